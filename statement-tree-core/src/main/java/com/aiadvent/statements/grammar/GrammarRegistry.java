package com.aiadvent.statements.grammar;

import com.aiadvent.statements.ast.TreeSitterLanguage;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Process-wide, read-only registry of classification tables. Populated once during class
 * initialization and safe for concurrent reads.
 */
public final class GrammarRegistry {

  private static final Map<TreeSitterLanguage, LanguageGrammar> GRAMMARS = createGrammars();

  private GrammarRegistry() {}

  private static Map<TreeSitterLanguage, LanguageGrammar> createGrammars() {
    Map<TreeSitterLanguage, LanguageGrammar> grammars = new EnumMap<>(TreeSitterLanguage.class);
    grammars.put(TreeSitterLanguage.JAVASCRIPT, JavaScriptGrammars.javascript());
    grammars.put(TreeSitterLanguage.TYPESCRIPT, JavaScriptGrammars.typescript());
    grammars.put(TreeSitterLanguage.PYTHON, PythonGrammar.create());
    grammars.put(TreeSitterLanguage.GO, GoGrammar.create());
    grammars.put(TreeSitterLanguage.PHP, PhpGrammar.create());
    grammars.put(TreeSitterLanguage.RUBY, RubyGrammar.create());
    grammars.put(TreeSitterLanguage.JAVA, JavaGrammar.create());
    grammars.put(TreeSitterLanguage.CSHARP, CSharpGrammar.create());
    grammars.put(TreeSitterLanguage.C, CFamilyGrammars.c());
    grammars.put(TreeSitterLanguage.CPP, CFamilyGrammars.cpp());
    return Map.copyOf(grammars);
  }

  public static boolean isSupported(String languageId) {
    return grammar(languageId).isPresent();
  }

  public static Optional<LanguageGrammar> grammar(String languageId) {
    return TreeSitterLanguage.fromId(languageId).map(GRAMMARS::get);
  }

  public static LanguageGrammar require(String languageId) {
    return grammar(languageId).orElseThrow(() -> new UnsupportedLanguageException(languageId));
  }

  public static NodeRule classify(String languageId, String nodeKind) {
    return require(languageId).rule(nodeKind);
  }

  public static Set<String> supportedLanguageIds() {
    Set<String> ids = new TreeSet<>();
    for (TreeSitterLanguage language : GRAMMARS.keySet()) {
      ids.addAll(language.languageIds());
    }
    return ids;
  }
}
