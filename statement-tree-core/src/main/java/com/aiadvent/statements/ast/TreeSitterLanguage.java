package com.aiadvent.statements.ast;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.treesitter.TSLanguage;
import org.treesitter.TreeSitterC;
import org.treesitter.TreeSitterCSharp;
import org.treesitter.TreeSitterCpp;
import org.treesitter.TreeSitterGo;
import org.treesitter.TreeSitterJava;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterPhp;
import org.treesitter.TreeSitterPython;
import org.treesitter.TreeSitterRuby;
import org.treesitter.TreeSitterTypescript;

/**
 * Maps editor language ids to the Tree-sitter grammar that parses them.
 */
public enum TreeSitterLanguage {
  JAVASCRIPT(Set.of("javascript", "javascriptreact", "jsx"), TreeSitterJavascript::new),
  TYPESCRIPT(Set.of("typescript", "typescriptreact"), TreeSitterTypescript::new),
  PYTHON(Set.of("python"), TreeSitterPython::new),
  GO(Set.of("go"), TreeSitterGo::new),
  PHP(Set.of("php"), TreeSitterPhp::new),
  RUBY(Set.of("ruby"), TreeSitterRuby::new),
  JAVA(Set.of("java"), TreeSitterJava::new),
  CSHARP(Set.of("csharp"), TreeSitterCSharp::new),
  C(Set.of("c"), TreeSitterC::new),
  CPP(Set.of("cpp"), TreeSitterCpp::new);

  private static final Map<String, TreeSitterLanguage> INDEX =
      Stream.of(values())
          .flatMap(language -> language.languageIds.stream().map(id -> Map.entry(id, language)))
          .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

  private final Set<String> languageIds;
  private final Supplier<TSLanguage> grammar;

  TreeSitterLanguage(Set<String> languageIds, Supplier<TSLanguage> grammar) {
    this.languageIds = languageIds;
    this.grammar = grammar;
  }

  public Set<String> languageIds() {
    return languageIds;
  }

  /** Instantiates the grammar, loading its native library on first use. */
  TSLanguage newGrammar() {
    return grammar.get();
  }

  public static Optional<TreeSitterLanguage> fromId(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(INDEX.get(normalize(value)));
  }

  public static String normalize(String languageId) {
    return languageId.trim().toLowerCase(Locale.ROOT);
  }
}
