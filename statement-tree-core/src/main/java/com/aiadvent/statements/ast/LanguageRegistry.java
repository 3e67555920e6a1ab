package com.aiadvent.statements.ast;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;

/**
 * Caches one Tree-sitter grammar handle per language. A grammar whose native library cannot be
 * loaded is reported as absent and retried on the next lookup.
 */
public class LanguageRegistry {

  private static final Logger log = LoggerFactory.getLogger(LanguageRegistry.class);

  private final Map<TreeSitterLanguage, TSLanguage> byLanguage = new ConcurrentHashMap<>();

  public Optional<TSLanguage> language(String languageId) {
    return TreeSitterLanguage.fromId(languageId).flatMap(this::language);
  }

  public Optional<TSLanguage> language(TreeSitterLanguage language) {
    TSLanguage existing = byLanguage.get(language);
    if (existing != null) {
      return Optional.of(existing);
    }
    try {
      TSLanguage loaded = language.newGrammar();
      TSLanguage previous = byLanguage.putIfAbsent(language, loaded);
      return Optional.of(previous != null ? previous : loaded);
    } catch (RuntimeException | LinkageError ex) {
      log.warn("Tree-sitter grammar {} could not be loaded: {}", language, ex.toString());
      return Optional.empty();
    }
  }
}
