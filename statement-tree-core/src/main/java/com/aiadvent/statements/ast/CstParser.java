package com.aiadvent.statements.ast;

/**
 * Parses source text into a concrete syntax tree.
 */
public interface CstParser {

  /**
   * @throws CstParseException when the grammar is unavailable or the parser produces no tree
   */
  CstTree parse(String languageId, String text);
}
