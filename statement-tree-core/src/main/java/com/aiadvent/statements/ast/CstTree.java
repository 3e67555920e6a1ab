package com.aiadvent.statements.ast;

/** Handle on a parsed document. Closing it releases the underlying parse tree. */
public interface CstTree extends AutoCloseable {

  CstNode root();

  String sourceText();

  @Override
  void close();
}
