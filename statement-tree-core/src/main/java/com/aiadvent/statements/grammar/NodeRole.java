package com.aiadvent.statements.grammar;

/**
 * How the statement builder treats a CST node kind.
 */
public enum NodeRole {
  /** Atomic statement, never descended. */
  STATEMENT,
  /** Statement owning a body; may collapse to a simple statement. */
  COMPOUND,
  /** Label, export or decorator host that takes its shape from the statement it wraps. */
  WRAPPER,
  /** Brace or indentation block: flattened as a body, compound in statement position. */
  BLOCK,
  /** Part of a compound statement (else, catch, switch body) flattened into its owner. */
  CLAUSE,
  /** Decorator that is not nested in its declaration; fused into the next statement. */
  ATTACHMENT,
  /** Comments and other trivia. */
  SKIP,
  /** Not a statement; the builder looks through it. */
  TRANSPARENT;

  public boolean isStatement() {
    return this == STATEMENT || this == COMPOUND || this == WRAPPER || this == BLOCK;
  }
}
