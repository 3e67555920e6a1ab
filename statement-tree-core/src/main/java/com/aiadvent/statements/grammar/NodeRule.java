package com.aiadvent.statements.grammar;

import java.util.Objects;

/**
 * Classification of one CST node kind within a language.
 *
 * @param collapsible control statement that is simple unless one of its branches is a block
 * @param alwaysCompound compound even when the body selector finds nothing, e.g. an empty case
 */
public record NodeRule(
    String kind, NodeRole role, BodySelector body, boolean collapsible, boolean alwaysCompound) {

  public NodeRule {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(role, "role");
    body = body != null ? body : BodySelector.NONE;
  }

  static NodeRule of(String kind, NodeRole role) {
    return new NodeRule(kind, role, BodySelector.NONE, false, false);
  }

  public static NodeRule transparent(String kind) {
    return of(kind, NodeRole.TRANSPARENT);
  }

  public boolean isStatement() {
    return role.isStatement();
  }

  /** Whether the kind can own nested statements. Collapsing and missing bodies may still apply. */
  public boolean isCompound() {
    return role == NodeRole.COMPOUND || role == NodeRole.BLOCK;
  }

  public BodySelector bodySelector() {
    return body;
  }
}
