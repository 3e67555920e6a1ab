package com.aiadvent.statements.grammar;

import com.aiadvent.statements.ast.CstNode;
import com.aiadvent.statements.ast.TreeSitterLanguage;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Classification table for one Tree-sitter grammar. Instances are immutable and shared by every
 * tree built for the language.
 */
public final class LanguageGrammar {

  private final TreeSitterLanguage language;
  private final Map<String, NodeRule> rules;
  private final Set<String> statementContainers;
  private final boolean inlineBlocksOnHeaderRow;
  private final boolean splitsOldStyleFunctions;

  private LanguageGrammar(Builder builder) {
    this.language = builder.language;
    this.rules = Map.copyOf(builder.rules);
    this.statementContainers = Set.copyOf(builder.statementContainers);
    this.inlineBlocksOnHeaderRow = builder.inlineBlocksOnHeaderRow;
    this.splitsOldStyleFunctions = builder.splitsOldStyleFunctions;
  }

  public static Builder builder(TreeSitterLanguage language) {
    return new Builder(language);
  }

  public TreeSitterLanguage language() {
    return language;
  }

  /** Rule for a kind, falling back to {@link NodeRole#TRANSPARENT} for anything unlisted. */
  public NodeRule rule(String kind) {
    NodeRule rule = rules.get(kind);
    return rule != null ? rule : NodeRule.transparent(kind);
  }

  /**
   * Rule for a concrete node. In languages where any expression can stand as a statement, named
   * children of statement-list containers are statements even when their kind is unlisted.
   */
  public NodeRule rule(CstNode node) {
    NodeRule rule = rule(node.kind());
    if (rule.role() == NodeRole.TRANSPARENT
        && !statementContainers.isEmpty()
        && node.isNamed()
        && !node.isError()
        && node.parent().map(CstNode::kind).filter(statementContainers::contains).isPresent()) {
      return NodeRule.of(node.kind(), NodeRole.STATEMENT);
    }
    return rule;
  }

  /** Blocks starting on their header's row count as inline bodies (Python suites). */
  public boolean inlineBlocksOnHeaderRow() {
    return inlineBlocksOnHeaderRow;
  }

  /** K&R definitions are split into header, parameter declarations and body. */
  public boolean splitsOldStyleFunctions() {
    return splitsOldStyleFunctions;
  }

  public static final class Builder {

    private final TreeSitterLanguage language;
    private final Map<String, NodeRule> rules = new HashMap<>();
    private final Set<String> statementContainers = new HashSet<>();
    private boolean inlineBlocksOnHeaderRow;
    private boolean splitsOldStyleFunctions;

    private Builder(TreeSitterLanguage language) {
      this.language = Objects.requireNonNull(language, "language");
    }

    /** Copies every rule of {@code base}; later calls override them. */
    public Builder extend(LanguageGrammar base) {
      rules.putAll(base.rules);
      statementContainers.addAll(base.statementContainers);
      inlineBlocksOnHeaderRow = base.inlineBlocksOnHeaderRow;
      splitsOldStyleFunctions = base.splitsOldStyleFunctions;
      return this;
    }

    public Builder statements(String... kinds) {
      for (String kind : kinds) {
        put(NodeRule.of(kind, NodeRole.STATEMENT));
      }
      return this;
    }

    public Builder compound(String kind, BodySelector body) {
      return put(new NodeRule(kind, NodeRole.COMPOUND, body, false, false));
    }

    public Builder collapsible(String kind, BodySelector body) {
      return put(new NodeRule(kind, NodeRole.COMPOUND, body, true, false));
    }

    public Builder alwaysCompound(String kind, BodySelector body) {
      return put(new NodeRule(kind, NodeRole.COMPOUND, body, false, true));
    }

    public Builder wrappers(String... kinds) {
      for (String kind : kinds) {
        put(NodeRule.of(kind, NodeRole.WRAPPER));
      }
      return this;
    }

    public Builder blocks(String... kinds) {
      for (String kind : kinds) {
        put(new NodeRule(kind, NodeRole.BLOCK, BodySelector.namedChildren(), false, true));
      }
      return this;
    }

    public Builder block(String kind, BodySelector body) {
      return put(new NodeRule(kind, NodeRole.BLOCK, body, false, true));
    }

    public Builder clause(String kind, BodySelector body) {
      return put(new NodeRule(kind, NodeRole.CLAUSE, body, false, true));
    }

    public Builder attachments(String... kinds) {
      for (String kind : kinds) {
        put(NodeRule.of(kind, NodeRole.ATTACHMENT));
      }
      return this;
    }

    public Builder skip(String... kinds) {
      for (String kind : kinds) {
        put(NodeRule.of(kind, NodeRole.SKIP));
      }
      return this;
    }

    public Builder transparent(String... kinds) {
      for (String kind : kinds) {
        put(NodeRule.transparent(kind));
      }
      return this;
    }

    public Builder statementContainers(String... kinds) {
      statementContainers.addAll(Set.of(kinds));
      return this;
    }

    public Builder inlineBlocksOnHeaderRow() {
      this.inlineBlocksOnHeaderRow = true;
      return this;
    }

    public Builder splitOldStyleFunctions() {
      this.splitsOldStyleFunctions = true;
      return this;
    }

    private Builder put(NodeRule rule) {
      rules.put(rule.kind(), rule);
      return this;
    }

    public LanguageGrammar build() {
      return new LanguageGrammar(this);
    }
  }
}
