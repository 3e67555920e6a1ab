package com.aiadvent.statements.tree;

import com.aiadvent.statements.ast.CstNode;
import com.aiadvent.statements.grammar.LanguageGrammar;
import com.aiadvent.statements.grammar.NodeRole;
import com.aiadvent.statements.grammar.NodeRule;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a CST node is a statement, whether it is compound, and which nodes hold its
 * nested statements.
 */
final class CompoundClassifier {

  record Classification(boolean statement, boolean compound, List<CstNode> bodies) {

    static final Classification NOT_STATEMENT = new Classification(false, false, List.of());
    static final Classification SIMPLE = new Classification(true, false, List.of());

    static Classification compound(List<CstNode> bodies) {
      return new Classification(true, true, bodies);
    }
  }

  private final LanguageGrammar grammar;

  CompoundClassifier(LanguageGrammar grammar) {
    this.grammar = Objects.requireNonNull(grammar, "grammar");
  }

  Classification classify(CstNode node) {
    NodeRule rule = grammar.rule(node);
    switch (rule.role()) {
      case STATEMENT:
        return Classification.SIMPLE;
      case BLOCK:
        return Classification.compound(List.of(node));
      case CLAUSE:
        return Classification.compound(rule.bodySelector().select(node));
      case COMPOUND:
        return classifyCompound(node, rule);
      case WRAPPER:
        return wrappedStatement(node)
            .map(this::classify)
            .map(target -> target.compound() ? target : Classification.SIMPLE)
            .orElse(Classification.SIMPLE);
      default:
        return Classification.NOT_STATEMENT;
    }
  }

  /** First named child of a wrapper (label, export, decorators) that is itself a statement. */
  Optional<CstNode> wrappedStatement(CstNode wrapper) {
    for (CstNode child : wrapper.namedChildren()) {
      if (grammar.rule(child).role().isStatement()) {
        return Optional.of(child);
      }
    }
    return Optional.empty();
  }

  private Classification classifyCompound(CstNode node, NodeRule rule) {
    List<CstNode> bodies = rule.bodySelector().select(node);
    if (bodies.isEmpty() && !rule.alwaysCompound()) {
      return Classification.SIMPLE;
    }
    if (rule.collapsible() && !hasBlockBody(node, rule)) {
      return Classification.SIMPLE;
    }
    return Classification.compound(bodies);
  }

  /**
   * Whether any branch of {@code owner} is a block, following else-if chains, clauses and wrapped
   * statements. A control statement without one is a single inlined statement and collapses.
   */
  private boolean hasBlockBody(CstNode owner, NodeRule ownerRule) {
    Deque<CstNode> owners = new ArrayDeque<>();
    Deque<CstNode> candidates = new ArrayDeque<>();
    owners.push(owner);
    while (!owners.isEmpty() || !candidates.isEmpty()) {
      if (!candidates.isEmpty()) {
        CstNode candidate = candidates.pop();
        NodeRule rule = grammar.rule(candidate);
        switch (rule.role()) {
          case BLOCK:
          case CLAUSE:
            return true;
          case COMPOUND:
            if (!rule.bodySelector().select(candidate).isEmpty() || rule.alwaysCompound()) {
              if (!rule.collapsible()) {
                return true;
              }
              owners.push(candidate);
            }
            break;
          case WRAPPER:
            wrappedStatement(candidate).ifPresent(candidates::push);
            break;
          default:
            break;
        }
        continue;
      }
      CstNode current = owners.pop();
      NodeRule currentRule = current == owner ? ownerRule : grammar.rule(current);
      for (CstNode body : currentRule.bodySelector().select(current)) {
        if (body.isMissing() || body.width() == 0) {
          continue;
        }
        NodeRole role = grammar.rule(body).role();
        if (role == NodeRole.BLOCK && !isInline(body, current)) {
          return true;
        }
        if (role == NodeRole.CLAUSE) {
          owners.push(body);
        } else if (role == NodeRole.COMPOUND || role == NodeRole.WRAPPER) {
          candidates.push(body);
        }
      }
    }
    return false;
  }

  private boolean isInline(CstNode block, CstNode header) {
    return grammar.inlineBlocksOnHeaderRow() && block.startRow() == header.startRow();
  }
}
