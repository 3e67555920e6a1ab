package com.aiadvent.statements.tree;

import com.aiadvent.statements.ast.CstNode;
import com.aiadvent.statements.grammar.LanguageGrammar;
import com.aiadvent.statements.grammar.NodeRole;
import com.aiadvent.statements.grammar.NodeRule;
import com.aiadvent.statements.tree.CompoundClassifier.Classification;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Depth-first walk over a CST that emits the statements intersecting a query range. Subtrees
 * outside the range are never visited; emitted statements keep their full syntactic span.
 */
final class StatementTreeBuilder {

  static final String ERROR_KIND = "ERROR";
  private static final String FUNCTION_DEFINITION = "function_definition";
  private static final String DECLARATION = "declaration";

  private final LanguageGrammar grammar;
  private final CompoundClassifier classifier;
  private final TextRange queryRange;
  private final StatementArena arena = new StatementArena();
  private final Deque<Runnable> pending = new ArrayDeque<>();

  StatementTreeBuilder(LanguageGrammar grammar, TextRange queryRange) {
    this.grammar = Objects.requireNonNull(grammar, "grammar");
    this.classifier = new CompoundClassifier(grammar);
    this.queryRange = Objects.requireNonNull(queryRange, "queryRange");
  }

  StatementArena build(CstNode root) {
    schedule(() -> visit(root, StatementArena.NO_PARENT, -1));
    drain();
    return arena;
  }

  /**
   * Runs pending steps until none are left. Nesting depth of the source, e.g. a long else-if
   * chain, costs heap on {@link #pending} rather than Java stack.
   */
  private void drain() {
    while (!pending.isEmpty()) {
      pending.pop().run();
    }
  }

  private void schedule(Runnable step) {
    pending.push(step);
  }

  /** Schedules {@code steps} so they run in list order, before anything scheduled earlier. */
  private void scheduleInOrder(List<Runnable> steps) {
    for (int i = steps.size() - 1; i >= 0; i--) {
      pending.push(steps.get(i));
    }
  }

  /**
   * Visits nodes found in statement position. Detached decorators are remembered and fused into
   * the statement that follows them; clauses met here are flattened into {@code parent}.
   */
  private void visitSequence(List<CstNode> nodes, int parent) {
    List<Runnable> steps = new ArrayList<>(nodes.size());
    int pendingStart = -1;
    for (CstNode node : nodes) {
      NodeRole role = grammar.rule(node).role();
      if (role == NodeRole.ATTACHMENT) {
        if (pendingStart < 0) {
          pendingStart = node.startOffset();
        }
        continue;
      }
      if (role == NodeRole.SKIP) {
        continue;
      }
      if (role == NodeRole.CLAUSE) {
        steps.add(() -> visitBody(node, parent));
      } else {
        int fusedStart = pendingStart;
        steps.add(() -> visit(node, parent, fusedStart));
      }
      pendingStart = -1;
    }
    scheduleInOrder(steps);
  }

  private void visit(CstNode node, int parent, int fusedStart) {
    if (node.isMissing() || node.width() == 0) {
      return;
    }
    int start = fusedStart >= 0 ? Math.min(fusedStart, node.startOffset()) : node.startOffset();
    int end = node.endOffset();
    if (!queryRange.intersects(start, end)) {
      return;
    }
    NodeRole role = grammar.rule(node).role();
    if (role == NodeRole.SKIP || role == NodeRole.ATTACHMENT) {
      return;
    }
    if (grammar.splitsOldStyleFunctions() && isOldStyleFunction(node)) {
      splitOldStyleFunction(node, parent);
      return;
    }
    Classification classification = classifier.classify(node);
    if (!classification.statement()) {
      visitTransparent(node, parent);
      return;
    }
    if (parent != StatementArena.NO_PARENT && arena.hasSpan(parent, start, end)) {
      // same extent as the enclosing statement: it adds no level of its own
      if (classification.compound()) {
        visitBodies(classification.bodies(), parent);
      }
      return;
    }
    int index = arena.add(node.kind(), start, end, classification.compound(), parent);
    if (classification.compound()) {
      visitBodies(classification.bodies(), index);
    }
  }

  /** An ERROR node that yields no statements of its own becomes one, once its children ran. */
  private void visitTransparent(CstNode node, int parent) {
    int before = arena.size();
    if (node.isError()) {
      schedule(
          () -> {
            if (arena.size() == before
                && (parent == StatementArena.NO_PARENT
                    || !arena.hasSpan(parent, node.startOffset(), node.endOffset()))) {
              arena.add(ERROR_KIND, node.startOffset(), node.endOffset(), false, parent);
            }
          });
    }
    visitSequence(node.namedChildren(), parent);
  }

  private void visitBodies(List<CstNode> bodies, int parent) {
    List<Runnable> steps = new ArrayList<>(bodies.size());
    for (CstNode body : bodies) {
      steps.add(() -> visitBody(body, parent));
    }
    scheduleInOrder(steps);
  }

  /** Blocks and clauses used as bodies are flattened: their statements belong to {@code parent}. */
  private void visitBody(CstNode body, int parent) {
    NodeRule rule = grammar.rule(body);
    if (rule.role() == NodeRole.BLOCK || rule.role() == NodeRole.CLAUSE) {
      if (body.width() > 0 && queryRange.intersects(body.startOffset(), body.endOffset())) {
        if (rule.role() == NodeRole.BLOCK) {
          visitSequence(rule.bodySelector().select(body), parent);
        } else {
          visitBodies(rule.bodySelector().select(body), parent);
        }
      }
      return;
    }
    visit(body, parent, -1);
  }

  private boolean isOldStyleFunction(CstNode node) {
    if (!FUNCTION_DEFINITION.equals(node.kind())) {
      return false;
    }
    for (CstNode child : node.namedChildren()) {
      if (DECLARATION.equals(child.kind())) {
        return true;
      }
    }
    return false;
  }

  /**
   * K&R definitions put parameter declarations between the declarator and the body. The header,
   * each declaration and the body become sibling statements.
   */
  private void splitOldStyleFunction(CstNode node, int parent) {
    Optional<CstNode> declarator = node.childByField("declarator");
    int headerEnd = declarator.map(CstNode::endOffset).orElse(node.startOffset());
    if (headerEnd > node.startOffset() && queryRange.intersects(node.startOffset(), headerEnd)) {
      arena.add(node.kind(), node.startOffset(), headerEnd, false, parent);
    }
    List<Runnable> steps = new ArrayList<>();
    for (CstNode child : node.namedChildren()) {
      if (DECLARATION.equals(child.kind())) {
        steps.add(() -> visit(child, parent, -1));
      }
    }
    node.childByField("body").ifPresent(body -> steps.add(() -> visit(body, parent, -1)));
    scheduleInOrder(steps);
  }
}
