package com.aiadvent.statements.tree;

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * A statement of a {@link StatementTree}. Parent, children and siblings are arena indices
 * resolved through the owning tree, so nodes hold no references to each other.
 */
public final class StatementNode {

  private static final int MAX_DESCRIPTION_TEXT = 33;
  private static final int DESCRIPTION_EDGE = 15;

  private final StatementTree tree;
  private final int index;
  private final String kind;
  private final TextRange range;
  private final boolean compound;
  private final int parentIndex;
  private final int[] childIndexes;
  private final int nextSiblingIndex;

  StatementNode(
      StatementTree tree,
      int index,
      String kind,
      TextRange range,
      boolean compound,
      int parentIndex,
      int[] childIndexes,
      int nextSiblingIndex) {
    this.tree = tree;
    this.index = index;
    this.kind = kind;
    this.range = range;
    this.compound = compound;
    this.parentIndex = parentIndex;
    this.childIndexes = childIndexes;
    this.nextSiblingIndex = nextSiblingIndex;
  }

  /** The CST node type this statement was built from. */
  public String kind() {
    return kind;
  }

  public TextRange range() {
    return range;
  }

  public int startOffset() {
    return range.start();
  }

  public int endOffset() {
    return range.end();
  }

  /**
   * True when the statement introduces a nested body. A compound statement may still have no
   * children, e.g. an empty block or a body lying outside the query range.
   */
  public boolean isCompoundStatementType() {
    return compound;
  }

  public Optional<StatementNode> parent() {
    return parentIndex < 0 ? Optional.empty() : Optional.of(tree.node(parentIndex));
  }

  public List<StatementNode> children() {
    if (childIndexes.length == 0) {
      return List.of();
    }
    List<StatementNode> children = new ArrayList<>(childIndexes.length);
    for (int childIndex : childIndexes) {
      children.add(tree.node(childIndex));
    }
    return Collections.unmodifiableList(children);
  }

  public Optional<StatementNode> nextSibling() {
    return nextSiblingIndex < 0 ? Optional.empty() : Optional.of(tree.node(nextSiblingIndex));
  }

  public int depth() {
    int depth = 0;
    Optional<StatementNode> current = parent();
    while (current.isPresent()) {
      depth++;
      current = current.get().parent();
    }
    return depth;
  }

  public String text() {
    return tree.sourceText().substring(range.start(), range.end());
  }

  public SourcePosition startPosition() {
    return tree.position(range.start());
  }

  public SourcePosition endPosition() {
    return tree.position(range.end());
  }

  public boolean contains(StatementNode other) {
    return range.contains(other.range);
  }

  /** Innermost statement at or below this one whose range contains {@code offset}. */
  public Optional<StatementNode> statementAt(int offset) {
    if (!range.contains(offset)) {
      return Optional.empty();
    }
    StatementNode current = this;
    boolean descended = true;
    while (descended) {
      descended = false;
      for (int childIndex : current.childIndexes) {
        StatementNode child = tree.node(childIndex);
        if (child.range.contains(offset)) {
          current = child;
          descended = true;
          break;
        }
      }
    }
    return Optional.of(current);
  }

  /** One-line rendering: {@code kind ([row,col]..[row,col]): "text"}. */
  public String description() {
    String text = text();
    if (text.length() > MAX_DESCRIPTION_TEXT) {
      text =
          text.substring(0, DESCRIPTION_EDGE)
              + "..."
              + text.substring(text.length() - DESCRIPTION_EDGE);
    }
    return kind
        + " ("
        + startPosition()
        + ".."
        + endPosition()
        + "): \""
        + new String(JsonStringEncoder.getInstance().quoteAsString(text))
        + "\"";
  }

  public String dump() {
    return dump("", "");
  }

  /**
   * Renders this statement and its descendants. {@code firstPrefix} starts this node's line,
   * {@code childPrefix} starts every line below it.
   */
  public String dump(String firstPrefix, String childPrefix) {
    StringBuilder result = new StringBuilder();
    Deque<DumpLine> lines = new ArrayDeque<>();
    lines.push(new DumpLine(this, firstPrefix, childPrefix));
    while (!lines.isEmpty()) {
      DumpLine line = lines.pop();
      if (result.length() > 0) {
        result.append('\n');
      }
      result.append(line.firstPrefix()).append(line.node().description());
      int[] children = line.node().childIndexes;
      for (int i = children.length - 1; i >= 0; i--) {
        boolean last = i == children.length - 1;
        lines.push(
            new DumpLine(
                tree.node(children[i]),
                line.childPrefix() + "+- ",
                line.childPrefix() + (last ? "   " : "|  ")));
      }
    }
    return result.toString();
  }

  /** Renders the chain of statements from the top-level ancestor down to this one. */
  public String dumpPath() {
    Deque<StatementNode> path = new ArrayDeque<>();
    for (StatementNode current = this; current != null; current = current.parent().orElse(null)) {
      path.push(current);
    }
    StringBuilder result = new StringBuilder(path.pop().description());
    for (int level = 0; !path.isEmpty(); level++) {
      result
          .append('\n')
          .append(" ".repeat(3 * level))
          .append("+- ")
          .append(path.pop().description());
    }
    return result.toString();
  }

  private record DumpLine(StatementNode node, String firstPrefix, String childPrefix) {}

  int index() {
    return index;
  }

  @Override
  public String toString() {
    return description();
  }
}
