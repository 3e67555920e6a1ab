package com.aiadvent.statements.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Fixture notation for expected statements. {@code ⟦} and {@code ⟧} bracket each expected
 * statement, nested brackets are its children, and an optional {@code ‸} marks a point query.
 * Without a cursor the whole document is queried.
 */
final class StatementMarkup {

  static final char OPEN = '⟦';
  static final char CLOSE = '⟧';
  static final char CURSOR = '‸';

  record Parsed(String text, List<String> expected, int cursor) {

    int queryStart() {
      return cursor >= 0 ? cursor : 0;
    }

    int queryEnd() {
      return cursor >= 0 ? cursor : text.length();
    }
  }

  private StatementMarkup() {}

  static Parsed parse(String markup) {
    StringBuilder text = new StringBuilder();
    List<int[]> spans = new ArrayList<>();
    Deque<int[]> open = new ArrayDeque<>();
    int cursor = -1;
    for (int i = 0; i < markup.length(); i++) {
      char c = markup.charAt(i);
      if (c == OPEN) {
        int[] span = {text.length(), -1, open.size()};
        spans.add(span);
        open.push(span);
      } else if (c == CLOSE) {
        if (open.isEmpty()) {
          throw new IllegalArgumentException("Unbalanced " + CLOSE + " at " + i);
        }
        open.pop()[1] = text.length();
      } else if (c == CURSOR) {
        cursor = text.length();
      } else {
        text.append(c);
      }
    }
    if (!open.isEmpty()) {
      throw new IllegalArgumentException("Unclosed " + OPEN);
    }
    String source = text.toString();
    List<String> expected = new ArrayList<>();
    for (int[] span : spans) {
      expected.add(line(span[2], source.substring(span[0], span[1])));
    }
    return new Parsed(source, expected, cursor);
  }

  /** Renders a built tree in the same form as {@link Parsed#expected()}. */
  static List<String> outline(StatementTree tree) {
    List<String> lines = new ArrayList<>();
    for (StatementNode statement : tree.statements()) {
      outline(statement, 0, lines);
    }
    return lines;
  }

  private static void outline(StatementNode node, int depth, List<String> lines) {
    lines.add(line(depth, node.text()));
    for (StatementNode child : node.children()) {
      outline(child, depth + 1, lines);
    }
  }

  private static String line(int depth, String text) {
    return "  ".repeat(depth) + text;
  }
}
