package com.aiadvent.statements.grammar;

import com.aiadvent.statements.ast.CstNode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks the CST nodes holding the nested statements of a compound node.
 */
@FunctionalInterface
public interface BodySelector {

  BodySelector NONE = node -> List.of();

  List<CstNode> select(CstNode node);

  /** Children stored under any of the given fields, in document order. */
  static BodySelector fields(String... names) {
    Set<String> wanted = Set.of(names);
    return node -> {
      List<CstNode> selected = new ArrayList<>();
      for (CstNode child : node.children()) {
        if (child.fieldName().filter(wanted::contains).isPresent()) {
          selected.add(child);
        }
      }
      return selected;
    };
  }

  static BodySelector kinds(String... kinds) {
    Set<String> wanted = Set.of(kinds);
    return node -> {
      List<CstNode> selected = new ArrayList<>();
      for (CstNode child : node.namedChildren()) {
        if (wanted.contains(child.kind())) {
          selected.add(child);
        }
      }
      return selected;
    };
  }

  static BodySelector namedChildren() {
    return CstNode::namedChildren;
  }

  /** Named children plus anonymous children spelled as one of {@code tokens}, in document order. */
  static BodySelector namedChildrenAndTokens(String... tokens) {
    Set<String> wanted = Set.of(tokens);
    return node -> {
      List<CstNode> selected = new ArrayList<>();
      for (CstNode child : node.children()) {
        if (child.isNamed() || wanted.contains(child.kind())) {
          selected.add(child);
        }
      }
      return selected;
    };
  }

  static BodySelector namedChildrenExceptFields(String... fields) {
    Set<String> excluded = Set.of(fields);
    return node -> {
      List<CstNode> selected = new ArrayList<>();
      for (CstNode child : node.namedChildren()) {
        if (child.fieldName().filter(excluded::contains).isEmpty()) {
          selected.add(child);
        }
      }
      return selected;
    };
  }

  /** The trailing named child, for grammars that leave a statement body unlabelled. */
  static BodySelector lastNamedChild() {
    return node -> {
      List<CstNode> named = node.namedChildren();
      return named.isEmpty() ? List.of() : List.of(named.get(named.size() - 1));
    };
  }

  /** Follows {@code field} and applies {@code then} to the node found there. */
  static BodySelector nested(String field, BodySelector then) {
    return node -> node.childByField(field).map(then::select).orElse(List.of());
  }

  /** Union of both selections, deduplicated and in document order. */
  default BodySelector and(BodySelector other) {
    return node -> {
      Set<CstNode> merged = new LinkedHashSet<>(select(node));
      merged.addAll(other.select(node));
      List<CstNode> ordered = new ArrayList<>(merged);
      ordered.sort(Comparator.comparingInt(CstNode::startOffset));
      return ordered;
    };
  }
}
