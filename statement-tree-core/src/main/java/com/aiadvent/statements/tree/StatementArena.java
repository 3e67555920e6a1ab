package com.aiadvent.statements.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only storage for statements while a tree is being built. Every insertion is checked
 * against the tree invariants so a faulty walk fails instead of producing an inconsistent tree.
 */
final class StatementArena {

  static final int NO_PARENT = -1;
  static final int NO_SIBLING = -1;

  private final List<Slot> slots = new ArrayList<>();
  private final List<Integer> roots = new ArrayList<>();

  int add(String kind, int start, int end, boolean compound, int parent) {
    if (end <= start) {
      throw new IllegalStateException(
          "Statement " + kind + " has empty span [" + start + ", " + end + ")");
    }
    List<Integer> siblings;
    if (parent == NO_PARENT) {
      siblings = roots;
    } else {
      Slot owner = slots.get(parent);
      if (!owner.compound) {
        throw new IllegalStateException("Simple statement " + owner.describe() + " cannot own " + kind);
      }
      boolean inside = owner.start <= start && end <= owner.end;
      if (!inside || (owner.start == start && owner.end == end)) {
        throw new IllegalStateException(
            kind + " [" + start + ", " + end + ") is not strictly inside " + owner.describe());
      }
      siblings = owner.children;
    }
    Slot previous = siblings.isEmpty() ? null : slots.get(siblings.get(siblings.size() - 1));
    if (previous != null && start < previous.end) {
      throw new IllegalStateException(
          kind + " [" + start + ", " + end + ") overlaps preceding " + previous.describe());
    }
    int index = slots.size();
    slots.add(new Slot(kind, start, end, compound, parent));
    siblings.add(index);
    if (previous != null) {
      previous.nextSibling = index;
    }
    return index;
  }

  boolean hasSpan(int index, int start, int end) {
    Slot slot = slots.get(index);
    return slot.start == start && slot.end == end;
  }

  int size() {
    return slots.size();
  }

  Slot slot(int index) {
    return slots.get(index);
  }

  List<Integer> roots() {
    return roots;
  }

  static final class Slot {
    final String kind;
    final int start;
    final int end;
    final boolean compound;
    final int parent;
    final List<Integer> children = new ArrayList<>();
    int nextSibling = NO_SIBLING;

    Slot(String kind, int start, int end, boolean compound, int parent) {
      this.kind = kind;
      this.start = start;
      this.end = end;
      this.compound = compound;
      this.parent = parent;
    }

    String describe() {
      return kind + " [" + start + ", " + end + ")";
    }
  }
}
