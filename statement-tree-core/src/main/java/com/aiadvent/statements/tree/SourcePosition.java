package com.aiadvent.statements.tree;

/** Zero-based row and column of an offset. */
public record SourcePosition(int row, int column) {

  @Override
  public String toString() {
    return "[" + row + "," + column + "]";
  }
}
