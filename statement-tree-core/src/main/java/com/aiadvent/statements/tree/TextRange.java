package com.aiadvent.statements.tree;

/**
 * Half-open range {@code [start, end)} of UTF-16 code unit offsets.
 */
public record TextRange(int start, int end) {

  public TextRange {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid range [" + start + ", " + end + ")");
    }
  }

  public int length() {
    return end - start;
  }

  public boolean isEmpty() {
    return start == end;
  }

  public boolean contains(int offset) {
    return start <= offset && offset < end;
  }

  public boolean contains(TextRange other) {
    return start <= other.start && other.end <= end;
  }

  /**
   * Whether {@code [otherStart, otherEnd)} shares at least one offset with this range. An empty
   * range behaves as a point and intersects the spans containing it.
   */
  public boolean intersects(int otherStart, int otherEnd) {
    if (isEmpty()) {
      return otherStart <= start && start < otherEnd;
    }
    return otherStart < end && otherEnd > start;
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
