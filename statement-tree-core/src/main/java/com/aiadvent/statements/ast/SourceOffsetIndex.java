package com.aiadvent.statements.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Translates the UTF-8 byte offsets reported by Tree-sitter into {@link String} indices and
 * resolves rows and columns for those indices.
 */
public final class SourceOffsetIndex {

  private final int[] lineStarts;
  private final int[] byteOffsets;
  private final int length;

  private SourceOffsetIndex(int[] lineStarts, int[] byteOffsets, int length) {
    this.lineStarts = lineStarts;
    this.byteOffsets = byteOffsets;
    this.length = length;
  }

  public static SourceOffsetIndex of(String text) {
    List<Integer> starts = new ArrayList<>();
    starts.add(0);
    boolean ascii = true;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '\n') {
        starts.add(i + 1);
      }
      if (c >= 0x80) {
        ascii = false;
      }
    }
    int[] lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    return new SourceOffsetIndex(lineStarts, ascii ? null : utf8Offsets(text), text.length());
  }

  /** Byte offset of every char index, plus one trailing entry for the end of text. */
  private static int[] utf8Offsets(String text) {
    int[] offsets = new int[text.length() + 1];
    int bytes = 0;
    for (int i = 0; i < text.length(); i++) {
      offsets[i] = bytes;
      char c = text.charAt(i);
      if (c < 0x80) {
        bytes += 1;
      } else if (c < 0x800) {
        bytes += 2;
      } else if (Character.isHighSurrogate(c)
          && i + 1 < text.length()
          && Character.isLowSurrogate(text.charAt(i + 1))) {
        // four bytes for the pair, split evenly so the table stays strictly increasing
        bytes += 2;
        offsets[++i] = bytes;
        bytes += 2;
      } else {
        bytes += 3;
      }
    }
    offsets[text.length()] = bytes;
    return offsets;
  }

  public int charOffset(int byteOffset) {
    if (byteOffsets == null) {
      return Math.min(Math.max(0, byteOffset), length);
    }
    int position = Arrays.binarySearch(byteOffsets, byteOffset);
    if (position >= 0) {
      return position;
    }
    // inside a multi-byte sequence: snap to the char that owns it
    return Math.max(0, -position - 2);
  }

  public int row(int offset) {
    int position = Arrays.binarySearch(lineStarts, Math.min(Math.max(0, offset), length));
    return position >= 0 ? position : -position - 2;
  }

  public int column(int offset) {
    int clamped = Math.min(Math.max(0, offset), length);
    return clamped - lineStarts[row(clamped)];
  }

  public int length() {
    return length;
  }
}
