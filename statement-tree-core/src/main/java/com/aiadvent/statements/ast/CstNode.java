package com.aiadvent.statements.ast;

import java.util.List;
import java.util.Optional;

/**
 * Language-neutral view of a concrete syntax tree node. Offsets are UTF-16 code unit indices
 * into the parsed source, rows and columns are zero based.
 */
public interface CstNode {

  String kind();

  int startOffset();

  int endOffset();

  int startRow();

  int startColumn();

  int endRow();

  int endColumn();

  boolean isNamed();

  boolean isMissing();

  default boolean isError() {
    return "ERROR".equals(kind());
  }

  /** Name of the field under which the parent holds this node, if any. */
  Optional<String> fieldName();

  List<CstNode> children();

  List<CstNode> namedChildren();

  Optional<CstNode> parent();

  default Optional<CstNode> childByField(String field) {
    for (CstNode child : children()) {
      if (child.fieldName().filter(field::equals).isPresent()) {
        return Optional.of(child);
      }
    }
    return Optional.empty();
  }

  default int width() {
    return endOffset() - startOffset();
  }
}
