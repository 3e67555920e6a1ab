package com.aiadvent.statements.ast;

public class CstParseException extends RuntimeException {

  private final String languageId;

  public CstParseException(String languageId, String message) {
    super(message);
    this.languageId = languageId;
  }

  public CstParseException(String languageId, String message, Throwable cause) {
    super(message, cause);
    this.languageId = languageId;
  }

  public String getLanguageId() {
    return languageId;
  }
}
