package com.aiadvent.statements.grammar;

public class UnsupportedLanguageException extends IllegalArgumentException {

  private final String languageId;

  public UnsupportedLanguageException(String languageId) {
    super("Unsupported languageId: " + languageId);
    this.languageId = languageId;
  }

  public String getLanguageId() {
    return languageId;
  }
}
