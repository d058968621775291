package com.github.simbo1905.bhf;

import java.io.IOException;
import lombok.Getter;

/// Thrown when a help file cannot be decoded at all: a required record is missing or out of
/// order, or a structural read ran past the end of the file.
public class BhfFormatException extends IOException {

  private static final long serialVersionUID = 1L;

  @Getter private final Diagnostic diagnostic;

  public BhfFormatException(Diagnostic diagnostic) {
    super(diagnostic.toString());
    this.diagnostic = diagnostic;
  }

  public DiagnosticKind getKind() {
    return diagnostic.kind();
  }
}
