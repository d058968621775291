package com.github.simbo1905.bhf;

import java.io.Serializable;
import java.util.Objects;

/// A single problem found while decoding, with the file position it was found at.
public record Diagnostic(DiagnosticKind kind, String message, long position)
    implements Serializable {

  public Diagnostic {
    Objects.requireNonNull(kind, "kind cannot be null");
    Objects.requireNonNull(message, "message cannot be null");
  }

  @Override
  public String toString() {
    return String.format("%s at offset %d: %s", kind, position, message);
  }
}
