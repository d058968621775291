package com.github.simbo1905.bhf;

import java.util.logging.Level;

/// Classification of the problems found while decoding a help file.
/// The level is the one used when the problem is recorded rather than thrown.
public enum DiagnosticKind {
  /// Fewer bytes were available than a fixed-size read required.
  SHORT_READ(Level.WARNING),
  /// A positionally required record carried the wrong type tag.
  UNEXPECTED_RECORD_TYPE(Level.SEVERE),
  /// The byte following the stamp was not 0x1A.
  INVALID_SENTINEL(Level.WARNING),
  /// A text was requested at an offset that does not hold a Text record.
  NOT_A_TEXT_RECORD(Level.FINE),
  /// A raw or repeat escape was cut off by the end of a text payload.
  TRUNCATED_ESCAPE(Level.WARNING),
  /// A keyword span had no context id left in the adjacent Keyword record.
  MISSING_KEYWORD_TARGET(Level.FINE),
  /// A context id outside the context table was requested.
  CONTEXT_OUT_OF_RANGE(Level.FINE);

  final Level level;

  DiagnosticKind(Level level) {
    this.level = level;
  }
}
