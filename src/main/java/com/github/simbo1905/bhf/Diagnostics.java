package com.github.simbo1905.bhf;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Collects the recoverable problems seen by one open help file so that callers can
/// retrieve them after the fact. Every recorded diagnostic is also logged.
///
/// Only the most recent [#MAX_RECORDED] are kept; older ones are dropped.
final class Diagnostics {

  private static final Logger logger = Logger.getLogger(Diagnostics.class.getName());

  static final int MAX_RECORDED = 1000;

  private final Deque<Diagnostic> recorded = new ArrayDeque<>();
  private long dropped;

  synchronized Diagnostic record(DiagnosticKind kind, long position, String message) {
    return record(new Diagnostic(kind, message, position));
  }

  synchronized Diagnostic record(Diagnostic diagnostic) {
    if (recorded.size() == MAX_RECORDED) {
      recorded.removeFirst();
      if (dropped++ == 0) {
        logger.log(Level.FINE, () -> String.format(
            "more than %d diagnostics, dropping the oldest", MAX_RECORDED));
      }
    }
    recorded.addLast(diagnostic);
    logger.log(diagnostic.kind().level, diagnostic::toString);
    return diagnostic;
  }

  synchronized Optional<Diagnostic> last() {
    return Optional.ofNullable(recorded.peekLast());
  }

  synchronized List<Diagnostic> all() {
    return List.copyOf(recorded);
  }
}
