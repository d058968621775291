package com.github.simbo1905.bhf;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Typed little-endian cursor over a [ByteSource].
///
/// A strict reader throws a [BhfFormatException] of kind [DiagnosticKind#SHORT_READ] when the
/// source runs out. A lenient reader records the short read as a diagnostic and zero-fills the
/// missing bytes. Both views share the source, and so share the cursor.
final class RecordReader {

  private static final Logger logger = Logger.getLogger(RecordReader.class.getName());

  private final ByteSource source;
  private final Diagnostics diagnostics;
  private final boolean strict;

  RecordReader(ByteSource source, Diagnostics diagnostics, boolean strict) {
    this.source = source;
    this.diagnostics = diagnostics;
    this.strict = strict;
  }

  /// Returns a view over the same cursor that tolerates short reads.
  RecordReader lenient() {
    return strict ? new RecordReader(source, diagnostics, false) : this;
  }

  long position() throws IOException {
    return source.getFilePointer();
  }

  long length() throws IOException {
    return source.length();
  }

  long remaining() throws IOException {
    return Math.max(0, source.length() - source.getFilePointer());
  }

  void seek(long offset) throws IOException {
    logger.log(Level.FINEST, () -> "seek " + offset);
    source.seek(offset);
  }

  /// Reads exactly `count` bytes.
  byte[] readBytes(int count) throws IOException {
    if (count < 0) {
      throw new IllegalArgumentException("count must be non-negative, got " + count);
    }
    long start = source.getFilePointer();
    byte[] result = new byte[count];
    int total = 0;
    while (total < count) {
      int n = source.read(result, total, count - total);
      if (n <= 0) {
        break;
      }
      total += n;
    }
    if (total != count) {
      shortRead(start, count, total);
    }
    return result;
  }

  int readU8() throws IOException {
    return readBytes(1)[0] & 0xFF;
  }

  int readS8() throws IOException {
    return readBytes(1)[0];
  }

  int readU16() throws IOException {
    return wrap(readBytes(Short.BYTES)).getShort() & 0xFFFF;
  }

  /// Reads a three byte offset assembled as `b0 | b1 << 8 | signed(b2) << 16`.
  int readS24() throws IOException {
    byte[] b = readBytes(3);
    return (b[0] & 0xFF) | (b[1] & 0xFF) << 8 | b[2] << 16;
  }

  /// Reads bytes up to and excluding a NUL terminator. The terminator is consumed.
  byte[] readCString() throws IOException {
    long start = source.getFilePointer();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] one = new byte[1];
    while (true) {
      int n = source.read(one, 0, 1);
      if (n <= 0) {
        shortRead(start, out.size() + 1, out.size());
        return out.toByteArray();
      }
      if (one[0] == 0) {
        return out.toByteArray();
      }
      out.write(one[0]);
    }
  }

  static ByteBuffer wrap(byte[] bytes) {
    return ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
  }

  private void shortRead(long position, int wanted, int got) throws BhfFormatException {
    String message =
        String.format("Short read, trying to read %d bytes got %d bytes", wanted, got);
    if (strict) {
      throw new BhfFormatException(new Diagnostic(DiagnosticKind.SHORT_READ, message, position));
    }
    diagnostics.record(DiagnosticKind.SHORT_READ, position, message);
  }
}
