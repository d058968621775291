package com.github.simbo1905.bhf;

import java.util.logging.Level;
import java.util.logging.Logger;

/// Expands the payload of a Text record into a control-coded byte stream.
///
/// Each nibble is one of:
///
/// | nibble | meaning |
/// |---|---|
/// | 0x0-0xD | the byte at that position of the [CompressionTable] |
/// | 0xE n | emit the next decoded byte n+1 times |
/// | 0xF lo hi | the literal byte `(hi << 4) + lo` |
///
/// Decoded bytes pass through an inline word-wrap (see [Reflow]) that only ever rewrites bytes
/// in place, so the output length is always the sum of the repeat counts.
final class NibbleDecompressor {

  private static final Logger logger = Logger.getLogger(NibbleDecompressor.class.getName());

  static final int NIBBLE_REPEAT = 0xE;
  static final int NIBBLE_RAW = 0xF;

  private final CompressionTable table;
  private final int maxWidth;
  private final Diagnostics diagnostics;

  /// @param maxWidth columns available per line; 0 or less turns reflow off
  NibbleDecompressor(CompressionTable table, int maxWidth, Diagnostics diagnostics) {
    this.table = table;
    this.maxWidth = maxWidth;
    this.diagnostics = diagnostics;
  }

  /// Decompresses a whole payload. `position` is the file offset of the payload and is only
  /// used to locate diagnostics.
  byte[] decompress(byte[] payload, long position) {
    return decompress(new NibbleStream(payload), position);
  }

  byte[] decompress(NibbleStream stream, long position) {
    final ReflowBuffer out = new ReflowBuffer(stream.remaining());
    final Reflow reflow = new Reflow(out, maxWidth);
    int repeat = 1;
    while (!stream.isEmpty()) {
      final int nibble = stream.next();
      final int value;
      if (nibble == NIBBLE_RAW) {
        if (stream.remaining() < 2) {
          truncated(stream, position, "raw byte");
          break;
        }
        final int lo = stream.next();
        final int hi = stream.next();
        value = hi << 4 | lo;
      } else if (nibble == NIBBLE_REPEAT) {
        if (stream.remaining() < 1) {
          truncated(stream, position, "repeat count");
          break;
        }
        repeat = stream.next() + 1;
        continue;
      } else {
        value = table.substitute(nibble);
      }
      for (int i = 0; i < repeat; i++) {
        reflow.accept(value);
      }
      repeat = 1;
    }
    logger.log(Level.FINEST, () -> String.format(
        "decompressed %d nibbles at %d into %d bytes", stream.consumed(), position, out.size()));
    return out.toByteArray();
  }

  private void truncated(NibbleStream stream, long position, String what) {
    diagnostics.record(DiagnosticKind.TRUNCATED_ESCAPE, position,
        String.format("%s escape truncated at nibble %d", what, stream.consumed() - 1));
  }

  /// Lazy word-wrap applied while bytes are decoded.
  ///
  /// A source line that starts with a glyph is "armed": its newlines are soft breaks and are
  /// folded into spaces, which become break positions. A second newline in a row, or a newline
  /// after a space, is a hard break. Lines that start with a space (indented text, code) keep
  /// their newlines and are never wrapped. On an armed line, whenever the column passes
  /// `maxWidth` the last break position on the line is rewritten to a newline straight away,
  /// without waiting for the next newline. Words longer than `maxWidth` are never split.
  static final class Reflow {

    private final ReflowBuffer out;
    private final int maxWidth;

    private int column;
    private boolean armed;
    private boolean lineStart = true;
    private int lastSpace = -1;
    private int foldedNewline = -1;
    private int previous = ControlCode.NEW_LINE;
    private boolean inKeyword;

    Reflow(ReflowBuffer out, int maxWidth) {
      this.out = out;
      this.maxWidth = maxWidth;
    }

    void accept(int b) {
      if (maxWidth <= 0) {
        out.write(b);
        return;
      }
      switch (b) {
        case ControlCode.NEW_LINE:
          newLine();
          break;
        case ControlCode.KEYWORD_TOGGLE:
          inKeyword = !inKeyword;
          out.write(b);
          break;
        case ControlCode.DOCUMENT_END:
        case ControlCode.SOURCE_CODE_TOGGLE:
          out.write(b);
          break;
        default:
          glyph(b);
      }
    }

    private void newLine() {
      if (armed && previous != ControlCode.NEW_LINE && previous != ControlCode.SPACE) {
        // soft break
        foldedNewline = out.size();
        out.write(ControlCode.SPACE);
        if (!inKeyword) {
          lastSpace = foldedNewline;
        }
        column++;
        wrapIfNeeded();
        previous = ControlCode.NEW_LINE;
        return;
      }
      if (armed && previous == ControlCode.NEW_LINE && foldedNewline >= 0) {
        out.set(foldedNewline, ControlCode.NEW_LINE);
      }
      out.write(ControlCode.NEW_LINE);
      column = 0;
      armed = false;
      lineStart = true;
      lastSpace = -1;
      foldedNewline = -1;
      previous = ControlCode.NEW_LINE;
    }

    private void glyph(int b) {
      if (lineStart && b != ControlCode.SPACE) {
        armed = true;
      }
      lineStart = false;
      if (armed && b == ControlCode.SPACE && !inKeyword) {
        lastSpace = out.size();
      }
      out.write(b);
      column++;
      if (armed) {
        wrapIfNeeded();
      }
      previous = b;
    }

    private void wrapIfNeeded() {
      if (column > maxWidth && lastSpace >= 0) {
        out.set(lastSpace, ControlCode.NEW_LINE);
        column = out.printableAfter(lastSpace);
        lastSpace = -1;
      }
    }
  }
}
