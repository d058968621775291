package com.github.simbo1905.bhf;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/// Writes synthetic help files for tests. Nothing is validated so that broken files can be
/// written as easily as good ones.
public final class HelpFileWriter {

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();

  /// Bytes of a string with one byte per char, so control codes can be written as `\u0002`.
  public static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.ISO_8859_1);
  }

  public static String string(byte[] b) {
    return new String(b, StandardCharsets.ISO_8859_1);
  }

  public int position() {
    return out.size();
  }

  public byte[] toByteArray() {
    return out.toByteArray();
  }

  public HelpFileWriter raw(byte... b) {
    out.write(b, 0, b.length);
    return this;
  }

  public HelpFileWriter u8(int v) {
    out.write(v);
    return this;
  }

  public HelpFileWriter u16(int v) {
    out.write(v & 0xFF);
    out.write((v >>> 8) & 0xFF);
    return this;
  }

  public HelpFileWriter s24(int v) {
    out.write(v & 0xFF);
    out.write((v >>> 8) & 0xFF);
    out.write((v >>> 16) & 0xFF);
    return this;
  }

  public HelpFileWriter cString(String s) {
    return raw(bytes(s)).u8(0);
  }

  /// Stamp, 0x1A sentinel, signature and version.
  public HelpFileWriter preamble(String stamp, String signature, int format, int text) {
    return cString(stamp).u8(HeaderParser.STAMP_SENTINEL).cString(signature).u8(format).u8(text);
  }

  public HelpFileWriter record(RecordType type, byte[] payload) {
    return record(type.getCode(), payload);
  }

  public HelpFileWriter record(int typeCode, byte[] payload) {
    return u8(typeCode).u16(payload.length).raw(payload);
  }

  public HelpFileWriter fileHeader(
      int options, int mainIndex, int largestRecord, int height, int width, int leftMargin) {
    byte[] payload =
        new HelpFileWriter()
            .u16(options)
            .u16(mainIndex)
            .u16(largestRecord)
            .u8(height)
            .u8(width)
            .u8(leftMargin)
            .toByteArray();
    return record(RecordType.FILE_HEADER, payload);
  }

  public HelpFileWriter compression(byte[] table) {
    return record(RecordType.COMPRESSION, new HelpFileWriter().u8(2).raw(table).toByteArray());
  }

  public HelpFileWriter contexts(int... offsets) {
    HelpFileWriter payload = new HelpFileWriter().u16(offsets.length);
    for (int offset : offsets) {
      payload.s24(offset);
    }
    return record(RecordType.CONTEXT, payload.toByteArray());
  }

  /// One index entry as stored: carry in the top three bits, new chars, context id.
  public static byte[] indexEntry(int carry, String newChars, int contextId) {
    return new HelpFileWriter()
        .u8(carry << HeaderParser.CARRY_SHIFT | newChars.length())
        .raw(bytes(newChars))
        .u16(contextId)
        .toByteArray();
  }

  public HelpFileWriter index(byte[]... entries) {
    HelpFileWriter payload = new HelpFileWriter().u16(entries.length);
    for (byte[] entry : entries) {
      payload.raw(entry);
    }
    return record(RecordType.INDEX, payload.toByteArray());
  }

  public HelpFileWriter text(byte[] table, String text) {
    return record(RecordType.TEXT, compress(table, bytes(text)));
  }

  public HelpFileWriter keyword(int up, int down, int... contexts) {
    HelpFileWriter payload = new HelpFileWriter().u16(up).u16(down).u16(contexts.length);
    for (int context : contexts) {
      payload.u16(context);
    }
    return record(RecordType.KEYWORD, payload.toByteArray());
  }

  /// Nibble-encodes text. Runs of the same byte use the repeat escape, bytes missing from the
  /// table use the raw escape.
  public static int[] encode(byte[] table, byte[] text) {
    List<Integer> nibbles = new ArrayList<>();
    int i = 0;
    while (i < text.length) {
      int run = 1;
      while (i + run < text.length && text[i + run] == text[i] && run < 16) {
        run++;
      }
      if (run > 1) {
        nibbles.add(NibbleDecompressor.NIBBLE_REPEAT);
        nibbles.add(run - 1);
      }
      int b = text[i] & 0xFF;
      int index = indexOf(table, b);
      if (index >= 0) {
        nibbles.add(index);
      } else {
        nibbles.add(NibbleDecompressor.NIBBLE_RAW);
        nibbles.add(b & 0x0F);
        nibbles.add(b >>> 4);
      }
      i += run;
    }
    return nibbles.stream().mapToInt(Integer::intValue).toArray();
  }

  /// Encodes and packs text. An odd nibble count is padded with the document end code, so the
  /// table must contain 0x01.
  public static byte[] compress(byte[] table, byte[] text) {
    int[] nibbles = encode(table, text);
    if (nibbles.length % 2 == 1) {
      int pad = indexOf(table, ControlCode.DOCUMENT_END);
      if (pad < 0) {
        throw new IllegalArgumentException("table has no document end code to pad with");
      }
      int[] padded = new int[nibbles.length + 1];
      System.arraycopy(nibbles, 0, padded, 0, nibbles.length);
      padded[nibbles.length] = pad;
      nibbles = padded;
    }
    return packNibbles(nibbles);
  }

  /// Packs nibbles two per byte, low nibble first. The count must be even.
  public static byte[] packNibbles(int... nibbles) {
    if (nibbles.length % 2 != 0) {
      throw new IllegalArgumentException("odd nibble count " + nibbles.length);
    }
    byte[] packed = new byte[nibbles.length / 2];
    for (int i = 0; i < packed.length; i++) {
      packed[i] = (byte) (nibbles[2 * i] | nibbles[2 * i + 1] << 4);
    }
    return packed;
  }

  private static int indexOf(byte[] table, int b) {
    for (int i = 0; i < table.length; i++) {
      if ((table[i] & 0xFF) == b) {
        return i;
      }
    }
    return -1;
  }
}
