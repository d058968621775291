package com.github.simbo1905.bhf;

import java.io.IOException;
import java.nio.ByteBuffer;

/// Payload of the FileHeader record.
///
/// @param options       option bits, kept verbatim
/// @param mainIndex     context id of the main index screen
/// @param largestRecord size in bytes of the largest record in the file
/// @param height        screen height the help was compiled for
/// @param width         screen width the help was compiled for
/// @param leftMargin    left margin the legacy viewer indents text by
public record FileHeader(
    int options, int mainIndex, int largestRecord, int height, int width, int leftMargin) {

  /// u16 options + u16 main index + u16 largest record + u8 height + u8 width + u8 margin.
  static final int SIZE = Short.BYTES * 3 + Byte.BYTES * 3;

  /// Number of columns available to text once the left margin is taken off.
  public int maxWidth() {
    return width - leftMargin;
  }

  static FileHeader readFrom(RecordReader in) throws IOException {
    ByteBuffer buffer = RecordReader.wrap(in.readBytes(SIZE));
    int options = buffer.getShort() & 0xFFFF;
    int mainIndex = buffer.getShort() & 0xFFFF;
    int largestRecord = buffer.getShort() & 0xFFFF;
    int height = buffer.get() & 0xFF;
    int width = buffer.get() & 0xFF;
    int leftMargin = buffer.get() & 0xFF;
    return new FileHeader(options, mainIndex, largestRecord, height, width, leftMargin);
  }
}
