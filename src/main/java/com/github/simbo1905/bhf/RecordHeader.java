package com.github.simbo1905.bhf;

import java.io.IOException;

/// Header in front of every record: a one byte type tag then a u16 payload length.
/// Carries the file position of the header so the payload can be found again later.
public record RecordHeader(RecordType type, int code, int length, long position) {

  /// Type (1) + length (2) = 3 bytes.
  static final int SIZE = Byte.BYTES + Short.BYTES;

  /// File offset of the first payload byte.
  public long payloadStart() {
    return position + SIZE;
  }

  /// File offset just past the payload, where the next record header starts.
  public long payloadEnd() {
    return payloadStart() + length;
  }

  /// Returns this header if it has the expected type.
  /// @throws BhfFormatException of kind [DiagnosticKind#UNEXPECTED_RECORD_TYPE] otherwise
  RecordHeader expect(RecordType expected) throws BhfFormatException {
    if (type != expected) {
      throw new BhfFormatException(
          new Diagnostic(
              DiagnosticKind.UNEXPECTED_RECORD_TYPE,
              String.format("expected %s record but found %s (type code %d)", expected, type, code),
              position));
    }
    return this;
  }

  /// Reads a record header at the current cursor position.
  static RecordHeader readFrom(RecordReader in) throws IOException {
    long position = in.position();
    int code = in.readU8();
    int length = in.readU16();
    return new RecordHeader(RecordType.fromCode(code), code, length, position);
  }

  static String formatForLog(RecordHeader header) {
    return String.format(
        "RecordHeader[type=%s, code=%d, length=%d, position=%d]",
        header.type, header.code, header.length, header.position);
  }
}
