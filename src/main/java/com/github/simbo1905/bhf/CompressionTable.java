package com.github.simbo1905.bhf;

import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;

/// Payload of the Compression record: the per-file table that maps the nibble values 0-13
/// to the byte each one stands for.
public record CompressionTable(Type type, int typeCode, byte[] table) {

  /// Number of substitutable nibble values. 0xE and 0xF are escapes.
  public static final int TABLE_SIZE = 14;

  /// Type byte + table.
  static final int SIZE = Byte.BYTES + TABLE_SIZE;

  public enum Type {
    NIBBLE(2),
    INVALID(-1);

    final int code;

    Type(int code) {
      this.code = code;
    }

    static Type fromCode(int code) {
      return code == NIBBLE.code ? NIBBLE : INVALID;
    }
  }

  public CompressionTable {
    Objects.requireNonNull(type, "type cannot be null");
    Objects.requireNonNull(table, "table cannot be null");
    if (table.length != TABLE_SIZE) {
      throw new IllegalArgumentException(
          "compression table must have " + TABLE_SIZE + " entries, got " + table.length);
    }
    table = table.clone();
  }

  static CompressionTable of(byte... table) {
    return new CompressionTable(Type.NIBBLE, Type.NIBBLE.code, table);
  }

  /// Returns a copy of the substitution table.
  @Override
  public byte[] table() {
    return table.clone();
  }

  /// Returns the byte a plain nibble stands for.
  int substitute(int nibble) {
    return table[nibble] & 0xFF;
  }

  static CompressionTable readFrom(RecordReader in) throws IOException {
    int typeCode = in.readU8();
    byte[] table = in.readBytes(TABLE_SIZE);
    return new CompressionTable(Type.fromCode(typeCode), typeCode, table);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null || getClass() != obj.getClass()) return false;
    CompressionTable that = (CompressionTable) obj;
    return type == that.type && typeCode == that.typeCode && Arrays.equals(table, that.table);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(type, typeCode) + Arrays.hashCode(table);
  }

  @Override
  public String toString() {
    return "CompressionTable[type=" + type + ", table=" + new ByteSequence(table) + "]";
  }
}
