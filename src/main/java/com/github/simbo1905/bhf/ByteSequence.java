package com.github.simbo1905.bhf;

import java.util.Arrays;
import java.util.Objects;

/// Raw byte string read from a help file, such as the signature. Copies on the way in and on
/// the way out so a [Document] can hand it out freely.
public record ByteSequence(byte[] bytes) {

  public ByteSequence {
    Objects.requireNonNull(bytes, "bytes cannot be null");
    bytes = bytes.clone();
  }

  /// Returns a copy of the bytes.
  @Override
  public byte[] bytes() {
    return bytes.clone();
  }

  public int length() {
    return bytes.length;
  }

  /// Decodes the bytes through code page 437.
  ///
  /// @return the text the legacy viewer would have displayed
  public String asText() {
    return CodePage437.decode(bytes);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (obj == null || getClass() != obj.getClass()) return false;
    return Arrays.equals(bytes, ((ByteSequence) obj).bytes);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  /// Space separated hex pairs, safe for arbitrary binary data.
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(bytes.length * 3);
    for (int i = 0; i < bytes.length; i++) {
      if (i > 0) {
        sb.append(' ');
      }
      sb.append(String.format("%02x", bytes[i] & 0xFF));
    }
    return sb.toString();
  }
}
