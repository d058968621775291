package com.github.simbo1905.bhf;

import java.io.IOException;

/// Format version pair that follows the signature.
public record Version(Format format, int formatCode, int text) {

  /// Known help file generations, keyed by the format byte.
  public enum Format {
    TP2(0x02),
    /// Also written by Turbo C++ 3.0.
    TP4(0x04),
    TP6(0x33),
    BP7(0x34),
    INVALID(-1);

    final int code;

    Format(int code) {
      this.code = code;
    }

    static Format fromCode(int code) {
      for (Format format : values()) {
        if (format.code == code) {
          return format;
        }
      }
      return INVALID;
    }
  }

  static Version readFrom(RecordReader in) throws IOException {
    int formatCode = in.readU8();
    int text = in.readU8();
    return new Version(Format.fromCode(formatCode), formatCode, text);
  }
}
