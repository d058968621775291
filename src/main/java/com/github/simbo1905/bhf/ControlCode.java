package com.github.simbo1905.bhf;

/// In-band control bytes of a decompressed text stream.
final class ControlCode {

  static final int NEW_LINE = 0x00;
  static final int DOCUMENT_END = 0x01;
  static final int KEYWORD_TOGGLE = 0x02;
  static final int SOURCE_CODE_TOGGLE = 0x05;

  static final int SPACE = 0x20;

  private ControlCode() {}

  static boolean isControl(int b) {
    switch (b) {
      case NEW_LINE:
      case DOCUMENT_END:
      case KEYWORD_TOGGLE:
      case SOURCE_CODE_TOGGLE:
        return true;
      default:
        return false;
    }
  }
}
