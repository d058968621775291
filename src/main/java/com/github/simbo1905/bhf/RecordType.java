package com.github.simbo1905.bhf;

/// Type tag of a length-prefixed record.
public enum RecordType {
  FILE_HEADER(0),
  CONTEXT(1),
  TEXT(2),
  KEYWORD(3),
  INDEX(4),
  COMPRESSION(5),
  /// Only present in the newest format variant; recognised so that it can be skipped.
  INDEX_TAGS(6),
  /// Any tag this reader does not know.
  UNKNOWN(-1);

  final int code;

  RecordType(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  static RecordType fromCode(int code) {
    for (RecordType type : values()) {
      if (type.code == code) {
        return type;
      }
    }
    return UNKNOWN;
  }
}
