package com.github.simbo1905.bhf;

/// Which spans are open while formatting a text stream.
enum SpanState {
  NORMAL,
  KEYWORD,
  CODE,
  CODE_KEYWORD;

  // [state][0] on keyword toggle, [state][1] on source code toggle
  private static final SpanState[][] TRANSITIONS = {
      {KEYWORD, CODE},
      {NORMAL, CODE_KEYWORD},
      {CODE_KEYWORD, NORMAL},
      {CODE, KEYWORD},
  };

  /// Returns the state after a toggle control code. Any other byte leaves the state unchanged.
  SpanState next(int controlCode) {
    switch (controlCode) {
      case ControlCode.KEYWORD_TOGGLE:
        return TRANSITIONS[ordinal()][0];
      case ControlCode.SOURCE_CODE_TOGGLE:
        return TRANSITIONS[ordinal()][1];
      default:
        return this;
    }
  }

  boolean inKeyword() {
    return this == KEYWORD || this == CODE_KEYWORD;
  }

  boolean inCode() {
    return this == CODE || this == CODE_KEYWORD;
  }
}
