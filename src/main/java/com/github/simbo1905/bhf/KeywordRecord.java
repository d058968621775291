package com.github.simbo1905.bhf;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/// Payload of the Keyword record that follows a Text record.
///
/// @param upContext   context to go to when paging up from this text
/// @param downContext context to go to when paging down from this text
/// @param contexts    hyperlink targets, one per keyword span of the text, in order
public record KeywordRecord(int upContext, int downContext, List<Integer> contexts) {

  static final KeywordRecord EMPTY = new KeywordRecord(0, 0, List.of());

  public KeywordRecord {
    contexts = List.copyOf(contexts);
  }

  static KeywordRecord readFrom(RecordReader in) throws IOException {
    int up = in.readU16();
    int down = in.readU16();
    int count = in.readU16();
    List<Integer> contexts = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      contexts.add(in.readU16());
    }
    return new KeywordRecord(up, down, contexts);
  }
}
