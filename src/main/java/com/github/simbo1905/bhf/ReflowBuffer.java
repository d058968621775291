package com.github.simbo1905.bhf;

import java.io.ByteArrayOutputStream;

/// Extends ByteArrayOutputStream so that bytes already written can be read and rewritten in
/// place without copying the buffer.
final class ReflowBuffer extends ByteArrayOutputStream {

  ReflowBuffer(int size) {
    super(size);
  }

  void set(int index, int value) {
    checkIndex(index);
    buf[index] = (byte) value;
  }

  /// Number of non-control bytes written after `index`.
  int printableAfter(int index) {
    int printable = 0;
    for (int i = index + 1; i < count; i++) {
      if (!ControlCode.isControl(buf[i] & 0xFF)) {
        printable++;
      }
    }
    return printable;
  }

  private void checkIndex(int index) {
    if (index < 0 || index >= count) {
      throw new IndexOutOfBoundsException("index " + index + " out of bounds for size " + count);
    }
  }
}
