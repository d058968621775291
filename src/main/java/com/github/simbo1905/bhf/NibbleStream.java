package com.github.simbo1905.bhf;

/// Reads 4-bit values out of a byte array, low nibble of each byte first.
final class NibbleStream {

  private final byte[] data;
  private final int nibbleCount;
  private int index;

  NibbleStream(byte[] data, int nibbleCount) {
    if (nibbleCount < 0 || nibbleCount > data.length * 2) {
      throw new IllegalArgumentException(
          "nibbleCount " + nibbleCount + " out of range for " + data.length + " bytes");
    }
    this.data = data;
    this.nibbleCount = nibbleCount;
  }

  NibbleStream(byte[] data) {
    this(data, data.length * 2);
  }

  int next() {
    if (isEmpty()) {
      throw new IllegalStateException("nibble stream exhausted after " + nibbleCount + " nibbles");
    }
    final int b = data[index >>> 1];
    final int nibble = (index & 1) == 0 ? b & 0x0F : (b >>> 4) & 0x0F;
    index++;
    return nibble;
  }

  boolean isEmpty() {
    return index >= nibbleCount;
  }

  int remaining() {
    return nibbleCount - index;
  }

  int consumed() {
    return index;
  }
}
