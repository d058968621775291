package com.github.simbo1905.bhf;

import java.io.IOException;
import java.util.Objects;

/// In-memory [ByteSource] over a help file image that is already loaded.
final class ByteArraySource implements ByteSource {

  private final byte[] data;
  private long position = 0;
  private boolean closed = false;

  ByteArraySource(byte[] data) {
    this.data = Objects.requireNonNull(data, "data cannot be null");
  }

  @Override
  public long getFilePointer() throws IOException {
    ensureOpen();
    return position;
  }

  @Override
  public int read(byte[] b, int off, int len) throws IOException {
    ensureOpen();
    Objects.checkFromIndexSize(off, len, b.length);
    if (position >= data.length) {
      return -1;
    }
    int n = (int) Math.min(len, data.length - position);
    System.arraycopy(data, (int) position, b, off, n);
    position += n;
    return n;
  }

  @Override
  public void seek(long pos) throws IOException {
    ensureOpen();
    if (pos < 0) {
      throw new IOException("Negative seek offset " + pos);
    }
    position = pos;
  }

  @Override
  public long length() throws IOException {
    ensureOpen();
    return data.length;
  }

  @Override
  public void close() {
    closed = true;
  }

  private void ensureOpen() throws IOException {
    if (closed) {
      throw new IOException("Byte source is closed");
    }
  }
}
