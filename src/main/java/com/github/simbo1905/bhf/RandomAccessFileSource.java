package com.github.simbo1905.bhf;

import java.io.IOException;

record RandomAccessFileSource(java.io.RandomAccessFile randomAccessFile) implements ByteSource {

  @Override
  public long getFilePointer() throws IOException {
    return randomAccessFile.getFilePointer();
  }

  @Override
  public int read(byte[] b, int off, int len) throws IOException {
    return randomAccessFile.read(b, off, len);
  }

  @Override
  public void seek(long pos) throws IOException {
    randomAccessFile.seek(pos);
  }

  @Override
  public long length() throws IOException {
    return randomAccessFile.length();
  }

  @Override
  public void close() throws IOException {
    randomAccessFile.close();
  }
}
