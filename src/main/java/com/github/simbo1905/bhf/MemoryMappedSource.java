package com.github.simbo1905.bhf;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Read-only memory-mapped implementation of [ByteSource].
///
/// Context offsets are 24-bit so a help file always fits in a single mapping. The whole
/// file is mapped once at open time and every read is served from the mapping.
class MemoryMappedSource implements ByteSource {

  static final Logger logger = Logger.getLogger(MemoryMappedSource.class.getName());

  final RandomAccessFile randomAccessFile;
  final FileChannel channel;
  final MappedByteBuffer buffer;
  private long position = 0;

  /// Maps the whole file read-only.
  /// @param file The underlying RandomAccessFile, closed by [#close()]
  /// @throws IOException if mapping fails or the file is too large for one mapping
  MemoryMappedSource(RandomAccessFile file) throws IOException {
    this.randomAccessFile = file;
    this.channel = file.getChannel();
    long fileSize = channel.size();
    if (fileSize > Integer.MAX_VALUE) {
      throw new IOException("Help file too large to map: " + fileSize + " bytes");
    }
    this.buffer = channel.map(FileChannel.MapMode.READ_ONLY, 0, fileSize);
    logger.log(Level.FINE, () -> String.format("Mapped %d bytes read-only", fileSize));
  }

  @Override
  public long getFilePointer() {
    return position;
  }

  @Override
  public int read(byte[] b, int off, int len) {
    int limit = buffer.limit();
    if (position >= limit) {
      return -1;
    }
    int n = (int) Math.min(len, limit - position);
    buffer.get((int) position, b, off, n);
    position += n;
    return n;
  }

  @Override
  public void seek(long pos) throws IOException {
    if (pos < 0) {
      throw new IOException("Negative seek offset " + pos);
    }
    position = pos;
  }

  @Override
  public long length() {
    return buffer.limit();
  }

  @Override
  public void close() throws IOException {
    randomAccessFile.close();
  }
}
