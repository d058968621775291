package com.github.simbo1905.bhf;

import java.io.IOException;

/// Seekable read-only byte source underneath a [RecordReader].
/// Wraps file I/O so that direct, memory-mapped and in-memory implementations
/// share the same single-cursor model.
interface ByteSource {

  long getFilePointer() throws IOException;

  /// Reads up to `len` bytes into `b` starting at `off`.
  /// Returns the number of bytes read, or -1 when the cursor is at the end of the source.
  int read(byte[] b, int off, int len) throws IOException;

  void seek(long pos) throws IOException;

  long length() throws IOException;

  void close() throws IOException;
}
