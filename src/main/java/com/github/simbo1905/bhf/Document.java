package com.github.simbo1905.bhf;

import java.util.List;
import java.util.Objects;

/// Immutable catalog of a help file, built once by [HeaderParser] when the file is opened.
///
/// @param stamp               the stamp string at the start of the file
/// @param signature           the raw signature bytes
/// @param version             format version
/// @param fileHeader          payload of the FileHeader record
/// @param compression         the nibble substitution table
/// @param contexts            context id to Text record offset
/// @param index               index entries in file order
/// @param indexTagsLength     payload length of the skipped IndexTags record, 0 when absent
/// @param firstRecordPosition file offset of the FileHeader record header
public record Document(
    String stamp,
    ByteSequence signature,
    Version version,
    FileHeader fileHeader,
    CompressionTable compression,
    ContextTable contexts,
    List<IndexEntry> index,
    int indexTagsLength,
    long firstRecordPosition) {

  public Document {
    Objects.requireNonNull(stamp, "stamp cannot be null");
    Objects.requireNonNull(signature, "signature cannot be null");
    Objects.requireNonNull(version, "version cannot be null");
    Objects.requireNonNull(fileHeader, "fileHeader cannot be null");
    Objects.requireNonNull(compression, "compression cannot be null");
    Objects.requireNonNull(contexts, "contexts cannot be null");
    index = List.copyOf(index);
  }

  /// Returns the Text record offset an index entry points at.
  /// @throws IndexOutOfBoundsException if the entry names a context that is not in the table
  public int resolve(IndexEntry entry) {
    return contexts.offset(entry.contextId());
  }
}
