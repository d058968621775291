package com.github.simbo1905.bhf;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Reads the fixed prefix and the catalog records of a help file in one linear pass and builds
/// the [Document]. The record order is fixed:
///
/// ```
/// stamp NUL, 0x1A, signature NUL, version(2)
/// FileHeader, Compression, Context, Index, [IndexTags]
/// ```
///
/// Any record out of place aborts the parse with a [BhfFormatException].
final class HeaderParser {

  private static final Logger logger = Logger.getLogger(HeaderParser.class.getName());

  static final int STAMP_SENTINEL = 0x1A;

  /// Top three bits of an index entry's length byte carry the shared prefix length.
  static final int CARRY_SHIFT = 5;
  static final int NEW_CHARS_MASK = 0x1F;

  private final RecordReader in;
  private final Diagnostics diagnostics;
  private final boolean strictSentinel;

  HeaderParser(RecordReader in, Diagnostics diagnostics, boolean strictSentinel) {
    this.in = in;
    this.diagnostics = diagnostics;
    this.strictSentinel = strictSentinel;
  }

  Document parse() throws IOException {
    in.seek(0);
    final String stamp = CodePage437.decode(in.readCString());
    checkSentinel();
    final ByteSequence signature = new ByteSequence(in.readCString());
    final Version version = Version.readFrom(in);
    logger.log(Level.FINE, () -> String.format("stamp=%s version=%s", stamp.trim(), version));

    final long firstRecordPosition = in.position();

    RecordHeader header = RecordHeader.readFrom(in).expect(RecordType.FILE_HEADER);
    final FileHeader fileHeader = FileHeader.readFrom(in);
    checkConsumed(header);

    header = RecordHeader.readFrom(in).expect(RecordType.COMPRESSION);
    final CompressionTable compression = CompressionTable.readFrom(in);
    checkConsumed(header);
    if (compression.type() != CompressionTable.Type.NIBBLE) {
      logger.log(Level.WARNING, () -> String.format(
          "unknown compression type code %d, decoding as nibble compression", compression.typeCode()));
    }

    header = RecordHeader.readFrom(in).expect(RecordType.CONTEXT);
    final ContextTable contexts = readContexts();
    checkConsumed(header);

    header = RecordHeader.readFrom(in).expect(RecordType.INDEX);
    final List<IndexEntry> index = readIndex();
    checkConsumed(header);

    final int indexTagsLength = skipIndexTags();

    logger.log(Level.FINE, () -> String.format(
        "parsed %d contexts, %d index entries, index tags length %d",
        contexts.size(), index.size(), indexTagsLength));

    return new Document(stamp, signature, version, fileHeader, compression, contexts, index,
        indexTagsLength, firstRecordPosition);
  }

  private void checkSentinel() throws IOException {
    final long position = in.position();
    final int sentinel = in.readU8();
    if (sentinel != STAMP_SENTINEL) {
      final Diagnostic diagnostic = new Diagnostic(DiagnosticKind.INVALID_SENTINEL,
          String.format("expected stamp sentinel 0x%02X but found 0x%02X", STAMP_SENTINEL, sentinel),
          position);
      if (strictSentinel) {
        throw new BhfFormatException(diagnostic);
      }
      diagnostics.record(diagnostic);
    }
  }

  private ContextTable readContexts() throws IOException {
    final int count = in.readU16();
    final int[] offsets = new int[count];
    for (int i = 0; i < count; i++) {
      offsets[i] = in.readS24();
    }
    return new ContextTable(offsets);
  }

  private List<IndexEntry> readIndex() throws IOException {
    final int count = in.readU16();
    final RecordReader entries = in.lenient();
    final List<IndexEntry> index = new ArrayList<>(count);
    String previous = "";
    for (int i = 0; i < count; i++) {
      final IndexEntry entry = readIndexEntry(entries, previous);
      index.add(entry);
      previous = entry.label();
    }
    return index;
  }

  /// Reads one prefix-compressed index entry. `previous` is the label of the entry before it
  /// in file order, or the empty string for the first entry.
  static IndexEntry readIndexEntry(RecordReader in, String previous) throws IOException {
    final int lengthByte = in.readU8();
    final int carry = Math.min(lengthByte >>> CARRY_SHIFT, previous.length());
    final int newChars = lengthByte & NEW_CHARS_MASK;
    final StringBuilder label = new StringBuilder(carry + newChars);
    label.append(previous, 0, carry);
    label.append(CodePage437.decode(in.readBytes(newChars)));
    final int contextId = in.readU16();
    return new IndexEntry(label.toString(), contextId);
  }

  /// Skips an IndexTags record if one follows. Returns its payload length, or 0 when the next
  /// bytes are something else or the file ends here.
  private int skipIndexTags() throws IOException {
    final long position = in.position();
    if (in.remaining() < RecordHeader.SIZE) {
      return 0;
    }
    final RecordHeader header = RecordHeader.readFrom(in);
    if (header.type() != RecordType.INDEX_TAGS) {
      in.seek(position);
      return 0;
    }
    logger.log(Level.FINE, () -> "skipping " + RecordHeader.formatForLog(header));
    in.seek(header.payloadEnd());
    return header.length();
  }

  private void checkConsumed(RecordHeader header) throws IOException {
    final long consumed = in.position() - header.payloadStart();
    if (consumed != header.length()) {
      logger.log(Level.FINE, () -> String.format("%s declared %d bytes but %d were read",
          header.type(), header.length(), consumed));
    }
  }
}
