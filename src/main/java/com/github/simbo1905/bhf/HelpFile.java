package com.github.simbo1905.bhf;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;
import lombok.Synchronized;

/// An open help file. The catalog ([Document]) is parsed once when the file is opened. Text
/// records are decompressed and formatted on demand from their context offset.
///
/// Example usage:
/// <pre>
/// try (HelpFile help = HelpFile.open(Paths.get("TURBO.TPH"))) {
///   IndexEntry entry = help.index().get(0);
///   String html = help.renderText(help.resolve(entry), TextFormat.HTML);
/// }
/// </pre>
///
/// A help file has a single read cursor so all methods that read from the file are
/// synchronized. Recoverable problems do not throw; they are recorded and can be read back from
/// [#lastDiagnostic()] and [#diagnostics()].
public class HelpFile implements AutoCloseable {

  private static final Logger logger = Logger.getLogger(HelpFile.class.getName());

  enum State {
    OPEN,
    CLOSED
  }

  /// The file this help was opened from, or null when it was opened from bytes.
  @Getter private final Path filePath;

  private final Document document;

  private final HelpFileBuilder.Config config;
  private final Diagnostics diagnostics = new Diagnostics();
  private final NibbleDecompressor decompressor;
  private final TextFormatter formatter;
  private final Map<RenderKey, String> renderCache;

  private ByteSource source;
  private final RecordReader strict;
  private final RecordReader lenient;

  private volatile State state;

  record RenderKey(int offset, TextFormat format) {}

  HelpFile(ByteSource source, Path filePath, HelpFileBuilder.Config config) throws IOException {
    this.source = source;
    this.filePath = filePath;
    this.config = config;
    try {
      this.strict = new RecordReader(source, diagnostics, true);
      this.lenient = strict.lenient();
      this.document = new HeaderParser(strict, diagnostics, config.strictSentinel()).parse();
    } catch (IOException | RuntimeException e) {
      try {
        source.close();
      } catch (IOException closeException) {
        logger.log(
            Level.WARNING, "Failed to close help file during constructor failure", closeException);
      }
      throw e;
    }
    final int maxWidth = config.reflow() ? document.fileHeader().maxWidth() : 0;
    this.decompressor = new NibbleDecompressor(document.compression(), maxWidth, diagnostics);
    this.formatter = new TextFormatter(diagnostics);
    this.renderCache = config.cacheRenderedText() ? new HashMap<>() : null;
    this.state = State.OPEN;
    logger.log(Level.FINE, () -> String.format("opened %s", this));
  }

  /// Opens a help file with the default options.
  public static HelpFile open(Path path) throws IOException {
    return new HelpFileBuilder().path(path).open();
  }

  /// Opens a help file image held in memory with the default options.
  public static HelpFile open(byte[] bytes) throws IOException {
    return new HelpFileBuilder().bytes(bytes).open();
  }

  /// The catalog parsed at open time.
  public Document document() {
    return document;
  }

  public String stamp() {
    return document.stamp();
  }

  public ByteSequence signature() {
    return document.signature();
  }

  public Version version() {
    return document.version();
  }

  public FileHeader fileHeader() {
    return document.fileHeader();
  }

  public CompressionTable compression() {
    return document.compression();
  }

  public ContextTable contexts() {
    return document.contexts();
  }

  public List<IndexEntry> index() {
    return document.index();
  }

  /// Returns the Text record offset an index entry points at.
  public int resolve(IndexEntry entry) {
    return document.resolve(entry);
  }

  /// Decompresses and formats the Text record whose header starts at `offset`.
  ///
  /// @return the rendered text, or the empty string with a [DiagnosticKind#NOT_A_TEXT_RECORD]
  ///     diagnostic when there is no Text record at that offset
  /// @throws IOException if the file cannot be read
  @Synchronized
  public String renderText(int offset, TextFormat format) throws IOException {
    ensureOpen();
    final RenderKey key = new RenderKey(offset, format);
    if (renderCache != null) {
      final String cached = renderCache.get(key);
      if (cached != null) {
        return cached;
      }
    }
    final Optional<RecordHeader> header = textHeaderAt(offset);
    if (header.isEmpty()) {
      return "";
    }
    final RecordHeader text = header.get();
    logger.log(Level.FINE, () -> String.format("renderText offset:%d format:%s", offset, format));
    final byte[] payload = lenient.readBytes(text.length());
    final byte[] decoded = decompressor.decompress(payload, text.payloadStart());
    final KeywordRecord keywords =
        format == TextFormat.HTML
            ? keywordsAfter(text.payloadEnd()).orElse(KeywordRecord.EMPTY)
            : KeywordRecord.EMPTY;
    final String rendered = formatter.format(decoded, format, keywords, text.payloadStart());
    if (renderCache != null) {
      renderCache.put(key, rendered);
    }
    return rendered;
  }

  /// Renders the text a context id points at.
  ///
  /// @return the rendered text, or the empty string with a
  ///     [DiagnosticKind#CONTEXT_OUT_OF_RANGE] diagnostic when the id is not in the table
  @Synchronized
  public String renderContext(int contextId, TextFormat format) throws IOException {
    ensureOpen();
    final ContextTable contexts = document.contexts();
    if (!contexts.contains(contextId)) {
      diagnostics.record(DiagnosticKind.CONTEXT_OUT_OF_RANGE, -1,
          String.format("context id %d is not in a table of %d contexts", contextId, contexts.size()));
      return "";
    }
    return renderText(contexts.offset(contextId), format);
  }

  /// Returns the Keyword record stored immediately after the Text record at `offset`.
  /// Empty when there is no Text record at `offset` or no Keyword record after it.
  @Synchronized
  public Optional<KeywordRecord> keywords(int offset) throws IOException {
    ensureOpen();
    final Optional<RecordHeader> header = textHeaderAt(offset);
    if (header.isEmpty()) {
      return Optional.empty();
    }
    return keywordsAfter(header.get().payloadEnd());
  }

  /// Walks every record header from the first catalog record to the end of the file. The walk
  /// stops early at a zero-length record, which is not returned.
  @Synchronized
  public List<RecordHeader> records() throws IOException {
    ensureOpen();
    final List<RecordHeader> records = new ArrayList<>();
    long position = document.firstRecordPosition();
    while (position + RecordHeader.SIZE <= strict.length()) {
      strict.seek(position);
      final RecordHeader header = RecordHeader.readFrom(strict);
      if (header.length() == 0) {
        break;
      }
      logger.log(Level.FINEST, () -> RecordHeader.formatForLog(header));
      records.add(header);
      position = header.payloadEnd();
    }
    return records;
  }

  /// Returns the most recent diagnostic recorded since the file was opened.
  public Optional<Diagnostic> lastDiagnostic() {
    return diagnostics.last();
  }

  /// Returns the diagnostics recorded since the file was opened, oldest first. At most the
  /// latest [Diagnostics#MAX_RECORDED] are kept.
  public List<Diagnostic> diagnostics() {
    return diagnostics.all();
  }

  public boolean isClosed() {
    return state == State.CLOSED;
  }

  @Override
  @Synchronized
  public void close() throws IOException {
    logger.log(Level.FINE, () -> String.format("close called on %s", this));
    if (state == State.CLOSED) {
      return;
    }
    try {
      source.close();
    } finally {
      source = null;
      if (renderCache != null) renderCache.clear();
      state = State.CLOSED;
    }
  }

  /// Positions the cursor on the payload of the Text record at `offset`, or records why it
  /// cannot.
  private Optional<RecordHeader> textHeaderAt(int offset) throws IOException {
    if (offset < 0 || offset + RecordHeader.SIZE > strict.length()) {
      diagnostics.record(DiagnosticKind.NOT_A_TEXT_RECORD, offset,
          String.format("offset %d is outside a file of %d bytes", offset, strict.length()));
      return Optional.empty();
    }
    strict.seek(offset);
    final RecordHeader header = RecordHeader.readFrom(strict);
    if (header.type() != RecordType.TEXT) {
      diagnostics.record(DiagnosticKind.NOT_A_TEXT_RECORD, offset,
          String.format("expected %s record but found %s (type code %d)",
              RecordType.TEXT, header.type(), header.code()));
      return Optional.empty();
    }
    return Optional.of(header);
  }

  private Optional<KeywordRecord> keywordsAfter(long position) throws IOException {
    if (position + RecordHeader.SIZE > strict.length()) {
      return Optional.empty();
    }
    strict.seek(position);
    final RecordHeader header = RecordHeader.readFrom(strict);
    if (header.type() != RecordType.KEYWORD) {
      logger.log(Level.FINEST, () -> "no keyword record after text, found " + header.type());
      return Optional.empty();
    }
    return Optional.of(KeywordRecord.readFrom(lenient));
  }

  private void ensureOpen() {
    if (state != State.OPEN) {
      throw new IllegalStateException("Help file is in state " + state + ", expected OPEN");
    }
  }

  @Override
  public String toString() {
    return "HelpFile["
        + (filePath == null ? "<bytes>" : filePath)
        + ", version=" + document.version()
        + ", contexts=" + document.contexts().size()
        + ", index=" + document.index().size()
        + ", config=" + config
        + "]";
  }
}
