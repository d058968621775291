package com.github.simbo1905.bhf;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Builder for opening [HelpFile] instances with a fluent API.
///
/// Example usage:
/// <pre>
/// HelpFile help = new HelpFileBuilder()
///     .path("/path/to/TURBO.TPH")
///     .useMemoryMapping(true)
///     .cacheRenderedText(true)
///     .open();
/// </pre>
public class HelpFileBuilder {

  private static final Logger logger = Logger.getLogger(HelpFileBuilder.class.getName());

  private Path path;
  private byte[] bytes;
  private boolean useMemoryMapping = false;
  private boolean strictSentinel = false;
  private boolean reflow = true;
  private boolean cacheRenderedText = false;

  /// Sets the path of the help file.
  ///
  /// @param path the path to the help file
  /// @return this builder for chaining
  public HelpFileBuilder path(Path path) {
    this.path = path;
    this.bytes = null;
    return this;
  }

  /// Sets the path of the help file using a string.
  /// The string will be converted to a Path and normalized.
  ///
  /// @param path the path string to the help file
  /// @return this builder for chaining
  public HelpFileBuilder path(String path) {
    return path(Paths.get(path).normalize());
  }

  /// Reads the help file from an in-memory image instead of a file. The array is not copied
  /// and must not be modified while the help file is open.
  ///
  /// @param bytes the complete help file image
  /// @return this builder for chaining
  public HelpFileBuilder bytes(byte[] bytes) {
    if (bytes == null) {
      throw new IllegalArgumentException("bytes cannot be null");
    }
    this.bytes = bytes;
    this.path = null;
    return this;
  }

  /// Maps the file into memory instead of reading it with a RandomAccessFile.
  /// Ignored for in-memory images.
  ///
  /// @param useMemoryMapping true to enable memory mapping
  /// @return this builder for chaining
  public HelpFileBuilder useMemoryMapping(boolean useMemoryMapping) {
    this.useMemoryMapping = useMemoryMapping;
    return this;
  }

  /// Fails the open when the byte after the stamp is not 0x1A. By default a bad sentinel is
  /// only recorded as a diagnostic.
  ///
  /// @param strictSentinel true to reject files with a bad stamp sentinel
  /// @return this builder for chaining
  public HelpFileBuilder strictSentinel(boolean strictSentinel) {
    this.strictSentinel = strictSentinel;
    return this;
  }

  /// Enables word-wrapping of text to the screen width in the file header (on by default).
  ///
  /// @param reflow false to keep the line breaks exactly as stored
  /// @return this builder for chaining
  public HelpFileBuilder reflow(boolean reflow) {
    this.reflow = reflow;
    return this;
  }

  /// Keeps every rendered text in memory keyed by offset and format. Only offsets that hold a
  /// Text record are cached, so the cache is bounded by the Text records in the file.
  ///
  /// @param cacheRenderedText true to cache rendered text
  /// @return this builder for chaining
  public HelpFileBuilder cacheRenderedText(boolean cacheRenderedText) {
    this.cacheRenderedText = cacheRenderedText;
    return this;
  }

  Config build() {
    final Config config = new Config(strictSentinel, reflow, cacheRenderedText);
    logger.log(Level.FINE, () -> String.format("Resolved %s", config));
    return config;
  }

  /// Package-private record to hold the resolved options
  record Config(boolean strictSentinel, boolean reflow, boolean cacheRenderedText) {}

  /// Opens the help file and parses its catalog.
  ///
  /// @return a new HelpFile instance
  /// @throws NoSuchFileException if the path does not exist
  /// @throws BhfFormatException if the catalog records are missing, out of order or truncated
  /// @throws IOException if the file cannot be read
  /// @throws IllegalStateException if neither a path nor bytes were given
  public HelpFile open() throws IOException {
    final Config config = build();
    if (bytes != null) {
      return new HelpFile(new ByteArraySource(bytes), null, config);
    }
    if (path == null) {
      throw new IllegalStateException("Either path or bytes must be specified");
    }
    if (!Files.exists(path)) {
      throw new NoSuchFileException(path.toString());
    }
    final RandomAccessFile raf = new RandomAccessFile(path.toFile(), "r");
    final ByteSource source;
    try {
      source = useMemoryMapping ? new MemoryMappedSource(raf) : new RandomAccessFileSource(raf);
    } catch (IOException e) {
      try {
        raf.close();
      } catch (IOException closeException) {
        logger.log(Level.WARNING, "Failed to close RandomAccessFile after mapping failed",
            closeException);
      }
      throw e;
    }
    logger.log(Level.FINE, () -> String.format("opening %s memoryMapped=%b", path, useMemoryMapping));
    return new HelpFile(source, path, config);
  }
}
