package com.github.simbo1905.bhf;

import static com.github.simbo1905.bhf.HelpFileWriter.indexEntry;

/// A small but complete help file shared by the tests.
///
/// Screen 40 wide with a margin of 2. Three contexts: 0 is the introduction with two links,
/// 1 and 2 both point at the notes, which are the last record in the file and have no
/// Keyword record after them.
public final class TestHelpFiles {

  public static final String STAMP = "Test Help File";
  public static final String SIGNATURE = "$*$* &&&&   $*$*";
  public static final int WIDTH = 40;
  public static final int MARGIN = 2;

  public static final byte[] TABLE = {
    ' ', 'e', 't', 0x00, 0x02, 0x01, 'a', 'o', 'n', 's', 'i', 'r', 'h', 0x05
  };

  public static final String INTRO =
      "\u0002Intro\u0002 and \u0002Notes\u0002\u0000\u0000\u0005 x := 1\u0005\u0000\u0001";
  public static final String NOTES = "Notes text\u0000more notes\u0001";

  public static final String INTRO_PLAIN = "Intro and Notes\n\n x := 1\n";
  public static final String INTRO_HTML =
      "<pre><a href=\"#1\">Intro</a>&nbsp;and&nbsp;<a href=\"#2\">Notes</a><br><br>"
          + "<code>&nbsp;x&nbsp;:=&nbsp;1</code><br></pre>";
  public static final String NOTES_PLAIN = "Notes text more notes";
  public static final String NOTES_PLAIN_NO_REFLOW = "Notes text\nmore notes";

  public static final int INDEX_TAGS_LENGTH = 4;

  /// Sample file bytes with the offsets of the two Text records.
  public record Sample(byte[] bytes, int introOffset, int notesOffset) {}

  private TestHelpFiles() {}

  public static Sample sample() {
    // the catalog has the same size whatever the offsets, so lay out once to find them
    Sample layout = write(0, 0);
    return write(layout.introOffset(), layout.notesOffset());
  }

  private static Sample write(int introOffset, int notesOffset) {
    HelpFileWriter w =
        new HelpFileWriter()
            .preamble(STAMP, SIGNATURE, 0x34, 0x01)
            .fileHeader(0, 0, 64, 25, WIDTH, MARGIN)
            .compression(TABLE)
            .contexts(introOffset, notesOffset, notesOffset)
            .index(indexEntry(0, "Contents", 0), indexEntry(4, "ext", 1), indexEntry(0, "Keyword", 2))
            .record(RecordType.INDEX_TAGS, new byte[INDEX_TAGS_LENGTH]);
    int intro = w.position();
    w.text(TABLE, INTRO).keyword(0, 1, 1, 2);
    int notes = w.position();
    w.text(TABLE, NOTES);
    return new Sample(w.toByteArray(), intro, notes);
  }

  /// Just the catalog records, with the given context offsets and no text.
  public static byte[] catalogOnly(int... contextOffsets) {
    return new HelpFileWriter()
        .preamble(STAMP, SIGNATURE, 0x34, 0x01)
        .fileHeader(0, 0, 64, 25, WIDTH, MARGIN)
        .compression(TABLE)
        .contexts(contextOffsets)
        .index()
        .toByteArray();
  }
}
