package com.github.simbo1905.bhf.util;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import com.github.simbo1905.bhf.HelpFile;
import com.github.simbo1905.bhf.JulLoggingConfig;
import com.github.simbo1905.bhf.TestHelpFiles;
import com.github.simbo1905.bhf.TextFormat;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;

public class HelpFileDumpTest extends JulLoggingConfig {

  private static String dump(TextFormat format) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (HelpFile help = HelpFile.open(TestHelpFiles.sample().bytes());
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8)) {
      HelpFileDump.dump(help, format, out);
    }
    return bytes.toString(StandardCharsets.UTF_8);
  }

  @Test
  public void testSummary() throws IOException {
    String summary = dump(null);
    assertTrue(summary, summary.contains("stamp.........: " + TestHelpFiles.STAMP));
    assertTrue(summary, summary.contains("version.......: 1 34 (BP7)"));
    assertTrue(summary, summary.contains("  screen size.: 25 x 40"));
    assertTrue(summary, summary.contains("  table.......: 20 65 74 00 02 01"));
    assertTrue(summary, summary.contains("      1 Context"));
    assertTrue(summary, summary.contains("header........: INDEX_TAGS 4"));
    assertFalse(summary, summary.contains("--{ Context 0 }--"));
  }

  @Test
  public void testContextsAsText() throws IOException {
    String text = dump(TextFormat.PLAIN_TEXT);
    assertTrue(text, text.contains("--{ Context 2 }--"));
    assertTrue(text, text.contains(TestHelpFiles.NOTES_PLAIN));
  }

  @Test
  public void testContextsAsHtml() throws IOException {
    String html = dump(TextFormat.HTML);
    assertTrue(html, html.contains(TestHelpFiles.INTRO_HTML));
  }
}
