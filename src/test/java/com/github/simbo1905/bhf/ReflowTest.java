package com.github.simbo1905.bhf;

import static com.github.simbo1905.bhf.HelpFileWriter.bytes;
import static com.github.simbo1905.bhf.HelpFileWriter.string;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

/// Word-wrap applied while text is decompressed. Inputs use `\0` for the newline control code.
public class ReflowTest extends JulLoggingConfig {

  private static String reflow(String input, int maxWidth) {
    ReflowBuffer out = new ReflowBuffer(input.length());
    NibbleDecompressor.Reflow reflow = new NibbleDecompressor.Reflow(out, maxWidth);
    for (byte b : bytes(input)) {
      reflow.accept(b & 0xFF);
    }
    String result = string(out.toByteArray());
    assertEquals("reflow must not change the length", input.length(), result.length());
    return result.replace('\0', '\n');
  }

  @Test
  public void testWrapsAtLastSpace() {
    assertEquals("aaaa\nbbbb", reflow("aaaa bbbb", 4));
    assertEquals("the quick\nbrown fox\njumps", reflow("the quick brown fox jumps", 10));
  }

  @Test
  public void testNoWrapWithinWidth() {
    assertEquals("aaaa bbbb", reflow("aaaa bbbb", 9));
  }

  @Test
  public void testLongWordIsNotSplit() {
    assertEquals("abcdefghij\nkl", reflow("abcdefghij kl", 4));
  }

  @Test
  public void testSoftLineBreakBecomesSpace() {
    assertEquals("one two", reflow("one\0two", 40));
  }

  @Test
  public void testSoftLineBreakCanWrap() {
    assertEquals("one\ntwo", reflow("one\0two", 5));
  }

  @Test
  public void testBlankLineIsKept() {
    assertEquals("one\n\ntwo", reflow("one\0\0two", 40));
  }

  @Test
  public void testNewLineAfterSpaceIsHard() {
    assertEquals("one \ntwo", reflow("one \0two", 40));
  }

  @Test
  public void testIndentedLinesAreKept() {
    assertEquals(" code\n more", reflow(" code\0 more", 40));
  }

  @Test
  public void testIndentedLineLongerThanWidthIsNotWrapped() {
    assertEquals("  if (a > b) then x := y", reflow("  if (a > b) then x := y", 10));
    assertEquals("  if (a > b)\n  x := y", reflow("  if (a > b)\0  x := y", 6));
  }

  @Test
  public void testWrapsAsSoonAsWidthIsPassed() {
    // no newline is ever decoded and the second break is only seen past the width
    assertEquals("aa bb\ncc dd", reflow("aa bb cc dd", 5));
    assertEquals("aaaa\nbb cc", reflow("aaaa bb cc", 5));
  }

  @Test
  public void testSpacesInsideKeywordsAreNotBreaks() {
    assertEquals("\u0002ab cd\u0002\nef", reflow("\u0002ab cd\u0002 ef", 4));
  }

  @Test
  public void testControlCodesDoNotCountAsColumns() {
    assertEquals("\u0005ab\u0005 \u0005cd\u0005", reflow("\u0005ab\u0005 \u0005cd\u0005", 5));
  }

  @Test
  public void testDisabledWhenWidthNotPositive() {
    assertEquals("aaaa bbbb\ncc", reflow("aaaa bbbb\0cc", 0));
    assertEquals("aaaa bbbb\ncc", reflow("aaaa bbbb\0cc", -3));
  }
}
