package com.github.simbo1905.bhf;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import org.junit.Test;

public class CodePage437Test extends JulLoggingConfig {

  @Test
  public void testNulIsNewLine() {
    assertEquals("\n", CodePage437.translate(0x00));
  }

  @Test
  public void testPrintableAsciiMapsToItself() {
    for (int b = 0x20; b < 0x7F; b++) {
      assertEquals(String.valueOf((char) b), CodePage437.translate(b));
    }
  }

  @Test
  public void testSymbolicGlyphs() {
    assertEquals("☺", CodePage437.translate(0x01));
    assertEquals("→", CodePage437.translate(0x1A));
    assertEquals("▼", CodePage437.translate(0x1F));
    assertEquals("⌂", CodePage437.translate(0x7F));
    assertEquals("Ç", CodePage437.translate(0x80));
    assertEquals("░", CodePage437.translate(0xB0));
    assertEquals("α", CodePage437.translate(0xE0));
    assertEquals("\u00a0", CodePage437.translate(0xFF));
  }

  @Test
  public void testEveryByteIsMapped() {
    for (int b = 0; b < 256; b++) {
      String s = CodePage437.translate(b);
      assertFalse("byte " + b, s == null || s.isEmpty());
    }
  }

  @Test
  public void testNegativeBytesAreTreatedAsUnsigned() {
    assertEquals(CodePage437.translate(0xFF), CodePage437.translate((byte) 0xFF));
  }

  @Test
  public void testHtmlEscapes() {
    assertThat(CodePage437.translateHtml('"'), is("&quot;"));
    assertThat(CodePage437.translateHtml('&'), is("&amp;"));
    assertThat(CodePage437.translateHtml('\''), is("&#39;"));
    assertThat(CodePage437.translateHtml('/'), is("&#47;"));
    assertThat(CodePage437.translateHtml('<'), is("&lt;"));
    assertThat(CodePage437.translateHtml('>'), is("&gt;"));
    assertThat(CodePage437.translateHtml(' '), is("&nbsp;"));
    assertThat(CodePage437.translateHtml('x'), is("x"));
    assertThat(CodePage437.translateHtml(0xB0), is("░"));
  }

  @Test
  public void testDecode() {
    assertEquals("A☺B", CodePage437.decode(new byte[] {'A', 0x01, 'B'}));
  }
}
