package com.github.simbo1905.bhf;

import java.util.Iterator;

/// Renders a decompressed, control-coded text stream as plain text or HTML.
final class TextFormatter {

  static final String HTML_OPEN = "<pre>";
  static final String HTML_CLOSE = "</pre>";
  static final String HTML_NEW_LINE = "<br>";
  static final String CODE_OPEN = "<code>";
  static final String CODE_CLOSE = "</code>";
  static final String ANCHOR_CLOSE = "</a>";

  private final Diagnostics diagnostics;

  TextFormatter(Diagnostics diagnostics) {
    this.diagnostics = diagnostics;
  }

  String format(byte[] text, TextFormat format, KeywordRecord keywords, long position) {
    switch (format) {
      case PLAIN_TEXT:
        return toPlainText(text);
      case HTML:
        return toHtml(text, keywords, position);
      default:
        throw new IllegalArgumentException("unsupported format " + format);
    }
  }

  /// Newlines become `\n`, toggles are dropped and output stops at the document end marker.
  static String toPlainText(byte[] text) {
    final StringBuilder sb = new StringBuilder(text.length);
    for (byte value : text) {
      final int b = value & 0xFF;
      if (b == ControlCode.DOCUMENT_END) {
        break;
      }
      if (b == ControlCode.KEYWORD_TOGGLE || b == ControlCode.SOURCE_CODE_TOGGLE) {
        continue;
      }
      sb.append(CodePage437.translate(b));
    }
    return sb.toString();
  }

  /// Wraps the text in `<pre>`. Each keyword span becomes a link to the next context id of
  /// `keywords`. The link covers only the glyphs of the span, not its surrounding spaces.
  /// Where a code span crosses a link boundary the code span is closed and reopened around the
  /// anchor tag, so tags always nest.
  String toHtml(byte[] text, KeywordRecord keywords, long position) {
    final StringBuilder sb = new StringBuilder(text.length * 2 + HTML_OPEN.length());
    final Iterator<Integer> targets = keywords.contexts().iterator();
    sb.append(HTML_OPEN);
    SpanState state = SpanState.NORMAL;
    int anchorStart = -1;
    int anchorEnd = -1;
    boolean codeAtStart = false;
    boolean codeAtEnd = false;
    for (byte value : text) {
      final int b = value & 0xFF;
      if (b == ControlCode.DOCUMENT_END) {
        break;
      }
      switch (b) {
        case ControlCode.NEW_LINE:
          sb.append(HTML_NEW_LINE);
          break;
        case ControlCode.KEYWORD_TOGGLE:
          if (state.inKeyword()) {
            closeAnchor(sb, anchorStart, codeAtStart, anchorEnd, codeAtEnd, targets, position);
          }
          anchorStart = -1;
          anchorEnd = -1;
          state = state.next(b);
          break;
        case ControlCode.SOURCE_CODE_TOGGLE:
          sb.append(state.inCode() ? CODE_CLOSE : CODE_OPEN);
          state = state.next(b);
          break;
        case ControlCode.SPACE:
          sb.append(CodePage437.translateHtml(b));
          break;
        default:
          if (state.inKeyword() && anchorStart < 0) {
            anchorStart = sb.length();
            codeAtStart = state.inCode();
          }
          sb.append(CodePage437.translateHtml(b));
          if (state.inKeyword()) {
            anchorEnd = sb.length();
            codeAtEnd = state.inCode();
          }
      }
    }
    if (state.inCode()) {
      sb.append(CODE_CLOSE);
    }
    if (state.inKeyword()) {
      closeAnchor(sb, anchorStart, codeAtStart, anchorEnd, codeAtEnd, targets, position);
    }
    sb.append(HTML_CLOSE);
    return sb.toString();
  }

  private void closeAnchor(StringBuilder sb, int start, boolean codeAtStart, int end,
      boolean codeAtEnd, Iterator<Integer> targets, long position) {
    if (!targets.hasNext()) {
      diagnostics.record(DiagnosticKind.MISSING_KEYWORD_TARGET, position,
          "keyword span has no target context, rendering it unlinked");
      return;
    }
    final int target = targets.next();
    if (start < 0) {
      return;
    }
    // a code span that opens right before the first glyph or closes right after the last one
    // moves inside the link
    final int codeOpenAt = start - CODE_OPEN.length();
    if (codeAtStart && codeOpenAt >= 0 && sb.lastIndexOf(CODE_OPEN, codeOpenAt) == codeOpenAt) {
      start = codeOpenAt;
      codeAtStart = false;
    }
    if (codeAtEnd && sb.indexOf(CODE_CLOSE, end) == end) {
      end += CODE_CLOSE.length();
      codeAtEnd = false;
    }
    // close first so that start stays valid
    sb.insert(end, codeAtEnd ? CODE_CLOSE + ANCHOR_CLOSE + CODE_OPEN : ANCHOR_CLOSE);
    final String anchorOpen = "<a href=\"#" + target + "\">";
    sb.insert(start, codeAtStart ? CODE_CLOSE + anchorOpen + CODE_OPEN : anchorOpen);
  }
}
