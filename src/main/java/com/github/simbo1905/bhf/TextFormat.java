package com.github.simbo1905.bhf;

/// Output rendering of a Text record.
public enum TextFormat {
  PLAIN_TEXT,
  /// Preformatted HTML with keyword spans rendered as `<a href="#N">` links to context ids.
  HTML
}
