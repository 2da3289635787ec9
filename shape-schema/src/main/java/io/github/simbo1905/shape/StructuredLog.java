package io.github.simbo1905.shape;

import java.util.logging.Level;
import java.util.logging.Logger;

/// Package-private helper for `event=NAME key=value` JUL lines.
/// Values are rendered with the same bounded preview used in issue messages.
final class StructuredLog {

  private static final int MAX_VALUE = 200;

  private StructuredLog() {}

  static void fine(Logger log, String event, Object... kv) {
    if (log.isLoggable(Level.FINE)) {
      log.fine(() -> line(event, kv));
    }
  }

  static void finer(Logger log, String event, Object... kv) {
    if (log.isLoggable(Level.FINER)) {
      log.finer(() -> line(event, kv));
    }
  }

  static void finest(Logger log, String event, Object... kv) {
    if (log.isLoggable(Level.FINEST)) {
      log.finest(() -> line(event, kv));
    }
  }

  static String line(String event, Object... kv) {
    final var sb = new StringBuilder(64).append("event=").append(event);
    for (int i = 0; i + 1 < kv.length; i += 2) {
      final String value = render(kv[i + 1]);
      sb.append(' ').append(kv[i]).append('=');
      if (value.chars().anyMatch(c -> Character.isWhitespace(c) || c == '"')) {
        sb.append('"').append(value.replace("\"", "\\\"")).append('"');
      } else {
        sb.append(value);
      }
    }
    return sb.toString();
  }

  private static String render(Object value) {
    final String text = value instanceof Enum<?> || value instanceof Path || value instanceof CharSequence
        ? String.valueOf(value)
        : Formatting.preview(value);
    final String single = text.replace('\n', ' ').replace('\r', ' ').replace('\t', ' ');
    return single.length() > MAX_VALUE ? single.substring(0, MAX_VALUE) + "..." : single;
  }
}
