package io.github.simbo1905.shape;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Per-call engine options. There is no process-wide default beyond [#DEFAULT].
///
/// @param errors           stop at the first issue or collect all of them
/// @param onExcessProperty what a struct does with keys it does not declare
/// @param preserveKeyOrder order struct output by input key order instead of declaration order
/// @param maxDepth         nested suspend resolutions allowed before recursion is reported as an issue
public record ParseOptions(ErrorMode errors, ExcessPropertyMode onExcessProperty, boolean preserveKeyOrder,
                           int maxDepth) {

  public static final ParseOptions DEFAULT =
      new ParseOptions(ErrorMode.FIRST, ExcessPropertyMode.IGNORE, false, 512);

  public enum ErrorMode {
    FIRST,
    ALL
  }

  public enum ExcessPropertyMode {
    IGNORE,
    ERROR,
    PRESERVE
  }

  public ParseOptions {
    Objects.requireNonNull(errors, "errors");
    Objects.requireNonNull(onExcessProperty, "onExcessProperty");
    if (maxDepth <= 0) {
      throw new IllegalArgumentException("maxDepth must be > 0");
    }
  }

  public ParseOptions withErrors(ErrorMode mode) {
    return new ParseOptions(mode, onExcessProperty, preserveKeyOrder, maxDepth);
  }

  public ParseOptions withOnExcessProperty(ExcessPropertyMode mode) {
    return new ParseOptions(errors, mode, preserveKeyOrder, maxDepth);
  }

  public ParseOptions withPreserveKeyOrder(boolean preserve) {
    return new ParseOptions(errors, onExcessProperty, preserve, maxDepth);
  }

  public ParseOptions withMaxDepth(int depth) {
    return new ParseOptions(errors, onExcessProperty, preserveKeyOrder, depth);
  }

  /// Reads `errors`, `onExcessProperty`, `preserveKeyOrder` and `maxDepth` over [#DEFAULT].
  /// Unknown keys and values are rejected.
  public static ParseOptions fromMap(Map<String, ?> config) {
    Objects.requireNonNull(config, "config");
    var options = DEFAULT;
    for (Map.Entry<String, ?> entry : config.entrySet()) {
      final String key = entry.getKey();
      final Object value = entry.getValue();
      options = switch (key) {
        case "errors" -> options.withErrors(enumValue(ErrorMode.class, key, value));
        case "onExcessProperty" -> options.withOnExcessProperty(enumValue(ExcessPropertyMode.class, key, value));
        case "preserveKeyOrder" -> options.withPreserveKeyOrder(booleanValue(key, value));
        case "maxDepth" -> options.withMaxDepth(intValue(key, value));
        default -> throw new IllegalArgumentException("unknown parse option: " + key);
      };
    }
    return options;
  }

  public String summary() {
    return "errors=" + errors + ", onExcessProperty=" + onExcessProperty
        + ", preserveKeyOrder=" + preserveKeyOrder + ", maxDepth=" + maxDepth;
  }

  private static <E extends Enum<E>> E enumValue(Class<E> type, String key, Object value) {
    if (type.isInstance(value)) {
      return type.cast(value);
    }
    if (value instanceof String s) {
      try {
        return Enum.valueOf(type, s.toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("invalid value for " + key + ": " + s, e);
      }
    }
    throw new IllegalArgumentException("invalid value for " + key + ": " + value);
  }

  private static boolean booleanValue(String key, Object value) {
    if (value instanceof Boolean b) {
      return b;
    }
    if ("true".equals(value) || "false".equals(value)) {
      return Boolean.parseBoolean((String) value);
    }
    throw new IllegalArgumentException("invalid value for " + key + ": " + value);
  }

  private static int intValue(String key, Object value) {
    if (value instanceof Integer i) {
      return i;
    }
    if (value instanceof String s) {
      try {
        return Integer.parseInt(s.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("invalid value for " + key + ": " + s, e);
      }
    }
    throw new IllegalArgumentException("invalid value for " + key + ": " + value);
  }
}
