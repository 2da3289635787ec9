package io.github.simbo1905.shape;

import java.math.BigInteger;
import java.util.Locale;

/// Base type tags of [Ast.Primitive] and the runtime test for each.
public enum PrimitiveKind {
  STRING,
  NUMBER,
  BOOLEAN,
  BIGINT,
  SYMBOL,
  NULL,
  UNDEFINED,
  UNKNOWN,
  NEVER,
  OBJECT;

  /// True when `value` is a carrier of this base type.
  public boolean test(Object value) {
    return switch (this) {
      case STRING -> value instanceof String;
      case NUMBER -> value instanceof Number && !(value instanceof BigInteger);
      case BOOLEAN -> value instanceof Boolean;
      case BIGINT -> value instanceof BigInteger;
      case SYMBOL -> value instanceof Symbol;
      case NULL -> value == null;
      case UNDEFINED -> value == Undefined.INSTANCE;
      case UNKNOWN -> true;
      case NEVER -> false;
      case OBJECT -> value != null && !isScalar(value);
    };
  }

  /// Name used when describing an expected shape, e.g. `string`.
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  static boolean isScalar(Object value) {
    return value instanceof String
        || value instanceof Number
        || value instanceof Boolean
        || value instanceof Symbol
        || value instanceof Undefined;
  }
}
