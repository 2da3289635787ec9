package io.github.simbo1905.shape;

import java.math.BigDecimal;
import java.math.BigInteger;

/// Numeric helpers shared by literal matching, filters and number parsing.
///
/// Numbers of different boxed types compare by value. NaN never compares equal
/// and never satisfies an ordering bound.
final class Numbers {

  private Numbers() {}

  /// Exact decimal view, or `null` for NaN and the infinities.
  static BigDecimal toBigDecimal(Number n) {
    if (n instanceof BigDecimal bd) {
      return bd;
    }
    if (n instanceof BigInteger bi) {
      return new BigDecimal(bi);
    }
    if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
      return BigDecimal.valueOf(n.longValue());
    }
    final double d = n.doubleValue();
    if (Double.isNaN(d) || Double.isInfinite(d)) {
      return null;
    }
    return new BigDecimal(Double.toString(d));
  }

  static boolean isNaN(Number n) {
    return (n instanceof Double || n instanceof Float) && Double.isNaN(n.doubleValue());
  }

  static boolean isFinite(Number n) {
    return toBigDecimal(n) != null;
  }

  /// Three-way comparison, or `null` when either side is NaN.
  static Integer compare(Number a, Number b) {
    if (isNaN(a) || isNaN(b)) {
      return null;
    }
    final BigDecimal x = toBigDecimal(a);
    final BigDecimal y = toBigDecimal(b);
    if (x != null && y != null) {
      return x.compareTo(y);
    }
    return Double.compare(a.doubleValue(), b.doubleValue());
  }

  static boolean numericallyEqual(Number a, Number b) {
    final Integer c = compare(a, b);
    return c != null && c == 0;
  }

  static boolean isInteger(Number n) {
    if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte
        || n instanceof BigInteger) {
      return true;
    }
    final BigDecimal bd = toBigDecimal(n);
    return bd != null && bd.remainder(BigDecimal.ONE).signum() == 0;
  }

  /// Canonical text: integral values have no fraction digits, e.g. `30.0` gives `"30"`.
  static String format(Number n) {
    final BigDecimal bd = toBigDecimal(n);
    if (bd == null) {
      final double d = n.doubleValue();
      return Double.isNaN(d) ? "NaN" : (d > 0 ? "Infinity" : "-Infinity");
    }
    if (bd.signum() == 0) {
      return "0";
    }
    return bd.stripTrailingZeros().toPlainString();
  }

  /// Parses decimal text; integral text that fits a `long` becomes a `Long`, anything else a `Double`.
  static Number parse(String text) {
    final String s = text.trim();
    if (s.isEmpty()) {
      throw new NumberFormatException("empty string");
    }
    switch (s) {
      case "NaN":
        return Double.NaN;
      case "Infinity":
      case "+Infinity":
        return Double.POSITIVE_INFINITY;
      case "-Infinity":
        return Double.NEGATIVE_INFINITY;
      default:
        break;
    }
    try {
      return Long.parseLong(s);
    } catch (NumberFormatException notLong) {
      return Double.parseDouble(new BigDecimal(s).toString());
    }
  }
}
