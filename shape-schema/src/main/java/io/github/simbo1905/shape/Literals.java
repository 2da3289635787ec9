package io.github.simbo1905.shape;

import java.math.BigInteger;

/// Equality used by literal nodes and discriminator lookup.
final class Literals {

  private Literals() {}

  static boolean isLiteralValue(Object value) {
    return value == null || value instanceof String || value instanceof Boolean || value instanceof Number;
  }

  /// `bigint` literals only equal `BigInteger` values; other numbers compare numerically.
  static boolean equal(Object literal, Object value) {
    if (literal == null || value == null) {
      return literal == value;
    }
    if (literal instanceof BigInteger) {
      return value instanceof BigInteger && literal.equals(value);
    }
    if (literal instanceof Number a) {
      return value instanceof Number b && !(value instanceof BigInteger) && Numbers.numericallyEqual(a, b);
    }
    return literal.equals(value);
  }
}
