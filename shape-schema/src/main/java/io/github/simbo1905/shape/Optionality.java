package io.github.simbo1905.shape;

/// How a struct property treats a missing key.
public enum Optionality {
  /// Key must be present.
  REQUIRED,
  /// Key may be missing or hold undefined.
  OPTIONAL,
  /// Key may be missing; a present key must hold a valid value.
  OPTIONAL_EXACT,
  /// Missing key decodes to a default value; the Type side always has the key.
  OPTIONAL_WITH_DEFAULT,
  /// Missing key decodes to `Optional.empty()`, a present value to `Optional.of(value)`.
  OPTIONAL_AS_CONTAINER
}
