package io.github.simbo1905.shape;

import java.util.Objects;
import java.util.function.Supplier;

/// Policy of an optional struct property.
///
/// `exact` rejects a present undefined; `nullable` treats a present null as
/// missing; `defaultValue` fills a missing key when decoding; `asContainer`
/// decodes to [java.util.Optional]. A default and a container cannot be combined.
public record OptionalOptions(boolean exact, boolean nullable, Supplier<?> defaultValue, boolean asContainer) {

  public static final OptionalOptions DEFAULT = new OptionalOptions(false, false, null, false);

  public OptionalOptions {
    if (defaultValue != null && asContainer) {
      throw new IllegalArgumentException("an optional property cannot have both a default and asContainer");
    }
  }

  public OptionalOptions withExact() {
    return new OptionalOptions(true, nullable, defaultValue, asContainer);
  }

  public OptionalOptions withNullable() {
    return new OptionalOptions(exact, true, defaultValue, asContainer);
  }

  public OptionalOptions withDefault(Supplier<?> thunk) {
    return new OptionalOptions(exact, nullable, Objects.requireNonNull(thunk, "thunk"), asContainer);
  }

  public OptionalOptions withAsContainer() {
    return new OptionalOptions(exact, nullable, defaultValue, true);
  }

  Optionality optionality() {
    if (asContainer) {
      return Optionality.OPTIONAL_AS_CONTAINER;
    }
    if (defaultValue != null) {
      return Optionality.OPTIONAL_WITH_DEFAULT;
    }
    return exact ? Optionality.OPTIONAL_EXACT : Optionality.OPTIONAL;
  }
}
