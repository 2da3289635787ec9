package io.github.simbo1905.shape;

import java.util.Objects;
import java.util.function.Supplier;

/// A property signature still waiting for its name; [Schemas#field] supplies it.
public record PropertySchema(Ast type, Optionality optionality, boolean exact, boolean nullable, String fromKey,
                             Supplier<?> decodeDefault, Supplier<?> constructorDefault, Annotations annotations) {

  public PropertySchema {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(optionality, "optionality");
    Objects.requireNonNull(annotations, "annotations");
  }

  static PropertySchema required(Ast type) {
    return new PropertySchema(type, Optionality.REQUIRED, false, false, null, null, null, Annotations.EMPTY);
  }

  static PropertySchema optional(Ast type, OptionalOptions options) {
    return new PropertySchema(type, options.optionality(), options.exact(), options.nullable(), null,
        options.defaultValue(), null, Annotations.EMPTY);
  }

  /// Reads and writes the value under `key` on the Encoded side.
  public PropertySchema fromKey(String key) {
    return new PropertySchema(type, optionality, exact, nullable, Objects.requireNonNull(key, "key"), decodeDefault,
        constructorDefault, annotations);
  }

  /// Value used by [Schema#make] when the key is absent.
  public PropertySchema withConstructorDefault(Supplier<?> thunk) {
    return new PropertySchema(type, optionality, exact, nullable, fromKey, decodeDefault,
        Objects.requireNonNull(thunk, "thunk"), annotations);
  }

  /// Message used instead of "is missing".
  public PropertySchema missingMessage(Supplier<String> message) {
    return annotations(Annotations.of(AnnotationKey.MISSING_MESSAGE, message));
  }

  public PropertySchema annotations(Annotations more) {
    return new PropertySchema(type, optionality, exact, nullable, fromKey, decodeDefault, constructorDefault,
        annotations.merge(more));
  }

  PropertySignature named(String name) {
    return new PropertySignature(name, type, optionality, exact, nullable, fromKey, decodeDefault,
        constructorDefault, annotations);
  }
}
