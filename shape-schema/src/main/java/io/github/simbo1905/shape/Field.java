package io.github.simbo1905.shape;

import java.util.Objects;

/// Name and property schema, as passed to [Schemas#struct].
public record Field(String name, PropertySchema property) {
  public Field {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(property, "property");
  }

  PropertySignature signature() {
    return property.named(name);
  }
}
