package io.github.simbo1905.shape;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable typed metadata attached to a node.
///
/// Every mutator returns a new store; the receiver is never changed, so a
/// store may be shared by any number of nodes.
public final class Annotations {

  public static final Annotations EMPTY = new Annotations(Map.of());

  private final Map<AnnotationKey<?>, Object> values;

  private Annotations(Map<AnnotationKey<?>, Object> values) {
    this.values = values;
  }

  public static <T> Annotations of(AnnotationKey<T> key, T value) {
    return EMPTY.with(key, value);
  }

  public <T> Optional<T> get(AnnotationKey<T> key) {
    Objects.requireNonNull(key, "key");
    final Object value = values.get(key);
    return value == null ? Optional.empty() : Optional.of(key.check(value));
  }

  public <T> Annotations with(AnnotationKey<T> key, T value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    key.check(value);
    final var copy = new LinkedHashMap<AnnotationKey<?>, Object>(values);
    copy.put(key, value);
    return new Annotations(Collections.unmodifiableMap(copy));
  }

  public Annotations without(AnnotationKey<?> key) {
    if (!values.containsKey(key)) {
      return this;
    }
    final var copy = new LinkedHashMap<AnnotationKey<?>, Object>(values);
    copy.remove(key);
    return copy.isEmpty() ? EMPTY : new Annotations(Collections.unmodifiableMap(copy));
  }

  /// Entries of `other` win over entries of this store.
  public Annotations merge(Annotations other) {
    Objects.requireNonNull(other, "other");
    if (other.values.isEmpty()) {
      return this;
    }
    if (values.isEmpty()) {
      return other;
    }
    final var copy = new LinkedHashMap<AnnotationKey<?>, Object>(values);
    copy.putAll(other.values);
    return new Annotations(Collections.unmodifiableMap(copy));
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public Set<AnnotationKey<?>> keys() {
    return values.keySet();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Annotations other && values.equals(other.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    final var sb = new StringBuilder("Annotations{");
    var first = true;
    for (var entry : values.entrySet()) {
      if (!first) {
        sb.append(", ");
      }
      sb.append(entry.getKey().name()).append('=').append(entry.getValue());
      first = false;
    }
    return sb.append('}').toString();
  }
}
