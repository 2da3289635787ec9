package io.github.simbo1905.shape;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Supplier;

/// Typed key into an [Annotations] store.
///
/// Keys compare by identity so two keys with the same name stay distinct. The
/// recognized keys below are read by the engine (for messages) or by external
/// consumers walking the node tree.
public final class AnnotationKey<T> {

  /// Stable name used in place of the structural description of a node.
  public static final AnnotationKey<String> IDENTIFIER = of("identifier", String.class);
  public static final AnnotationKey<String> TITLE = of("title", String.class);
  /// Human wording of the expected shape, e.g. "a string at least 1 character(s) long".
  public static final AnnotationKey<String> DESCRIPTION = of("description", String.class);
  public static final AnnotationKey<List<?>> EXAMPLES = of("examples", List.class);
  public static final AnnotationKey<Object> DEFAULT = of("default", Object.class);
  /// Replaces the default message of an issue raised at the annotated node.
  public static final AnnotationKey<Function<ParseIssue, String>> MESSAGE = of("message", Function.class);
  /// Replaces "is missing" for a property signature.
  public static final AnnotationKey<Supplier<String>> MISSING_MESSAGE = of("missingMessage", Supplier.class);
  public static final AnnotationKey<Map<String, Object>> JSON_SCHEMA = of("jsonSchema", Map.class);
  public static final AnnotationKey<Function<Random, Object>> ARBITRARY = of("arbitrary", Function.class);
  public static final AnnotationKey<Function<Object, String>> PRETTY = of("pretty", Function.class);
  public static final AnnotationKey<BiPredicate<Object, Object>> EQUIVALENCE = of("equivalence", BiPredicate.class);

  private final String name;
  private final Class<?> rawType;

  private AnnotationKey(String name, Class<?> rawType) {
    this.name = name;
    this.rawType = rawType;
  }

  /// Declares a key. `rawType` is checked when a value is stored.
  public static <T> AnnotationKey<T> of(String name, Class<?> rawType) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(rawType, "rawType");
    return new AnnotationKey<>(name, rawType);
  }

  public String name() {
    return name;
  }

  T check(Object value) {
    if (!rawType.isInstance(value)) {
      throw new IllegalArgumentException("annotation '" + name + "' expects " + rawType.getSimpleName()
          + " but got " + (value == null ? "null" : value.getClass().getSimpleName()));
    }
    @SuppressWarnings("unchecked") final T typed = (T) value;
    return typed;
  }

  @Override
  public String toString() {
    return "AnnotationKey[" + name + "]";
  }
}
