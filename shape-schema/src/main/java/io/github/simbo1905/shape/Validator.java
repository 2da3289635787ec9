package io.github.simbo1905.shape;

import java.util.Objects;
import java.util.function.Predicate;

/// Type-side checks. No transform function runs: a transformation is checked
/// against its `to` side and refinements against their predicates.
public final class Validator {

  private Validator() {}

  public static <A, I> ParseResult<A> validate(Schema<A, I> schema, Object value) {
    return validate(schema, value, ParseOptions.DEFAULT);
  }

  public static <A, I> ParseResult<A> validate(Schema<A, I> schema, Object value, ParseOptions options) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(options, "options");
    return Decoder.typed(Interpreter.runSync(schema.ast(), value, options, Direction.VALIDATE));
  }

  public static boolean isValid(Schema<?, ?> schema, Object value) {
    return isValid(schema, value, ParseOptions.DEFAULT);
  }

  public static boolean isValid(Schema<?, ?> schema, Object value, ParseOptions options) {
    return validate(schema, value, options).isSuccess();
  }

  /// @throws ParseException when `value` is not a valid Type value
  public static void assertValid(Schema<?, ?> schema, Object value) {
    validate(schema, value).getOrThrow();
  }

  public static void assertValid(Schema<?, ?> schema, Object value, ParseOptions options) {
    validate(schema, value, options).getOrThrow();
  }

  /// Type guard for use with streams and filters.
  public static Predicate<Object> is(Schema<?, ?> schema) {
    Objects.requireNonNull(schema, "schema");
    return value -> isValid(schema, value);
  }
}
