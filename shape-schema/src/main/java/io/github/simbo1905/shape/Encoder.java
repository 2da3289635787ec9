package io.github.simbo1905.shape;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/// Encoding entry points: Type values to their Encoded form.
///
/// Mirrors [Decoder]. Transformations run their encode function and struct
/// properties are written under their Encoded-side key. Excess keys are
/// dropped, or copied unchanged when the options preserve them.
public final class Encoder {

  private Encoder() {}

  public static <A, I> ParseResult<I> encodeUnknown(Schema<A, I> schema, Object value) {
    return encodeUnknown(schema, value, ParseOptions.DEFAULT);
  }

  public static <A, I> ParseResult<I> encodeUnknown(Schema<A, I> schema, Object value, ParseOptions options) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(options, "options");
    return Decoder.typed(Interpreter.runSync(schema.ast(), value, options, Direction.ENCODE));
  }

  public static <A, I> I encodeUnknownSync(Schema<A, I> schema, Object value) {
    return encodeUnknown(schema, value).getOrThrow();
  }

  public static <A, I> I encodeUnknownSync(Schema<A, I> schema, Object value, ParseOptions options) {
    return encodeUnknown(schema, value, options).getOrThrow();
  }

  public static <A, I> Optional<I> encodeUnknownOption(Schema<A, I> schema, Object value) {
    return encodeUnknown(schema, value).toOptional();
  }

  public static <A, I> CompletableFuture<ParseResult<I>> encodeUnknownAsync(Schema<A, I> schema, Object value) {
    return encodeUnknownAsync(schema, value, ParseOptions.DEFAULT);
  }

  public static <A, I> CompletableFuture<ParseResult<I>> encodeUnknownAsync(Schema<A, I> schema, Object value,
                                                                            ParseOptions options) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(options, "options");
    final CompletableFuture<ParseResult<Object>> future =
        Interpreter.runAsync(schema.ast(), value, options, Direction.ENCODE);
    @SuppressWarnings("unchecked") final CompletableFuture<ParseResult<I>> typed =
        (CompletableFuture<ParseResult<I>>) (CompletableFuture<?>) future;
    return typed;
  }

  public static <A, I> ParseResult<I> encode(Schema<A, I> schema, A value) {
    return encodeUnknown(schema, value);
  }

  public static <A, I> ParseResult<I> encode(Schema<A, I> schema, A value, ParseOptions options) {
    return encodeUnknown(schema, value, options);
  }

  public static <A, I> I encodeSync(Schema<A, I> schema, A value) {
    return encodeUnknownSync(schema, value);
  }
}
