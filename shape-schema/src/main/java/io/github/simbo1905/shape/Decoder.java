package io.github.simbo1905.shape;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/// Decoding entry points: Encoded (or untrusted) input to Type values.
///
/// The `decodeUnknown` family accepts any input and never throws for bad data;
/// the `Sync` variants throw [ParseException] instead of returning a failure.
/// Effectful refinements and transformations need the `Async` variants.
public final class Decoder {

  private Decoder() {}

  public static <A, I> ParseResult<A> decodeUnknown(Schema<A, I> schema, Object input) {
    return decodeUnknown(schema, input, ParseOptions.DEFAULT);
  }

  public static <A, I> ParseResult<A> decodeUnknown(Schema<A, I> schema, Object input, ParseOptions options) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(options, "options");
    return typed(Interpreter.runSync(schema.ast(), input, options, Direction.DECODE));
  }

  public static <A, I> A decodeUnknownSync(Schema<A, I> schema, Object input) {
    return decodeUnknown(schema, input).getOrThrow();
  }

  public static <A, I> A decodeUnknownSync(Schema<A, I> schema, Object input, ParseOptions options) {
    return decodeUnknown(schema, input, options).getOrThrow();
  }

  public static <A, I> Optional<A> decodeUnknownOption(Schema<A, I> schema, Object input) {
    return decodeUnknown(schema, input).toOptional();
  }

  public static <A, I> Optional<A> decodeUnknownOption(Schema<A, I> schema, Object input, ParseOptions options) {
    return decodeUnknown(schema, input, options).toOptional();
  }

  /// Completes when every effect has finished; cancelling the future cancels them.
  public static <A, I> CompletableFuture<ParseResult<A>> decodeUnknownAsync(Schema<A, I> schema, Object input) {
    return decodeUnknownAsync(schema, input, ParseOptions.DEFAULT);
  }

  public static <A, I> CompletableFuture<ParseResult<A>> decodeUnknownAsync(Schema<A, I> schema, Object input,
                                                                            ParseOptions options) {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(options, "options");
    final CompletableFuture<ParseResult<Object>> future =
        Interpreter.runAsync(schema.ast(), input, options, Direction.DECODE);
    @SuppressWarnings("unchecked") final CompletableFuture<ParseResult<A>> typed =
        (CompletableFuture<ParseResult<A>>) (CompletableFuture<?>) future;
    return typed;
  }

  /// Decodes a value already typed as the Encoded side.
  public static <A, I> ParseResult<A> decode(Schema<A, I> schema, I input) {
    return decodeUnknown(schema, input);
  }

  public static <A, I> ParseResult<A> decode(Schema<A, I> schema, I input, ParseOptions options) {
    return decodeUnknown(schema, input, options);
  }

  public static <A, I> A decodeSync(Schema<A, I> schema, I input) {
    return decodeUnknownSync(schema, input);
  }

  @SuppressWarnings("unchecked")
  static <A> ParseResult<A> typed(ParseResult<Object> result) {
    return (ParseResult<A>) (ParseResult<?>) result;
  }
}
