package io.github.simbo1905.shape;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/// Outcome of a decode, encode or validate call: a value or an issue tree.
public sealed interface ParseResult<A> permits ParseResult.Success, ParseResult.Failure {

  static <A> ParseResult<A> success(A value) {
    return new Success<>(value);
  }

  static <A> ParseResult<A> failure(ParseIssue issue) {
    return new Failure<>(issue);
  }

  /// Failure with a plain reason, for use inside fallible transform functions.
  /// The engine places it at the transformation's path.
  static <A> ParseResult<A> failure(String reason) {
    Objects.requireNonNull(reason, "reason");
    return new Failure<>(new ParseIssue.TransformFailed(Path.ROOT, Ast.Primitive.UNKNOWN, Undefined.INSTANCE,
        Optional.of(reason)));
  }

  boolean isSuccess();

  default boolean isFailure() {
    return !isSuccess();
  }

  Optional<A> toOptional();

  Optional<ParseIssue> issue();

  <B> ParseResult<B> map(Function<? super A, ? extends B> f);

  <B> ParseResult<B> flatMap(Function<? super A, ParseResult<B>> f);

  <R> R fold(Function<? super ParseIssue, ? extends R> onFailure, Function<? super A, ? extends R> onSuccess);

  /// The value, or a [ParseException] carrying the issue tree.
  A getOrThrow();

  default A getOrElse(A fallback) {
    return isSuccess() ? getOrThrow() : fallback;
  }

  record Success<A>(A value) implements ParseResult<A> {
    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public Optional<A> toOptional() {
      return Optional.ofNullable(value);
    }

    @Override
    public Optional<ParseIssue> issue() {
      return Optional.empty();
    }

    @Override
    public <B> ParseResult<B> map(Function<? super A, ? extends B> f) {
      return new Success<>(f.apply(value));
    }

    @Override
    public <B> ParseResult<B> flatMap(Function<? super A, ParseResult<B>> f) {
      return f.apply(value);
    }

    @Override
    public <R> R fold(Function<? super ParseIssue, ? extends R> onFailure, Function<? super A, ? extends R> onSuccess) {
      return onSuccess.apply(value);
    }

    @Override
    public A getOrThrow() {
      return value;
    }
  }

  record Failure<A>(ParseIssue cause) implements ParseResult<A> {
    public Failure {
      Objects.requireNonNull(cause, "cause");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public Optional<A> toOptional() {
      return Optional.empty();
    }

    @Override
    public Optional<ParseIssue> issue() {
      return Optional.of(cause);
    }

    @Override
    public <B> ParseResult<B> map(Function<? super A, ? extends B> f) {
      return new Failure<>(cause);
    }

    @Override
    public <B> ParseResult<B> flatMap(Function<? super A, ParseResult<B>> f) {
      return new Failure<>(cause);
    }

    @Override
    public <R> R fold(Function<? super ParseIssue, ? extends R> onFailure, Function<? super A, ? extends R> onSuccess) {
      return onFailure.apply(cause);
    }

    @Override
    public A getOrThrow() {
      throw new ParseException(cause);
    }
  }
}
