package io.github.simbo1905.shape;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.Supplier;

/// Result of one interpreter step: already known, or pending on an effect.
///
/// Synchronous calls only ever see [Done]. Steps that hit an effectful
/// refinement or transform return [Pending] and the rest of the walk resumes
/// through `thenCompose`, so no thread blocks.
sealed interface Outcome permits Outcome.Done, Outcome.Pending {

  record Done(ParseResult<Object> result) implements Outcome {}

  record Pending(CompletableFuture<ParseResult<Object>> future) implements Outcome {}

  /// Receives the result of step `index`; returns false to stop iterating.
  @FunctionalInterface
  interface Sink {
    boolean accept(int index, ParseResult<Object> result);
  }

  static Outcome success(Object value) {
    return new Done(ParseResult.success(value));
  }

  static Outcome failure(ParseIssue issue) {
    return new Done(ParseResult.failure(issue));
  }

  static Outcome of(ParseResult<Object> result) {
    return new Done(result);
  }

  static Outcome pending(CompletableFuture<ParseResult<Object>> future) {
    return new Pending(future);
  }

  default Outcome then(Function<ParseResult<Object>, Outcome> next) {
    if (this instanceof Done done) {
      return next.apply(done.result());
    }
    final var pending = (Pending) this;
    return new Pending(pending.future().thenCompose(result -> next.apply(result).toFuture()));
  }

  /// Continues with the success value; failures pass through untouched.
  default Outcome flatMap(Function<Object, Outcome> next) {
    return then(result -> result instanceof ParseResult.Success<Object> success
        ? next.apply(success.value())
        : new Done(result));
  }

  default Outcome map(Function<Object, Object> f) {
    return flatMap(value -> success(f.apply(value)));
  }

  default CompletableFuture<ParseResult<Object>> toFuture() {
    if (this instanceof Done done) {
      return CompletableFuture.completedFuture(done.result());
    }
    return ((Pending) this).future();
  }

  /// The result of a synchronous walk.
  default ParseResult<Object> resultNow() {
    if (this instanceof Done done) {
      return done.result();
    }
    throw new IllegalStateException("synchronous walk produced a pending outcome");
  }

  /// Runs `count` steps strictly in order, feeding each result to `sink`, then `done`.
  /// A pending step suspends the loop and the remaining steps run when it completes.
  static Outcome iterate(int count, IntFunction<Outcome> step, Sink sink, Supplier<Outcome> done) {
    return iterateFrom(0, count, step, sink, done);
  }

  private static Outcome iterateFrom(int start, int count, IntFunction<Outcome> step, Sink sink,
                                     Supplier<Outcome> done) {
    for (int i = start; i < count; i++) {
      final Outcome outcome = step.apply(i);
      if (outcome instanceof Pending pending) {
        final int index = i;
        return new Pending(pending.future().thenCompose(result ->
            (sink.accept(index, result)
                ? iterateFrom(index + 1, count, step, sink, done)
                : done.get()).toFuture()));
      }
      if (!sink.accept(i, ((Done) outcome).result())) {
        return done.get();
      }
    }
    return done.get();
  }
}
