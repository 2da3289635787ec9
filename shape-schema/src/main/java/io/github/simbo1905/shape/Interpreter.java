package io.github.simbo1905.shape;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

import static io.github.simbo1905.shape.ShapeLogging.LOG;

/// Walks a node tree over a value in one [Direction].
///
/// One instance serves exactly one call. It owns the per-call caches (resolved
/// suspends, detected discriminators) and the cancellation token; nodes are only
/// read, so any number of interpreters may share a tree. Data problems never
/// throw: every step returns an [Outcome] holding a value or an issue.
final class Interpreter {

  /// Step output meaning "write no key".
  private static final Object ABSENT = new Object();

  private final ParseOptions options;
  private final boolean effectsAllowed;
  private final CancellationToken token;
  private final Map<Ast.Suspend, Ast> resolved = new IdentityHashMap<>();
  private final Map<Direction, Map<Ast.Union, Optional<Discriminator>>> discriminators =
      new EnumMap<>(Direction.class);

  Interpreter(ParseOptions options, boolean effectsAllowed, CancellationToken token) {
    this.options = options;
    this.effectsAllowed = effectsAllowed;
    this.token = token;
  }

  static ParseResult<Object> runSync(Ast ast, Object input, ParseOptions options, Direction direction) {
    StructuredLog.fine(LOG, "run.start", "direction", direction, "ast", ast.kind(), "options", options.summary());
    final var interpreter = new Interpreter(options, false, new CancellationToken());
    final ParseResult<Object> result = interpreter.run(Frame.root(ast, input, direction)).resultNow();
    StructuredLog.fine(LOG, "run.end", "direction", direction, "ok", result.isSuccess());
    return result;
  }

  /// Cancelling the returned future cancels every effect still running for this call.
  static CompletableFuture<ParseResult<Object>> runAsync(Ast ast, Object input, ParseOptions options,
                                                         Direction direction) {
    StructuredLog.fine(LOG, "run.async.start", "direction", direction, "ast", ast.kind(), "options", options.summary());
    final var token = new CancellationToken();
    final var outer = new CompletableFuture<ParseResult<Object>>();
    outer.whenComplete((result, error) -> {
      if (outer.isCancelled()) {
        LOG.fine(() -> "async " + direction + " cancelled by caller");
        token.cancel();
      }
    });
    final CompletableFuture<ParseResult<Object>> inner;
    try {
      inner = new Interpreter(options, true, token).run(Frame.root(ast, input, direction)).toFuture();
    } catch (RuntimeException e) {
      outer.completeExceptionally(e);
      return outer;
    }
    inner.whenComplete((result, error) -> {
      if (error != null) {
        outer.completeExceptionally(error);
      } else {
        StructuredLog.fine(LOG, "run.async.end", "direction", direction, "ok", result.isSuccess());
        outer.complete(result);
      }
    });
    return outer;
  }

  Outcome run(Frame frame) {
    final Ast ast = frame.ast();
    StructuredLog.finer(LOG, "step", "kind", ast.kind(), "direction", frame.direction(), "path", frame.path());
    return switch (ast.kind()) {
      case PRIMITIVE -> primitive((Ast.Primitive) ast, frame);
      case LITERAL -> literal((Ast.Literal) ast, frame);
      case STRUCT -> struct((Ast.Struct) ast, frame);
      case TUPLE -> tuple((Ast.TupleType) ast, frame);
      case RECORD -> recordType((Ast.RecordType) ast, frame);
      case UNION -> union((Ast.Union) ast, frame);
      case REFINEMENT -> refinement((Ast.Refinement) ast, frame);
      case TRANSFORMATION -> transformation((Ast.Transformation) ast, frame);
      case BRAND -> run(frame.with(((Ast.Brand) ast).from()));
      case SUSPEND -> suspend((Ast.Suspend) ast, frame);
    };
  }

  private Outcome primitive(Ast.Primitive node, Frame frame) {
    if (node.primitive().test(frame.input())) {
      return Outcome.success(frame.input());
    }
    return Outcome.failure(Issues.typeMismatch(node, frame.path(), frame.input()));
  }

  private Outcome literal(Ast.Literal node, Frame frame) {
    if (node.matches(frame.input())) {
      return Outcome.success(frame.input());
    }
    return Outcome.failure(Issues.typeMismatch(node, frame.path(), frame.input()));
  }

  // ------------------------------------------------------------------
  // Struct
  // ------------------------------------------------------------------

  private Outcome struct(Ast.Struct node, Frame frame) {
    if (!(frame.input() instanceof Map<?, ?> input)) {
      return Outcome.failure(Issues.typeMismatch(node, frame.path(), frame.input()));
    }
    final List<PropertySignature> properties = node.properties();
    final Direction direction = frame.direction();
    final var output = new LinkedHashMap<String, Object>();
    final var issues = new ArrayList<ParseIssue>();
    return Outcome.iterate(properties.size(),
        i -> property(properties.get(i), input, frame),
        (i, result) -> {
          if (result instanceof ParseResult.Failure<Object> failure) {
            issues.add(failure.cause());
            return options.errors() == ParseOptions.ErrorMode.ALL;
          }
          final Object value = ((ParseResult.Success<Object>) result).value();
          if (value != ABSENT) {
            output.put(outputKey(properties.get(i), direction), value);
          }
          return true;
        },
        () -> finishStruct(node, frame, input, output, issues));
  }

  private Outcome property(PropertySignature ps, Map<?, ?> input, Frame frame) {
    final String key = inputKey(ps, frame.direction());
    final Optional<Map.Entry<?, ?>> entry = entry(input, key);
    final boolean present = entry.isPresent();
    final Object value = present ? entry.get().getValue() : null;
    final Path path = frame.path().append(key);
    StructuredLog.finest(LOG, "property", "key", key, "present", present, "policy", ps.optionality());
    if (frame.direction() == Direction.DECODE) {
      return decodeProperty(ps, present, value, path, frame);
    }
    return typeSideProperty(ps, present, value, path, frame);
  }

  private Outcome decodeProperty(PropertySignature ps, boolean present, Object value, Path path, Frame frame) {
    final boolean treatAsMissing = !present
        || (value == Undefined.INSTANCE && ps.acceptsUndefined() && ps.optionality() != Optionality.OPTIONAL)
        || (value == null && ps.nullable());
    return switch (ps.optionality()) {
      case REQUIRED -> present
          ? run(new Frame(ps.type(), value, path, frame.depth(), frame.direction()))
          : Outcome.failure(Issues.missing(ps, path));
      case OPTIONAL, OPTIONAL_EXACT -> {
        if (treatAsMissing) {
          yield Outcome.success(ABSENT);
        }
        if (value == Undefined.INSTANCE && ps.acceptsUndefined()) {
          yield Outcome.success(Undefined.INSTANCE);
        }
        yield run(new Frame(ps.type(), value, path, frame.depth(), frame.direction()));
      }
      case OPTIONAL_WITH_DEFAULT -> treatAsMissing
          ? applyDefault(ps, path)
          : run(new Frame(ps.type(), value, path, frame.depth(), frame.direction()));
      case OPTIONAL_AS_CONTAINER -> treatAsMissing
          ? Outcome.success(Optional.empty())
          : run(new Frame(ps.type(), value, path, frame.depth(), frame.direction())).map(Optional::ofNullable);
    };
  }

  /// Encode and validate: the input is a Type value keyed by property name.
  private Outcome typeSideProperty(PropertySignature ps, boolean present, Object value, Path path, Frame frame) {
    final Direction direction = frame.direction();
    return switch (ps.optionality()) {
      case REQUIRED, OPTIONAL_WITH_DEFAULT -> present
          ? run(new Frame(ps.type(), value, path, frame.depth(), direction))
          : Outcome.failure(Issues.missing(ps, path));
      case OPTIONAL, OPTIONAL_EXACT -> {
        if (!present) {
          yield Outcome.success(ABSENT);
        }
        if (value == Undefined.INSTANCE && ps.acceptsUndefined()) {
          yield Outcome.success(Undefined.INSTANCE);
        }
        yield run(new Frame(ps.type(), value, path, frame.depth(), direction));
      }
      case OPTIONAL_AS_CONTAINER -> {
        if (!present) {
          yield Outcome.failure(Issues.missing(ps, path));
        }
        if (!(value instanceof Optional<?> container)) {
          yield Outcome.failure(Issues.typeMismatch(ps.type(), path, value,
              "Expected Optional<" + Formatting.describe(ps.type()) + ">, actual " + Formatting.preview(value)));
        }
        if (container.isEmpty()) {
          yield Outcome.success(direction == Direction.ENCODE ? ABSENT : Optional.empty());
        }
        final Outcome inner = run(new Frame(ps.type(), container.get(), path, frame.depth(), direction));
        yield direction == Direction.ENCODE ? inner : inner.map(Optional::ofNullable);
      }
    };
  }

  private Outcome applyDefault(PropertySignature ps, Path path) {
    try {
      return Outcome.success(ps.decodeDefault().get());
    } catch (RuntimeException e) {
      LOG.fine(() -> "default value for " + path + " failed: " + e);
      return Outcome.failure(Issues.typeMismatch(ps.type(), path, Undefined.INSTANCE,
          "Default value could not be computed: " + e.getMessage()));
    }
  }

  private Outcome finishStruct(Ast.Struct node, Frame frame, Map<?, ?> input, Map<String, Object> output,
                               List<ParseIssue> issues) {
    final boolean all = options.errors() == ParseOptions.ErrorMode.ALL;
    if (!issues.isEmpty() && !all) {
      return Outcome.failure(issues.get(0));
    }
    final Direction direction = frame.direction();
    final var known = new LinkedHashSet<String>();
    node.properties().forEach(ps -> known.add(inputKey(ps, direction)));
    for (Map.Entry<?, ?> entry : input.entrySet()) {
      final Object key = entry.getKey();
      if (key instanceof String s && known.contains(s)) {
        continue;
      }
      switch (options.onExcessProperty()) {
        case IGNORE -> {
          // dropped
        }
        case PRESERVE -> output.putIfAbsent(String.valueOf(key), entry.getValue());
        case ERROR -> {
          if (direction == Direction.ENCODE) {
            continue;
          }
          final ParseIssue issue = Issues.unexpected(node, frame.path().append(key), entry.getValue(),
              List.copyOf(known));
          if (!all) {
            return Outcome.failure(issue);
          }
          issues.add(issue);
        }
      }
    }
    if (!issues.isEmpty()) {
      return Outcome.failure(Issues.collapse(node, frame.path(), input, issues));
    }
    final Map<String, Object> ordered = options.preserveKeyOrder() ? inputOrder(node, direction, input, output) : output;
    return Outcome.success(node.mutable() ? ordered : Collections.unmodifiableMap(ordered));
  }

  private static Map<String, Object> inputOrder(Ast.Struct node, Direction direction, Map<?, ?> input,
                                                Map<String, Object> output) {
    final var inToOut = new HashMap<String, String>();
    node.properties().forEach(ps -> inToOut.put(inputKey(ps, direction), outputKey(ps, direction)));
    final var ordered = new LinkedHashMap<String, Object>();
    for (Object key : input.keySet()) {
      final String name = String.valueOf(key);
      final String out = inToOut.getOrDefault(name, name);
      if (output.containsKey(out) && !ordered.containsKey(out)) {
        ordered.put(out, output.get(out));
      }
    }
    output.forEach(ordered::putIfAbsent);
    return ordered;
  }

  /// The entry for `key`, also for sorted maps whose comparator cannot take a string.
  private static Optional<Map.Entry<?, ?>> entry(Map<?, ?> map, String key) {
    try {
      return map.containsKey(key)
          ? Optional.of(new AbstractMap.SimpleImmutableEntry<Object, Object>(key, map.get(key)))
          : Optional.empty();
    } catch (ClassCastException | NullPointerException e) {
      LOG.finest(() -> "keyed lookup of " + key + " rejected by " + map.getClass().getName() + ", scanning entries");
      for (Map.Entry<?, ?> candidate : map.entrySet()) {
        if (key.equals(candidate.getKey())) {
          return Optional.of(candidate);
        }
      }
      return Optional.empty();
    }
  }

  private static String inputKey(PropertySignature ps, Direction direction) {
    return direction == Direction.DECODE ? ps.encodedKey() : ps.name();
  }

  private static String outputKey(PropertySignature ps, Direction direction) {
    return direction == Direction.ENCODE ? ps.encodedKey() : ps.name();
  }

  // ------------------------------------------------------------------
  // Tuple, array and record
  // ------------------------------------------------------------------

  private Outcome tuple(Ast.TupleType node, Frame frame) {
    if (!(frame.input() instanceof List<?> input)) {
      return Outcome.failure(Issues.typeMismatch(node, frame.path(), frame.input()));
    }
    final int size = input.size();
    final List<Ast.TupleType.Element> elements = node.elements();
    final List<Ast> rest = node.rest();
    final int trailing = rest.isEmpty() ? 0 : rest.size() - 1;
    if (size < node.requiredElementCount() + trailing || (rest.isEmpty() && size > elements.size())) {
      return Outcome.failure(Issues.typeMismatch(node, frame.path(), input));
    }
    final int head = Math.min(elements.size(), size - trailing);
    final var plan = new ArrayList<Ast>(size);
    for (int i = 0; i < size; i++) {
      if (i < head) {
        plan.add(elements.get(i).type());
      } else if (i < size - trailing) {
        plan.add(rest.get(0));
      } else {
        plan.add(rest.get(1 + i - (size - trailing)));
      }
    }
    final var output = new ArrayList<Object>(Collections.nCopies(size, null));
    final var issues = new ArrayList<ParseIssue>();
    return Outcome.iterate(size,
        i -> run(frame.child(plan.get(i), input.get(i), i)),
        (i, result) -> {
          if (result instanceof ParseResult.Failure<Object> failure) {
            issues.add(failure.cause());
            return options.errors() == ParseOptions.ErrorMode.ALL;
          }
          output.set(i, ((ParseResult.Success<Object>) result).value());
          return true;
        },
        () -> issues.isEmpty()
            ? Outcome.success(node.mutable() ? output : Collections.unmodifiableList(output))
            : Outcome.failure(Issues.collapse(node, frame.path(), input, issues)));
  }

  private Outcome recordType(Ast.RecordType node, Frame frame) {
    if (!(frame.input() instanceof Map<?, ?> input)) {
      return Outcome.failure(Issues.typeMismatch(node, frame.path(), frame.input()));
    }
    final List<Map.Entry<?, ?>> entries = new ArrayList<>(input.entrySet());
    final var output = new LinkedHashMap<Object, Object>();
    final var issues = new ArrayList<ParseIssue>();
    return Outcome.iterate(entries.size(),
        i -> {
          final Map.Entry<?, ?> entry = entries.get(i);
          return run(frame.child(node.key(), entry.getKey(), entry.getKey()))
              .flatMap(key -> run(frame.child(node.value(), entry.getValue(), entry.getKey()))
                  .map(value -> new AbstractMap.SimpleEntry<>(key, value)));
        },
        (i, result) -> {
          if (result instanceof ParseResult.Failure<Object> failure) {
            issues.add(failure.cause());
            return options.errors() == ParseOptions.ErrorMode.ALL;
          }
          final var entry = (Map.Entry<?, ?>) ((ParseResult.Success<Object>) result).value();
          output.put(entry.getKey(), entry.getValue());
          return true;
        },
        () -> issues.isEmpty()
            ? Outcome.success(node.mutable() ? output : Collections.unmodifiableMap(output))
            : Outcome.failure(Issues.collapse(node, frame.path(), input, issues)));
  }

  // ------------------------------------------------------------------
  // Union
  // ------------------------------------------------------------------

  private Outcome union(Ast.Union node, Frame frame) {
    final Optional<Discriminator> discriminator = discriminator(node, frame.direction());
    final Optional<Map.Entry<?, ?>> tagEntry = discriminator.isPresent() && frame.input() instanceof Map<?, ?> map
        ? entry(map, discriminator.get().key())
        : Optional.empty();
    if (tagEntry.isPresent()) {
      final String key = discriminator.get().key();
      final Object tag = tagEntry.get().getValue();
      final Optional<Ast> member = discriminator.get().lookup(tag);
      StructuredLog.finer(LOG, "union.discriminated", "key", key, "tag", tag, "matched", member.isPresent());
      if (member.isPresent()) {
        return run(frame.with(member.get()));
      }
      return Outcome.failure(Issues.typeMismatch(discriminator.get().expected(), frame.path().append(key), tag));
    }
    final List<Ast> members = node.members();
    final var issues = new ArrayList<ParseIssue>(members.size());
    final var winner = new Object[] {ABSENT};
    return Outcome.iterate(members.size(),
        i -> run(frame.with(members.get(i))),
        (i, result) -> {
          if (result instanceof ParseResult.Success<Object> success) {
            winner[0] = success.value();
            return false;
          }
          issues.add(((ParseResult.Failure<Object>) result).cause());
          return true;
        },
        () -> winner[0] != ABSENT
            ? Outcome.success(winner[0])
            : Outcome.failure(Issues.composite(node, frame.path(), frame.input(), issues)));
  }

  private Optional<Discriminator> discriminator(Ast.Union node, Direction direction) {
    return discriminators.computeIfAbsent(direction, d -> new IdentityHashMap<>())
        .computeIfAbsent(node, union -> Discriminator.detect(union, direction));
  }

  // ------------------------------------------------------------------
  // Refinement
  // ------------------------------------------------------------------

  /// Decode checks the decoded value. Encode checks the Type value before `from`
  /// encodes it; validate checks the value as is.
  private Outcome refinement(Ast.Refinement node, Frame frame) {
    if (frame.direction() == Direction.ENCODE) {
      return run(frame.as(Direction.VALIDATE, node.from(), frame.input()))
          .flatMap(value -> check(node, value, frame))
          .flatMap(checked -> run(frame.with(node.from())));
    }
    return run(frame.with(node.from())).flatMap(value -> check(node, value, frame));
  }

  private Outcome check(Ast.Refinement node, Object value, Frame frame) {
    if (node.check() instanceof Ast.Refinement.Check.Sync sync) {
      try {
        return sync.predicate().test(value)
            ? Outcome.success(value)
            : Outcome.failure(Issues.forbidden(node, frame.path(), value, null));
      } catch (RuntimeException e) {
        LOG.fine(() -> "predicate threw at " + frame.path() + ": " + e);
        return Outcome.failure(Issues.forbidden(node, frame.path(), value, String.valueOf(e.getMessage())));
      }
    }
    if (node.check() instanceof Ast.Refinement.Check.OptionalOf optionalOf) {
      if (!(value instanceof Optional<?> container)) {
        return Outcome.failure(Issues.forbidden(node, frame.path(), value, null));
      }
      return container.isEmpty()
          ? Outcome.success(value)
          : run(frame.as(Direction.VALIDATE, optionalOf.content(), container.get())).map(content -> value);
    }
    final var effectful = (Ast.Refinement.Check.Effectful) node.check();
    if (!effectsAllowed) {
      return Outcome.failure(Issues.forbidden(node, frame.path(), value,
          "effectful refinement cannot be evaluated synchronously"));
    }
    return Outcome.pending(effect(() -> effectful.predicate().apply(value, token)).handle((accepted, error) -> {
      if (error != null) {
        final Throwable cause = rethrowCancellation(error);
        return ParseResult.failure(Issues.forbidden(node, frame.path(), value, String.valueOf(cause.getMessage())));
      }
      return Boolean.TRUE.equals(accepted)
          ? ParseResult.success(value)
          : ParseResult.failure(Issues.forbidden(node, frame.path(), value, null));
    }));
  }

  // ------------------------------------------------------------------
  // Transformation
  // ------------------------------------------------------------------

  private Outcome transformation(Ast.Transformation node, Frame frame) {
    return switch (frame.direction()) {
      case DECODE -> run(frame.with(node.from()))
          .flatMap(encoded -> apply(node, node.decode(), encoded, frame))
          .flatMap(decoded -> run(frame.as(Direction.VALIDATE, node.to(), decoded)));
      case ENCODE -> run(frame.as(Direction.VALIDATE, node.to(), frame.input()))
          .flatMap(value -> apply(node, node.encode(), value, frame))
          .flatMap(encoded -> run(frame.with(node.from(), encoded)));
      case VALIDATE -> run(frame.with(node.to()));
    };
  }

  private Outcome apply(Ast.Transformation node, TransformFunction function, Object value, Frame frame) {
    if (function instanceof TransformFunction.Total total) {
      try {
        return Outcome.success(total.function().apply(value));
      } catch (RuntimeException e) {
        LOG.fine(() -> "transform threw at " + frame.path() + ": " + e);
        return Outcome.failure(Issues.transformFailed(node, frame.path(), value, String.valueOf(e.getMessage())));
      }
    }
    if (function instanceof TransformFunction.Fallible fallible) {
      try {
        return Outcome.of(adopt(node, frame, value, fallible.function().apply(value)));
      } catch (RuntimeException e) {
        LOG.fine(() -> "transform threw at " + frame.path() + ": " + e);
        return Outcome.failure(Issues.transformFailed(node, frame.path(), value, String.valueOf(e.getMessage())));
      }
    }
    if (function instanceof TransformFunction.Composed composed) {
      return run(frame.with(composed.through(), value));
    }
    final var effectful = (TransformFunction.Effectful) function;
    if (!effectsAllowed) {
      return Outcome.failure(Issues.transformFailed(node, frame.path(), value,
          "effectful transformation cannot be evaluated synchronously"));
    }
    return Outcome.pending(effect(() -> effectful.function().apply(value, token)).handle((result, error) -> {
      if (error != null) {
        final Throwable cause = rethrowCancellation(error);
        return ParseResult.failure(Issues.transformFailed(node, frame.path(), value, String.valueOf(cause.getMessage())));
      }
      return adopt(node, frame, value, result);
    }));
  }

  /// Places a failure returned by a transform function at the transformation's path.
  private static ParseResult<Object> adopt(Ast.Transformation node, Frame frame, Object value,
                                           ParseResult<Object> result) {
    if (result == null) {
      return ParseResult.failure(Issues.transformFailed(node, frame.path(), value, "transformation returned no result"));
    }
    if (result instanceof ParseResult.Failure<Object> failure) {
      final ParseIssue issue = failure.cause();
      if (issue instanceof ParseIssue.TransformFailed detached && detached.path().isRoot()) {
        return ParseResult.failure(Issues.transformFailed(node, frame.path(), value, detached.message().orElse(null)));
      }
      return ParseResult.failure(issue.under(frame.path()));
    }
    return result;
  }

  // ------------------------------------------------------------------
  // Suspend
  // ------------------------------------------------------------------

  private Outcome suspend(Ast.Suspend node, Frame frame) {
    if (frame.depth() >= options.maxDepth()) {
      LOG.fine(() -> "recursion limit " + options.maxDepth() + " reached at " + frame.path());
      return Outcome.failure(Issues.typeMismatch(node, frame.path(), frame.input(),
          "Maximum recursion depth of " + options.maxDepth() + " exceeded"));
    }
    Ast target = resolved.get(node);
    if (target == null) {
      try {
        target = node.resolve();
      } catch (RuntimeException e) {
        LOG.fine(() -> "suspended schema failed to resolve at " + frame.path() + ": " + e);
        return Outcome.failure(Issues.typeMismatch(node, frame.path(), frame.input(),
            "Suspended schema could not be resolved: " + e.getMessage()));
      }
      resolved.put(node, target);
    }
    return run(frame.deeper(target));
  }

  // ------------------------------------------------------------------
  // Effects
  // ------------------------------------------------------------------

  private <T> CompletableFuture<T> effect(Supplier<? extends CompletionStage<T>> call) {
    if (token.isCancelled()) {
      return CompletableFuture.failedFuture(new CancellationException("cancelled"));
    }
    final CompletionStage<T> stage;
    try {
      stage = call.get();
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
    if (stage == null) {
      return CompletableFuture.failedFuture(new IllegalStateException("effect returned no completion stage"));
    }
    return token.track(stage.toCompletableFuture());
  }

  /// Cancellation ends the whole call; any other failure becomes an issue.
  private static Throwable rethrowCancellation(Throwable error) {
    final Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    if (cause instanceof CancellationException cancellation) {
      throw cancellation;
    }
    return cause;
  }
}
