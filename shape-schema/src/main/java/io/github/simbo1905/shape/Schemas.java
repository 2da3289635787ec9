package io.github.simbo1905.shape;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.logging.Level;

import static io.github.simbo1905.shape.ShapeLogging.LOG;

/// Combinators that build schemas. Every method returns a new schema and
/// leaves its arguments untouched.
public final class Schemas {

  private static final Schema<String, String> STRING = new Schema<>(Ast.Primitive.STRING);
  private static final Schema<Number, Number> NUMBER = new Schema<>(Ast.Primitive.NUMBER);
  private static final Schema<Boolean, Boolean> BOOLEAN = new Schema<>(Ast.Primitive.BOOLEAN);
  private static final Schema<BigInteger, BigInteger> BIGINT = new Schema<>(Ast.Primitive.BIGINT);
  private static final Schema<Symbol, Symbol> SYMBOL = new Schema<>(Ast.Primitive.SYMBOL);
  private static final Schema<Void, Void> NULL = new Schema<>(Ast.Primitive.NULL);
  private static final Schema<Undefined, Undefined> UNDEFINED = new Schema<>(Ast.Primitive.UNDEFINED);
  private static final Schema<Object, Object> UNKNOWN = new Schema<>(Ast.Primitive.UNKNOWN);
  private static final Schema<Void, Void> NEVER = new Schema<>(Ast.Primitive.NEVER);
  private static final Schema<Object, Object> OBJECT = new Schema<>(Ast.Primitive.OBJECT);

  private Schemas() {}

  public static Schema<String, String> string() {
    return STRING;
  }

  public static Schema<Number, Number> number() {
    return NUMBER;
  }

  public static Schema<Boolean, Boolean> booleanSchema() {
    return BOOLEAN;
  }

  public static Schema<BigInteger, BigInteger> bigint() {
    return BIGINT;
  }

  public static Schema<Symbol, Symbol> symbol() {
    return SYMBOL;
  }

  public static Schema<Void, Void> nullSchema() {
    return NULL;
  }

  public static Schema<Undefined, Undefined> undefined() {
    return UNDEFINED;
  }

  public static Schema<Object, Object> unknown() {
    return UNKNOWN;
  }

  public static Schema<Void, Void> never() {
    return NEVER;
  }

  /// Any non-scalar value: maps, lists and other objects.
  public static Schema<Object, Object> object() {
    return OBJECT;
  }

  // ------------------------------------------------------------------
  // Literals
  // ------------------------------------------------------------------

  @SafeVarargs
  public static <T> Schema<T, T> literal(T... values) {
    Objects.requireNonNull(values, "values");
    return new Schema<>(new Ast.Literal(new ArrayList<Object>(Arrays.asList(values)), Annotations.EMPTY));
  }

  /// Literal union of the Type-side property names of a struct.
  public static Schema<String, String> keyof(Schema<?, ?> struct) {
    final Ast.Struct node = Structs.requireStruct(struct.ast(), "keyof");
    final List<Object> names = new ArrayList<>();
    node.properties().forEach(ps -> names.add(ps.name()));
    if (names.isEmpty()) {
      return new Schema<>(Ast.Primitive.NEVER);
    }
    return new Schema<>(new Ast.Literal(names, Annotations.EMPTY));
  }

  // ------------------------------------------------------------------
  // Structs
  // ------------------------------------------------------------------

  public static Schema<Map<String, Object>, Map<String, Object>> struct(Field... fields) {
    Objects.requireNonNull(fields, "fields");
    final var properties = new ArrayList<PropertySignature>(fields.length);
    for (Field field : fields) {
      properties.add(field.signature());
    }
    return new Schema<>(structNode(properties, false));
  }

  static Ast.Struct structNode(List<PropertySignature> properties, boolean mutable) {
    try {
      return new Ast.Struct(properties, mutable, Annotations.EMPTY);
    } catch (IllegalArgumentException e) {
      LOG.log(Level.FINE, "invalid struct definition", e);
      throw e;
    }
  }

  public static Field field(String name, Schema<?, ?> schema) {
    return new Field(name, PropertySchema.required(schema.ast()));
  }

  public static Field field(String name, PropertySchema property) {
    return new Field(name, property);
  }

  /// Property schema for a required key.
  public static PropertySchema required(Schema<?, ?> schema) {
    return PropertySchema.required(schema.ast());
  }

  /// Optional key that may also hold undefined.
  public static PropertySchema optional(Schema<?, ?> schema) {
    return PropertySchema.optional(schema.ast(), OptionalOptions.DEFAULT);
  }

  public static PropertySchema optional(Schema<?, ?> schema, OptionalOptions options) {
    Objects.requireNonNull(options, "options");
    return PropertySchema.optional(schema.ast(), options);
  }

  // ------------------------------------------------------------------
  // Arrays, tuples and records
  // ------------------------------------------------------------------

  public static <A, I> Schema<List<A>, List<I>> arrayOf(Schema<A, I> item) {
    return new Schema<>(new Ast.TupleType(List.of(), List.of(item.ast()), false, Annotations.EMPTY));
  }

  /// Array with at least one item.
  public static <A, I> Schema<List<A>, List<I>> nonEmptyArray(Schema<A, I> item) {
    return new Schema<>(new Ast.TupleType(List.of(new Ast.TupleType.Element(item.ast(), false)),
        List.of(item.ast()), false, Annotations.EMPTY));
  }

  /// Fixed-length tuple of required elements.
  public static Schema<List<Object>, List<Object>> tuple(Schema<?, ?>... elements) {
    final var list = new ArrayList<Ast.TupleType.Element>(elements.length);
    for (Schema<?, ?> element : elements) {
      list.add(element(element));
    }
    return new Schema<>(new Ast.TupleType(list, List.of(), false, Annotations.EMPTY));
  }

  /// Tuple with leading `elements`, a variadic `rest` and fixed `trailing` elements.
  public static Schema<List<Object>, List<Object>> tupleWithRest(List<Ast.TupleType.Element> elements,
                                                                 Schema<?, ?> rest, Schema<?, ?>... trailing) {
    final var restNodes = new ArrayList<Ast>(1 + trailing.length);
    restNodes.add(rest.ast());
    for (Schema<?, ?> t : trailing) {
      restNodes.add(t.ast());
    }
    return new Schema<>(new Ast.TupleType(elements, restNodes, false, Annotations.EMPTY));
  }

  public static Ast.TupleType.Element element(Schema<?, ?> schema) {
    return new Ast.TupleType.Element(schema.ast(), false);
  }

  public static Ast.TupleType.Element optionalElement(Schema<?, ?> schema) {
    return new Ast.TupleType.Element(schema.ast(), true);
  }

  public static <K, V, KI, VI> Schema<Map<K, V>, Map<KI, VI>> record(Schema<K, KI> key, Schema<V, VI> value) {
    return new Schema<>(new Ast.RecordType(key.ast(), value.ast(), false, Annotations.EMPTY));
  }

  /// Same struct, tuple or record whose decoded container is mutable.
  public static <A, I> Schema<A, I> mutable(Schema<A, I> schema) {
    final Ast ast = schema.ast();
    return switch (ast.kind()) {
      case STRUCT -> {
        final var s = (Ast.Struct) ast;
        yield new Schema<>(new Ast.Struct(s.properties(), true, s.annotations()));
      }
      case TUPLE -> {
        final var t = (Ast.TupleType) ast;
        yield new Schema<>(new Ast.TupleType(t.elements(), t.rest(), true, t.annotations()));
      }
      case RECORD -> {
        final var r = (Ast.RecordType) ast;
        yield new Schema<>(new Ast.RecordType(r.key(), r.value(), true, r.annotations()));
      }
      default -> throw new IllegalArgumentException("mutable applies to struct, tuple and record schemas, not "
          + ast.kind());
    };
  }

  // ------------------------------------------------------------------
  // Unions
  // ------------------------------------------------------------------

  /// Members are tried in order. Nested unions are flattened; no member gives
  /// `never` and a single member is returned as is.
  @SafeVarargs
  public static <A, I> Schema<A, I> union(Schema<? extends A, ? extends I>... members) {
    final var nodes = new ArrayList<Ast>();
    for (Schema<? extends A, ? extends I> member : members) {
      final Ast ast = member.ast();
      if (ast instanceof Ast.Union u && u.annotations().isEmpty()) {
        nodes.addAll(u.members());
      } else {
        nodes.add(ast);
      }
    }
    if (nodes.isEmpty()) {
      return new Schema<>(Ast.Primitive.NEVER);
    }
    if (nodes.size() == 1) {
      return new Schema<>(nodes.get(0));
    }
    return new Schema<>(new Ast.Union(nodes, Annotations.EMPTY));
  }

  public static <A, I> Schema<A, I> nullOr(Schema<A, I> schema) {
    return new Schema<>(new Ast.Union(List.of(schema.ast(), Ast.Primitive.NULL), Annotations.EMPTY));
  }

  public static <A, I> Schema<A, I> undefinedOr(Schema<A, I> schema) {
    return new Schema<>(new Ast.Union(List.of(schema.ast(), Ast.Primitive.UNDEFINED), Annotations.EMPTY));
  }

  public static <A, I> Schema<A, I> nullish(Schema<A, I> schema) {
    return new Schema<>(new Ast.Union(List.of(schema.ast(), Ast.Primitive.NULL, Ast.Primitive.UNDEFINED),
        Annotations.EMPTY));
  }

  // ------------------------------------------------------------------
  // Refinements
  // ------------------------------------------------------------------

  /// Narrows `self` with `predicate`; `description` words the expected shape in messages.
  public static <A, I> Schema<A, I> filter(Schema<A, I> self, Predicate<? super A> predicate, String description) {
    Objects.requireNonNull(predicate, "predicate");
    final Predicate<Object> untyped = value -> {
      @SuppressWarnings("unchecked") final A typed = (A) value;
      return predicate.test(typed);
    };
    return refine(self, new Ast.Refinement.Check.Sync(untyped), description);
  }

  /// Narrows `self` with an asynchronous predicate, evaluated only by the async entry points.
  public static <A, I> Schema<A, I> filterEffect(
      Schema<A, I> self,
      BiFunction<? super A, CancellationToken, ? extends CompletionStage<Boolean>> predicate,
      String description) {
    Objects.requireNonNull(predicate, "predicate");
    final BiFunction<Object, CancellationToken, CompletionStage<Boolean>> untyped = (value, token) -> {
      @SuppressWarnings("unchecked") final A typed = (A) value;
      return predicate.apply(typed, token);
    };
    return refine(self, new Ast.Refinement.Check.Effectful(untyped), description);
  }

  private static <A, I> Schema<A, I> refine(Schema<A, I> self, Ast.Refinement.Check check, String description) {
    final Annotations annotations = description == null
        ? Annotations.EMPTY
        : Annotations.of(AnnotationKey.DESCRIPTION, description);
    return new Schema<>(new Ast.Refinement(self.ast(), check, annotations));
  }

  // ------------------------------------------------------------------
  // Transformations
  // ------------------------------------------------------------------

  /// Total conversion between the Type side of `from` and the Type side of `to`.
  public static <A, I, B, J> Schema<B, I> transform(Schema<A, I> from, Schema<B, J> to,
                                                    Function<? super A, ? extends B> decode,
                                                    Function<? super B, ? extends A> encode) {
    Objects.requireNonNull(decode, "decode");
    Objects.requireNonNull(encode, "encode");
    return new Schema<>(new Ast.Transformation(from.ast(), to.ast(),
        new TransformFunction.Total(untyped(decode)), new TransformFunction.Total(untyped(encode)),
        Annotations.EMPTY));
  }

  /// Conversion that may fail in either direction; return [ParseResult#failure(String)] to reject.
  public static <A, I, B, J> Schema<B, I> transformOrFail(Schema<A, I> from, Schema<B, J> to,
                                                          Function<? super A, ParseResult<B>> decode,
                                                          Function<? super B, ParseResult<A>> encode) {
    Objects.requireNonNull(decode, "decode");
    Objects.requireNonNull(encode, "encode");
    return new Schema<>(new Ast.Transformation(from.ast(), to.ast(),
        new TransformFunction.Fallible(untypedResult(decode)), new TransformFunction.Fallible(untypedResult(encode)),
        Annotations.EMPTY));
  }

  /// Asynchronous conversion; only the async entry points run it.
  public static <A, I, B, J> Schema<B, I> transformOrFailEffect(
      Schema<A, I> from, Schema<B, J> to,
      BiFunction<? super A, CancellationToken, ? extends CompletionStage<ParseResult<B>>> decode,
      BiFunction<? super B, CancellationToken, ? extends CompletionStage<ParseResult<A>>> encode) {
    Objects.requireNonNull(decode, "decode");
    Objects.requireNonNull(encode, "encode");
    return new Schema<>(new Ast.Transformation(from.ast(), to.ast(),
        new TransformFunction.Effectful(untypedEffect(decode)), new TransformFunction.Effectful(untypedEffect(encode)),
        Annotations.EMPTY));
  }

  /// `ab` then `bc`: decodes A to C through B and encodes back the same way.
  public static <A, B, C> Schema<C, A> compose(Schema<B, A> ab, Schema<C, B> bc) {
    final var through = new TransformFunction.Composed(bc.ast());
    return new Schema<>(new Ast.Transformation(ab.ast(), bc.ast(), through, through, Annotations.EMPTY));
  }

  @SuppressWarnings("unchecked")
  private static <X, Y> Function<Object, Object> untyped(Function<? super X, ? extends Y> f) {
    return value -> f.apply((X) value);
  }

  @SuppressWarnings("unchecked")
  private static <X, Y> Function<Object, ParseResult<Object>> untypedResult(Function<? super X, ParseResult<Y>> f) {
    return value -> (ParseResult<Object>) (ParseResult<?>) f.apply((X) value);
  }

  @SuppressWarnings("unchecked")
  private static <X, Y> BiFunction<Object, CancellationToken, CompletionStage<ParseResult<Object>>> untypedEffect(
      BiFunction<? super X, CancellationToken, ? extends CompletionStage<ParseResult<Y>>> f) {
    return (value, token) -> {
      final CompletionStage<ParseResult<Y>> stage = f.apply((X) value, token);
      return stage == null ? null : stage.thenApply(result -> (ParseResult<Object>) (ParseResult<?>) result);
    };
  }

  // ------------------------------------------------------------------
  // Brands, recursion and Java types
  // ------------------------------------------------------------------

  /// Nominal tag with no runtime effect.
  public static <A, I> Schema<A, I> brand(Schema<A, I> self, String tag) {
    return new Schema<>(new Ast.Brand(self.ast(), Objects.requireNonNull(tag, "tag"), Annotations.EMPTY));
  }

  /// Defers construction of a schema until an engine needs it; use for recursive shapes.
  public static <A, I> Schema<A, I> suspend(Supplier<Schema<A, I>> thunk) {
    Objects.requireNonNull(thunk, "thunk");
    return new Schema<>(new Ast.Suspend(() -> {
      final Schema<A, I> target = thunk.get();
      return target == null ? null : target.ast();
    }, Annotations.EMPTY));
  }

  /// Values that are instances of `type`.
  public static <T> Schema<T, T> instanceOf(Class<T> type) {
    Objects.requireNonNull(type, "type");
    return new Schema<>(new Ast.Refinement(Ast.Primitive.UNKNOWN, new Ast.Refinement.Check.Sync(type::isInstance),
        Annotations.of(AnnotationKey.DESCRIPTION, "an instance of " + type.getSimpleName())
            .with(AnnotationKey.IDENTIFIER, type.getSimpleName())));
  }

  /// Type-side `Optional` whose content, when present, satisfies `schema`.
  public static <A, I> Schema<Optional<A>, Optional<A>> optionOf(Schema<A, I> schema) {
    final Ast inner = schema.ast();
    return new Schema<>(new Ast.Refinement(Ast.Primitive.UNKNOWN, new Ast.Refinement.Check.OptionalOf(inner),
        Annotations.of(AnnotationKey.DESCRIPTION, "Optional<" + Formatting.describe(inner) + ">")));
  }
}
