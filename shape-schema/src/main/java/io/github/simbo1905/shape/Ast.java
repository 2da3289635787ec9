package io.github.simbo1905.shape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.function.BiFunction;
import java.util.function.Predicate;
import java.util.function.Supplier;

/// Immutable schema node: the single source of truth for one data shape.
///
/// The node set is closed. Engines switch on [#kind()] and external consumers
/// (JSON Schema generators, example generators, pretty printers) walk the tree
/// with [Visitor], so adding a variant is a compile-time change everywhere.
///
/// Nodes are never mutated. [#annotate(Annotations)] returns a copy that shares
/// its children with the receiver.
public sealed interface Ast
    permits Ast.Primitive, Ast.Literal, Ast.Struct, Ast.TupleType, Ast.RecordType,
    Ast.Union, Ast.Refinement, Ast.Transformation, Ast.Brand, Ast.Suspend {

  AstKind kind();

  Annotations annotations();

  /// Copy of this node with `more` merged over its annotations.
  Ast annotate(Annotations more);

  /// Direct child nodes in declaration order. A [Suspend] reports none so that
  /// walking the tree never forces a thunk.
  List<Ast> children();

  <R> R accept(Visitor<R> visitor);

  /// One method per variant; implementations must handle every kind.
  interface Visitor<R> {
    R visitPrimitive(Primitive node);

    R visitLiteral(Literal node);

    R visitStruct(Struct node);

    R visitTuple(TupleType node);

    R visitRecord(RecordType node);

    R visitUnion(Union node);

    R visitRefinement(Refinement node);

    R visitTransformation(Transformation node);

    R visitBrand(Brand node);

    R visitSuspend(Suspend node);
  }

  /// Base type: string, number, boolean, bigint, symbol, null, undefined, unknown, never, object.
  record Primitive(PrimitiveKind primitive, Annotations annotations) implements Ast {
    public static final Primitive STRING = new Primitive(PrimitiveKind.STRING, Annotations.EMPTY);
    public static final Primitive NUMBER = new Primitive(PrimitiveKind.NUMBER, Annotations.EMPTY);
    public static final Primitive BOOLEAN = new Primitive(PrimitiveKind.BOOLEAN, Annotations.EMPTY);
    public static final Primitive BIGINT = new Primitive(PrimitiveKind.BIGINT, Annotations.EMPTY);
    public static final Primitive SYMBOL = new Primitive(PrimitiveKind.SYMBOL, Annotations.EMPTY);
    public static final Primitive NULL = new Primitive(PrimitiveKind.NULL, Annotations.EMPTY);
    public static final Primitive UNDEFINED = new Primitive(PrimitiveKind.UNDEFINED, Annotations.EMPTY);
    public static final Primitive UNKNOWN = new Primitive(PrimitiveKind.UNKNOWN, Annotations.EMPTY);
    public static final Primitive NEVER = new Primitive(PrimitiveKind.NEVER, Annotations.EMPTY);
    public static final Primitive OBJECT = new Primitive(PrimitiveKind.OBJECT, Annotations.EMPTY);

    public Primitive {
      Objects.requireNonNull(primitive, "primitive");
      Objects.requireNonNull(annotations, "annotations");
    }

    @Override
    public AstKind kind() {
      return AstKind.PRIMITIVE;
    }

    @Override
    public Primitive annotate(Annotations more) {
      return new Primitive(primitive, annotations.merge(more));
    }

    @Override
    public List<Ast> children() {
      return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPrimitive(this);
    }
  }

  /// One or more scalar constants; a value matches when it equals any of them.
  record Literal(List<Object> values, Annotations annotations) implements Ast {
    public Literal {
      Objects.requireNonNull(values, "values");
      Objects.requireNonNull(annotations, "annotations");
      if (values.isEmpty()) {
        throw new IllegalArgumentException("literal requires at least one value");
      }
      for (Object value : values) {
        if (!Literals.isLiteralValue(value)) {
          throw new IllegalArgumentException("not a literal value: " + value.getClass().getName());
        }
      }
      values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public boolean matches(Object value) {
      for (Object literal : values) {
        if (Literals.equal(literal, value)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public AstKind kind() {
      return AstKind.LITERAL;
    }

    @Override
    public Literal annotate(Annotations more) {
      return new Literal(values, annotations.merge(more));
    }

    @Override
    public List<Ast> children() {
      return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLiteral(this);
    }
  }

  /// Fixed set of named properties.
  record Struct(List<PropertySignature> properties, boolean mutable, Annotations annotations) implements Ast {
    public Struct {
      Objects.requireNonNull(properties, "properties");
      Objects.requireNonNull(annotations, "annotations");
      properties = List.copyOf(properties);
      final var names = new HashSet<String>();
      final var keys = new HashSet<String>();
      for (PropertySignature ps : properties) {
        if (!names.add(ps.name())) {
          throw new IllegalArgumentException("duplicate property name: " + ps.name());
        }
        if (!keys.add(ps.encodedKey())) {
          throw new IllegalArgumentException("duplicate encoded key: " + ps.encodedKey());
        }
      }
    }

    public Optional<PropertySignature> property(String name) {
      return properties.stream().filter(ps -> ps.name().equals(name)).findFirst();
    }

    @Override
    public AstKind kind() {
      return AstKind.STRUCT;
    }

    @Override
    public Struct annotate(Annotations more) {
      return new Struct(properties, mutable, annotations.merge(more));
    }

    @Override
    public List<Ast> children() {
      return properties.stream().map(PropertySignature::type).toList();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitStruct(this);
    }
  }

  /// Array or tuple. `elements` are the fixed leading positions; `rest`, when
  /// non-empty, holds the variadic element followed by fixed trailing elements.
  /// An array is a tuple with no elements and a single rest entry.
  record TupleType(List<Element> elements, List<Ast> rest, boolean mutable, Annotations annotations)
      implements Ast {

    public record Element(Ast type, boolean optional) {
      public Element {
        Objects.requireNonNull(type, "type");
      }
    }

    public TupleType {
      Objects.requireNonNull(elements, "elements");
      Objects.requireNonNull(rest, "rest");
      Objects.requireNonNull(annotations, "annotations");
      elements = List.copyOf(elements);
      rest = List.copyOf(rest);
      var seenOptional = false;
      for (Element element : elements) {
        if (element.optional()) {
          seenOptional = true;
        } else if (seenOptional) {
          throw new IllegalArgumentException("a required element cannot follow an optional element");
        }
      }
      if (seenOptional && rest.size() > 1) {
        throw new IllegalArgumentException("trailing elements cannot follow optional elements");
      }
    }

    public boolean isArray() {
      return elements.isEmpty() && rest.size() == 1;
    }

    public int requiredElementCount() {
      return (int) elements.stream().filter(e -> !e.optional()).count();
    }

    @Override
    public AstKind kind() {
      return AstKind.TUPLE;
    }

    @Override
    public TupleType annotate(Annotations more) {
      return new TupleType(elements, rest, mutable, annotations.merge(more));
    }

    @Override
    public List<Ast> children() {
      final var all = new ArrayList<Ast>(elements.size() + rest.size());
      elements.forEach(e -> all.add(e.type()));
      all.addAll(rest);
      return List.copyOf(all);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTuple(this);
    }
  }

  /// Map with arbitrary keys, each key decoded by `key` and each value by `value`.
  record RecordType(Ast key, Ast value, boolean mutable, Annotations annotations) implements Ast {
    public RecordType {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(value, "value");
      Objects.requireNonNull(annotations, "annotations");
    }

    @Override
    public AstKind kind() {
      return AstKind.RECORD;
    }

    @Override
    public RecordType annotate(Annotations more) {
      return new RecordType(key, value, mutable, annotations.merge(more));
    }

    @Override
    public List<Ast> children() {
      return List.of(key, value);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRecord(this);
    }
  }

  /// Ordered alternatives; the first member that accepts the input wins.
  record Union(List<Ast> members, Annotations annotations) implements Ast {
    public Union {
      Objects.requireNonNull(members, "members");
      Objects.requireNonNull(annotations, "annotations");
      members = List.copyOf(members);
    }

    @Override
    public AstKind kind() {
      return AstKind.UNION;
    }

    @Override
    public Union annotate(Annotations more) {
      return new Union(members, annotations.merge(more));
    }

    @Override
    public List<Ast> children() {
      return members;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitUnion(this);
    }
  }

  /// `from` narrowed by a predicate.
  record Refinement(Ast from, Check check, Annotations annotations) implements Ast {

    /// Predicate of a refinement, evaluated after `from` succeeded.
    public sealed interface Check permits Check.Sync, Check.Effectful, Check.OptionalOf {

      record Sync(Predicate<Object> predicate) implements Check {
        public Sync {
          Objects.requireNonNull(predicate, "predicate");
        }
      }

      /// An `Optional` that is empty or holds a valid Type value of `content`.
      record OptionalOf(Ast content) implements Check {
        public OptionalOf {
          Objects.requireNonNull(content, "content");
        }
      }

      /// Asynchronous predicate; only the async entry points can evaluate it.
      record Effectful(BiFunction<Object, CancellationToken, ? extends CompletionStage<Boolean>> predicate)
          implements Check {
        public Effectful {
          Objects.requireNonNull(predicate, "predicate");
        }
      }
    }

    public Refinement {
      Objects.requireNonNull(from, "from");
      Objects.requireNonNull(check, "check");
      Objects.requireNonNull(annotations, "annotations");
    }

    @Override
    public AstKind kind() {
      return AstKind.REFINEMENT;
    }

    @Override
    public Refinement annotate(Annotations more) {
      return new Refinement(from, check, annotations.merge(more));
    }

    @Override
    public List<Ast> children() {
      return List.of(from);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRefinement(this);
    }
  }

  /// Encoded side `from`, Type side `to`, and the two functions between them.
  record Transformation(Ast from, Ast to, TransformFunction decode, TransformFunction encode,
                        Annotations annotations) implements Ast {
    public Transformation {
      Objects.requireNonNull(from, "from");
      Objects.requireNonNull(to, "to");
      Objects.requireNonNull(decode, "decode");
      Objects.requireNonNull(encode, "encode");
      Objects.requireNonNull(annotations, "annotations");
    }

    @Override
    public AstKind kind() {
      return AstKind.TRANSFORMATION;
    }

    @Override
    public Transformation annotate(Annotations more) {
      return new Transformation(from, to, decode, encode, annotations.merge(more));
    }

    @Override
    public List<Ast> children() {
      return List.of(from, to);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTransformation(this);
    }
  }

  /// Nominal tag; no runtime effect beyond `from`.
  record Brand(Ast from, String brand, Annotations annotations) implements Ast {
    public Brand {
      Objects.requireNonNull(from, "from");
      Objects.requireNonNull(brand, "brand");
      Objects.requireNonNull(annotations, "annotations");
    }

    @Override
    public AstKind kind() {
      return AstKind.BRAND;
    }

    @Override
    public Brand annotate(Annotations more) {
      return new Brand(from, brand, annotations.merge(more));
    }

    @Override
    public List<Ast> children() {
      return List.of(from);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBrand(this);
    }
  }

  /// Deferred node for recursive shapes. The thunk is only invoked by an engine.
  record Suspend(Supplier<Ast> thunk, Annotations annotations) implements Ast {
    public Suspend {
      Objects.requireNonNull(thunk, "thunk");
      Objects.requireNonNull(annotations, "annotations");
    }

    public Ast resolve() {
      final Ast target = thunk.get();
      if (target == null) {
        throw new IllegalStateException("suspended schema resolved to null");
      }
      return target;
    }

    @Override
    public AstKind kind() {
      return AstKind.SUSPEND;
    }

    @Override
    public Suspend annotate(Annotations more) {
      return new Suspend(thunk, annotations.merge(more));
    }

    @Override
    public List<Ast> children() {
      return List.of();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSuspend(this);
    }
  }
}
