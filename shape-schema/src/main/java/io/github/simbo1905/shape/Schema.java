/// Copyright (c) 2025 Simon Massey
///
/// Permission is hereby granted, free of charge, to any person obtaining a copy of this software and associated documentation files (the "Software"), to deal in the Software without restriction, including without limitation the rights to use, copy, modify, merge, publish, distribute, sublicense, and/or sell copies of the Software, and to permit persons to whom the Software is furnished to do so, subject to the following conditions:
///
/// The above copyright notice and this permission notice shall be included in all copies or substantial portions of the Software.
///
/// THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
package io.github.simbo1905.shape;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/// Typed handle on one schema node.
///
/// `A` is the Type side (what the program works with) and `I` the Encoded side
/// (what crosses the boundary). The type parameters exist for the caller only;
/// the engine works on the untyped [Ast] held by the schema.
///
/// ## Usage
/// ```java
/// Schema<Map<String, Object>, Map<String, Object>> person = Schemas.struct(
///     Schemas.field("name", Filters.minLength(Schemas.string(), 1)),
///     Schemas.field("age", Filters.between(Filters.integer(Schemas.number()), 0, 150)));
///
/// ParseResult<Map<String, Object>> result = Decoder.decodeUnknown(person, input);
/// Map<String, Object> encoded = Encoder.encodeSync(person, result.getOrThrow());
/// ```
///
/// Schemas are immutable and safe to share between threads.
public final class Schema<A, I> {

  private final Ast ast;

  Schema(Ast ast) {
    this.ast = Objects.requireNonNull(ast, "ast");
  }

  /// Wraps a node built by hand. The caller vouches for `A` and `I`.
  public static <A, I> Schema<A, I> of(Ast ast) {
    return new Schema<>(ast);
  }

  public Ast ast() {
    return ast;
  }

  public Schema<A, I> annotations(Annotations more) {
    return new Schema<>(ast.annotate(more));
  }

  public <T> Schema<A, I> annotate(AnnotationKey<T> key, T value) {
    return annotations(Annotations.of(key, value));
  }

  public Schema<A, I> identifier(String identifier) {
    return annotate(AnnotationKey.IDENTIFIER, identifier);
  }

  public Schema<A, I> title(String title) {
    return annotate(AnnotationKey.TITLE, title);
  }

  public Schema<A, I> description(String description) {
    return annotate(AnnotationKey.DESCRIPTION, description);
  }

  /// Replaces the message of issues raised by this node.
  public Schema<A, I> message(Function<ParseIssue, String> message) {
    return annotate(AnnotationKey.MESSAGE, message);
  }

  public Schema<A, I> examples(List<A> examples) {
    return annotate(AnnotationKey.EXAMPLES, List.copyOf(examples));
  }

  public Schema<A, I> defaultValue(A value) {
    return annotate(AnnotationKey.DEFAULT, value);
  }

  /// Applies `f` to this schema, for chaining combinators left to right.
  public <R> R pipe(Function<? super Schema<A, I>, ? extends R> f) {
    return f.apply(this);
  }

  /// Builds a Type value: fills constructor defaults of a struct, then asserts validity.
  ///
  /// @throws ParseException when the value does not satisfy the Type side
  public A make(A value) {
    final Object filled = fillConstructorDefaults(ast, value);
    return Validator.validate(this, filled).getOrThrow();
  }

  private static Object fillConstructorDefaults(Ast ast, Object value) {
    final Ast struct = Structs.unwrapTypeSide(ast);
    if (!(struct instanceof Ast.Struct s) || !(value instanceof Map<?, ?> map)) {
      return value;
    }
    Map<Object, Object> copy = null;
    for (PropertySignature ps : s.properties()) {
      if (ps.constructorDefault() != null && !map.containsKey(ps.name())) {
        if (copy == null) {
          copy = new LinkedHashMap<>(map);
        }
        copy.put(ps.name(), ps.constructorDefault().get());
      }
    }
    return copy == null ? value : copy;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Schema<?, ?> other && ast.equals(other.ast);
  }

  @Override
  public int hashCode() {
    return ast.hashCode();
  }

  @Override
  public String toString() {
    return Formatting.describe(ast);
  }
}
