package io.github.simbo1905.shape;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

import static io.github.simbo1905.shape.ShapeLogging.LOG;

/// Struct-shape operators. Each returns a new struct; property signatures it
/// does not touch are shared with the input by reference.
public final class Structs {

  private Structs() {}

  /// Only the named properties, in declaration order.
  public static Schema<Map<String, Object>, Map<String, Object>> pick(Schema<?, ?> struct, String... names) {
    final Ast.Struct node = requireStruct(struct.ast(), "pick");
    final Set<String> wanted = known(node, names, "pick");
    return select(node, ps -> wanted.contains(ps.name()));
  }

  /// Every property except the named ones.
  public static Schema<Map<String, Object>, Map<String, Object>> omit(Schema<?, ?> struct, String... names) {
    final Ast.Struct node = requireStruct(struct.ast(), "omit");
    final Set<String> dropped = known(node, names, "omit");
    return select(node, ps -> !dropped.contains(ps.name()));
  }

  /// Properties of `base` followed by those of `extension`. A union of structs
  /// as the extension distributes: the result is a union of extended structs.
  public static <A, I> Schema<A, I> extend(Schema<?, ?> base, Schema<?, ?> extension) {
    return new Schema<>(extendNode(base.ast(), extension.ast()));
  }

  private static Ast extendNode(Ast base, Ast extension) {
    if (extension instanceof Ast.Union union) {
      final var members = new ArrayList<Ast>(union.members().size());
      union.members().forEach(member -> members.add(extendNode(base, member)));
      return new Ast.Union(members, union.annotations());
    }
    if (base instanceof Ast.Union union) {
      final var members = new ArrayList<Ast>(union.members().size());
      union.members().forEach(member -> members.add(extendNode(member, extension)));
      return new Ast.Union(members, union.annotations());
    }
    final Ast.Struct left = requireStruct(base, "extend");
    final Ast.Struct right = requireStruct(extension, "extend");
    final var properties = new ArrayList<PropertySignature>(left.properties());
    properties.addAll(right.properties());
    return Schemas.structNode(properties, left.mutable() || right.mutable());
  }

  /// Every required property becomes optional, allowing undefined.
  public static Schema<Map<String, Object>, Map<String, Object>> partial(Schema<?, ?> struct) {
    return mapRequired(requireStruct(struct.ast(), "partial"), ps -> ps.withOptionality(Optionality.OPTIONAL));
  }

  /// Every required property becomes optional; undefined stays invalid.
  public static Schema<Map<String, Object>, Map<String, Object>> partialExact(Schema<?, ?> struct) {
    return mapRequired(requireStruct(struct.ast(), "partialExact"),
        ps -> ps.withOptionality(Optionality.OPTIONAL_EXACT));
  }

  /// Every property becomes required; defaults and modifiers are dropped.
  public static Schema<Map<String, Object>, Map<String, Object>> required(Schema<?, ?> struct) {
    final Ast.Struct node = requireStruct(struct.ast(), "required");
    final var properties = new ArrayList<PropertySignature>(node.properties().size());
    for (PropertySignature ps : node.properties()) {
      properties.add(ps.optionality() == Optionality.REQUIRED ? ps : ps.withOptionality(Optionality.REQUIRED));
    }
    return new Schema<>(new Ast.Struct(properties, node.mutable(), node.annotations()));
  }

  /// Renames Type-side keys; Encoded-side keys stay as they were.
  public static Schema<Map<String, Object>, Map<String, Object>> rename(Schema<?, ?> struct,
                                                                        Map<String, String> mapping) {
    Objects.requireNonNull(mapping, "mapping");
    final Ast.Struct node = requireStruct(struct.ast(), "rename");
    known(node, mapping.keySet().toArray(new String[0]), "rename");
    final var properties = new ArrayList<PropertySignature>(node.properties().size());
    for (PropertySignature ps : node.properties()) {
      final String target = mapping.get(ps.name());
      properties.add(target == null ? ps : ps.withFromKey(ps.encodedKey()).withName(target));
    }
    return new Schema<>(Schemas.structNode(properties, node.mutable()));
  }

  /// Struct whose decoded map is mutable.
  public static Schema<Map<String, Object>, Map<String, Object>> mutable(Schema<?, ?> struct) {
    final Ast.Struct node = requireStruct(struct.ast(), "mutable");
    return new Schema<>(new Ast.Struct(node.properties(), true, node.annotations()));
  }

  static Ast.Struct requireStruct(Ast ast, String operation) {
    if (ast instanceof Ast.Struct struct) {
      return struct;
    }
    LOG.fine(() -> operation + " rejected a " + ast.kind() + " node");
    throw new IllegalArgumentException(operation + " requires a struct schema, not " + ast.kind());
  }

  /// The node a Type value is checked against, seen through refinements, brands and transformations.
  static Ast unwrapTypeSide(Ast ast) {
    Ast current = ast;
    while (true) {
      if (current instanceof Ast.Refinement r) {
        current = r.from();
      } else if (current instanceof Ast.Brand b) {
        current = b.from();
      } else if (current instanceof Ast.Transformation t) {
        current = t.to();
      } else {
        return current;
      }
    }
  }

  private static Set<String> known(Ast.Struct node, String[] names, String operation) {
    final var set = new LinkedHashSet<>(Arrays.asList(names));
    for (String name : set) {
      if (node.property(name).isEmpty()) {
        throw new IllegalArgumentException(operation + ": unknown property '" + name + "'");
      }
    }
    return set;
  }

  private static Schema<Map<String, Object>, Map<String, Object>> select(
      Ast.Struct node, Predicate<PropertySignature> keep) {
    final List<PropertySignature> properties = node.properties().stream().filter(keep).toList();
    return new Schema<>(new Ast.Struct(properties, node.mutable(), Annotations.EMPTY));
  }

  private static Schema<Map<String, Object>, Map<String, Object>> mapRequired(
      Ast.Struct node, UnaryOperator<PropertySignature> change) {
    final var properties = new ArrayList<PropertySignature>(node.properties().size());
    for (PropertySignature ps : node.properties()) {
      properties.add(ps.optionality() == Optionality.REQUIRED ? change.apply(ps) : ps);
    }
    return new Schema<>(new Ast.Struct(properties, node.mutable(), node.annotations()));
  }
}
