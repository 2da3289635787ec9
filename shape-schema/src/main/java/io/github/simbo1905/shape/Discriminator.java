package io.github.simbo1905.shape;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Tag key shared by every member of a union, with the literal values that select each member.
///
/// Detected when every member is a struct (seen through refinements, brands and
/// the side of a transformation facing the input) that declares the same key as
/// a required literal property, and no literal value selects two members.
/// Suspended members are never forced, so a union holding one has no discriminator.
record Discriminator(String key, List<List<Object>> tags, List<Ast> members) {

  static Optional<Discriminator> detect(Ast.Union union, Direction direction) {
    final List<Ast> members = union.members();
    if (members.size() < 2) {
      return Optional.empty();
    }
    final var structs = new ArrayList<Ast.Struct>(members.size());
    for (Ast member : members) {
      final Ast.Struct struct = structOf(member, direction);
      if (struct == null) {
        return Optional.empty();
      }
      structs.add(struct);
    }
    for (PropertySignature candidate : structs.get(0).properties()) {
      final String key = keyOf(candidate, direction);
      final var tags = new ArrayList<List<Object>>(structs.size());
      for (Ast.Struct struct : structs) {
        final List<Object> literals = literalsFor(struct, key, direction);
        if (literals == null) {
          break;
        }
        tags.add(literals);
      }
      if (tags.size() == structs.size() && distinct(tags)) {
        return Optional.of(new Discriminator(key, List.copyOf(tags), members));
      }
    }
    return Optional.empty();
  }

  /// The member selected by `tag`.
  Optional<Ast> lookup(Object tag) {
    for (int i = 0; i < tags.size(); i++) {
      for (Object literal : tags.get(i)) {
        if (Literals.equal(literal, tag)) {
          return Optional.of(members.get(i));
        }
      }
    }
    return Optional.empty();
  }

  /// Every accepted tag value, for the mismatch message.
  Ast.Literal expected() {
    final var all = new ArrayList<Object>();
    tags.forEach(all::addAll);
    return new Ast.Literal(all, Annotations.EMPTY);
  }

  private static Ast.Struct structOf(Ast ast, Direction direction) {
    Ast current = ast;
    while (true) {
      switch (current.kind()) {
        case STRUCT:
          return (Ast.Struct) current;
        case REFINEMENT:
          current = ((Ast.Refinement) current).from();
          break;
        case BRAND:
          current = ((Ast.Brand) current).from();
          break;
        case TRANSFORMATION:
          final var t = (Ast.Transformation) current;
          current = direction == Direction.DECODE ? t.from() : t.to();
          break;
        default:
          return null;
      }
    }
  }

  private static String keyOf(PropertySignature ps, Direction direction) {
    return direction == Direction.DECODE ? ps.encodedKey() : ps.name();
  }

  private static List<Object> literalsFor(Ast.Struct struct, String key, Direction direction) {
    for (PropertySignature ps : struct.properties()) {
      if (!keyOf(ps, direction).equals(key)) {
        continue;
      }
      if (ps.optionality() != Optionality.REQUIRED) {
        return null;
      }
      Ast type = ps.type();
      while (type instanceof Ast.Brand brand) {
        type = brand.from();
      }
      return type instanceof Ast.Literal literal ? literal.values() : null;
    }
    return null;
  }

  private static boolean distinct(List<List<Object>> tags) {
    for (int i = 0; i < tags.size(); i++) {
      for (int j = i + 1; j < tags.size(); j++) {
        for (Object a : tags.get(i)) {
          for (Object b : tags.get(j)) {
            if (Literals.equal(a, b)) {
              return false;
            }
          }
        }
      }
    }
    return true;
  }
}
