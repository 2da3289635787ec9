package io.github.simbo1905.shape;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/// Text renderings of nodes and values used in issue messages.
final class Formatting {

  private static final int MAX_DEPTH = 4;
  private static final int MAX_ITEMS = 8;
  private static final int MAX_STRING = 80;

  private Formatting() {}

  /// Expected-shape wording for a node, e.g. `{ name: string; age?: number }`.
  static String describe(Ast ast) {
    final Optional<String> identifier = ast.annotations().get(AnnotationKey.IDENTIFIER);
    if (identifier.isPresent()) {
      return identifier.get();
    }
    return switch (ast.kind()) {
      case PRIMITIVE -> ((Ast.Primitive) ast).primitive().label();
      case LITERAL -> ((Ast.Literal) ast).values().stream().map(Formatting::preview)
          .collect(Collectors.joining(" | "));
      case STRUCT -> describeStruct((Ast.Struct) ast);
      case TUPLE -> describeTuple((Ast.TupleType) ast);
      case RECORD -> {
        final var record = (Ast.RecordType) ast;
        yield "Record<" + describe(record.key()) + ", " + describe(record.value()) + ">";
      }
      case UNION -> {
        final var union = (Ast.Union) ast;
        yield union.members().isEmpty() ? "never"
            : union.members().stream().map(Formatting::describe).collect(Collectors.joining(" | "));
      }
      case REFINEMENT -> ast.annotations().get(AnnotationKey.DESCRIPTION)
          .or(() -> ast.annotations().get(AnnotationKey.TITLE))
          .orElseGet(() -> "{ " + describe(((Ast.Refinement) ast).from()) + " | filter }");
      case TRANSFORMATION -> {
        final var t = (Ast.Transformation) ast;
        yield "(" + describe(t.from()) + " <-> " + describe(t.to()) + ")";
      }
      case BRAND -> {
        final var brand = (Ast.Brand) ast;
        yield describe(brand.from()) + " & Brand<" + preview(brand.brand()) + ">";
      }
      case SUSPEND -> ast.annotations().get(AnnotationKey.TITLE).orElse("<suspended schema>");
    };
  }

  private static String describeStruct(Ast.Struct struct) {
    if (struct.properties().isEmpty()) {
      return "{}";
    }
    return struct.properties().stream()
        .map(ps -> ps.name() + (ps.optionalOnTypeSide() ? "?: " : ": ") + describe(ps.type()))
        .collect(Collectors.joining("; ", "{ ", " }"));
  }

  private static String describeTuple(Ast.TupleType tuple) {
    if (tuple.isArray()) {
      return "Array<" + describe(tuple.rest().get(0)) + ">";
    }
    final var parts = new ArrayList<String>();
    for (Ast.TupleType.Element element : tuple.elements()) {
      parts.add(describe(element.type()) + (element.optional() ? "?" : ""));
    }
    if (!tuple.rest().isEmpty()) {
      parts.add("...Array<" + describe(tuple.rest().get(0)) + ">");
      tuple.rest().subList(1, tuple.rest().size()).forEach(t -> parts.add(describe(t)));
    }
    return "[" + String.join(", ", parts) + "]";
  }

  /// Short, bounded rendering of an actual value.
  static String preview(Object value) {
    final var sb = new StringBuilder();
    preview(value, sb, 0);
    return sb.toString();
  }

  private static void preview(Object value, StringBuilder sb, int depth) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof String s) {
      quote(s.length() > MAX_STRING ? s.substring(0, MAX_STRING) + "..." : s, sb);
    } else if (value instanceof BigInteger bi) {
      sb.append(bi).append('n');
    } else if (value instanceof Number n) {
      sb.append(Numbers.format(n));
    } else if (value instanceof Map<?, ?> map) {
      if (depth >= MAX_DEPTH) {
        sb.append("{...}");
        return;
      }
      sb.append('{');
      var count = 0;
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (count == MAX_ITEMS) {
          sb.append(",...");
          break;
        }
        if (count++ > 0) {
          sb.append(',');
        }
        quote(String.valueOf(entry.getKey()), sb);
        sb.append(':');
        preview(entry.getValue(), sb, depth + 1);
      }
      sb.append('}');
    } else if (value instanceof List<?> list) {
      if (depth >= MAX_DEPTH) {
        sb.append("[...]");
        return;
      }
      sb.append('[');
      for (int i = 0; i < list.size(); i++) {
        if (i == MAX_ITEMS) {
          sb.append(",...");
          break;
        }
        if (i > 0) {
          sb.append(',');
        }
        preview(list.get(i), sb, depth + 1);
      }
      sb.append(']');
    } else if (value instanceof Optional<?> optional) {
      if (optional.isEmpty()) {
        sb.append("Optional.empty");
      } else {
        sb.append("Optional[");
        preview(optional.get(), sb, depth + 1);
        sb.append(']');
      }
    } else {
      sb.append(value);
    }
  }

  private static void quote(String s, StringBuilder sb) {
    sb.append('"');
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    sb.append('"');
  }
}
