package io.github.simbo1905.shape;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/// Built-in transformations between common Encoded and Type representations.
public final class Transformations {

  private Transformations() {}

  /// Decimal text to a number: integral text becomes a `Long`, other text a `Double`.
  /// `"NaN"`, `"Infinity"` and `"-Infinity"` are accepted.
  public static Schema<Number, String> numberFromString() {
    return Schemas.transformOrFail(Schemas.string(), Schemas.number(),
        s -> {
          try {
            return ParseResult.success(Numbers.parse(s));
          } catch (NumberFormatException e) {
            return ParseResult.failure("Unable to decode " + Formatting.preview(s) + " into a number");
          }
        },
        n -> ParseResult.success(Numbers.format(n))).identifier("NumberFromString");
  }

  public static Schema<BigInteger, String> bigintFromString() {
    return Schemas.transformOrFail(Schemas.string(), Schemas.bigint(),
        s -> {
          try {
            return ParseResult.success(new BigInteger(s.trim()));
          } catch (NumberFormatException e) {
            return ParseResult.failure("Unable to decode " + Formatting.preview(s) + " into a bigint");
          }
        },
        b -> ParseResult.success(b.toString())).identifier("BigIntFromString");
  }

  public static Schema<BigDecimal, String> bigDecimalFromString() {
    return Schemas.transformOrFail(Schemas.string(), Schemas.instanceOf(BigDecimal.class),
        s -> {
          try {
            return ParseResult.success(new BigDecimal(s.trim()));
          } catch (NumberFormatException e) {
            return ParseResult.failure("Unable to decode " + Formatting.preview(s) + " into a BigDecimal");
          }
        },
        d -> ParseResult.success(d.toPlainString())).identifier("BigDecimalFromString");
  }

  /// Trims on decode; encode checks the value is already trimmed.
  public static Schema<String, String> trim() {
    return Schemas.transform(Schemas.string(), Filters.trimmed(Schemas.string()), String::trim, s -> s)
        .identifier("Trim");
  }

  public static Schema<String, String> lowercase() {
    return Schemas.transform(Schemas.string(), Filters.lowercased(Schemas.string()),
        s -> s.toLowerCase(Locale.ROOT), s -> s).identifier("Lowercase");
  }

  public static Schema<String, String> uppercase() {
    return Schemas.transform(Schemas.string(), Filters.uppercased(Schemas.string()),
        s -> s.toUpperCase(Locale.ROOT), s -> s).identifier("Uppercase");
  }

  /// Splits on a literal separator and joins back with it.
  public static Schema<List<String>, String> split(String separator) {
    Objects.requireNonNull(separator, "separator");
    final Pattern literal = Pattern.compile(Pattern.quote(separator));
    return Schemas.transform(Schemas.string(), Schemas.arrayOf(Schemas.string()),
        s -> List.of(literal.split(s, -1)),
        parts -> String.join(separator, parts));
  }

  /// ISO-8601 instant, e.g. `2024-01-01T00:00:00Z`.
  public static Schema<Instant, String> instantFromString() {
    return Schemas.transformOrFail(Schemas.string(), Schemas.instanceOf(Instant.class),
        s -> {
          try {
            return ParseResult.success(Instant.parse(s));
          } catch (DateTimeParseException e) {
            return ParseResult.failure("Unable to decode " + Formatting.preview(s) + " into an Instant");
          }
        },
        i -> ParseResult.success(i.toString())).identifier("InstantFromString");
  }

  /// ISO-8601 local date, e.g. `2024-01-31`.
  public static Schema<LocalDate, String> localDateFromString() {
    return Schemas.transformOrFail(Schemas.string(), Schemas.instanceOf(LocalDate.class),
        s -> {
          try {
            return ParseResult.success(LocalDate.parse(s));
          } catch (DateTimeParseException e) {
            return ParseResult.failure("Unable to decode " + Formatting.preview(s) + " into a LocalDate");
          }
        },
        d -> ParseResult.success(d.toString())).identifier("LocalDateFromString");
  }

  public static Schema<UUID, String> uuidFromString() {
    return Schemas.transformOrFail(Schemas.string(), Schemas.instanceOf(UUID.class),
        s -> {
          try {
            return ParseResult.success(UUID.fromString(s));
          } catch (IllegalArgumentException e) {
            return ParseResult.failure("Unable to decode " + Formatting.preview(s) + " into a UUID");
          }
        },
        u -> ParseResult.success(u.toString())).identifier("UUIDFromString");
  }

  /// Negates a boolean in both directions.
  public static Schema<Boolean, Boolean> not() {
    return Schemas.transform(Schemas.booleanSchema(), Schemas.booleanSchema(), b -> !b, b -> !b).identifier("Not");
  }

  /// Encoded `A | null`, Type `Optional<A>`.
  public static <A, I> Schema<Optional<A>, I> optionFromNullOr(Schema<A, I> value) {
    return Schemas.transform(Schemas.nullOr(value), Schemas.optionOf(value),
        Optional::ofNullable, option -> option.orElse(null));
  }

  /// Constant names of `type` to its constants.
  public static <E extends Enum<E>> Schema<E, String> enumFromName(Class<E> type) {
    Objects.requireNonNull(type, "type");
    final List<Object> names = new ArrayList<>();
    Arrays.stream(type.getEnumConstants()).forEach(e -> names.add(e.name()));
    final Schema<String, String> literal = Schema.of(new Ast.Literal(names, Annotations.EMPTY));
    return Schemas.transform(literal, Schemas.instanceOf(type), name -> Enum.valueOf(type, name), Enum::name);
  }

  /// Struct to a Java record through its canonical constructor, and back through
  /// its component accessors. Struct property names must match component names.
  public static <R extends Record> Schema<R, Map<String, Object>> recordOf(
      Class<R> type, Schema<Map<String, Object>, Map<String, Object>> struct) {
    final RecordMapping<R> mapping = RecordMapping.of(type);
    return Schemas.transformOrFail(struct, Schemas.instanceOf(type), mapping::construct, mapping::deconstruct)
        .identifier(type.getSimpleName());
  }
}
