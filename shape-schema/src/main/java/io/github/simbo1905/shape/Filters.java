package io.github.simbo1905.shape;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntPredicate;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/// Built-in refinements. Each one words its expected shape (used in failure
/// messages) and records a JSON Schema hint for generators walking the tree.
public final class Filters {

  private Filters() {}

  // ------------------------------------------------------------------
  // Strings
  // ------------------------------------------------------------------

  public static <I> Schema<String, I> minLength(Schema<String, I> self, int min) {
    return hinted(self, s -> s.length() >= min,
        "a string at least " + min + " character(s) long", Map.of("minLength", min));
  }

  public static <I> Schema<String, I> maxLength(Schema<String, I> self, int max) {
    return hinted(self, s -> s.length() <= max,
        "a string at most " + max + " character(s) long", Map.of("maxLength", max));
  }

  public static <I> Schema<String, I> length(Schema<String, I> self, int exact) {
    return hinted(self, s -> s.length() == exact,
        "a string " + exact + " character(s) long", Map.of("minLength", exact, "maxLength", exact));
  }

  public static <I> Schema<String, I> nonEmptyString(Schema<String, I> self) {
    return hinted(self, s -> !s.isEmpty(), "a non empty string", Map.of("minLength", 1));
  }

  /// Matches when `regex` is found anywhere in the string.
  public static <I> Schema<String, I> pattern(Schema<String, I> self, String regex) {
    final Pattern compiled = Pattern.compile(Objects.requireNonNull(regex, "regex"));
    return hinted(self, s -> compiled.matcher(s).find(),
        "a string matching the pattern " + regex, Map.of("pattern", regex));
  }

  public static <I> Schema<String, I> startsWith(Schema<String, I> self, String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    return hinted(self, s -> s.startsWith(prefix), "a string starting with \"" + prefix + "\"",
        Map.of("pattern", "^" + Pattern.quote(prefix)));
  }

  public static <I> Schema<String, I> endsWith(Schema<String, I> self, String suffix) {
    Objects.requireNonNull(suffix, "suffix");
    return hinted(self, s -> s.endsWith(suffix), "a string ending with \"" + suffix + "\"",
        Map.of("pattern", Pattern.quote(suffix) + "$"));
  }

  public static <I> Schema<String, I> includes(Schema<String, I> self, String part) {
    Objects.requireNonNull(part, "part");
    return hinted(self, s -> s.contains(part), "a string including \"" + part + "\"",
        Map.of("pattern", Pattern.quote(part)));
  }

  /// No leading or trailing whitespace.
  public static <I> Schema<String, I> trimmed(Schema<String, I> self) {
    return hinted(self, s -> s.equals(s.trim()), "a string with no leading or trailing whitespace",
        Map.of("pattern", "^\\S[\\s\\S]*\\S$|^\\S$|^$"));
  }

  public static <I> Schema<String, I> lowercased(Schema<String, I> self) {
    return hinted(self, s -> s.equals(s.toLowerCase(Locale.ROOT)), "a lowercase string",
        Map.of("pattern", "^[^A-Z]*$"));
  }

  public static <I> Schema<String, I> uppercased(Schema<String, I> self) {
    return hinted(self, s -> s.equals(s.toUpperCase(Locale.ROOT)), "an uppercase string",
        Map.of("pattern", "^[^a-z]*$"));
  }

  // ------------------------------------------------------------------
  // Numbers
  // ------------------------------------------------------------------

  public static <I> Schema<Number, I> greaterThan(Schema<Number, I> self, Number min) {
    return hinted(self, n -> holds(n, min, c -> c > 0), "a number greater than " + Numbers.format(min),
        Map.of("exclusiveMinimum", min));
  }

  public static <I> Schema<Number, I> greaterThanOrEqualTo(Schema<Number, I> self, Number min) {
    return hinted(self, n -> holds(n, min, c -> c >= 0), "a number greater than or equal to " + Numbers.format(min),
        Map.of("minimum", min));
  }

  public static <I> Schema<Number, I> lessThan(Schema<Number, I> self, Number max) {
    return hinted(self, n -> holds(n, max, c -> c < 0), "a number less than " + Numbers.format(max),
        Map.of("exclusiveMaximum", max));
  }

  public static <I> Schema<Number, I> lessThanOrEqualTo(Schema<Number, I> self, Number max) {
    return hinted(self, n -> holds(n, max, c -> c <= 0), "a number less than or equal to " + Numbers.format(max),
        Map.of("maximum", max));
  }

  public static <I> Schema<Number, I> between(Schema<Number, I> self, Number min, Number max) {
    return hinted(self, n -> holds(n, min, c -> c >= 0) && holds(n, max, c -> c <= 0),
        "a number between " + Numbers.format(min) + " and " + Numbers.format(max),
        Map.of("minimum", min, "maximum", max));
  }

  public static <I> Schema<Number, I> integer(Schema<Number, I> self) {
    return hinted(self, Numbers::isInteger, "an integer", Map.of("type", "integer"));
  }

  public static <I> Schema<Number, I> positive(Schema<Number, I> self) {
    return hinted(self, n -> holds(n, 0, c -> c > 0), "a positive number", Map.of("exclusiveMinimum", 0));
  }

  public static <I> Schema<Number, I> negative(Schema<Number, I> self) {
    return hinted(self, n -> holds(n, 0, c -> c < 0), "a negative number", Map.of("exclusiveMaximum", 0));
  }

  public static <I> Schema<Number, I> nonNegative(Schema<Number, I> self) {
    return hinted(self, n -> holds(n, 0, c -> c >= 0), "a non-negative number", Map.of("minimum", 0));
  }

  public static <I> Schema<Number, I> nonPositive(Schema<Number, I> self) {
    return hinted(self, n -> holds(n, 0, c -> c <= 0), "a non-positive number", Map.of("maximum", 0));
  }

  public static <I> Schema<Number, I> multipleOf(Schema<Number, I> self, Number divisor) {
    final BigDecimal d = Numbers.toBigDecimal(divisor);
    if (d == null || d.signum() == 0) {
      throw new IllegalArgumentException("multipleOf requires a finite non-zero divisor, got " + divisor);
    }
    return hinted(self, n -> {
      final BigDecimal value = Numbers.toBigDecimal(n);
      return value != null && value.remainder(d).signum() == 0;
    }, "a number divisible by " + Numbers.format(divisor), Map.of("multipleOf", divisor));
  }

  public static <I> Schema<Number, I> finite(Schema<Number, I> self) {
    return Schemas.filter(self, Numbers::isFinite, "a finite number");
  }

  public static <I> Schema<Number, I> nonNaN(Schema<Number, I> self) {
    return Schemas.filter(self, n -> !Numbers.isNaN(n), "a number excluding NaN");
  }

  // ------------------------------------------------------------------
  // Bigints
  // ------------------------------------------------------------------

  public static <I> Schema<BigInteger, I> greaterThanBigInt(Schema<BigInteger, I> self, BigInteger min) {
    Objects.requireNonNull(min, "min");
    return Schemas.filter(self, b -> b.compareTo(min) > 0, "a bigint greater than " + min + "n");
  }

  public static <I> Schema<BigInteger, I> lessThanBigInt(Schema<BigInteger, I> self, BigInteger max) {
    Objects.requireNonNull(max, "max");
    return Schemas.filter(self, b -> b.compareTo(max) < 0, "a bigint less than " + max + "n");
  }

  public static <I> Schema<BigInteger, I> betweenBigInt(Schema<BigInteger, I> self, BigInteger min, BigInteger max) {
    Objects.requireNonNull(min, "min");
    Objects.requireNonNull(max, "max");
    return Schemas.filter(self, b -> b.compareTo(min) >= 0 && b.compareTo(max) <= 0,
        "a bigint between " + min + "n and " + max + "n");
  }

  // ------------------------------------------------------------------
  // Arrays
  // ------------------------------------------------------------------

  public static <T, I> Schema<List<T>, I> minItems(Schema<List<T>, I> self, int min) {
    return hinted(self, l -> l.size() >= min, "an array of at least " + min + " item(s)", Map.of("minItems", min));
  }

  public static <T, I> Schema<List<T>, I> maxItems(Schema<List<T>, I> self, int max) {
    return hinted(self, l -> l.size() <= max, "an array of at most " + max + " item(s)", Map.of("maxItems", max));
  }

  public static <T, I> Schema<List<T>, I> itemsCount(Schema<List<T>, I> self, int count) {
    return hinted(self, l -> l.size() == count, "an array of exactly " + count + " item(s)",
        Map.of("minItems", count, "maxItems", count));
  }

  private static <A, I> Schema<A, I> hinted(Schema<A, I> self, Predicate<? super A> predicate,
                                            String description, Map<String, Object> jsonSchema) {
    return Schemas.filter(self, predicate, description).annotate(AnnotationKey.JSON_SCHEMA, jsonSchema);
  }

  /// NaN is unordered and fails every bound.
  private static boolean holds(Number value, Number bound, IntPredicate accept) {
    final Integer c = Numbers.compare(value, bound);
    return c != null && accept.test(c);
  }
}
