package io.github.simbo1905.shape;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransformationTest extends ShapeTestBase {

  private static final Logger LOG = Logger.getLogger(TransformationTest.class.getName());

  record Person(String name, int age) {}

  record Money(long cents) {
    Money {
      if (cents < 0) {
        throw new IllegalArgumentException("negative amount");
      }
    }
  }

  enum Colour { RED, GREEN }

  // ------------------------------------------------------------------
  // Built-in conversions
  // ------------------------------------------------------------------

  @Test
  void numberFromStringDecodesAndEncodes() {
    LOG.info("EXECUTING: numberFromStringDecodesAndEncodes");
    final var schema = Transformations.numberFromString();
    assertThat(Decoder.decodeUnknownSync(schema, "42")).isEqualTo(42L);
    assertThat(Decoder.decodeUnknownSync(schema, "1.5")).isEqualTo(1.5);
    assertThat(Decoder.decodeUnknownSync(schema, "NaN")).isEqualTo(Double.NaN);
    assertThat(Encoder.encodeUnknownSync(schema, 30.0)).isEqualTo("30");
    assertThat(Encoder.encodeUnknownSync(schema, 1.5)).isEqualTo("1.5");
  }

  @Test
  void numberFromStringRejectsText() {
    LOG.info("EXECUTING: numberFromStringRejectsText");
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(Transformations.numberFromString(), "abc"));
    assertThat(issue.kind()).isEqualTo(IssueKind.TRANSFORM_FAILED);
    assertThat(issue.path().isRoot()).isTrue();
    assertThat(issue.actual()).isEqualTo("abc");
    assertThat(issue.messageText()).isEqualTo("Unable to decode \"abc\" into a number");

    final ParseIssue wrongInput = issueOf(Decoder.decodeUnknown(Transformations.numberFromString(), 42));
    assertThat(wrongInput.kind()).isEqualTo(IssueKind.TYPE_MISMATCH);
    assertThat(wrongInput.messageText()).isEqualTo("Expected string, actual 42");
  }

  @Test
  void failuresInsideAStructAreReportedAtTheProperty() {
    LOG.info("EXECUTING: failuresInsideAStructAreReportedAtTheProperty");
    final var schema = Schemas.struct(Schemas.field("count", Transformations.numberFromString()));
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(schema, Map.of("count", "x")));
    assertThat(issue.kind()).isEqualTo(IssueKind.TRANSFORM_FAILED);
    assertThat(issue.path()).isEqualTo(Path.of("count"));
  }

  @Test
  void returnedIssuesAreRebasedOntoTheTransformation() {
    LOG.info("EXECUTING: returnedIssuesAreRebasedOntoTheTransformation");
    final Schema<String, String> picky = Schemas.transformOrFail(Schemas.string(), Schemas.string(),
        s -> ParseResult.failure(new ParseIssue.Forbidden(Path.of("inner"), Ast.Primitive.STRING, s,
            Optional.of("inner value rejected"))),
        ParseResult::success);
    final var schema = Schemas.struct(Schemas.field("outer", picky));
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(schema, Map.of("outer", "v")));
    assertThat(issue.path()).isEqualTo(Path.of("outer", "inner"));
    assertThat(issue.messageText()).isEqualTo("inner value rejected");
  }

  @Test
  void throwingTotalTransformBecomesTransformFailed() {
    LOG.info("EXECUTING: throwingTotalTransformBecomesTransformFailed");
    final Schema<Number, String> strict = Schemas.transform(Schemas.string(), Schemas.number(),
        s -> Long.valueOf(s), n -> n.toString());
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(strict, "x1"));
    assertThat(issue.kind()).isEqualTo(IssueKind.TRANSFORM_FAILED);
    assertThat(issue.messageText()).contains("x1");
  }

  @Test
  void decodedValueMustSatisfyTheTargetSide() {
    LOG.info("EXECUTING: decodedValueMustSatisfyTheTargetSide");
    final Schema<Number, String> positive = Schemas.transform(Schemas.string(), Filters.positive(Schemas.number()),
        s -> Long.valueOf(s), n -> n.toString());
    assertThat(Decoder.decodeUnknownSync(positive, "5")).isEqualTo(5L);
    assertThat(issueOf(Decoder.decodeUnknown(positive, "-5")).messageText())
        .isEqualTo("Expected a positive number, actual -5");
    assertThat(issueOf(Encoder.encodeUnknown(positive, -5L)).kind()).isEqualTo(IssueKind.FORBIDDEN);
  }

  @Test
  void bigNumbersFromString() {
    LOG.info("EXECUTING: bigNumbersFromString");
    assertThat(Decoder.decodeUnknownSync(Transformations.bigintFromString(), "123456789012345678901234567890"))
        .isEqualTo(new BigInteger("123456789012345678901234567890"));
    assertThat(Encoder.encodeUnknownSync(Transformations.bigintFromString(), BigInteger.TEN)).isEqualTo("10");
    assertThat(Decoder.decodeUnknownSync(Transformations.bigDecimalFromString(), "1.50"))
        .isEqualTo(new BigDecimal("1.50"));
    assertThat(Encoder.encodeUnknownSync(Transformations.bigDecimalFromString(), new BigDecimal("1.50")))
        .isEqualTo("1.50");
    assertThat(Decoder.decodeUnknown(Transformations.bigintFromString(), "1.5").isFailure()).isTrue();
  }

  @Test
  void caseAndWhitespaceTransformations() {
    LOG.info("EXECUTING: caseAndWhitespaceTransformations");
    assertThat(Decoder.decodeUnknownSync(Transformations.trim(), "  a b ")).isEqualTo("a b");
    assertThat(Decoder.decodeUnknownSync(Transformations.lowercase(), "ABC")).isEqualTo("abc");
    assertThat(Decoder.decodeUnknownSync(Transformations.uppercase(), "abc")).isEqualTo("ABC");

    final ParseIssue issue = issueOf(Encoder.encodeUnknown(Transformations.trim(), " a "));
    assertThat(issue.kind()).isEqualTo(IssueKind.FORBIDDEN);
    assertThat(issue.messageText()).isEqualTo("Expected a string with no leading or trailing whitespace, actual \" a \"");
  }

  @Test
  void splitJoinsBackWithTheSeparator() {
    LOG.info("EXECUTING: splitJoinsBackWithTheSeparator");
    final var csv = Transformations.split(",");
    assertThat(Decoder.decodeUnknownSync(csv, "a,b,,c")).containsExactly("a", "b", "", "c");
    assertThat(Encoder.encodeUnknownSync(csv, List.of("x", "y"))).isEqualTo("x,y");
  }

  @Test
  void temporalAndIdentifierTransformations() {
    LOG.info("EXECUTING: temporalAndIdentifierTransformations");
    assertThat(Decoder.decodeUnknownSync(Transformations.instantFromString(), "2024-01-01T00:00:00Z"))
        .isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    assertThat(issueOf(Decoder.decodeUnknown(Transformations.instantFromString(), "yesterday")).messageText())
        .isEqualTo("Unable to decode \"yesterday\" into an Instant");
    assertThat(Encoder.encodeUnknownSync(Transformations.localDateFromString(), LocalDate.of(2024, 1, 31)))
        .isEqualTo("2024-01-31");
    final UUID id = UUID.randomUUID();
    assertThat(Decoder.decodeUnknownSync(Transformations.uuidFromString(), id.toString())).isEqualTo(id);
    assertThat(Decoder.decodeUnknown(Transformations.uuidFromString(), "not-a-uuid").isFailure()).isTrue();
  }

  @Test
  void notNegatesBothWays() {
    LOG.info("EXECUTING: notNegatesBothWays");
    assertThat(Decoder.decodeUnknownSync(Transformations.not(), true)).isFalse();
    assertThat(Encoder.encodeUnknownSync(Transformations.not(), true)).isFalse();
  }

  @Test
  void optionFromNullOr() {
    LOG.info("EXECUTING: optionFromNullOr");
    final var schema = Transformations.optionFromNullOr(Schemas.string());
    assertThat(Decoder.decodeUnknownSync(schema, null)).isEmpty();
    assertThat(Decoder.decodeUnknownSync(schema, "x")).contains("x");
    assertThat(Encoder.encodeUnknownSync(schema, Optional.empty())).isNull();
    assertThat(Encoder.encodeUnknownSync(schema, Optional.of("x"))).isEqualTo("x");
    assertThat(Encoder.encodeUnknown(schema, Optional.of(3)).isFailure()).isTrue();
  }

  // ------------------------------------------------------------------
  // Java types
  // ------------------------------------------------------------------

  @Test
  void enumFromName() {
    LOG.info("EXECUTING: enumFromName");
    final var schema = Transformations.enumFromName(Colour.class);
    assertThat(Decoder.decodeUnknownSync(schema, "GREEN")).isEqualTo(Colour.GREEN);
    assertThat(Encoder.encodeUnknownSync(schema, Colour.RED)).isEqualTo("RED");
    assertThat(issueOf(Decoder.decodeUnknown(schema, "PINK")).messageText())
        .isEqualTo("Expected \"RED\" | \"GREEN\", actual \"PINK\"");
  }

  @Test
  void recordOfBuildsJavaRecords() {
    LOG.info("EXECUTING: recordOfBuildsJavaRecords");
    final var schema = Transformations.recordOf(Person.class, Schemas.struct(
        Schemas.field("name", Schemas.string()),
        Schemas.field("age", Filters.integer(Schemas.number()))));
    assertThat(Decoder.decodeUnknownSync(schema, Map.of("name", "Ann", "age", 30))).isEqualTo(new Person("Ann", 30));
    assertThat(Decoder.decodeUnknownSync(schema, Map.of("name", "Ann", "age", 30.0))).isEqualTo(new Person("Ann", 30));
    assertThat(Encoder.encodeUnknownSync(schema, new Person("Bob", 4))).isEqualTo(Map.of("name", "Bob", "age", 4));
    assertThat(schema.toString()).isEqualTo("Person");
  }

  @Test
  void recordConstructorRejectionIsATransformFailure() {
    LOG.info("EXECUTING: recordConstructorRejectionIsATransformFailure");
    final var schema = Transformations.recordOf(Money.class,
        Schemas.struct(Schemas.field("cents", Schemas.number())));
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(schema, Map.of("cents", -1)));
    assertThat(issue.kind()).isEqualTo(IssueKind.TRANSFORM_FAILED);
    assertThat(issue.messageText()).isEqualTo("Money constructor failed: negative amount");
    assertThat(Decoder.decodeUnknown(schema, Map.of("cents", 2.5)).isFailure()).isTrue();
  }

  @Test
  void recordOfRejectsNonRecordsAtBuildTime() {
    LOG.info("EXECUTING: recordOfRejectsNonRecordsAtBuildTime");
    @SuppressWarnings({"unchecked", "rawtypes"}) final Class<Record> notARecord = (Class) String.class;
    assertThatThrownBy(() -> Transformations.recordOf(notARecord, Schemas.struct()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("is not a record class");
  }

  // ------------------------------------------------------------------
  // Composition
  // ------------------------------------------------------------------

  @Test
  void composeChainsDecodeAndEncode() {
    LOG.info("EXECUTING: composeChainsDecodeAndEncode");
    final Schema<Number, String> trimmedNumber = Schemas.compose(Transformations.trim(),
        Transformations.numberFromString());
    assertThat(Decoder.decodeUnknownSync(trimmedNumber, " 7 ")).isEqualTo(7L);
    assertThat(Encoder.encodeUnknownSync(trimmedNumber, 7L)).isEqualTo("7");
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(trimmedNumber, " x "));
    assertThat(issue.kind()).isEqualTo(IssueKind.TRANSFORM_FAILED);
    assertThat(issue.messageText()).isEqualTo("Unable to decode \"x\" into a number");
  }

  @Test
  void validateSkipsTransformFunctions() {
    LOG.info("EXECUTING: validateSkipsTransformFunctions");
    assertThat(Validator.isValid(Transformations.numberFromString(), 42)).isTrue();
    assertThat(Validator.isValid(Transformations.numberFromString(), "42")).isFalse();
  }

  // ------------------------------------------------------------------
  // Refinements over transformations
  // ------------------------------------------------------------------

  @Test
  void refinementOverTransformEncodesTheTypeValue() {
    LOG.info("EXECUTING: refinementOverTransformEncodesTheTypeValue");
    final Schema<Number, String> positiveText = Filters.positive(Transformations.numberFromString());
    assertThat(Decoder.decodeUnknownSync(positiveText, "5")).isEqualTo(5L);
    assertThat(Encoder.encodeUnknownSync(positiveText, 5L)).isEqualTo("5");

    final ParseIssue issue = issueOf(Encoder.encodeUnknown(positiveText, -1L));
    assertThat(issue.kind()).isEqualTo(IssueKind.FORBIDDEN);
    assertThat(issue.messageText()).isEqualTo("Expected a positive number, actual -1");

    final Schema<String, String> longTrimmed = Filters.minLength(Transformations.trim(), 3);
    assertThat(Encoder.encodeUnknownSync(longTrimmed, "abc")).isEqualTo("abc");
    assertThat(issueOf(Encoder.encodeUnknown(longTrimmed, "ab")).messageText())
        .isEqualTo("Expected a string at least 3 character(s) long, actual \"ab\"");
  }

  @Test
  void optionOfReportsTheContentIssue() {
    LOG.info("EXECUTING: optionOfReportsTheContentIssue");
    final var schema = Schemas.optionOf(Filters.minLength(Schemas.string(), 2));
    assertThat(Validator.isValid(schema, Optional.empty())).isTrue();
    assertThat(Validator.isValid(schema, Optional.of("ab"))).isTrue();

    final ParseIssue content = issueOf(Validator.validate(schema, Optional.of("a")));
    assertThat(content.kind()).isEqualTo(IssueKind.FORBIDDEN);
    assertThat(content.messageText()).isEqualTo("Expected a string at least 2 character(s) long, actual \"a\"");

    assertThat(issueOf(Validator.validate(schema, "ab")).messageText()).startsWith("Expected Optional<");
  }

  @Test
  void optionOfUsesTheCallersOptions() {
    LOG.info("EXECUTING: optionOfUsesTheCallersOptions");
    final var schema = Schemas.optionOf(Schemas.struct(Schemas.field("a", Schemas.string())));
    final var value = Optional.of(Map.of("a", "x", "b", "y"));
    assertThat(Validator.validate(schema, value).isSuccess()).isTrue();

    final var errors = ParseOptions.DEFAULT.withOnExcessProperty(ParseOptions.ExcessPropertyMode.ERROR);
    final ParseIssue issue = issueOf(Validator.validate(schema, value, errors));
    assertThat(issue.kind()).isEqualTo(IssueKind.UNEXPECTED_KEY);
    assertThat(issue.path()).isEqualTo(Path.of("b"));
  }
}
