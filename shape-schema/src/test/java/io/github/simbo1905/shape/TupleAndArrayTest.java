package io.github.simbo1905.shape;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TupleAndArrayTest extends ShapeTestBase {

  private static final Logger LOG = Logger.getLogger(TupleAndArrayTest.class.getName());

  @Test
  void arrayDecodesEveryItem() {
    LOG.info("EXECUTING: arrayDecodesEveryItem");
    final Schema<List<Number>, List<String>> numbers = Schemas.arrayOf(Transformations.numberFromString());
    assertThat(Decoder.decodeUnknownSync(numbers, List.of("1", "2", "3"))).containsExactly(1L, 2L, 3L);
    assertThat(Decoder.decodeUnknownSync(numbers, List.of())).isEmpty();
  }

  @Test
  void arrayReportsTheFirstBadIndex() {
    LOG.info("EXECUTING: arrayReportsTheFirstBadIndex");
    final var numbers = Schemas.arrayOf(Schemas.number());
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(numbers, List.of(1, "x", "y")));
    assertThat(issue.path()).isEqualTo(Path.of(1));
    assertThat(issue.messageText()).isEqualTo("Expected number, actual \"x\"");
  }

  @Test
  void arrayInAllModeGroupsBadIndices() {
    LOG.info("EXECUTING: arrayInAllModeGroupsBadIndices");
    final var numbers = Schemas.arrayOf(Schemas.number());
    final var options = ParseOptions.DEFAULT.withErrors(ParseOptions.ErrorMode.ALL);
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(numbers, List.of(1, "x", "y"), options));
    assertThat(issue.kind()).isEqualTo(IssueKind.COMPOSITE);
    assertThat(issue.children()).extracting(ParseIssue::path).containsExactly(Path.of(1), Path.of(2));
    assertThat(issue.messageText()).isEqualTo("Expected Array<number>, actual [1,\"x\",\"y\"]");
  }

  @Test
  void decodedListsAreUnmodifiableUnlessMutable() {
    LOG.info("EXECUTING: decodedListsAreUnmodifiableUnlessMutable");
    final List<Number> frozen = Decoder.decodeUnknownSync(Schemas.arrayOf(Schemas.number()), List.of(1));
    assertThatThrownBy(() -> frozen.add(2)).isInstanceOf(UnsupportedOperationException.class);

    final List<Number> open = Decoder.decodeUnknownSync(Schemas.mutable(Schemas.arrayOf(Schemas.number())),
        new ArrayList<>(List.of(1)));
    open.add(2);
    assertThat(open).containsExactly(1, 2);
  }

  @Test
  void tupleChecksLengthAndPositions() {
    LOG.info("EXECUTING: tupleChecksLengthAndPositions");
    final var pair = Schemas.tuple(Schemas.string(), Schemas.number());
    assertThat(Decoder.decodeUnknownSync(pair, List.of("a", 1))).containsExactly("a", 1);

    final ParseIssue tooShort = issueOf(Decoder.decodeUnknown(pair, List.of("a")));
    assertThat(tooShort.path().isRoot()).isTrue();
    assertThat(tooShort.messageText()).isEqualTo("Expected [string, number], actual [\"a\"]");

    assertThat(Decoder.decodeUnknown(pair, List.of("a", 1, 2)).isFailure()).isTrue();

    final ParseIssue wrongItem = issueOf(Decoder.decodeUnknown(pair, List.of("a", "b")));
    assertThat(wrongItem.path()).isEqualTo(Path.of(1));
  }

  @Test
  void optionalElementsMayBeOmitted() {
    LOG.info("EXECUTING: optionalElementsMayBeOmitted");
    final Schema<List<Object>, List<Object>> schema = Schema.of(new Ast.TupleType(
        List.of(Schemas.element(Schemas.string()), Schemas.optionalElement(Schemas.number())),
        List.of(), false, Annotations.EMPTY));
    assertThat(Validator.isValid(schema, List.of("a"))).isTrue();
    assertThat(Validator.isValid(schema, List.of("a", 1))).isTrue();
    assertThat(Validator.isValid(schema, List.of("a", 1, 2))).isFalse();
    assertThat(schema.toString()).isEqualTo("[string, number?]");
  }

  @Test
  void requiredElementCannotFollowAnOptionalOne() {
    LOG.info("EXECUTING: requiredElementCannotFollowAnOptionalOne");
    assertThatThrownBy(() -> new Ast.TupleType(
        List.of(Schemas.optionalElement(Schemas.number()), Schemas.element(Schemas.string())),
        List.of(), false, Annotations.EMPTY))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void restAndTrailingElements() {
    LOG.info("EXECUTING: restAndTrailingElements");
    final var schema = Schemas.tupleWithRest(List.of(Schemas.element(Schemas.string())),
        Schemas.number(), Schemas.booleanSchema());
    assertThat(schema.toString()).isEqualTo("[string, ...Array<number>, boolean]");
    assertThat(Validator.isValid(schema, List.of("a", true))).isTrue();
    assertThat(Validator.isValid(schema, List.of("a", 1, 2, 3, false))).isTrue();
    assertThat(Validator.isValid(schema, List.of("a"))).isFalse();

    final ParseIssue issue = issueOf(Validator.validate(schema, List.of("a", 1, "two", false)));
    assertThat(issue.path()).isEqualTo(Path.of(2));
  }

  @Test
  void nonEmptyArrayNeedsOneItem() {
    LOG.info("EXECUTING: nonEmptyArrayNeedsOneItem");
    final var names = Schemas.nonEmptyArray(Schemas.string());
    assertThat(Validator.isValid(names, List.of())).isFalse();
    assertThat(Validator.isValid(names, List.of("a"))).isTrue();
    assertThat(Validator.isValid(names, List.of("a", "b"))).isTrue();
  }

  @Test
  void nullItemsAreCheckedLikeAnyOther() {
    LOG.info("EXECUTING: nullItemsAreCheckedLikeAnyOther");
    final var schema = Schemas.arrayOf(Schemas.nullOr(Schemas.string()));
    assertThat(Decoder.decodeUnknownSync(schema, list("a", null))).containsExactly("a", null);
    assertThat(Decoder.decodeUnknown(Schemas.arrayOf(Schemas.string()), list("a", null)).isFailure()).isTrue();
  }
}
