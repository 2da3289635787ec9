package io.github.simbo1905.shape;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;

class IssueFormattingTest extends ShapeTestBase {

  private static final Logger LOG = Logger.getLogger(IssueFormattingTest.class.getName());

  private static final ParseOptions ALL = ParseOptions.DEFAULT.withErrors(ParseOptions.ErrorMode.ALL);

  private static final Schema<Map<String, Object>, Map<String, Object>> PERSON = Schemas.struct(
      Schemas.field("name", Schemas.string()),
      Schemas.field("age", Filters.nonNegative(Schemas.number())));

  @Test
  void treeFormatterDrawsNestedIssues() {
    LOG.info("EXECUTING: treeFormatterDrawsNestedIssues");
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(PERSON, Map.of("age", -5), ALL));
    assertThat(TreeFormatter.format(issue)).isEqualTo(String.join("\n",
        "Expected { name: string; age: a non-negative number }, actual {\"age\":-5}",
        "├─ [\"name\"] is missing",
        "└─ [\"age\"] Expected a non-negative number, actual -5"));
  }

  @Test
  void treeFormatterIndentsDeeperLevels() {
    LOG.info("EXECUTING: treeFormatterIndentsDeeperLevels");
    final var team = Schemas.struct(
        Schemas.field("lead", PERSON),
        Schemas.field("size", Schemas.number()));
    final ParseIssue issue =
        issueOf(Decoder.decodeUnknown(team, Map.of("lead", Map.of("age", -5), "size", "x"), ALL));
    final List<String> lines = TreeFormatter.format(issue).lines().toList();
    assertThat(lines).hasSize(5);
    assertThat(lines.get(1)).isEqualTo(
        "├─ [\"lead\"] Expected { name: string; age: a non-negative number }, actual {\"age\":-5}");
    assertThat(lines.get(2)).isEqualTo("│  ├─ [\"name\"] is missing");
    assertThat(lines.get(3)).isEqualTo("│  └─ [\"age\"] Expected a non-negative number, actual -5");
    assertThat(lines.get(4)).isEqualTo("└─ [\"size\"] Expected number, actual \"x\"");
  }

  @Test
  void singleIssueIsOneLine() {
    LOG.info("EXECUTING: singleIssueIsOneLine");
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(PERSON, Map.of("name", "a", "age", -1)));
    assertThat(TreeFormatter.format(issue)).isEqualTo("[\"age\"] Expected a non-negative number, actual -1");
  }

  @Test
  void arrayFormatterFlattensLeaves() {
    LOG.info("EXECUTING: arrayFormatterFlattensLeaves");
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(PERSON, Map.of("age", -5), ALL));
    final List<IssueEntry> entries = ArrayFormatter.format(issue);
    assertThat(entries).containsExactly(
        new IssueEntry(Path.of("name"), "is missing", IssueKind.MISSING_KEY),
        new IssueEntry(Path.of("age"), "Expected a non-negative number, actual -5", IssueKind.FORBIDDEN));
    assertThat(entries.get(0).toString()).isEqualTo("[\"name\"] is missing");
  }

  @Test
  void unionFailureListsEachMember() {
    LOG.info("EXECUTING: unionFailureListsEachMember");
    final Schema<Object, Object> scalar = Schemas.union(Schemas.string(), Schemas.number());
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(scalar, true));
    assertThat(TreeFormatter.format(issue)).isEqualTo(String.join("\n",
        "Expected string | number, actual true",
        "├─ Expected string, actual true",
        "└─ Expected number, actual true"));
    assertThat(ArrayFormatter.format(issue)).hasSize(2);
  }

  @Test
  void transformFailureWording() {
    LOG.info("EXECUTING: transformFailureWording");
    final Schema<Number, String> strict = Schemas.transform(Schemas.string(), Schemas.number(),
        s -> Long.valueOf(s), n -> n.toString());
    final var issue = new ParseIssue.TransformFailed(Path.ROOT, strict.ast(), "x", java.util.Optional.empty());
    assertThat(issue.messageText()).isEqualTo("Transformation (string <-> number) failed, actual \"x\"");
  }

  @Test
  void parseExceptionCarriesTheTree() {
    LOG.info("EXECUTING: parseExceptionCarriesTheTree");
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(PERSON, Map.of("age", -5), ALL));
    final var exception = new ParseException(issue);
    assertThat(exception.getMessage()).isEqualTo(TreeFormatter.format(issue));
    assertThat(exception.issue()).isSameAs(issue);
    assertThat(exception.entries()).hasSize(2);
  }

  @Test
  void valuesArePreviewedCompactly() {
    LOG.info("EXECUTING: valuesArePreviewedCompactly");
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(Schemas.string(), List.of(1, 2, 3, 4, 5, 6, 7, 8, 9)));
    assertThat(issue.messageText()).isEqualTo("Expected string, actual [1,2,3,4,5,6,7,8,...]");
    assertThat(issueOf(Decoder.decodeUnknown(Schemas.number(), "a\nb")).messageText())
        .isEqualTo("Expected number, actual \"a\\nb\"");
    assertThat(issueOf(Decoder.decodeUnknown(Schemas.number(), "a\"b")).messageText())
        .isEqualTo("Expected number, actual \"a\\\"b\"");
  }

  @Test
  void pathsRenderAsPointers() {
    LOG.info("EXECUTING: pathsRenderAsPointers");
    final var path = Path.of("a/b", 0, "c~d");
    assertThat(path.toPointer()).isEqualTo("/a~1b/0/c~0d");
    assertThat(path.toString()).isEqualTo("[\"a/b\"][0][\"c~d\"]");
    assertThat(Path.of("x", 1).under(Path.of("root"))).isEqualTo(Path.of("root", "x", 1));
    assertThat(Path.of("root", "x").relativeTo(Path.of("root"))).isEqualTo(Path.of("x"));
  }
}
