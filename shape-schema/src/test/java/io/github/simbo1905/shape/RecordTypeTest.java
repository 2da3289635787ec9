package io.github.simbo1905.shape;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordTypeTest extends ShapeTestBase {

  private static final Logger LOG = Logger.getLogger(RecordTypeTest.class.getName());

  @Test
  void recordDecodesEveryEntry() {
    LOG.info("EXECUTING: recordDecodesEveryEntry");
    final var scores = Schemas.record(Schemas.string(), Schemas.number());
    final Map<String, Number> decoded = Decoder.decodeUnknownSync(scores, map("ann", 3, "bob", 4));
    assertThat(decoded).containsExactly(Map.entry("ann", 3), Map.entry("bob", 4));
    assertThatThrownBy(() -> decoded.put("cy", 5)).isInstanceOf(UnsupportedOperationException.class);
    assertThat(scores.toString()).isEqualTo("Record<string, number>");
  }

  @Test
  void badValueIsReportedUnderItsKey() {
    LOG.info("EXECUTING: badValueIsReportedUnderItsKey");
    final var scores = Schemas.record(Schemas.string(), Schemas.number());
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(scores, map("ann", 3, "bob", "four")));
    assertThat(issue.path()).isEqualTo(Path.of("bob"));
    assertThat(issue.messageText()).isEqualTo("Expected number, actual \"four\"");
  }

  @Test
  void keysAreDecodedToo() {
    LOG.info("EXECUTING: keysAreDecodedToo");
    final var shortKeys = Schemas.record(Filters.maxLength(Schemas.string(), 3), Schemas.number());
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(shortKeys, map("toolong", 1)));
    assertThat(issue.kind()).isEqualTo(IssueKind.FORBIDDEN);
    assertThat(issue.path()).isEqualTo(Path.of("toolong"));

    final var upper = Schemas.record(Transformations.uppercase(), Schemas.number());
    assertThat(Decoder.decodeUnknownSync(upper, map("ab", 1))).isEqualTo(Map.of("AB", 1));
  }

  @Test
  void nonStringKeysAreRejectedByAStringKeySchema() {
    LOG.info("EXECUTING: nonStringKeysAreRejectedByAStringKeySchema");
    final var scores = Schemas.record(Schemas.string(), Schemas.number());
    final Map<Object, Object> input = new HashMap<>();
    input.put(1, 2);
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(scores, input));
    assertThat(issue.path()).isEqualTo(Path.of(1));
    assertThat(issue.messageText()).isEqualTo("Expected string, actual 1");
  }

  @Test
  void mutableRecordOutput() {
    LOG.info("EXECUTING: mutableRecordOutput");
    final var scores = Schemas.mutable(Schemas.record(Schemas.string(), Schemas.number()));
    final Map<String, Number> decoded = Decoder.decodeUnknownSync(scores, map("ann", 3));
    decoded.put("bob", 4);
    assertThat(decoded).hasSize(2);
  }

  @Test
  void recordEncodesKeysAndValues() {
    LOG.info("EXECUTING: recordEncodesKeysAndValues");
    final var schema = Schemas.record(Schemas.string(), Transformations.numberFromString());
    final Map<String, String> encoded = Encoder.encodeUnknownSync(schema, map("a", 1L, "b", 2.5));
    assertThat(encoded).isEqualTo(Map.of("a", "1", "b", "2.5"));
  }
}
