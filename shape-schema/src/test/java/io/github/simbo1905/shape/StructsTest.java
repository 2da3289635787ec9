package io.github.simbo1905.shape;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.logging.Logger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StructsTest extends ShapeTestBase {

  private static final Logger LOG = Logger.getLogger(StructsTest.class.getName());

  private static final Schema<Map<String, Object>, Map<String, Object>> USER = Schemas.struct(
      Schemas.field("id", Schemas.number()),
      Schemas.field("name", Schemas.string()),
      Schemas.field("email", Schemas.optional(Schemas.string())));

  @Test
  void pickKeepsNamedPropertiesInDeclarationOrder() {
    LOG.info("EXECUTING: pickKeepsNamedPropertiesInDeclarationOrder");
    final var picked = Structs.pick(USER, "name", "id");
    assertThat(picked.toString()).isEqualTo("{ id: number; name: string }");
    assertThat(Decoder.decodeUnknownSync(picked, Map.of("id", 1, "name", "a", "email", "x")))
        .isEqualTo(Map.of("id", 1, "name", "a"));
    assertThatThrownBy(() -> Structs.pick(USER, "nope")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void omitDropsNamedProperties() {
    LOG.info("EXECUTING: omitDropsNamedProperties");
    final var omitted = Structs.omit(USER, "email");
    assertThat(omitted.toString()).isEqualTo("{ id: number; name: string }");
  }

  @Test
  void extendAppendsProperties() {
    LOG.info("EXECUTING: extendAppendsProperties");
    final Schema<Map<String, Object>, Map<String, Object>> admin =
        Structs.extend(USER, Schemas.struct(Schemas.field("level", Schemas.number())));
    assertThat(admin.toString()).isEqualTo("{ id: number; name: string; email?: string; level: number }");
    assertThatThrownBy(() -> Structs.extend(USER, Schemas.struct(Schemas.field("id", Schemas.string()))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("duplicate");
  }

  @Test
  void extendDistributesOverUnions() {
    LOG.info("EXECUTING: extendDistributesOverUnions");
    final Schema<Map<String, Object>, Map<String, Object>> variants = Schemas.union(
        Schemas.struct(Schemas.field("kind", Schemas.literal("a"))),
        Schemas.struct(Schemas.field("kind", Schemas.literal("b"))));
    final Schema<Map<String, Object>, Map<String, Object>> extended = Structs.extend(variants, USER);
    assertThat(extended.ast()).isInstanceOf(Ast.Union.class);
    assertThat(((Ast.Union) extended.ast()).members()).hasSize(2);
    assertThat(Validator.isValid(extended, Map.of("kind", "b", "id", 1, "name", "n"))).isTrue();
    assertThat(Validator.isValid(extended, Map.of("kind", "b"))).isFalse();
  }

  @Test
  void partialMakesEveryPropertyOptional() {
    LOG.info("EXECUTING: partialMakesEveryPropertyOptional");
    final var partial = Structs.partial(USER);
    assertThat(Decoder.decodeUnknownSync(partial, Map.of())).isEmpty();
    assertThat(Decoder.decodeUnknown(partial, map("id", Undefined.INSTANCE)).isSuccess()).isTrue();

    final var exact = Structs.partialExact(USER);
    assertThat(Decoder.decodeUnknownSync(exact, Map.of())).isEmpty();
    assertThat(Decoder.decodeUnknown(exact, map("id", Undefined.INSTANCE)).isFailure()).isTrue();
  }

  @Test
  void requiredMakesEveryPropertyRequired() {
    LOG.info("EXECUTING: requiredMakesEveryPropertyRequired");
    final var strict = Structs.required(USER);
    final ParseIssue issue = issueOf(Decoder.decodeUnknown(strict, Map.of("id", 1, "name", "a")));
    assertThat(issue.kind()).isEqualTo(IssueKind.MISSING_KEY);
    assertThat(issue.path()).isEqualTo(Path.of("email"));
  }

  @Test
  void renameChangesTypeSideKeysOnly() {
    LOG.info("EXECUTING: renameChangesTypeSideKeysOnly");
    final var renamed = Structs.rename(USER, Map.of("name", "displayName"));
    final Map<String, Object> decoded = Decoder.decodeUnknownSync(renamed, Map.of("id", 1, "name", "a"));
    assertThat(decoded).isEqualTo(Map.of("id", 1, "displayName", "a"));
    assertThat(Encoder.encodeUnknownSync(renamed, decoded)).isEqualTo(Map.of("id", 1, "name", "a"));
    assertThatThrownBy(() -> Structs.rename(USER, Map.of("missing", "x")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void renameKeepsAnExistingEncodedKey() {
    LOG.info("EXECUTING: renameKeepsAnExistingEncodedKey");
    final var snake = Schemas.struct(
        Schemas.field("firstName", Schemas.required(Schemas.string()).fromKey("first_name")));
    final var renamed = Structs.rename(snake, Map.of("firstName", "given"));
    assertThat(Decoder.decodeUnknownSync(renamed, Map.of("first_name", "Ann"))).isEqualTo(Map.of("given", "Ann"));
  }

  @Test
  void mutableStructOutput() {
    LOG.info("EXECUTING: mutableStructOutput");
    final Map<String, Object> decoded = Decoder.decodeUnknownSync(Structs.mutable(USER), Map.of("id", 1, "name", "a"));
    decoded.put("email", "x");
    assertThat(decoded).hasSize(3);
    assertThatThrownBy(() -> Structs.mutable(Schemas.string())).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void duplicateEncodedKeysAreRejected() {
    LOG.info("EXECUTING: duplicateEncodedKeysAreRejected");
    assertThatThrownBy(() -> Schemas.struct(
        Schemas.field("a", Schemas.string()),
        Schemas.field("b", Schemas.required(Schemas.string()).fromKey("a"))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("duplicate encoded key: a");
  }

  @Test
  void operatorsLeaveTheirInputUntouched() {
    LOG.info("EXECUTING: operatorsLeaveTheirInputUntouched");
    final String before = USER.toString();
    Structs.partial(USER);
    Structs.omit(USER, "id");
    Structs.rename(USER, Map.of("id", "key"));
    assertThat(USER.toString()).isEqualTo(before);
  }
}
