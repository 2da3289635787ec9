package io.github.simbo1905.shape;

import java.util.stream.Collectors;

/// Default wording of each issue kind.
final class IssueMessages {

  private IssueMessages() {}

  static String defaultMessage(ParseIssue issue) {
    return switch (issue.kind()) {
      case TYPE_MISMATCH, FORBIDDEN, COMPOSITE -> expected(issue);
      case MISSING_KEY -> "is missing";
      case UNEXPECTED_KEY -> {
        final var unexpected = (ParseIssue.UnexpectedKey) issue;
        yield unexpected.expectedKeys().isEmpty()
            ? "is unexpected, expected no keys"
            : "is unexpected, expected: " + unexpected.expectedKeys().stream()
                .map(Formatting::preview).collect(Collectors.joining(" | "));
      }
      case TRANSFORM_FAILED -> "Transformation " + Formatting.describe(issue.ast()) + " failed, actual "
          + Formatting.preview(issue.actual());
    };
  }

  private static String expected(ParseIssue issue) {
    return "Expected " + Formatting.describe(issue.ast()) + ", actual " + Formatting.preview(issue.actual());
  }
}
