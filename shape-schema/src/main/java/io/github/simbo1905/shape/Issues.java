package io.github.simbo1905.shape;

import java.util.List;
import java.util.Optional;

import static io.github.simbo1905.shape.ShapeLogging.LOG;

/// Issue factories used by the interpreter. Each applies the node's
/// [AnnotationKey#MESSAGE] annotation, when present, to the new issue.
final class Issues {

  private Issues() {}

  static ParseIssue typeMismatch(Ast ast, Path path, Object actual) {
    return customize(new ParseIssue.TypeMismatch(path, ast, actual, Optional.empty()));
  }

  static ParseIssue typeMismatch(Ast ast, Path path, Object actual, String message) {
    return new ParseIssue.TypeMismatch(path, ast, actual, Optional.of(message));
  }

  static ParseIssue missing(PropertySignature ps, Path path) {
    final Optional<String> message = ps.annotations().get(AnnotationKey.MISSING_MESSAGE).map(supplier -> supplier.get());
    return new ParseIssue.MissingKey(path, ps.type(), message);
  }

  static ParseIssue unexpected(Ast.Struct struct, Path path, Object actual, List<String> expectedKeys) {
    return new ParseIssue.UnexpectedKey(path, struct, actual, expectedKeys, Optional.empty());
  }

  static ParseIssue forbidden(Ast.Refinement refinement, Path path, Object actual, String detail) {
    final var issue = new ParseIssue.Forbidden(path, refinement, actual, Optional.empty());
    return detail == null ? customize(issue) : customize(issue.withMessage(IssueMessages.defaultMessage(issue) + ": " + detail));
  }

  static ParseIssue transformFailed(Ast.Transformation transformation, Path path, Object actual, String detail) {
    final var issue = new ParseIssue.TransformFailed(path, transformation, actual, Optional.ofNullable(detail));
    return customize(issue);
  }

  /// A single issue as is, several grouped under `ast`.
  static ParseIssue collapse(Ast ast, Path path, Object actual, List<ParseIssue> issues) {
    if (issues.size() == 1) {
      return issues.get(0);
    }
    return composite(ast, path, actual, issues);
  }

  static ParseIssue composite(Ast ast, Path path, Object actual, List<ParseIssue> issues) {
    return customize(new ParseIssue.Composite(path, ast, actual, issues, Optional.empty()));
  }

  private static ParseIssue customize(ParseIssue issue) {
    final var custom = issue.ast().annotations().get(AnnotationKey.MESSAGE);
    if (custom.isEmpty()) {
      return issue;
    }
    try {
      final String text = custom.get().apply(issue);
      return text == null ? issue : issue.withMessage(text);
    } catch (RuntimeException e) {
      LOG.fine(() -> "custom message function failed at " + issue.path() + ", keeping default message: " + e);
      return issue;
    }
  }
}
