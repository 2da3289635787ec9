package io.github.simbo1905.shape;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// A failure found while decoding, encoding or validating.
///
/// Every issue carries the absolute [Path] of the offending value, the node that
/// rejected it, the actual value and an optional custom message (set from the
/// node's [AnnotationKey#MESSAGE] annotation). A [Composite] groups independent
/// failures: the fields of a struct in `ALL` mode, or the members of a union.
public sealed interface ParseIssue
    permits ParseIssue.TypeMismatch, ParseIssue.MissingKey, ParseIssue.UnexpectedKey, ParseIssue.Forbidden,
    ParseIssue.TransformFailed, ParseIssue.Composite {

  IssueKind kind();

  Path path();

  Ast ast();

  Object actual();

  Optional<String> message();

  ParseIssue withMessage(String text);

  /// Same issue tree with every path placed under `prefix`.
  ParseIssue under(Path prefix);

  default List<ParseIssue> children() {
    return List.of();
  }

  /// The custom message when set, otherwise the default wording.
  default String messageText() {
    return message().orElseGet(() -> IssueMessages.defaultMessage(this));
  }

  /// Value does not have the expected shape.
  record TypeMismatch(Path path, Ast ast, Object actual, Optional<String> message) implements ParseIssue {
    public TypeMismatch {
      Objects.requireNonNull(path, "path");
      Objects.requireNonNull(ast, "ast");
      Objects.requireNonNull(message, "message");
    }

    @Override
    public IssueKind kind() {
      return IssueKind.TYPE_MISMATCH;
    }

    @Override
    public TypeMismatch withMessage(String text) {
      return new TypeMismatch(path, ast, actual, Optional.of(text));
    }

    @Override
    public TypeMismatch under(Path prefix) {
      return new TypeMismatch(path.under(prefix), ast, actual, message);
    }
  }

  /// Required key absent. The actual value is [Undefined#INSTANCE].
  record MissingKey(Path path, Ast ast, Optional<String> message) implements ParseIssue {
    public MissingKey {
      Objects.requireNonNull(path, "path");
      Objects.requireNonNull(ast, "ast");
      Objects.requireNonNull(message, "message");
    }

    @Override
    public IssueKind kind() {
      return IssueKind.MISSING_KEY;
    }

    @Override
    public Object actual() {
      return Undefined.INSTANCE;
    }

    @Override
    public MissingKey withMessage(String text) {
      return new MissingKey(path, ast, Optional.of(text));
    }

    @Override
    public MissingKey under(Path prefix) {
      return new MissingKey(path.under(prefix), ast, message);
    }
  }

  /// Key not declared by the struct while excess keys are rejected.
  record UnexpectedKey(Path path, Ast ast, Object actual, List<String> expectedKeys, Optional<String> message)
      implements ParseIssue {
    public UnexpectedKey {
      Objects.requireNonNull(path, "path");
      Objects.requireNonNull(ast, "ast");
      Objects.requireNonNull(message, "message");
      expectedKeys = List.copyOf(expectedKeys);
    }

    @Override
    public IssueKind kind() {
      return IssueKind.UNEXPECTED_KEY;
    }

    @Override
    public UnexpectedKey withMessage(String text) {
      return new UnexpectedKey(path, ast, actual, expectedKeys, Optional.of(text));
    }

    @Override
    public UnexpectedKey under(Path prefix) {
      return new UnexpectedKey(path.under(prefix), ast, actual, expectedKeys, message);
    }
  }

  /// Refinement predicate rejected an otherwise well-shaped value.
  record Forbidden(Path path, Ast ast, Object actual, Optional<String> message) implements ParseIssue {
    public Forbidden {
      Objects.requireNonNull(path, "path");
      Objects.requireNonNull(ast, "ast");
      Objects.requireNonNull(message, "message");
    }

    @Override
    public IssueKind kind() {
      return IssueKind.FORBIDDEN;
    }

    @Override
    public Forbidden withMessage(String text) {
      return new Forbidden(path, ast, actual, Optional.of(text));
    }

    @Override
    public Forbidden under(Path prefix) {
      return new Forbidden(path.under(prefix), ast, actual, message);
    }
  }

  /// Transform function reported failure or threw.
  record TransformFailed(Path path, Ast ast, Object actual, Optional<String> message) implements ParseIssue {
    public TransformFailed {
      Objects.requireNonNull(path, "path");
      Objects.requireNonNull(ast, "ast");
      Objects.requireNonNull(message, "message");
    }

    @Override
    public IssueKind kind() {
      return IssueKind.TRANSFORM_FAILED;
    }

    @Override
    public TransformFailed withMessage(String text) {
      return new TransformFailed(path, ast, actual, Optional.of(text));
    }

    @Override
    public TransformFailed under(Path prefix) {
      return new TransformFailed(path.under(prefix), ast, actual, message);
    }
  }

  /// Ordered group of independent failures found at one node.
  record Composite(Path path, Ast ast, Object actual, List<ParseIssue> issues, Optional<String> message)
      implements ParseIssue {
    public Composite {
      Objects.requireNonNull(path, "path");
      Objects.requireNonNull(ast, "ast");
      Objects.requireNonNull(message, "message");
      issues = List.copyOf(issues);
    }

    @Override
    public IssueKind kind() {
      return IssueKind.COMPOSITE;
    }

    @Override
    public List<ParseIssue> children() {
      return issues;
    }

    @Override
    public Composite withMessage(String text) {
      return new Composite(path, ast, actual, issues, Optional.of(text));
    }

    @Override
    public Composite under(Path prefix) {
      return new Composite(path.under(prefix), ast, actual,
          issues.stream().map(issue -> issue.under(prefix)).toList(), message);
    }
  }
}
