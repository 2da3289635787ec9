package io.github.simbo1905.shape;

/// Category of a [ParseIssue], as reported by the formatters.
public enum IssueKind {
  TYPE_MISMATCH,
  MISSING_KEY,
  UNEXPECTED_KEY,
  FORBIDDEN,
  TRANSFORM_FAILED,
  COMPOSITE
}
