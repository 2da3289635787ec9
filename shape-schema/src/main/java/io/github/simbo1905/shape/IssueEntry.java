package io.github.simbo1905.shape;

import java.util.Objects;

/// One flattened issue: where, what and which kind.
public record IssueEntry(Path path, String message, IssueKind kind) {
  public IssueEntry {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(kind, "kind");
  }

  @Override
  public String toString() {
    return path.isRoot() ? message : path + " " + message;
  }
}
