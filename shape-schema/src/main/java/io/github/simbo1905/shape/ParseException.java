package io.github.simbo1905.shape;

import java.util.List;
import java.util.Objects;

/// Thrown by the "-Sync" and assert entry points; the message is the rendered issue tree.
public final class ParseException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final transient ParseIssue issue;

  public ParseException(ParseIssue issue) {
    super(TreeFormatter.format(Objects.requireNonNull(issue, "issue")));
    this.issue = issue;
  }

  public ParseIssue issue() {
    return issue;
  }

  /// Leaf issues as flat entries.
  public List<IssueEntry> entries() {
    return ArrayFormatter.format(issue);
  }
}
