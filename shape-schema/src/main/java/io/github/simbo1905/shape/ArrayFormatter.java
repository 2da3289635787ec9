package io.github.simbo1905.shape;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Flattens an issue tree into one entry per leaf, depth-first, left to right.
///
/// A composite with a custom message is kept as a single entry since the
/// message was written to replace its children.
public final class ArrayFormatter {

  private ArrayFormatter() {}

  public static List<IssueEntry> format(ParseIssue issue) {
    Objects.requireNonNull(issue, "issue");
    final var entries = new ArrayList<IssueEntry>();
    collect(issue, entries);
    return List.copyOf(entries);
  }

  private static void collect(ParseIssue issue, List<IssueEntry> out) {
    if (issue instanceof ParseIssue.Composite composite
        && composite.message().isEmpty()
        && !composite.issues().isEmpty()) {
      for (ParseIssue child : composite.issues()) {
        collect(child, out);
      }
      return;
    }
    out.add(new IssueEntry(issue.path(), issue.messageText(), issue.kind()));
  }
}
