package io.github.simbo1905.shape;

import java.util.List;
import java.util.Objects;

/// Renders an issue tree as indented text, one line per issue.
///
/// ```
/// Expected { name: string; age: number }, actual {"age":-5}
/// ├─ ["name"] is missing
/// └─ ["age"] Expected a non-negative number, actual -5
/// ```
///
/// Child paths are shown relative to their parent.
public final class TreeFormatter {

  private TreeFormatter() {}

  public static String format(ParseIssue issue) {
    Objects.requireNonNull(issue, "issue");
    final var sb = new StringBuilder();
    line(issue, Path.ROOT, sb);
    children(issue, "", sb);
    return sb.toString();
  }

  private static void children(ParseIssue parent, String indent, StringBuilder sb) {
    final List<ParseIssue> children = parent.children();
    if (parent.message().isPresent()) {
      return;
    }
    for (int i = 0; i < children.size(); i++) {
      final boolean last = i == children.size() - 1;
      final ParseIssue child = children.get(i);
      sb.append('\n').append(indent).append(last ? "└─ " : "├─ ");
      line(child, parent.path(), sb);
      children(child, indent + (last ? "   " : "│  "), sb);
    }
  }

  private static void line(ParseIssue issue, Path parentPath, StringBuilder sb) {
    final Path relative = issue.path().relativeTo(parentPath);
    if (!relative.isRoot()) {
      sb.append(relative).append(' ');
    }
    sb.append(issue.messageText());
  }
}
