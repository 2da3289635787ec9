package io.github.simbo1905.shape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Absolute location of a value inside the input: property keys and list indices from the root.
///
/// Rendered as `["address"]["lines"][0]`, or as a JSON pointer with [#toPointer()].
public record Path(List<Object> segments) {

  public static final Path ROOT = new Path(List.of());

  public Path {
    Objects.requireNonNull(segments, "segments");
    segments = Collections.unmodifiableList(new ArrayList<>(segments));
  }

  public static Path of(Object... segments) {
    return new Path(List.of(segments));
  }

  public Path append(Object segment) {
    final var next = new ArrayList<Object>(segments.size() + 1);
    next.addAll(segments);
    next.add(segment);
    return new Path(next);
  }

  /// `prefix` followed by this path.
  public Path under(Path prefix) {
    if (prefix.isRoot()) {
      return this;
    }
    final var next = new ArrayList<Object>(prefix.segments.size() + segments.size());
    next.addAll(prefix.segments);
    next.addAll(segments);
    return new Path(next);
  }

  /// This path with `prefix` removed, or this path unchanged when it does not start with `prefix`.
  public Path relativeTo(Path prefix) {
    if (prefix.segments.size() > segments.size() || !segments.subList(0, prefix.segments.size()).equals(prefix.segments)) {
      return this;
    }
    return new Path(segments.subList(prefix.segments.size(), segments.size()));
  }

  public boolean isRoot() {
    return segments.isEmpty();
  }

  /// RFC 6901 pointer, e.g. `/address/lines/0`.
  public String toPointer() {
    final var sb = new StringBuilder();
    for (Object segment : segments) {
      sb.append('/').append(String.valueOf(segment).replace("~", "~0").replace("/", "~1"));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    final var sb = new StringBuilder();
    for (Object segment : segments) {
      sb.append('[');
      if (segment instanceof Integer) {
        sb.append(segment);
      } else {
        sb.append(Formatting.preview(segment));
      }
      sb.append(']');
    }
    return sb.toString();
  }
}
