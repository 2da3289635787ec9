package io.github.simbo1905.shape;

/// One interpreter step: the node, the value under it, where the value sits,
/// how many suspends were resolved on the way down, and the walk direction.
record Frame(Ast ast, Object input, Path path, int depth, Direction direction) {

  static Frame root(Ast ast, Object input, Direction direction) {
    return new Frame(ast, input, Path.ROOT, 0, direction);
  }

  /// Same value and position under another node.
  Frame with(Ast next) {
    return new Frame(next, input, path, depth, direction);
  }

  /// Another value at the same position, e.g. the output of a transform function.
  Frame with(Ast next, Object value) {
    return new Frame(next, value, path, depth, direction);
  }

  Frame child(Ast next, Object value, Object segment) {
    return new Frame(next, value, path.append(segment), depth, direction);
  }

  Frame as(Direction other, Ast next, Object value) {
    return new Frame(next, value, path, depth, other);
  }

  Frame deeper(Ast next) {
    return new Frame(next, input, path, depth + 1, direction);
  }

  @Override
  public String toString() {
    return "Frame[ast=" + ast.kind() + ", path=" + path + ", depth=" + depth + ", direction=" + direction + "]";
  }
}
