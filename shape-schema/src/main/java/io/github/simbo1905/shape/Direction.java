package io.github.simbo1905.shape;

/// Which way the interpreter walks a node.
enum Direction {
  /// Encoded to Type, running decode functions.
  DECODE,
  /// Type to Encoded, running encode functions.
  ENCODE,
  /// Type only; transformations contribute their `to` side and no function runs.
  VALIDATE
}
