package io.github.simbo1905.shape;

import java.util.logging.Logger;

/// Centralized logger for the shape engine.
/// All classes use this logger via:
///   import static io.github.simbo1905.shape.ShapeLogging.LOG;
final class ShapeLogging {
  static final Logger LOG = Logger.getLogger("io.github.simbo1905.shape");

  private ShapeLogging() {}
}
