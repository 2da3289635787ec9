package io.github.simbo1905.shape;

import org.junit.jupiter.api.BeforeAll;

import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Raises JUL to the level named by `-Djava.util.logging.ConsoleHandler.level`, INFO otherwise.
public class ShapeLoggingConfig {

  @BeforeAll
  static void enableJulDebug() {
    final Logger root = Logger.getLogger("");
    final String levelProp = System.getProperty("java.util.logging.ConsoleHandler.level");
    Level targetLevel = Level.INFO;
    if (levelProp != null) {
      try {
        targetLevel = Level.parse(levelProp.trim());
      } catch (IllegalArgumentException ex) {
        try {
          targetLevel = Level.parse(levelProp.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
          targetLevel = Level.INFO;
        }
      }
    }
    if (root.getLevel() == null || root.getLevel().intValue() > targetLevel.intValue()) {
      root.setLevel(targetLevel);
    }
    for (Handler handler : root.getHandlers()) {
      final Level handlerLevel = handler.getLevel();
      if (handlerLevel == null || handlerLevel.intValue() > targetLevel.intValue()) {
        handler.setLevel(targetLevel);
      }
    }
    // engine loggers sit under this name; FINE shows run.start/run.end lines
    Logger.getLogger("io.github.simbo1905.shape").setLevel(targetLevel);
  }
}
