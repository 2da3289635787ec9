package io.github.simbo1905.shape;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/// Identity-unique token matched by the `symbol` primitive.
///
/// [#of(String)] always creates a fresh symbol; [#forKey(String)] returns the
/// shared symbol registered under a key.
public final class Symbol {

  private static final ConcurrentMap<String, Symbol> REGISTRY = new ConcurrentHashMap<>();

  private final String description;

  private Symbol(String description) {
    this.description = description;
  }

  public static Symbol of(String description) {
    return new Symbol(Objects.requireNonNull(description, "description"));
  }

  public static Symbol forKey(String key) {
    Objects.requireNonNull(key, "key");
    return REGISTRY.computeIfAbsent(key, Symbol::new);
  }

  public String description() {
    return description;
  }

  @Override
  public String toString() {
    return "Symbol(" + description + ")";
  }
}
