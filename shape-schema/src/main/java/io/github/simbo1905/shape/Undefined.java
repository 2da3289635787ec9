package io.github.simbo1905.shape;

/// The "undefined" value of the shape model.
///
/// Java has no undefined, so the engine uses this singleton wherever a value is
/// explicitly present but undefined. An absent map key is *missing*, which is a
/// different thing: optional property signatures distinguish the two.
public enum Undefined {
  INSTANCE;

  @Override
  public String toString() {
    return "undefined";
  }
}
