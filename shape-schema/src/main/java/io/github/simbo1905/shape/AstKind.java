package io.github.simbo1905.shape;

/// Tag of each [Ast] variant, used for exhaustive `switch` dispatch.
public enum AstKind {
  PRIMITIVE,
  LITERAL,
  STRUCT,
  TUPLE,
  RECORD,
  UNION,
  REFINEMENT,
  TRANSFORMATION,
  BRAND,
  SUSPEND
}
