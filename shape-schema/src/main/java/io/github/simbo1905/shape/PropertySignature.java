package io.github.simbo1905.shape;

import java.util.Objects;
import java.util.function.Supplier;

/// One named property of a [Ast.Struct].
///
/// `name` is the Type-side key. `fromKey`, when set, is the Encoded-side key.
/// `exact` forbids undefined for optional policies and `nullable` lets a present
/// null behave like a missing key.
public record PropertySignature(
    String name,
    Ast type,
    Optionality optionality,
    boolean exact,
    boolean nullable,
    String fromKey,
    Supplier<?> decodeDefault,
    Supplier<?> constructorDefault,
    Annotations annotations) {

  public PropertySignature {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(optionality, "optionality");
    Objects.requireNonNull(annotations, "annotations");
    if (optionality == Optionality.OPTIONAL && exact) {
      optionality = Optionality.OPTIONAL_EXACT;
    }
    if (optionality == Optionality.OPTIONAL_EXACT) {
      exact = true;
    }
    if (optionality == Optionality.REQUIRED && (exact || nullable)) {
      throw new IllegalArgumentException("property '" + name + "': exact and nullable apply only to optional properties");
    }
    if ((optionality == Optionality.OPTIONAL_WITH_DEFAULT) != (decodeDefault != null)) {
      throw new IllegalArgumentException("property '" + name + "': a decode default goes with OPTIONAL_WITH_DEFAULT only");
    }
  }

  public static PropertySignature required(String name, Ast type) {
    return new PropertySignature(name, type, Optionality.REQUIRED, false, false, null, null, null, Annotations.EMPTY);
  }

  public static PropertySignature optional(String name, Ast type) {
    return new PropertySignature(name, type, Optionality.OPTIONAL, false, false, null, null, null, Annotations.EMPTY);
  }

  /// Key used on the Encoded side.
  public String encodedKey() {
    return fromKey == null ? name : fromKey;
  }

  /// True when a present undefined counts as missing.
  public boolean acceptsUndefined() {
    return optionality != Optionality.REQUIRED && !exact;
  }

  /// True when the Type side may omit the key.
  public boolean optionalOnTypeSide() {
    return optionality == Optionality.OPTIONAL || optionality == Optionality.OPTIONAL_EXACT;
  }

  public PropertySignature withName(String newName) {
    return new PropertySignature(newName, type, optionality, exact, nullable, fromKey, decodeDefault,
        constructorDefault, annotations);
  }

  public PropertySignature withType(Ast newType) {
    return new PropertySignature(name, newType, optionality, exact, nullable, fromKey, decodeDefault,
        constructorDefault, annotations);
  }

  public PropertySignature withFromKey(String key) {
    return new PropertySignature(name, type, optionality, exact, nullable, key, decodeDefault,
        constructorDefault, annotations);
  }

  public PropertySignature withConstructorDefault(Supplier<?> thunk) {
    return new PropertySignature(name, type, optionality, exact, nullable, fromKey, decodeDefault, thunk,
        annotations);
  }

  public PropertySignature annotate(Annotations more) {
    return new PropertySignature(name, type, optionality, exact, nullable, fromKey, decodeDefault,
        constructorDefault, annotations.merge(more));
  }

  /// Same property with a different optional policy; modifiers that do not fit the policy are dropped.
  public PropertySignature withOptionality(Optionality policy) {
    if (policy == optionality) {
      return this;
    }
    final boolean keepModifiers = policy != Optionality.REQUIRED;
    return new PropertySignature(name, type, policy,
        keepModifiers && exact && policy != Optionality.OPTIONAL,
        keepModifiers && nullable,
        fromKey,
        policy == Optionality.OPTIONAL_WITH_DEFAULT ? decodeDefault : null,
        constructorDefault, annotations);
  }
}
