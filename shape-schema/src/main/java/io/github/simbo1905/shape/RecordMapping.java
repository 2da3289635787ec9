package io.github.simbo1905.shape;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.shape.ShapeLogging.LOG;

/// Reflective bridge between a struct map and a Java record.
///
/// Numbers are narrowed to the component's numeric type when the value fits
/// exactly; anything else reaches the constructor unchanged and a mismatch is
/// reported as a transformation failure.
final class RecordMapping<R extends Record> {

  private final Class<R> type;
  private final RecordComponent[] components;
  private final Constructor<R> constructor;

  private RecordMapping(Class<R> type, RecordComponent[] components, Constructor<R> constructor) {
    this.type = type;
    this.components = components;
    this.constructor = constructor;
  }

  static <R extends Record> RecordMapping<R> of(Class<R> type) {
    Objects.requireNonNull(type, "type");
    if (!type.isRecord()) {
      throw new IllegalArgumentException(type.getName() + " is not a record class");
    }
    final RecordComponent[] components = type.getRecordComponents();
    final Class<?>[] types = new Class<?>[components.length];
    for (int i = 0; i < components.length; i++) {
      types[i] = components[i].getType();
    }
    try {
      final Constructor<R> constructor = type.getDeclaredConstructor(types);
      constructor.setAccessible(true);
      return new RecordMapping<>(type, components, constructor);
    } catch (NoSuchMethodException | RuntimeException e) {
      LOG.fine(() -> "no usable canonical constructor on " + type.getName() + ": " + e);
      throw new IllegalArgumentException("record " + type.getName() + " has no usable canonical constructor", e);
    }
  }

  ParseResult<R> construct(Map<String, Object> fields) {
    final Object[] args = new Object[components.length];
    for (int i = 0; i < components.length; i++) {
      final RecordComponent component = components[i];
      final Object value = fields.get(component.getName());
      final Object arg = coerce(value, component.getType());
      if (arg == null && component.getType().isPrimitive()) {
        return ParseResult.failure("component '" + component.getName() + "' of " + type.getSimpleName()
            + " cannot be " + Formatting.preview(value));
      }
      args[i] = arg;
    }
    try {
      return ParseResult.success(constructor.newInstance(args));
    } catch (InvocationTargetException e) {
      final Throwable cause = e.getCause() == null ? e : e.getCause();
      LOG.fine(() -> type.getSimpleName() + " constructor rejected " + Formatting.preview(fields) + ": " + cause);
      return ParseResult.failure(type.getSimpleName() + " constructor failed: " + cause.getMessage());
    } catch (ReflectiveOperationException | IllegalArgumentException e) {
      LOG.fine(() -> "cannot construct " + type.getSimpleName() + " from " + Formatting.preview(fields) + ": " + e);
      return ParseResult.failure("cannot construct " + type.getSimpleName() + ": " + e.getMessage());
    }
  }

  ParseResult<Map<String, Object>> deconstruct(R value) {
    final var fields = new LinkedHashMap<String, Object>();
    for (RecordComponent component : components) {
      try {
        final var accessor = component.getAccessor();
        accessor.setAccessible(true);
        fields.put(component.getName(), accessor.invoke(value));
      } catch (ReflectiveOperationException | RuntimeException e) {
        LOG.fine(() -> "cannot read " + component.getName() + " of " + type.getSimpleName() + ": " + e);
        return ParseResult.failure("cannot read component '" + component.getName() + "': " + e.getMessage());
      }
    }
    return ParseResult.success(Collections.unmodifiableMap(fields));
  }

  /// Exact numeric narrowing; returns `null` when a primitive target cannot hold the value.
  private static Object coerce(Object value, Class<?> target) {
    if (!(value instanceof Number n) || target.isInstance(value)) {
      return value;
    }
    final BigDecimal exact = Numbers.toBigDecimal(n);
    try {
      if (target == int.class || target == Integer.class) {
        return exact == null ? null : exact.intValueExact();
      }
      if (target == long.class || target == Long.class) {
        return exact == null ? null : exact.longValueExact();
      }
      if (target == short.class || target == Short.class) {
        return exact == null ? null : exact.shortValueExact();
      }
      if (target == byte.class || target == Byte.class) {
        return exact == null ? null : exact.byteValueExact();
      }
    } catch (ArithmeticException e) {
      return target.isPrimitive() ? null : value;
    }
    if (target == double.class || target == Double.class) {
      return n.doubleValue();
    }
    if (target == float.class || target == Float.class) {
      return n.floatValue();
    }
    if (target == BigDecimal.class) {
      return exact == null ? value : exact;
    }
    if (target == BigInteger.class && exact != null && Numbers.isInteger(exact)) {
      return exact.toBigIntegerExact();
    }
    return value;
  }
}
