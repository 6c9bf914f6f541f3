package io.intellixity.activa.persistence.types.adapters;

import io.intellixity.activa.persistence.types.ColumnType;
import io.intellixity.activa.persistence.types.TypeAdapter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/**
 * Pass-through adapters for the scalar types every JDBC driver binds natively. Integral reads
 * reject values that do not fit the target type instead of truncating them.
 */
public final class ScalarAdapters {
  private ScalarAdapters() {}

  private static int toInt(Number n) {
    if (n instanceof Integer i) return i;
    try {
      return decimal(n).intValueExact();
    } catch (ArithmeticException | NumberFormatException e) {
      throw new IllegalArgumentException("Value " + n + " does not fit in an int", e);
    }
  }

  private static long toLong(Number n) {
    if (n instanceof Long l) return l;
    try {
      return decimal(n).longValueExact();
    } catch (ArithmeticException | NumberFormatException e) {
      throw new IllegalArgumentException("Value " + n + " does not fit in a long", e);
    }
  }

  private static short toShort(Number n) {
    if (n instanceof Short sh) return sh;
    try {
      return decimal(n).shortValueExact();
    } catch (ArithmeticException | NumberFormatException e) {
      throw new IllegalArgumentException("Value " + n + " does not fit in a short", e);
    }
  }

  private static BigDecimal decimal(Number n) {
    if (n instanceof BigDecimal d) return d;
    if (n instanceof BigInteger i) return new BigDecimal(i);
    if (n instanceof Double || n instanceof Float) return new BigDecimal(n.toString());
    return BigDecimal.valueOf(n.longValue());
  }

  public static TypeAdapter<String> string() {
    return new TypeAdapter<>() {
      @Override public Class<String> javaType() { return String.class; }
      @Override public ColumnType columnType() { return ColumnType.TEXT; }
      @Override public Object toDatabase(String value, Map<String, Object> options) { return value; }
      @Override public String fromDatabase(Object raw, Class<? extends String> target, Map<String, Object> options) {
        return raw == null ? null : String.valueOf(raw);
      }
    };
  }

  public static TypeAdapter<Integer> integer() {
    return new TypeAdapter<>() {
      @Override public Class<Integer> javaType() { return Integer.class; }
      @Override public ColumnType columnType() { return ColumnType.INTEGER; }
      @Override public Object toDatabase(Integer value, Map<String, Object> options) { return value; }
      @Override public Integer fromDatabase(Object raw, Class<? extends Integer> target, Map<String, Object> options) {
        if (raw == null) return null;
        if (raw instanceof Number n) return toInt(n);
        return Integer.parseInt(String.valueOf(raw).trim());
      }
    };
  }

  public static TypeAdapter<Long> longType() {
    return new TypeAdapter<>() {
      @Override public Class<Long> javaType() { return Long.class; }
      @Override public ColumnType columnType() { return ColumnType.BIGINT; }
      @Override public Object toDatabase(Long value, Map<String, Object> options) { return value; }
      @Override public Long fromDatabase(Object raw, Class<? extends Long> target, Map<String, Object> options) {
        if (raw == null) return null;
        if (raw instanceof Number n) return toLong(n);
        return Long.parseLong(String.valueOf(raw).trim());
      }
    };
  }

  public static TypeAdapter<Short> shortType() {
    return new TypeAdapter<>() {
      @Override public Class<Short> javaType() { return Short.class; }
      @Override public ColumnType columnType() { return ColumnType.INTEGER; }
      @Override public Object toDatabase(Short value, Map<String, Object> options) { return value; }
      @Override public Short fromDatabase(Object raw, Class<? extends Short> target, Map<String, Object> options) {
        if (raw == null) return null;
        if (raw instanceof Number n) return toShort(n);
        return Short.parseShort(String.valueOf(raw).trim());
      }
    };
  }

  public static TypeAdapter<Double> doubleType() {
    return new TypeAdapter<>() {
      @Override public Class<Double> javaType() { return Double.class; }
      @Override public ColumnType columnType() { return ColumnType.DOUBLE; }
      @Override public Object toDatabase(Double value, Map<String, Object> options) { return value; }
      @Override public Double fromDatabase(Object raw, Class<? extends Double> target, Map<String, Object> options) {
        if (raw == null) return null;
        if (raw instanceof Number n) return n.doubleValue();
        return Double.parseDouble(String.valueOf(raw).trim());
      }
    };
  }

  public static TypeAdapter<Float> floatType() {
    return new TypeAdapter<>() {
      @Override public Class<Float> javaType() { return Float.class; }
      @Override public ColumnType columnType() { return ColumnType.DOUBLE; }
      @Override public Object toDatabase(Float value, Map<String, Object> options) { return value; }
      @Override public Float fromDatabase(Object raw, Class<? extends Float> target, Map<String, Object> options) {
        if (raw == null) return null;
        if (raw instanceof Number n) return n.floatValue();
        return Float.parseFloat(String.valueOf(raw).trim());
      }
    };
  }
}
