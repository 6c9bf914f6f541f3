package io.intellixity.activa.persistence.types.adapters;

import io.intellixity.activa.persistence.types.ColumnType;
import io.intellixity.activa.persistence.types.TypeAdapter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/**
 * BigDecimal adapter. Text mode stores the plain string form, for backends whose numeric storage
 * would round (SQLite REAL affinity).
 */
public final class DecimalAdapter implements TypeAdapter<BigDecimal> {
  private final boolean asText;

  public DecimalAdapter() {
    this(false);
  }

  public DecimalAdapter(boolean asText) {
    this.asText = asText;
  }

  @Override public Class<BigDecimal> javaType() { return BigDecimal.class; }
  @Override public ColumnType columnType() { return asText ? ColumnType.TEXT : ColumnType.DECIMAL; }

  @Override
  public Object toDatabase(BigDecimal value, Map<String, Object> options) {
    if (value == null) return null;
    return asText ? value.toPlainString() : value;
  }

  @Override
  public BigDecimal fromDatabase(Object raw, Class<? extends BigDecimal> target, Map<String, Object> options) {
    if (raw == null) return null;
    if (raw instanceof BigDecimal d) return d;
    if (raw instanceof BigInteger i) return new BigDecimal(i);
    if (raw instanceof Long || raw instanceof Integer || raw instanceof Short) return BigDecimal.valueOf(((Number) raw).longValue());
    // Double.toString keeps the shortest decimal form, so 0.1 reads back as 0.1
    if (raw instanceof Number n) return new BigDecimal(n.toString());
    return new BigDecimal(String.valueOf(raw).trim());
  }
}
