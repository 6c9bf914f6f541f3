package io.intellixity.activa.persistence.compile;

import io.intellixity.activa.persistence.expr.Literal;
import io.intellixity.activa.persistence.types.TypeAdapter;

/**
 * One positional bind parameter of a compiled statement.
 *
 * <p>The value is still the Java-side value; conversion through a type adapter happens when the
 * statement is bound, so registrations made after compilation still apply.</p>
 */
public record Bind(Object value, Class<?> javaType, TypeAdapter<?> adapter) {
  public Bind {
    if (javaType == null && value != null) javaType = value.getClass();
  }

  public static Bind of(Object value) {
    return new Bind(value, null, null);
  }

  public static Bind of(Literal literal) {
    return new Bind(literal.value(), literal.declaredType(), literal.adapter());
  }
}
