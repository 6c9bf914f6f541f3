package io.intellixity.activa.persistence.types;

/** No adapter is registered for a Java type at bind or read time. */
public final class UnregisteredTypeException extends RuntimeException {
  private final Class<?> javaType;

  public UnregisteredTypeException(Class<?> javaType, AdapterDirection direction, String dialectId) {
    super("No type adapter registered for " + (javaType == null ? "null" : javaType.getName()) +
        " (direction=" + direction + ", dialectId=" + dialectId + ")");
    this.javaType = javaType;
  }

  public Class<?> javaType() { return javaType; }
}
