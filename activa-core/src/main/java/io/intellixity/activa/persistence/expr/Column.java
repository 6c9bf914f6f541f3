package io.intellixity.activa.persistence.expr;

import java.util.Objects;

/** Column reference, optionally qualified by a table name or alias. */
public record Column(String table, String name) implements Expression {
  public Column {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("column name must not be blank");
    table = (table == null || table.isBlank()) ? null : table;
  }

  public static Column of(String name) {
    return new Column(null, name);
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitColumn(this); }
}
