package io.intellixity.activa.persistence.expr;

/** {@code *} or {@code table.*}. */
public record Star(String table) implements Expression {
  public Star {
    table = (table == null || table.isBlank()) ? null : table;
  }

  @Override
  public <R> R accept(ExpressionVisitor<R> visitor) { return visitor.visitStar(this); }
}
