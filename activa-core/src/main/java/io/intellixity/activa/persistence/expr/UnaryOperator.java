package io.intellixity.activa.persistence.expr;

public enum UnaryOperator {
  NOT("NOT ", 3),
  NEGATE("-", 8);

  private final String prefix;
  private final int precedence;

  UnaryOperator(String prefix, int precedence) {
    this.prefix = prefix;
    this.precedence = precedence;
  }

  public String prefix() { return prefix; }
  public int precedence() { return precedence; }
}
