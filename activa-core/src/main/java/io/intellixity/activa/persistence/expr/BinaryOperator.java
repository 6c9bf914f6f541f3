package io.intellixity.activa.persistence.expr;

/**
 * Binary operators with their SQL symbol and binding strength (higher binds tighter).
 */
public enum BinaryOperator {
  OR("OR", 1, true),
  AND("AND", 2, true),

  EQ("=", 4, false),
  NE("<>", 4, false),
  LT("<", 4, false),
  LE("<=", 4, false),
  GT(">", 4, false),
  GE(">=", 4, false),
  LIKE("LIKE", 4, false),
  NOT_LIKE("NOT LIKE", 4, false),

  ADD("+", 6, true),
  SUBTRACT("-", 6, false),
  MULTIPLY("*", 7, true),
  DIVIDE("/", 7, false),
  MODULO("%", 7, false);

  public static final int PREDICATE_PRECEDENCE = 4;

  private final String symbol;
  private final int precedence;
  private final boolean associative;

  BinaryOperator(String symbol, int precedence, boolean associative) {
    this.symbol = symbol;
    this.precedence = precedence;
    this.associative = associative;
  }

  public String symbol() { return symbol; }
  public int precedence() { return precedence; }
  public boolean associative() { return associative; }
  public boolean isComparison() { return precedence == PREDICATE_PRECEDENCE; }
  public boolean isLogical() { return this == AND || this == OR; }
}
