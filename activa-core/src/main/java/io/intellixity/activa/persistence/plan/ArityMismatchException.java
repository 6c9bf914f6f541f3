package io.intellixity.activa.persistence.plan;

/** Set-operation operands project a different number of columns. */
public final class ArityMismatchException extends InvalidPlanException {
  private final int leftArity;
  private final int rightArity;

  public ArityMismatchException(SetOperator operator, int leftArity, int rightArity) {
    super(operator + " operands must project the same number of columns (left=" + leftArity +
        ", right=" + rightArity + ")");
    this.leftArity = leftArity;
    this.rightArity = rightArity;
  }

  public int leftArity() { return leftArity; }
  public int rightArity() { return rightArity; }
}
