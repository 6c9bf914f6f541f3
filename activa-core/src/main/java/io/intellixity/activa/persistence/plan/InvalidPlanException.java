package io.intellixity.activa.persistence.plan;

/**
 * Raised when a query plan is structurally invalid (HAVING without GROUP BY, a join without a
 * condition, a recursive CTE that is not a UNION...). Always raised before any SQL is generated.
 */
public class InvalidPlanException extends RuntimeException {
  public InvalidPlanException(String message) {
    super(message);
  }

  public InvalidPlanException(String message, Throwable cause) {
    super(message, cause);
  }
}
