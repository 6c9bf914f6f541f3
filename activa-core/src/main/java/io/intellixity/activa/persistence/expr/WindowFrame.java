package io.intellixity.activa.persistence.expr;

import java.util.Objects;

public record WindowFrame(Unit unit, Bound start, Bound end) {
  public WindowFrame {
    Objects.requireNonNull(unit, "unit");
    Objects.requireNonNull(start, "start");
  }

  public enum Unit { ROWS, RANGE }

  public enum BoundKind { UNBOUNDED_PRECEDING, PRECEDING, CURRENT_ROW, FOLLOWING, UNBOUNDED_FOLLOWING }

  public record Bound(BoundKind kind, long offset) {
    public Bound {
      Objects.requireNonNull(kind, "kind");
      if (offset < 0) throw new IllegalArgumentException("frame offset must be >= 0");
    }

    public static Bound unboundedPreceding() { return new Bound(BoundKind.UNBOUNDED_PRECEDING, 0); }
    public static Bound preceding(long n) { return new Bound(BoundKind.PRECEDING, n); }
    public static Bound currentRow() { return new Bound(BoundKind.CURRENT_ROW, 0); }
    public static Bound following(long n) { return new Bound(BoundKind.FOLLOWING, n); }
    public static Bound unboundedFollowing() { return new Bound(BoundKind.UNBOUNDED_FOLLOWING, 0); }
  }

  public static WindowFrame rowsBetween(Bound start, Bound end) {
    return new WindowFrame(Unit.ROWS, start, end);
  }

  public static WindowFrame rangeBetween(Bound start, Bound end) {
    return new WindowFrame(Unit.RANGE, start, end);
  }
}
