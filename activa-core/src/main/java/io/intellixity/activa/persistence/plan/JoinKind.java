package io.intellixity.activa.persistence.plan;

public enum JoinKind {
  INNER("INNER JOIN"),
  LEFT("LEFT JOIN"),
  RIGHT("RIGHT JOIN"),
  FULL("FULL OUTER JOIN"),
  CROSS("CROSS JOIN");

  private final String keyword;

  JoinKind(String keyword) { this.keyword = keyword; }

  public String keyword() { return keyword; }
}
