package io.intellixity.activa.persistence.spi.sql;

/** Positional parameter marker syntax. Every occurrence gets its own number; values are never deduplicated. */
public enum PlaceholderStyle {
  /** {@code ?} (SQLite, MySQL, MariaDB). */
  QUESTION_MARK {
    @Override public String render(int position1Based) { return "?"; }
  },
  /** {@code $1, $2, ...} (PostgreSQL). */
  DOLLAR_NUMBERED {
    @Override public String render(int position1Based) { return "$" + position1Based; }
  },
  /** {@code :p1, :p2, ...} (Oracle). */
  COLON_NAMED {
    @Override public String render(int position1Based) { return ":p" + position1Based; }
  },
  /** {@code @p1, @p2, ...} (SQL Server). */
  AT_NAMED {
    @Override public String render(int position1Based) { return "@p" + position1Based; }
  };

  public abstract String render(int position1Based);
}
