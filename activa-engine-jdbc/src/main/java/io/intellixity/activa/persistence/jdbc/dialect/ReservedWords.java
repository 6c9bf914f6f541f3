package io.intellixity.activa.persistence.jdbc.dialect;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Keyword tables used to decide when an identifier must be quoted. Entries are upper-case. */
public final class ReservedWords {
  private ReservedWords() {}

  /** Words reserved by the SQL standard and by every supported backend's core grammar. */
  public static final Set<String> COMMON = Set.of(
      "ALL", "ALTER", "AND", "ANY", "AS", "ASC", "BETWEEN", "BY", "CASE", "CAST", "CHECK", "COLUMN",
      "CONSTRAINT", "CREATE", "CROSS", "CURRENT_DATE", "CURRENT_TIME", "CURRENT_TIMESTAMP", "CURRENT_USER",
      "DEFAULT", "DELETE", "DESC", "DISTINCT", "DROP", "ELSE", "END", "EXCEPT", "EXISTS", "FALSE", "FETCH",
      "FOR", "FOREIGN", "FROM", "FULL", "GRANT", "GROUP", "HAVING", "IN", "INNER", "INSERT", "INTERSECT",
      "INTO", "IS", "JOIN", "LEFT", "LIKE", "NATURAL", "NOT", "NULL", "OF", "ON", "OR", "ORDER", "OUTER",
      "PRIMARY", "REFERENCES", "RIGHT", "SELECT", "SET", "SOME", "TABLE", "THEN", "TO", "TRUE", "UNION",
      "UNIQUE", "UPDATE", "USER", "USING", "VALUES", "WHEN", "WHERE", "WITH");

  public static Set<String> with(String... extra) {
    Set<String> out = new HashSet<>(COMMON);
    out.addAll(List.of(extra));
    return Set.copyOf(out);
  }
}
