package io.intellixity.activa.persistence.jdbc;

import io.intellixity.activa.persistence.mapping.Row;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/** Materializes a ResultSet into driver-level {@link Row}s; decoding happens later through adapters. */
final class JdbcRowReader {
  private JdbcRowReader() {}

  static List<Row> readAll(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    List<String> labels = new ArrayList<>(n);
    for (int i = 1; i <= n; i++) {
      String label = md.getColumnLabel(i);
      labels.add(label == null || label.isBlank() ? md.getColumnName(i) : label);
    }
    List<Row> out = new ArrayList<>();
    while (rs.next()) {
      List<Object> values = new ArrayList<>(n);
      for (int i = 1; i <= n; i++) values.add(rs.getObject(i));
      out.add(new Row(labels, values));
    }
    return out;
  }
}
