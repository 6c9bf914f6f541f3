package io.intellixity.activa.persistence.jdbc;

import io.intellixity.activa.persistence.compile.Bind;
import io.intellixity.activa.persistence.jdbc.bind.JdbcBindException;
import io.intellixity.activa.persistence.jdbc.bind.ParameterSlot;
import io.intellixity.activa.persistence.mapping.Row;
import io.intellixity.activa.persistence.spi.bind.BindEncoder;
import io.intellixity.activa.persistence.spi.bind.BindOpKind;
import io.intellixity.activa.persistence.spi.bind.DiscoveredBinderRegistry;
import io.intellixity.activa.persistence.spi.exec.QueryExecutionException;
import io.intellixity.activa.persistence.spi.exec.QueryExecutor;
import io.intellixity.activa.persistence.spi.exec.StatementListener;
import io.intellixity.activa.persistence.spi.sql.PlaceholderStyle;
import io.intellixity.activa.persistence.spi.sql.SqlStatement;
import io.intellixity.activa.persistence.types.TypeAdapterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Blocking executor: one pooled connection per statement, binds encoded through type adapters and
 * applied through discovered binders.
 */
public final class JdbcQueryExecutor implements QueryExecutor {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryExecutor.class);

  private final JdbcHandle handle;
  private final PlaceholderStyle placeholderStyle;
  private final BindEncoder encoder;
  private final DiscoveredBinderRegistry binders;
  private final List<StatementListener> listeners = new CopyOnWriteArrayList<>();

  public JdbcQueryExecutor(JdbcHandle handle, PlaceholderStyle placeholderStyle,
                           TypeAdapterRegistry types, DiscoveredBinderRegistry binders) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.placeholderStyle = Objects.requireNonNull(placeholderStyle, "placeholderStyle");
    this.encoder = new BindEncoder(Objects.requireNonNull(types, "types"));
    this.binders = Objects.requireNonNull(binders, "binders");
  }

  @Override public String backendId() { return handle.id(); }

  public JdbcHandle handle() { return handle; }

  public void addListener(StatementListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(StatementListener listener) {
    listeners.remove(listener);
  }

  @Override
  public List<Row> query(SqlStatement ss) {
    String jdbcSql = JdbcSqlRewriter.toJdbcSql(ss.sql(), placeholderStyle);
    BindOpKind kind = opKindOf(ss.sql());
    notifyListeners(ss);
    try (Connection c = handle.client().getConnection()) {
      long start = System.nanoTime();
      debugSql("QUERY", ss, jdbcSql, kind);
      try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
        bindAll(ps, ss, kind);
        try (ResultSet rs = ps.executeQuery()) {
          List<Row> out = JdbcRowReader.readAll(rs);
          debugDone("QUERY", ss, out.size(), System.nanoTime() - start);
          return out;
        }
      }
    } catch (SQLException e) {
      throw new QueryExecutionException(handle.id(), "query failed: " + e.getMessage(), e);
    }
  }

  @Override
  public long update(SqlStatement ss) {
    String jdbcSql = JdbcSqlRewriter.toJdbcSql(ss.sql(), placeholderStyle);
    BindOpKind kind = opKindOf(ss.sql());
    notifyListeners(ss);
    try (Connection c = handle.client().getConnection()) {
      long start = System.nanoTime();
      debugSql("UPDATE", ss, jdbcSql, kind);
      try (PreparedStatement ps = c.prepareStatement(jdbcSql)) {
        bindAll(ps, ss, kind);
        long n = ps.executeUpdate();
        debugDone("UPDATE", ss, n, System.nanoTime() - start);
        return n;
      }
    } catch (SQLException e) {
      throw new QueryExecutionException(handle.id(), "update failed: " + e.getMessage(), e);
    }
  }

  private void bindAll(PreparedStatement ps, SqlStatement stmt, BindOpKind opKind) {
    for (int i = 0; i < stmt.binds().size(); i++) {
      Bind b = stmt.binds().get(i);
      BindEncoder.Encoded encoded = encoder.encode(b);
      var ctx = new ParameterSlot(opKind, i + 1, encoded.columnType());
      try {
        binders.bind(ps, ctx, b, encoded.value());
      } catch (JdbcBindException e) {
        throw new QueryExecutionException(handle.id(), e.getMessage(), e.getCause());
      }
    }
  }

  private void notifyListeners(SqlStatement ss) {
    for (StatementListener l : listeners) l.onStatement(handle.id(), ss);
  }

  static BindOpKind opKindOf(String sql) {
    String s = sql.stripLeading().toUpperCase(Locale.ROOT);
    if (s.startsWith("INSERT")) return BindOpKind.INSERT;
    if (s.startsWith("UPDATE")) return BindOpKind.UPDATE;
    if (s.startsWith("DELETE")) return BindOpKind.DELETE;
    return BindOpKind.QUERY;
  }

  private void debugSql(String op, SqlStatement ss, String jdbcSql, BindOpKind bindKind) {
    if (!log.isDebugEnabled()) return;
    log.debug("activa.jdbc op={} execKind={} bindKind={} bindCount={} backend={} dialect={} sql={}",
        op, ss.execKind(), bindKind, ss.binds().size(), handle.id(), handle.dialectId(), jdbcSql);

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled() && !ss.binds().isEmpty()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("activa.jdbc bind index={} adapter={} valueType={} valueLen={}",
            idx++, b.adapter() == null ? "registry" : b.adapter().getClass().getSimpleName(), vType, vLen);
      }
    }
  }

  private void debugDone(String op, SqlStatement ss, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("activa.jdbc_done op={} execKind={} backend={} durationMs={} result={}",
        op, ss.execKind(), handle.id(), durationNanos / 1_000_000.0, result);
  }
}
