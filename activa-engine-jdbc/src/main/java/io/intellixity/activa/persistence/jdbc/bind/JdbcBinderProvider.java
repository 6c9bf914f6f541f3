package io.intellixity.activa.persistence.jdbc.bind;

import io.intellixity.activa.persistence.compile.Bind;
import io.intellixity.activa.persistence.spi.bind.BindContext;
import io.intellixity.activa.persistence.spi.bind.Binder;
import io.intellixity.activa.persistence.spi.bind.BinderProvider;
import io.intellixity.activa.persistence.types.ColumnType;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Base for the {@link PreparedStatement} binders of one JDBC dialect.
 *
 * <p>Subclasses contribute driver quirks through {@link #dialectBinders()}; those are consulted
 * ahead of the generic null, byte array and {@code setObject} binders every driver accepts.</p>
 */
public abstract class JdbcBinderProvider implements BinderProvider {
  @Override
  public final Collection<Binder<?, ?>> binders() {
    List<Binder<?, ?>> ordered = new ArrayList<>(dialectBinders());
    ordered.add(new SlotBinder<>(Object.class) {
      @Override protected boolean accepts(BindContext ctx, Object value) { return value == null; }
      @Override protected void apply(PreparedStatement ps, int index, BindContext ctx, Object value) throws SQLException {
        ps.setNull(index, sqlTypeOf(ctx.columnType()));
      }
    });
    ordered.add(new SlotBinder<>(byte[].class) {
      @Override protected void apply(PreparedStatement ps, int index, BindContext ctx, byte[] value) throws SQLException {
        ps.setBytes(index, value);
      }
    });
    ordered.add(new SlotBinder<>(Object.class) {
      @Override protected void apply(PreparedStatement ps, int index, BindContext ctx, Object value) throws SQLException {
        ps.setObject(index, value);
      }
    });
    return List.copyOf(ordered);
  }

  protected abstract Collection<Binder<?, ?>> dialectBinders();

  /** JDBC type for a NULL of the given storage class; {@link Types#NULL} when untyped. */
  public static int sqlTypeOf(ColumnType columnType) {
    if (columnType == null) return Types.NULL;
    return switch (columnType) {
      case TEXT -> Types.VARCHAR;
      case INTEGER -> Types.INTEGER;
      case BIGINT -> Types.BIGINT;
      case DOUBLE -> Types.DOUBLE;
      case DECIMAL -> Types.DECIMAL;
      case BOOLEAN -> Types.BOOLEAN;
      case DATE -> Types.DATE;
      case TIMESTAMP -> Types.TIMESTAMP;
      case BLOB -> Types.BINARY;
      case UUID, JSON, OTHER -> Types.OTHER;
    };
  }

  /** True for NULLs whose JDBC type is {@link Types#NULL} or {@link Types#OTHER}, which some drivers reject. */
  protected static boolean isUntypedNull(BindContext ctx, Object value) {
    if (value != null) return false;
    int t = sqlTypeOf(ctx.columnType());
    return t == Types.NULL || t == Types.OTHER;
  }

  /** Binder writing into one {@link PreparedStatement} parameter; driver errors surface as {@link JdbcBindException}. */
  protected abstract static class SlotBinder<V> implements Binder<PreparedStatement, V> {
    private final Class<V> valueType;

    protected SlotBinder(Class<V> valueType) {
      this.valueType = valueType;
    }

    @Override public final Class<PreparedStatement> targetType() { return PreparedStatement.class; }
    @Override public final Class<V> valueType() { return valueType; }

    protected boolean accepts(BindContext ctx, V value) { return true; }

    protected abstract void apply(PreparedStatement ps, int index, BindContext ctx, V value) throws SQLException;

    @Override
    public final boolean supports(BindContext ctx, Bind bind, V encodedValue) {
      return accepts(ctx, encodedValue);
    }

    @Override
    public final void bind(PreparedStatement ps, BindContext ctx, Bind bind, V encodedValue) {
      if (!(ctx instanceof JdbcBindContext slot)) {
        throw new IllegalArgumentException("JDBC binders need a JdbcBindContext, got " + ctx.getClass().getName());
      }
      try {
        apply(ps, slot.parameterIndex(), ctx, encodedValue);
      } catch (SQLException e) {
        throw new JdbcBindException(slot.parameterIndex(), e);
      }
    }
  }
}
