package io.intellixity.activa.persistence.jdbc.sqlserver;

import io.intellixity.activa.persistence.jdbc.bind.JdbcBinderProvider;
import io.intellixity.activa.persistence.spi.bind.BindContext;
import io.intellixity.activa.persistence.spi.bind.Binder;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collection;
import java.util.List;

public final class SqlServerBinderProvider extends JdbcBinderProvider {
  @Override
  public String dialectId() { return SqlServerDialect.ID; }

  /** Untyped NULLs are sent as NVARCHAR, which the server converts implicitly. */
  @Override
  protected Collection<Binder<?, ?>> dialectBinders() {
    return List.of(new SlotBinder<>(Object.class) {
      @Override
      protected boolean accepts(BindContext ctx, Object value) { return isUntypedNull(ctx, value); }

      @Override
      protected void apply(PreparedStatement ps, int index, BindContext ctx, Object value) throws SQLException {
        ps.setNull(index, Types.NVARCHAR);
      }
    });
  }
}
