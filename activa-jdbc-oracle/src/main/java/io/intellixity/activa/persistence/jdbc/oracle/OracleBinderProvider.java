package io.intellixity.activa.persistence.jdbc.oracle;

import io.intellixity.activa.persistence.jdbc.bind.JdbcBinderProvider;
import io.intellixity.activa.persistence.spi.bind.BindContext;
import io.intellixity.activa.persistence.spi.bind.Binder;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collection;
import java.util.List;

public final class OracleBinderProvider extends JdbcBinderProvider {
  @Override
  public String dialectId() { return OracleDialect.ID; }

  // ojdbc rejects Types.NULL and Types.OTHER in setNull.
  @Override
  protected Collection<Binder<?, ?>> dialectBinders() {
    return List.of(new SlotBinder<>(Object.class) {
      @Override
      protected boolean accepts(BindContext ctx, Object value) { return isUntypedNull(ctx, value); }

      @Override
      protected void apply(PreparedStatement ps, int index, BindContext ctx, Object value) throws SQLException {
        ps.setNull(index, Types.VARCHAR);
      }
    });
  }
}
