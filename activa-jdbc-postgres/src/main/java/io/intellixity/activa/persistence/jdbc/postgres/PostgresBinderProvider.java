package io.intellixity.activa.persistence.jdbc.postgres;

import io.intellixity.activa.persistence.jdbc.bind.JdbcBinderProvider;
import io.intellixity.activa.persistence.spi.bind.BindContext;
import io.intellixity.activa.persistence.spi.bind.Binder;
import io.intellixity.activa.persistence.types.ColumnType;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collection;
import java.util.List;

public final class PostgresBinderProvider extends JdbcBinderProvider {
  @Override
  public String dialectId() { return PostgresDialect.ID; }

  @Override
  protected Collection<Binder<?, ?>> dialectBinders() {
    return List.of(new JsonbBinder());
  }

  /** JSON values go out as {@code jsonb}; a bare string parameter would arrive typed as text. */
  static final class JsonbBinder extends SlotBinder<Object> {
    JsonbBinder() {
      super(Object.class);
    }

    @Override
    protected boolean accepts(BindContext ctx, Object value) {
      return ctx.columnType() == ColumnType.JSON;
    }

    @Override
    protected void apply(PreparedStatement ps, int index, BindContext ctx, Object value) throws SQLException {
      if (value == null) {
        ps.setNull(index, Types.OTHER);
        return;
      }
      PGobject jsonb = new PGobject();
      jsonb.setType("jsonb");
      jsonb.setValue(value.toString());
      ps.setObject(index, jsonb);
    }
  }
}
