package io.intellixity.activa.persistence.jdbc.bind;

import io.intellixity.activa.persistence.spi.bind.Binder;
import io.intellixity.activa.persistence.spi.bind.BinderProvider;

import java.util.Collection;
import java.util.List;

/** Generic JDBC binders, registered for every dialect. */
public final class DefaultJdbcBinderProvider extends JdbcBinderProvider {
  @Override
  public String dialectId() { return BinderProvider.ANY_DIALECT; }

  @Override
  protected Collection<Binder<?, ?>> dialectBinders() { return List.of(); }
}
