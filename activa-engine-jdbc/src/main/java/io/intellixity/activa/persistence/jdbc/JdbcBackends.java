package io.intellixity.activa.persistence.jdbc;

import io.intellixity.activa.persistence.capability.ServerVersion;
import io.intellixity.activa.persistence.spi.bind.DiscoveredBinderRegistry;
import io.intellixity.activa.persistence.spi.exec.Backend;
import io.intellixity.activa.persistence.spi.sql.Dialect;
import io.intellixity.activa.persistence.spi.sql.DialectProvider;
import io.intellixity.activa.persistence.types.TypeAdapterRegistry;
import io.intellixity.activa.persistence.util.ActivaFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Wires a {@link Backend} for a JDBC DataSource: detects product and version once, picks the
 * discovered {@link DialectProvider}, and builds the adapter registry, binder registry and executors
 * for that dialect.
 */
public final class JdbcBackends {
  private static final Logger log = LoggerFactory.getLogger(JdbcBackends.class);

  private JdbcBackends() {}

  /** Blocking-only backend with detected dialect. */
  public static Backend detect(String id, DataSource ds) {
    return detect(id, ds, null, false);
  }

  /**
   * @param asyncPool            pool for the async executor, or null for a blocking-only backend
   * @param concurrentStatements whether {@code ds} hands out independent connections
   */
  public static Backend detect(String id, DataSource ds, ExecutorService asyncPool, boolean concurrentStatements) {
    Objects.requireNonNull(ds, "ds");
    String product;
    String versionText;
    ServerVersion version;
    try (Connection c = ds.getConnection()) {
      DatabaseMetaData md = c.getMetaData();
      product = md.getDatabaseProductName();
      versionText = md.getDatabaseProductVersion();
      version = detectVersion(md);
    } catch (SQLException e) {
      throw new RuntimeException("Failed to read database metadata for backend '" + id + "'", e);
    }

    DialectProvider provider = providerFor(product, versionText, ActivaFactoriesLoader.load(DialectProvider.class));
    Dialect dialect = provider.create(version);
    log.info("activa.backend id={} product={} version={} dialect={}", id, product, version, dialect.id());
    if (log.isDebugEnabled()) log.debug("activa.backend id={} capabilities={}", id, dialect.capabilities().describe());
    return create(id, ds, dialect, asyncPool, concurrentStatements);
  }

  /** Backend with an explicitly chosen dialect (no detection round-trip). */
  public static Backend create(String id, DataSource ds, Dialect dialect, ExecutorService asyncPool,
                               boolean concurrentStatements) {
    TypeAdapterRegistry types = new TypeAdapterRegistry(dialect.id());
    DiscoveredBinderRegistry binders = new DiscoveredBinderRegistry(dialect.id());
    JdbcQueryExecutor executor = new JdbcQueryExecutor(new JdbcHandle(id, ds, dialect.id()), dialect.placeholderStyle(), types, binders);
    AsyncJdbcQueryExecutor async = asyncPool == null ? null
        : new AsyncJdbcQueryExecutor(executor, asyncPool, concurrentStatements);
    return new Backend(id, dialect, types, executor, async);
  }

  static DialectProvider providerFor(String product, String versionText, List<DialectProvider> providers) {
    for (DialectProvider p : providers) {
      if (p.handles(product, versionText)) return p;
    }
    throw new IllegalStateException("No dialect provider for database product '" + product + "' (" + versionText
        + "); add the matching activa-jdbc-* module to the classpath");
  }

  /** Prefers the product version string (it carries the patch level) over the metadata major/minor. */
  static ServerVersion detectVersion(DatabaseMetaData md) throws SQLException {
    String text = md.getDatabaseProductVersion();
    // MariaDB behind MySQL Connector/J reports "5.5.5-10.6.12-MariaDB"
    if (text != null && text.startsWith("5.5.5-") && text.contains("MariaDB")) text = text.substring(6);
    if (text != null) {
      try {
        return ServerVersion.parse(text);
      } catch (IllegalArgumentException e) {
        log.debug("activa.backend unparseable productVersion={}, using metadata major/minor", text);
      }
    }
    return ServerVersion.of(md.getDatabaseMajorVersion(), md.getDatabaseMinorVersion());
  }
}
