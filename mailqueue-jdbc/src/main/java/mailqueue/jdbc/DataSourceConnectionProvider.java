package mailqueue.jdbc;

import mailqueue.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ConnectionProvider} backed by a {@link DataSource}.
 *
 * <p>A provider created with {@link #owning(DataSource)} also closes the data source (for
 * example a connection pool) when it is closed; the plain constructor leaves the data source
 * to its owner, such as a DI container.
 */
public final class DataSourceConnectionProvider implements ConnectionProvider, AutoCloseable {
  private static final Logger logger = Logger.getLogger(DataSourceConnectionProvider.class.getName());

  private final DataSource dataSource;
  private final boolean ownsDataSource;

  public DataSourceConnectionProvider(DataSource dataSource) {
    this(dataSource, false);
  }

  private DataSourceConnectionProvider(DataSource dataSource, boolean ownsDataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.ownsDataSource = ownsDataSource;
  }

  /** Creates a provider that closes {@code dataSource} on {@link #close()}. */
  public static DataSourceConnectionProvider owning(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource, true);
  }

  @Override
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }

  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public void close() {
    if (!ownsDataSource || !(dataSource instanceof AutoCloseable closeable)) {
      return;
    }
    try {
      closeable.close();
    } catch (Exception e) {
      logger.log(Level.WARNING, "Failed to close data source", e);
    }
  }
}
