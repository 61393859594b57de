package mailqueue.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of JDBC connections for the job store.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see mailqueue.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
