package ephemera.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for sweep steps and submissions.
 *
 * <p>Every step of a sweep obtains its own connection and runs in auto-commit mode.
 * Callers are responsible for closing the returned connection.
 *
 * @see ephemera.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
