package eventsource.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for store operations that run outside a caller's
 * transaction (reads, queue status updates, poller queries).
 *
 * <p>Callers are responsible for closing the returned connection.
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
