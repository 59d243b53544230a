package infra.jdbc;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Hands out the connection of the current invocation. Callers must not close it.
 */
@FunctionalInterface
public interface ConnectionProvider {
    Connection get() throws SQLException;
}
