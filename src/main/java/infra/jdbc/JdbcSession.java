package infra.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * One lazily opened JDBC connection shared by the resolver, the catalog and the renderer of a
 * single invocation. The driver jar comes from the runtime class path.
 */
public final class JdbcSession implements ConnectionProvider, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JdbcSession.class);

    private final String url;
    private final String user;
    private final String password;
    private Connection connection;

    public JdbcSession(String url, String user, String password) {
        if (url == null || url.isBlank()) throw new IllegalArgumentException("jdbc url is blank");
        this.url = url.trim();
        this.user = user;
        this.password = password;
    }

    @Override
    public Connection get() throws SQLException {
        if (connection == null || connection.isClosed()) {
            Properties props = new Properties();
            if (user != null && !user.isBlank()) props.setProperty("user", user);
            if (password != null) props.setProperty("password", password);
            log.debug("opening connection url={} user={}", url, user);
            connection = DriverManager.getConnection(url, props);
            connection.setReadOnly(true);
        }
        return connection;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public void close() {
        if (connection == null) return;
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("[WARN] failed to close connection: {}", e.getMessage());
        } finally {
            connection = null;
        }
    }
}
