package tech.notifyrelay.notify.upstream;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Optional;
import java.util.Properties;

/**
 * Opens the dedicated, unpooled JDBC connection that holds a LISTEN subscription.
 */
@FunctionalInterface
public interface PgConnectionFactory {

    Connection connect() throws SQLException;

    /**
     * Human readable target for logs. Never includes credentials.
     */
    default String describe() {
        return "postgresql";
    }

    static PgConnectionFactory driverManager(String jdbcUrl, Optional<String> username, Optional<String> password) {
        return new PgConnectionFactory() {
            @Override
            public Connection connect() throws SQLException {
                Properties props = new Properties();
                username.ifPresent(u -> props.setProperty("user", u));
                password.ifPresent(p -> props.setProperty("password", p));
                props.setProperty("ApplicationName", "notifyrelay");
                props.setProperty("tcpKeepAlive", "true");
                Connection connection = DriverManager.getConnection(jdbcUrl, props);
                connection.setAutoCommit(true);
                return connection;
            }

            @Override
            public String describe() {
                int params = jdbcUrl.indexOf('?');
                return params >= 0 ? jdbcUrl.substring(0, params) : jdbcUrl;
            }
        };
    }
}
