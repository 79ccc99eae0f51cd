package tech.notifyrelay.notify.error;

import java.sql.SQLException;

/**
 * Initial connection setup failed.
 *
 * <p>Authentication and configuration failures are never retryable. Network level
 * failures are reported as retryable; whether to retry is the owner's decision.</p>
 */
public class ConnectFailedException extends NotifyRelayException {

    private final boolean retryable;

    public ConnectFailedException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * Classifies a JDBC connection failure by SQLState.
     * <ul>
     *   <li>{@code 28xxx} invalid authorization - fatal</li>
     *   <li>{@code 3D000} unknown database - fatal</li>
     *   <li>no driver for the URL - fatal</li>
     *   <li>anything else (typically {@code 08xxx}) - retryable</li>
     * </ul>
     */
    public static ConnectFailedException fromSql(String target, SQLException e) {
        String sqlState = e.getSQLState();
        boolean fatal = (sqlState != null && (sqlState.startsWith("28") || sqlState.equals("3D000")))
            || (e.getMessage() != null && e.getMessage().startsWith("No suitable driver"));
        return new ConnectFailedException(
            String.format("Failed to connect to %s (sqlState=%s): %s", target, sqlState, e.getMessage()),
            e,
            !fatal);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
