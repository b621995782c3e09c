package com.bridgesentinel.pipeline.store;

import com.bridgesentinel.core.store.RecordStoreException;
import com.bridgesentinel.core.store.StoreConnectionException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;
import java.util.Set;

/**
 * Maps JDBC failures onto the record store exception types.
 *
 * <p>
 * A failure counts as lost connectivity when any exception in the chain is a
 * JDBC connection exception type, carries an SQLState of class {@code 08}
 * (connection exception) or one of the PostgreSQL shutdown states
 * {@code 57P01}..{@code 57P03}.
 * </p>
 */
public final class SqlErrorClassifier {

    private static final Set<String> SHUTDOWN_STATES = Set.of("57P01", "57P02", "57P03");

    private SqlErrorClassifier() {
        // utility class, not instantiable
    }

    public static boolean isConnectivityFailure(SQLException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLTransientConnectionException
                    || current instanceof SQLNonTransientConnectionException
                    || current instanceof SQLRecoverableException) {
                return true;
            }
            if (current instanceof SQLException sql) {
                String state = sql.getSQLState();
                if (state != null && (state.startsWith("08") || SHUTDOWN_STATES.contains(state))) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * @param operation short description used in the message
     * @param e         the JDBC failure
     * @return a {@link StoreConnectionException} or a plain
     *         {@link RecordStoreException}
     */
    public static RecordStoreException translate(String operation, SQLException e) {
        String message = operation + " failed: " + e.getMessage();
        return isConnectivityFailure(e)
                ? new StoreConnectionException(message, e)
                : new RecordStoreException(message, e);
    }
}
