package com.bridgesentinel.pipeline.store;

import com.bridgesentinel.core.store.RecordStoreException;
import com.bridgesentinel.core.store.StoreConnectionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link SqlErrorClassifier}.
 */
class SqlErrorClassifierTest {

    @ParameterizedTest(name = "SQLState {0} is a connectivity failure")
    @ValueSource(strings = { "08000", "08001", "08006", "57P01", "57P02", "57P03" })
    void connectivityStates(String state) {
        assertThat(SqlErrorClassifier.isConnectivityFailure(new SQLException("boom", state))).isTrue();
    }

    @ParameterizedTest(name = "SQLState {0} is not a connectivity failure")
    @ValueSource(strings = { "23505", "42P01", "22001", "57014" })
    void otherStates(String state) {
        assertThat(SqlErrorClassifier.isConnectivityFailure(new SQLException("boom", state))).isFalse();
    }

    @Test
    @DisplayName("Connection exception types should count regardless of state")
    void connectionTypes() {
        assertThat(SqlErrorClassifier.isConnectivityFailure(new SQLTransientConnectionException("pool timeout")))
                .isTrue();
        assertThat(SqlErrorClassifier.isConnectivityFailure(new SQLRecoverableException("reset"))).isTrue();
        assertThat(SqlErrorClassifier.isConnectivityFailure(new SQLException("no state"))).isFalse();
    }

    @Test
    @DisplayName("A connectivity cause deeper in the chain should be found")
    void nestedCause() {
        SQLException wrapper = new SQLException("batch failed", "XX000",
                new SQLException("socket closed", "08006"));

        assertThat(SqlErrorClassifier.isConnectivityFailure(wrapper)).isTrue();
    }

    @Test
    @DisplayName("translate should pick the exception type and keep the cause")
    void translate() {
        SQLException lost = new SQLException("terminating connection", "57P01");
        SQLException duplicate = new SQLException("duplicate key", "23505");

        RecordStoreException connection = SqlErrorClassifier.translate("Fetch pending", lost);
        RecordStoreException other = SqlErrorClassifier.translate("Insert", duplicate);

        assertThat(connection).isInstanceOf(StoreConnectionException.class)
                .hasMessageStartingWith("Fetch pending failed")
                .hasCause(lost);
        assertThat(other).isNotInstanceOf(StoreConnectionException.class)
                .hasCause(duplicate);
    }
}
