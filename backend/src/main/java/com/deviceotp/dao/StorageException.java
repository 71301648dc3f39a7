package com.deviceotp.dao;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;

public final class StorageException extends RuntimeException {
    private final String operation;
    private final boolean transientFailure;

    public StorageException(String operation, boolean transientFailure, Throwable cause) {
        super("Storage operation " + operation + " failed", cause);
        this.operation = operation;
        this.transientFailure = transientFailure;
    }

    public static StorageException of(String operation, SQLException e) {
        return new StorageException(operation, isTransient(e), e);
    }

    public String operation() {
        return operation;
    }

    /**
     * Timeouts, lost connections and lock conflicts. Only idempotent reads may be retried on these.
     */
    public boolean isTransient() {
        return transientFailure;
    }

    static boolean isTransient(SQLException e) {
        if (e instanceof SQLTimeoutException
            || e instanceof SQLTransientException
            || e instanceof SQLRecoverableException) {
            return true;
        }
        String state = e.getSQLState();
        if (state == null) {
            return false;
        }
        return state.startsWith("08")
            || "57014".equals(state)
            || "40001".equals(state)
            || "40P01".equals(state)
            || "55P03".equals(state);
    }
}
