package com.bridgesentinel.core.store;

/**
 * The store could not be reached. Callers may recover with
 * {@link RecordStore#reconnect()}.
 */
public class StoreConnectionException extends RecordStoreException {

    private static final long serialVersionUID = 1L;

    public StoreConnectionException(String message) {
        super(message);
    }

    public StoreConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
