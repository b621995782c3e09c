package com.bridgesentinel.core.store;

/**
 * A failed {@link RecordStore} operation.
 */
public class RecordStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RecordStoreException(String message) {
        super(message);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
