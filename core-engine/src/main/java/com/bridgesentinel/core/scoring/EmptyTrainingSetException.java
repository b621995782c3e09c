package com.bridgesentinel.core.scoring;

/**
 * Raised when there is no historical data to train on. Without a model there
 * is nothing to serve, so callers treat this as fatal.
 */
public class EmptyTrainingSetException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public EmptyTrainingSetException(String message) {
        super(message);
    }
}
