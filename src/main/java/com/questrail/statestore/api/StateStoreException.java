package com.questrail.statestore.api;

/**
 * Base type for unchecked failures surfaced by a {@link StateStore}.
 */
public class StateStoreException extends RuntimeException
{
    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
