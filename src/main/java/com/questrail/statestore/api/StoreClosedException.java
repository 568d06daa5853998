package com.questrail.statestore.api;

/**
 * Raised (or used to complete a dispatch future) when an operation reaches a
 * store that has been closed or has failed.
 */
public class StoreClosedException extends StateStoreException
{
    public StoreClosedException(String message) {
        super(message);
    }

    public StoreClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
