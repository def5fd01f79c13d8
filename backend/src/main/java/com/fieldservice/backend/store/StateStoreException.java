package com.fieldservice.backend.store;

/**
 * Raised by a {@link KeyedStateStore} whose backing system could not serve a request
 * (timeout, connection failure). The in-memory store never throws it.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StateStoreException(String message) {
        super(message);
    }
}
