package com.elssolution.insteonbridge.exception;

/** Device cache file could not be read or written. */
public class CachePersistenceException extends RuntimeException {

    public CachePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
