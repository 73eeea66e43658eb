package com.elssolution.insteonbridge.exception;

/**
 * No capability on the device matches the requested command.
 */
public class CommandUnsupportedException extends RuntimeException {

    public CommandUnsupportedException(String message) {
        super(message);
    }

    public CommandUnsupportedException(String message, Throwable cause) {
        super(message, cause);
    }
}
