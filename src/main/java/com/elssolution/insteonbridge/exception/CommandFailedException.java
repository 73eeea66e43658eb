package com.elssolution.insteonbridge.exception;

/**
 * The device capability was found but failed while executing.
 */
public class CommandFailedException extends RuntimeException {

    public CommandFailedException(String message) {
        super(message);
    }

    public CommandFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
