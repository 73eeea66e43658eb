package com.elssolution.insteonbridge.exception;

/**
 * The gateway failed to reload its device list.
 */
public class DiscoveryFailedException extends RuntimeException {

    public DiscoveryFailedException(String message) {
        super(message);
    }

    public DiscoveryFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
