package com.elssolution.insteonbridge.exception;

/**
 * Exception thrown when a device id is unknown to both the live registry and the cache.
 */
public class DeviceNotFoundException extends RuntimeException {

    public DeviceNotFoundException(String message) {
        super(message);
    }

    public DeviceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
