package com.propertybooking.common.exception;

/**
 * Thrown when a required dependency (e.g. the lock server) is temporarily unavailable.
 * Client may retry the whole request later.
 * Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
