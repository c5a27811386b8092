package com.propertybooking.common.exception;

/**
 * The request is well-formed but clashes with the current state of a resource.
 * Mapped to HTTP 409. Retrying the same request without changing it fails again.
 */
public class ConflictException extends BusinessException {

    public ConflictException(String message, String errorCode) {
        super(message, errorCode);
    }

    public ConflictException(String message, Throwable cause, String errorCode) {
        super(message, cause, errorCode);
    }
}
