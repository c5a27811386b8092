package com.propertybooking.common.exception;

import lombok.Getter;

/**
 * Base type for domain errors the caller can act on.
 * Subclasses pick the HTTP status through {@link GlobalExceptionHandler};
 * a plain BusinessException is treated as a client error.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message) {
        super(message);
        this.errorCode = "BUSINESS_ERROR";
    }

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
