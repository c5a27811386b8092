package com.propertybooking.booking.exception;

import lombok.Getter;

/**
 * Persistence failure that is not a known domain error. Fatal for the current operation;
 * not retried by the store.
 */
@Getter
public class BookingStoreException extends RuntimeException {

    private final String errorCode = "STORE_ERROR";

    public BookingStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
