package com.propertybooking.booking.exception;

import com.propertybooking.common.exception.BusinessException;

/**
 * Malformed booking input: bad dates, non-positive guest count, missing fields.
 * The caller can always recover by correcting the request.
 */
public class BookingValidationException extends BusinessException {

    public BookingValidationException(String message) {
        super(message, "VALIDATION_ERROR");
    }
}
