package com.propertybooking.booking.exception;

import com.propertybooking.common.exception.ConflictException;

/**
 * Operation not permitted for the booking's current status or dates,
 * e.g. cancelling a stay that already started or was already cancelled.
 */
public class InvalidBookingStateException extends ConflictException {

    public InvalidBookingStateException(String message) {
        super(message, "INVALID_BOOKING_STATE");
    }
}
