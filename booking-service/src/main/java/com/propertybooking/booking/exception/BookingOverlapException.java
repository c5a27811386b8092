package com.propertybooking.booking.exception;

import com.propertybooking.booking.domain.model.StayRange;
import com.propertybooking.common.exception.ConflictException;
import lombok.Getter;

import java.util.UUID;

/**
 * The requested stay intersects an active booking of the same property.
 */
@Getter
public class BookingOverlapException extends ConflictException {

    private final UUID propertyId;
    private final UUID conflictingBookingId;

    public BookingOverlapException(UUID propertyId, StayRange requested, UUID conflictingBookingId) {
        super(String.format("Booking dates %s overlap with existing booking %s for property %s",
                requested, conflictingBookingId, propertyId), "BOOKING_OVERLAP");
        this.propertyId = propertyId;
        this.conflictingBookingId = conflictingBookingId;
    }

    /**
     * Overlap reported by the database exclusion constraint, where the other booking is unknown.
     */
    public BookingOverlapException(UUID propertyId, Throwable cause) {
        super(String.format("Booking dates overlap with an existing booking for property %s", propertyId),
                cause, "BOOKING_OVERLAP");
        this.propertyId = propertyId;
        this.conflictingBookingId = null;
    }
}
