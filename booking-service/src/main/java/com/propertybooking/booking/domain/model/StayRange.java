package com.propertybooking.booking.domain.model;

import com.propertybooking.booking.exception.BookingValidationException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Half-open stay interval {@code [checkIn, checkOut)}: the guest occupies the nights starting
 * on {@code checkIn} up to but excluding {@code checkOut}. A checkout on the same day as the next
 * check-in is therefore not a conflict.
 */
public record StayRange(LocalDate checkIn, LocalDate checkOut) {

    public StayRange {
        if (checkIn == null || checkOut == null) {
            throw new BookingValidationException("Check-in and check-out dates are required");
        }
        if (!checkOut.isAfter(checkIn)) {
            throw new BookingValidationException(
                    String.format("Check-out date %s must be after check-in date %s", checkOut, checkIn));
        }
    }

    public boolean overlaps(StayRange other) {
        return checkIn.isBefore(other.checkOut) && other.checkIn.isBefore(checkOut);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(checkIn) && date.isBefore(checkOut);
    }

    public long nights() {
        return ChronoUnit.DAYS.between(checkIn, checkOut);
    }

    @Override
    public String toString() {
        return "[" + checkIn + ", " + checkOut + ")";
    }
}
