package com.propertybooking.booking.api.dto;

import com.propertybooking.booking.domain.model.Booking;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Sparse update: a {@code null} component means "leave unchanged".
 * A non-null {@code additionalGuests} replaces the whole guest list.
 */
public record UpdateBookingRequest(
        UUID propertyId,

        @Size(min = 1, max = 100, message = "Guest name must be 1 to 100 characters")
        String guestName,

        @Size(min = 1, max = 50, message = "Guest ID card must be 1 to 50 characters")
        String guestIdCard,

        @Size(min = 1, max = 20, message = "Guest contact number must be 1 to 20 characters")
        String guestContactNumber,

        @Email(message = "Guest email must be a valid address")
        @Size(max = 100, message = "Guest email must be at most 100 characters")
        String guestEmail,

        LocalDate checkInDate,

        LocalDate checkOutDate,

        @Positive(message = "Number of guests must be positive")
        Integer numberOfGuests,

        String bookingNotes,

        String specialRequests,

        @DecimalMin(value = "0.00", message = "Booking amount cannot be negative")
        @Digits(integer = 8, fraction = 2, message = "Booking amount must fit 8 integer and 2 fraction digits")
        BigDecimal bookingAmount,

        Booking.BookingStatus bookingStatus,

        Booking.PaymentStatus paymentStatus,

        @Valid
        List<GuestRequest> additionalGuests
) {

    public boolean hasChanges() {
        return Stream.of(propertyId, guestName, guestIdCard, guestContactNumber, guestEmail,
                        checkInDate, checkOutDate, numberOfGuests, bookingNotes, specialRequests,
                        bookingAmount, bookingStatus, paymentStatus, additionalGuests)
                .anyMatch(value -> value != null);
    }
}
