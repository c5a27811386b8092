package com.propertybooking.booking.api.dto;

import com.propertybooking.booking.domain.model.Booking;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record CreateBookingRequest(
        @NotNull(message = "Property ID cannot be null")
        UUID propertyId,

        @NotBlank(message = "Guest name cannot be blank")
        @Size(max = 100, message = "Guest name must be at most 100 characters")
        String guestName,

        @NotBlank(message = "Guest ID card cannot be blank")
        @Size(max = 50, message = "Guest ID card must be at most 50 characters")
        String guestIdCard,

        @NotBlank(message = "Guest contact number cannot be blank")
        @Size(max = 20, message = "Guest contact number must be at most 20 characters")
        String guestContactNumber,

        @Email(message = "Guest email must be a valid address")
        @Size(max = 100, message = "Guest email must be at most 100 characters")
        String guestEmail,

        @NotNull(message = "Check-in date cannot be null")
        LocalDate checkInDate,

        @NotNull(message = "Check-out date cannot be null")
        LocalDate checkOutDate,

        @NotNull(message = "Number of guests cannot be null")
        @Positive(message = "Number of guests must be positive")
        Integer numberOfGuests,

        String bookingNotes,

        String specialRequests,

        @DecimalMin(value = "0.00", message = "Booking amount cannot be negative")
        @Digits(integer = 8, fraction = 2, message = "Booking amount must fit 8 integer and 2 fraction digits")
        BigDecimal bookingAmount,

        Booking.BookingStatus bookingStatus,

        @Valid
        List<GuestRequest> additionalGuests
) {
}
