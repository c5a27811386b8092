package com.propertybooking.booking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record GuestRequest(
        @NotBlank(message = "Guest name cannot be blank")
        @Size(max = 100, message = "Guest name must be at most 100 characters")
        String guestName,

        @Size(max = 50, message = "Guest ID card must be at most 50 characters")
        String guestIdCard,

        @Size(max = 20, message = "Guest contact number must be at most 20 characters")
        String guestContactNumber,

        @PositiveOrZero(message = "Guest age cannot be negative")
        Integer guestAge,

        @Size(max = 50, message = "Relationship must be at most 50 characters")
        String relationshipToMainGuest
) {
}
