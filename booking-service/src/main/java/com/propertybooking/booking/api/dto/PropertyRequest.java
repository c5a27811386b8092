package com.propertybooking.booking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record PropertyRequest(
        @NotBlank(message = "Property name cannot be blank")
        @Size(max = 100, message = "Property name must be at most 100 characters")
        String propertyName,

        String propertyAddress,

        @Size(max = 50, message = "Property type must be at most 50 characters")
        String propertyType,

        @Positive(message = "Max guests must be positive")
        Integer maxGuests,

        String description
) {
}
