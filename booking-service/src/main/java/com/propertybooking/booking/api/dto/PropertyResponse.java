package com.propertybooking.booking.api.dto;

import com.propertybooking.booking.domain.model.Property;

import java.time.LocalDateTime;
import java.util.UUID;

public record PropertyResponse(
        UUID propertyId,
        String propertyName,
        String propertyAddress,
        String propertyType,
        Integer maxGuests,
        String description,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static PropertyResponse from(Property property) {
        return new PropertyResponse(
                property.getId(),
                property.getPropertyName(),
                property.getPropertyAddress(),
                property.getPropertyType(),
                property.getMaxGuests(),
                property.getDescription(),
                property.getCreatedAt(),
                property.getUpdatedAt()
        );
    }
}
