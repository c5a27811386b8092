package com.propertybooking.booking.api.dto;

import com.propertybooking.booking.domain.model.BookingGuest;

import java.time.LocalDateTime;
import java.util.UUID;

public record GuestResponse(
        UUID guestId,
        String guestName,
        String guestIdCard,
        String guestContactNumber,
        Integer guestAge,
        String relationshipToMainGuest,
        LocalDateTime createdAt
) {
    public static GuestResponse from(BookingGuest guest) {
        return new GuestResponse(
                guest.getId(),
                guest.getGuestName(),
                guest.getGuestIdCard(),
                guest.getGuestContactNumber(),
                guest.getGuestAge(),
                guest.getRelationshipToMainGuest(),
                guest.getCreatedAt()
        );
    }
}
