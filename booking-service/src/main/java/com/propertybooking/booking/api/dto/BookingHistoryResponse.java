package com.propertybooking.booking.api.dto;

import com.propertybooking.booking.domain.model.BookingHistory;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

public record BookingHistoryResponse(
        UUID historyId,
        UUID bookingId,
        String modifiedBy,
        BookingHistory.ModificationType modificationType,
        Map<String, Object> oldValues,
        Map<String, Object> newValues,
        String modificationNotes,
        LocalDateTime createdAt
) {
    public static BookingHistoryResponse from(BookingHistory history) {
        return new BookingHistoryResponse(
                history.getId(),
                history.getBookingId(),
                history.getModifiedBy(),
                history.getModificationType(),
                history.getOldValues(),
                history.getNewValues(),
                history.getModificationNotes(),
                history.getCreatedAt()
        );
    }
}
