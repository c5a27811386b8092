package com.propertybooking.booking.domain.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertybooking.booking.api.dto.BookingResponse;
import com.propertybooking.booking.domain.model.BookingHistory;
import com.propertybooking.booking.domain.model.BookingHistory.ModificationType;
import com.propertybooking.booking.domain.repository.BookingHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;

/**
 * Writes booking audit rows. Callers invoke it inside the transaction of the mutation, so a
 * failed write rolls back the history row with it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingHistoryRecorder {

    private static final TypeReference<Map<String, Object>> SNAPSHOT_TYPE = new TypeReference<>() {
    };

    private final BookingHistoryRepository historyRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void recordCreated(BookingResponse created, String actorId) {
        record(created.bookingId(), ModificationType.CREATED, null, created, "Booking created", actorId);
    }

    public void recordUpdated(BookingResponse before, BookingResponse after,
                              Collection<String> changedFields, String actorId) {
        String notes = changedFields.isEmpty()
                ? "No effective changes"
                : "Changed fields: " + String.join(", ", changedFields);
        record(after.bookingId(), ModificationType.UPDATED, before, after, notes, actorId);
    }

    public void recordCancelled(BookingResponse before, BookingResponse after, String actorId) {
        record(after.bookingId(), ModificationType.CANCELLED, before, after, "Booking cancelled", actorId);
    }

    public void recordCompleted(BookingResponse before, BookingResponse after) {
        record(after.bookingId(), ModificationType.COMPLETED, before, after, "Stay completed", null);
    }

    private void record(UUID bookingId, ModificationType type, BookingResponse before, BookingResponse after,
                        String notes, String actorId) {
        BookingHistory history = BookingHistory.builder()
                .bookingId(bookingId)
                .modifiedBy(actorId)
                .modificationType(type)
                .oldValues(snapshot(before))
                .newValues(snapshot(after))
                .modificationNotes(notes)
                .createdAt(LocalDateTime.now(clock))
                .build();
        historyRepository.save(history);
        log.debug("Recorded {} history for booking {}", type, bookingId);
    }

    private Map<String, Object> snapshot(BookingResponse booking) {
        return booking == null ? null : objectMapper.convertValue(booking, SNAPSHOT_TYPE);
    }
}
