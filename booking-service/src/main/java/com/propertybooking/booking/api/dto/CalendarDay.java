package com.propertybooking.booking.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalendarDay(
        LocalDate date,
        @JsonProperty("is_booked") boolean booked,
        UUID bookingId
) {
    public static CalendarDay free(LocalDate date) {
        return new CalendarDay(date, false, null);
    }

    public static CalendarDay bookedBy(LocalDate date, UUID bookingId) {
        return new CalendarDay(date, true, bookingId);
    }
}
