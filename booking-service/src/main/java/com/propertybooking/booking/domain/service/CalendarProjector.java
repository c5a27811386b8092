package com.propertybooking.booking.domain.service;

import com.propertybooking.booking.api.dto.CalendarDay;
import com.propertybooking.booking.api.dto.MonthCalendar;
import com.propertybooking.booking.domain.model.Booking;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a property's booking ranges into a per-day occupancy view of one month.
 * Pure: no I/O, the caller supplies the bookings intersecting the month.
 */
@Component
public class CalendarProjector {

    public MonthCalendar project(YearMonth month, List<Booking> bookings) {
        LocalDate firstDay = month.atDay(1);
        LocalDate dayAfterMonth = month.atEndOfMonth().plusDays(1);

        // pass 1: booked nights inside the month, first covering booking wins
        Map<LocalDate, UUID> bookedDays = new HashMap<>();
        for (Booking booking : bookings) {
            if (!booking.isActive()) {
                continue;
            }
            LocalDate from = max(booking.getCheckInDate(), firstDay);
            LocalDate to = min(booking.getCheckOutDate(), dayAfterMonth);
            for (LocalDate day = from; day.isBefore(to); day = day.plusDays(1)) {
                bookedDays.putIfAbsent(day, booking.getId());
            }
        }

        // pass 2: one entry per day
        List<CalendarDay> days = new ArrayList<>(month.lengthOfMonth());
        for (LocalDate day = firstDay; day.isBefore(dayAfterMonth); day = day.plusDays(1)) {
            UUID bookingId = bookedDays.get(day);
            days.add(bookingId != null ? CalendarDay.bookedBy(day, bookingId) : CalendarDay.free(day));
        }
        return new MonthCalendar(month.getYear(), month.getMonthValue(), days);
    }

    private static LocalDate max(LocalDate a, LocalDate b) {
        return a.isAfter(b) ? a : b;
    }

    private static LocalDate min(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? a : b;
    }
}
