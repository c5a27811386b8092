package com.propertybooking.booking.api.dto;

import java.util.List;

/**
 * Occupancy of one property for one calendar month, one entry per day in date order.
 */
public record MonthCalendar(
        int year,
        int month,
        List<CalendarDay> days
) {
}
