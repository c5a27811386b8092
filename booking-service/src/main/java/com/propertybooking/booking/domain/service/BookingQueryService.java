package com.propertybooking.booking.domain.service;

import com.propertybooking.booking.api.dto.BookingResponse;
import com.propertybooking.booking.api.dto.MonthCalendar;
import com.propertybooking.booking.domain.model.Booking;
import com.propertybooking.booking.domain.model.Booking.BookingStatus;
import com.propertybooking.booking.domain.repository.BookingRepository;
import com.propertybooking.booking.domain.repository.PropertyRepository;
import com.propertybooking.booking.exception.BookingValidationException;
import com.propertybooking.common.exception.ResourceNotFoundException;
import com.propertybooking.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Year;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

/**
 * Read side of the booking store: listings per property and the month calendar.
 * Reads take no locks and may run concurrently with writes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BookingQueryService {

    private final BookingRepository bookingRepository;
    private final PropertyRepository propertyRepository;
    private final CalendarProjector calendarProjector;
    private final Clock clock;

    /**
     * Active bookings with check-in between today and {@code upToDate} inclusive, earliest first.
     * Defaults to three months ahead.
     */
    public List<BookingResponse> getUpcomingBookings(UUID propertyId, LocalDate upToDate) {
        LocalDate today = LocalDate.now(clock);
        LocalDate upTo = upToDate != null ? upToDate : today.plusMonths(Constants.DEFAULT_LOOKAHEAD_MONTHS);
        log.debug("Listing upcoming bookings for property {} from {} to {}", propertyId, today, upTo);
        return toResponses(bookingRepository.findUpcoming(propertyId, BookingStatus.ACTIVE, today, upTo));
    }

    /**
     * Bookings of any status that checked out before today and on or after {@code backToDate},
     * most recent checkout first. Defaults to three months back.
     */
    public List<BookingResponse> getPreviousBookings(UUID propertyId, LocalDate backToDate) {
        LocalDate today = LocalDate.now(clock);
        LocalDate backTo = backToDate != null ? backToDate : today.minusMonths(Constants.DEFAULT_LOOKBACK_MONTHS);
        log.debug("Listing previous bookings for property {} from {} back to {}", propertyId, today, backTo);
        return toResponses(bookingRepository.findPrevious(propertyId, today, backTo));
    }

    public List<BookingResponse> searchByGuestName(UUID propertyId, String guestName) {
        if (guestName == null || guestName.isBlank()) {
            throw new BookingValidationException("Guest name is required");
        }
        return toResponses(bookingRepository
                .findByPropertyIdAndGuestNameContainingIgnoreCaseOrderByCheckInDateDesc(propertyId, guestName.trim()));
    }

    public MonthCalendar getMonthCalendar(UUID propertyId, int year, int month) {
        YearMonth yearMonth = toYearMonth(year, month);
        if (!propertyRepository.existsById(propertyId)) {
            throw new ResourceNotFoundException("Property", propertyId);
        }
        LocalDate firstDay = yearMonth.atDay(1);
        LocalDate dayAfterMonth = yearMonth.atEndOfMonth().plusDays(1);
        List<Booking> bookings = bookingRepository.findIntersecting(
                propertyId, BookingStatus.ACTIVE, firstDay, dayAfterMonth);
        log.debug("Projecting {} bookings onto {} for property {}", bookings.size(), yearMonth, propertyId);
        return calendarProjector.project(yearMonth, bookings);
    }

    private static YearMonth toYearMonth(int year, int month) {
        if (month < 1 || month > 12) {
            throw new BookingValidationException("Month must be between 1 and 12");
        }
        // the calendar query reads up to the first day of the following month
        if (year < Year.MIN_VALUE || year >= Year.MAX_VALUE) {
            throw new BookingValidationException("Invalid year: " + year);
        }
        try {
            return YearMonth.of(year, month);
        } catch (DateTimeException e) {
            throw new BookingValidationException("Invalid year: " + year);
        }
    }

    private static List<BookingResponse> toResponses(List<Booking> bookings) {
        return bookings.stream().map(BookingResponse::from).toList();
    }
}
