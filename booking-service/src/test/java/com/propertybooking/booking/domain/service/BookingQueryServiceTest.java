package com.propertybooking.booking.domain.service;

import com.propertybooking.booking.api.dto.BookingResponse;
import com.propertybooking.booking.api.dto.CalendarDay;
import com.propertybooking.booking.api.dto.MonthCalendar;
import com.propertybooking.booking.domain.model.Booking;
import com.propertybooking.booking.domain.model.Booking.BookingStatus;
import com.propertybooking.booking.domain.repository.BookingRepository;
import com.propertybooking.booking.domain.repository.PropertyRepository;
import com.propertybooking.booking.exception.BookingValidationException;
import com.propertybooking.common.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class BookingQueryServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-10T08:00:00Z"), ZoneOffset.UTC);
    private static final LocalDate TODAY = LocalDate.of(2024, 1, 10);
    private static final UUID PROPERTY_ID = UUID.randomUUID();

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private PropertyRepository propertyRepository;

    private BookingQueryService queryService;

    @BeforeEach
    void setUp() {
        queryService = new BookingQueryService(bookingRepository, propertyRepository, new CalendarProjector(), CLOCK);
    }

    private static Booking booking(String checkIn, String checkOut) {
        return Booking.builder()
                .id(UUID.randomUUID())
                .propertyId(PROPERTY_ID)
                .guestName("Jane Doe")
                .guestIdCard("ID-1")
                .guestContactNumber("555")
                .checkInDate(LocalDate.parse(checkIn))
                .checkOutDate(LocalDate.parse(checkOut))
                .numberOfGuests(1)
                .bookingStatus(BookingStatus.CONFIRMED)
                .build();
    }

    @Test
    @DisplayName("upcoming defaults to three months ahead of today")
    void upcoming_defaultWindow() {
        Booking next = booking("2024-01-15", "2024-01-20");
        given(bookingRepository.findUpcoming(PROPERTY_ID, BookingStatus.ACTIVE, TODAY, LocalDate.of(2024, 4, 10)))
                .willReturn(List.of(next));

        List<BookingResponse> upcoming = queryService.getUpcomingBookings(PROPERTY_ID, null);

        assertThat(upcoming).extracting(BookingResponse::bookingId).containsExactly(next.getId());
    }

    @Test
    void upcoming_explicitUpperBound() {
        given(bookingRepository.findUpcoming(PROPERTY_ID, BookingStatus.ACTIVE, TODAY, LocalDate.of(2024, 1, 31)))
                .willReturn(List.of());

        assertThat(queryService.getUpcomingBookings(PROPERTY_ID, LocalDate.of(2024, 1, 31))).isEmpty();
    }

    @Test
    @DisplayName("previous defaults to three months before today")
    void previous_defaultWindow() {
        given(bookingRepository.findPrevious(PROPERTY_ID, TODAY, LocalDate.of(2023, 10, 10))).willReturn(List.of());

        assertThat(queryService.getPreviousBookings(PROPERTY_ID, null)).isEmpty();
        verify(bookingRepository).findPrevious(PROPERTY_ID, TODAY, LocalDate.of(2023, 10, 10));
    }

    @Test
    void search_trimsName() {
        given(bookingRepository.findByPropertyIdAndGuestNameContainingIgnoreCaseOrderByCheckInDateDesc(PROPERTY_ID, "doe"))
                .willReturn(List.of(booking("2024-02-01", "2024-02-03")));

        assertThat(queryService.searchByGuestName(PROPERTY_ID, "  doe ")).hasSize(1);
    }

    @Test
    void search_rejectsBlankName() {
        assertThatThrownBy(() -> queryService.searchByGuestName(PROPERTY_ID, "   "))
                .isInstanceOf(BookingValidationException.class);
        verifyNoInteractions(bookingRepository);
    }

    @Test
    @DisplayName("calendar fetches bookings intersecting the month and projects them")
    void calendar_projectsMonth() {
        Booking stay = booking("2024-01-30", "2024-02-03");
        given(propertyRepository.existsById(PROPERTY_ID)).willReturn(true);
        given(bookingRepository.findIntersecting(eq(PROPERTY_ID), eq(BookingStatus.ACTIVE),
                eq(LocalDate.of(2024, 2, 1)), eq(LocalDate.of(2024, 3, 1))))
                .willReturn(List.of(stay));

        MonthCalendar calendar = queryService.getMonthCalendar(PROPERTY_ID, 2024, 2);

        assertThat(calendar.days()).hasSize(29);
        assertThat(calendar.days()).filteredOn(CalendarDay::booked).hasSize(2);
    }

    @Test
    void calendar_rejectsMonthOutOfRange() {
        assertThatThrownBy(() -> queryService.getMonthCalendar(PROPERTY_ID, 2024, 13))
                .isInstanceOf(BookingValidationException.class)
                .hasMessageContaining("between 1 and 12");
        assertThatThrownBy(() -> queryService.getMonthCalendar(PROPERTY_ID, 2024, 0))
                .isInstanceOf(BookingValidationException.class);
        verifyNoInteractions(propertyRepository, bookingRepository);
    }

    @Test
    @DisplayName("calendar rejects a year whose following month cannot be represented")
    void calendar_rejectsLastRepresentableYear() {
        assertThatThrownBy(() -> queryService.getMonthCalendar(PROPERTY_ID, 999_999_999, 12))
                .isInstanceOf(BookingValidationException.class)
                .hasMessageContaining("Invalid year");
        verifyNoInteractions(propertyRepository, bookingRepository);
    }

    @Test
    void calendar_unknownProperty() {
        given(propertyRepository.existsById(PROPERTY_ID)).willReturn(false);

        assertThatThrownBy(() -> queryService.getMonthCalendar(PROPERTY_ID, 2024, 1))
                .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(bookingRepository);
    }
}
