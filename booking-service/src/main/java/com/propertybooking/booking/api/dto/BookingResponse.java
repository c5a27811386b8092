package com.propertybooking.booking.api.dto;

import com.propertybooking.booking.domain.model.Booking;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public record BookingResponse(
        UUID bookingId,
        UUID propertyId,
        String createdBy,
        String guestName,
        String guestIdCard,
        String guestContactNumber,
        String guestEmail,
        LocalDate checkInDate,
        LocalDate checkOutDate,
        long totalNights,
        Integer numberOfGuests,
        String bookingNotes,
        String specialRequests,
        Booking.BookingStatus bookingStatus,
        BigDecimal bookingAmount,
        Booking.PaymentStatus paymentStatus,
        List<GuestResponse> additionalGuests,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getPropertyId(),
                booking.getCreatedBy(),
                booking.getGuestName(),
                booking.getGuestIdCard(),
                booking.getGuestContactNumber(),
                booking.getGuestEmail(),
                booking.getCheckInDate(),
                booking.getCheckOutDate(),
                booking.getTotalNights(),
                booking.getNumberOfGuests(),
                booking.getBookingNotes(),
                booking.getSpecialRequests(),
                booking.getBookingStatus(),
                booking.getBookingAmount(),
                booking.getPaymentStatus(),
                booking.getAdditionalGuests().stream().map(GuestResponse::from).toList(),
                booking.getCreatedAt(),
                booking.getUpdatedAt()
        );
    }
}
