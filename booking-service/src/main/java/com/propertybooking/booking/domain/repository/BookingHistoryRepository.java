package com.propertybooking.booking.domain.repository;

import com.propertybooking.booking.domain.model.BookingHistory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface BookingHistoryRepository extends JpaRepository<BookingHistory, UUID> {

    List<BookingHistory> findByBookingIdOrderByCreatedAtDesc(UUID bookingId);
}
