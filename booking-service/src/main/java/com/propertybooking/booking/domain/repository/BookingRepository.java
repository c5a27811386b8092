package com.propertybooking.booking.domain.repository;

import com.propertybooking.booking.domain.model.Booking;
import com.propertybooking.booking.domain.model.Booking.BookingStatus;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Booking entity.
 * Finders that return bookings to callers fetch the additional guests in the same query.
 */
public interface BookingRepository extends JpaRepository<Booking, UUID> {

    @EntityGraph(attributePaths = "additionalGuests")
    Optional<Booking> findWithGuestsById(UUID id);

    /**
     * Bookings of a property in the given statuses whose stay intersects {@code [from, to)}.
     * Serves both the overlap check and the month calendar.
     */
    @Query("SELECT b FROM Booking b WHERE b.propertyId = :propertyId " +
            "AND b.bookingStatus IN :statuses " +
            "AND b.checkInDate < :to AND b.checkOutDate > :from " +
            "ORDER BY b.checkInDate")
    List<Booking> findIntersecting(
            @Param("propertyId") UUID propertyId,
            @Param("statuses") Collection<BookingStatus> statuses,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to);

    @EntityGraph(attributePaths = "additionalGuests")
    @Query("SELECT b FROM Booking b WHERE b.propertyId = :propertyId " +
            "AND b.bookingStatus IN :statuses " +
            "AND b.checkInDate >= :today AND b.checkInDate <= :upTo " +
            "ORDER BY b.checkInDate ASC")
    List<Booking> findUpcoming(
            @Param("propertyId") UUID propertyId,
            @Param("statuses") Collection<BookingStatus> statuses,
            @Param("today") LocalDate today,
            @Param("upTo") LocalDate upTo);

    @EntityGraph(attributePaths = "additionalGuests")
    @Query("SELECT b FROM Booking b WHERE b.propertyId = :propertyId " +
            "AND b.checkOutDate < :today AND b.checkOutDate >= :backTo " +
            "ORDER BY b.checkOutDate DESC")
    List<Booking> findPrevious(
            @Param("propertyId") UUID propertyId,
            @Param("today") LocalDate today,
            @Param("backTo") LocalDate backTo);

    /**
     * Case-insensitive substring match on the primary guest name. Wildcards in the
     * name are matched literally.
     */
    @EntityGraph(attributePaths = "additionalGuests")
    List<Booking> findByPropertyIdAndGuestNameContainingIgnoreCaseOrderByCheckInDateDesc(
            UUID propertyId, String guestName);

    @EntityGraph(attributePaths = "additionalGuests")
    List<Booking> findByBookingStatusAndCheckOutDateBefore(BookingStatus status, LocalDate date);
}
