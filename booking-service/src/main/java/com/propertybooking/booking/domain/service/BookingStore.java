package com.propertybooking.booking.domain.service;

import com.propertybooking.booking.api.dto.BookingHistoryResponse;
import com.propertybooking.booking.api.dto.BookingResponse;
import com.propertybooking.booking.api.dto.CreateBookingRequest;
import com.propertybooking.booking.api.dto.GuestRequest;
import com.propertybooking.booking.api.dto.UpdateBookingRequest;
import com.propertybooking.booking.domain.model.Booking;
import com.propertybooking.booking.domain.model.Booking.BookingStatus;
import com.propertybooking.booking.domain.model.BookingGuest;
import com.propertybooking.booking.domain.model.StayRange;
import com.propertybooking.booking.domain.repository.BookingHistoryRepository;
import com.propertybooking.booking.domain.repository.BookingRepository;
import com.propertybooking.booking.domain.strategy.PropertyLockStrategy;
import com.propertybooking.booking.exception.BookingOverlapException;
import com.propertybooking.booking.exception.BookingStoreException;
import com.propertybooking.booking.exception.BookingValidationException;
import com.propertybooking.booking.exception.InvalidBookingStateException;
import com.propertybooking.common.exception.ConflictException;
import com.propertybooking.common.exception.ResourceNotFoundException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Owns every booking write and enforces the non-overlap rule: two active bookings of the same
 * property never share a night.
 *
 * Create and update run their check-then-write sequence inside the per-property lock supplied by
 * the configured {@link PropertyLockStrategy}; the database exclusion constraint
 * {@value #OVERLAP_CONSTRAINT} backs this up and its violations are reported as overlaps too.
 *
 * Configuration:
 * booking.lock.strategy: pessimistic | distributed
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingStore {

    static final String OVERLAP_CONSTRAINT = "bookings_no_overlap";

    private static final Set<String> OVERLAP_FIELDS =
            Set.of("property_id", "check_in_date", "check_out_date", "booking_status");

    private final Map<String, PropertyLockStrategy> lockStrategies;
    private final BookingRepository bookingRepository;
    private final BookingHistoryRepository historyRepository;
    private final BookingHistoryRecorder historyRecorder;
    private final Clock clock;

    @Value("${booking.lock.strategy:pessimistic}")
    private String lockStrategyType;

    @PostConstruct
    public void init() {
        PropertyLockStrategy strategy = getLockStrategy();
        log.info("Initialized BookingStore with lock strategy: {}", strategy.getStrategyType());
    }

    public BookingResponse createBooking(CreateBookingRequest request, String actorId) {
        if (request == null) {
            throw new BookingValidationException("Booking request is required");
        }
        if (request.propertyId() == null) {
            throw new BookingValidationException("Property ID is required");
        }
        requireText(request.guestName(), "Guest name");
        requireText(request.guestIdCard(), "Guest ID card");
        requireText(request.guestContactNumber(), "Guest contact number");
        validateGuestCount(request.numberOfGuests());
        StayRange stay = new StayRange(request.checkInDate(), request.checkOutDate());

        BookingStatus initialStatus = request.bookingStatus() != null
                ? request.bookingStatus() : BookingStatus.CONFIRMED;
        if (!initialStatus.isActive()) {
            throw new BookingValidationException(
                    "A new booking must be pending or confirmed, not " + initialStatus.value());
        }

        return getLockStrategy().executeLocked(request.propertyId(), () -> {
            ensureNoOverlap(request.propertyId(), stay, null);

            LocalDateTime now = LocalDateTime.now(clock);
            Booking booking = Booking.builder()
                    .propertyId(request.propertyId())
                    .createdBy(actorId)
                    .guestName(request.guestName())
                    .guestIdCard(request.guestIdCard())
                    .guestContactNumber(request.guestContactNumber())
                    .guestEmail(request.guestEmail())
                    .checkInDate(stay.checkIn())
                    .checkOutDate(stay.checkOut())
                    .numberOfGuests(request.numberOfGuests())
                    .bookingNotes(request.bookingNotes())
                    .specialRequests(request.specialRequests())
                    .bookingAmount(request.bookingAmount())
                    .bookingStatus(initialStatus)
                    .paymentStatus(Booking.PaymentStatus.PENDING)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            toGuests(request.additionalGuests(), now).forEach(booking::addGuest);

            BookingResponse created = BookingResponse.from(persist(booking));
            historyRecorder.recordCreated(created, actorId);
            log.info("Created booking {} for property {} {} ({} nights)",
                    created.bookingId(), created.propertyId(), stay, created.totalNights());
            return created;
        });
    }

    /**
     * Applies the non-null fields of {@code request}. The overlap check re-runs, excluding the
     * booking itself, only when property, dates or status changed and the result is active.
     */
    public BookingResponse updateBooking(UUID bookingId, UpdateBookingRequest request, String actorId) {
        if (request == null || !request.hasChanges()) {
            throw new BookingValidationException("No fields to update");
        }
        UUID currentPropertyId = bookingRepository.findById(bookingId)
                .map(Booking::getPropertyId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        UUID targetPropertyId = request.propertyId() != null ? request.propertyId() : currentPropertyId;

        return getLockStrategy().executeLocked(targetPropertyId, () -> {
            Booking booking = findBooking(bookingId);
            if (request.propertyId() == null && !targetPropertyId.equals(booking.getPropertyId())) {
                throw new ConflictException(
                        "Booking " + bookingId + " was moved to another property concurrently",
                        "CONCURRENT_MODIFICATION");
            }
            BookingResponse before = BookingResponse.from(booking);

            LocalDateTime now = LocalDateTime.now(clock);
            Set<String> changed = applyChanges(booking, request, now);
            requireText(booking.getGuestName(), "Guest name");
            requireText(booking.getGuestIdCard(), "Guest ID card");
            requireText(booking.getGuestContactNumber(), "Guest contact number");
            validateGuestCount(booking.getNumberOfGuests());
            StayRange stay = booking.getStayRange();

            if (booking.isActive() && changed.stream().anyMatch(OVERLAP_FIELDS::contains)) {
                ensureNoOverlap(booking.getPropertyId(), stay, booking.getId());
            }
            booking.setUpdatedAt(now);

            BookingResponse after = BookingResponse.from(persist(booking));
            historyRecorder.recordUpdated(before, after, changed, actorId);
            log.info("Updated booking {} (changed: {})", bookingId, changed);
            return after;
        });
    }

    /**
     * Cancels an active booking whose check-in is today or later. Concurrent writers are detected
     * through the booking's version column.
     */
    @Transactional
    public void cancelBooking(UUID bookingId, String actorId) {
        Booking booking = findBooking(bookingId);
        LocalDate today = LocalDate.now(clock);

        if (!booking.isActive()) {
            throw new InvalidBookingStateException(String.format(
                    "Booking %s is %s and cannot be cancelled", bookingId, booking.getBookingStatus().value()));
        }
        if (booking.getCheckInDate().isBefore(today)) {
            throw new InvalidBookingStateException(String.format(
                    "Booking %s cannot be cancelled: check-in date %s has passed", bookingId, booking.getCheckInDate()));
        }

        BookingResponse before = BookingResponse.from(booking);
        booking.setBookingStatus(BookingStatus.CANCELLED);
        booking.setUpdatedAt(LocalDateTime.now(clock));
        BookingResponse after = BookingResponse.from(persist(booking));
        historyRecorder.recordCancelled(before, after, actorId);
        log.info("Cancelled booking {} for property {}", bookingId, booking.getPropertyId());
    }

    @Transactional(readOnly = true)
    public BookingResponse getBooking(UUID bookingId) {
        return BookingResponse.from(findBooking(bookingId));
    }

    @Transactional(readOnly = true)
    public List<BookingHistoryResponse> getBookingHistory(UUID bookingId) {
        if (!bookingRepository.existsById(bookingId)) {
            throw new ResourceNotFoundException("Booking", bookingId);
        }
        return historyRepository.findByBookingIdOrderByCreatedAtDesc(bookingId).stream()
                .map(BookingHistoryResponse::from)
                .toList();
    }

    /**
     * Marks confirmed bookings whose checkout date has passed as completed.
     *
     * @return number of bookings completed
     */
    @Transactional
    public int completeFinishedStays() {
        LocalDate today = LocalDate.now(clock);
        List<Booking> finished = bookingRepository.findByBookingStatusAndCheckOutDateBefore(
                BookingStatus.CONFIRMED, today);
        for (Booking booking : finished) {
            BookingResponse before = BookingResponse.from(booking);
            booking.setBookingStatus(BookingStatus.COMPLETED);
            booking.setUpdatedAt(LocalDateTime.now(clock));
            historyRecorder.recordCompleted(before, BookingResponse.from(booking));
        }
        if (!finished.isEmpty()) {
            log.info("Completed {} bookings with checkout before {}", finished.size(), today);
        }
        return finished.size();
    }

    private void ensureNoOverlap(UUID propertyId, StayRange requested, UUID excludeBookingId) {
        bookingRepository.findIntersecting(propertyId, BookingStatus.ACTIVE, requested.checkIn(), requested.checkOut())
                .stream()
                .filter(existing -> !existing.getId().equals(excludeBookingId))
                .filter(existing -> existing.getStayRange().overlaps(requested))
                .findFirst()
                .ifPresent(conflict -> {
                    log.debug("Requested stay {} for property {} overlaps booking {} {}",
                            requested, propertyId, conflict.getId(), conflict.getStayRange());
                    throw new BookingOverlapException(propertyId, requested, conflict.getId());
                });
    }

    private Set<String> applyChanges(Booking booking, UpdateBookingRequest request, LocalDateTime now) {
        Set<String> changed = new LinkedHashSet<>();
        merge("property_id", request.propertyId(), booking.getPropertyId(), booking::setPropertyId, changed);
        merge("guest_name", request.guestName(), booking.getGuestName(), booking::setGuestName, changed);
        merge("guest_id_card", request.guestIdCard(), booking.getGuestIdCard(), booking::setGuestIdCard, changed);
        merge("guest_contact_number", request.guestContactNumber(), booking.getGuestContactNumber(),
                booking::setGuestContactNumber, changed);
        merge("guest_email", request.guestEmail(), booking.getGuestEmail(), booking::setGuestEmail, changed);
        merge("check_in_date", request.checkInDate(), booking.getCheckInDate(), booking::setCheckInDate, changed);
        merge("check_out_date", request.checkOutDate(), booking.getCheckOutDate(), booking::setCheckOutDate, changed);
        merge("number_of_guests", request.numberOfGuests(), booking.getNumberOfGuests(),
                booking::setNumberOfGuests, changed);
        merge("booking_notes", request.bookingNotes(), booking.getBookingNotes(), booking::setBookingNotes, changed);
        merge("special_requests", request.specialRequests(), booking.getSpecialRequests(),
                booking::setSpecialRequests, changed);
        merge("booking_amount", request.bookingAmount(), booking.getBookingAmount(),
                booking::setBookingAmount, changed);
        merge("booking_status", request.bookingStatus(), booking.getBookingStatus(),
                booking::setBookingStatus, changed);
        merge("payment_status", request.paymentStatus(), booking.getPaymentStatus(),
                booking::setPaymentStatus, changed);
        if (request.additionalGuests() != null) {
            booking.replaceGuests(toGuests(request.additionalGuests(), now));
            changed.add("additional_guests");
        }
        return changed;
    }

    private static <T> void merge(String field, T requested, T current, Consumer<T> setter, Set<String> changed) {
        if (requested != null && !Objects.equals(requested, current)) {
            setter.accept(requested);
            changed.add(field);
        }
    }

    private static List<BookingGuest> toGuests(List<GuestRequest> guests, LocalDateTime createdAt) {
        if (guests == null) {
            return List.of();
        }
        return guests.stream()
                .map(guest -> {
                    requireText(guest.guestName(), "Additional guest name");
                    return BookingGuest.builder()
                            .guestName(guest.guestName())
                            .guestIdCard(guest.guestIdCard())
                            .guestContactNumber(guest.guestContactNumber())
                            .guestAge(guest.guestAge())
                            .relationshipToMainGuest(guest.relationshipToMainGuest())
                            .createdAt(createdAt)
                            .build();
                })
                .toList();
    }

    private Booking findBooking(UUID bookingId) {
        return bookingRepository.findWithGuestsById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }

    /**
     * Flushes immediately so constraint violations surface here and can be classified.
     */
    private Booking persist(Booking booking) {
        try {
            return bookingRepository.saveAndFlush(booking);
        } catch (DataIntegrityViolationException e) {
            if (isOverlapViolation(e)) {
                log.warn("Exclusion constraint rejected booking for property {}", booking.getPropertyId());
                throw new BookingOverlapException(booking.getPropertyId(), e);
            }
            throw new BookingStoreException("Failed to save booking: constraint violation", e);
        } catch (OptimisticLockingFailureException e) {
            // version conflicts are reported as-is
            throw e;
        } catch (DataAccessException e) {
            throw new BookingStoreException("Failed to save booking", e);
        }
    }

    private static boolean isOverlapViolation(DataIntegrityViolationException e) {
        String message = e.getMostSpecificCause().getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains(OVERLAP_CONSTRAINT);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new BookingValidationException(field + " is required");
        }
    }

    private static void validateGuestCount(Integer numberOfGuests) {
        if (numberOfGuests == null || numberOfGuests <= 0) {
            throw new BookingValidationException("Number of guests must be positive");
        }
    }

    private PropertyLockStrategy getLockStrategy() {
        String strategyKey = lockStrategyType.toLowerCase(Locale.ROOT);
        PropertyLockStrategy strategy = lockStrategies.get(strategyKey);
        if (strategy == null) {
            throw new IllegalStateException(String.format(
                    "Unknown lock strategy '%s'. Available strategies: %s", lockStrategyType, lockStrategies.keySet()));
        }
        return strategy;
    }
}
