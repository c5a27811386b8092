package com.propertybooking.booking.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * A reservation of one property for a half-open range of nights.
 * Total nights are derived from the dates and never stored.
 */
@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_bookings_property_id", columnList = "property_id"),
        @Index(name = "idx_bookings_dates", columnList = "check_in_date, check_out_date"),
        @Index(name = "idx_bookings_status", columnList = "booking_status"),
        @Index(name = "idx_bookings_guest_name", columnList = "guest_name")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Booking {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "booking_id")
    private UUID id;

    @Column(name = "property_id", nullable = false)
    private UUID propertyId;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "guest_name", nullable = false, length = 100)
    private String guestName;

    @Column(name = "guest_id_card", nullable = false, length = 50)
    private String guestIdCard;

    @Column(name = "guest_contact_number", nullable = false, length = 20)
    private String guestContactNumber;

    @Column(name = "guest_email", length = 100)
    private String guestEmail;

    @Column(name = "check_in_date", nullable = false)
    private LocalDate checkInDate;

    @Column(name = "check_out_date", nullable = false)
    private LocalDate checkOutDate;

    @Column(name = "number_of_guests", nullable = false)
    private Integer numberOfGuests;

    @Column(name = "booking_notes", columnDefinition = "TEXT")
    private String bookingNotes;

    @Column(name = "special_requests", columnDefinition = "TEXT")
    private String specialRequests;

    @Enumerated(EnumType.STRING)
    @Column(name = "booking_status", nullable = false, length = 20)
    private BookingStatus bookingStatus;

    @Column(name = "booking_amount", precision = 10, scale = 2)
    private BigDecimal bookingAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    @OneToMany(mappedBy = "booking", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("createdAt ASC")
    @Builder.Default
    private List<BookingGuest> additionalGuests = new ArrayList<>();

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Timestamps are set by the booking store from its clock; this only fills rows inserted
     * without one.
     */
    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (bookingStatus == null) {
            bookingStatus = BookingStatus.CONFIRMED;
        }
        if (paymentStatus == null) {
            paymentStatus = PaymentStatus.PENDING;
        }
    }

    public StayRange getStayRange() {
        return new StayRange(checkInDate, checkOutDate);
    }

    public long getTotalNights() {
        return getStayRange().nights();
    }

    public boolean isActive() {
        return bookingStatus != null && bookingStatus.isActive();
    }

    public void addGuest(BookingGuest guest) {
        guest.setBooking(this);
        additionalGuests.add(guest);
    }

    /**
     * Replaces the guest list in place so orphan removal deletes the dropped rows.
     */
    public void replaceGuests(Collection<BookingGuest> guests) {
        additionalGuests.clear();
        guests.forEach(this::addGuest);
    }

    public enum BookingStatus {
        PENDING,
        CONFIRMED,
        CANCELLED,
        COMPLETED;

        public static final Set<BookingStatus> ACTIVE = EnumSet.of(PENDING, CONFIRMED);

        public boolean isActive() {
            return this == PENDING || this == CONFIRMED;
        }

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static BookingStatus fromValue(String value) {
            return BookingStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum PaymentStatus {
        PENDING,
        PAID,
        PARTIAL,
        REFUNDED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static PaymentStatus fromValue(String value) {
            return PaymentStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
