package com.propertybooking.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A bookable unit. Bookings reference it by id only; deleting a property cascades to its
 * bookings at the database level.
 */
@Entity
@Table(name = "properties")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Property {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "property_id")
    private UUID id;

    @Column(name = "property_name", nullable = false, length = 100)
    private String propertyName;

    @Column(name = "property_address", columnDefinition = "TEXT")
    private String propertyAddress;

    @Column(name = "property_type", length = 50)
    private String propertyType;

    @Column(name = "max_guests", nullable = false)
    private Integer maxGuests;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (maxGuests == null) {
            maxGuests = 1;
        }
    }
}
