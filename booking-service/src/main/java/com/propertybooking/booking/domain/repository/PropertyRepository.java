package com.propertybooking.booking.domain.repository;

import com.propertybooking.booking.domain.model.Property;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PropertyRepository extends JpaRepository<Property, UUID> {

    /**
     * Locks the property row (SELECT FOR UPDATE) until the surrounding transaction ends.
     * Every booking write for the property serializes on this row.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Property p WHERE p.id = :id")
    Optional<Property> findByIdForUpdate(@Param("id") UUID id);

    List<Property> findAllByOrderByPropertyNameAsc();
}
