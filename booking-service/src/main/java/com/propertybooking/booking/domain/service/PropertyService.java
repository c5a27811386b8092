package com.propertybooking.booking.domain.service;

import com.propertybooking.booking.api.dto.PropertyRequest;
import com.propertybooking.booking.api.dto.PropertyResponse;
import com.propertybooking.booking.domain.model.Property;
import com.propertybooking.booking.domain.repository.PropertyRepository;
import com.propertybooking.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PropertyService {

    private final PropertyRepository propertyRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<PropertyResponse> getAllProperties() {
        return propertyRepository.findAllByOrderByPropertyNameAsc().stream()
                .map(PropertyResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public PropertyResponse getProperty(UUID propertyId) {
        return propertyRepository.findById(propertyId)
                .map(PropertyResponse::from)
                .orElseThrow(() -> new ResourceNotFoundException("Property", propertyId));
    }

    @Transactional
    public PropertyResponse createProperty(PropertyRequest request) {
        LocalDateTime now = LocalDateTime.now(clock);
        Property property = Property.builder()
                .propertyName(request.propertyName())
                .propertyAddress(request.propertyAddress())
                .propertyType(request.propertyType())
                .maxGuests(request.maxGuests())
                .description(request.description())
                .createdAt(now)
                .updatedAt(now)
                .build();
        property = propertyRepository.save(property);
        log.info("Created property {} ({})", property.getId(), property.getPropertyName());
        return PropertyResponse.from(property);
    }

    /**
     * Deletes the property; its bookings, guests and history go with it (ON DELETE CASCADE).
     */
    @Transactional
    public void deleteProperty(UUID propertyId) {
        Property property = propertyRepository.findById(propertyId)
                .orElseThrow(() -> new ResourceNotFoundException("Property", propertyId));
        propertyRepository.delete(property);
        log.info("Deleted property {} and its bookings", propertyId);
    }
}
