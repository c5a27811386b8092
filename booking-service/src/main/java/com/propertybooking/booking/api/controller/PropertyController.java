package com.propertybooking.booking.api.controller;

import com.propertybooking.booking.api.dto.BookingResponse;
import com.propertybooking.booking.api.dto.MonthCalendar;
import com.propertybooking.booking.api.dto.PropertyRequest;
import com.propertybooking.booking.api.dto.PropertyResponse;
import com.propertybooking.booking.domain.service.BookingQueryService;
import com.propertybooking.booking.domain.service.PropertyService;
import com.propertybooking.common.dto.BaseResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for properties and the per-property booking views.
 */
@RestController
@RequestMapping("/api/v1/properties")
@RequiredArgsConstructor
public class PropertyController {

    private final PropertyService propertyService;
    private final BookingQueryService bookingQueryService;

    @GetMapping
    public ResponseEntity<BaseResponse<List<PropertyResponse>>> getAllProperties() {
        return ResponseEntity.ok(BaseResponse.success(propertyService.getAllProperties()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<PropertyResponse>> getProperty(@PathVariable UUID id) {
        return ResponseEntity.ok(BaseResponse.success(propertyService.getProperty(id)));
    }

    @PostMapping
    public ResponseEntity<BaseResponse<PropertyResponse>> createProperty(@Valid @RequestBody PropertyRequest request) {
        PropertyResponse response = propertyService.createProperty(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Property created successfully", response));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteProperty(@PathVariable UUID id) {
        propertyService.deleteProperty(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/calendar/{year}/{month}")
    public ResponseEntity<BaseResponse<MonthCalendar>> getMonthCalendar(
            @PathVariable UUID id,
            @PathVariable int year,
            @PathVariable int month) {
        return ResponseEntity.ok(BaseResponse.success(bookingQueryService.getMonthCalendar(id, year, month)));
    }

    @GetMapping("/{id}/bookings/upcoming")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getUpcomingBookings(
            @PathVariable UUID id,
            @RequestParam(name = "up_to_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate upToDate) {
        return ResponseEntity.ok(BaseResponse.success(bookingQueryService.getUpcomingBookings(id, upToDate)));
    }

    @GetMapping("/{id}/bookings/previous")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getPreviousBookings(
            @PathVariable UUID id,
            @RequestParam(name = "back_to_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate backToDate) {
        return ResponseEntity.ok(BaseResponse.success(bookingQueryService.getPreviousBookings(id, backToDate)));
    }

    @GetMapping("/{id}/bookings/search")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> searchBookings(
            @PathVariable UUID id,
            @RequestParam(name = "guest_name") String guestName) {
        return ResponseEntity.ok(BaseResponse.success(bookingQueryService.searchByGuestName(id, guestName)));
    }
}
