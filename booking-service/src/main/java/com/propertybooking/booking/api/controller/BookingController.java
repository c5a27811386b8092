package com.propertybooking.booking.api.controller;

import com.propertybooking.booking.api.dto.BookingHistoryResponse;
import com.propertybooking.booking.api.dto.BookingResponse;
import com.propertybooking.booking.api.dto.CreateBookingRequest;
import com.propertybooking.booking.api.dto.UpdateBookingRequest;
import com.propertybooking.booking.domain.service.BookingStore;
import com.propertybooking.common.dto.BaseResponse;
import com.propertybooking.common.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for booking commands and single-booking reads.
 * The optional X-User-Id header identifies the acting user for the audit trail.
 */
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingStore bookingStore;

    @PostMapping
    public ResponseEntity<BaseResponse<BookingResponse>> createBooking(
            @Valid @RequestBody CreateBookingRequest request,
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String actorId) {
        BookingResponse response = bookingStore.createBooking(request, actorId);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Booking created successfully", response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(@PathVariable UUID id) {
        return ResponseEntity.ok(BaseResponse.success(bookingStore.getBooking(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> updateBooking(
            @PathVariable UUID id,
            @Valid @RequestBody UpdateBookingRequest request,
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String actorId) {
        BookingResponse response = bookingStore.updateBooking(id, request, actorId);
        return ResponseEntity.ok(BaseResponse.success("Booking updated successfully", response));
    }

    @PutMapping("/{id}/cancel")
    public ResponseEntity<Void> cancelBooking(
            @PathVariable UUID id,
            @RequestHeader(value = Constants.USER_ID_HEADER, required = false) String actorId) {
        bookingStore.cancelBooking(id, actorId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/history")
    public ResponseEntity<BaseResponse<List<BookingHistoryResponse>>> getBookingHistory(@PathVariable UUID id) {
        return ResponseEntity.ok(BaseResponse.success(bookingStore.getBookingHistory(id)));
    }
}
