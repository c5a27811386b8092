package com.propertybooking.booking.api.controller;

import com.propertybooking.booking.api.dto.BookingResponse;
import com.propertybooking.booking.api.dto.CreateBookingRequest;
import com.propertybooking.booking.api.dto.UpdateBookingRequest;
import com.propertybooking.booking.domain.model.Booking;
import com.propertybooking.booking.domain.model.StayRange;
import com.propertybooking.booking.domain.service.BookingStore;
import com.propertybooking.booking.exception.BookingOverlapException;
import com.propertybooking.booking.exception.BookingStoreException;
import com.propertybooking.booking.exception.BookingValidationException;
import com.propertybooking.booking.exception.InvalidBookingStateException;
import com.propertybooking.common.exception.ResourceNotFoundException;
import com.propertybooking.common.exception.ServiceUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BookingController.class)
class BookingControllerTest {

    private static final UUID PROPERTY_ID = UUID.fromString("7f0c2d8e-4a55-4c1b-9f3e-1d2b3c4d5e6f");
    private static final UUID BOOKING_ID = UUID.fromString("a1b2c3d4-e5f6-4711-8899-aabbccddeeff");

    private static final String CREATE_BODY = """
            {
              "property_id": "7f0c2d8e-4a55-4c1b-9f3e-1d2b3c4d5e6f",
              "guest_name": "Jane Doe",
              "guest_id_card": "ID-12345",
              "guest_contact_number": "+1-555-0100",
              "guest_email": "jane@example.com",
              "check_in_date": "2024-01-15",
              "check_out_date": "2024-01-20",
              "number_of_guests": 2,
              "booking_amount": 750.00,
              "additional_guests": [
                {"guest_name": "John Doe", "guest_age": 34, "relationship_to_main_guest": "Spouse"}
              ]
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BookingStore bookingStore;

    private static BookingResponse bookingResponse() {
        return new BookingResponse(BOOKING_ID, PROPERTY_ID, "manager-42", "Jane Doe", "ID-12345", "+1-555-0100",
                "jane@example.com", LocalDate.of(2024, 1, 15), LocalDate.of(2024, 1, 20), 5, 2, null, null,
                Booking.BookingStatus.CONFIRMED, new BigDecimal("750.00"), Booking.PaymentStatus.PENDING, List.of(),
                LocalDateTime.of(2024, 1, 10, 8, 0), LocalDateTime.of(2024, 1, 10, 8, 0));
    }

    @Test
    void createBooking_returnsCreatedWithSnakeCaseBody() throws Exception {
        given(bookingStore.createBooking(any(CreateBookingRequest.class), eq("manager-42")))
                .willReturn(bookingResponse());

        mockMvc.perform(post("/api/v1/bookings")
                        .header("X-User-Id", "manager-42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.booking_id").value(BOOKING_ID.toString()))
                .andExpect(jsonPath("$.data.check_in_date").value("2024-01-15"))
                .andExpect(jsonPath("$.data.total_nights").value(5))
                .andExpect(jsonPath("$.data.booking_status").value("confirmed"))
                .andExpect(jsonPath("$.data.payment_status").value("pending"));
    }

    @Test
    void createBooking_withoutActorHeaderPassesNull() throws Exception {
        given(bookingStore.createBooking(any(CreateBookingRequest.class), isNull())).willReturn(bookingResponse());

        mockMvc.perform(post("/api/v1/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isCreated());

        verify(bookingStore).createBooking(any(CreateBookingRequest.class), isNull());
    }

    @Test
    void createBooking_missingFieldsIsValidationError() throws Exception {
        mockMvc.perform(post("/api/v1/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"property_id": "7f0c2d8e-4a55-4c1b-9f3e-1d2b3c4d5e6f", "number_of_guests": 0}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.data.guestName").exists())
                .andExpect(jsonPath("$.data.numberOfGuests").exists());

        verifyNoInteractions(bookingStore);
    }

    @Test
    void createBooking_malformedDateIsValidationError() throws Exception {
        mockMvc.perform(post("/api/v1/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY.replace("2024-01-15", "15/01/2024")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"));
    }

    @Test
    void createBooking_invalidRangeFromStore() throws Exception {
        given(bookingStore.createBooking(any(CreateBookingRequest.class), any()))
                .willThrow(new BookingValidationException("Check-out date 2024-01-15 must be after check-in date 2024-01-20"));

        mockMvc.perform(post("/api/v1/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"));
    }

    @Test
    void createBooking_overlapIsConflict() throws Exception {
        StayRange requested = new StayRange(LocalDate.of(2024, 1, 15), LocalDate.of(2024, 1, 20));
        given(bookingStore.createBooking(any(CreateBookingRequest.class), any()))
                .willThrow(new BookingOverlapException(PROPERTY_ID, requested, UUID.randomUUID()));

        mockMvc.perform(post("/api/v1/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("BOOKING_OVERLAP"));
    }

    @Test
    void createBooking_unknownPropertyIsNotFound() throws Exception {
        given(bookingStore.createBooking(any(CreateBookingRequest.class), any()))
                .willThrow(new ResourceNotFoundException("Property", PROPERTY_ID));

        mockMvc.perform(post("/api/v1/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("RESOURCE_NOT_FOUND"));
    }

    @Test
    void createBooking_lockTimeoutIsServiceUnavailable() throws Exception {
        given(bookingStore.createBooking(any(CreateBookingRequest.class), any()))
                .willThrow(new ServiceUnavailableException("Property is busy"));

        mockMvc.perform(post("/api/v1/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error_code").value("SERVICE_UNAVAILABLE"));
    }

    @Test
    void createBooking_storeFailureIsInternalError() throws Exception {
        given(bookingStore.createBooking(any(CreateBookingRequest.class), any()))
                .willThrow(new BookingStoreException("Failed to save booking", new RuntimeException("connection reset")));

        mockMvc.perform(post("/api/v1/bookings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CREATE_BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error_code").value("STORE_ERROR"));
    }

    @Test
    void getBooking_returnsBooking() throws Exception {
        given(bookingStore.getBooking(BOOKING_ID)).willReturn(bookingResponse());

        mockMvc.perform(get("/api/v1/bookings/{id}", BOOKING_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.guest_name").value("Jane Doe"))
                .andExpect(jsonPath("$.data.additional_guests").isArray());
    }

    @Test
    void getBooking_unknownIsNotFound() throws Exception {
        given(bookingStore.getBooking(BOOKING_ID)).willThrow(new ResourceNotFoundException("Booking", BOOKING_ID));

        mockMvc.perform(get("/api/v1/bookings/{id}", BOOKING_ID))
                .andExpect(status().isNotFound());
    }

    @Test
    void getBooking_malformedIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/bookings/not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_ERROR"));

        verifyNoInteractions(bookingStore);
    }

    @Test
    void updateBooking_passesOnlySuppliedFields() throws Exception {
        given(bookingStore.updateBooking(eq(BOOKING_ID), any(UpdateBookingRequest.class), eq("manager-42")))
                .willReturn(bookingResponse());

        mockMvc.perform(put("/api/v1/bookings/{id}", BOOKING_ID)
                        .header("X-User-Id", "manager-42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"booking_notes\": \"Needs a crib\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.booking_id").value(BOOKING_ID.toString()));

        verify(bookingStore).updateBooking(eq(BOOKING_ID),
                eq(new UpdateBookingRequest(null, null, null, null, null, null, null, null,
                        "Needs a crib", null, null, null, null, null)),
                eq("manager-42"));
    }

    @Test
    void updateBooking_unknownStatusValueIsBadRequest() throws Exception {
        mockMvc.perform(put("/api/v1/bookings/{id}", BOOKING_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"booking_status\": \"archived\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(bookingStore);
    }

    @Test
    void updateBooking_concurrentModificationIsConflict() throws Exception {
        given(bookingStore.updateBooking(eq(BOOKING_ID), any(UpdateBookingRequest.class), any()))
                .willThrow(new OptimisticLockingFailureException("stale version"));

        mockMvc.perform(put("/api/v1/bookings/{id}", BOOKING_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"number_of_guests\": 3}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("CONCURRENT_MODIFICATION"));
    }

    @Test
    void cancelBooking_returnsNoContent() throws Exception {
        mockMvc.perform(put("/api/v1/bookings/{id}/cancel", BOOKING_ID).header("X-User-Id", "manager-42"))
                .andExpect(status().isNoContent());

        verify(bookingStore).cancelBooking(BOOKING_ID, "manager-42");
    }

    @Test
    void cancelBooking_pastStayIsConflict() throws Exception {
        willThrow(new InvalidBookingStateException("check-in date has passed"))
                .given(bookingStore).cancelBooking(eq(BOOKING_ID), any());

        mockMvc.perform(put("/api/v1/bookings/{id}/cancel", BOOKING_ID))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("INVALID_BOOKING_STATE"));
    }

    @Test
    void getBookingHistory_returnsList() throws Exception {
        given(bookingStore.getBookingHistory(BOOKING_ID)).willReturn(List.of());

        mockMvc.perform(get("/api/v1/bookings/{id}/history", BOOKING_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isArray());
    }
}
