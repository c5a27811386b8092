package com.propertybooking.booking.api.exception;

import com.propertybooking.booking.exception.BookingStoreException;
import com.propertybooking.common.dto.BaseResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Persistence failures raised by the booking store. Runs ahead of the global handler so these
 * are not reported as generic internal errors.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
public class BookingExceptionHandler {

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<BaseResponse<?>> handleConcurrentModification(OptimisticLockingFailureException ex) {
        log.warn("Concurrent modification detected: {}", ex.getMessage());
        BaseResponse<?> response = BaseResponse.error(
                "The booking was modified by another request. Reload and try again.", "CONCURRENT_MODIFICATION");
        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @ExceptionHandler(BookingStoreException.class)
    public ResponseEntity<BaseResponse<?>> handleStoreFailure(BookingStoreException ex) {
        log.error("Booking store failure: {}", ex.getMessage(), ex);
        BaseResponse<?> response = BaseResponse.error(ex.getMessage(), ex.getErrorCode());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<BaseResponse<?>> handleDataAccess(DataAccessException ex) {
        log.error("Database access failed", ex);
        BaseResponse<?> response = BaseResponse.error("Booking store is unavailable", "STORE_ERROR");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}
