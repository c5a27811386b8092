package com.propertybooking.booking.job;

import com.propertybooking.booking.domain.service.BookingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Moves confirmed bookings to completed once their checkout date has passed.
 * Off unless booking.completion.enabled=true.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingCompletionJob {

    private final BookingStore bookingStore;

    @Value("${booking.completion.enabled:false}")
    private boolean completionEnabled;

    @Scheduled(cron = "${booking.completion.cron:0 0 3 * * *}")
    public void completeFinishedStays() {
        if (!completionEnabled) return;
        try {
            int completed = bookingStore.completeFinishedStays();
            log.debug("Stay completion sweep finished, {} booking(s) completed", completed);
        } catch (Exception e) {
            log.error("Stay completion sweep failed", e);
        }
    }
}
