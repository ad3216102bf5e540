package com.venuebooking.booking.service;

import com.venuebooking.booking.constants.BookingConstants;
import com.venuebooking.booking.enums.BookingStatus;
import com.venuebooking.booking.model.Booking;
import com.venuebooking.booking.repository.BookingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Cancels bookings whose checkout was abandoned. Pending bookings never block
 * a date, so this only keeps the booking list tidy.
 */
@Service
@Slf4j
public class BookingExpiryService {

    private final BookingRepository bookingRepository;
    private final TransactionTemplate transactionTemplate;

    private final int pendingExpiryMinutes;

    public BookingExpiryService(
            BookingRepository bookingRepository,
            TransactionTemplate transactionTemplate,
            @Value("${booking.pending-expiry-minutes:" + BookingConstants.DEFAULT_PENDING_EXPIRY_MINUTES + "}") int pendingExpiryMinutes) {
        this.bookingRepository = bookingRepository;
        this.transactionTemplate = transactionTemplate;
        this.pendingExpiryMinutes = pendingExpiryMinutes;
    }

    @Scheduled(fixedDelay = BookingConstants.BOOKING_EXPIRY_CHECK_INTERVAL_MS)
    public int processExpiredBookings() {
        LocalDateTime cutoff = LocalDateTime.now().minus(pendingExpiryMinutes, ChronoUnit.MINUTES);

        List<Booking> expiredBookings = bookingRepository
                .findByStatusAndCreatedAtBefore(BookingStatus.PENDING_PAYMENT, cutoff);

        if (expiredBookings.isEmpty()) {
            return 0;
        }

        log.info("Processing {} expired bookings", expiredBookings.size());
        int expired = 0;
        for (Booking booking : expiredBookings) {
            if (expireBooking(booking.getBookingId())) {
                expired++;
            }
        }
        return expired;
    }

    private boolean expireBooking(String bookingId) {
        try {
            Boolean expired = transactionTemplate.execute(status -> bookingRepository.lockByBookingId(bookingId)
                    .filter(Booking::isPendingPayment)
                    .map(booking -> {
                        booking.cancel(BookingConstants.CANCEL_REASON_EXPIRED);
                        bookingRepository.save(booking);
                        return true;
                    })
                    .orElse(false));

            if (Boolean.TRUE.equals(expired)) {
                log.info("Expired booking cancelled: bookingId={}", bookingId);
            }
            return Boolean.TRUE.equals(expired);
        } catch (Exception e) {
            log.error("Error expiring booking {}: {}", bookingId, e.getMessage());
            return false;
        }
    }
}
