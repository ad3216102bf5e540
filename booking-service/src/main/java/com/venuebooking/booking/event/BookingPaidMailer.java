package com.venuebooking.booking.event;

import com.venuebooking.booking.client.MailAdapter;
import com.venuebooking.booking.dto.BookingConfirmationDetails;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Sends the confirmation mail for every paid booking.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BookingPaidMailer {

    private final MailAdapter mailAdapter;

    @EventListener
    public void onBookingPaid(BookingPaidEvent event) {
        BookingConfirmationDetails details = BookingConfirmationDetails.builder()
                .bookingId(event.getBookingId())
                .tenantId(event.getTenantId())
                .customerName(event.getCustomerName())
                .eventDate(event.getEventDate())
                .packageTitle(event.getPackageTitle())
                .addOnTitles(event.getAddOnTitles())
                .totalCents(event.getTotalCents())
                .build();

        mailAdapter.sendBookingConfirmation(event.getEmail(), details);
        log.info("Booking confirmation dispatched: bookingId={}", event.getBookingId());
    }
}
