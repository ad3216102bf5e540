package com.venuebooking.booking.service;

import com.venuebooking.booking.constants.BookingConstants;
import com.venuebooking.booking.constants.ValidationMessages;
import com.venuebooking.booking.dto.PaymentWebhook;
import com.venuebooking.booking.dto.WebhookResult;
import com.venuebooking.booking.enums.BookingStatus;
import com.venuebooking.booking.enums.PaymentOutcome;
import com.venuebooking.booking.enums.WebhookOutcome;
import com.venuebooking.booking.event.BookingPaidEvent;
import com.venuebooking.booking.exception.BookingValidationException;
import com.venuebooking.booking.model.AddOn;
import com.venuebooking.booking.model.Booking;
import com.venuebooking.booking.model.CatalogPackage;
import com.venuebooking.booking.model.WebhookLedgerEntry;
import com.venuebooking.booking.repository.AddOnRepository;
import com.venuebooking.booking.repository.BookingRepository;
import com.venuebooking.booking.repository.CatalogPackageRepository;
import com.venuebooking.booking.util.TenantIds;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

/**
 * Reconciles payment webhooks into booking state, exactly once per event id.
 * <p>
 * Each delivery runs in one transaction that locks the booking row, re-checks
 * the ledger, applies the transition and writes the ledger entry. The unique
 * key on (tenant_id, confirmed_date) decides races between different bookings
 * for the same date: the losing transaction rolls back and is replayed, and the
 * replay sees the winner and cancels its own booking as a conflict. Lock
 * timeouts and deadlocks are replayed the same way.
 * BookingPaid is published only after the confirming transaction has committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentOrchestrator {

    private static final int MAX_RECONCILE_ATTEMPTS = 3;

    private final BookingRepository bookingRepository;
    private final CatalogPackageRepository packageRepository;
    private final AddOnRepository addOnRepository;
    private final WebhookLedger webhookLedger;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;

    public WebhookResult handlePaymentWebhook(PaymentWebhook webhook) {
        validateWebhook(webhook);
        PaymentOutcome paymentOutcome = PaymentOutcome.from(webhook.getPaymentStatus());

        log.info("Payment webhook: eventId={}, tenantId={}, session={}, status={}",
                webhook.getEventId(), webhook.getTenantId(), webhook.getSessionReference(), paymentOutcome);

        Optional<WebhookLedgerEntry> recorded = webhookLedger.find(webhook.getEventId());
        if (recorded.isPresent()) {
            return complete(webhook, Reconciliation.duplicate(recorded.get()));
        }

        Reconciliation reconciliation = reconcileWithRetry(webhook, paymentOutcome);

        if (reconciliation.paidEvent() != null) {
            eventPublisher.publishEvent(reconciliation.paidEvent());
        }
        return complete(webhook, reconciliation);
    }

    // ============ Private Methods ============

    private Reconciliation reconcileWithRetry(PaymentWebhook webhook, PaymentOutcome paymentOutcome) {
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> reconcile(webhook, paymentOutcome));
            } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
                // Lock timeouts and deadlocks among racing deliveries are replayed like constraint violations.
                if (attempt >= MAX_RECONCILE_ATTEMPTS) {
                    log.error("Webhook reconciliation kept failing: eventId={}, attempts={}, error={}",
                            webhook.getEventId(), attempt, e.getClass().getSimpleName());
                    throw e;
                }
                log.warn("Webhook reconciliation lost a race, replaying: eventId={}, attempt={}, error={}",
                        webhook.getEventId(), attempt, e.getMostSpecificCause().getMessage());
            }
        }
    }

    private Reconciliation reconcile(PaymentWebhook webhook, PaymentOutcome paymentOutcome) {
        String tenantId = webhook.getTenantId();
        String sessionReference = webhook.getSessionReference();

        Optional<Booking> locked = bookingRepository.lockByTenantIdAndSessionReference(tenantId, sessionReference);

        // Re-checked under the row lock: a concurrent delivery of this event may have committed meanwhile.
        Optional<WebhookLedgerEntry> recorded = webhookLedger.find(webhook.getEventId());
        if (recorded.isPresent()) {
            return Reconciliation.duplicate(recorded.get());
        }

        if (locked.isEmpty()) {
            log.warn("Webhook for unknown session: eventId={}, tenantId={}, session={}",
                    webhook.getEventId(), tenantId, sessionReference);
            return record(webhook, null, WebhookOutcome.UNKNOWN_SESSION);
        }

        Booking booking = locked.get();

        if (!booking.isPendingPayment()) {
            if (paymentOutcome == PaymentOutcome.SUCCEEDED && booking.getStatus() == BookingStatus.CANCELLED) {
                log.error("Payment succeeded for cancelled booking, manual refund required: bookingId={}, reason={}",
                        booking.getBookingId(), booking.getCancellationReason());
            } else {
                log.info("Ignoring webhook for settled booking: bookingId={}, status={}",
                        booking.getBookingId(), booking.getStatus());
            }
            return record(webhook, booking.getBookingId(), WebhookOutcome.IGNORED);
        }

        if (paymentOutcome != PaymentOutcome.SUCCEEDED) {
            booking.cancel(BookingConstants.CANCEL_REASON_PAYMENT_FAILED);
            bookingRepository.save(booking);
            log.info("Booking cancelled: bookingId={}, reason={}", booking.getBookingId(), paymentOutcome);
            return record(webhook, booking.getBookingId(), WebhookOutcome.PAYMENT_FAILED);
        }

        if (bookingRepository.existsByTenantIdAndConfirmedDate(tenantId, booking.getEventDate())) {
            booking.cancel(BookingConstants.CANCEL_REASON_DATE_TAKEN);
            bookingRepository.save(booking);
            meterRegistry.counter("booking.webhook.conflict").increment();
            log.error("Paid booking conflicts with confirmed booking, manual refund required: " +
                            "bookingId={}, tenantId={}, eventDate={}",
                    booking.getBookingId(), tenantId, booking.getEventDate());
            return record(webhook, booking.getBookingId(), WebhookOutcome.CONFLICT);
        }

        booking.confirm();
        bookingRepository.saveAndFlush(booking);
        Reconciliation confirmed = record(webhook, booking.getBookingId(), WebhookOutcome.CONFIRMED);
        log.info("Booking confirmed: bookingId={}, tenantId={}, eventDate={}",
                booking.getBookingId(), tenantId, booking.getEventDate());

        return new Reconciliation(confirmed.outcome(), confirmed.bookingId(), buildPaidEvent(booking));
    }

    private Reconciliation record(PaymentWebhook webhook, String bookingId, WebhookOutcome outcome) {
        webhookLedger.record(webhook.getEventId(), webhook.getTenantId(), webhook.getSessionReference(),
                bookingId, outcome);
        return new Reconciliation(outcome, bookingId, null);
    }

    private BookingPaidEvent buildPaidEvent(Booking booking) {
        String packageTitle = packageRepository.findById(booking.getPackageId())
                .map(CatalogPackage::getTitle)
                .orElse(booking.getPackageId());
        List<String> addOnTitles = booking.getAddOnIds().isEmpty()
                ? List.of()
                : addOnRepository.findAllById(booking.getAddOnIds()).stream().map(AddOn::getTitle).toList();

        return BookingPaidEvent.builder()
                .source(this)
                .bookingId(booking.getBookingId())
                .tenantId(booking.getTenantId())
                .email(booking.getEmail())
                .customerName(booking.getCustomerName())
                .eventDate(booking.getEventDate())
                .packageTitle(packageTitle)
                .addOnTitles(addOnTitles)
                .totalCents(booking.getTotalCents())
                .build();
    }

    private WebhookResult complete(PaymentWebhook webhook, Reconciliation reconciliation) {
        meterRegistry.counter("booking.webhook.total", "outcome", reconciliation.outcome().name()).increment();
        if (reconciliation.outcome() == WebhookOutcome.DUPLICATE) {
            log.info("Duplicate webhook ignored: eventId={}", webhook.getEventId());
        }
        return WebhookResult.builder()
                .eventId(webhook.getEventId())
                .outcome(reconciliation.outcome())
                .bookingId(reconciliation.bookingId())
                .build();
    }

    private void validateWebhook(PaymentWebhook webhook) {
        if (webhook == null) {
            throw new BookingValidationException("INVALID_REQUEST", "Webhook payload is required");
        }
        if (!StringUtils.hasText(webhook.getEventId())) {
            throw new BookingValidationException("INVALID_EVENT_ID", ValidationMessages.EVENT_ID_REQUIRED);
        }
        TenantIds.requireValid(webhook.getTenantId());
        if (!StringUtils.hasText(webhook.getSessionReference())) {
            throw new BookingValidationException("INVALID_SESSION_REFERENCE",
                    ValidationMessages.SESSION_REFERENCE_REQUIRED);
        }
    }

    private record Reconciliation(WebhookOutcome outcome, String bookingId, BookingPaidEvent paidEvent) {

        static Reconciliation duplicate(WebhookLedgerEntry entry) {
            return new Reconciliation(WebhookOutcome.DUPLICATE, entry.getBookingId(), null);
        }
    }
}
