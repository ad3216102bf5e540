package com.venuebooking.booking.service;

import com.venuebooking.booking.enums.WebhookOutcome;
import com.venuebooking.booking.model.WebhookLedgerEntry;
import com.venuebooking.booking.repository.WebhookLedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Record of processed payment event ids. An event id is written at most once;
 * a second insert for the same id fails on the primary key.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookLedger {

    private final WebhookLedgerRepository ledgerRepository;

    public Optional<WebhookLedgerEntry> find(String eventId) {
        return ledgerRepository.findById(eventId);
    }

    public WebhookLedgerEntry record(String eventId, String tenantId, String sessionReference,
                                     String bookingId, WebhookOutcome outcome) {
        WebhookLedgerEntry entry = ledgerRepository.saveAndFlush(WebhookLedgerEntry.builder()
                .eventId(eventId)
                .tenantId(tenantId)
                .sessionReference(sessionReference)
                .bookingId(bookingId)
                .outcome(outcome)
                .processedAt(LocalDateTime.now())
                .build());
        log.debug("Webhook recorded: eventId={}, outcome={}", eventId, outcome);
        return entry;
    }
}
