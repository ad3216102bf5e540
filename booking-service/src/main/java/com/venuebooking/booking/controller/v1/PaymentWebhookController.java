package com.venuebooking.booking.controller.v1;

import com.venuebooking.booking.dto.PaymentWebhook;
import com.venuebooking.booking.dto.WebhookResult;
import com.venuebooking.booking.service.PaymentOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives normalized payment events. Every handled outcome answers 200,
 * conflicts and unknown sessions included; only storage failures answer 5xx
 * so the gateway redelivers.
 */
@RestController
@RequestMapping("/v1/webhooks")
@RequiredArgsConstructor
@Slf4j
public class PaymentWebhookController {

    private final PaymentOrchestrator paymentOrchestrator;

    @PostMapping("/payments")
    public ResponseEntity<WebhookResult> handlePayment(@Valid @RequestBody PaymentWebhook webhook) {
        log.info("POST /v1/webhooks/payments - eventId={}, tenantId={}, status={}",
                webhook.getEventId(), webhook.getTenantId(), webhook.getPaymentStatus());

        return ResponseEntity.ok(paymentOrchestrator.handlePaymentWebhook(webhook));
    }
}
