package com.venuebooking.booking.dto;

import com.venuebooking.booking.constants.ValidationMessages;
import jakarta.validation.constraints.NotBlank;
import lombok.*;
import lombok.experimental.FieldDefaults;

/**
 * Gateway-neutral webhook payload. Vendor payloads are normalized into this
 * shape before they reach the service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class PaymentWebhook {

    @NotBlank(message = ValidationMessages.EVENT_ID_REQUIRED)
    String eventId;

    @NotBlank(message = ValidationMessages.TENANT_ID_REQUIRED)
    String tenantId;

    @NotBlank(message = ValidationMessages.SESSION_REFERENCE_REQUIRED)
    String sessionReference;

    @NotBlank(message = ValidationMessages.PAYMENT_STATUS_REQUIRED)
    String paymentStatus;
}
