package com.venuebooking.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class CheckoutSessionRequest {

    String tenantId;
    Long amountCents;
    String successUrl;
    String cancelUrl;
    Map<String, String> metadata;
}
