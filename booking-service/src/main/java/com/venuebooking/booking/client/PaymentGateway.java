package com.venuebooking.booking.client;

import com.venuebooking.booking.dto.CheckoutSession;
import com.venuebooking.booking.exception.PaymentGatewayException;

import java.util.Map;

/**
 * Hosted checkout provider.
 */
public interface PaymentGateway {

    /**
     * Creates a hosted checkout session for the given amount in minor currency units.
     *
     * @throws PaymentGatewayException when the session cannot be created
     */
    CheckoutSession createCheckoutSession(String tenantId, long amountCents, String successUrl,
                                          String cancelUrl, Map<String, String> metadata);
}
