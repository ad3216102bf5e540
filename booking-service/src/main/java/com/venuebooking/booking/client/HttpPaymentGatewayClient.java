package com.venuebooking.booking.client;

import com.venuebooking.booking.config.RestClientConfiguration;
import com.venuebooking.booking.dto.CheckoutSession;
import com.venuebooking.booking.dto.CheckoutSessionRequest;
import com.venuebooking.booking.exception.PaymentGatewayException;
import lombok.AccessLevel;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.Map;

/**
 * Client for the payment gateway's hosted checkout API.
 */
@Component
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE)
public class HttpPaymentGatewayClient implements PaymentGateway {

    final RestTemplate restTemplate;

    @Value("${payment-gateway.url}")
    String paymentGatewayUrl;

    @Value("${payment-gateway.api-key:}")
    String apiKey;

    public HttpPaymentGatewayClient(@Qualifier(RestClientConfiguration.PAYMENT_GATEWAY) RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public CheckoutSession createCheckoutSession(String tenantId, long amountCents, String successUrl,
                                                 String cancelUrl, Map<String, String> metadata) {
        log.info("Creating checkout session: tenantId={}, amountCents={}", tenantId, amountCents);

        CheckoutSessionRequest request = CheckoutSessionRequest.builder()
                .tenantId(tenantId)
                .amountCents(amountCents)
                .successUrl(successUrl)
                .cancelUrl(cancelUrl)
                .metadata(metadata)
                .build();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.hasText(apiKey)) {
            headers.setBearerAuth(apiKey);
        }

        String url = paymentGatewayUrl + "/v1/checkout-sessions";

        CheckoutSession session;
        try {
            session = restTemplate.postForObject(url, new HttpEntity<>(request, headers), CheckoutSession.class);
        } catch (ResourceAccessException e) {
            boolean timedOut = e.getCause() instanceof SocketTimeoutException;
            throw new PaymentGatewayException("Payment gateway unreachable: " + e.getMessage(), timedOut, e);
        } catch (RestClientException e) {
            throw new PaymentGatewayException("Payment gateway rejected checkout: " + e.getMessage(), false, e);
        }

        if (session == null || !StringUtils.hasText(session.getSessionId())
                || !StringUtils.hasText(session.getCheckoutUrl())) {
            throw new PaymentGatewayException("Payment gateway returned an incomplete session", false, null);
        }

        log.info("Checkout session created: tenantId={}, sessionId={}", tenantId, session.getSessionId());
        return session;
    }
}
