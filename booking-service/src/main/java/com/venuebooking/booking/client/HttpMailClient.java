package com.venuebooking.booking.client;

import com.venuebooking.booking.config.RestClientConfiguration;
import com.venuebooking.booking.dto.BookingConfirmationDetails;
import com.venuebooking.booking.dto.MailMessage;
import com.venuebooking.booking.exception.BookingException;
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
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Sends transactional mail through an HTTP mail API.
 * Without a configured URL the message is only logged.
 */
@Component
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE)
public class HttpMailClient implements MailAdapter {

    final RestTemplate restTemplate;

    @Value("${mail.url:}")
    String mailUrl;

    @Value("${mail.api-key:}")
    String apiKey;

    @Value("${mail.from:bookings@localhost}")
    String from;

    public HttpMailClient(@Qualifier(RestClientConfiguration.MAIL) RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public void sendBookingConfirmation(String email, BookingConfirmationDetails details) {
        MailMessage message = MailMessage.builder()
                .from(from)
                .to(email)
                .subject("Booking confirmed for " + details.getEventDate())
                .text(renderText(details))
                .build();

        if (!StringUtils.hasText(mailUrl)) {
            log.info("Mail delivery disabled, confirmation not sent: bookingId={}, to={}",
                    details.getBookingId(), email);
            return;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.hasText(apiKey)) {
            headers.setBearerAuth(apiKey);
        }

        try {
            restTemplate.postForEntity(mailUrl, new HttpEntity<>(message, headers), String.class);
        } catch (RestClientException e) {
            throw new BookingException("MAIL_DELIVERY_FAILED",
                    "Failed to send confirmation for booking " + details.getBookingId(), true, e);
        }
    }

    private String renderText(BookingConfirmationDetails details) {
        StringBuilder text = new StringBuilder()
                .append("Hi ").append(details.getCustomerName()).append(",\n\n")
                .append("Your booking ").append(details.getBookingId())
                .append(" for ").append(details.getEventDate()).append(" is confirmed.\n")
                .append("Package: ").append(details.getPackageTitle()).append('\n');
        if (details.getAddOnTitles() != null && !details.getAddOnTitles().isEmpty()) {
            text.append("Add-ons: ").append(String.join(", ", details.getAddOnTitles())).append('\n');
        }
        text.append("Total paid: ").append(formatCents(details.getTotalCents())).append('\n');
        return text.toString();
    }

    private String formatCents(Long cents) {
        long value = cents == null ? 0L : cents;
        return String.format("%d.%02d", value / 100, value % 100);
    }
}
