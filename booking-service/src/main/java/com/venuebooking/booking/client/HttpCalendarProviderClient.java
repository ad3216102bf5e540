package com.venuebooking.booking.client;

import com.venuebooking.booking.config.RestClientConfiguration;
import com.venuebooking.booking.dto.BusyDatesResponse;
import com.venuebooking.booking.exception.CalendarProviderUnavailableException;
import lombok.AccessLevel;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.SocketTimeoutException;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.Set;

/**
 * Client for the tenant's external calendar busy-dates endpoint.
 * With no base URL configured the tenant has no external calendar.
 */
@Component
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE)
public class HttpCalendarProviderClient implements CalendarProvider {

    final RestTemplate restTemplate;

    @Value("${calendar-provider.url:}")
    String calendarProviderUrl;

    public HttpCalendarProviderClient(@Qualifier(RestClientConfiguration.CALENDAR_PROVIDER) RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public Set<LocalDate> getBusyDates(String tenantId, LocalDate startDate, LocalDate endDate) {
        if (!StringUtils.hasText(calendarProviderUrl)) {
            return Set.of();
        }

        String url = UriComponentsBuilder.fromHttpUrl(calendarProviderUrl)
                .path("/v1/tenants/{tenantId}/busy-dates")
                .queryParam("startDate", startDate)
                .queryParam("endDate", endDate)
                .buildAndExpand(tenantId)
                .toUriString();

        try {
            BusyDatesResponse response = restTemplate.getForObject(url, BusyDatesResponse.class);
            if (response == null || response.getBusyDates() == null) {
                return Set.of();
            }
            Set<LocalDate> busyDates = new HashSet<>(response.getBusyDates());
            log.debug("Calendar busy dates: tenantId={}, count={}", tenantId, busyDates.size());
            return busyDates;
        } catch (ResourceAccessException e) {
            boolean timedOut = e.getCause() instanceof SocketTimeoutException;
            throw new CalendarProviderUnavailableException(
                    "Calendar provider unreachable for tenant " + tenantId, timedOut, e);
        } catch (RestClientException e) {
            throw new CalendarProviderUnavailableException(
                    "Calendar provider failed for tenant " + tenantId, false, e);
        }
    }
}
