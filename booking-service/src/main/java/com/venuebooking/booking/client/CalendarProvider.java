package com.venuebooking.booking.client;

import com.venuebooking.booking.exception.CalendarProviderUnavailableException;

import java.time.LocalDate;
import java.util.Set;

/**
 * External calendar that reports dates a tenant is already busy.
 */
public interface CalendarProvider {

    /**
     * Returns busy dates within the inclusive range.
     *
     * @throws CalendarProviderUnavailableException when the provider fails or times out
     */
    Set<LocalDate> getBusyDates(String tenantId, LocalDate startDate, LocalDate endDate);
}
