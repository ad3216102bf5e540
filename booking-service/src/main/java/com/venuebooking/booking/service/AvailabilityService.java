package com.venuebooking.booking.service;

import com.venuebooking.booking.client.CalendarProvider;
import com.venuebooking.booking.constants.BookingConstants;
import com.venuebooking.booking.constants.ValidationMessages;
import com.venuebooking.booking.dto.AvailabilityEntry;
import com.venuebooking.booking.enums.UnavailableReason;
import com.venuebooking.booking.exception.BookingValidationException;
import com.venuebooking.booking.exception.CalendarProviderUnavailableException;
import com.venuebooking.booking.model.Blackout;
import com.venuebooking.booking.repository.BlackoutRepository;
import com.venuebooking.booking.repository.BookingRepository;
import com.venuebooking.booking.util.TenantIds;
import com.venuebooking.booking.util.TenantZoneResolver;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether calendar dates are bookable for a tenant.
 * <p>
 * A date is unavailable when it is in the past, blacked out, busy in the
 * tenant's external calendar, or already held by a CONFIRMED booking. Pending
 * bookings never block a date. The external calendar is best effort: when it
 * fails or exceeds its time budget it contributes nothing.
 */
@Service
@Slf4j
public class AvailabilityService {

    private final BlackoutRepository blackoutRepository;
    private final BookingRepository bookingRepository;
    private final CalendarProvider calendarProvider;
    private final ExecutorService calendarExecutor;
    private final Clock clock;
    private final TenantZoneResolver tenantZoneResolver;
    private final MeterRegistry meterRegistry;

    private final int maxRangeDays;
    private final long calendarTimeoutMs;

    public AvailabilityService(
            BlackoutRepository blackoutRepository,
            BookingRepository bookingRepository,
            CalendarProvider calendarProvider,
            @Qualifier("calendarExecutor") ExecutorService calendarExecutor,
            Clock clock,
            TenantZoneResolver tenantZoneResolver,
            MeterRegistry meterRegistry,
            @Value("${booking.availability.max-range-days:" + BookingConstants.DEFAULT_MAX_RANGE_DAYS + "}") int maxRangeDays,
            @Value("${booking.calendar.timeout-ms:" + BookingConstants.DEFAULT_CALENDAR_TIMEOUT_MS + "}") long calendarTimeoutMs) {
        this.blackoutRepository = blackoutRepository;
        this.bookingRepository = bookingRepository;
        this.calendarProvider = calendarProvider;
        this.calendarExecutor = calendarExecutor;
        this.clock = clock;
        this.tenantZoneResolver = tenantZoneResolver;
        this.meterRegistry = meterRegistry;
        this.maxRangeDays = maxRangeDays;
        this.calendarTimeoutMs = calendarTimeoutMs;
    }

    public AvailabilityEntry getAvailability(String tenantId, LocalDate date) {
        TenantIds.requireValid(tenantId);
        if (date == null) {
            throw new BookingValidationException("INVALID_DATE", ValidationMessages.DATE_REQUIRED);
        }

        Set<UnavailableReason> reasons = EnumSet.noneOf(UnavailableReason.class);
        if (date.isBefore(today(tenantId))) {
            reasons.add(UnavailableReason.PAST);
        }
        if (blackoutRepository.existsByTenantIdAndDate(tenantId, date)) {
            reasons.add(UnavailableReason.BLACKOUT);
        }
        if (bookingRepository.existsByTenantIdAndConfirmedDate(tenantId, date)) {
            reasons.add(UnavailableReason.BOOKED);
        }
        if (fetchBusyDates(tenantId, date, date).contains(date)) {
            reasons.add(UnavailableReason.CALENDAR);
        }

        log.debug("Availability checked: tenantId={}, date={}, reasons={}", tenantId, date, reasons);
        return AvailabilityEntry.builder()
                .date(date)
                .available(reasons.isEmpty())
                .reasons(reasons)
                .build();
    }

    /**
     * Returns every unavailable date in the inclusive range, sorted ascending.
     * The range end is clamped to the configured maximum span after start.
     */
    public Set<LocalDate> getUnavailableDates(String tenantId, LocalDate startDate, LocalDate endDate) {
        TenantIds.requireValid(tenantId);
        if (startDate == null || endDate == null) {
            throw new BookingValidationException("INVALID_DATE_RANGE", ValidationMessages.DATE_REQUIRED);
        }
        if (endDate.isBefore(startDate)) {
            throw new BookingValidationException("INVALID_DATE_RANGE", ValidationMessages.DATE_RANGE_INVALID);
        }

        LocalDate end = clampEnd(startDate, endDate);
        Set<LocalDate> unavailable = new TreeSet<>();

        LocalDate today = today(tenantId);
        for (LocalDate day = startDate; !day.isAfter(end) && day.isBefore(today); day = day.plusDays(1)) {
            unavailable.add(day);
        }

        blackoutRepository.findByTenantIdAndDateBetween(tenantId, startDate, end).stream()
                .map(Blackout::getDate)
                .forEach(unavailable::add);

        unavailable.addAll(bookingRepository.findConfirmedDates(tenantId, startDate, end));

        fetchBusyDates(tenantId, startDate, end).stream()
                .filter(day -> !day.isBefore(startDate) && !day.isAfter(end))
                .forEach(unavailable::add);

        log.debug("Unavailable dates: tenantId={}, start={}, end={}, count={}",
                tenantId, startDate, end, unavailable.size());
        return unavailable;
    }

    public LocalDate clampEnd(LocalDate startDate, LocalDate endDate) {
        LocalDate maxEnd = startDate.plusDays(maxRangeDays);
        return endDate.isAfter(maxEnd) ? maxEnd : endDate;
    }

    /**
     * Today in the tenant's zone.
     */
    public LocalDate today(String tenantId) {
        return tenantZoneResolver.today(tenantId, clock);
    }

    // ============ Private Methods ============

    private Set<LocalDate> fetchBusyDates(String tenantId, LocalDate startDate, LocalDate endDate) {
        Future<Set<LocalDate>> future = null;
        try {
            future = calendarExecutor.submit(() -> calendarProvider.getBusyDates(tenantId, startDate, endDate));
            Set<LocalDate> busyDates = future.get(calendarTimeoutMs, TimeUnit.MILLISECONDS);
            return busyDates != null ? busyDates : Set.of();
        } catch (TimeoutException e) {
            future.cancel(true);
            return degraded(tenantId, "timeout", "no answer within " + calendarTimeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            boolean timedOut = cause instanceof CalendarProviderUnavailableException unavailable
                    && unavailable.isTimedOut();
            return degraded(tenantId, timedOut ? "timeout" : "failure", String.valueOf(cause));
        } catch (RejectedExecutionException e) {
            return degraded(tenantId, "failure", "calendar executor rejected the call");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            return degraded(tenantId, "failure", "interrupted");
        }
    }

    private Set<LocalDate> degraded(String tenantId, String cause, String detail) {
        meterRegistry.counter("availability.calendar.degraded", "cause", cause).increment();
        log.warn("Calendar provider degraded, ignoring external calendar: tenantId={}, cause={}, detail={}",
                tenantId, cause, detail);
        return Set.of();
    }
}
