package com.venuebooking.booking.controller.v1;

import com.venuebooking.booking.dto.AvailabilityEntry;
import com.venuebooking.booking.dto.UnavailableDatesEntry;
import com.venuebooking.booking.service.AvailabilityService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.ArrayList;

@RestController
@RequestMapping("/v1/tenants/{tenantId}/availability")
@RequiredArgsConstructor
@Slf4j
public class AvailabilityController {

    private final AvailabilityService availabilityService;

    @GetMapping
    public ResponseEntity<AvailabilityEntry> getAvailability(
            @PathVariable String tenantId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        log.debug("GET /v1/tenants/{}/availability?date={}", tenantId, date);
        return ResponseEntity.ok(availabilityService.getAvailability(tenantId, date));
    }

    @GetMapping("/unavailable-dates")
    public ResponseEntity<UnavailableDatesEntry> getUnavailableDates(
            @PathVariable String tenantId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.debug("GET /v1/tenants/{}/availability/unavailable-dates?startDate={}&endDate={}",
                tenantId, startDate, endDate);

        UnavailableDatesEntry entry = UnavailableDatesEntry.builder()
                .startDate(startDate)
                .endDate(endDate.isBefore(startDate) ? endDate : availabilityService.clampEnd(startDate, endDate))
                .unavailableDates(new ArrayList<>(availabilityService.getUnavailableDates(tenantId, startDate, endDate)))
                .build();
        return ResponseEntity.ok(entry);
    }
}
