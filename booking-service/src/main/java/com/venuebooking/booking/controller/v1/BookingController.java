package com.venuebooking.booking.controller.v1;

import com.venuebooking.booking.dto.BookingEntry;
import com.venuebooking.booking.dto.CheckoutEntry;
import com.venuebooking.booking.dto.CheckoutRequest;
import com.venuebooking.booking.service.BookingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/tenants/{tenantId}/bookings")
@RequiredArgsConstructor
@Slf4j
public class BookingController {

    private final BookingService bookingService;

    @PostMapping("/checkout")
    public ResponseEntity<CheckoutEntry> checkout(
            @PathVariable String tenantId,
            @Valid @RequestBody CheckoutRequest request) {

        log.info("POST /v1/tenants/{}/bookings/checkout - package={}, eventDate={}",
                tenantId, request.getPackageSlug(), request.getEventDate());

        CheckoutEntry entry = bookingService.createCheckout(tenantId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @GetMapping
    public ResponseEntity<List<BookingEntry>> findAll(@PathVariable String tenantId) {
        log.debug("GET /v1/tenants/{}/bookings", tenantId);
        return ResponseEntity.ok(bookingService.getBookings(tenantId));
    }

    @GetMapping("/{bookingId}")
    public ResponseEntity<BookingEntry> findById(@PathVariable String tenantId, @PathVariable String bookingId) {
        log.debug("GET /v1/tenants/{}/bookings/{}", tenantId, bookingId);
        return ResponseEntity.ok(bookingService.getBooking(tenantId, bookingId));
    }
}
