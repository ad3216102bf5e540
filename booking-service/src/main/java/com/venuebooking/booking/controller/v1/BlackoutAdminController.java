package com.venuebooking.booking.controller.v1;

import com.venuebooking.booking.dto.BlackoutEntry;
import com.venuebooking.booking.dto.BlackoutRequest;
import com.venuebooking.booking.service.BlackoutService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/v1/tenants/{tenantId}/admin/blackouts")
@RequiredArgsConstructor
@Slf4j
public class BlackoutAdminController {

    private final BlackoutService blackoutService;

    @GetMapping
    public ResponseEntity<List<BlackoutEntry>> findAll(@PathVariable String tenantId) {
        log.debug("GET /v1/tenants/{}/admin/blackouts", tenantId);
        return ResponseEntity.ok(blackoutService.getBlackouts(tenantId));
    }

    @PostMapping
    public ResponseEntity<BlackoutEntry> create(
            @PathVariable String tenantId,
            @Valid @RequestBody BlackoutRequest request) {

        log.info("POST /v1/tenants/{}/admin/blackouts - date={}", tenantId, request.getDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(blackoutService.addBlackout(tenantId, request));
    }

    @DeleteMapping("/{date}")
    public ResponseEntity<Void> delete(
            @PathVariable String tenantId,
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {

        log.info("DELETE /v1/tenants/{}/admin/blackouts/{}", tenantId, date);
        blackoutService.removeBlackout(tenantId, date);
        return ResponseEntity.noContent().build();
    }
}
