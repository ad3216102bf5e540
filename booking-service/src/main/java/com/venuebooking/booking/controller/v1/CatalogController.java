package com.venuebooking.booking.controller.v1;

import com.venuebooking.booking.dto.PackageEntry;
import com.venuebooking.booking.service.CatalogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/tenants/{tenantId}/packages")
@RequiredArgsConstructor
@Slf4j
public class CatalogController {

    private final CatalogService catalogService;

    @GetMapping
    public ResponseEntity<List<PackageEntry>> findAll(@PathVariable String tenantId,
                                                      @RequestParam(required = false) String segmentId) {
        log.debug("GET /v1/tenants/{}/packages - segmentId={}", tenantId, segmentId);
        if (segmentId != null) {
            return ResponseEntity.ok(catalogService.getPackagesBySegment(tenantId, segmentId));
        }
        return ResponseEntity.ok(catalogService.getPackages(tenantId));
    }

    @GetMapping("/{slug}")
    public ResponseEntity<PackageEntry> findBySlug(@PathVariable String tenantId, @PathVariable String slug) {
        log.debug("GET /v1/tenants/{}/packages/{}", tenantId, slug);
        return ResponseEntity.ok(catalogService.getPackage(tenantId, slug));
    }
}
