package com.venuebooking.booking.controller.v1;

import com.venuebooking.booking.dto.AddOnEntry;
import com.venuebooking.booking.dto.AddOnRequest;
import com.venuebooking.booking.dto.PackageEntry;
import com.venuebooking.booking.dto.PackageRequest;
import com.venuebooking.booking.service.CatalogService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v1/tenants/{tenantId}/admin")
@RequiredArgsConstructor
@Slf4j
public class CatalogAdminController {

    private final CatalogService catalogService;

    @PostMapping("/packages")
    public ResponseEntity<PackageEntry> createPackage(
            @PathVariable String tenantId,
            @Valid @RequestBody PackageRequest request) {

        log.info("POST /v1/tenants/{}/admin/packages - slug={}", tenantId, request.getSlug());
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createPackage(tenantId, request));
    }

    @PutMapping("/packages/{packageId}")
    public ResponseEntity<PackageEntry> updatePackage(
            @PathVariable String tenantId,
            @PathVariable String packageId,
            @Valid @RequestBody PackageRequest request) {

        log.info("PUT /v1/tenants/{}/admin/packages/{}", tenantId, packageId);
        return ResponseEntity.ok(catalogService.updatePackage(tenantId, packageId, request));
    }

    @DeleteMapping("/packages/{packageId}")
    public ResponseEntity<Void> deletePackage(@PathVariable String tenantId, @PathVariable String packageId) {
        log.info("DELETE /v1/tenants/{}/admin/packages/{}", tenantId, packageId);
        catalogService.deletePackage(tenantId, packageId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/add-ons")
    public ResponseEntity<AddOnEntry> createAddOn(
            @PathVariable String tenantId,
            @Valid @RequestBody AddOnRequest request) {

        log.info("POST /v1/tenants/{}/admin/add-ons - packageId={}", tenantId, request.getPackageId());
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createAddOn(tenantId, request));
    }

    @PutMapping("/add-ons/{addOnId}")
    public ResponseEntity<AddOnEntry> updateAddOn(
            @PathVariable String tenantId,
            @PathVariable String addOnId,
            @Valid @RequestBody AddOnRequest request) {

        log.info("PUT /v1/tenants/{}/admin/add-ons/{}", tenantId, addOnId);
        return ResponseEntity.ok(catalogService.updateAddOn(tenantId, addOnId, request));
    }

    @DeleteMapping("/add-ons/{addOnId}")
    public ResponseEntity<Void> deleteAddOn(@PathVariable String tenantId, @PathVariable String addOnId) {
        log.info("DELETE /v1/tenants/{}/admin/add-ons/{}", tenantId, addOnId);
        catalogService.deleteAddOn(tenantId, addOnId);
        return ResponseEntity.noContent().build();
    }
}
