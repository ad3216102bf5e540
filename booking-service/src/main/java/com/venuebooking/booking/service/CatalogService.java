package com.venuebooking.booking.service;

import com.venuebooking.booking.cache.TenantCacheOperations;
import com.venuebooking.booking.constants.BookingConstants;
import com.venuebooking.booking.dto.AddOnEntry;
import com.venuebooking.booking.dto.AddOnRequest;
import com.venuebooking.booking.dto.CatalogSnapshot;
import com.venuebooking.booking.dto.PackageEntry;
import com.venuebooking.booking.dto.PackageRequest;
import com.venuebooking.booking.exception.BookingValidationException;
import com.venuebooking.booking.exception.ResourceNotFoundException;
import com.venuebooking.booking.mapper.CatalogMapper;
import com.venuebooking.booking.model.AddOn;
import com.venuebooking.booking.model.CatalogPackage;
import com.venuebooking.booking.repository.AddOnRepository;
import com.venuebooking.booking.repository.CatalogPackageRepository;
import com.venuebooking.booking.util.IdGenerator;
import com.venuebooking.booking.util.TenantIds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Tenant catalog of packages and add-ons.
 * <p>
 * Reads go through a per-tenant snapshot cached under the tenant's current
 * catalog generation. Writes commit first and then move the tenant to a new
 * generation before returning, so the next read after a write always rebuilds
 * from the database and a snapshot loaded concurrently with the write is never
 * served. Checkout pricing never reads the cache.
 */
@Service
@Slf4j
public class CatalogService {

    private final CatalogPackageRepository packageRepository;
    private final AddOnRepository addOnRepository;
    private final TenantCacheOperations cache;
    private final CatalogMapper catalogMapper;
    private final TransactionTemplate transactionTemplate;

    private final Duration cacheTtl;

    public CatalogService(
            CatalogPackageRepository packageRepository,
            AddOnRepository addOnRepository,
            TenantCacheOperations cache,
            CatalogMapper catalogMapper,
            TransactionTemplate transactionTemplate,
            @Value("${booking.catalog.cache-ttl-seconds:" + BookingConstants.DEFAULT_CATALOG_CACHE_TTL_SECONDS + "}") long cacheTtlSeconds) {
        this.packageRepository = packageRepository;
        this.addOnRepository = addOnRepository;
        this.cache = cache;
        this.catalogMapper = catalogMapper;
        this.transactionTemplate = transactionTemplate;
        this.cacheTtl = Duration.ofSeconds(cacheTtlSeconds);
    }

    // ============ Reads ============

    public List<PackageEntry> getPackages(String tenantId) {
        return getSnapshot(tenantId).getPackages();
    }

    public PackageEntry getPackage(String tenantId, String slug) {
        if (!StringUtils.hasText(slug)) {
            throw new BookingValidationException("INVALID_SLUG", "Package slug is required");
        }
        return getSnapshot(tenantId).getPackages().stream()
                .filter(entry -> slug.equals(entry.getSlug()))
                .findFirst()
                .orElseThrow(() -> ResourceNotFoundException.packageSlug(slug));
    }

    /**
     * Packages assigned to a segment, with their add-ons.
     */
    public List<PackageEntry> getPackagesBySegment(String tenantId, String segmentId) {
        if (!StringUtils.hasText(segmentId)) {
            throw new BookingValidationException("INVALID_SEGMENT", "Segment id is required");
        }
        return getSnapshot(tenantId).getPackages().stream()
                .filter(entry -> segmentId.equals(entry.getSegmentId()))
                .toList();
    }

    public long invalidate(String tenantId) {
        long generation = cache.invalidate(TenantIds.requireValid(tenantId), BookingConstants.CATALOG_CACHE_RESOURCE);
        log.info("Catalog cache invalidated: tenantId={}, generation={}", tenantId, generation);
        return generation;
    }

    // ============ Checkout lookups (database only) ============

    public CatalogPackage findPackageForCheckout(String tenantId, String slug) {
        return packageRepository.findByTenantIdAndSlug(TenantIds.requireValid(tenantId), slug)
                .filter(pkg -> Boolean.TRUE.equals(pkg.getActive()))
                .orElseThrow(() -> ResourceNotFoundException.packageSlug(slug));
    }

    /**
     * Resolves the requested add-ons for a package with current prices.
     * Duplicate ids count once. Any id that is unknown, inactive, owned by another
     * tenant or bound to another package rejects the whole selection.
     */
    public List<AddOn> findAddOnsForCheckout(String tenantId, String packageId, Collection<String> addOnIds) {
        if (addOnIds == null || addOnIds.isEmpty()) {
            return List.of();
        }

        Set<String> requested = addOnIds.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<String, AddOn> found = addOnRepository.findByTenantIdAndAddOnIdIn(tenantId, requested).stream()
                .collect(Collectors.toMap(AddOn::getAddOnId, Function.identity()));

        for (String addOnId : requested) {
            AddOn addOn = found.get(addOnId);
            if (addOn == null || !Boolean.TRUE.equals(addOn.getActive()) || !addOn.appliesTo(packageId)) {
                throw new BookingValidationException("INVALID_ADD_ON",
                        "Add-on is not available for this package: " + addOnId);
            }
        }

        return requested.stream().map(found::get).toList();
    }

    // ============ Admin writes ============

    public PackageEntry createPackage(String tenantId, PackageRequest request) {
        TenantIds.requireValid(tenantId);
        validatePackageRequest(request);

        CatalogPackage created = transactionTemplate.execute(status -> {
            if (packageRepository.existsByTenantIdAndSlug(tenantId, request.getSlug())) {
                throw new BookingValidationException("DUPLICATE_SLUG", "Slug already in use: " + request.getSlug());
            }
            return packageRepository.save(CatalogPackage.builder()
                    .packageId(IdGenerator.generatePackageId())
                    .tenantId(tenantId)
                    .slug(request.getSlug())
                    .title(request.getTitle())
                    .description(request.getDescription())
                    .priceCents(request.getPriceCents())
                    .active(request.getActive() == null || request.getActive())
                    .segmentId(request.getSegmentId())
                    .build());
        });

        invalidate(tenantId);
        log.info("Package created: tenantId={}, packageId={}, slug={}",
                tenantId, created.getPackageId(), created.getSlug());
        return catalogMapper.toPackageEntry(created, List.of());
    }

    public PackageEntry updatePackage(String tenantId, String packageId, PackageRequest request) {
        TenantIds.requireValid(tenantId);
        validatePackageRequest(request);

        CatalogPackage updated = transactionTemplate.execute(status -> {
            CatalogPackage existing = packageRepository.findByTenantIdAndPackageId(tenantId, packageId)
                    .orElseThrow(() -> ResourceNotFoundException.packageId(packageId));
            if (!existing.getSlug().equals(request.getSlug())
                    && packageRepository.existsByTenantIdAndSlug(tenantId, request.getSlug())) {
                throw new BookingValidationException("DUPLICATE_SLUG", "Slug already in use: " + request.getSlug());
            }
            existing.setSlug(request.getSlug());
            existing.setTitle(request.getTitle());
            existing.setDescription(request.getDescription());
            existing.setPriceCents(request.getPriceCents());
            existing.setActive(request.getActive() == null || request.getActive());
            existing.setSegmentId(request.getSegmentId());
            return packageRepository.save(existing);
        });

        invalidate(tenantId);
        log.info("Package updated: tenantId={}, packageId={}", tenantId, packageId);
        return catalogMapper.toPackageEntry(updated, addOnRepository.findByTenantIdAndPackageId(tenantId, packageId));
    }

    public void deletePackage(String tenantId, String packageId) {
        TenantIds.requireValid(tenantId);

        transactionTemplate.executeWithoutResult(status -> {
            CatalogPackage existing = packageRepository.findByTenantIdAndPackageId(tenantId, packageId)
                    .orElseThrow(() -> ResourceNotFoundException.packageId(packageId));
            addOnRepository.deleteAll(addOnRepository.findByTenantIdAndPackageId(tenantId, packageId));
            packageRepository.delete(existing);
        });

        invalidate(tenantId);
        log.info("Package deleted: tenantId={}, packageId={}", tenantId, packageId);
    }

    public AddOnEntry createAddOn(String tenantId, AddOnRequest request) {
        TenantIds.requireValid(tenantId);
        validateAddOnRequest(request);

        AddOn created = transactionTemplate.execute(status -> {
            requirePackageOwnership(tenantId, request.getPackageId());
            return addOnRepository.save(AddOn.builder()
                    .addOnId(IdGenerator.generateAddOnId())
                    .tenantId(tenantId)
                    .packageId(request.getPackageId())
                    .title(request.getTitle())
                    .priceCents(request.getPriceCents())
                    .active(request.getActive() == null || request.getActive())
                    .build());
        });

        invalidate(tenantId);
        log.info("Add-on created: tenantId={}, addOnId={}, packageId={}",
                tenantId, created.getAddOnId(), created.getPackageId());
        return catalogMapper.toAddOnEntry(created);
    }

    public AddOnEntry updateAddOn(String tenantId, String addOnId, AddOnRequest request) {
        TenantIds.requireValid(tenantId);
        validateAddOnRequest(request);

        AddOn updated = transactionTemplate.execute(status -> {
            AddOn existing = addOnRepository.findByTenantIdAndAddOnId(tenantId, addOnId)
                    .orElseThrow(() -> ResourceNotFoundException.addOn(addOnId));
            requirePackageOwnership(tenantId, request.getPackageId());
            existing.setPackageId(request.getPackageId());
            existing.setTitle(request.getTitle());
            existing.setPriceCents(request.getPriceCents());
            existing.setActive(request.getActive() == null || request.getActive());
            return addOnRepository.save(existing);
        });

        invalidate(tenantId);
        log.info("Add-on updated: tenantId={}, addOnId={}", tenantId, addOnId);
        return catalogMapper.toAddOnEntry(updated);
    }

    public void deleteAddOn(String tenantId, String addOnId) {
        TenantIds.requireValid(tenantId);

        transactionTemplate.executeWithoutResult(status -> {
            AddOn existing = addOnRepository.findByTenantIdAndAddOnId(tenantId, addOnId)
                    .orElseThrow(() -> ResourceNotFoundException.addOn(addOnId));
            addOnRepository.delete(existing);
        });

        invalidate(tenantId);
        log.info("Add-on deleted: tenantId={}, addOnId={}", tenantId, addOnId);
    }

    // ============ Private Methods ============

    private CatalogSnapshot getSnapshot(String tenantId) {
        TenantIds.requireValid(tenantId);

        // Read before loading: a write committing during the load bumps past this generation.
        OptionalLong generation = cache.currentGeneration(tenantId, BookingConstants.CATALOG_CACHE_RESOURCE);
        if (generation.isEmpty()) {
            log.warn("Catalog cache unavailable, reading database: tenantId={}", tenantId);
            return loadSnapshot(tenantId);
        }

        long current = generation.getAsLong();
        return cache.get(tenantId, BookingConstants.CATALOG_CACHE_RESOURCE, current, CatalogSnapshot.class)
                .orElseGet(() -> {
                    CatalogSnapshot snapshot = loadSnapshot(tenantId);
                    cache.put(tenantId, BookingConstants.CATALOG_CACHE_RESOURCE, current, snapshot, cacheTtl);
                    log.debug("Catalog cache rebuilt: tenantId={}, generation={}, packages={}",
                            tenantId, current, snapshot.getPackages().size());
                    return snapshot;
                });
    }

    private CatalogSnapshot loadSnapshot(String tenantId) {
        List<CatalogPackage> packages = packageRepository.findByTenantIdAndActiveTrueOrderByTitleAsc(tenantId);
        List<AddOn> addOns = addOnRepository.findByTenantIdAndActiveTrue(tenantId);

        List<PackageEntry> entries = packages.stream()
                .map(pkg -> catalogMapper.toPackageEntry(pkg, addOns.stream()
                        .filter(addOn -> addOn.appliesTo(pkg.getPackageId()))
                        .toList()))
                .toList();

        return CatalogSnapshot.builder()
                .tenantId(tenantId)
                .packages(entries)
                .build();
    }

    private void requirePackageOwnership(String tenantId, String packageId) {
        if (packageId != null && packageRepository.findByTenantIdAndPackageId(tenantId, packageId).isEmpty()) {
            throw ResourceNotFoundException.packageId(packageId);
        }
    }

    private void validatePackageRequest(PackageRequest request) {
        if (request == null) {
            throw new BookingValidationException("INVALID_REQUEST", "Package request is required");
        }
        if (!StringUtils.hasText(request.getSlug())) {
            throw new BookingValidationException("INVALID_SLUG", "Slug is required");
        }
        if (!StringUtils.hasText(request.getTitle())) {
            throw new BookingValidationException("INVALID_TITLE", "Title is required");
        }
        if (request.getPriceCents() == null || request.getPriceCents() < 0) {
            throw new BookingValidationException("INVALID_PRICE", "Price must be non-negative");
        }
    }

    private void validateAddOnRequest(AddOnRequest request) {
        if (request == null) {
            throw new BookingValidationException("INVALID_REQUEST", "Add-on request is required");
        }
        if (!StringUtils.hasText(request.getTitle())) {
            throw new BookingValidationException("INVALID_TITLE", "Title is required");
        }
        if (request.getPriceCents() == null || request.getPriceCents() < 0) {
            throw new BookingValidationException("INVALID_PRICE", "Price must be non-negative");
        }
    }
}
