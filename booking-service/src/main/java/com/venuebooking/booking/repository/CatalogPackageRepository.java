package com.venuebooking.booking.repository;

import com.venuebooking.booking.model.CatalogPackage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface CatalogPackageRepository extends JpaRepository<CatalogPackage, String> {

    List<CatalogPackage> findByTenantIdAndActiveTrueOrderByTitleAsc(String tenantId);

    Optional<CatalogPackage> findByTenantIdAndSlug(String tenantId, String slug);

    Optional<CatalogPackage> findByTenantIdAndPackageId(String tenantId, String packageId);

    boolean existsByTenantIdAndSlug(String tenantId, String slug);
}
