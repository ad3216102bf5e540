package com.venuebooking.booking.repository;

import com.venuebooking.booking.model.AddOn;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AddOnRepository extends JpaRepository<AddOn, String> {

    List<AddOn> findByTenantIdAndActiveTrue(String tenantId);

    List<AddOn> findByTenantIdAndAddOnIdIn(String tenantId, Collection<String> addOnIds);

    Optional<AddOn> findByTenantIdAndAddOnId(String tenantId, String addOnId);

    List<AddOn> findByTenantIdAndPackageId(String tenantId, String packageId);
}
