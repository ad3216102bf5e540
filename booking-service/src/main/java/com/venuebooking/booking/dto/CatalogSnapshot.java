package com.venuebooking.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.ArrayList;
import java.util.List;

/**
 * Cached view of a tenant's active catalog.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class CatalogSnapshot {

    String tenantId;

    @Builder.Default
    List<PackageEntry> packages = new ArrayList<>();
}
