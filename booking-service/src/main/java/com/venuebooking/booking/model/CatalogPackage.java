package com.venuebooking.booking.model;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

@Entity
@Table(name = "packages",
        uniqueConstraints = @UniqueConstraint(name = "uk_packages_tenant_slug", columnNames = {"tenant_id", "slug"}),
        indexes = @Index(name = "idx_packages_tenant", columnList = "tenant_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class CatalogPackage {

    @Id
    @Column(name = "package_id", length = 36)
    String packageId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    String tenantId;

    @Column(name = "slug", nullable = false, length = 100)
    String slug;

    @Column(name = "title", nullable = false, length = 255)
    String title;

    @Column(name = "description", length = 2000)
    String description;

    @Column(name = "price_cents", nullable = false)
    Long priceCents;

    @Column(name = "active", nullable = false)
    @Builder.Default
    Boolean active = Boolean.TRUE;

    @Column(name = "segment_id", length = 36)
    String segmentId;

    @Column(name = "created_at", updatable = false)
    LocalDateTime createdAt;

    @Column(name = "updated_at")
    LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
