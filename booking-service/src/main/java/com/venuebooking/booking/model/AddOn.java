package com.venuebooking.booking.model;

import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

/**
 * Optional extra sold with a package. A null packageId makes the add-on
 * available to every package of the tenant.
 */
@Entity
@Table(name = "add_ons", indexes = @Index(name = "idx_add_ons_tenant", columnList = "tenant_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class AddOn {

    @Id
    @Column(name = "add_on_id", length = 36)
    String addOnId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    String tenantId;

    @Column(name = "package_id", length = 36)
    String packageId;

    @Column(name = "title", nullable = false, length = 255)
    String title;

    @Column(name = "price_cents", nullable = false)
    Long priceCents;

    @Column(name = "active", nullable = false)
    @Builder.Default
    Boolean active = Boolean.TRUE;

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

    public boolean appliesTo(String candidatePackageId) {
        return packageId == null || packageId.equals(candidatePackageId);
    }
}
