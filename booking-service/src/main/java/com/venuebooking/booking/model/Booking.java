package com.venuebooking.booking.model;

import com.venuebooking.booking.enums.BookingStatus;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A customer's reservation of one calendar date for one package.
 * <p>
 * {@code confirmedDate} mirrors {@code eventDate} only while the booking is
 * CONFIRMED. The unique key on (tenant_id, confirmed_date) is what makes a
 * second confirmation for the same date fail at flush time.
 */
@Entity
@Table(name = "bookings",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_bookings_tenant_confirmed_date", columnNames = {"tenant_id", "confirmed_date"}),
                @UniqueConstraint(name = "uk_bookings_session_reference", columnNames = {"session_reference"})
        },
        indexes = {
                @Index(name = "idx_bookings_tenant_event_date", columnList = "tenant_id, event_date"),
                @Index(name = "idx_bookings_status_created", columnList = "status, created_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Booking {

    @Id
    @Column(name = "booking_id", length = 36)
    String bookingId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    String tenantId;

    @Column(name = "package_id", nullable = false, length = 36)
    String packageId;

    @Column(name = "event_date", nullable = false)
    LocalDate eventDate;

    @Column(name = "customer_name", nullable = false, length = 255)
    String customerName;

    @Column(name = "email", nullable = false, length = 320)
    String email;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "booking_add_ons", joinColumns = @JoinColumn(name = "booking_id"))
    @Column(name = "add_on_id", length = 36)
    @Builder.Default
    List<String> addOnIds = new ArrayList<>();

    @Column(name = "total_cents", nullable = false)
    Long totalCents;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    BookingStatus status = BookingStatus.PENDING_PAYMENT;

    @Column(name = "session_reference", length = 255)
    String sessionReference;

    @Column(name = "confirmed_date")
    LocalDate confirmedDate;

    @Column(name = "cancellation_reason", length = 50)
    String cancellationReason;

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

    public boolean isPendingPayment() {
        return status == BookingStatus.PENDING_PAYMENT;
    }

    public void confirm() {
        status = BookingStatus.CONFIRMED;
        confirmedDate = eventDate;
        cancellationReason = null;
    }

    public void cancel(String reason) {
        status = BookingStatus.CANCELLED;
        confirmedDate = null;
        cancellationReason = reason;
    }
}
