package com.venuebooking.booking.model;

import com.venuebooking.booking.enums.WebhookOutcome;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * One row per processed payment event. Always inserted, never merged, so a
 * concurrent delivery of the same event id fails on the primary key.
 */
@Entity
@Table(name = "webhook_ledger")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class WebhookLedgerEntry implements Persistable<String> {

    @Id
    @Column(name = "event_id", length = 255)
    String eventId;

    @Column(name = "tenant_id", nullable = false, length = 64)
    String tenantId;

    @Column(name = "session_reference", length = 255)
    String sessionReference;

    @Column(name = "booking_id", length = 36)
    String bookingId;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 20)
    WebhookOutcome outcome;

    @Column(name = "processed_at", nullable = false)
    LocalDateTime processedAt;

    @Transient
    @Builder.Default
    boolean newEntry = true;

    @Override
    public String getId() {
        return eventId;
    }

    @Override
    public boolean isNew() {
        return newEntry;
    }

    @PostLoad
    @PostPersist
    protected void markPersisted() {
        newEntry = false;
    }
}
