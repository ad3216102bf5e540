package com.venuebooking.booking.repository;

import com.venuebooking.booking.model.WebhookLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface WebhookLedgerRepository extends JpaRepository<WebhookLedgerEntry, String> {
}
