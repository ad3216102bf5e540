package com.venuebooking.booking.repository;

import com.venuebooking.booking.model.Blackout;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface BlackoutRepository extends JpaRepository<Blackout, Long> {

    boolean existsByTenantIdAndDate(String tenantId, LocalDate date);

    Optional<Blackout> findByTenantIdAndDate(String tenantId, LocalDate date);

    List<Blackout> findByTenantIdAndDateBetween(String tenantId, LocalDate start, LocalDate end);

    List<Blackout> findByTenantIdOrderByDateAsc(String tenantId);
}
