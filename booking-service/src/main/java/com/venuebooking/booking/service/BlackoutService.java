package com.venuebooking.booking.service;

import com.venuebooking.booking.constants.ValidationMessages;
import com.venuebooking.booking.dto.BlackoutEntry;
import com.venuebooking.booking.dto.BlackoutRequest;
import com.venuebooking.booking.exception.BookingValidationException;
import com.venuebooking.booking.exception.ResourceNotFoundException;
import com.venuebooking.booking.mapper.CatalogMapper;
import com.venuebooking.booking.model.Blackout;
import com.venuebooking.booking.repository.BlackoutRepository;
import com.venuebooking.booking.util.TenantIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Administrative date blocks per tenant.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BlackoutService {

    private final BlackoutRepository blackoutRepository;
    private final CatalogMapper catalogMapper;

    @Transactional(readOnly = true)
    public List<BlackoutEntry> getBlackouts(String tenantId) {
        TenantIds.requireValid(tenantId);
        return blackoutRepository.findByTenantIdOrderByDateAsc(tenantId).stream()
                .map(catalogMapper::toBlackoutEntry)
                .toList();
    }

    /**
     * Adds a blackout. Adding an existing date updates its reason.
     */
    @Transactional
    public BlackoutEntry addBlackout(String tenantId, BlackoutRequest request) {
        TenantIds.requireValid(tenantId);
        if (request == null || request.getDate() == null) {
            throw new BookingValidationException("INVALID_DATE", ValidationMessages.DATE_REQUIRED);
        }

        Blackout blackout = blackoutRepository.findByTenantIdAndDate(tenantId, request.getDate())
                .orElseGet(() -> Blackout.builder()
                        .tenantId(tenantId)
                        .date(request.getDate())
                        .build());
        blackout.setReason(request.getReason());
        blackoutRepository.save(blackout);

        log.info("Blackout saved: tenantId={}, date={}", tenantId, request.getDate());
        return catalogMapper.toBlackoutEntry(blackout);
    }

    @Transactional
    public void removeBlackout(String tenantId, LocalDate date) {
        TenantIds.requireValid(tenantId);
        if (date == null) {
            throw new BookingValidationException("INVALID_DATE", ValidationMessages.DATE_REQUIRED);
        }

        Blackout blackout = blackoutRepository.findByTenantIdAndDate(tenantId, date)
                .orElseThrow(() -> ResourceNotFoundException.blackout(date.toString()));
        blackoutRepository.delete(blackout);
        log.info("Blackout removed: tenantId={}, date={}", tenantId, date);
    }
}
