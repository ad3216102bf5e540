package com.venuebooking.booking.service;

import com.venuebooking.booking.enums.BookingStatus;
import com.venuebooking.booking.model.Booking;
import com.venuebooking.booking.repository.BookingRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("BookingExpiryService Unit Tests")
class BookingExpiryServiceTest {

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private BookingExpiryService expiryService;

    @BeforeEach
    void setUp() {
        expiryService = new BookingExpiryService(bookingRepository, new TransactionTemplate(transactionManager), 1440);
    }

    private Booking booking(String id, BookingStatus status) {
        return Booking.builder()
                .bookingId(id).tenantId("acme").packageId("PKG1")
                .eventDate(LocalDate.of(2025, 9, 20)).customerName("Jane").email("jane@example.com")
                .totalCents(50000L).status(status).build();
    }

    @Test
    @DisplayName("Should cancel stale pending bookings as expired")
    void processExpiredBookings_CancelsPending() {
        Booking stale = booking("BK1", BookingStatus.PENDING_PAYMENT);
        when(bookingRepository.findByStatusAndCreatedAtBefore(eq(BookingStatus.PENDING_PAYMENT), any()))
                .thenReturn(List.of(stale));
        when(bookingRepository.lockByBookingId("BK1")).thenReturn(Optional.of(stale));

        int expired = expiryService.processExpiredBookings();

        assertThat(expired).isEqualTo(1);
        assertThat(stale.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(stale.getCancellationReason()).isEqualTo("EXPIRED");
        verify(bookingRepository).save(stale);
    }

    @Test
    @DisplayName("Should skip a booking confirmed since it was listed")
    void processExpiredBookings_ConfirmedMeanwhile_Skipped() {
        Booking listed = booking("BK2", BookingStatus.PENDING_PAYMENT);
        Booking current = booking("BK2", BookingStatus.CONFIRMED);
        when(bookingRepository.findByStatusAndCreatedAtBefore(eq(BookingStatus.PENDING_PAYMENT), any()))
                .thenReturn(List.of(listed));
        when(bookingRepository.lockByBookingId("BK2")).thenReturn(Optional.of(current));

        assertThat(expiryService.processExpiredBookings()).isZero();
        assertThat(current.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        verify(bookingRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should keep going when one booking fails")
    void processExpiredBookings_OneFailure_Continues() {
        Booking first = booking("BK3", BookingStatus.PENDING_PAYMENT);
        Booking second = booking("BK4", BookingStatus.PENDING_PAYMENT);
        when(bookingRepository.findByStatusAndCreatedAtBefore(eq(BookingStatus.PENDING_PAYMENT), any()))
                .thenReturn(List.of(first, second));
        when(bookingRepository.lockByBookingId("BK3")).thenThrow(new RuntimeException("lock timeout"));
        when(bookingRepository.lockByBookingId("BK4")).thenReturn(Optional.of(second));

        assertThat(expiryService.processExpiredBookings()).isEqualTo(1);
        assertThat(second.getStatus()).isEqualTo(BookingStatus.CANCELLED);
    }
}
