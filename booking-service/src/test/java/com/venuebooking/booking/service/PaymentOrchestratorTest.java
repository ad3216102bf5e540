package com.venuebooking.booking.service;

import com.venuebooking.booking.dto.PaymentWebhook;
import com.venuebooking.booking.dto.WebhookResult;
import com.venuebooking.booking.enums.BookingStatus;
import com.venuebooking.booking.enums.WebhookOutcome;
import com.venuebooking.booking.event.BookingPaidEvent;
import com.venuebooking.booking.exception.BookingValidationException;
import com.venuebooking.booking.model.AddOn;
import com.venuebooking.booking.model.Booking;
import com.venuebooking.booking.model.CatalogPackage;
import com.venuebooking.booking.model.WebhookLedgerEntry;
import com.venuebooking.booking.repository.AddOnRepository;
import com.venuebooking.booking.repository.BookingRepository;
import com.venuebooking.booking.repository.CatalogPackageRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("PaymentOrchestrator Unit Tests")
class PaymentOrchestratorTest {

    private static final String TENANT = "acme";
    private static final String SESSION = "cs_123";
    private static final LocalDate EVENT_DATE = LocalDate.of(2025, 9, 20);

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private CatalogPackageRepository packageRepository;

    @Mock
    private AddOnRepository addOnRepository;

    @Mock
    private WebhookLedger webhookLedger;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private PlatformTransactionManager transactionManager;

    private SimpleMeterRegistry meterRegistry;
    private PaymentOrchestrator orchestrator;

    private Booking pendingBooking;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        orchestrator = new PaymentOrchestrator(
                bookingRepository,
                packageRepository,
                addOnRepository,
                webhookLedger,
                eventPublisher,
                new TransactionTemplate(transactionManager),
                meterRegistry
        );

        pendingBooking = newPendingBooking();

        when(webhookLedger.find(anyString())).thenReturn(Optional.empty());
        when(bookingRepository.lockByTenantIdAndSessionReference(TENANT, SESSION))
                .thenReturn(Optional.of(pendingBooking));
        when(bookingRepository.existsByTenantIdAndConfirmedDate(TENANT, EVENT_DATE)).thenReturn(false);
        when(packageRepository.findById("PKG1")).thenReturn(Optional.of(CatalogPackage.builder()
                .packageId("PKG1").title("Sunset").build()));
        when(addOnRepository.findAllById(anyIterable())).thenReturn(List.of(AddOn.builder()
                .addOnId("AO1").title("Photos").build()));
    }

    private Booking newPendingBooking() {
        return Booking.builder()
                .bookingId("BK1")
                .tenantId(TENANT)
                .packageId("PKG1")
                .eventDate(EVENT_DATE)
                .customerName("Jane Doe")
                .email("jane@example.com")
                .addOnIds(new ArrayList<>(List.of("AO1")))
                .totalCents(60000L)
                .status(BookingStatus.PENDING_PAYMENT)
                .sessionReference(SESSION)
                .build();
    }

    private PaymentWebhook webhook(String eventId, String status) {
        return PaymentWebhook.builder()
                .eventId(eventId)
                .tenantId(TENANT)
                .sessionReference(SESSION)
                .paymentStatus(status)
                .build();
    }

    private WebhookLedgerEntry ledgerEntry(String eventId, WebhookOutcome outcome) {
        return WebhookLedgerEntry.builder()
                .eventId(eventId).tenantId(TENANT).sessionReference(SESSION)
                .bookingId("BK1").outcome(outcome).build();
    }

    @Nested
    @DisplayName("Successful Payment Tests")
    class SuccessTests {

        @Test
        @DisplayName("Should confirm a pending booking and publish BookingPaid")
        void handlePaymentWebhook_Success_Confirms() {
            WebhookResult result = orchestrator.handlePaymentWebhook(webhook("evt_1", "succeeded"));

            assertThat(result.getOutcome()).isEqualTo(WebhookOutcome.CONFIRMED);
            assertThat(result.getBookingId()).isEqualTo("BK1");
            assertThat(pendingBooking.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
            assertThat(pendingBooking.getConfirmedDate()).isEqualTo(EVENT_DATE);
            verify(bookingRepository).saveAndFlush(pendingBooking);
            verify(webhookLedger).record("evt_1", TENANT, SESSION, "BK1", WebhookOutcome.CONFIRMED);

            ArgumentCaptor<BookingPaidEvent> event = ArgumentCaptor.forClass(BookingPaidEvent.class);
            verify(eventPublisher).publishEvent(event.capture());
            assertThat(event.getValue().name()).isEqualTo("BookingPaid");
            assertThat(event.getValue().getPackageTitle()).isEqualTo("Sunset");
            assertThat(event.getValue().getAddOnTitles()).containsExactly("Photos");
            assertThat(event.getValue().getTotalCents()).isEqualTo(60000L);
        }

        @Test
        @DisplayName("Should publish only after the transaction commits")
        void handlePaymentWebhook_Success_PublishesAfterCommit() {
            orchestrator.handlePaymentWebhook(webhook("evt_1", "succeeded"));

            InOrder inOrder = inOrder(transactionManager, eventPublisher);
            inOrder.verify(transactionManager).commit(any());
            inOrder.verify(eventPublisher).publishEvent(any(BookingPaidEvent.class));
        }

        @Test
        @DisplayName("Should cancel as conflict when the date is already confirmed")
        void handlePaymentWebhook_DateTaken_Conflict() {
            when(bookingRepository.existsByTenantIdAndConfirmedDate(TENANT, EVENT_DATE)).thenReturn(true);

            WebhookResult result = orchestrator.handlePaymentWebhook(webhook("evt_2", "succeeded"));

            assertThat(result.getOutcome()).isEqualTo(WebhookOutcome.CONFLICT);
            assertThat(pendingBooking.getStatus()).isEqualTo(BookingStatus.CANCELLED);
            assertThat(pendingBooking.getCancellationReason()).isEqualTo("DATE_TAKEN");
            assertThat(pendingBooking.getConfirmedDate()).isNull();
            verify(webhookLedger).record("evt_2", TENANT, SESSION, "BK1", WebhookOutcome.CONFLICT);
            verifyNoInteractions(eventPublisher);
            assertThat(meterRegistry.counter("booking.webhook.conflict").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should replay as conflict when the unique confirmed date is violated")
        void handlePaymentWebhook_LostRace_ReplaysAsConflict() {
            Booking firstAttempt = newPendingBooking();
            Booking secondAttempt = newPendingBooking();
            when(bookingRepository.lockByTenantIdAndSessionReference(TENANT, SESSION))
                    .thenReturn(Optional.of(firstAttempt), Optional.of(secondAttempt));
            when(bookingRepository.existsByTenantIdAndConfirmedDate(TENANT, EVENT_DATE)).thenReturn(false, true);
            when(bookingRepository.saveAndFlush(firstAttempt))
                    .thenThrow(new DataIntegrityViolationException("uk_bookings_tenant_confirmed_date"));

            WebhookResult result = orchestrator.handlePaymentWebhook(webhook("evt_3", "succeeded"));

            assertThat(result.getOutcome()).isEqualTo(WebhookOutcome.CONFLICT);
            assertThat(secondAttempt.getCancellationReason()).isEqualTo("DATE_TAKEN");
            verify(transactionManager).rollback(any());
            verify(webhookLedger, never()).record(anyString(), anyString(), anyString(), anyString(),
                    eq(WebhookOutcome.CONFIRMED));
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("Should give up after repeated constraint violations")
        void handlePaymentWebhook_RepeatedViolations_Propagates() {
            when(bookingRepository.lockByTenantIdAndSessionReference(TENANT, SESSION))
                    .thenAnswer(inv -> Optional.of(newPendingBooking()));
            when(bookingRepository.saveAndFlush(any(Booking.class)))
                    .thenThrow(new DataIntegrityViolationException("uk_bookings_tenant_confirmed_date"));

            assertThatThrownBy(() -> orchestrator.handlePaymentWebhook(webhook("evt_4", "succeeded")))
                    .isInstanceOf(DataIntegrityViolationException.class);

            verify(bookingRepository, times(3)).saveAndFlush(any(Booking.class));
            verifyNoInteractions(eventPublisher);
        }
    }

    @Nested
    @DisplayName("Idempotency Tests")
    class IdempotencyTests {

        @Test
        @DisplayName("Should answer duplicate for a known event id without side effects")
        void handlePaymentWebhook_KnownEvent_Duplicate() {
            when(webhookLedger.find("evt_1")).thenReturn(Optional.of(ledgerEntry("evt_1", WebhookOutcome.CONFIRMED)));

            WebhookResult result = orchestrator.handlePaymentWebhook(webhook("evt_1", "succeeded"));

            assertThat(result.getOutcome()).isEqualTo(WebhookOutcome.DUPLICATE);
            assertThat(result.getBookingId()).isEqualTo("BK1");
            verifyNoInteractions(bookingRepository, eventPublisher);
            verify(webhookLedger, never()).record(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("Should report duplicate when a concurrent delivery wins the ledger insert")
        void handlePaymentWebhook_ConcurrentSameEvent_Duplicate() {
            when(bookingRepository.lockByTenantIdAndSessionReference(TENANT, SESSION)).thenReturn(Optional.empty());
            when(webhookLedger.find("evt_5")).thenReturn(
                    Optional.empty(),
                    Optional.empty(),
                    Optional.of(ledgerEntry("evt_5", WebhookOutcome.UNKNOWN_SESSION)));
            when(webhookLedger.record(eq("evt_5"), anyString(), anyString(), isNull(), any()))
                    .thenThrow(new DataIntegrityViolationException("webhook_ledger pk"));

            WebhookResult result = orchestrator.handlePaymentWebhook(webhook("evt_5", "succeeded"));

            assertThat(result.getOutcome()).isEqualTo(WebhookOutcome.DUPLICATE);
        }
    }

    @Nested
    @DisplayName("Other Outcome Tests")
    class OtherOutcomeTests {

        @Test
        @DisplayName("Should record unknown sessions without failing")
        void handlePaymentWebhook_UnknownSession() {
            when(bookingRepository.lockByTenantIdAndSessionReference(TENANT, SESSION)).thenReturn(Optional.empty());

            WebhookResult result = orchestrator.handlePaymentWebhook(webhook("evt_6", "succeeded"));

            assertThat(result.getOutcome()).isEqualTo(WebhookOutcome.UNKNOWN_SESSION);
            verify(webhookLedger).record("evt_6", TENANT, SESSION, null, WebhookOutcome.UNKNOWN_SESSION);
        }

        @Test
        @DisplayName("Should cancel the booking on payment failure")
        void handlePaymentWebhook_Failed_Cancels() {
            WebhookResult result = orchestrator.handlePaymentWebhook(webhook("evt_7", "failed"));

            assertThat(result.getOutcome()).isEqualTo(WebhookOutcome.PAYMENT_FAILED);
            assertThat(pendingBooking.getStatus()).isEqualTo(BookingStatus.CANCELLED);
            assertThat(pendingBooking.getCancellationReason()).isEqualTo("PAYMENT_FAILED");
            verifyNoInteractions(eventPublisher);
        }

        @Test
        @DisplayName("Should ignore events for settled bookings")
        void handlePaymentWebhook_TerminalBooking_Ignored() {
            pendingBooking.confirm();

            WebhookResult result = orchestrator.handlePaymentWebhook(webhook("evt_8", "failed"));

            assertThat(result.getOutcome()).isEqualTo(WebhookOutcome.IGNORED);
            assertThat(pendingBooking.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
            verify(bookingRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should reject an unknown payment status before writing anything")
        void handlePaymentWebhook_UnknownStatus_ThrowsException() {
            assertThatThrownBy(() -> orchestrator.handlePaymentWebhook(webhook("evt_9", "refunded")))
                    .isInstanceOf(BookingValidationException.class)
                    .hasFieldOrPropertyWithValue("errorCode", "INVALID_PAYMENT_STATUS");

            verifyNoInteractions(webhookLedger, bookingRepository);
        }

        @Test
        @DisplayName("Should replay after a transient lock timeout")
        void handlePaymentWebhook_TransientLockTimeout_Replays() {
            when(bookingRepository.lockByTenantIdAndSessionReference(TENANT, SESSION))
                    .thenThrow(new PessimisticLockingFailureException("lock timeout"))
                    .thenReturn(Optional.of(pendingBooking));

            WebhookResult result = orchestrator.handlePaymentWebhook(webhook("evt_11", "succeeded"));

            assertThat(result.getOutcome()).isEqualTo(WebhookOutcome.CONFIRMED);
            verify(transactionManager).rollback(any());
            verify(eventPublisher).publishEvent(any(BookingPaidEvent.class));
        }

        @Test
        @DisplayName("Should let repeated lock timeouts propagate so the gateway redelivers")
        void handlePaymentWebhook_LockTimeout_Propagates() {
            when(bookingRepository.lockByTenantIdAndSessionReference(TENANT, SESSION))
                    .thenThrow(new PessimisticLockingFailureException("lock timeout"));

            assertThatThrownBy(() -> orchestrator.handlePaymentWebhook(webhook("evt_10", "succeeded")))
                    .isInstanceOf(PessimisticLockingFailureException.class);

            verify(bookingRepository, times(3)).lockByTenantIdAndSessionReference(TENANT, SESSION);
            verify(webhookLedger, never()).record(any(), any(), any(), any(), any());
        }
    }
}
