package com.venuebooking.booking.event;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextRefreshedEvent;
import org.springframework.context.support.GenericApplicationContext;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DomainEventMulticaster Unit Tests")
class DomainEventMulticasterTest {

    private SimpleMeterRegistry meterRegistry;
    private DomainEventMulticaster multicaster;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        multicaster = new DomainEventMulticaster(() -> meterRegistry);
    }

    private BookingPaidEvent paidEvent() {
        return BookingPaidEvent.builder()
                .source(this)
                .bookingId("BK1")
                .tenantId("acme")
                .email("jane@example.com")
                .customerName("Jane")
                .eventDate(LocalDate.of(2025, 9, 20))
                .packageTitle("Sunset")
                .addOnTitles(List.of())
                .totalCents(50000L)
                .build();
    }

    @Test
    @DisplayName("Should deliver to listeners in registration order")
    void multicast_RegistrationOrder() {
        List<String> calls = new ArrayList<>();
        multicaster.addApplicationListener((ApplicationListener<ApplicationEvent>) e -> calls.add("first"));
        multicaster.addApplicationListener((ApplicationListener<ApplicationEvent>) e -> calls.add("second"));

        multicaster.multicastEvent(paidEvent());

        assertThat(calls).containsExactly("first", "second");
    }

    @Test
    @DisplayName("Should isolate a failing listener from the others and the publisher")
    void multicast_FailingListener_Isolated() {
        List<String> calls = new ArrayList<>();
        multicaster.addApplicationListener((ApplicationListener<ApplicationEvent>) e -> {
            throw new IllegalStateException("mail down");
        });
        multicaster.addApplicationListener((ApplicationListener<ApplicationEvent>) e ->
                calls.add(((BookingPaidEvent) e).getBookingId()));

        assertThatCode(() -> multicaster.multicastEvent(paidEvent())).doesNotThrowAnyException();

        assertThat(calls).containsExactly("BK1");
        assertThat(meterRegistry.counter("event.handler.failures", "event", "BookingPaid").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should keep default failure handling for framework events")
    void multicast_FrameworkEvent_Propagates() {
        multicaster.addApplicationListener((ApplicationListener<ApplicationEvent>) e -> {
            throw new IllegalStateException("broken");
        });

        assertThatThrownBy(() -> multicaster.multicastEvent(new ContextRefreshedEvent(new GenericApplicationContext())))
                .isInstanceOf(IllegalStateException.class);
        assertThat(meterRegistry.find("event.handler.failures").counter()).isNull();
    }
}
