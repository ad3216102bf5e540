package com.venuebooking.booking.event;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectFactory;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.SimpleApplicationEventMulticaster;

/**
 * Application event multicaster that isolates listeners of {@link DomainEvent}s.
 * <p>
 * Listeners still run synchronously on the publishing thread in order. A failing
 * domain-event listener is logged and counted; it never reaches the publisher and
 * never stops the remaining listeners. Framework events keep Spring's default handling.
 */
@Slf4j
public class DomainEventMulticaster extends SimpleApplicationEventMulticaster {

    private final ObjectFactory<MeterRegistry> meterRegistry;

    public DomainEventMulticaster(ObjectFactory<MeterRegistry> meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    protected void invokeListener(ApplicationListener<?> listener, ApplicationEvent event) {
        if (!(event instanceof DomainEvent)) {
            super.invokeListener(listener, event);
            return;
        }

        String name = ((DomainEvent) event).name();
        try {
            super.invokeListener(listener, event);
        } catch (RuntimeException e) {
            meterRegistry.getObject().counter("event.handler.failures", "event", name).increment();
            log.error("Event listener failed: name={}, error={}", name, e.getMessage(), e);
        }
    }
}
