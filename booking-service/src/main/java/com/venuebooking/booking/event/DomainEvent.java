package com.venuebooking.booking.event;

import org.springframework.context.ApplicationEvent;

/**
 * Base class for booking domain events. Listener failures for these events are
 * isolated by {@link DomainEventMulticaster}.
 */
public abstract class DomainEvent extends ApplicationEvent {

    protected DomainEvent(Object source) {
        super(source);
    }

    /**
     * Stable event name used in logs and metrics.
     */
    public abstract String name();
}
