package com.venuebooking.booking.config;

import com.venuebooking.booking.event.DomainEventMulticaster;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.ApplicationEventMulticaster;
import org.springframework.context.support.AbstractApplicationContext;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties(TenantZoneProperties.class)
@Slf4j
public class BookingConfiguration {

    /**
     * UTC clock; tenant-local dates are derived through {@code TenantZoneResolver}.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Replaces Spring's default multicaster so domain-event listener failures are isolated.
     */
    @Bean(name = AbstractApplicationContext.APPLICATION_EVENT_MULTICASTER_BEAN_NAME)
    public ApplicationEventMulticaster applicationEventMulticaster(ObjectProvider<MeterRegistry> meterRegistry) {
        log.info("Registering domain event multicaster");
        return new DomainEventMulticaster(meterRegistry);
    }

    /**
     * Runs calendar provider calls so callers can bound them with a timeout.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService calendarExecutor(@Value("${booking.calendar.pool-size:8}") int poolSize) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "calendar-provider-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(poolSize, threadFactory);
    }
}
