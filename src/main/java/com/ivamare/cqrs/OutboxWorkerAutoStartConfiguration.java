package com.ivamare.cqrs;

import com.ivamare.cqrs.health.OutboxPublisherHealthIndicator;
import com.ivamare.cqrs.outbox.worker.OutboxPublishingWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;
import java.time.Duration;

/**
 * Auto-start configuration for the outbox publishing worker.
 *
 * <p>Enable with:
 * <pre>
 * cqrs:
 *   outbox:
 *     publisher:
 *       auto-start: true
 * </pre>
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "cqrs.outbox.publisher", name = "auto-start", havingValue = "true")
public class OutboxWorkerAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(OutboxWorkerAutoStartConfiguration.class);

    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private final OutboxPublishingWorker worker;

    public OutboxWorkerAutoStartConfiguration(OutboxPublishingWorker worker) {
        this.worker = worker;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startWorker() {
        worker.start();
        log.info("Started outbox publishing worker");
    }

    @PreDestroy
    public void stopWorker() {
        if (!worker.isRunning()) {
            return;
        }
        worker.stop(SHUTDOWN_TIMEOUT).join();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(HealthIndicator.class)
    static class HealthConfiguration {

        @Bean
        public HealthIndicator outboxPublisherHealthIndicator(OutboxPublishingWorker worker) {
            return new OutboxPublisherHealthIndicator(worker);
        }
    }
}
