package com.ivamare.cqrs;

import com.ivamare.cqrs.outbox.OutboxPublisher;
import com.ivamare.cqrs.outbox.impl.InMemoryMessageOutboxRepository;
import com.ivamare.cqrs.outbox.worker.OutboxPublishingWorker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OutboxWorkerAutoStartConfiguration")
class OutboxWorkerAutoStartConfigurationTest {

    private OutboxPublishingWorker worker;
    private OutboxWorkerAutoStartConfiguration configuration;

    @BeforeEach
    void setUp() {
        OutboxPublisher publisher = new OutboxPublisher(new InMemoryMessageOutboxRepository(), event -> { });
        worker = new OutboxPublishingWorker(publisher, 10, 1000, 0);
        configuration = new OutboxWorkerAutoStartConfiguration(worker);
    }

    @AfterEach
    void tearDown() {
        configuration.stopWorker();
    }

    @Test
    @DisplayName("should start the worker when the application is ready")
    void shouldStartWorker() {
        configuration.startWorker();

        assertTrue(worker.isRunning());
    }

    @Test
    @DisplayName("should stop the worker on shutdown")
    void shouldStopWorker() {
        configuration.startWorker();

        configuration.stopWorker();

        assertFalse(worker.isRunning());
    }

    @Test
    @DisplayName("should do nothing on shutdown when the worker never started")
    void shouldIgnoreStopWhenNotStarted() {
        assertDoesNotThrow(() -> configuration.stopWorker());
    }

    @Test
    @DisplayName("should report the running worker as healthy")
    void shouldExposeHealthIndicator() {
        HealthIndicator indicator = new OutboxWorkerAutoStartConfiguration.HealthConfiguration()
            .outboxPublisherHealthIndicator(worker);
        configuration.startWorker();

        assertEquals(Status.UP, indicator.health().getStatus());
    }
}
