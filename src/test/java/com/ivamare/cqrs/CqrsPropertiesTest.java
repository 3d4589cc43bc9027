package com.ivamare.cqrs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CqrsProperties")
class CqrsPropertiesTest {

    @Test
    @DisplayName("should have default values")
    void shouldHaveDefaultValues() {
        CqrsProperties properties = new CqrsProperties();

        assertTrue(properties.isEnabled());
        assertFalse(properties.isFailOnDuplicateHandler());
        assertEquals(CqrsProperties.StoreType.MEMORY, properties.getOutbox().getStore());
        assertEquals("cqrs_outbox", properties.getOutbox().getTableName());
        assertEquals(100, properties.getOutbox().getBatchSize());
        assertFalse(properties.getOutbox().getPublisher().isAutoStart());
        assertEquals(1000, properties.getOutbox().getPublisher().getPollIntervalMs());
        assertEquals(0, properties.getOutbox().getPublisher().getInitialDelayMs());
    }

    @Test
    @DisplayName("should bind kebab-case properties")
    void shouldBindProperties() {
        MapConfigurationPropertySource source = new MapConfigurationPropertySource(Map.of(
            "cqrs.fail-on-duplicate-handler", "true",
            "cqrs.outbox.store", "jdbc",
            "cqrs.outbox.table-name", "app_outbox",
            "cqrs.outbox.batch-size", "25",
            "cqrs.outbox.publisher.auto-start", "true",
            "cqrs.outbox.publisher.poll-interval-ms", "250",
            "cqrs.outbox.publisher.initial-delay-ms", "5000"
        ));

        CqrsProperties properties = new Binder(source).bind("cqrs", CqrsProperties.class).get();

        assertTrue(properties.isFailOnDuplicateHandler());
        assertEquals(CqrsProperties.StoreType.JDBC, properties.getOutbox().getStore());
        assertEquals("app_outbox", properties.getOutbox().getTableName());
        assertEquals(25, properties.getOutbox().getBatchSize());
        assertTrue(properties.getOutbox().getPublisher().isAutoStart());
        assertEquals(250, properties.getOutbox().getPublisher().getPollIntervalMs());
        assertEquals(5000, properties.getOutbox().getPublisher().getInitialDelayMs());
    }
}
