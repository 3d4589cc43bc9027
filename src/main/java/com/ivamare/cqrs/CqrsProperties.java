package com.ivamare.cqrs;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the CQRS mediator and outbox.
 *
 * <p>Example configuration:
 * <pre>
 * cqrs:
 *   enabled: true
 *   fail-on-duplicate-handler: false
 *   outbox:
 *     store: jdbc
 *     table-name: cqrs_outbox
 *     batch-size: 100
 *     publisher:
 *       auto-start: true
 *       poll-interval-ms: 1000
 *       initial-delay-ms: 0
 * </pre>
 */
@ConfigurationProperties(prefix = "cqrs")
public class CqrsProperties {

    /**
     * Enable/disable CQRS auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Fail on a second handler for the same command or query type instead of replacing
     * the first one.
     */
    private boolean failOnDuplicateHandler = false;

    /**
     * Outbox configuration.
     */
    private OutboxProperties outbox = new OutboxProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isFailOnDuplicateHandler() {
        return failOnDuplicateHandler;
    }

    public void setFailOnDuplicateHandler(boolean failOnDuplicateHandler) {
        this.failOnDuplicateHandler = failOnDuplicateHandler;
    }

    public OutboxProperties getOutbox() {
        return outbox;
    }

    public void setOutbox(OutboxProperties outbox) {
        this.outbox = outbox;
    }

    /**
     * Where outbox messages are kept.
     */
    public enum StoreType {
        MEMORY,
        JDBC
    }

    /**
     * Outbox store and publisher configuration.
     */
    public static class OutboxProperties {

        /**
         * Outbox store implementation.
         */
        private StoreType store = StoreType.MEMORY;

        /**
         * Table used by the JDBC store.
         */
        private String tableName = "cqrs_outbox";

        /**
         * Maximum messages handled by one publish pass.
         */
        private int batchSize = 100;

        /**
         * Background publisher configuration.
         */
        private PublisherProperties publisher = new PublisherProperties();

        public StoreType getStore() {
            return store;
        }

        public void setStore(StoreType store) {
            this.store = store;
        }

        public String getTableName() {
            return tableName;
        }

        public void setTableName(String tableName) {
            this.tableName = tableName;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public PublisherProperties getPublisher() {
            return publisher;
        }

        public void setPublisher(PublisherProperties publisher) {
            this.publisher = publisher;
        }
    }

    /**
     * Background publisher configuration.
     */
    public static class PublisherProperties {

        /**
         * Start the publishing worker when the application is ready.
         */
        private boolean autoStart = false;

        /**
         * Delay between two publish passes in milliseconds.
         */
        private long pollIntervalMs = 1000;

        /**
         * Delay before the first publish pass in milliseconds.
         */
        private long initialDelayMs = 0;

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }
    }
}
