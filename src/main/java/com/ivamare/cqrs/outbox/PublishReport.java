package com.ivamare.cqrs.outbox;

/**
 * Counts of one publish pass.
 *
 * @param attempted messages fetched and tried
 * @param published messages delivered and marked published
 * @param failed messages whose delivery failed
 */
public record PublishReport(int attempted, int published, int failed) {

    public static PublishReport empty() {
        return new PublishReport(0, 0, 0);
    }

    public boolean hasFailures() {
        return failed > 0;
    }
}
