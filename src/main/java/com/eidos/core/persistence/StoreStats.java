package com.eidos.core.persistence;

/**
 * Aggregate counts reported by {@link EpisodicStore#getStats()}.
 *
 * @param successRate share of episodes whose outcome is success, 0 when there are none
 */
public record StoreStats(
    int episodes,
    int steps,
    int distillations,
    int policies,
    int archivedDistillations,
    double successRate,
    int highConfidenceDistillations,
    String dbPath
) {
}
