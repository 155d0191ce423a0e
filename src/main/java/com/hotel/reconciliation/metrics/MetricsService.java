package com.hotel.reconciliation.metrics;

import com.hotel.reconciliation.decision.RejectionReason;

import java.time.Duration;

/**
 * Interface for recording reconciliation metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library runs without a
 * metrics backend.
 */
public interface MetricsService {

    void recordReconciliationDuration(boolean enriched, Duration duration);

    void incrementListingsNormalized(int count);

    void incrementDataWarning(String field);

    void incrementMatchAccepted();

    void incrementMatchRejected(RejectionReason reason);

    void recordSimilarityScore(double score);

    void recordCandidateCount(long count);
}
