package com.hotel.reconciliation.metrics;

import com.hotel.reconciliation.decision.RejectionReason;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordReconciliationDuration(boolean enriched, Duration duration) {
    }

    @Override
    public void incrementListingsNormalized(int count) {
    }

    @Override
    public void incrementDataWarning(String field) {
    }

    @Override
    public void incrementMatchAccepted() {
    }

    @Override
    public void incrementMatchRejected(RejectionReason reason) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordCandidateCount(long count) {
    }
}
