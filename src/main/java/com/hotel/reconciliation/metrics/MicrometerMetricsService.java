package com.hotel.reconciliation.metrics;

import com.hotel.reconciliation.decision.RejectionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code hotel.reconciliation.duration} - Timer (tag: enriched)</li>
 *   <li>{@code hotel.listings.normalized} - Counter</li>
 *   <li>{@code hotel.data.warning} - Counter (tag: field)</li>
 *   <li>{@code hotel.match.accepted} - Counter</li>
 *   <li>{@code hotel.match.rejected} - Counter (tag: reason)</li>
 *   <li>{@code hotel.match.similarity} - DistributionSummary</li>
 *   <li>{@code hotel.candidates.per.run} - DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter normalizedCounter;
    private final Counter acceptedCounter;
    private final DistributionSummary similaritySummary;
    private final DistributionSummary candidateSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.normalizedCounter = Counter.builder("hotel.listings.normalized")
                .description("Number of listings normalized")
                .register(registry);
        this.acceptedCounter = Counter.builder("hotel.match.accepted")
                .description("Number of accepted cross-source matches")
                .register(registry);
        this.similaritySummary = DistributionSummary.builder("hotel.match.similarity")
                .description("Name similarity of scored candidate pairs")
                .register(registry);
        this.candidateSummary = DistributionSummary.builder("hotel.candidates.per.run")
                .description("Candidate pairs generated per reconciliation run")
                .register(registry);
    }

    @Override
    public void recordReconciliationDuration(boolean enriched, Duration duration) {
        String key = "enriched:" + enriched;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("hotel.reconciliation.duration")
                        .description("Duration of reconciliation runs")
                        .tag("enriched", Boolean.toString(enriched))
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementListingsNormalized(int count) {
        normalizedCounter.increment(count);
    }

    @Override
    public void incrementDataWarning(String field) {
        String key = "warning:" + field;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("hotel.data.warning")
                        .description("Number of data quality warnings raised while normalizing")
                        .tag("field", field)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementMatchAccepted() {
        acceptedCounter.increment();
    }

    @Override
    public void incrementMatchRejected(RejectionReason reason) {
        String key = "rejected:" + reason.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("hotel.match.rejected")
                        .description("Number of rejected candidate pairs")
                        .tag("reason", reason.label())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similaritySummary.record(score);
    }

    @Override
    public void recordCandidateCount(long count) {
        candidateSummary.record(count);
    }
}
