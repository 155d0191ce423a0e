package com.hotel.reconciliation.metrics;

import com.hotel.reconciliation.decision.RejectionReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods are callable without a registry")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordReconciliationDuration(true, Duration.ofMillis(100));
                noOp.incrementListingsNormalized(10);
                noOp.incrementDataWarning("price");
                noOp.incrementMatchAccepted();
                noOp.incrementMatchRejected(RejectionReason.NAME);
                noOp.recordSimilarityScore(0.85);
                noOp.recordCandidateCount(50);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Records run duration tagged by enrichment outcome")
        void reconciliationDuration() {
            metrics.recordReconciliationDuration(true, Duration.ofMillis(150));
            metrics.recordReconciliationDuration(true, Duration.ofMillis(250));
            metrics.recordReconciliationDuration(false, Duration.ofMillis(20));

            Timer enriched = registry.find("hotel.reconciliation.duration").tag("enriched", "true").timer();
            Timer failed = registry.find("hotel.reconciliation.duration").tag("enriched", "false").timer();

            assertNotNull(enriched);
            assertEquals(2, enriched.count());
            assertNotNull(failed);
            assertEquals(1, failed.count());
        }

        @Test
        @DisplayName("Counts normalized listings and warnings per field")
        void normalizationCounters() {
            metrics.incrementListingsNormalized(40);
            metrics.incrementListingsNormalized(2);
            metrics.incrementDataWarning("price");
            metrics.incrementDataWarning("price");
            metrics.incrementDataWarning("rating");

            assertEquals(42.0, registry.find("hotel.listings.normalized").counter().count());
            Counter price = registry.find("hotel.data.warning").tag("field", "price").counter();
            assertNotNull(price);
            assertEquals(2.0, price.count());
            assertEquals(1.0, registry.find("hotel.data.warning").tag("field", "rating").counter().count());
        }

        @Test
        @DisplayName("Counts accepted matches and rejections by reason label")
        void matchCounters() {
            metrics.incrementMatchAccepted();
            metrics.incrementMatchRejected(RejectionReason.DISTANCE);
            metrics.incrementMatchRejected(RejectionReason.DISTANCE);
            metrics.incrementMatchRejected(RejectionReason.SOURCE_B_CLAIMED);

            assertEquals(1.0, registry.find("hotel.match.accepted").counter().count());
            assertEquals(2.0, registry.find("hotel.match.rejected").tag("reason", "distance").counter().count());
            assertEquals(1.0, registry.find("hotel.match.rejected").tag("reason", "b-claimed").counter().count());
        }

        @Test
        @DisplayName("Records similarity and candidate distributions")
        void distributions() {
            metrics.recordSimilarityScore(0.9);
            metrics.recordSimilarityScore(0.5);
            metrics.recordCandidateCount(120);

            DistributionSummary similarity = registry.find("hotel.match.similarity").summary();
            assertNotNull(similarity);
            assertEquals(2, similarity.count());
            assertEquals(0.7, similarity.mean(), 1e-9);
            assertEquals(120.0, registry.find("hotel.candidates.per.run").summary().totalAmount());
        }
    }
}
