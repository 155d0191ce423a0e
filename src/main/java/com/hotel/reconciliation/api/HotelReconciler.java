package com.hotel.reconciliation.api;

import com.hotel.reconciliation.audit.MatchAuditTrail;
import com.hotel.reconciliation.blocking.CandidateGenerator;
import com.hotel.reconciliation.blocking.CandidateSet;
import com.hotel.reconciliation.blocking.GridBucketKeyStrategy;
import com.hotel.reconciliation.blocking.GridNeighborhood;
import com.hotel.reconciliation.concurrent.PartitionExecutor;
import com.hotel.reconciliation.core.model.ConsolidatedHotel;
import com.hotel.reconciliation.core.model.DataQualityWarning;
import com.hotel.reconciliation.core.model.EnrichedHotel;
import com.hotel.reconciliation.core.model.NormalizedListing;
import com.hotel.reconciliation.core.model.RawListing;
import com.hotel.reconciliation.core.model.Source;
import com.hotel.reconciliation.decision.MatchDecision;
import com.hotel.reconciliation.enrich.Enricher;
import com.hotel.reconciliation.enrich.InsufficientDataException;
import com.hotel.reconciliation.filter.FilterCriteria;
import com.hotel.reconciliation.filter.FilterEngine;
import com.hotel.reconciliation.logging.LogContext;
import com.hotel.reconciliation.matching.CandidatePair;
import com.hotel.reconciliation.matching.Matcher;
import com.hotel.reconciliation.merge.Consolidator;
import com.hotel.reconciliation.metrics.MetricsService;
import com.hotel.reconciliation.metrics.NoOpMetricsService;
import com.hotel.reconciliation.normalize.ListingNormalizer;
import com.hotel.reconciliation.normalize.NameCleaner;
import com.hotel.reconciliation.similarity.SimilarityAlgorithms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Main entry point: reconciles the listings of two platforms into one ranked hotel set.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * HotelReconciler reconciler = HotelReconciler.builder()
 *     .options(ReconciliationOptions.builder()
 *         .nameThreshold(0.8)
 *         .distanceThresholdKm(0.2)
 *         .ratingScale(Source.A, RatingScale.fivePoint())
 *         .build())
 *     .build();
 *
 * ReconciliationResult result = reconciler.reconcile(bookingListings, agodaListings);
 * result.getRankedView().forEach(hotel -&gt; ...);
 * </pre>
 *
 * <p>Each call is an independent batch run; the reconciler keeps no state between runs and
 * can be shared between threads.</p>
 */
public class HotelReconciler {
    private static final Logger log = LoggerFactory.getLogger(HotelReconciler.class);

    private final ReconciliationOptions options;
    private final MetricsService metricsService;
    private final ListingNormalizer normalizer;
    private final CandidateGenerator candidateGenerator;
    private final Matcher matcher;
    private final Consolidator consolidator;
    private final Enricher enricher;
    private final FilterEngine filterEngine;

    private HotelReconciler(Builder builder) {
        this.options = builder.options;
        this.metricsService = builder.metricsService;
        this.normalizer = new ListingNormalizer(
                new NameCleaner(options.getNoiseTokens()),
                options.getRatingScales(),
                new GridBucketKeyStrategy(options.getGridCellSizeDegrees(), options.isUseNameToken()));
        this.candidateGenerator = new CandidateGenerator(
                GridNeighborhood.covering(options.getGridCellSizeDegrees(), options.getSearchRadiusKm()));
        this.matcher = new Matcher(
                SimilarityAlgorithms.forName(options.getSimilarityAlgorithm(), options.getSimilarityWeights()),
                options.getMatchingStrategy());
        this.consolidator = new Consolidator(options.getCityCenter());
        this.enricher = new Enricher(options.getPopularityBreakpoints(), options.getLocationBreakpoints());
        this.filterEngine = new FilterEngine();
    }

    /**
     * Runs the whole pipeline on one query's listings.
     *
     * @param sourceA listings of the first platform, tagged {@link Source#A}
     * @param sourceB listings of the second platform, tagged {@link Source#B}
     * @throws IllegalArgumentException when a listing carries the wrong source tag
     */
    public ReconciliationResult reconcile(List<RawListing> sourceA, List<RawListing> sourceB) {
        Objects.requireNonNull(sourceA, "sourceA is required");
        Objects.requireNonNull(sourceB, "sourceB is required");
        List<RawListing> listingsA = positioned(sourceA, Source.A);
        List<RawListing> listingsB = positioned(sourceB, Source.B);

        String runId = LogContext.generateRunId();
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forRun(runId)) {
            log.info("reconciliation.started runId={} sourceA={} sourceB={} options={}",
                    runId, listingsA.size(), listingsB.size(), options);
            ReconciliationResult result;
            try (PartitionExecutor executor = PartitionExecutor.create(options.getParallelism())) {
                result = run(runId, listingsA, listingsB, executor);
            }
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            metricsService.recordReconciliationDuration(result.isEnriched(), duration);
            log.info("reconciliation.completed runId={} result={} durationMs={}",
                    runId, result, duration.toMillis());
            return result;
        }
    }

    /**
     * Re-applies business thresholds to an enriched result without rerunning matching.
     *
     * @throws InsufficientDataException when the result was not enriched
     */
    public List<EnrichedHotel> rank(ReconciliationResult result, FilterCriteria criteria, Integer topN) {
        return filterEngine.filterAndRank(result.requireEnriched(), criteria, topN);
    }

    private ReconciliationResult run(String runId, List<RawListing> listingsA, List<RawListing> listingsB,
                                     PartitionExecutor executor) {
        List<NormalizedListing> normalizedA;
        List<NormalizedListing> normalizedB;
        List<DataQualityWarning> warnings = new ArrayList<>();
        try (LogContext stage = LogContext.forStage("normalize")) {
            normalizedA = normalizer.normalizeAll(listingsA, executor, options.getChunkSize());
            normalizedB = normalizer.normalizeAll(listingsB, executor, options.getChunkSize());
            collectWarnings(normalizedA, warnings);
            collectWarnings(normalizedB, warnings);
            metricsService.incrementListingsNormalized(normalizedA.size() + normalizedB.size());
            if (!warnings.isEmpty()) {
                log.warn("normalization.warnings runId={} count={} listings={}", runId, warnings.size(),
                        normalizedA.size() + normalizedB.size());
            }
        }

        MatchAuditTrail auditTrail = new MatchAuditTrail();
        try (LogContext stage = LogContext.forStage("match")) {
            CandidateSet candidates = candidateGenerator.generate(normalizedA, normalizedB);
            List<CandidatePair> pairs = matcher.scoreAll(candidates, normalizedA, normalizedB, executor);
            metricsService.recordCandidateCount(pairs.size());
            for (CandidatePair pair : pairs) {
                metricsService.recordSimilarityScore(pair.similarity());
            }

            List<MatchDecision> decisions = matcher.decide(pairs,
                    options.getNameThreshold(), options.getDistanceThresholdKm());
            auditTrail.recordAll(decisions);
            for (MatchDecision decision : decisions) {
                if (decision.accepted()) {
                    metricsService.incrementMatchAccepted();
                } else {
                    metricsService.incrementMatchRejected(decision.rejectionReason());
                }
            }
            log.info("matching.completed runId={} candidates={} accepted={} rejections={}",
                    runId, pairs.size(), auditTrail.acceptedCount(), auditTrail.rejectionCounts());
        }

        List<ConsolidatedHotel> consolidated;
        try (LogContext stage = LogContext.forStage("consolidate")) {
            consolidated = consolidator.consolidate(normalizedA, normalizedB, auditTrail.all());
        }

        try (LogContext stage = LogContext.forStage("enrich")) {
            List<EnrichedHotel> enriched = enricher.enrich(consolidated, executor, options.getChunkSize());
            List<EnrichedHotel> ranked = filterEngine.filterAndRank(
                    enriched, options.getFilterCriteria(), options.getTopN());
            return ReconciliationResult.enriched(runId, consolidated, enriched, ranked, auditTrail, warnings);
        } catch (InsufficientDataException e) {
            log.warn("reconciliation.not-enriched runId={} hotels={} reason={}",
                    runId, consolidated.size(), e.getMessage());
            return ReconciliationResult.notEnriched(runId, consolidated, auditTrail, warnings, e);
        }
    }

    private void collectWarnings(List<NormalizedListing> listings, List<DataQualityWarning> warnings) {
        for (NormalizedListing listing : listings) {
            for (DataQualityWarning warning : listing.warnings()) {
                warnings.add(warning);
                metricsService.incrementDataWarning(warning.field());
            }
        }
    }

    /**
     * Checks source tags and re-indexes listings by their position in the sequence.
     */
    private static List<RawListing> positioned(List<RawListing> listings, Source expected) {
        List<RawListing> positioned = new ArrayList<>(listings.size());
        for (int i = 0; i < listings.size(); i++) {
            RawListing listing = Objects.requireNonNull(listings.get(i), "listing " + expected + "#" + i);
            if (listing.source() != expected) {
                throw new IllegalArgumentException("Listing at position " + i + " of the Source " + expected
                        + " sequence is tagged " + listing.source());
            }
            positioned.add(listing.withIndex(i));
        }
        return positioned;
    }

    public ReconciliationOptions getOptions() {
        return options;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ReconciliationOptions options = ReconciliationOptions.defaults();
        private MetricsService metricsService = new NoOpMetricsService();

        public Builder options(ReconciliationOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
            return this;
        }

        public HotelReconciler build() {
            return new HotelReconciler(this);
        }
    }
}
