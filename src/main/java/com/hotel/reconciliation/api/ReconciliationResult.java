package com.hotel.reconciliation.api;

import com.hotel.reconciliation.audit.MatchAuditTrail;
import com.hotel.reconciliation.core.model.ConsolidatedHotel;
import com.hotel.reconciliation.core.model.DataQualityWarning;
import com.hotel.reconciliation.core.model.EnrichedHotel;
import com.hotel.reconciliation.enrich.InsufficientDataException;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one reconciliation run.
 *
 * <p>When enrichment fails for lack of price data the consolidated hotels and the audit
 * trail are still available; the enriched views are empty and {@link #enrichmentFailure()}
 * carries the cause.</p>
 */
public class ReconciliationResult {

    private final String runId;
    private final List<ConsolidatedHotel> consolidated;
    private final List<EnrichedHotel> fullView;
    private final List<EnrichedHotel> rankedView;
    private final MatchAuditTrail auditTrail;
    private final List<DataQualityWarning> warnings;
    private final InsufficientDataException enrichmentFailure;

    private ReconciliationResult(String runId, List<ConsolidatedHotel> consolidated, List<EnrichedHotel> fullView,
                                 List<EnrichedHotel> rankedView, MatchAuditTrail auditTrail,
                                 List<DataQualityWarning> warnings, InsufficientDataException enrichmentFailure) {
        this.runId = Objects.requireNonNull(runId, "runId is required");
        this.consolidated = List.copyOf(consolidated);
        this.fullView = List.copyOf(fullView);
        this.rankedView = List.copyOf(rankedView);
        this.auditTrail = Objects.requireNonNull(auditTrail, "auditTrail is required");
        this.warnings = List.copyOf(warnings);
        this.enrichmentFailure = enrichmentFailure;
    }

    static ReconciliationResult enriched(String runId, List<ConsolidatedHotel> consolidated,
                                         List<EnrichedHotel> fullView, List<EnrichedHotel> rankedView,
                                         MatchAuditTrail auditTrail, List<DataQualityWarning> warnings) {
        return new ReconciliationResult(runId, consolidated, fullView, rankedView, auditTrail, warnings, null);
    }

    static ReconciliationResult notEnriched(String runId, List<ConsolidatedHotel> consolidated,
                                            MatchAuditTrail auditTrail, List<DataQualityWarning> warnings,
                                            InsufficientDataException failure) {
        Objects.requireNonNull(failure, "failure is required");
        return new ReconciliationResult(runId, consolidated, List.of(), List.of(), auditTrail, warnings, failure);
    }

    public String getRunId() {
        return runId;
    }

    /**
     * Consolidated hotels before enrichment. Always available.
     */
    public List<ConsolidatedHotel> getConsolidated() {
        return consolidated;
    }

    /**
     * Every enriched hotel in consolidation order; empty when enrichment failed.
     */
    public List<EnrichedHotel> getFullView() {
        return fullView;
    }

    /**
     * Hotels passing the filter criteria, ranked by value score and truncated to top N.
     */
    public List<EnrichedHotel> getRankedView() {
        return rankedView;
    }

    public MatchAuditTrail getAuditTrail() {
        return auditTrail;
    }

    public List<DataQualityWarning> getWarnings() {
        return warnings;
    }

    public boolean isEnriched() {
        return enrichmentFailure == null;
    }

    public Optional<InsufficientDataException> enrichmentFailure() {
        return Optional.ofNullable(enrichmentFailure);
    }

    /**
     * Returns the full view, rethrowing the enrichment failure if there was one.
     */
    public List<EnrichedHotel> requireEnriched() {
        if (enrichmentFailure != null) {
            throw enrichmentFailure;
        }
        return fullView;
    }

    /**
     * Enriched hotels that have no value score because they have no price.
     */
    public List<EnrichedHotel> hotelsWithoutValueScore() {
        return fullView.stream()
                .filter(hotel -> !hotel.hasValueScore())
                .toList();
    }

    public int matchedCount() {
        return (int) consolidated.stream().filter(ConsolidatedHotel::isMatched).count();
    }

    @Override
    public String toString() {
        return "ReconciliationResult{" +
                "runId='" + runId + '\'' +
                ", consolidated=" + consolidated.size() +
                ", matched=" + matchedCount() +
                ", ranked=" + rankedView.size() +
                ", decisions=" + auditTrail.size() +
                ", warnings=" + warnings.size() +
                ", enriched=" + isEnriched() +
                '}';
    }
}
