package com.hotel.reconciliation.audit;

import com.hotel.reconciliation.core.model.Source;
import com.hotel.reconciliation.decision.MatchDecision;
import com.hotel.reconciliation.decision.RejectionReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only record of every evaluated candidate pair of a run.
 * Decisions are never removed or replaced once recorded.
 */
public class MatchAuditTrail {
    private static final Logger log = LoggerFactory.getLogger(MatchAuditTrail.class);

    private final List<MatchDecision> decisions = new CopyOnWriteArrayList<>();

    public MatchAuditTrail() {
    }

    public MatchAuditTrail(List<MatchDecision> decisions) {
        recordAll(decisions);
    }

    public MatchDecision record(MatchDecision decision) {
        decisions.add(decision);
        log.trace("match.audited a={} b={} accepted={} reason={}", decision.aIndex(), decision.bIndex(),
                decision.accepted(), decision.rejectionReason());
        return decision;
    }

    public void recordAll(List<MatchDecision> batch) {
        decisions.addAll(batch);
    }

    /**
     * Gets all decisions in recording order (immutable snapshot).
     */
    public List<MatchDecision> all() {
        return Collections.unmodifiableList(new ArrayList<>(decisions));
    }

    public List<MatchDecision> accepted() {
        return decisions.stream()
                .filter(MatchDecision::accepted)
                .collect(Collectors.toList());
    }

    public List<MatchDecision> rejected() {
        return decisions.stream()
                .filter(MatchDecision::isRejected)
                .collect(Collectors.toList());
    }

    public List<MatchDecision> byReason(RejectionReason reason) {
        return decisions.stream()
                .filter(d -> d.rejectionReason() == reason)
                .collect(Collectors.toList());
    }

    /**
     * Gets every decision the given listing took part in.
     */
    public List<MatchDecision> forListing(Source source, int index) {
        return decisions.stream()
                .filter(d -> (source == Source.A ? d.aIndex() : d.bIndex()) == index)
                .collect(Collectors.toList());
    }

    /**
     * Counts rejections per reason; reasons that never occurred are absent.
     */
    public Map<RejectionReason, Long> rejectionCounts() {
        Map<RejectionReason, Long> counts = new EnumMap<>(RejectionReason.class);
        for (MatchDecision decision : decisions) {
            if (decision.isRejected()) {
                counts.merge(decision.rejectionReason(), 1L, Long::sum);
            }
        }
        return counts;
    }

    public int acceptedCount() {
        return (int) decisions.stream().filter(MatchDecision::accepted).count();
    }

    public int size() {
        return decisions.size();
    }
}
