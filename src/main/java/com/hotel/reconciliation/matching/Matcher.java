package com.hotel.reconciliation.matching;

import com.hotel.reconciliation.blocking.CandidateIndexPair;
import com.hotel.reconciliation.blocking.CandidatePartition;
import com.hotel.reconciliation.blocking.CandidateSet;
import com.hotel.reconciliation.concurrent.PartitionExecutor;
import com.hotel.reconciliation.config.ConfigurationException;
import com.hotel.reconciliation.core.model.NormalizedListing;
import com.hotel.reconciliation.decision.MatchDecision;
import com.hotel.reconciliation.decision.RejectionReason;
import com.hotel.reconciliation.geo.GeoDistance;
import com.hotel.reconciliation.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Scores candidate pairs and decides which of them are matches.
 *
 * <p>A pair qualifies when its name similarity reaches the name threshold and its distance
 * does not exceed the distance threshold; both conditions are required. Qualifying pairs are
 * then reduced to a one-to-one matching: the preferred pair is the one with the highest
 * similarity, then the smallest distance, then the lowest A and B indices.</p>
 */
public class Matcher {
    private static final Logger log = LoggerFactory.getLogger(Matcher.class);

    static final Comparator<CandidatePair> PREFERENCE = Comparator
            .comparingDouble(CandidatePair::similarity).reversed()
            .thenComparingDouble(CandidatePair::distanceMeters)
            .thenComparingInt(CandidatePair::aIndex)
            .thenComparingInt(CandidatePair::bIndex);

    private final SimilarityAlgorithm similarity;
    private final MatchingStrategy strategy;

    public Matcher(SimilarityAlgorithm similarity, MatchingStrategy strategy) {
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
        this.strategy = Objects.requireNonNull(strategy, "strategy is required");
    }

    public MatchScore score(NormalizedListing a, NormalizedListing b) {
        double nameScore = similarity.compute(a.cleanedName(), b.cleanedName());
        // Guard against rounding slightly outside [0, 1]
        nameScore = Math.max(0.0, Math.min(1.0, nameScore));
        return new MatchScore(nameScore, GeoDistance.meters(a.coordinates(), b.coordinates()));
    }

    /**
     * Scores every candidate pair, one task per partition, concatenated in partition order.
     */
    public List<CandidatePair> scoreAll(CandidateSet candidates, List<NormalizedListing> sourceA,
                                        List<NormalizedListing> sourceB, PartitionExecutor executor) {
        List<List<CandidatePair>> scored = executor.map(candidates.partitions(),
                partition -> scorePartition(partition, sourceA, sourceB));
        List<CandidatePair> pairs = new ArrayList<>();
        scored.forEach(pairs::addAll);
        return pairs;
    }

    private List<CandidatePair> scorePartition(CandidatePartition partition, List<NormalizedListing> sourceA,
                                               List<NormalizedListing> sourceB) {
        List<CandidatePair> pairs = new ArrayList<>();
        for (CandidateIndexPair indices : partition) {
            NormalizedListing a = sourceA.get(indices.aIndex());
            NormalizedListing b = sourceB.get(indices.bIndex());
            pairs.add(new CandidatePair(a, b, score(a, b)));
        }
        return pairs;
    }

    /**
     * Decides every pair. Returns exactly one decision per pair, in input order.
     *
     * @throws ConfigurationException when a threshold is out of range
     */
    public List<MatchDecision> decide(List<CandidatePair> pairs, double nameThreshold, double distanceThresholdKm) {
        validateThresholds(nameThreshold, distanceThresholdKm);
        double maxMeters = distanceThresholdKm * 1000.0;

        List<CandidatePair> qualifying = new ArrayList<>();
        for (CandidatePair pair : pairs) {
            if (passesName(pair, nameThreshold) && passesDistance(pair, maxMeters)) {
                qualifying.add(pair);
            }
        }
        qualifying.sort(PREFERENCE);

        Claims claims = claimGreedily(qualifying);
        int greedyMatches = claims.size();
        if (strategy == MatchingStrategy.MAXIMUM) {
            augment(qualifying, claims);
        }
        log.debug("matching.reduced pairs={} qualifying={} greedyMatches={} finalMatches={} strategy={}",
                pairs.size(), qualifying.size(), greedyMatches, claims.size(), strategy);

        List<MatchDecision> decisions = new ArrayList<>(pairs.size());
        for (CandidatePair pair : pairs) {
            MatchDecision.Builder builder = MatchDecision.builder()
                    .aIndex(pair.aIndex())
                    .bIndex(pair.bIndex())
                    .aName(pair.a().cleanedName())
                    .bName(pair.b().cleanedName())
                    .similarity(pair.similarity())
                    .distanceMeters(pair.distanceMeters())
                    .nameThreshold(nameThreshold)
                    .distanceThresholdKm(distanceThresholdKm);

            boolean namePassed = passesName(pair, nameThreshold);
            boolean distancePassed = passesDistance(pair, maxMeters);
            if (!namePassed || !distancePassed) {
                builder.rejected(RejectionReason.forThresholds(namePassed, distancePassed));
            } else if (claims.holds(pair)) {
                builder.accepted();
            } else if (claims.isClaimedB(pair.bIndex())) {
                builder.rejected(RejectionReason.SOURCE_B_CLAIMED);
            } else {
                builder.rejected(RejectionReason.SOURCE_A_MATCHED);
            }
            decisions.add(builder.build());
        }
        return decisions;
    }

    public static void validateThresholds(double nameThreshold, double distanceThresholdKm) {
        if (Double.isNaN(nameThreshold) || nameThreshold < 0.0 || nameThreshold > 1.0) {
            throw new ConfigurationException("name similarity threshold must be between 0.0 and 1.0, got "
                    + nameThreshold);
        }
        if (Double.isNaN(distanceThresholdKm) || distanceThresholdKm < 0.0 || Double.isInfinite(distanceThresholdKm)) {
            throw new ConfigurationException("distance threshold must be a finite number of km >= 0, got "
                    + distanceThresholdKm);
        }
    }

    public MatchingStrategy getStrategy() {
        return strategy;
    }

    public SimilarityAlgorithm getSimilarity() {
        return similarity;
    }

    private static boolean passesName(CandidatePair pair, double nameThreshold) {
        return pair.similarity() >= nameThreshold;
    }

    private static boolean passesDistance(CandidatePair pair, double maxMeters) {
        return pair.distanceMeters() <= maxMeters;
    }

    private static Claims claimGreedily(List<CandidatePair> qualifying) {
        Claims claims = new Claims();
        for (CandidatePair pair : qualifying) {
            if (!claims.isClaimedA(pair.aIndex()) && !claims.isClaimedB(pair.bIndex())) {
                claims.assign(pair);
            }
        }
        return claims;
    }

    /**
     * Kuhn's augmenting paths over the qualifying pairs, starting from the greedy claims.
     * Each unmatched A listing is tried once, in index order; edges are tried in preference order.
     */
    private static void augment(List<CandidatePair> qualifying, Claims claims) {
        Map<Integer, List<CandidatePair>> edgesByA = new TreeMap<>();
        for (CandidatePair pair : qualifying) {
            edgesByA.computeIfAbsent(pair.aIndex(), k -> new ArrayList<>()).add(pair);
        }
        for (Integer aIndex : edgesByA.keySet()) {
            if (!claims.isClaimedA(aIndex)) {
                tryAugment(aIndex, edgesByA, claims, new HashSet<>());
            }
        }
    }

    private static boolean tryAugment(int aIndex, Map<Integer, List<CandidatePair>> edgesByA,
                                      Claims claims, Set<Integer> visitedB) {
        for (CandidatePair edge : edgesByA.getOrDefault(aIndex, List.of())) {
            if (!visitedB.add(edge.bIndex())) {
                continue;
            }
            CandidatePair holder = claims.holderOfB(edge.bIndex());
            if (holder == null || tryAugment(holder.aIndex(), edgesByA, claims, visitedB)) {
                claims.assign(edge);
                return true;
            }
        }
        return false;
    }

    /**
     * Claimed listings on both sides. Local to a single {@link #decide} call.
     */
    private static final class Claims {
        private final Map<Integer, CandidatePair> byA = new HashMap<>();
        private final Map<Integer, CandidatePair> byB = new HashMap<>();

        void assign(CandidatePair pair) {
            byA.put(pair.aIndex(), pair);
            byB.put(pair.bIndex(), pair);
        }

        boolean isClaimedA(int aIndex) {
            return byA.containsKey(aIndex);
        }

        boolean isClaimedB(int bIndex) {
            return byB.containsKey(bIndex);
        }

        CandidatePair holderOfB(int bIndex) {
            return byB.get(bIndex);
        }

        boolean holds(CandidatePair pair) {
            CandidatePair held = byA.get(pair.aIndex());
            return held != null && held.bIndex() == pair.bIndex();
        }

        int size() {
            return byA.size();
        }
    }
}
