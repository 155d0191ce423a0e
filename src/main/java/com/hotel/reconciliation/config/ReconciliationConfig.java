package com.hotel.reconciliation.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * JSON shape of a reconciliation configuration file. Absent values keep their defaults.
 *
 * <pre>
 * {
 *   "noiseTokens": ["hotel", "resort"],
 *   "blocking": {"gridCellSizeDegrees": 0.01, "useNameToken": true, "searchRadiusFactor": 10},
 *   "matching": {"nameThreshold": 0.85, "distanceThresholdKm": 0.3, "similarityAlgorithm": "token-sort"},
 *   "ratingScales": {"A": {"min": 0, "max": 5}},
 *   "enrichment": {"popularityBreakpoints": [50, 300, 1000], "locationBreakpoints": [1, 3, 8]},
 *   "filter": {"maxPrice": 150, "minRating": 8},
 *   "topN": 10
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReconciliationConfig(
        @JsonProperty("noiseTokens") List<String> noiseTokens,
        @JsonProperty("blocking") Blocking blocking,
        @JsonProperty("matching") Matching matching,
        @JsonProperty("ratingScales") Map<String, Scale> ratingScales,
        @JsonProperty("enrichment") Enrichment enrichment,
        @JsonProperty("filter") Filter filter,
        @JsonProperty("topN") Integer topN,
        @JsonProperty("parallelism") Integer parallelism,
        @JsonProperty("chunkSize") Integer chunkSize
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Blocking(
            @JsonProperty("gridCellSizeDegrees") Double gridCellSizeDegrees,
            @JsonProperty("useNameToken") Boolean useNameToken,
            @JsonProperty("searchRadiusFactor") Double searchRadiusFactor
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Matching(
            @JsonProperty("nameThreshold") Double nameThreshold,
            @JsonProperty("distanceThresholdKm") Double distanceThresholdKm,
            @JsonProperty("similarityAlgorithm") String similarityAlgorithm,
            @JsonProperty("strategy") String strategy,
            @JsonProperty("weights") Weights weights
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Weights(
            @JsonProperty("levenshtein") double levenshtein,
            @JsonProperty("tokenSort") double tokenSort,
            @JsonProperty("jaccard") double jaccard
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Scale(
            @JsonProperty("min") double min,
            @JsonProperty("max") double max
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Enrichment(
            @JsonProperty("popularityBreakpoints") List<Double> popularityBreakpoints,
            @JsonProperty("locationBreakpoints") List<Double> locationBreakpoints,
            @JsonProperty("cityCenter") Point cityCenter
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Point(
            @JsonProperty("latitude") double latitude,
            @JsonProperty("longitude") double longitude
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Filter(
            @JsonProperty("maxPrice") Double maxPrice,
            @JsonProperty("maxDistanceKm") Double maxDistanceKm,
            @JsonProperty("minRating") Double minRating,
            @JsonProperty("minReviews") Integer minReviews
    ) {}
}
