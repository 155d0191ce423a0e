package com.hotel.reconciliation.api;

import com.hotel.reconciliation.config.ConfigurationException;
import com.hotel.reconciliation.core.model.GeoPoint;
import com.hotel.reconciliation.core.model.LocationCategory;
import com.hotel.reconciliation.core.model.PopularityTier;
import com.hotel.reconciliation.core.model.Source;
import com.hotel.reconciliation.enrich.Breakpoints;
import com.hotel.reconciliation.filter.FilterCriteria;
import com.hotel.reconciliation.matching.Matcher;
import com.hotel.reconciliation.matching.MatchingStrategy;
import com.hotel.reconciliation.normalize.RatingScale;
import com.hotel.reconciliation.rules.HotelNameRules;
import com.hotel.reconciliation.similarity.SimilarityAlgorithms;
import com.hotel.reconciliation.similarity.SimilarityWeights;
import com.hotel.reconciliation.similarity.TokenSortSimilarity;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Options for a reconciliation run.
 * Every value is validated when the options are built, so a run never starts with an
 * invalid configuration; violations raise {@link ConfigurationException}.
 */
public class ReconciliationOptions {

    private static final double DEFAULT_NAME_THRESHOLD = 0.85;
    private static final double DEFAULT_DISTANCE_THRESHOLD_KM = 0.3;
    private static final double DEFAULT_GRID_CELL_SIZE_DEGREES = 0.01;
    private static final double DEFAULT_SEARCH_RADIUS_FACTOR = 10.0;
    private static final int DEFAULT_TOP_N = 10;
    private static final int DEFAULT_CHUNK_SIZE = 500;

    private final List<String> noiseTokens;
    private final double gridCellSizeDegrees;
    private final boolean useNameToken;
    private final double searchRadiusFactor;
    private final double nameThreshold;
    private final double distanceThresholdKm;
    private final String similarityAlgorithm;
    private final SimilarityWeights similarityWeights;
    private final MatchingStrategy matchingStrategy;
    private final Map<Source, RatingScale> ratingScales;
    private final Breakpoints popularityBreakpoints;
    private final Breakpoints locationBreakpoints;
    private final GeoPoint cityCenter;
    private final FilterCriteria filterCriteria;
    private final Integer topN;
    private final int parallelism;
    private final int chunkSize;

    private ReconciliationOptions(Builder builder) {
        this.noiseTokens = List.copyOf(builder.noiseTokens);
        this.gridCellSizeDegrees = builder.gridCellSizeDegrees;
        this.useNameToken = builder.useNameToken;
        this.searchRadiusFactor = builder.searchRadiusFactor;
        this.nameThreshold = builder.nameThreshold;
        this.distanceThresholdKm = builder.distanceThresholdKm;
        this.similarityAlgorithm = builder.similarityAlgorithm;
        this.similarityWeights = builder.similarityWeights;
        this.matchingStrategy = builder.matchingStrategy;
        this.ratingScales = Map.copyOf(builder.ratingScales);
        this.popularityBreakpoints = builder.popularityBreakpoints;
        this.locationBreakpoints = builder.locationBreakpoints;
        this.cityCenter = builder.cityCenter;
        this.filterCriteria = builder.filterCriteria;
        this.topN = builder.topN;
        this.parallelism = builder.parallelism;
        this.chunkSize = builder.chunkSize;
    }

    public List<String> getNoiseTokens() {
        return noiseTokens;
    }

    public double getGridCellSizeDegrees() {
        return gridCellSizeDegrees;
    }

    public boolean isUseNameToken() {
        return useNameToken;
    }

    public double getSearchRadiusFactor() {
        return searchRadiusFactor;
    }

    /**
     * Candidate search radius: the distance threshold times {@link #getSearchRadiusFactor()}.
     * Pairs inside the radius are compared and audited even when they fail the distance threshold.
     */
    public double getSearchRadiusKm() {
        return distanceThresholdKm * searchRadiusFactor;
    }

    public double getNameThreshold() {
        return nameThreshold;
    }

    public double getDistanceThresholdKm() {
        return distanceThresholdKm;
    }

    public String getSimilarityAlgorithm() {
        return similarityAlgorithm;
    }

    public SimilarityWeights getSimilarityWeights() {
        return similarityWeights;
    }

    public MatchingStrategy getMatchingStrategy() {
        return matchingStrategy;
    }

    public Map<Source, RatingScale> getRatingScales() {
        return ratingScales;
    }

    public RatingScale getRatingScale(Source source) {
        return ratingScales.get(source);
    }

    public Breakpoints getPopularityBreakpoints() {
        return popularityBreakpoints;
    }

    public Breakpoints getLocationBreakpoints() {
        return locationBreakpoints;
    }

    /**
     * City center used to recompute distances, or null to carry platform-reported distances.
     */
    public GeoPoint getCityCenter() {
        return cityCenter;
    }

    public FilterCriteria getFilterCriteria() {
        return filterCriteria;
    }

    /**
     * Size of the ranked view, or null for no truncation.
     */
    public Integer getTopN() {
        return topN;
    }

    public int getParallelism() {
        return parallelism;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Returns a builder pre-filled with these options.
     */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .noiseTokens(noiseTokens)
                .gridCellSizeDegrees(gridCellSizeDegrees)
                .useNameToken(useNameToken)
                .searchRadiusFactor(searchRadiusFactor)
                .nameThreshold(nameThreshold)
                .distanceThresholdKm(distanceThresholdKm)
                .similarityAlgorithm(similarityAlgorithm)
                .similarityWeights(similarityWeights)
                .matchingStrategy(matchingStrategy)
                .popularityBreakpoints(popularityBreakpoints)
                .locationBreakpoints(locationBreakpoints)
                .cityCenter(cityCenter)
                .filterCriteria(filterCriteria)
                .topN(topN)
                .parallelism(parallelism)
                .chunkSize(chunkSize);
        ratingScales.forEach(builder::ratingScale);
        return builder;
    }

    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<String> noiseTokens = HotelNameRules.DEFAULT_NOISE_TOKENS;
        private double gridCellSizeDegrees = DEFAULT_GRID_CELL_SIZE_DEGREES;
        private boolean useNameToken = true;
        private double searchRadiusFactor = DEFAULT_SEARCH_RADIUS_FACTOR;
        private double nameThreshold = DEFAULT_NAME_THRESHOLD;
        private double distanceThresholdKm = DEFAULT_DISTANCE_THRESHOLD_KM;
        private String similarityAlgorithm = TokenSortSimilarity.NAME;
        private SimilarityWeights similarityWeights = SimilarityWeights.defaultWeights();
        private MatchingStrategy matchingStrategy = MatchingStrategy.MAXIMUM;
        private final Map<Source, RatingScale> ratingScales = new EnumMap<>(Map.of(
                Source.A, RatingScale.tenPoint(),
                Source.B, RatingScale.tenPoint()));
        private Breakpoints popularityBreakpoints = Breakpoints.defaultPopularity();
        private Breakpoints locationBreakpoints = Breakpoints.defaultLocation();
        private GeoPoint cityCenter;
        private FilterCriteria filterCriteria = FilterCriteria.none();
        private Integer topN = DEFAULT_TOP_N;
        private int parallelism = 1;
        private int chunkSize = DEFAULT_CHUNK_SIZE;

        public Builder noiseTokens(List<String> noiseTokens) {
            if (noiseTokens == null) {
                throw new ConfigurationException("noiseTokens must not be null; use an empty list to disable");
            }
            if (noiseTokens.stream().anyMatch(Objects::isNull)) {
                throw new ConfigurationException("noiseTokens must not contain null entries");
            }
            this.noiseTokens = noiseTokens;
            return this;
        }

        public Builder gridCellSizeDegrees(double gridCellSizeDegrees) {
            if (!Double.isFinite(gridCellSizeDegrees) || gridCellSizeDegrees <= 0.0) {
                throw new ConfigurationException("gridCellSizeDegrees must be > 0, got " + gridCellSizeDegrees);
            }
            this.gridCellSizeDegrees = gridCellSizeDegrees;
            return this;
        }

        public Builder useNameToken(boolean useNameToken) {
            this.useNameToken = useNameToken;
            return this;
        }

        /**
         * Multiple of the distance threshold searched for candidates; at least 1.
         */
        public Builder searchRadiusFactor(double searchRadiusFactor) {
            if (!Double.isFinite(searchRadiusFactor) || searchRadiusFactor < 1.0) {
                throw new ConfigurationException("searchRadiusFactor must be >= 1, got " + searchRadiusFactor);
            }
            this.searchRadiusFactor = searchRadiusFactor;
            return this;
        }

        public Builder nameThreshold(double nameThreshold) {
            Matcher.validateThresholds(nameThreshold, 0.0);
            this.nameThreshold = nameThreshold;
            return this;
        }

        public Builder distanceThresholdKm(double distanceThresholdKm) {
            Matcher.validateThresholds(0.0, distanceThresholdKm);
            this.distanceThresholdKm = distanceThresholdKm;
            return this;
        }

        public Builder similarityAlgorithm(String similarityAlgorithm) {
            this.similarityAlgorithm = similarityAlgorithm;
            return this;
        }

        public Builder similarityWeights(SimilarityWeights similarityWeights) {
            this.similarityWeights = similarityWeights;
            return this;
        }

        public Builder matchingStrategy(MatchingStrategy matchingStrategy) {
            if (matchingStrategy == null) {
                throw new ConfigurationException("matchingStrategy must not be null");
            }
            this.matchingStrategy = matchingStrategy;
            return this;
        }

        public Builder ratingScale(Source source, RatingScale scale) {
            Objects.requireNonNull(source, "source is required");
            if (scale == null) {
                throw new ConfigurationException("rating scale for source " + source + " must not be null");
            }
            this.ratingScales.put(source, scale);
            return this;
        }

        public Builder popularityBreakpoints(Breakpoints popularityBreakpoints) {
            this.popularityBreakpoints = popularityBreakpoints;
            return this;
        }

        public Builder locationBreakpoints(Breakpoints locationBreakpoints) {
            this.locationBreakpoints = locationBreakpoints;
            return this;
        }

        public Builder cityCenter(GeoPoint cityCenter) {
            if (cityCenter != null && !GeoPoint.isValid(cityCenter.latitude(), cityCenter.longitude())) {
                throw new ConfigurationException("cityCenter is not a valid coordinate: " + cityCenter);
            }
            this.cityCenter = cityCenter;
            return this;
        }

        public Builder filterCriteria(FilterCriteria filterCriteria) {
            this.filterCriteria = filterCriteria != null ? filterCriteria : FilterCriteria.none();
            return this;
        }

        public Builder topN(Integer topN) {
            if (topN != null && topN < 1) {
                throw new ConfigurationException("topN must be >= 1, got " + topN);
            }
            this.topN = topN;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new ConfigurationException("parallelism must be >= 1, got " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder chunkSize(int chunkSize) {
            if (chunkSize < 1) {
                throw new ConfigurationException("chunkSize must be >= 1, got " + chunkSize);
            }
            this.chunkSize = chunkSize;
            return this;
        }

        public ReconciliationOptions build() {
            if (similarityWeights == null) {
                throw new ConfigurationException("similarityWeights must not be null");
            }
            // Fails on unknown names
            SimilarityAlgorithms.forName(similarityAlgorithm, similarityWeights);
            if (popularityBreakpoints == null || popularityBreakpoints.size() != PopularityTier.values().length - 1) {
                throw new ConfigurationException("popularity breakpoints need exactly "
                        + (PopularityTier.values().length - 1) + " values");
            }
            if (locationBreakpoints == null || locationBreakpoints.size() != LocationCategory.orderedCount() - 1) {
                throw new ConfigurationException("location breakpoints need exactly "
                        + (LocationCategory.orderedCount() - 1) + " values");
            }
            try {
                HotelNameRules.createEngine(noiseTokens);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid noise tokens " + noiseTokens + ": " + e.getMessage(), e);
            }
            return new ReconciliationOptions(this);
        }
    }

    @Override
    public String toString() {
        return "ReconciliationOptions{" +
                "nameThreshold=" + nameThreshold +
                ", distanceThresholdKm=" + distanceThresholdKm +
                ", gridCellSizeDegrees=" + gridCellSizeDegrees +
                ", useNameToken=" + useNameToken +
                ", searchRadiusFactor=" + searchRadiusFactor +
                ", similarityAlgorithm='" + similarityAlgorithm + '\'' +
                ", matchingStrategy=" + matchingStrategy +
                ", ratingScales=" + ratingScales +
                ", cityCenter=" + cityCenter +
                ", filterCriteria=" + filterCriteria +
                ", topN=" + topN +
                ", parallelism=" + parallelism +
                '}';
    }
}
