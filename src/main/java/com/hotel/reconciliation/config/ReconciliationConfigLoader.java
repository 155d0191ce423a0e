package com.hotel.reconciliation.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hotel.reconciliation.api.ReconciliationOptions;
import com.hotel.reconciliation.core.model.GeoPoint;
import com.hotel.reconciliation.core.model.Source;
import com.hotel.reconciliation.enrich.Breakpoints;
import com.hotel.reconciliation.filter.FilterCriteria;
import com.hotel.reconciliation.matching.MatchingStrategy;
import com.hotel.reconciliation.normalize.RatingScale;
import com.hotel.reconciliation.similarity.SimilarityWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Reads {@link ReconciliationOptions} from JSON.
 * Any unreadable or invalid file surfaces as {@link ConfigurationException}.
 */
public class ReconciliationConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationConfigLoader.class);

    public static final String DEFAULTS_RESOURCE = "/reconciliation-defaults.json";

    private final ObjectMapper objectMapper;

    public ReconciliationConfigLoader() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
    }

    /**
     * Loads the defaults bundled on the classpath.
     */
    public ReconciliationOptions loadDefaults() {
        try (InputStream input = ReconciliationConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (input == null) {
                throw new ConfigurationException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            return load(input);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + DEFAULTS_RESOURCE, e);
        }
    }

    public ReconciliationOptions load(Path path) {
        try (InputStream input = Files.newInputStream(path)) {
            ReconciliationOptions options = load(input);
            log.info("config.loaded path={}", path);
            return options;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + path, e);
        }
    }

    public ReconciliationOptions load(InputStream input) {
        return toOptions(read(input));
    }

    public ReconciliationConfig read(InputStream input) {
        try {
            ReconciliationConfig config = objectMapper.readValue(input, ReconciliationConfig.class);
            if (config == null) {
                throw new ConfigurationException("Configuration document is empty");
            }
            return config;
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed configuration: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration", e);
        }
    }

    /**
     * Overlays the present values of {@code config} on the built-in defaults.
     */
    public ReconciliationOptions toOptions(ReconciliationConfig config) {
        ReconciliationOptions.Builder builder = ReconciliationOptions.builder();
        if (config.noiseTokens() != null) {
            builder.noiseTokens(config.noiseTokens());
        }

        ReconciliationConfig.Blocking blocking = config.blocking();
        if (blocking != null) {
            if (blocking.gridCellSizeDegrees() != null) {
                builder.gridCellSizeDegrees(blocking.gridCellSizeDegrees());
            }
            if (blocking.useNameToken() != null) {
                builder.useNameToken(blocking.useNameToken());
            }
            if (blocking.searchRadiusFactor() != null) {
                builder.searchRadiusFactor(blocking.searchRadiusFactor());
            }
        }

        ReconciliationConfig.Matching matching = config.matching();
        if (matching != null) {
            if (matching.nameThreshold() != null) {
                builder.nameThreshold(matching.nameThreshold());
            }
            if (matching.distanceThresholdKm() != null) {
                builder.distanceThresholdKm(matching.distanceThresholdKm());
            }
            if (matching.similarityAlgorithm() != null) {
                builder.similarityAlgorithm(matching.similarityAlgorithm());
            }
            if (matching.strategy() != null) {
                builder.matchingStrategy(parseStrategy(matching.strategy()));
            }
            if (matching.weights() != null) {
                ReconciliationConfig.Weights w = matching.weights();
                builder.similarityWeights(new SimilarityWeights(w.levenshtein(), w.tokenSort(), w.jaccard()));
            }
        }

        if (config.ratingScales() != null) {
            for (Map.Entry<String, ReconciliationConfig.Scale> entry : config.ratingScales().entrySet()) {
                ReconciliationConfig.Scale scale = entry.getValue();
                if (scale == null) {
                    throw new ConfigurationException("Rating scale for source " + entry.getKey() + " is empty");
                }
                builder.ratingScale(parseSource(entry.getKey()), new RatingScale(scale.min(), scale.max()));
            }
        }

        ReconciliationConfig.Enrichment enrichment = config.enrichment();
        if (enrichment != null) {
            if (enrichment.popularityBreakpoints() != null) {
                builder.popularityBreakpoints(new Breakpoints(enrichment.popularityBreakpoints()));
            }
            if (enrichment.locationBreakpoints() != null) {
                builder.locationBreakpoints(new Breakpoints(enrichment.locationBreakpoints()));
            }
            if (enrichment.cityCenter() != null) {
                builder.cityCenter(GeoPoint.of(enrichment.cityCenter().latitude(), enrichment.cityCenter().longitude()));
            }
        }

        ReconciliationConfig.Filter filter = config.filter();
        if (filter != null) {
            builder.filterCriteria(new FilterCriteria(
                    filter.maxPrice(), filter.maxDistanceKm(), filter.minRating(), filter.minReviews()));
        }
        if (config.topN() != null) {
            builder.topN(config.topN());
        }
        if (config.parallelism() != null) {
            builder.parallelism(config.parallelism());
        }
        if (config.chunkSize() != null) {
            builder.chunkSize(config.chunkSize());
        }
        return builder.build();
    }

    private static MatchingStrategy parseStrategy(String value) {
        try {
            return MatchingStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown matching strategy '" + value + "'", e);
        }
    }

    private static Source parseSource(String value) {
        try {
            return Source.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown source '" + value + "', expected A or B", e);
        }
    }
}
