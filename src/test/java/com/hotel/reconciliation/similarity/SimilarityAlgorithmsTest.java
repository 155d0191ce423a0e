package com.hotel.reconciliation.similarity;

import com.hotel.reconciliation.config.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Similarity algorithm Tests")
class SimilarityAlgorithmsTest {

    @Nested
    @DisplayName("Levenshtein")
    class Levenshtein {
        private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();

        @Test
        void editDistance() {
            assertEquals(3, LevenshteinSimilarity.distance("kitten", "sitting"));
            assertEquals(0, LevenshteinSimilarity.distance("", ""));
            assertEquals(5, LevenshteinSimilarity.distance("", "plaza"));
        }

        @Test
        void normalizedByLongerName() {
            assertEquals(1.0 - 3.0 / 7.0, similarity.compute("kitten", "sitting"), 1e-9);
            assertEquals(1.0, similarity.compute("", ""));
            assertEquals(0.0, similarity.compute("", "plaza"));
            assertEquals(0.0, similarity.compute(null, "plaza"));
        }
    }

    @Nested
    @DisplayName("Token sort")
    class TokenSort {
        private final TokenSortSimilarity similarity = new TokenSortSimilarity();

        @Test
        @DisplayName("Word order does not matter")
        void wordOrderIgnored() {
            assertEquals(1.0, similarity.compute("plaza lisboa", "lisboa plaza"));
        }

        @Test
        @DisplayName("Spelling differences are still penalized")
        void spellingPenalized() {
            double score = similarity.compute("plaza lisboa", "lisbon plaza");

            assertTrue(score < 1.0);
            assertTrue(score > 0.8);
        }
    }

    @Nested
    @DisplayName("Jaccard")
    class Jaccard {
        private final JaccardSimilarity similarity = new JaccardSimilarity();

        @Test
        void tokenOverlap() {
            assertEquals(2.0 / 3.0, similarity.compute("casa azul lisboa", "azul casa"), 1e-9);
            assertEquals(0.0, similarity.compute("casa", "palacio"));
            assertEquals(1.0, similarity.compute("", ""));
        }
    }

    @Nested
    @DisplayName("Jaro-Winkler")
    class JaroWinkler {
        private final JaroWinklerSimilarity similarity = new JaroWinklerSimilarity();

        @Test
        void classicExample() {
            assertEquals(0.9611, similarity.compute("martha", "marhta"), 1e-4);
            assertEquals(1.0, similarity.compute("casa", "casa"));
            assertEquals(0.0, similarity.compute("abc", "xyz"));
        }

        @Test
        void rejectsInvalidScalingFactor() {
            assertThrows(IllegalArgumentException.class, () -> new JaroWinklerSimilarity(0.3));
        }
    }

    @Nested
    @DisplayName("Composite")
    class Composite {

        @Test
        @DisplayName("Identical names score 1")
        void identical() {
            assertEquals(1.0, new CompositeSimilarityScorer().compute("plaza", "plaza"));
        }

        @Test
        @DisplayName("Score is the weighted sum of the components")
        void weightedSum() {
            CompositeSimilarityScorer scorer = new CompositeSimilarityScorer(new SimilarityWeights(0.0, 0.0, 1.0));

            assertEquals(2.0 / 3.0, scorer.compute("casa azul lisboa", "azul casa"), 1e-9);
        }

        @Test
        @DisplayName("Weights must be non-negative and sum to 1")
        void weightValidation() {
            assertThrows(ConfigurationException.class, () -> new SimilarityWeights(0.5, 0.5, 0.5));
            assertThrows(ConfigurationException.class, () -> new SimilarityWeights(-0.2, 0.6, 0.6));
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"levenshtein", "token-sort", "jaro-winkler", "jaccard", "composite"})
    @DisplayName("Every configured algorithm is symmetric and bounded")
    void symmetricAndBounded(String name) {
        SimilarityAlgorithm algorithm = SimilarityAlgorithms.forName(name, null);
        String[][] pairs = {
                {"plaza", "plaza lisboa"},
                {"casa azul", "azul"},
                {"pestana palace", "palace pestana lisboa"},
                {"", "eden"}
        };

        assertEquals(name, algorithm.getName());
        for (String[] pair : pairs) {
            double forward = algorithm.compute(pair[0], pair[1]);
            double backward = algorithm.compute(pair[1], pair[0]);
            assertEquals(forward, backward, 1e-12);
            assertTrue(forward >= 0.0 && forward <= 1.0);
        }
    }

    @Test
    @DisplayName("Algorithm names are case-insensitive and unknown names are a configuration error")
    void forName() {
        assertInstanceOf(TokenSortSimilarity.class, SimilarityAlgorithms.forName(" Token-Sort ", null));
        assertThrows(ConfigurationException.class, () -> SimilarityAlgorithms.forName("soundex", null));
        assertThrows(ConfigurationException.class, () -> SimilarityAlgorithms.forName(null, null));
    }
}
