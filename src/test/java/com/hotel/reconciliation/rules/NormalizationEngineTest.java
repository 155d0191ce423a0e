package com.hotel.reconciliation.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    @Test
    @DisplayName("Null and blank names normalize to the empty string")
    void nullAndBlank() {
        NormalizationEngine engine = new NormalizationEngine(List.of());

        assertEquals("", engine.normalize(null));
        assertEquals("", engine.normalize("   "));
    }

    @ParameterizedTest
    @CsvSource({
            "Hôtel Éden, hotel eden",
            "CAFÉ São Bento, cafe sao bento",
            "Ångström, angstrom",
            "Plain, plain"
    })
    @DisplayName("fold lowercases and strips diacritics")
    void foldStripsDiacritics(String input, String expected) {
        assertEquals(expected, NormalizationEngine.fold(input));
    }

    @Test
    @DisplayName("Rules run in ascending priority order")
    void rulesRunInPriorityOrder() {
        NormalizationRule late = NormalizationRule.builder()
                .name("b-to-c").pattern("b").replacement("c").priority(20).build();
        NormalizationRule early = NormalizationRule.builder()
                .name("a-to-b").pattern("a").replacement("b").priority(10).build();

        NormalizationEngine engine = new NormalizationEngine(List.of(late, early));

        assertEquals(List.of(early, late), engine.getRules());
        assertEquals("ccc", engine.normalize("abc"));
    }

    @Test
    @DisplayName("Whitespace is trimmed and collapsed after the rules")
    void whitespaceCollapsed() {
        NormalizationEngine engine = new NormalizationEngine(List.of());

        assertEquals("casa azul", engine.normalize("  Casa \t  Azul  "));
    }

    @Test
    @DisplayName("withRule returns a new engine and leaves the original untouched")
    void withRuleIsImmutable() {
        NormalizationEngine engine = new NormalizationEngine(List.of());
        NormalizationEngine extended = engine.withRule(NormalizationRule.builder()
                .name("drop-x").pattern("x").replacement("").build());

        assertEquals(0, engine.getRules().size());
        assertEquals(1, extended.getRules().size());
        assertEquals("ab", extended.normalize("axb"));
        assertEquals("axb", engine.normalize("axb"));
    }

    @Test
    @DisplayName("Rule builder requires name, pattern and replacement")
    void ruleBuilderValidation() {
        assertThrows(NullPointerException.class, () -> NormalizationRule.builder().pattern("a").replacement("").build());
        assertThrows(NullPointerException.class, () -> NormalizationRule.builder().name("n").replacement("").build());
        assertThrows(NullPointerException.class, () -> NormalizationRule.builder().name("n").pattern("a").build());
    }
}
