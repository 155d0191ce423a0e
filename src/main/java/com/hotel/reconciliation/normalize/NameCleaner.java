package com.hotel.reconciliation.normalize;

import com.hotel.reconciliation.rules.HotelNameRules;
import com.hotel.reconciliation.rules.NormalizationEngine;

import java.util.Collection;

/**
 * Turns a displayed hotel name into the form used for similarity scoring.
 *
 * <p>When every word of a name is a noise token ("The Grand Hotel") the folded name is
 * kept instead, so such hotels still compare against each other. The transform is a fixed
 * point: cleaning a cleaned name returns it unchanged.</p>
 */
public class NameCleaner {

    private final NormalizationEngine engine;
    private final NormalizationEngine fallback;

    public NameCleaner(Collection<String> noiseTokens) {
        this(HotelNameRules.createEngine(noiseTokens), HotelNameRules.createFoldingEngine());
    }

    public NameCleaner(NormalizationEngine engine, NormalizationEngine fallback) {
        this.engine = engine;
        this.fallback = fallback;
    }

    public static NameCleaner withDefaultNoiseTokens() {
        return new NameCleaner(HotelNameRules.DEFAULT_NOISE_TOKENS);
    }

    public String clean(String name) {
        String cleaned = engine.normalize(name);
        return cleaned.isEmpty() ? fallback.normalize(name) : cleaned;
    }
}
