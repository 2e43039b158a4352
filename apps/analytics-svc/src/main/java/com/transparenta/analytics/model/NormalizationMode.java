package com.transparenta.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum NormalizationMode {
    TOTAL("total", false, false),
    TOTAL_CURRENCY("total_currency", true, false),
    PER_CAPITA("per_capita", false, true),
    PER_CAPITA_CURRENCY("per_capita_currency", true, true);

    private final String value;
    private final boolean currency;
    private final boolean perCapita;

    NormalizationMode(String value, boolean currency, boolean perCapita) {
        this.value = value;
        this.currency = currency;
        this.perCapita = perCapita;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Currency modes convert per year before re-aggregating, so thresholds, ordering and
     * pagination cannot run in the store.
     */
    public boolean requiresCurrencyConversion() {
        return currency;
    }

    public boolean requiresPopulation() {
        return perCapita;
    }

    @JsonCreator
    public static NormalizationMode fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return TOTAL;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "total" -> TOTAL;
            case "total_currency", "total_euro" -> TOTAL_CURRENCY;
            case "per_capita" -> PER_CAPITA;
            case "per_capita_currency", "per_capita_euro" -> PER_CAPITA_CURRENCY;
            default -> throw new IllegalArgumentException("Unknown normalization mode: " + raw);
        };
    }
}
