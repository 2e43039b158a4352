package com.transparenta.analytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum AccountCategory {
    EXPENSE("ch", "expense"),
    REVENUE("vn", "revenue");

    private final String code;
    private final String label;

    AccountCategory(String code, String label) {
        this.code = code;
        this.label = label;
    }

    /**
     * Value stored in {@code ExecutionLineItems.account_category}.
     */
    @JsonValue
    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    @JsonCreator
    public static AccountCategory fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("account category must be provided");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "ch", "expense", "expenses" -> EXPENSE;
            case "vn", "revenue", "income" -> REVENUE;
            default -> throw new IllegalArgumentException("Unknown account category: " + value);
        };
    }
}
