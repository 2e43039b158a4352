package com.transparenta.analytics.model;

public enum ClassificationDimension {
    FUNCTIONAL,
    ECONOMIC;

    public String codeOf(AggregatedRow row) {
        return this == FUNCTIONAL ? row.functionalCode() : row.economicCode();
    }

    public String nameOf(AggregatedRow row) {
        return this == FUNCTIONAL ? row.functionalName() : row.economicName();
    }

    public String label() {
        return this == FUNCTIONAL ? "functional" : "economic";
    }
}
