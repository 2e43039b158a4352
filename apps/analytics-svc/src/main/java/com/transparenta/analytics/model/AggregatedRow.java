package com.transparenta.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;

/**
 * One classification pair with its summed amount and line-item count. {@code year} is only set
 * for per-year buckets produced for currency conversion.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AggregatedRow(
        String functionalCode,
        String functionalName,
        String economicCode,
        String economicName,
        BigDecimal amount,
        long count,
        Integer year
) {

    public static final String UNKNOWN_ECONOMIC_CODE = "00.00.00";
    public static final String UNKNOWN_ECONOMIC_NAME = "Unknown economic classification";

    public AggregatedRow {
        amount = amount != null ? amount : BigDecimal.ZERO;
    }

    public AggregatedRow(String functionalCode, String functionalName, String economicCode, String economicName,
                         BigDecimal amount, long count) {
        this(functionalCode, functionalName, economicCode, economicName, amount, count, null);
    }

    public String classificationKey() {
        return functionalCode + "|" + economicCode;
    }

    public AggregatedRow withAmount(BigDecimal newAmount) {
        return new AggregatedRow(functionalCode, functionalName, economicCode, economicName, newAmount, count, year);
    }
}
