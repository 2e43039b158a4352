package com.transparenta.analytics.analytics;

import com.transparenta.analytics.model.AggregatedLineItems;
import com.transparenta.analytics.model.AggregatedRow;
import com.transparenta.analytics.model.AnalyticsFilter;
import com.transparenta.analytics.model.NormalizationMode;
import com.transparenta.analytics.query.PeriodResolver;
import com.transparenta.analytics.query.YearSpan;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies the filter's {@link NormalizationMode} to executor output.
 *
 * <p>Currency modes receive per-year buckets: each bucket is converted with its year's rate,
 * buckets are merged per classification pair, and only then are aggregate thresholds, ordering
 * and paging applied. Per-capita division happens before thresholds, so thresholds compare
 * against the normalized figure.
 */
@Component
public class NormalizationPipeline {
    private static final Logger log = LoggerFactory.getLogger(NormalizationPipeline.class);

    static final MathContext PRECISION = MathContext.DECIMAL128;

    static final Comparator<AggregatedRow> RESULT_ORDER = Comparator
            .comparing(AggregatedRow::amount, Comparator.reverseOrder())
            .thenComparing(AggregatedRow::functionalCode, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(AggregatedRow::economicCode, Comparator.nullsLast(Comparator.naturalOrder()));

    private final CurrencyRateTable rateTable;
    private final PopulationDenominatorResolver populationResolver;
    private final PeriodResolver periodResolver;

    public NormalizationPipeline(
            CurrencyRateTable rateTable,
            PopulationDenominatorResolver populationResolver,
            PeriodResolver periodResolver
    ) {
        this.rateTable = rateTable;
        this.populationResolver = populationResolver;
        this.periodResolver = periodResolver;
    }

    public AggregatedLineItems normalize(AnalyticsFilter filter, AggregatedLineItems raw, Integer limit, int offset) {
        NormalizationMode mode = filter.normalization();
        if (mode.requiresCurrencyConversion()) {
            warnOnMissingRates(filter);
        }
        return switch (mode) {
            case TOTAL -> raw;
            case PER_CAPITA -> raw.rows().isEmpty()
                    ? raw
                    : new AggregatedLineItems(perCapita(raw.rows(), populationResolver.resolve(filter)), raw.totalCount());
            case TOTAL_CURRENCY -> finish(filter, convert(raw.rows()), limit, offset);
            case PER_CAPITA_CURRENCY -> {
                List<AggregatedRow> converted = convert(raw.rows());
                List<AggregatedRow> scaled = converted.isEmpty()
                        ? converted
                        : perCapita(converted, populationResolver.resolve(filter));
                yield finish(filter, scaled, limit, offset);
            }
        };
    }

    /**
     * Converts every per-year bucket with its year's rate and merges the buckets of each
     * classification pair, keeping first-seen order.
     */
    List<AggregatedRow> convert(List<AggregatedRow> buckets) {
        Map<String, AggregatedRow> merged = new LinkedHashMap<>();
        for (AggregatedRow bucket : buckets) {
            BigDecimal converted = bucket.amount().divide(rateTable.rateFor(bucket.year()), PRECISION);
            merged.merge(bucket.classificationKey(),
                    new AggregatedRow(bucket.functionalCode(), bucket.functionalName(), bucket.economicCode(),
                            bucket.economicName(), converted, bucket.count()),
                    (left, right) -> new AggregatedRow(left.functionalCode(), left.functionalName(), left.economicCode(),
                            left.economicName(), left.amount().add(right.amount()), left.count() + right.count()));
        }
        return new ArrayList<>(merged.values());
    }

    private void warnOnMissingRates(AnalyticsFilter filter) {
        YearSpan span = periodResolver.yearSpan(filter.reportPeriod());
        for (int year = span.startYear(); year <= span.endYear(); year++) {
            if (!rateTable.hasRateFor(year)) {
                log.warn("No {}/{} rate configured for {}; amounts for that year are left unconverted",
                        rateTable.nativeCode(), rateTable.currencyCode(), year);
            }
        }
    }

    List<AggregatedRow> perCapita(List<AggregatedRow> rows, long population) {
        if (population <= 0) {
            log.debug("Population denominator is {}; per-capita amounts left unscaled", population);
            return rows;
        }
        BigDecimal denominator = BigDecimal.valueOf(population);
        List<AggregatedRow> result = new ArrayList<>(rows.size());
        for (AggregatedRow row : rows) {
            result.add(row.withAmount(row.amount().divide(denominator, PRECISION)));
        }
        return result;
    }

    private AggregatedLineItems finish(AnalyticsFilter filter, List<AggregatedRow> rows, Integer limit, int offset) {
        BigDecimal min = filter.aggregateMinAmount();
        BigDecimal max = filter.aggregateMaxAmount();
        List<AggregatedRow> kept = rows.stream()
                .filter(row -> min == null || row.amount().compareTo(min) >= 0)
                .filter(row -> max == null || row.amount().compareTo(max) <= 0)
                .sorted(RESULT_ORDER)
                .toList();
        int total = kept.size();
        int from = Math.min(Math.max(offset, 0), total);
        int to = limit == null ? total : (int) Math.min((long) from + limit, total);
        return new AggregatedLineItems(kept.subList(from, to), total);
    }
}
