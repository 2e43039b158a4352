package com.transparenta.analytics.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Declarative filter over execution line items. {@code accountCategory} and
 * {@code reportPeriod} are required (checked by the compiler, not here, so that transports can
 * build partial filters and get a proper validation error).
 */
public record AnalyticsFilter(
        AccountCategory accountCategory,
        ReportPeriod reportPeriod,
        List<String> reportIds,
        String reportType,
        String mainCreditorCui,
        List<String> entityCuis,
        List<Integer> uatIds,
        List<String> countyCodes,
        Boolean isUat,
        Long minPopulation,
        Long maxPopulation,
        List<String> entityTypes,
        String search,
        List<String> functionalCodes,
        List<String> functionalPrefixes,
        List<String> economicCodes,
        List<String> economicPrefixes,
        List<Integer> fundingSourceIds,
        List<Integer> budgetSectorIds,
        List<String> programCodes,
        List<String> expenseTypes,
        BigDecimal itemMinAmount,
        BigDecimal itemMaxAmount,
        BigDecimal aggregateMinAmount,
        BigDecimal aggregateMaxAmount,
        Exclusions exclude,
        NormalizationMode normalization
) {

    public AnalyticsFilter {
        reportIds = copy(reportIds);
        entityCuis = copy(entityCuis);
        uatIds = copy(uatIds);
        countyCodes = copy(countyCodes);
        entityTypes = copy(entityTypes);
        functionalCodes = copy(functionalCodes);
        functionalPrefixes = copy(functionalPrefixes);
        economicCodes = copy(economicCodes);
        economicPrefixes = copy(economicPrefixes);
        fundingSourceIds = copy(fundingSourceIds);
        budgetSectorIds = copy(budgetSectorIds);
        programCodes = copy(programCodes);
        expenseTypes = copy(expenseTypes);
        search = blankToNull(search);
        exclude = exclude != null ? exclude : Exclusions.none();
        normalization = normalization != null ? normalization : NormalizationMode.TOTAL;
    }

    /**
     * True when any dimension narrows the entity set; drives the population denominator.
     */
    public boolean hasEntityScope() {
        return !entityCuis.isEmpty()
                || !uatIds.isEmpty()
                || !countyCodes.isEmpty()
                || isUat != null
                || !entityTypes.isEmpty();
    }

    public AnalyticsFilter withNormalization(NormalizationMode mode) {
        return toBuilder().normalization(mode).build();
    }

    public static Builder builder(AccountCategory accountCategory, ReportPeriod reportPeriod) {
        return new Builder().accountCategory(accountCategory).reportPeriod(reportPeriod);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.accountCategory = accountCategory;
        b.reportPeriod = reportPeriod;
        b.reportIds = reportIds;
        b.reportType = reportType;
        b.mainCreditorCui = mainCreditorCui;
        b.entityCuis = entityCuis;
        b.uatIds = uatIds;
        b.countyCodes = countyCodes;
        b.isUat = isUat;
        b.minPopulation = minPopulation;
        b.maxPopulation = maxPopulation;
        b.entityTypes = entityTypes;
        b.search = search;
        b.functionalCodes = functionalCodes;
        b.functionalPrefixes = functionalPrefixes;
        b.economicCodes = economicCodes;
        b.economicPrefixes = economicPrefixes;
        b.fundingSourceIds = fundingSourceIds;
        b.budgetSectorIds = budgetSectorIds;
        b.programCodes = programCodes;
        b.expenseTypes = expenseTypes;
        b.itemMinAmount = itemMinAmount;
        b.itemMaxAmount = itemMaxAmount;
        b.aggregateMinAmount = aggregateMinAmount;
        b.aggregateMaxAmount = aggregateMaxAmount;
        b.exclude = exclude;
        b.normalization = normalization;
        return b;
    }

    static <T> List<T> copy(List<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        List<T> result = new ArrayList<>(values.size());
        for (T value : values) {
            if (value != null) {
                result.add(value);
            }
        }
        return List.copyOf(result);
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * Negated counterparts of the inclusion fields. Every non-empty field removes matching rows.
     */
    public record Exclusions(
            List<String> reportIds,
            List<String> entityCuis,
            String mainCreditorCui,
            List<Integer> uatIds,
            List<String> countyCodes,
            List<String> regions,
            List<String> entityTypes,
            String search,
            List<String> functionalCodes,
            List<String> functionalPrefixes,
            List<String> economicCodes,
            List<String> economicPrefixes,
            List<Integer> fundingSourceIds,
            List<Integer> budgetSectorIds,
            List<String> programCodes,
            List<String> expenseTypes
    ) {

        public Exclusions {
            reportIds = copy(reportIds);
            entityCuis = copy(entityCuis);
            uatIds = copy(uatIds);
            countyCodes = copy(countyCodes);
            regions = copy(regions);
            entityTypes = copy(entityTypes);
            search = blankToNull(search);
            functionalCodes = copy(functionalCodes);
            functionalPrefixes = copy(functionalPrefixes);
            economicCodes = copy(economicCodes);
            economicPrefixes = copy(economicPrefixes);
            fundingSourceIds = copy(fundingSourceIds);
            budgetSectorIds = copy(budgetSectorIds);
            programCodes = copy(programCodes);
            expenseTypes = copy(expenseTypes);
        }

        public static Exclusions none() {
            return new Exclusions(null, null, null, null, null, null, null, null,
                    null, null, null, null, null, null, null, null);
        }

        public static ExclusionsBuilder builder() {
            return new ExclusionsBuilder();
        }
    }

    public static final class ExclusionsBuilder {
        private List<String> reportIds;
        private List<String> entityCuis;
        private String mainCreditorCui;
        private List<Integer> uatIds;
        private List<String> countyCodes;
        private List<String> regions;
        private List<String> entityTypes;
        private String search;
        private List<String> functionalCodes;
        private List<String> functionalPrefixes;
        private List<String> economicCodes;
        private List<String> economicPrefixes;
        private List<Integer> fundingSourceIds;
        private List<Integer> budgetSectorIds;
        private List<String> programCodes;
        private List<String> expenseTypes;

        private ExclusionsBuilder() {
        }

        public ExclusionsBuilder reportIds(String... values) {
            this.reportIds = Arrays.asList(values);
            return this;
        }

        public ExclusionsBuilder entityCuis(String... values) {
            this.entityCuis = Arrays.asList(values);
            return this;
        }

        public ExclusionsBuilder mainCreditorCui(String value) {
            this.mainCreditorCui = value;
            return this;
        }

        public ExclusionsBuilder uatIds(Integer... values) {
            this.uatIds = Arrays.asList(values);
            return this;
        }

        public ExclusionsBuilder countyCodes(String... values) {
            this.countyCodes = Arrays.asList(values);
            return this;
        }

        public ExclusionsBuilder regions(String... values) {
            this.regions = Arrays.asList(values);
            return this;
        }

        public ExclusionsBuilder entityTypes(String... values) {
            this.entityTypes = Arrays.asList(values);
            return this;
        }

        public ExclusionsBuilder search(String value) {
            this.search = value;
            return this;
        }

        public ExclusionsBuilder functionalCodes(String... values) {
            this.functionalCodes = Arrays.asList(values);
            return this;
        }

        public ExclusionsBuilder functionalPrefixes(String... values) {
            this.functionalPrefixes = Arrays.asList(values);
            return this;
        }

        public ExclusionsBuilder economicCodes(String... values) {
            this.economicCodes = Arrays.asList(values);
            return this;
        }

        public ExclusionsBuilder economicPrefixes(String... values) {
            this.economicPrefixes = Arrays.asList(values);
            return this;
        }

        public ExclusionsBuilder fundingSourceIds(Integer... values) {
            this.fundingSourceIds = Arrays.asList(values);
            return this;
        }

        public ExclusionsBuilder budgetSectorIds(Integer... values) {
            this.budgetSectorIds = Arrays.asList(values);
            return this;
        }

        public ExclusionsBuilder programCodes(String... values) {
            this.programCodes = Arrays.asList(values);
            return this;
        }

        public ExclusionsBuilder expenseTypes(String... values) {
            this.expenseTypes = Arrays.asList(values);
            return this;
        }

        public Exclusions build() {
            return new Exclusions(reportIds, entityCuis, mainCreditorCui, uatIds, countyCodes, regions,
                    entityTypes, search, functionalCodes, functionalPrefixes, economicCodes, economicPrefixes,
                    fundingSourceIds, budgetSectorIds, programCodes, expenseTypes);
        }
    }

    public static final class Builder {
        private AccountCategory accountCategory;
        private ReportPeriod reportPeriod;
        private List<String> reportIds;
        private String reportType;
        private String mainCreditorCui;
        private List<String> entityCuis;
        private List<Integer> uatIds;
        private List<String> countyCodes;
        private Boolean isUat;
        private Long minPopulation;
        private Long maxPopulation;
        private List<String> entityTypes;
        private String search;
        private List<String> functionalCodes;
        private List<String> functionalPrefixes;
        private List<String> economicCodes;
        private List<String> economicPrefixes;
        private List<Integer> fundingSourceIds;
        private List<Integer> budgetSectorIds;
        private List<String> programCodes;
        private List<String> expenseTypes;
        private BigDecimal itemMinAmount;
        private BigDecimal itemMaxAmount;
        private BigDecimal aggregateMinAmount;
        private BigDecimal aggregateMaxAmount;
        private Exclusions exclude;
        private NormalizationMode normalization;

        private Builder() {
        }

        public Builder accountCategory(AccountCategory value) {
            this.accountCategory = value;
            return this;
        }

        public Builder reportPeriod(ReportPeriod value) {
            this.reportPeriod = value;
            return this;
        }

        public Builder reportIds(String... values) {
            this.reportIds = Arrays.asList(values);
            return this;
        }

        public Builder reportType(String value) {
            this.reportType = value;
            return this;
        }

        public Builder mainCreditorCui(String value) {
            this.mainCreditorCui = value;
            return this;
        }

        public Builder entityCuis(String... values) {
            this.entityCuis = Arrays.asList(values);
            return this;
        }

        public Builder uatIds(Integer... values) {
            this.uatIds = Arrays.asList(values);
            return this;
        }

        public Builder countyCodes(String... values) {
            this.countyCodes = Arrays.asList(values);
            return this;
        }

        public Builder isUat(Boolean value) {
            this.isUat = value;
            return this;
        }

        public Builder minPopulation(Long value) {
            this.minPopulation = value;
            return this;
        }

        public Builder maxPopulation(Long value) {
            this.maxPopulation = value;
            return this;
        }

        public Builder entityTypes(String... values) {
            this.entityTypes = Arrays.asList(values);
            return this;
        }

        public Builder search(String value) {
            this.search = value;
            return this;
        }

        public Builder functionalCodes(String... values) {
            this.functionalCodes = Arrays.asList(values);
            return this;
        }

        public Builder functionalPrefixes(String... values) {
            this.functionalPrefixes = Arrays.asList(values);
            return this;
        }

        public Builder economicCodes(String... values) {
            this.economicCodes = Arrays.asList(values);
            return this;
        }

        public Builder economicPrefixes(String... values) {
            this.economicPrefixes = Arrays.asList(values);
            return this;
        }

        public Builder fundingSourceIds(Integer... values) {
            this.fundingSourceIds = Arrays.asList(values);
            return this;
        }

        public Builder budgetSectorIds(Integer... values) {
            this.budgetSectorIds = Arrays.asList(values);
            return this;
        }

        public Builder programCodes(String... values) {
            this.programCodes = Arrays.asList(values);
            return this;
        }

        public Builder expenseTypes(String... values) {
            this.expenseTypes = Arrays.asList(values);
            return this;
        }

        public Builder itemMinAmount(BigDecimal value) {
            this.itemMinAmount = value;
            return this;
        }

        public Builder itemMaxAmount(BigDecimal value) {
            this.itemMaxAmount = value;
            return this;
        }

        public Builder aggregateMinAmount(BigDecimal value) {
            this.aggregateMinAmount = value;
            return this;
        }

        public Builder aggregateMaxAmount(BigDecimal value) {
            this.aggregateMaxAmount = value;
            return this;
        }

        public Builder exclude(Exclusions value) {
            this.exclude = value;
            return this;
        }

        public Builder normalization(NormalizationMode value) {
            this.normalization = value;
            return this;
        }

        public AnalyticsFilter build() {
            return new AnalyticsFilter(accountCategory, reportPeriod, reportIds, reportType, mainCreditorCui,
                    entityCuis, uatIds, countyCodes, isUat, minPopulation, maxPopulation, entityTypes, search,
                    functionalCodes, functionalPrefixes, economicCodes, economicPrefixes, fundingSourceIds,
                    budgetSectorIds, programCodes, expenseTypes, itemMinAmount, itemMaxAmount,
                    aggregateMinAmount, aggregateMaxAmount, exclude, normalization);
        }
    }
}
