package com.transparenta.analytics.grouping;

import com.transparenta.analytics.model.AggregatedRow;
import com.transparenta.analytics.model.AnalyticsFilter;
import com.transparenta.analytics.model.ClassificationDimension;
import com.transparenta.analytics.model.GroupedItem;
import com.transparenta.analytics.model.GroupingOptions;
import com.transparenta.analytics.model.PivotConstraint;
import java.math.BigDecimal;
import java.math.MathContext;
import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Service;

/**
 * Regroups aggregated rows by classification-code depth for drilldown views. Works on
 * unpaginated executor output; percentages are shares of the groups returned by one call.
 */
@Service
public class ClassificationGroupingService {

    private static final Locale DISPLAY_LOCALE = Locale.forLanguageTag("ro-RO");

    private static final Comparator<GroupedItem> BY_VALUE_DESC = Comparator
            .comparing(GroupedItem::value, Comparator.reverseOrder())
            .thenComparing(GroupedItem::code);

    private final ClassificationLabelCatalog labelCatalog;

    public ClassificationGroupingService(ClassificationLabelCatalog labelCatalog) {
        this.labelCatalog = labelCatalog;
    }

    public List<GroupedItem> groupItems(List<AggregatedRow> rows, AnalyticsFilter filter, GroupingOptions options) {
        ClassificationDimension dimension = options.dimension();
        String pathLeaf = options.path().isEmpty()
                ? null
                : ClassificationCodes.normalize(options.path().get(options.path().size() - 1));
        int targetDepth = ClassificationCodes.nextDepth(pathLeaf, options.rootDepth().digits());
        Set<String> excludedChapters = normalizedChapters(options.excludeChapters());
        PivotConstraint pivot = options.pivotConstraint();
        String pivotPrefix = pivot == null ? null : ClassificationCodes.normalize(pivot.code());

        Map<String, Group> groups = new LinkedHashMap<>();
        for (AggregatedRow row : rows) {
            if (!excludedChapters.isEmpty() && excludedChapters.contains(ClassificationCodes.chapterOf(row.economicCode()))) {
                continue;
            }
            if (dimension == ClassificationDimension.ECONOMIC && ClassificationCodes.isUnclassified(row.economicCode())) {
                continue;
            }
            if (pivot != null && !ClassificationCodes.normalize(pivot.dimension().codeOf(row)).startsWith(pivotPrefix)) {
                continue;
            }
            String code = ClassificationCodes.normalize(dimension.codeOf(row));
            if (pathLeaf != null && !code.startsWith(pathLeaf)) {
                continue;
            }
            String groupCode = ClassificationCodes.truncate(code, targetDepth);
            if (groupCode.equals(pathLeaf)) {
                continue;
            }
            groups.computeIfAbsent(groupCode, key -> new Group(row)).add(row);
        }

        BigDecimal total = BigDecimal.ZERO;
        for (Group group : groups.values()) {
            total = total.add(group.value);
        }

        String category = filter != null && filter.accountCategory() != null
                ? filter.accountCategory().label()
                : "amount";
        List<GroupedItem> items = new ArrayList<>(groups.size());
        for (Map.Entry<String, Group> entry : groups.entrySet()) {
            String code = entry.getKey();
            Group group = entry.getValue();
            String name = resolveLabel(dimension, code, targetDepth, group.representative);
            double percentage = total.signum() == 0
                    ? 0d
                    : group.value.divide(total, MathContext.DECIMAL64).doubleValue();
            items.add(new GroupedItem(
                    code,
                    name,
                    group.value,
                    group.count,
                    targetDepth >= ClassificationCodes.PARAGRAPH_DIGITS,
                    percentage,
                    summarize(category, dimension, name, group.value, percentage)
            ));
        }
        items.sort(BY_VALUE_DESC);
        return items;
    }

    String resolveLabel(ClassificationDimension dimension, String code, int depth, AggregatedRow representative) {
        String formatted = ClassificationCodes.format(code);
        if (depth < ClassificationCodes.PARAGRAPH_DIGITS) {
            return labelCatalog.label(dimension, code).orElse(formatted);
        }
        String rowName = representative == null ? null : dimension.nameOf(representative);
        return rowName != null && !rowName.isBlank() ? rowName.trim() : formatted;
    }

    private static String summarize(String category, ClassificationDimension dimension, String label,
                                    BigDecimal value, double share) {
        NumberFormat compact = NumberFormat.getCompactNumberInstance(DISPLAY_LOCALE, NumberFormat.Style.SHORT);
        compact.setMaximumFractionDigits(2);
        NumberFormat standard = NumberFormat.getNumberInstance(DISPLAY_LOCALE);
        standard.setMinimumFractionDigits(2);
        standard.setMaximumFractionDigits(2);
        NumberFormat percent = NumberFormat.getNumberInstance(DISPLAY_LOCALE);
        percent.setMaximumFractionDigits(2);
        return String.format("The %s for %s category \"%s\" was %s (%s), %s%% of total %s.",
                category, dimension.label(), label, compact.format(value), standard.format(value),
                percent.format(share * 100), category);
    }

    private static Set<String> normalizedChapters(Set<String> chapters) {
        if (chapters.isEmpty()) {
            return Set.of();
        }
        Set<String> result = new HashSet<>();
        for (String chapter : chapters) {
            String digits = ClassificationCodes.chapterOf(chapter);
            if (!digits.isEmpty()) {
                result.add(digits);
            }
        }
        return result;
    }

    private static final class Group {
        private final AggregatedRow representative;
        private BigDecimal value = BigDecimal.ZERO;
        private long count;

        Group(AggregatedRow representative) {
            this.representative = representative;
        }

        void add(AggregatedRow row) {
            value = value.add(row.amount());
            count += row.count();
        }
    }
}
