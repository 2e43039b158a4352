package com.transparenta.analytics.grouping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.transparenta.analytics.model.AccountCategory;
import com.transparenta.analytics.model.AggregatedRow;
import com.transparenta.analytics.model.AnalyticsFilter;
import com.transparenta.analytics.model.ClassificationDimension;
import com.transparenta.analytics.model.GroupedItem;
import com.transparenta.analytics.model.GroupingOptions;
import com.transparenta.analytics.model.PivotConstraint;
import com.transparenta.analytics.model.ReportPeriod;
import com.transparenta.analytics.model.RootDepth;
import java.math.BigDecimal;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ClassificationGroupingServiceTest {

    private static final AnalyticsFilter FILTER =
            AnalyticsFilter.builder(AccountCategory.EXPENSE, ReportPeriod.year(2023)).build();

    private final ClassificationGroupingService service =
            new ClassificationGroupingService(new ClassificationLabelCatalog(new ObjectMapper()));

    private final List<AggregatedRow> rows = List.of(
            row("65.02.01", "Invatamant prescolar", "10.01.01", "Salarii de baza", "600"),
            row("65.02.02", "Invatamant primar", "20.01.01", "Furnituri de birou", "200"),
            row("65.04.01", "Invatamant secundar inferior", "10.01.01", "Salarii de baza", "200"),
            row("66.02.01", "Spitale generale", "20.01.01", "Furnituri de birou", "500"),
            row("70.02.05", "Alimentare cu apa", "70.01.01", "Constructii", "500"),
            row("65.00.00", "Invatamant", "00.00.00", "Unknown economic classification", "40"));

    @Test
    void rootViewGroupsByChapterWithCatalogNames() {
        List<GroupedItem> items = service.groupItems(rows, FILTER, GroupingOptions.of(ClassificationDimension.FUNCTIONAL));

        assertThat(items).extracting(GroupedItem::code).containsExactly("65", "66", "70");
        assertThat(items.get(0).name()).isEqualTo("Invatamant");
        assertThat(items.get(0).value()).isEqualByComparingTo("1040");
        assertThat(items.get(0).count()).isEqualTo(4);
        assertThat(items).noneMatch(GroupedItem::isLeaf);
    }

    @Test
    void drilldownIntoChapterReturnsOnlyItsSubchapters() {
        List<GroupedItem> items = service.groupItems(rows, FILTER, GroupingOptions.of(ClassificationDimension.FUNCTIONAL, "65"));

        assertThat(items).extracting(GroupedItem::code).containsExactly("6502", "6504", "6500");
        assertThat(items).allSatisfy(item -> {
            assertThat(item.code()).hasSize(4).startsWith("65");
        });
        assertThat(items.get(0).name()).isEqualTo("Servicii publice descentralizate");
    }

    @Test
    void paragraphLevelUsesRowNamesAndMarksLeaves() {
        List<GroupedItem> items = service.groupItems(rows, FILTER, GroupingOptions.of(ClassificationDimension.FUNCTIONAL, "65.02"));

        assertThat(items).extracting(GroupedItem::code).containsExactly("650201", "650202");
        assertThat(items).extracting(GroupedItem::name).containsExactly("Invatamant prescolar", "Invatamant primar");
        assertThat(items).allMatch(GroupedItem::isLeaf);
    }

    @Test
    void groupEqualToThePathLeafIsDropped() {
        List<AggregatedRow> padded = List.of(
                row("65.02", "Servicii publice descentralizate", "10.01.01", "Salarii", "10"),
                row("65.02.01", "Invatamant prescolar", "10.01.01", "Salarii", "5"));

        List<GroupedItem> items = service.groupItems(padded, FILTER, GroupingOptions.of(ClassificationDimension.FUNCTIONAL, "65.02"));

        assertThat(items).extracting(GroupedItem::code).containsExactly("650201");
    }

    @Test
    void economicViewDropsUnclassifiedAndExcludedChapters() {
        GroupingOptions options = GroupingOptions.of(ClassificationDimension.ECONOMIC)
                .withExcludeChapters(Set.of("70"));

        List<GroupedItem> items = service.groupItems(rows, FILTER, options);

        assertThat(items).extracting(GroupedItem::code).containsExactly("10", "20");
        assertThat(items.get(0).name()).isEqualTo("Cheltuieli de personal");
    }

    @Test
    void pivotKeepsOnlyRowsUnderTheOtherDimensionCode() {
        GroupingOptions options = GroupingOptions.of(ClassificationDimension.ECONOMIC)
                .withPivot(new PivotConstraint(ClassificationDimension.FUNCTIONAL, "66"));

        List<GroupedItem> items = service.groupItems(rows, FILTER, options);

        assertThat(items).hasSize(1);
        assertThat(items.get(0).code()).isEqualTo("20");
        assertThat(items.get(0).value()).isEqualByComparingTo("500");
        assertThat(items.get(0).percentage()).isEqualTo(1.0);
    }

    @Test
    void percentagesSumToOne() {
        List<GroupedItem> items = service.groupItems(rows, FILTER,
                GroupingOptions.of(ClassificationDimension.FUNCTIONAL).withRootDepth(RootDepth.SUBCHAPTER));

        assertThat(items.stream().mapToDouble(GroupedItem::percentage).sum()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void zeroTotalGivesZeroPercentages() {
        List<AggregatedRow> zeros = List.of(row("65.02.01", "a", "10.01.01", "b", "0"));

        List<GroupedItem> items = service.groupItems(zeros, FILTER, GroupingOptions.of(ClassificationDimension.FUNCTIONAL));

        assertThat(items).singleElement().satisfies(item -> assertThat(item.percentage()).isZero());
    }

    @Test
    void unknownCodesFallBackToFormattedCode() {
        List<AggregatedRow> unknown = List.of(row("98.07.00", null, "10.01.01", "Salarii", "1"));

        assertThat(service.groupItems(unknown, FILTER, GroupingOptions.of(ClassificationDimension.FUNCTIONAL, "98")))
                .extracting(GroupedItem::name).containsExactly("98.07");
    }

    @Test
    void summaryNamesCategoryDimensionAndLabel() {
        List<GroupedItem> items = service.groupItems(rows, FILTER, GroupingOptions.of(ClassificationDimension.FUNCTIONAL));

        assertThat(items.get(0).humanSummary())
                .startsWith("The expense for functional category \"Invatamant\" was ")
                .endsWith("of total expense.");
    }

    private static AggregatedRow row(String functional, String functionalName, String economic, String economicName, String amount) {
        return new AggregatedRow(functional, functionalName, economic, economicName, new BigDecimal(amount), 1);
    }
}
