package com.transparenta.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.transparenta.analytics.analytics.AggregatedLineItemsService;
import com.transparenta.analytics.analytics.CurrencyRateTable;
import com.transparenta.analytics.analytics.PopulationDenominatorResolver;
import com.transparenta.analytics.cache.ResultCache;
import com.transparenta.analytics.config.AnalyticsProperties;
import com.transparenta.analytics.grouping.ClassificationGroupingService;
import java.math.BigDecimal;
import javax.sql.DataSource;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

class BudgetAnalyticsWiringTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(AnalyticsComponents.class)
            .withPropertyValues(
                    "analytics.currency.code=EUR",
                    "analytics.currency.rates[2023]=4.9465",
                    "analytics.cache.max-items=50",
                    "analytics.query.timeout-seconds=15");

    @Test
    void contextResolvesTheAnalyticsServices() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(AggregatedLineItemsService.class);
            assertThat(context).hasSingleBean(ClassificationGroupingService.class);
            assertThat(context).hasSingleBean(PopulationDenominatorResolver.class);
            assertThat(context).hasSingleBean(ResultCache.class);
            assertThat(context).hasSingleBean(NamedParameterJdbcTemplate.class);
        });
    }

    @Test
    void boundPropertiesReachTheRateTable() {
        runner.run(context -> {
            AnalyticsProperties properties = context.getBean(AnalyticsProperties.class);
            assertThat(properties.cache().maxItems()).isEqualTo(50);
            assertThat(properties.query().timeoutSeconds()).isEqualTo(15);

            CurrencyRateTable rates = context.getBean(CurrencyRateTable.class);
            assertThat(rates.currencyCode()).isEqualTo("EUR");
            assertThat(rates.nativeCode()).isEqualTo("RON");
            assertThat(rates.rateFor(2023)).isEqualByComparingTo(new BigDecimal("4.9465"));
        });
    }

    @Test
    void missingCurrencyCodeFailsStartup() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
                .withUserConfiguration(AnalyticsComponents.class)
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(AnalyticsProperties.class)
    @ComponentScan(basePackages = {
            "com.transparenta.analytics.config",
            "com.transparenta.analytics.query",
            "com.transparenta.analytics.repository",
            "com.transparenta.analytics.analytics",
            "com.transparenta.analytics.grouping",
            "com.transparenta.analytics.cache"
    })
    static class AnalyticsComponents {

        @Bean
        DataSource dataSource() {
            return mock(DataSource.class);
        }
    }
}
