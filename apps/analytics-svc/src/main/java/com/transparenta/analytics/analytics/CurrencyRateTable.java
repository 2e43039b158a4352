package com.transparenta.analytics.analytics;

import com.transparenta.analytics.config.AnalyticsProperties;
import java.math.BigDecimal;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Yearly average exchange rates, expressed as native units per one unit of the target
 * currency. Years without a configured rate convert at 1.
 */
@Component
public class CurrencyRateTable {

    private final Map<Integer, BigDecimal> ratesByYear;
    private final String currencyCode;
    private final String nativeCode;

    @Autowired
    public CurrencyRateTable(AnalyticsProperties properties) {
        this(properties.currency());
    }

    CurrencyRateTable(AnalyticsProperties.Currency currency) {
        this.ratesByYear = currency.rates();
        this.currencyCode = currency.code();
        this.nativeCode = currency.nativeCode();
    }

    public BigDecimal rateFor(Integer year) {
        if (year == null) {
            return BigDecimal.ONE;
        }
        BigDecimal rate = ratesByYear.get(year);
        return rate == null || rate.signum() <= 0 ? BigDecimal.ONE : rate;
    }

    public boolean hasRateFor(int year) {
        return ratesByYear.containsKey(year);
    }

    public String currencyCode() {
        return currencyCode;
    }

    public String nativeCode() {
        return nativeCode;
    }
}
