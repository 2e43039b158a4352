package com.transparenta.analytics.config;

import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "analytics")
public record AnalyticsProperties(
        Cache cache,
        Query query,
        Currency currency
) {

    @ConstructorBinding
    public AnalyticsProperties {
        if (currency == null) {
            throw new IllegalArgumentException("currency configuration must be provided");
        }
        // cache and query fall back to defaults; handle via accessor methods
    }

    public Cache cache() {
        return cache != null ? cache : new Cache(null, null);
    }

    public Query query() {
        return query != null ? query : new Query(null, null);
    }

    public record Cache(Integer maxItems, Long maxBytes) {
        public static final int DEFAULT_MAX_ITEMS = 10_000;
        public static final long DEFAULT_MAX_BYTES = 100L * 1024 * 1024;

        public Cache {
            if (maxItems == null) maxItems = DEFAULT_MAX_ITEMS;
            if (maxBytes == null) maxBytes = DEFAULT_MAX_BYTES;
            if (maxItems <= 0) {
                throw new IllegalArgumentException("cache.maxItems must be positive");
            }
            if (maxBytes <= 0) {
                throw new IllegalArgumentException("cache.maxBytes must be positive");
            }
        }

        /**
         * Lower bound on an entry's weight so that a full cache never holds more than
         * {@code maxItems} entries.
         */
        public long minEntryWeight() {
            return Math.max(1L, maxBytes / maxItems);
        }
    }

    public record Query(Integer timeoutSeconds, Integer maxLimit) {
        public Query {
            if (timeoutSeconds == null) timeoutSeconds = 30;
            if (maxLimit == null) maxLimit = 1000;
            if (timeoutSeconds < 0) {
                throw new IllegalArgumentException("query.timeoutSeconds must not be negative");
            }
            if (maxLimit <= 0) {
                throw new IllegalArgumentException("query.maxLimit must be positive");
            }
        }
    }

    public record Currency(String nativeCode, String code, Map<Integer, BigDecimal> rates) {
        public Currency {
            if (code == null || code.isBlank()) {
                throw new IllegalArgumentException("currency.code must be provided");
            }
            if (nativeCode == null || nativeCode.isBlank()) {
                nativeCode = "RON";
            }
            TreeMap<Integer, BigDecimal> sorted = new TreeMap<>();
            if (rates != null) {
                rates.forEach((year, rate) -> {
                    if (rate == null || rate.signum() <= 0) {
                        throw new IllegalArgumentException("currency rate for " + year + " must be positive");
                    }
                    sorted.put(year, rate);
                });
            }
            rates = Map.copyOf(sorted);
        }
    }
}
