package com.transparenta.analytics.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.transparenta.analytics.config.AnalyticsProperties;
import com.transparenta.analytics.model.AggregatedLineItems;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * In-process cache of normalized aggregation results, bounded by total serialized size.
 *
 * <p>Each entry weighs at least {@code maxBytes / maxItems}, which keeps the entry count at or
 * below {@code maxItems}. A single segment keeps one access-ordered queue, so eviction is
 * least-recently-used across the whole cache. No TTL: entries live until evicted.
 */
@Component
public class ResultCache {
    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final Cache<String, AggregatedLineItems> cache;
    private final ObjectMapper sizingMapper;
    private final long minEntryWeight;

    @Autowired
    public ResultCache(AnalyticsProperties properties, ObjectMapper objectMapper) {
        this(properties.cache(), objectMapper);
    }

    ResultCache(AnalyticsProperties.Cache settings, ObjectMapper objectMapper) {
        this.sizingMapper = objectMapper;
        this.minEntryWeight = settings.minEntryWeight();
        this.cache = CacheBuilder.newBuilder()
                .concurrencyLevel(1)
                .maximumWeight(settings.maxBytes())
                .weigher((String key, AggregatedLineItems value) -> weigh(key, value))
                .recordStats()
                .build();
        log.info("Analytics result cache: maxItems={} maxBytes={}", settings.maxItems(), settings.maxBytes());
    }

    public Optional<AggregatedLineItems> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public void put(String key, AggregatedLineItems value) {
        cache.put(key, value);
    }

    public long size() {
        return cache.size();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    int weigh(String key, AggregatedLineItems value) {
        long bytes;
        try {
            bytes = (long) key.length() + sizingMapper.writeValueAsBytes(value).length;
        } catch (JsonProcessingException ex) {
            log.warn("Result cache: unable to size entry {}, using minimum weight: {}", key, ex.getMessage());
            bytes = minEntryWeight;
        }
        return (int) Math.min(Integer.MAX_VALUE, Math.max(bytes, minEntryWeight));
    }
}
