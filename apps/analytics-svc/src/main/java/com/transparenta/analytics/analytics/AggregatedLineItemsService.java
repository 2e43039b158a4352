package com.transparenta.analytics.analytics;

import com.transparenta.analytics.cache.CacheKeyBuilder;
import com.transparenta.analytics.cache.ResultCache;
import com.transparenta.analytics.config.AnalyticsProperties;
import com.transparenta.analytics.model.AggregatedLineItems;
import com.transparenta.analytics.model.AnalyticsFilter;
import com.transparenta.analytics.query.FilterCompiler;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for aggregated line items: validate, look up the result cache, aggregate,
 * normalize, then cache the normalized page. Concurrent misses on the same key may both
 * compute; results are deterministic so the last write wins harmlessly.
 */
@Service
public class AggregatedLineItemsService {
    private static final Logger log = LoggerFactory.getLogger(AggregatedLineItemsService.class);

    private final FilterCompiler filterCompiler;
    private final AggregationExecutor executor;
    private final NormalizationPipeline normalizationPipeline;
    private final ResultCache resultCache;
    private final CacheKeyBuilder cacheKeyBuilder;
    private final int maxLimit;

    public AggregatedLineItemsService(
            FilterCompiler filterCompiler,
            AggregationExecutor executor,
            NormalizationPipeline normalizationPipeline,
            ResultCache resultCache,
            CacheKeyBuilder cacheKeyBuilder,
            AnalyticsProperties properties
    ) {
        this.filterCompiler = filterCompiler;
        this.executor = executor;
        this.normalizationPipeline = normalizationPipeline;
        this.resultCache = resultCache;
        this.cacheKeyBuilder = cacheKeyBuilder;
        this.maxLimit = properties.query().maxLimit();
    }

    public AggregatedLineItems getAggregatedLineItems(AnalyticsFilter filter) {
        return getAggregatedLineItems(filter, null, null);
    }

    /**
     * @param limit page size; {@code null} returns every group. Values above the configured
     *              maximum are capped.
     * @param offset number of groups to skip; {@code null} or negative means 0.
     */
    public AggregatedLineItems getAggregatedLineItems(AnalyticsFilter filter, Integer limit, Integer offset) {
        filterCompiler.validate(filter);
        Integer pageSize = limit == null ? null : Math.min(Math.max(limit, 0), maxLimit);
        int skip = offset == null ? 0 : Math.max(offset, 0);

        String key = cacheKeyBuilder.aggregatedKey(filter, pageSize, skip);
        Optional<AggregatedLineItems> cached = resultCache.get(key);
        if (cached.isPresent()) {
            log.debug("Aggregated line items cache hit {}", key);
            return cached.get();
        }
        log.debug("Aggregated line items cache miss {}", key);

        long started = System.nanoTime();
        AggregatedLineItems raw = executor.aggregate(filter, pageSize, skip);
        AggregatedLineItems result = normalizationPipeline.normalize(filter, raw, pageSize, skip);
        resultCache.put(key, result);
        log.debug("Aggregated line items computed: mode={} rows={} total={} in {}ms",
                filter.normalization().value(), result.rows().size(), result.totalCount(),
                (System.nanoTime() - started) / 1_000_000);
        return result;
    }
}
