package com.transparenta.analytics.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.transparenta.analytics.model.AnalyticsFilter;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.springframework.stereotype.Component;

/**
 * Builds namespaced cache keys from the SHA-256 of a canonical JSON rendering (properties and
 * map entries sorted) of the request, so that equal requests always share a key.
 */
@Component
public class CacheKeyBuilder {

    public static final String AGGREGATED_NAMESPACE = "analytics:aggregated";

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public String aggregatedKey(AnalyticsFilter filter, Integer limit, int offset) {
        return key(AGGREGATED_NAMESPACE, new AggregatedRequest(filter, limit, offset));
    }

    public String key(String namespace, Object payload) {
        return namespace + ":" + sha256(canonicalJson(payload));
    }

    String canonicalJson(Object payload) {
        try {
            return canonicalMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize cache key payload", ex);
        }
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    record AggregatedRequest(AnalyticsFilter filter, Integer limit, int offset) {
    }
}
