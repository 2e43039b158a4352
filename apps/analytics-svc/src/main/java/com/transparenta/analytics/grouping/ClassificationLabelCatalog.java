package com.transparenta.analytics.grouping;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.transparenta.analytics.model.ClassificationDimension;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

/**
 * Static chapter and subchapter names per classification dimension, loaded once from
 * {@code classifications/functional.json} and {@code classifications/economic.json}.
 */
@Component
public class ClassificationLabelCatalog {
    private static final Logger log = LoggerFactory.getLogger(ClassificationLabelCatalog.class);

    private static final TypeReference<LinkedHashMap<String, String>> LABELS_TYPE = new TypeReference<>() {
    };

    private final Map<ClassificationDimension, Map<String, String>> labels = new EnumMap<>(ClassificationDimension.class);

    public ClassificationLabelCatalog(ObjectMapper objectMapper) {
        labels.put(ClassificationDimension.FUNCTIONAL, load(objectMapper, "classifications/functional.json"));
        labels.put(ClassificationDimension.ECONOMIC, load(objectMapper, "classifications/economic.json"));
    }

    public Optional<String> label(ClassificationDimension dimension, String code) {
        String name = labels.get(dimension).get(ClassificationCodes.normalize(code));
        return name == null || name.isBlank() ? Optional.empty() : Optional.of(name);
    }

    private static Map<String, String> load(ObjectMapper objectMapper, String location) {
        ClassPathResource resource = new ClassPathResource(location);
        try (InputStream in = resource.getInputStream()) {
            Map<String, String> raw = objectMapper.readValue(in, LABELS_TYPE);
            Map<String, String> byDigits = new LinkedHashMap<>();
            raw.forEach((code, name) -> byDigits.put(ClassificationCodes.normalize(code), name));
            log.info("Loaded {} classification labels from {}", byDigits.size(), location);
            return Collections.unmodifiableMap(byDigits);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to load classification labels from " + location, ex);
        }
    }
}
