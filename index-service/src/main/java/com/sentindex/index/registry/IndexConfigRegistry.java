package com.sentindex.index.registry;

import com.sentindex.common.composer.IndexConfigValidator;
import com.sentindex.common.exception.ComputationException;
import com.sentindex.common.model.IndexConfig;
import com.sentindex.index.config.IndexProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Named index configurations loaded from {@code sentindex.indices}.
 *
 * <p>Every configuration is checked at startup. An invalid one is still registered, so it can be
 * listed, and is rejected with {@code invalid_config} when someone computes it.
 */
@Component
public class IndexConfigRegistry {

    private static final Logger log = LoggerFactory.getLogger(IndexConfigRegistry.class);

    private final Map<String, IndexConfig> configs;

    public IndexConfigRegistry(IndexProperties properties, IndexConfigValidator validator) {
        Map<String, IndexConfig> loaded = new LinkedHashMap<>();
        properties.indices().forEach((key, definition) -> {
            IndexConfig config;
            try {
                config = definition.toConfig(key);
            } catch (DateTimeParseException e) {
                log.error("[IndexConfig] Unparseable base-date, index skipped. key={} baseDate={}",
                          key, definition.baseDate());
                return;
            }
            try {
                validator.validate(config);
                log.info("[IndexConfig] Index registered. name={} symbols={} baseLevel={} baseDate={}",
                         config.name(), config.weights().keySet(), config.baseLevel(), config.baseDate());
            } catch (ComputationException e) {
                log.warn("[IndexConfig] Index registered with invalid configuration. name={} reason={} detail={}",
                         config.name(), e.getReason(), e.getMessage());
            }
            loaded.put(config.name(), config);
        });
        this.configs = Collections.unmodifiableMap(loaded);
    }

    public Optional<IndexConfig> find(String name) {
        return Optional.ofNullable(name == null ? null : configs.get(name.trim()));
    }

    /** @throws ComputationException with reason {@code unknown_index} */
    public IndexConfig require(String name) {
        return find(name).orElseThrow(() -> new ComputationException(ComputationException.UNKNOWN_INDEX,
            "no index configuration named '" + name + "'"));
    }

    public Collection<IndexConfig> all() {
        return configs.values();
    }
}
