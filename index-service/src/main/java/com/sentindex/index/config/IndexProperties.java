package com.sentindex.index.config;

import com.sentindex.common.composer.IndexComposer;
import com.sentindex.common.composer.IndexConfigValidator;
import com.sentindex.common.model.IndexConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds the {@code sentindex.*} tree.
 *
 * <p>Map keys that contain underscores or upper-case letters (index names, asset symbols) must be
 * written in bracket notation in YAML, e.g. {@code "[gold_silver_oil_crypto]"}, or Spring's relaxed
 * binding rewrites them.
 */
@ConfigurationProperties(prefix = "sentindex")
public record IndexProperties(
    Map<String, IndexDefinition> indices,
    Compute compute,
    Insights insights
) {
    public IndexProperties {
        indices  = indices  == null ? Map.of() : new LinkedHashMap<>(indices);
        compute  = compute  == null ? new Compute(null, null) : compute;
        insights = insights == null ? new Insights(null, null) : insights;
    }

    public record IndexDefinition(
        String name,
        BigDecimal baseLevel,
        String baseDate,
        Map<String, BigDecimal> weights,
        Map<String, BigDecimal> basePrices
    ) {
        /**
         * @param key the map key the definition was bound under; used as the name when none is set
         * @throws java.time.format.DateTimeParseException when {@code baseDate} is not ISO-8601
         */
        public IndexConfig toConfig(String key) {
            String resolvedName = name == null || name.isBlank() ? key : name.trim();
            LocalDate date = baseDate == null || baseDate.isBlank() ? null : LocalDate.parse(baseDate.trim());
            return new IndexConfig(resolvedName, baseLevel, date, weights, basePrices);
        }
    }

    public record Compute(BigDecimal minCoverage, BigDecimal weightTolerance) {
        public Compute {
            minCoverage     = minCoverage     == null ? IndexComposer.DEFAULT_MIN_COVERAGE : minCoverage;
            weightTolerance = weightTolerance == null ? IndexConfigValidator.DEFAULT_TOLERANCE : weightTolerance;
        }
    }

    public record Insights(Long deadlineMs, Integer maxTokens) {
        public Insights {
            deadlineMs = deadlineMs == null ? 4000L : deadlineMs;
            maxTokens  = maxTokens  == null ? 400 : maxTokens;
        }
    }
}
