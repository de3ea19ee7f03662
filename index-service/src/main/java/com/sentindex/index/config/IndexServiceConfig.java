package com.sentindex.index.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sentindex.common.composer.IndexCalculationStrategy;
import com.sentindex.common.composer.IndexComposer;
import com.sentindex.common.composer.IndexConfigValidator;
import com.sentindex.common.composer.LevelNormalizedStrategy;
import com.sentindex.common.composer.ReturnBasedStrategy;
import com.sentindex.common.normalize.PriceNormalizer;
import com.sentindex.common.provenance.ProvenanceRecorder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.List;

@Configuration
public class IndexServiceConfig {

    @Value("${services.history.base-url}")
    private String historyUrl;

    @Bean
    public WebClient historyClient(WebClient.Builder builder) {
        return builder.baseUrl(historyUrl).build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PriceNormalizer priceNormalizer() {
        return new PriceNormalizer();
    }

    @Bean
    public IndexConfigValidator indexConfigValidator(IndexProperties properties) {
        return new IndexConfigValidator(properties.compute().weightTolerance());
    }

    @Bean
    public LevelNormalizedStrategy levelNormalizedStrategy() {
        return new LevelNormalizedStrategy();
    }

    @Bean
    public ReturnBasedStrategy returnBasedStrategy() {
        return new ReturnBasedStrategy();
    }

    @Bean
    public IndexComposer indexComposer(List<IndexCalculationStrategy> strategies,
                                       IndexConfigValidator validator,
                                       IndexProperties properties) {
        return new IndexComposer(strategies, validator, properties.compute().minCoverage());
    }

    @Bean
    public ProvenanceRecorder provenanceRecorder(Clock clock) {
        return new ProvenanceRecorder(clock);
    }
}
