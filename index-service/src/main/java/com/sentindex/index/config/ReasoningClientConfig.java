package com.sentindex.index.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentindex.index.ai.AnthropicReasoningClient;
import com.sentindex.index.ai.DisabledReasoningClient;
import com.sentindex.index.ai.ReasoningClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Selects the reasoning backend. A blank {@code anthropic.api-key} wires the disabled client, so
 * every insight request degrades immediately instead of waiting for a call that cannot succeed.
 */
@Configuration
public class ReasoningClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ReasoningClientConfig.class);

    @Bean
    public ReasoningClient reasoningClient(WebClient.Builder builder,
                                           ObjectMapper objectMapper,
                                           IndexProperties properties,
                                           @Value("${anthropic.api-key:}") String apiKey,
                                           @Value("${anthropic.base-url:https://api.anthropic.com}") String baseUrl,
                                           @Value("${anthropic.model:claude-3-5-haiku-20241022}") String model) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[Insight] No Anthropic API key configured. Reasoning client disabled; insights will be degraded.");
            return new DisabledReasoningClient();
        }
        int maxTokens = properties.insights().maxTokens();
        log.info("[Insight] Reasoning client enabled. baseUrl={} model={} maxTokens={}", baseUrl, model, maxTokens);
        return new AnthropicReasoningClient(builder, objectMapper, baseUrl, apiKey, model, maxTokens);
    }
}
