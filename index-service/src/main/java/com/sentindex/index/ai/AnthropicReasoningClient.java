package com.sentindex.index.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentindex.common.exception.InsightUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link ReasoningClient} backed by the Anthropic Messages API ({@code POST /v1/messages}).
 *
 * <p>Returns the text of the first {@code text} content block. Every failure is mapped to an
 * {@link InsightUnavailableException} whose reason names the failure class.
 */
public class AnthropicReasoningClient implements ReasoningClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicReasoningClient.class);

    static final String API_VERSION = "2023-06-01";

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final int maxTokens;

    public AnthropicReasoningClient(WebClient.Builder builder, ObjectMapper objectMapper,
                                    String baseUrl, String apiKey, String model, int maxTokens) {
        this.anthropicClient = builder
            .baseUrl(baseUrl)
            .defaultHeader("x-api-key", apiKey)
            .defaultHeader("anthropic-version", API_VERSION)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper = objectMapper;
        this.model        = model;
        this.maxTokens    = maxTokens;
    }

    @Override
    public Mono<String> complete(String prompt, Duration deadline) {
        Map<String, Object> body = Map.of(
            "model", model,
            "max_tokens", maxTokens,
            "messages", List.of(Map.of("role", "user", "content", prompt)));

        return anthropicClient.post()
            .uri("/v1/messages")
            .bodyValue(body)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(deadline)
            .switchIfEmpty(Mono.error(() -> new InsightUnavailableException(
                InsightUnavailableException.EMPTY_RESPONSE, "reasoning service returned no body")))
            .map(this::extractText)
            .doOnSuccess(text -> log.debug("[Insight] Reasoning service answered. model={} chars={}",
                                           model, text == null ? 0 : text.length()))
            .onErrorMap(e -> !(e instanceof InsightUnavailableException), this::toUnavailable);
    }

    private String extractText(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new InsightUnavailableException(InsightUnavailableException.MALFORMED_RESPONSE,
                "reasoning service envelope is not JSON", e);
        }
        JsonNode content = root == null ? null : root.path("content");
        if (content != null && content.isArray()) {
            for (JsonNode block : content) {
                if ("text".equals(block.path("type").asText()) && block.path("text").isTextual()) {
                    return block.path("text").asText();
                }
            }
        }
        throw new InsightUnavailableException(InsightUnavailableException.EMPTY_RESPONSE,
            "reasoning service envelope has no text content");
    }

    private InsightUnavailableException toUnavailable(Throwable e) {
        if (e instanceof TimeoutException) {
            return new InsightUnavailableException(InsightUnavailableException.TIMEOUT,
                "reasoning service did not answer in time", e);
        }
        if (e instanceof WebClientResponseException wcre) {
            return new InsightUnavailableException(InsightUnavailableException.HTTP_STATUS,
                "reasoning service answered " + wcre.getStatusCode().value(), e);
        }
        return new InsightUnavailableException(InsightUnavailableException.TRANSPORT_ERROR,
            "reasoning service call failed: " + e.getMessage(), e);
    }
}
