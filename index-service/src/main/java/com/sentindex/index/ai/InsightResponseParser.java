package com.sentindex.index.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentindex.common.exception.InsightUnavailableException;
import com.sentindex.common.model.InsightResult;
import com.sentindex.common.model.InsightSource;
import com.sentindex.common.model.Sentiment;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Strict parse-or-reject of the reasoning service's answer.
 *
 * <p>Markdown code fences are stripped and the outermost {@code {...}} is extracted; after that
 * every field must be present with the right type. Nothing is coerced: a single bad field rejects
 * the whole payload.
 */
@Component
public class InsightResponseParser {

    public static final int MAX_SUMMARY_LENGTH = 200;

    private final ObjectMapper objectMapper;

    public InsightResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public InsightResult parse(String raw, Instant generatedAt) {
        JsonNode root = readObject(raw);

        JsonNode sentimentNode = required(root, "sentiment");
        if (!sentimentNode.isTextual()) {
            throw invalid("sentiment must be a string");
        }
        Sentiment sentiment = switch (sentimentNode.asText()) {
            case "positive" -> Sentiment.POSITIVE;
            case "neutral"  -> Sentiment.NEUTRAL;
            case "negative" -> Sentiment.NEGATIVE;
            default -> throw invalid("sentiment '" + sentimentNode.asText() + "' is not one of positive/neutral/negative");
        };

        JsonNode summaryNode = required(root, "summary");
        if (!summaryNode.isTextual() || summaryNode.asText().isBlank()) {
            throw invalid("summary must be a non-blank string");
        }
        String summary = summaryNode.asText().trim();
        if (summary.length() > MAX_SUMMARY_LENGTH) {
            throw invalid("summary exceeds " + MAX_SUMMARY_LENGTH + " characters");
        }

        List<String> events = stringArray(root, "notable_events");
        List<String> risks  = stringArray(root, "risk_factors");

        return new InsightResult(sentiment, summary, events, risks, InsightSource.AI, generatedAt);
    }

    private JsonNode readObject(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InsightUnavailableException(InsightUnavailableException.EMPTY_RESPONSE, "answer is empty");
        }
        String text = raw.replace("```json", "").replace("```", "").trim();
        int start = text.indexOf('{');
        int end   = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new InsightUnavailableException(InsightUnavailableException.MALFORMED_RESPONSE,
                "answer contains no JSON object");
        }
        try {
            JsonNode node = objectMapper.readTree(text.substring(start, end + 1));
            if (node == null || !node.isObject()) {
                throw new InsightUnavailableException(InsightUnavailableException.MALFORMED_RESPONSE,
                    "answer is not a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new InsightUnavailableException(InsightUnavailableException.MALFORMED_RESPONSE,
                "answer is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode required(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new InsightUnavailableException(InsightUnavailableException.MISSING_FIELD,
                "answer has no '" + field + "'");
        }
        return node;
    }

    private static List<String> stringArray(JsonNode root, String field) {
        JsonNode node = required(root, field);
        if (!node.isArray()) {
            throw invalid(field + " must be an array");
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                throw invalid(field + " must contain only strings");
            }
            values.add(item.asText());
        }
        return values;
    }

    private static InsightUnavailableException invalid(String message) {
        return new InsightUnavailableException(InsightUnavailableException.INVALID_FIELD, message);
    }
}
