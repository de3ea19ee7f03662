package com.sentindex.index.ai;

import com.sentindex.common.model.IndexConfig;
import com.sentindex.common.model.InsightRequest;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Renders an {@link InsightRequest} as a prompt that asks for a bare JSON object with
 * {@code sentiment}, {@code summary}, {@code notable_events} and {@code risk_factors}.
 */
@Component
public class InsightPromptBuilder {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public String build(InsightRequest request) {
        IndexConfig config = request.config();
        StringBuilder assets = new StringBuilder();
        if (request.prices() != null) {
            for (Map.Entry<String, BigDecimal> e : request.prices().prices().entrySet()) {
                assets.append("- ").append(e.getKey()).append(": ").append(e.getValue().toPlainString());
                if (config != null && config.weights().containsKey(e.getKey())) {
                    assets.append(" (weight ").append(percent(config.weights().get(e.getKey()))).append('%');
                    BigDecimal base = config.basePrices().get(e.getKey());
                    if (base != null) {
                        assets.append(", base price ").append(base.toPlainString());
                    }
                    assets.append(')');
                }
                assets.append('\n');
            }
        }

        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a financial analyst reviewing the composite index \"")
              .append(request.indexName()).append("\".\n\n")
              .append("Input prices:\n").append(assets);
        if (config != null && config.baseLevel() != null) {
            prompt.append("Base index level: ").append(config.baseLevel().toPlainString());
            if (config.baseDate() != null) {
                prompt.append(" (base date: ").append(config.baseDate()).append(')');
            }
            prompt.append('\n');
        }
        prompt.append("Current index value: ").append(request.value().toPlainString()).append('\n');
        if (request.delta24hPct() != null) {
            prompt.append("24h change: ").append(request.delta24hPct().toPlainString()).append("%\n");
        }
        prompt.append("""

            Return EXACTLY one JSON object with these keys and nothing else:
              "sentiment": one of "positive", "neutral", "negative"
              "summary": at most 2 sentences and 200 characters
              "notable_events": array of strings
              "risk_factors": array of strings
            Do not add any text before or after the JSON object.""");
        return prompt.toString();
    }

    private static String percent(BigDecimal weight) {
        return weight.multiply(HUNDRED).stripTrailingZeros().toPlainString();
    }
}
