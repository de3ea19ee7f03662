package com.sentindex.index.ai;

import com.sentindex.common.model.IndexConfig;
import com.sentindex.common.model.InsightRequest;
import com.sentindex.common.model.PriceSet;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InsightPromptBuilderTest {

    private final InsightPromptBuilder builder = new InsightPromptBuilder();

    @Test
    void embedsValuePricesWeightsAndDelta() {
        Map<String, BigDecimal> weights = new LinkedHashMap<>();
        weights.put("GOLD", new BigDecimal("0.25"));
        weights.put("BTC", new BigDecimal("0.75"));
        Map<String, BigDecimal> base = new LinkedHashMap<>();
        base.put("GOLD", new BigDecimal("1800"));
        base.put("BTC", new BigDecimal("20000"));
        IndexConfig config = new IndexConfig("demo", new BigDecimal("1000"), LocalDate.of(2025, 1, 1), weights, base);
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        prices.put("GOLD", new BigDecimal("1900.12"));
        prices.put("BTC", new BigDecimal("27450.0"));

        String prompt = builder.build(new InsightRequest("demo", new BigDecimal("1220.72"),
            PriceSet.of(prices), new BigDecimal("-1.25"), config));

        assertThat(prompt)
            .contains("\"demo\"")
            .contains("- GOLD: 1900.12 (weight 25%, base price 1800)")
            .contains("- BTC: 27450.0 (weight 75%, base price 20000)")
            .contains("Base index level: 1000 (base date: 2025-01-01)")
            .contains("Current index value: 1220.72")
            .contains("24h change: -1.25%")
            .contains("\"sentiment\"", "\"summary\"", "\"notable_events\"", "\"risk_factors\"");
    }

    @Test
    void omitsOptionalLinesWhenUnknown() {
        String prompt = builder.build(InsightRequest.of("demo", new BigDecimal("1000.00"),
            PriceSet.of(Map.of("GOLD", new BigDecimal("1800")))));

        assertThat(prompt)
            .contains("- GOLD: 1800\n")
            .doesNotContain("24h change")
            .doesNotContain("Base index level");
    }
}
