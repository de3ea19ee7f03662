package com.sentindex.common.composer;

import com.sentindex.common.model.CalculationMethod;
import com.sentindex.common.model.IndexConfig;
import com.sentindex.common.model.PriceSet;
import com.sentindex.common.model.PriorPeriod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Level-normalized index: every asset contributes its move relative to its own base price,
 * so a high-magnitude asset (BTC in dollars) cannot dominate a low-magnitude one (silver).
 *
 * <pre>
 *   score = Σ (price[s] / basePrice[s]) × weight[s]     over configured symbols with a price
 *   value = score × baseLevel
 * </pre>
 *
 * <p>The prior period is not used.
 */
public class LevelNormalizedStrategy implements IndexCalculationStrategy {

    private static final Logger log = LoggerFactory.getLogger(LevelNormalizedStrategy.class);

    @Override
    public CalculationMethod method() {
        return CalculationMethod.LEVEL_NORMALIZED;
    }

    @Override
    public WeightedComputation compute(IndexConfig config, PriceSet prices, PriorPeriod prior) {
        BigDecimal score      = BigDecimal.ZERO;
        BigDecimal usedWeight = BigDecimal.ZERO;
        List<String> used     = new ArrayList<>();
        List<String> missing  = new ArrayList<>();
        Map<String, BigDecimal> pricesUsed = new LinkedHashMap<>();

        for (Map.Entry<String, BigDecimal> entry : config.weights().entrySet()) {
            String symbol     = entry.getKey();
            BigDecimal weight = entry.getValue();
            if (!prices.contains(symbol)) {
                log.debug("Missing price, skipping. index={} symbol={}", config.name(), symbol);
                missing.add(symbol);
                continue;
            }
            BigDecimal price      = prices.get(symbol);
            BigDecimal normalized = price.divide(config.basePrices().get(symbol), PRECISION);
            score      = score.add(normalized.multiply(weight, PRECISION), PRECISION);
            usedWeight = usedWeight.add(weight);
            used.add(symbol);
            pricesUsed.put(symbol, price);
        }

        BigDecimal raw = score.multiply(config.baseLevel(), PRECISION);
        return new WeightedComputation(raw, usedWeight, used, missing, pricesUsed);
    }
}
