package com.sentindex.common.composer;

import com.sentindex.common.exception.ComputationException;
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
 * Return-based index: chains the previous level forward by the weighted period return.
 *
 * <pre>
 *   r[s]            = (price[s] − prevPrice[s]) / prevPrice[s]
 *   weightedReturn  = Σ weight[s] × r[s]        over configured symbols priced in both periods
 *   value           = previousValue × (1 + weightedReturn)
 * </pre>
 *
 * <p>A symbol priced in only one of the two periods counts as missing.
 */
public class ReturnBasedStrategy implements IndexCalculationStrategy {

    private static final Logger log = LoggerFactory.getLogger(ReturnBasedStrategy.class);

    @Override
    public CalculationMethod method() {
        return CalculationMethod.RETURN_BASED;
    }

    @Override
    public WeightedComputation compute(IndexConfig config, PriceSet prices, PriorPeriod prior) {
        if (prior == null || prior.value() == null || prior.prices() == null) {
            throw new ComputationException(ComputationException.NO_PRIOR_PERIOD,
                "return-based index '" + config.name() + "' needs a previous period value and prices");
        }
        if (prior.value().signum() <= 0) {
            throw new ComputationException(ComputationException.NO_PRIOR_PERIOD,
                "previous value of index '" + config.name() + "' must be > 0, got " + prior.value());
        }

        BigDecimal weightedReturn = BigDecimal.ZERO;
        BigDecimal usedWeight     = BigDecimal.ZERO;
        List<String> used         = new ArrayList<>();
        List<String> missing      = new ArrayList<>();
        Map<String, BigDecimal> pricesUsed = new LinkedHashMap<>();

        for (Map.Entry<String, BigDecimal> entry : config.weights().entrySet()) {
            String symbol     = entry.getKey();
            BigDecimal weight = entry.getValue();
            boolean hasNow  = prices.contains(symbol);
            boolean hasPrev = prior.prices().contains(symbol);
            if (!hasNow || !hasPrev) {
                log.debug("Missing price data, skipping. index={} symbol={} current={} previous={}",
                          config.name(), symbol, hasNow, hasPrev);
                missing.add(symbol);
                continue;
            }
            BigDecimal now  = prices.get(symbol);
            BigDecimal prev = prior.prices().get(symbol);
            BigDecimal periodReturn = now.subtract(prev).divide(prev, PRECISION);
            weightedReturn = weightedReturn.add(periodReturn.multiply(weight, PRECISION), PRECISION);
            usedWeight     = usedWeight.add(weight);
            used.add(symbol);
            pricesUsed.put(symbol, now);
        }

        BigDecimal raw = prior.value().multiply(BigDecimal.ONE.add(weightedReturn, PRECISION), PRECISION);
        return new WeightedComputation(raw, usedWeight, used, missing, pricesUsed);
    }
}
