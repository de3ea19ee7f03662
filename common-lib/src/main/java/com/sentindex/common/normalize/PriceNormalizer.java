package com.sentindex.common.normalize;

import com.sentindex.common.exception.ValidationException;
import com.sentindex.common.model.PriceSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Validates and coerces a raw symbol → number mapping into a {@link PriceSet}.
 *
 * <p>Symbols are trimmed and upper-cased. Any zero, negative, NaN or infinite value fails the
 * whole call with {@code non_positive_price}; a {@code null} value fails with
 * {@code missing_price}. The normalizer is config-agnostic: reconciling the price set with an
 * index's weights is the composer's job. Callers that know which symbols they care about may
 * pass them to {@link #normalize(Map, Collection)} to drop the rest.
 *
 * <p>Pure and thread-safe.
 */
public class PriceNormalizer {

    private static final Logger log = LoggerFactory.getLogger(PriceNormalizer.class);

    public PriceSet normalize(Map<String, ? extends Number> raw) {
        return normalize(raw, null);
    }

    /**
     * @param knownSymbols symbols to keep (upper-case); {@code null} keeps everything
     * @throws ValidationException on the first invalid entry
     */
    public PriceSet normalize(Map<String, ? extends Number> raw, Collection<String> knownSymbols) {
        if (raw == null || raw.isEmpty()) {
            return PriceSet.empty();
        }
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        for (Map.Entry<String, ? extends Number> entry : raw.entrySet()) {
            String symbol = canonicalSymbol(entry.getKey());
            BigDecimal price = toPositiveDecimal(symbol, entry.getValue());
            if (prices.putIfAbsent(symbol, price) != null) {
                log.debug("Symbol supplied more than once, keeping the first price. symbol={} ignored={}",
                          symbol, price);
            }
        }
        if (knownSymbols != null) {
            prices.keySet().removeIf(symbol -> {
                boolean unknown = !knownSymbols.contains(symbol);
                if (unknown) {
                    log.debug("Dropping unrecognised symbol. symbol={}", symbol);
                }
                return unknown;
            });
        }
        return new PriceSet(prices);
    }

    public static String canonicalSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new ValidationException(ValidationException.BLANK_SYMBOL, symbol, "price symbol is blank");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    private static BigDecimal toPositiveDecimal(String symbol, Number value) {
        if (value == null) {
            throw new ValidationException(ValidationException.MISSING_PRICE, symbol,
                "price for " + symbol + " is missing");
        }
        BigDecimal decimal;
        if (value instanceof BigDecimal bd) {
            decimal = bd;
        } else if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (!Double.isFinite(d)) {
                throw ValidationException.nonPositivePrice(symbol, value);
            }
            decimal = BigDecimal.valueOf(d);
        } else if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            decimal = BigDecimal.valueOf(value.longValue());
        } else {
            try {
                decimal = new BigDecimal(value.toString());
            } catch (NumberFormatException e) {
                throw ValidationException.nonPositivePrice(symbol, value);
            }
        }
        if (decimal.signum() <= 0) {
            throw ValidationException.nonPositivePrice(symbol, value);
        }
        return decimal;
    }
}
