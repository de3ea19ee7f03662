package com.sentindex.common.normalize;

import com.sentindex.common.exception.ValidationException;
import com.sentindex.common.model.PriceSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PriceNormalizerTest {

    private final PriceNormalizer normalizer = new PriceNormalizer();

    @Test
    @DisplayName("positive numbers of any numeric type become decimals under canonical symbols")
    void acceptsPositiveValues() {
        Map<String, Number> raw = new LinkedHashMap<>();
        raw.put(" gold ", 1900.12);
        raw.put("BTC", 27450);
        raw.put("eth", new BigDecimal("1850.0"));

        PriceSet prices = normalizer.normalize(raw);

        assertEquals(Set.of("GOLD", "BTC", "ETH"), prices.symbols());
        assertEquals(0, new BigDecimal("1900.12").compareTo(prices.get("GOLD")));
        assertEquals(0, new BigDecimal("27450").compareTo(prices.get("BTC")));
    }

    @Test
    void zeroIsRejected() {
        assertReason(ValidationException.NON_POSITIVE_PRICE, Map.of("GOLD", 0.0));
    }

    @Test
    void negativeIsRejected() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> normalizer.normalize(Map.of("OIL", -1)));
        assertEquals(ValidationException.NON_POSITIVE_PRICE, ex.getReason());
        assertEquals("OIL", ex.getSymbol());
    }

    @Test
    void nanAndInfinityAreRejected() {
        assertReason(ValidationException.NON_POSITIVE_PRICE, Map.of("BTC", Double.NaN));
        assertReason(ValidationException.NON_POSITIVE_PRICE, Map.of("BTC", Double.POSITIVE_INFINITY));
        assertReason(ValidationException.NON_POSITIVE_PRICE, Map.of("BTC", Float.NEGATIVE_INFINITY));
    }

    @Test
    void nullValueIsMissing() {
        Map<String, Number> raw = new HashMap<>();
        raw.put("SILVER", null);
        assertReason(ValidationException.MISSING_PRICE, raw);
    }

    @Test
    void blankSymbolIsRejected() {
        assertReason(ValidationException.BLANK_SYMBOL, Map.of("  ", 1.0));
    }

    @Test
    @DisplayName("case variants of one symbol collapse to the first price supplied")
    void caseVariantsKeepFirstPrice() {
        Map<String, Number> raw = new LinkedHashMap<>();
        raw.put("gold", 1.0);
        raw.put("GOLD", 2.0);

        PriceSet prices = normalizer.normalize(raw);

        assertEquals(Set.of("GOLD"), prices.symbols());
        assertEquals(0, BigDecimal.ONE.compareTo(prices.get("GOLD")));
    }

    @Test
    @DisplayName("one bad value fails the whole call")
    void oneBadValueFailsAll() {
        Map<String, Number> raw = new LinkedHashMap<>();
        raw.put("GOLD", 1900.0);
        raw.put("OIL", 0);
        assertReason(ValidationException.NON_POSITIVE_PRICE, raw);
    }

    @Test
    void unknownSymbolsAreDroppedWhenKnownSetGiven() {
        PriceSet prices = normalizer.normalize(Map.of("GOLD", 1900.0, "DOGE", 0.07), Set.of("GOLD", "SILVER"));

        assertEquals(Set.of("GOLD"), prices.symbols());
    }

    @Test
    void nullOrEmptyInputGivesEmptySet() {
        assertTrue(normalizer.normalize(null).isEmpty());
        assertTrue(normalizer.normalize(Map.of()).isEmpty());
    }

    private void assertReason(String reason, Map<String, ? extends Number> raw) {
        ValidationException ex = assertThrows(ValidationException.class, () -> normalizer.normalize(raw));
        assertEquals(reason, ex.getReason());
    }
}
