package com.sentindex.common.composer;

import com.sentindex.common.exception.ComputationException;
import com.sentindex.common.exception.ValidationException;
import com.sentindex.common.model.CalculationMethod;
import com.sentindex.common.model.IndexConfig;
import com.sentindex.common.model.PriceSet;
import com.sentindex.common.model.PriorPeriod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

import static com.sentindex.common.composer.IndexFixtures.basePrices;
import static com.sentindex.common.composer.IndexFixtures.currentPrices;
import static com.sentindex.common.composer.IndexFixtures.goldSilverOilCrypto;
import static com.sentindex.common.composer.IndexFixtures.without;
import static org.junit.jupiter.api.Assertions.*;

class IndexComposerTest {

    private final IndexComposer composer = new IndexComposer();
    private final IndexConfig config = goldSilverOilCrypto();

    @Nested
    @DisplayName("level-normalized")
    class LevelNormalized {

        @Test
        @DisplayName("prices equal to base prices → value equals base level")
        void basePricesYieldBaseLevel() {
            CompositionOutcome outcome = composer.compute(config, basePrices(), CalculationMethod.LEVEL_NORMALIZED);

            assertEquals(new BigDecimal("1000.00"), outcome.value());
            assertEquals(0, BigDecimal.ONE.compareTo(outcome.coverageRatio()));
        }

        @Test
        @DisplayName("Gold-Silver-Oil-Crypto example matches Σ(price/base × weight) × 1000")
        void endToEndExample() {
            MathContext mc = MathContext.DECIMAL128;
            BigDecimal expectedScore = BigDecimal.ZERO;
            for (Map.Entry<String, BigDecimal> w : config.weights().entrySet()) {
                BigDecimal ratio = currentPrices().get(w.getKey()).divide(config.basePrices().get(w.getKey()), mc);
                expectedScore = expectedScore.add(ratio.multiply(w.getValue(), mc), mc);
            }
            BigDecimal expected = expectedScore.multiply(config.baseLevel(), mc).setScale(2, RoundingMode.HALF_EVEN);

            CompositionOutcome outcome = composer.compute(config, currentPrices(), CalculationMethod.LEVEL_NORMALIZED);

            assertEquals(expected, outcome.value());
            assertEquals(new BigDecimal("1220.72"), outcome.value());
            assertEquals(List.of("GOLD", "SILVER", "OIL", "BTC", "ETH"), outcome.symbolsUsed());
            assertTrue(outcome.symbolsMissing().isEmpty());
            assertNull(outcome.prior());
        }

        @Test
        @DisplayName("a high-magnitude asset does not dominate: doubling BTC and doubling SILVER move the index equally")
        void noMagnitudeDominance() {
            IndexConfig twoAsset = new IndexConfig("pair", new BigDecimal("100"), null,
                Map.of("BTC", new BigDecimal("0.5"), "SILVER", new BigDecimal("0.5")),
                Map.of("BTC", new BigDecimal("20000"), "SILVER", new BigDecimal("23")));

            BigDecimal btcDoubled = composer.compute(twoAsset,
                PriceSet.of(Map.of("BTC", new BigDecimal("40000"), "SILVER", new BigDecimal("23"))),
                CalculationMethod.LEVEL_NORMALIZED).value();
            BigDecimal silverDoubled = composer.compute(twoAsset,
                PriceSet.of(Map.of("BTC", new BigDecimal("20000"), "SILVER", new BigDecimal("46"))),
                CalculationMethod.LEVEL_NORMALIZED).value();

            assertEquals(new BigDecimal("150.00"), btcDoubled);
            assertEquals(btcDoubled, silverDoubled);
        }

        @Test
        @DisplayName("unconfigured symbols are ignored")
        void extraSymbolsIgnored() {
            Map<String, BigDecimal> withExtra = new java.util.LinkedHashMap<>(basePrices().prices());
            withExtra.put("DOGE", new BigDecimal("0.07"));

            CompositionOutcome outcome = composer.compute(config, PriceSet.of(withExtra), CalculationMethod.LEVEL_NORMALIZED);

            assertEquals(new BigDecimal("1000.00"), outcome.value());
            assertFalse(outcome.symbolsUsed().contains("DOGE"));
            assertFalse(outcome.pricesUsed().containsKey("DOGE"));
        }

        @Test
        @DisplayName("rounding is half-even, applied once")
        void halfEvenRounding() {
            IndexConfig single = new IndexConfig("single", BigDecimal.ONE, null,
                Map.of("X", BigDecimal.ONE), Map.of("X", BigDecimal.ONE));

            assertEquals(new BigDecimal("2.12"),
                composer.compute(single, PriceSet.of(Map.of("X", new BigDecimal("2.125"))),
                                 CalculationMethod.LEVEL_NORMALIZED).value());
            assertEquals(new BigDecimal("2.14"),
                composer.compute(single, PriceSet.of(Map.of("X", new BigDecimal("2.135"))),
                                 CalculationMethod.LEVEL_NORMALIZED).value());
        }

        @Test
        @DisplayName("identical inputs → identical value and coverage")
        void idempotent() {
            CompositionOutcome first  = composer.compute(config, currentPrices(), CalculationMethod.LEVEL_NORMALIZED);
            CompositionOutcome second = composer.compute(config, currentPrices(), CalculationMethod.LEVEL_NORMALIZED);

            assertEquals(first.value(), second.value());
            assertEquals(first.coverageRatio(), second.coverageRatio());
        }
    }

    @Nested
    @DisplayName("return-based")
    class ReturnBased {

        @Test
        @DisplayName("flat prices → value equals previous value")
        void flatPricesKeepPreviousValue() {
            PriorPeriod prior = PriorPeriod.of(currentPrices(), new BigDecimal("1234.56"));

            CompositionOutcome outcome = composer.compute(config, currentPrices(), CalculationMethod.RETURN_BASED, null, prior);

            assertEquals(new BigDecimal("1234.56"), outcome.value());
            assertSame(prior, outcome.prior());
        }

        @Test
        @DisplayName("from base prices at base level, return-based equals level-normalized")
        void agreesWithLevelFromBase() {
            PriorPeriod prior = PriorPeriod.of(basePrices(), new BigDecimal("1000"));

            CompositionOutcome chained = composer.compute(config, currentPrices(), CalculationMethod.RETURN_BASED, null, prior);
            CompositionOutcome level   = composer.compute(config, currentPrices(), CalculationMethod.LEVEL_NORMALIZED);

            assertEquals(level.value(), chained.value());
        }

        @Test
        @DisplayName("+10% on every asset → previous value × 1.1")
        void uniformReturn() {
            IndexConfig pair = new IndexConfig("pair", new BigDecimal("100"), null,
                Map.of("A", new BigDecimal("0.6"), "B", new BigDecimal("0.4")),
                Map.of("A", BigDecimal.TEN, "B", BigDecimal.ONE));
            PriorPeriod prior = PriorPeriod.of(
                PriceSet.of(Map.of("A", new BigDecimal("50"), "B", new BigDecimal("2"))), new BigDecimal("200"));

            CompositionOutcome outcome = composer.compute(pair,
                PriceSet.of(Map.of("A", new BigDecimal("55"), "B", new BigDecimal("2.2"))),
                CalculationMethod.RETURN_BASED, null, prior);

            assertEquals(new BigDecimal("220.00"), outcome.value());
        }

        @Test
        @DisplayName("no prior period → no_prior_period")
        void missingPrior() {
            ComputationException ex = assertThrows(ComputationException.class,
                () -> composer.compute(config, currentPrices(), CalculationMethod.RETURN_BASED));
            assertEquals(ComputationException.NO_PRIOR_PERIOD, ex.getReason());
        }

        @Test
        @DisplayName("symbol absent from the previous period counts as missing")
        void symbolMissingInPreviousPeriod() {
            PriorPeriod prior = PriorPeriod.of(without(basePrices(), "ETH"), new BigDecimal("1000"));

            CompositionOutcome outcome = composer.compute(config, currentPrices(), CalculationMethod.RETURN_BASED, null, prior);

            assertEquals(List.of("ETH"), outcome.symbolsMissing());
            assertEquals(0, new BigDecimal("0.85").compareTo(outcome.coverageRatio()));
        }
    }

    @Nested
    @DisplayName("coverage policy")
    class Coverage {

        @Test
        @DisplayName("missing symbols are excluded and reported in configuration order")
        void missingSymbolsReported() {
            CompositionOutcome outcome = composer.compute(config, without(currentPrices(), "ETH", "SILVER"),
                                                          CalculationMethod.LEVEL_NORMALIZED);

            assertEquals(List.of("SILVER", "ETH"), outcome.symbolsMissing());
            assertEquals(List.of("GOLD", "OIL", "BTC"), outcome.symbolsUsed());
            assertEquals(0, new BigDecimal("0.6").compareTo(outcome.coverageRatio()));
        }

        @Test
        @DisplayName("coverage never decreases as more configured symbols are supplied")
        void monotonicCoverage() {
            String[] order = {"GOLD", "SILVER", "OIL", "BTC", "ETH"};
            BigDecimal previous = BigDecimal.ZERO;
            for (int supplied = 1; supplied <= order.length; supplied++) {
                Map<String, BigDecimal> partial = new java.util.LinkedHashMap<>();
                for (int i = 0; i < supplied; i++) {
                    partial.put(order[i], currentPrices().get(order[i]));
                }
                CompositionOutcome outcome = composer.compute(config, PriceSet.of(partial),
                    CalculationMethod.LEVEL_NORMALIZED, BigDecimal.ZERO, null);

                assertTrue(outcome.coverageRatio().compareTo(previous) >= 0);
                assertEquals(outcome.symbolsMissing().isEmpty(),
                             outcome.coverageRatio().compareTo(BigDecimal.ONE) == 0);
                previous = outcome.coverageRatio();
            }
            assertEquals(0, BigDecimal.ONE.compareTo(previous));
        }

        @Test
        @DisplayName("coverage below the default 0.5 → insufficient_coverage with the ratio")
        void belowDefaultThreshold() {
            ComputationException ex = assertThrows(ComputationException.class,
                () -> composer.compute(config, without(currentPrices(), "GOLD", "SILVER", "OIL"),
                                       CalculationMethod.LEVEL_NORMALIZED));

            assertEquals(ComputationException.INSUFFICIENT_COVERAGE, ex.getReason());
            assertEquals(0, new BigDecimal("0.3").compareTo(ex.getCoverageRatio()));
        }

        @Test
        @DisplayName("coverage exactly at the threshold is accepted")
        void atThreshold() {
            CompositionOutcome outcome = composer.compute(config, without(currentPrices(), "OIL", "BTC", "ETH"),
                                                          CalculationMethod.LEVEL_NORMALIZED);
            assertEquals(0, new BigDecimal("0.5").compareTo(outcome.coverageRatio()));
        }

        @Test
        @DisplayName("caller-supplied threshold overrides the default")
        void callerThreshold() {
            PriceSet partial = without(currentPrices(), "ETH");

            assertThrows(ComputationException.class,
                () -> composer.compute(config, partial, CalculationMethod.LEVEL_NORMALIZED, new BigDecimal("0.9"), null));
            assertNotNull(composer.compute(config, partial, CalculationMethod.LEVEL_NORMALIZED, new BigDecimal("0.85"), null));
        }

        @Test
        @DisplayName("threshold outside [0, 1] is rejected")
        void invalidThreshold() {
            ValidationException ex = assertThrows(ValidationException.class,
                () -> composer.compute(config, currentPrices(), CalculationMethod.LEVEL_NORMALIZED, new BigDecimal("1.5"), null));
            assertEquals(ValidationException.INVALID_THRESHOLD, ex.getReason());
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        @DisplayName("null config → missing_config")
        void missingConfig() {
            ComputationException ex = assertThrows(ComputationException.class,
                () -> composer.compute(null, currentPrices(), CalculationMethod.LEVEL_NORMALIZED));
            assertEquals(ComputationException.MISSING_CONFIG, ex.getReason());
        }

        @Test
        @DisplayName("null method → unsupported_method")
        void nullMethod() {
            ComputationException ex = assertThrows(ComputationException.class,
                () -> composer.compute(config, currentPrices(), null));
            assertEquals(ComputationException.UNSUPPORTED_METHOD, ex.getReason());
        }

        @Test
        @DisplayName("method without a registered strategy → unsupported_method")
        void unregisteredStrategy() {
            IndexComposer levelOnly = new IndexComposer(List.of(new LevelNormalizedStrategy()),
                new IndexConfigValidator(), IndexComposer.DEFAULT_MIN_COVERAGE);

            ComputationException ex = assertThrows(ComputationException.class,
                () -> levelOnly.compute(config, currentPrices(), CalculationMethod.RETURN_BASED, null,
                                        PriorPeriod.of(basePrices(), BigDecimal.TEN)));
            assertEquals(ComputationException.UNSUPPORTED_METHOD, ex.getReason());
        }

        @Test
        @DisplayName("all-zero weights → zero_sum_weights")
        void zeroSumWeights() {
            IndexConfig zero = new IndexConfig("zero", BigDecimal.TEN, null,
                Map.of("A", BigDecimal.ZERO), Map.of("A", BigDecimal.ONE));

            ComputationException ex = assertThrows(ComputationException.class,
                () -> composer.compute(zero, PriceSet.of(Map.of("A", BigDecimal.ONE)), CalculationMethod.LEVEL_NORMALIZED));
            assertEquals(ComputationException.ZERO_SUM_WEIGHTS, ex.getReason());
        }
    }
}
