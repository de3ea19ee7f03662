package com.sentindex.common.provenance;

import com.sentindex.common.composer.CompositionOutcome;
import com.sentindex.common.model.IndexResult;
import com.sentindex.common.model.PriceSet;
import com.sentindex.common.model.PriorPeriod;
import com.sentindex.common.model.ProvenanceRecord;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Assembles the final {@link IndexResult} with its {@link ProvenanceRecord}.
 *
 * <p>The timestamp comes from the injected {@link Clock}, never from the system clock
 * directly, so tests can pin it. Pure assembly; never fails for a valid outcome.
 */
public class ProvenanceRecorder {

    private final Clock clock;

    public ProvenanceRecorder(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param outcome composer output (value, method, coverage, used/missing symbols)
     * @param prices  the full price set handed to the composer, used to list ignored symbols
     */
    public IndexResult attach(CompositionOutcome outcome, PriceSet prices) {
        Instant computedAt = clock.instant();

        List<String> ignored = new ArrayList<>();
        if (prices != null) {
            for (String symbol : prices.symbols()) {
                if (!outcome.config().weights().containsKey(symbol)) {
                    ignored.add(symbol);
                }
            }
        }

        PriorPeriod prior = outcome.prior();
        ProvenanceRecord provenance = new ProvenanceRecord(
            outcome.symbolsUsed(),
            outcome.symbolsMissing(),
            ignored,
            outcome.pricesUsed(),
            outcome.config(),
            outcome.method(),
            prior != null && prior.prices() != null ? prior.prices().prices() : null,
            prior != null ? prior.value() : null,
            computedAt);

        return new IndexResult(outcome.config().name(), outcome.value(), outcome.method(),
                               outcome.coverageRatio(), computedAt, provenance);
    }
}
