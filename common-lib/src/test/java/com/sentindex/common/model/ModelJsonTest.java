package com.sentindex.common.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sentindex.common.composer.IndexComposer;
import com.sentindex.common.composer.IndexFixtures;
import com.sentindex.common.exception.ComputationException;
import com.sentindex.common.provenance.ProvenanceRecorder;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ModelJsonTest {

    private final ObjectMapper mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Test
    void indexResultUsesWireFieldNamesAndSurvivesTransport() throws Exception {
        IndexResult result = new ProvenanceRecorder(Clock.fixed(Instant.parse("2025-09-30T07:40:00Z"), ZoneOffset.UTC))
            .attach(new IndexComposer().compute(IndexFixtures.goldSilverOilCrypto(), IndexFixtures.currentPrices(),
                                                CalculationMethod.LEVEL_NORMALIZED),
                    IndexFixtures.currentPrices());

        String json = mapper.writeValueAsString(result);
        JsonNode node = mapper.readTree(json);

        assertEquals("gold_silver_oil_crypto", node.path("index_name").asText());
        assertEquals("level_normalized", node.path("method").asText());
        assertEquals(1220.72, node.path("index_value").asDouble(), 1e-9);
        assertTrue(node.path("provenance").path("symbols_used").isArray());
        assertEquals("2025-01-01", node.path("provenance").path("config").path("base_date").asText());
        assertFalse(node.path("provenance").has("previous_value"));

        IndexResult back = mapper.readValue(json, IndexResult.class);
        assertEquals(result.value(), back.value());
        assertEquals(result.provenance().symbolsUsed(), back.provenance().symbolsUsed());
        assertEquals(result.provenance().pricesUsed(), back.provenance().pricesUsed());
    }

    @Test
    void methodWireNames() {
        assertEquals(CalculationMethod.RETURN_BASED, CalculationMethod.fromWire("return_based"));
        assertEquals(CalculationMethod.LEVEL_NORMALIZED, CalculationMethod.fromWire("LEVEL_NORMALIZED"));
        assertEquals(CalculationMethod.LEVEL_NORMALIZED, CalculationMethod.fromWire(null));

        ComputationException ex = assertThrows(ComputationException.class, () -> CalculationMethod.fromWire("geometric"));
        assertEquals(ComputationException.UNSUPPORTED_METHOD, ex.getReason());
    }

    @Test
    void degradedInsightShape() {
        InsightResult degraded = InsightResult.degraded(Instant.EPOCH);

        assertEquals(Sentiment.UNKNOWN, degraded.sentiment());
        assertEquals(InsightSource.FALLBACK, degraded.source());
        assertEquals("insight unavailable", degraded.summary());
        assertTrue(degraded.notableEvents().isEmpty());
        assertTrue(degraded.riskFactors().isEmpty());
    }
}
