package com.tradeintel.intelligence.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeintel.common.model.EngineMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IntelligenceConfigTest {

    private final ObjectMapper mapper = new IntelligenceConfig().objectMapper();

    @Test
    @DisplayName("division-by-zero sentinels are written as \"Infinity\" strings")
    void infinitySentinel() throws Exception {
        EngineMetrics m = new EngineMetrics("alpha", 2, 2, 0, 0, 100.0, 1.5, Double.POSITIVE_INFINITY,
                                            Double.POSITIVE_INFINITY, 0.0, 1.5, null, 3.0, null);

        String json = mapper.writeValueAsString(m);

        assertTrue(json.contains("\"profitFactor\":\"Infinity\""), json);
        assertTrue(json.contains("\"sharpeRatio\":\"Infinity\""), json);
        assertTrue(json.contains("\"avgLossPercent\":null"), json);
    }

    @Test
    @DisplayName("timestamps are ISO-8601 strings")
    void isoTimestamps() throws Exception {
        String json = mapper.writeValueAsString(Map.of("at", Instant.parse("2025-03-03T14:30:00Z")));

        assertEquals("{\"at\":\"2025-03-03T14:30:00Z\"}", json);
    }
}
