package com.tradeintel.common.narrative;

import com.tradeintel.common.calibration.CalibrationAnalyzer;
import com.tradeintel.common.calibration.CalibrationSettings;
import com.tradeintel.common.model.CalibrationReport;
import com.tradeintel.common.model.EngineMetrics;
import com.tradeintel.common.model.HealthStatus;
import com.tradeintel.common.model.PlatformHealth;
import com.tradeintel.common.model.TradeOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.tradeintel.common.TestOutcomes.trade;
import static org.junit.jupiter.api.Assertions.*;

class RuleBasedNarrativeGeneratorTest {

    private final RuleBasedNarrativeGenerator narrative = new RuleBasedNarrativeGenerator();

    private static List<TradeOutcome> batch(double confidence, int wins, int losses) {
        List<TradeOutcome> rows = new ArrayList<>();
        for (int i = 0; i < wins; i++) rows.add(trade("X").confidence(confidence).ret(2.0).build());
        for (int i = 0; i < losses; i++) rows.add(trade("X").confidence(confidence).ret(-2.0).build());
        return rows;
    }

    @Nested
    @DisplayName("calibration advice")
    class CalibrationTests {

        @Test
        @DisplayName("overconfident 80-90 band produces Brier, band and adjustment lines")
        void overconfident() {
            CalibrationReport r = CalibrationAnalyzer.analyze(batch(80.0, 55, 45), CalibrationSettings.DEFAULTS);
            List<String> advice = narrative.calibrationRecommendations(r);

            assertTrue(advice.get(0).startsWith("High priority: Brier score 0.310"));
            assertTrue(advice.contains(
                "80-90% band is overconfident by 25.0 points (predicted 80.0%, actual 55.0%)."));
            assertTrue(advice.contains("Adjust 80-90% confidence down by 25 points."));
        }

        @Test
        @DisplayName("calibrated band with a weak Brier score → only the Brier line")
        void calibratedBandWeakBrier() {
            List<TradeOutcome> rows = new ArrayList<>(batch(55.0, 11, 9));
            CalibrationReport r = CalibrationAnalyzer.analyze(rows, CalibrationSettings.DEFAULTS);
            List<String> advice = narrative.calibrationRecommendations(r);
            assertEquals(1, advice.size());
            assertTrue(advice.get(0).startsWith("High priority"));
        }

        @Test
        @DisplayName("same report → same advice")
        void deterministic() {
            CalibrationReport r = CalibrationAnalyzer.analyze(batch(65.0, 3, 7), CalibrationSettings.DEFAULTS);
            assertEquals(narrative.calibrationRecommendations(r), narrative.calibrationRecommendations(r));
        }

        @Test
        @DisplayName("no samples → cannot assess")
        void noSamples() {
            CalibrationReport r = CalibrationAnalyzer.analyze(List.of(), CalibrationSettings.DEFAULTS);
            assertEquals(1, narrative.calibrationRecommendations(r).size());
        }
    }

    @Nested
    @DisplayName("health narrative")
    class HealthTests {

        @Test
        @DisplayName("unhealthy engine is named in issues and recommendations")
        void unhealthyEngine() {
            EngineMetrics beta = new EngineMetrics("beta", 20, 5, 15, 0, 25.0, -0.5, null, 0.7,
                                                   null, null, null, null, null);
            PlatformHealth h = new PlatformHealth(HealthStatus.DEGRADED, 60, 0.8, 1.6, 55.0,
                                                  List.of("beta"), List.of(), List.of());

            assertTrue(narrative.healthIssues(h, List.of(beta)).stream().anyMatch(s -> s.contains("beta")));
            assertTrue(narrative.healthRecommendations(h, List.of(beta)).contains(
                "Reduce reliance on beta until its expectancy turns positive."));
        }

        @Test
        @DisplayName("healthy platform → no issues, one reassurance")
        void healthy() {
            PlatformHealth h = new PlatformHealth(HealthStatus.HEALTHY, 60, 0.8, 1.6, 55.0,
                                                  List.of(), List.of(), List.of());
            assertTrue(narrative.healthIssues(h, List.of()).isEmpty());
            assertEquals(1, narrative.healthRecommendations(h, List.of()).size());
        }
    }
}
