package com.tradeintel.common.calibration;

import com.tradeintel.common.model.CalibrationBin;
import com.tradeintel.common.model.CalibrationReport;
import com.tradeintel.common.model.ConfidenceBandRow;
import com.tradeintel.common.model.TradeOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.tradeintel.common.TestOutcomes.trade;
import static org.junit.jupiter.api.Assertions.*;

class CalibrationAnalyzerTest {

    private static List<TradeOutcome> batch(double confidence, int wins, int losses) {
        List<TradeOutcome> rows = new ArrayList<>();
        for (int i = 0; i < wins; i++) rows.add(trade("X").confidence(confidence).ret(2.0).build());
        for (int i = 0; i < losses; i++) rows.add(trade("X").confidence(confidence).ret(-2.0).build());
        return rows;
    }

    // ── bins ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("bins")
    class BinTests {

        @Test
        @DisplayName("default bins partition [0, 100] into ten non-overlapping buckets")
        void tenBins() {
            CalibrationReport r = CalibrationAnalyzer.analyze(List.of(), CalibrationSettings.DEFAULTS);
            assertEquals(10, r.bins().size());
            for (int i = 0; i < 10; i++) {
                assertEquals(i * 10.0, r.bins().get(i).lowerBound());
                assertEquals((i + 1) * 10.0, r.bins().get(i).upperBound());
            }
            assertEquals("90-100%", r.bins().get(9).label());
        }

        @Test
        @DisplayName("confidence 100 lands in the last bin, 0 in the first")
        void boundaryConfidence() {
            assertEquals(9, CalibrationAnalyzer.binIndex(100.0, 10.0, 10));
            assertEquals(0, CalibrationAnalyzer.binIndex(0.0, 10.0, 10));
            assertEquals(8, CalibrationAnalyzer.binIndex(80.0, 10.0, 10));
        }

        @Test
        @DisplayName("empty bins are rendered with null statistics")
        void emptyBinsRendered() {
            CalibrationReport r = CalibrationAnalyzer.analyze(batch(85.0, 3, 2), CalibrationSettings.DEFAULTS);
            CalibrationBin empty = r.bins().get(2);
            assertEquals(0, empty.sampleSize());
            assertNull(empty.predictedConfidence());
            assertNull(empty.actualWinRate());
            assertNull(empty.calibrated());
        }

        @Test
        @DisplayName("breakevens count toward the bin sample but not the Brier score")
        void breakevensInBinsOnly() {
            List<TradeOutcome> rows = new ArrayList<>(batch(75.0, 1, 0));
            rows.add(trade("X").confidence(75.0).ret(0.0).build());

            CalibrationReport r = CalibrationAnalyzer.analyze(rows, CalibrationSettings.DEFAULTS);
            assertEquals(2, r.bins().get(7).sampleSize());
            assertEquals(50.0, r.bins().get(7).actualWinRate(), 1e-9);
            // only the win contributes: (0.75 − 1)² = 0.0625
            assertEquals(0.0625, r.brierScore(), 1e-9);
        }

        @Test
        @DisplayName("rows without a confidence score are excluded and counted")
        void missingConfidenceExcluded() {
            List<TradeOutcome> rows = new ArrayList<>(batch(55.0, 2, 1));
            rows.add(trade("X").ret(3.0).build());
            CalibrationReport r = CalibrationAnalyzer.analyze(rows, CalibrationSettings.DEFAULTS);
            assertEquals(3, r.totalSamples());
            assertEquals(1, r.excludedRecords());
        }

        @Test
        @DisplayName("confidences outside [0, 100] are excluded and counted like missing ones")
        void outOfRangeConfidenceExcluded() {
            List<TradeOutcome> rows = new ArrayList<>(batch(55.0, 2, 1));
            rows.add(trade("X").confidence(150.0).ret(3.0).build());
            rows.add(trade("X").confidence(-5.0).ret(-3.0).build());
            rows.add(trade("X").confidence(Double.NaN).ret(3.0).build());

            CalibrationReport r = CalibrationAnalyzer.analyze(rows, CalibrationSettings.DEFAULTS);

            assertEquals(3, r.totalSamples());
            assertEquals(3, r.excludedRecords());
            assertEquals(3, r.bins().get(5).sampleSize());
            assertEquals(0, r.bins().get(9).sampleSize());
        }
    }

    // ── scores ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Brier, ECE and reliability")
    class ScoreTests {

        @Test
        @DisplayName("100 predictions at 80% with 55 wins → bin 80-90 uncalibrated, gap 25")
        void overconfidentBand() {
            CalibrationReport r = CalibrationAnalyzer.analyze(batch(80.0, 55, 45), CalibrationSettings.DEFAULTS);
            CalibrationBin bin = r.bins().get(8);

            assertEquals(100, bin.sampleSize());
            assertEquals(80.0, bin.predictedConfidence(), 1e-9);
            assertEquals(55.0, bin.actualWinRate(), 1e-9);
            assertEquals(Boolean.FALSE, bin.calibrated());
            assertEquals(25.0, r.expectedCalibrationError(), 1e-9);
            assertEquals(50.0, r.reliabilityScore(), 1e-9);
            // 0.55·0.04 + 0.45·0.64
            assertEquals(0.31, r.brierScore(), 1e-9);
        }

        @Test
        @DisplayName("perfectly calibrated dataset → ECE 0, reliability 100")
        void perfectCalibration() {
            List<TradeOutcome> rows = new ArrayList<>();
            rows.addAll(batch(75.0, 6, 2));
            rows.addAll(batch(50.0, 5, 5));
            rows.addAll(batch(90.0, 9, 1));

            CalibrationReport r = CalibrationAnalyzer.analyze(rows, CalibrationSettings.DEFAULTS);
            assertEquals(0.0, r.expectedCalibrationError(), 1e-9);
            assertEquals(100.0, r.reliabilityScore(), 1e-9);
            assertTrue(r.bins().stream().filter(b -> b.sampleSize() > 0).allMatch(b -> b.calibrated()));
        }

        @Test
        @DisplayName("Brier score stays within [0, 1]")
        void brierBounds() {
            CalibrationReport worst = CalibrationAnalyzer.analyze(batch(100.0, 0, 10), CalibrationSettings.DEFAULTS);
            CalibrationReport best = CalibrationAnalyzer.analyze(batch(100.0, 10, 0), CalibrationSettings.DEFAULTS);
            assertEquals(1.0, worst.brierScore(), 1e-9);
            assertEquals(0.0, best.brierScore(), 1e-9);
        }

        @Test
        @DisplayName("bins below the sample minimum are reported but left out of ECE")
        void sparseBinsIgnoredByEce() {
            List<TradeOutcome> rows = new ArrayList<>();
            rows.addAll(batch(65.0, 13, 7));     // 65 vs 65 → calibrated
            rows.addAll(batch(95.0, 0, 3));      // 3 samples, gap 95, ineligible

            CalibrationReport r = CalibrationAnalyzer.analyze(rows, CalibrationSettings.DEFAULTS);
            assertFalse(r.bins().get(9).eligible());
            assertEquals(0.0, r.expectedCalibrationError(), 1e-9);
            assertEquals(0.0, r.maxCalibrationError(), 1e-9);
        }

        @Test
        @DisplayName("ECE ≥ 50 clamps reliability to 0; no eligible bins → null scores")
        void reliabilityClampAndNulls() {
            CalibrationReport bad = CalibrationAnalyzer.analyze(batch(95.0, 0, 10), CalibrationSettings.DEFAULTS);
            assertEquals(0.0, bad.reliabilityScore(), 1e-9);

            CalibrationReport thin = CalibrationAnalyzer.analyze(batch(95.0, 1, 1), CalibrationSettings.DEFAULTS);
            assertNull(thin.expectedCalibrationError());
            assertNull(thin.reliabilityScore());
        }

        @Test
        @DisplayName("settings reject a zero bin width")
        void rejectsZeroWidth() {
            assertThrows(IllegalArgumentException.class, () -> new CalibrationSettings(0.0, 10.0, 5));
        }
    }

    // ── confidence band table ──────────────────────────────────────────────

    @Nested
    @DisplayName("ConfidenceBandTable")
    class BandTableTests {

        @Test
        @DisplayName("five fixed bands with midpoint expectations and actual − expected error")
        void bandRows() {
            List<TradeOutcome> rows = new ArrayList<>(batch(72.0, 3, 1));
            rows.add(trade("X").confidence(71.0).open().build());

            List<ConfidenceBandRow> table = ConfidenceBandTable.build(rows);
            assertEquals(5, table.size());
            assertEquals("0-60", table.get(0).label());

            ConfidenceBandRow band = table.get(2);
            assertEquals("70-80", band.label());
            assertEquals(4, band.ideaCount());
            assertEquals(4, band.closedCount());
            assertEquals(75.0, band.expectedWinRate(), 1e-9);
            assertEquals(75.0, band.actualWinRate(), 1e-9);
            assertEquals(0.0, band.calibrationError(), 1e-9);

            assertNull(table.get(4).actualWinRate());
        }

        @Test
        @DisplayName("open ideas and out-of-range confidences do not raise ideaCount")
        void ideaCountIsClosedOnly() {
            List<TradeOutcome> rows = new ArrayList<>(batch(95.0, 1, 1));
            rows.add(trade("X").confidence(95.0).open().build());
            rows.add(trade("X").confidence(95.0).open().build());
            rows.add(trade("X").confidence(180.0).ret(2.0).build());

            ConfidenceBandRow top = ConfidenceBandTable.build(rows).get(4);

            assertEquals(2, top.ideaCount());
            assertEquals(top.closedCount(), top.ideaCount());
            assertEquals(50.0, top.actualWinRate(), 1e-9);
        }

        @Test
        @DisplayName("confidence 100 falls in the 90-100 band")
        void topBand() {
            assertEquals(4, ConfidenceBandTable.bandOf(100.0));
            assertEquals(0, ConfidenceBandTable.bandOf(59.9));
            assertEquals(1, ConfidenceBandTable.bandOf(60.0));
        }
    }
}
