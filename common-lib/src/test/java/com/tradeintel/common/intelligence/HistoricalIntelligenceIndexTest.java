package com.tradeintel.common.intelligence;

import com.tradeintel.common.model.CatalystStat;
import com.tradeintel.common.model.ConfidenceAdjustment;
import com.tradeintel.common.model.PlatformStats;
import com.tradeintel.common.model.SymbolIntelligence;
import com.tradeintel.common.model.SymbolProfile;
import com.tradeintel.common.model.TradeDirection;
import com.tradeintel.common.model.TradeOutcome;
import com.tradeintel.common.narrative.RuleBasedNarrativeGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.tradeintel.common.TestOutcomes.trade;
import static org.junit.jupiter.api.Assertions.*;

class HistoricalIntelligenceIndexTest {

    private static final IndexSettings S = IndexSettings.DEFAULTS;
    private static final RuleBasedNarrativeGenerator NARRATIVE = new RuleBasedNarrativeGenerator();

    /** NVDA: strong on long earnings, weak on short earnings. */
    private static List<TradeOutcome> nvdaLedger() {
        List<TradeOutcome> rows = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            rows.add(trade("NVDA").direction(TradeDirection.LONG).catalyst("earnings")
                .confidence(80.0).ret(4.0).pnl(400.0).build());
        }
        rows.add(trade("NVDA").direction(TradeDirection.LONG).catalyst("earnings")
            .confidence(80.0).ret(-2.0).pnl(-200.0).build());
        for (int i = 0; i < 3; i++) {
            rows.add(trade("NVDA").direction(TradeDirection.SHORT).catalyst("ai_news")
                .confidence(70.0).ret(-3.0).pnl(-300.0).build());
        }
        rows.add(trade("NVDA").direction(TradeDirection.LONG).open().build());
        return rows;
    }

    // ── profiles ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("symbol profiles")
    class ProfileTests {

        @Test
        @DisplayName("profile totals, direction split and best/worst catalyst")
        void profileContents() {
            HistoricalIntelligenceIndex index = HistoricalIntelligenceIndex.build(nvdaLedger(), S);
            SymbolProfile p = index.profile("nvda").orElseThrow();

            assertEquals(11, p.totalIdeas());
            assertEquals(10, p.closedTrades());
            assertEquals(6, p.wins());
            assertEquals(4, p.losses());
            assertEquals(60.0, p.overallWinRate(), 1e-9);
            assertEquals(6.0 / 7.0 * 100.0, p.longWinRate(), 1e-9);
            assertEquals(0.0, p.shortWinRate(), 1e-9);
            assertEquals(1300.0, p.totalPnl(), 1e-9);
            assertEquals("earnings", p.bestCatalyst());
            assertEquals("ai_news", p.worstCatalyst());
            assertEquals(77.0, p.avgConfidence(), 1e-9);
            assertNotNull(p.lastTradeAt());
        }

        @Test
        @DisplayName("symbol with only open ideas → null statistics, not 0%")
        void zeroClosedTrades() {
            HistoricalIntelligenceIndex index = HistoricalIntelligenceIndex.build(
                List.of(trade("PLTR").open().build()), S);
            SymbolProfile p = index.profile("PLTR").orElseThrow();

            assertEquals(1, p.totalIdeas());
            assertEquals(0, p.closedTrades());
            assertNull(p.overallWinRate());
            assertNull(p.profitFactor());
            assertNull(p.bestCatalyst());
        }

        @Test
        @DisplayName("unknown symbol lookup returns an all-null profile")
        void unknownSymbol() {
            SymbolIntelligence intel = HistoricalIntelligenceIndex.build(nvdaLedger(), S).lookup("ZZZ", NARRATIVE);
            assertEquals("ZZZ", intel.profile().symbol());
            assertNull(intel.profile().overallWinRate());
            assertTrue(intel.recentTrades().isEmpty());
            assertEquals(List.of("No closed trades for ZZZ yet."), intel.recommendations());
        }

        @Test
        @DisplayName("catalysts below the minimum sample are never best or worst")
        void catalystMinimumSample() {
            List<TradeOutcome> rows = List.of(
                trade("AMD").catalyst("earnings").ret(2.0).build(),
                trade("AMD").catalyst("earnings").ret(2.0).build());
            SymbolProfile p = HistoricalIntelligenceIndex.build(rows, S).profile("AMD").orElseThrow();
            assertNull(p.bestCatalyst());
            assertNull(p.worstCatalyst());
        }

        @Test
        @DisplayName("rebuilding from a shuffled ledger yields identical profiles")
        void rebuildIdentical() {
            List<TradeOutcome> ledger = nvdaLedger();
            List<TradeOutcome> shuffled = new ArrayList<>(ledger);
            Collections.shuffle(shuffled, new Random(7));
            assertEquals(HistoricalIntelligenceIndex.build(ledger, S).profiles(),
                         HistoricalIntelligenceIndex.build(shuffled, S).profiles());
        }
    }

    // ── lookup ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("lookup()")
    class LookupTests {

        @Test
        @DisplayName("returns recent trades newest first and per-direction catalyst rows")
        void lookupContents() {
            SymbolIntelligence intel = HistoricalIntelligenceIndex.build(nvdaLedger(), S).lookup("NVDA", NARRATIVE);

            assertEquals(10, intel.recentTrades().size());
            TradeOutcome newest = intel.recentTrades().get(0);
            TradeOutcome next = intel.recentTrades().get(1);
            assertTrue(newest.lastActivity().compareTo(next.lastActivity()) >= 0);

            assertEquals("earnings", intel.bestCatalyst().catalystType());
            assertTrue(intel.catalysts().stream().anyMatch(c -> c.direction() == TradeDirection.SHORT));
            CatalystStat combined = intel.catalysts().get(0);
            assertNull(combined.direction());
        }

        @Test
        @DisplayName("recommendations warn against shorting on the losing catalyst")
        void recommendations() {
            SymbolIntelligence intel = HistoricalIntelligenceIndex.build(nvdaLedger(), S).lookup("NVDA", NARRATIVE);
            assertTrue(intel.recommendations().contains(
                "Avoid shorting NVDA on ai_news catalysts: 0% win rate over 3 trades."),
                intel.recommendations().toString());
            assertTrue(intel.recommendations().stream().anyMatch(r -> r.startsWith("Favor long ideas on NVDA")));
        }
    }

    // ── platform stats ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("platform stats")
    class PlatformStatsTests {

        @Test
        @DisplayName("overall totals, catalyst ranking and performer lists")
        void stats() {
            List<TradeOutcome> ledger = new ArrayList<>(nvdaLedger());
            ledger.add(trade("AMD").catalyst("earnings").engine("beta").ret(-1.0).build());
            ledger.add(trade("AMD").catalyst("earnings").engine("beta").ret(-1.0).build());
            ledger.add(trade("AMD").catalyst("earnings").engine("beta").ret(1.0).build());

            PlatformStats stats = HistoricalIntelligenceIndex.build(ledger, S).platformStats();

            assertEquals(14, stats.overall().totalIdeas());
            assertEquals(13, stats.overall().closedIdeas());
            assertEquals(7, stats.overall().wins());
            assertEquals("earnings", stats.byCatalyst().get(0).key());
            assertEquals(List.of("alpha", "beta"), stats.bySource().stream().map(r -> r.key()).toList());
            assertEquals("NVDA", stats.symbolLeaderboard().get(0).symbol());
            assertEquals("NVDA", stats.topPerformers().get(0).symbol());
            assertEquals("AMD", stats.worstPerformers().get(0).symbol());
            assertEquals(5, stats.confidenceBands().size());
        }
    }

    // ── confidence adjustment ──────────────────────────────────────────────

    @Nested
    @DisplayName("confidenceAdjustment()")
    class AdjustmentTests {

        @Test
        @DisplayName("long earnings idea on NVDA: direction bias +5 and best catalyst +8")
        void favourableIdea() {
            ConfidenceAdjustment adj = HistoricalIntelligenceIndex.build(nvdaLedger(), S)
                .confidenceAdjustment("NVDA", "Earnings", TradeDirection.LONG);
            assertTrue(adj.hasHistory());
            assertEquals(13.0, adj.adjustment(), 1e-9);
            assertEquals(2, adj.reasons().size());
        }

        @Test
        @DisplayName("short ai_news idea on NVDA: direction −5 and worst catalyst −10")
        void unfavourableIdea() {
            ConfidenceAdjustment adj = HistoricalIntelligenceIndex.build(nvdaLedger(), S)
                .confidenceAdjustment("NVDA", "ai news", TradeDirection.SHORT);
            assertEquals(-15.0, adj.adjustment(), 1e-9);
        }

        @Test
        @DisplayName("thin history → zero adjustment")
        void insufficientHistory() {
            ConfidenceAdjustment adj = HistoricalIntelligenceIndex.build(
                List.of(trade("AMD").ret(3.0).build()), S).confidenceAdjustment("AMD", null, null);
            assertFalse(adj.hasHistory());
            assertEquals(0.0, adj.adjustment());
        }
    }

    // ── catalyst classifier ────────────────────────────────────────────────

    @Nested
    @DisplayName("CatalystClassifier")
    class ClassifierTests {

        @Test
        @DisplayName("keywords map to categories; first category wins")
        void classify() {
            assertEquals("earnings", CatalystClassifier.classify("Q3 earnings beat, raised guidance"));
            assertEquals("fda_approval", CatalystClassifier.classify("FDA grants approval"));
            assertEquals("ai_news", CatalystClassifier.classify("New AI chip from Nvidia"));
            assertEquals(CatalystClassifier.OTHER, CatalystClassifier.classify("CEO interview"));
            assertNull(CatalystClassifier.classify("  "));
        }

        @Test
        @DisplayName("short keywords match whole words only")
        void wordBoundaries() {
            assertEquals(CatalystClassifier.OTHER, CatalystClassifier.classify("strong gain today"));
        }

        @Test
        @DisplayName("normalize lower-cases and joins words with underscores")
        void normalize() {
            assertEquals("fda_approval", CatalystClassifier.normalize("FDA Approval"));
            assertEquals("merger_acquisition", CatalystClassifier.normalize("merger-acquisition"));
        }
    }
}
