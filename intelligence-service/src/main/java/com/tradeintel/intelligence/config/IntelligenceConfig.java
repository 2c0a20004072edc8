package com.tradeintel.intelligence.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradeintel.common.calibration.CalibrationSettings;
import com.tradeintel.common.health.HealthThresholds;
import com.tradeintel.common.intelligence.IndexSettings;
import com.tradeintel.common.narrative.NarrativeGenerator;
import com.tradeintel.common.narrative.RuleBasedNarrativeGenerator;
import com.tradeintel.common.snapshot.SnapshotCache;
import com.tradeintel.common.weights.WeightSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class IntelligenceConfig {

    @Value("${intelligence.ledger.breakeven-band:0.1}")
    private double breakevenBand;

    @Value("${intelligence.ledger.recent-limit:20}")
    private int recentLimit;

    @Value("${intelligence.calibration.bin-width:10}")
    private double binWidth;

    @Value("${intelligence.calibration.tolerance:10}")
    private double calibrationTolerance;

    @Value("${intelligence.calibration.min-bin-samples:5}")
    private int minBinSamples;

    @Value("${intelligence.weights.enabled:true}")
    private boolean weightsEnabled;

    @Value("${intelligence.weights.min-weight:0.3}")
    private double minWeight;

    @Value("${intelligence.weights.max-weight:2.0}")
    private double maxWeight;

    @Value("${intelligence.weights.baseline-win-rate:50}")
    private double baselineWinRate;

    @Value("${intelligence.weights.prior-strength:20}")
    private double priorStrength;

    @Value("${intelligence.weights.tier-low:10}")
    private int tierLow;

    @Value("${intelligence.weights.tier-medium:30}")
    private int tierMedium;

    @Value("${intelligence.weights.tier-high:100}")
    private int tierHigh;

    @Value("${intelligence.weights.neutral-epsilon:0.05}")
    private double neutralEpsilon;

    @Value("${intelligence.weights.top-n:10}")
    private int topN;

    @Value("${intelligence.index.min-catalyst-samples:3}")
    private int minCatalystSamples;

    @Value("${intelligence.index.recent-trades:10}")
    private int recentTrades;

    @Value("${intelligence.index.min-performer-trades:3}")
    private int minPerformerTrades;

    @Value("${intelligence.index.performer-limit:10}")
    private int performerLimit;

    @Value("${intelligence.index.min-adjustment-trades:5}")
    private int minAdjustmentTrades;

    @Value("${intelligence.health.healthy-min-profit-factor:1.2}")
    private double healthyMinProfitFactor;

    @Value("${intelligence.health.unhealthy-max-profit-factor:1.0}")
    private double unhealthyMaxProfitFactor;

    @Value("${intelligence.health.min-trades:20}")
    private int healthMinTrades;

    @Value("${intelligence.health.min-engine-trades:10}")
    private int healthMinEngineTrades;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public LedgerSettings ledgerSettings() {
        return new LedgerSettings(breakevenBand, recentLimit);
    }

    @Bean
    public CalibrationSettings calibrationSettings() {
        return new CalibrationSettings(binWidth, calibrationTolerance, minBinSamples);
    }

    @Bean
    public WeightSettings weightSettings() {
        return new WeightSettings(weightsEnabled, minWeight, maxWeight, baselineWinRate, priorStrength,
                                  tierLow, tierMedium, tierHigh, neutralEpsilon, topN);
    }

    @Bean
    public IndexSettings indexSettings() {
        return new IndexSettings(minCatalystSamples, recentTrades, minPerformerTrades,
                                 performerLimit, minAdjustmentTrades);
    }

    @Bean
    public HealthThresholds healthThresholds() {
        return new HealthThresholds(healthyMinProfitFactor, unhealthyMaxProfitFactor,
                                    healthMinTrades, healthMinEngineTrades);
    }

    @Bean
    public NarrativeGenerator narrativeGenerator(HealthThresholds healthThresholds) {
        return new RuleBasedNarrativeGenerator(healthThresholds);
    }

    @Bean
    public SnapshotCache snapshotCache() {
        return new SnapshotCache();
    }
}
