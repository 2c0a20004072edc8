package com.tradeintel.common.narrative;

import com.tradeintel.common.model.CalibrationReport;
import com.tradeintel.common.model.CatalystStat;
import com.tradeintel.common.model.EngineMetrics;
import com.tradeintel.common.model.PlatformHealth;
import com.tradeintel.common.model.SymbolProfile;

import java.util.List;

/**
 * Turns numeric analytics into advisory text. Implementations read only the numeric records
 * and must be deterministic: the same inputs always yield the same strings in the same order.
 */
public interface NarrativeGenerator {

    List<String> calibrationRecommendations(CalibrationReport report);

    List<String> healthIssues(PlatformHealth health, List<EngineMetrics> engines);

    List<String> healthRecommendations(PlatformHealth health, List<EngineMetrics> engines);

    List<String> symbolRecommendations(SymbolProfile profile, List<CatalystStat> catalysts);
}
