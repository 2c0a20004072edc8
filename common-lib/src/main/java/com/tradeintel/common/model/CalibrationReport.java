package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Calibration diagnostics over every closed trade that carried a confidence score.
 * Recommendations are attached afterwards by a narrative generator.
 */
public record CalibrationReport(
    @JsonProperty("bins")                     List<CalibrationBin> bins,
    @JsonProperty("totalSamples")             int                  totalSamples,
    @JsonProperty("excludedRecords")          int                  excludedRecords,
    @JsonProperty("overallAccuracy")          Double               overallAccuracy,
    @JsonProperty("brierScore")               Double               brierScore,
    @JsonProperty("expectedCalibrationError") Double               expectedCalibrationError,
    @JsonProperty("maxCalibrationError")      Double               maxCalibrationError,
    @JsonProperty("reliabilityScore")         Double               reliabilityScore,
    @JsonProperty("recommendations")          List<String>         recommendations
) {

    public CalibrationReport withRecommendations(List<String> advice) {
        return new CalibrationReport(bins, totalSamples, excludedRecords, overallAccuracy, brierScore,
                                     expectedCalibrationError, maxCalibrationError, reliabilityScore,
                                     List.copyOf(advice));
    }
}
