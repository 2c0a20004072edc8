package com.tradeintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One fixed-width confidence bucket. Empty bins are still reported so the chart keeps its
 * shape; their statistics and {@code calibrated} flag are {@code null}.
 *
 * <p>{@code eligible} marks bins with enough samples to take part in the ECE weighting.
 */
public record CalibrationBin(
    @JsonProperty("label")               String  label,
    @JsonProperty("lowerBound")          double  lowerBound,
    @JsonProperty("upperBound")          double  upperBound,
    @JsonProperty("predictedConfidence") Double  predictedConfidence,
    @JsonProperty("actualWinRate")       Double  actualWinRate,
    @JsonProperty("sampleSize")          int     sampleSize,
    @JsonProperty("wins")                int     wins,
    @JsonProperty("losses")              int     losses,
    @JsonProperty("standardError")       Double  standardError,
    @JsonProperty("calibrated")          Boolean calibrated,
    @JsonProperty("eligible")            boolean eligible
) {

    /** Signed gap {@code predicted − actual}; positive means overconfident. Null for empty bins. */
    public Double gap() {
        if (predictedConfidence == null || actualWinRate == null) return null;
        return predictedConfidence - actualWinRate;
    }
}
