package com.tradeintel.common.calibration;

/**
 * @param binWidth       width of each confidence bin in points (divides [0, 100])
 * @param tolerance      max |predicted − actual| for a bin to count as calibrated
 * @param minBinSamples  bins with fewer members are reported but left out of ECE
 */
public record CalibrationSettings(double binWidth, double tolerance, int minBinSamples) {

    public static final CalibrationSettings DEFAULTS = new CalibrationSettings(10.0, 10.0, 5);

    public CalibrationSettings {
        if (!(binWidth > 0.0) || binWidth > 100.0) {
            throw new IllegalArgumentException("binWidth must be in (0, 100], got " + binWidth);
        }
        if (tolerance < 0.0) {
            throw new IllegalArgumentException("tolerance must be >= 0, got " + tolerance);
        }
        if (minBinSamples < 1) {
            throw new IllegalArgumentException("minBinSamples must be >= 1, got " + minBinSamples);
        }
    }

    public int binCount() {
        return (int) Math.ceil(100.0 / binWidth - 1e-9);
    }
}
