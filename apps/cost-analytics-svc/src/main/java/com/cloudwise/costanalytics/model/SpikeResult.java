package com.cloudwise.costanalytics.model;

public record SpikeResult(
        boolean isSpike,
        double currentValue,
        double baselineMean,
        double deviationAmount,
        double deviationPercent,
        double zScore,
        Severity severity,
        double confidence,
        boolean withinCi95,
        boolean withinCi99,
        boolean percentThresholdExceeded,
        boolean zScoreThresholdExceeded,
        double thresholdPercent,
        double zThreshold
) {
    public enum Severity {
        NONE,
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL;

        public static Severity fromDeviationPercent(double deviationPercent) {
            if (deviationPercent <= 20) {
                return NONE;
            }
            if (deviationPercent <= 35) {
                return LOW;
            }
            if (deviationPercent <= 50) {
                return MEDIUM;
            }
            if (deviationPercent <= 100) {
                return HIGH;
            }
            return CRITICAL;
        }
    }
}
