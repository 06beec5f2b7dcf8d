package com.cloudwise.costanalytics.analytics;

final class SampleStatistics {

    private SampleStatistics() {
    }

    static double mean(double[] values) {
        if (values.length == 0) {
            return 0d;
        }
        double sum = 0d;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /** Sample standard deviation (N-1 denominator); zero for fewer than two values. */
    static double stdDeviation(double[] values, double mean) {
        if (values.length < 2) {
            return 0d;
        }
        double squares = 0d;
        for (double value : values) {
            double delta = value - mean;
            squares += delta * delta;
        }
        return Math.sqrt(squares / (values.length - 1));
    }

    /** Standard deviation as a percentage of the mean, zero when the mean is zero. */
    static double coefficientOfVariation(double stdDeviation, double mean) {
        return mean > 0 ? stdDeviation / mean * 100 : 0d;
    }
}
