package com.cloudwise.costanalytics.analytics;

/**
 * Ordinary least squares of cost against positional index {@code x = 0..n-1}. Gaps between
 * calendar dates are not weighted; consecutive observations are treated as one step apart.
 */
final class LinearRegression {

    private LinearRegression() {
    }

    static Fit fit(double[] y) {
        int n = y.length;
        double meanX = (n - 1) / 2.0;
        double meanY = SampleStatistics.mean(y);

        double numerator = 0d;
        double denominator = 0d;
        for (int x = 0; x < n; x++) {
            double dx = x - meanX;
            numerator += dx * (y[x] - meanY);
            denominator += dx * dx;
        }
        if (denominator == 0) {
            throw new DegenerateInputException("Cannot fit a trend: all " + n + " positions are identical");
        }
        double slope = numerator / denominator;
        double intercept = meanY - slope * meanX;

        double ssTotal = 0d;
        double ssResidual = 0d;
        for (int x = 0; x < n; x++) {
            double predicted = slope * x + intercept;
            ssTotal += (y[x] - meanY) * (y[x] - meanY);
            ssResidual += (y[x] - predicted) * (y[x] - predicted);
        }
        double rSquared = ssTotal == 0 ? 0d : 1 - ssResidual / ssTotal;
        return new Fit(slope, intercept, rSquared, n);
    }

    record Fit(double slope, double intercept, double rSquared, int sampleSize) {

        double predict(double x) {
            return slope * x + intercept;
        }
    }
}
