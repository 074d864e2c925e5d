package com.fincube.fraud.engine;

import java.util.Collection;

/**
 * Numeric helpers shared by the scoring stages. Every result is finite:
 * NaN and infinities collapse to 0 at the point of computation.
 */
public final class Numbers {

    private Numbers() {
    }

    public static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }

    public static double clamp01(double value) {
        if (!Double.isFinite(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Division that yields 0 for a zero or non-finite denominator.
     */
    public static double ratio(double numerator, double denominator) {
        if (denominator == 0.0 || !Double.isFinite(denominator)) return 0.0;
        return finiteOrZero(numerator / denominator);
    }

    public static double mean(Collection<Double> values) {
        if (values.isEmpty()) return 0.0;
        double sum = 0.0;
        for (double v : values) sum += v;
        return finiteOrZero(sum / values.size());
    }

    /**
     * Population standard deviation (divisor n).
     */
    public static double populationStd(Collection<Double> values) {
        if (values.isEmpty()) return 0.0;
        double mean = mean(values);
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - mean;
            sumSq += d * d;
        }
        return finiteOrZero(Math.sqrt(sumSq / values.size()));
    }

    public static double sum(Collection<Double> values) {
        double sum = 0.0;
        for (double v : values) sum += v;
        return finiteOrZero(sum);
    }

    public static double min(Collection<Double> values) {
        return values.isEmpty() ? 0.0 : values.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
    }

    public static double max(Collection<Double> values) {
        return values.isEmpty() ? 0.0 : values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }
}
