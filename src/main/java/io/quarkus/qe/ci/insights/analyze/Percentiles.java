package io.quarkus.qe.ci.insights.analyze;

import java.util.Collection;

/**
 * Floor-indexed percentiles of a sample: the value at index {@code min(len * pct / 100, len - 1)}
 * of the ascending sort, for pct 50, 95 and 99.
 */
public record Percentiles(double p50, double p95, double p99) {

    public static final Percentiles ZERO = new Percentiles(0.0, 0.0, 0.0);

    public static Percentiles of(Collection<Double> values) {
        if (values.isEmpty()) {
            return ZERO;
        }

        double[] sorted = values.stream()
                .mapToDouble(Double::doubleValue)
                .sorted()
                .toArray();

        if (sorted.length == 1) {
            return new Percentiles(sorted[0], sorted[0], sorted[0]);
        }

        return new Percentiles(at(sorted, 50), at(sorted, 95), at(sorted, 99));
    }

    private static double at(double[] sorted, int percentile) {
        int index = (int) ((long) sorted.length * percentile / 100);
        return sorted[Math.min(index, sorted.length - 1)];
    }
}
