package io.github.yok.flexetl.transform;

import io.github.yok.flexetl.model.Column;
import lombok.Getter;

/**
 * Mean and spread of a numeric column, computed over its non-missing cells.
 *
 * <p>
 * Sums are accumulated with a two-pass algorithm so that columns with a large offset keep their
 * variance.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public final class ColumnStatistics {

    // Relative spread below which a column is treated as constant
    private static final double ZERO_SPREAD_TOLERANCE = 1e-12;

    // Number of non-missing cells
    private final int count;

    // Arithmetic mean, NaN when count == 0
    private final double mean;

    // Sum of squared deviations from the mean
    private final double sumOfSquares;

    private ColumnStatistics(int count, double mean, double sumOfSquares) {
        this.count = count;
        this.mean = mean;
        this.sumOfSquares = sumOfSquares;
    }

    /**
     * Computes the statistics of a numeric column.
     *
     * @param column numeric column
     * @return statistics over the non-missing cells
     */
    public static ColumnStatistics of(Column column) {
        int count = 0;
        double sum = 0.0;
        for (int row = 0; row < column.size(); row++) {
            Double value = column.getNumber(row);
            if (value != null) {
                count++;
                sum += value;
            }
        }
        if (count == 0) {
            return new ColumnStatistics(0, Double.NaN, 0.0);
        }
        double mean = sum / count;
        double squares = 0.0;
        for (int row = 0; row < column.size(); row++) {
            Double value = column.getNumber(row);
            if (value != null) {
                double d = value - mean;
                squares += d * d;
            }
        }
        return new ColumnStatistics(count, mean, squares);
    }

    /**
     * Sample standard deviation (divisor {@code n - 1}).
     *
     * @return standard deviation, NaN when fewer than two values exist
     */
    public double sampleStandardDeviation() {
        if (count < 2) {
            return Double.NaN;
        }
        return Math.sqrt(sumOfSquares / (count - 1));
    }

    /**
     * Population standard deviation (divisor {@code n}).
     *
     * @return standard deviation, NaN when no value exists
     */
    public double populationStandardDeviation() {
        if (count == 0) {
            return Double.NaN;
        }
        return Math.sqrt(sumOfSquares / count);
    }

    /**
     * Returns whether a spread is usable as a z-score divisor. Spreads at rounding-noise level
     * relative to the mean count as zero variance.
     *
     * @param sigma standard deviation of this column
     * @return {@code true} if {@code sigma} is finite and clearly positive
     */
    public boolean isUsableSpread(double sigma) {
        return Double.isFinite(sigma)
                && sigma > ZERO_SPREAD_TOLERANCE * Math.max(1.0, Math.abs(mean));
    }
}
