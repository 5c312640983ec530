package io.github.yok.flexetl.transform;

import com.google.common.base.Preconditions;
import io.github.yok.flexetl.model.Column;
import io.github.yok.flexetl.model.ColumnType;
import io.github.yok.flexetl.model.Dataset;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps only the rows whose numeric values all lie within a z-score threshold.
 *
 * <p>
 * For each numeric column the mean {@code μ} and the sample standard deviation {@code σ}
 * (divisor {@code n - 1}) are computed over the non-missing cells of the current dataset. A row
 * survives only if, for <em>every</em> numeric column, {@code |x - μ| / σ < threshold}.
 * </p>
 *
 * <p>
 * <strong>Edge cases:</strong>
 * </p>
 * <ul>
 * <li>A column whose {@code σ} is zero, or undefined because it has fewer than two values, never
 * rejects a row.</li>
 * <li>A missing cell in a column that takes part in the test rejects its row, since no z-score can
 * be computed for it.</li>
 * <li>Non-numeric columns do not take part.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public class OutlierFilter implements TransformStage {

    /**
     * Threshold used when none is configured.
     */
    public static final double DEFAULT_THRESHOLD = 3.0;

    private final double threshold;

    public OutlierFilter() {
        this(DEFAULT_THRESHOLD);
    }

    /**
     * Creates a filter with the given threshold.
     *
     * @param threshold z-score threshold, strictly positive
     */
    public OutlierFilter(double threshold) {
        Preconditions.checkArgument(Double.isFinite(threshold) && threshold > 0.0,
                "threshold must be a positive number: %s", threshold);
        this.threshold = threshold;
    }

    @Override
    public StageId id() {
        return StageId.REMOVE_OUTLIERS;
    }

    @Override
    public Dataset apply(Dataset input) {
        List<Column> tested = new ArrayList<>();
        List<double[]> bounds = new ArrayList<>();
        for (Column column : input.columnsOfType(ColumnType.NUMERIC)) {
            ColumnStatistics stats = ColumnStatistics.of(column);
            double sigma = stats.sampleStandardDeviation();
            if (!stats.isUsableSpread(sigma)) {
                log.debug("Column '{}' has no spread; excluded from the outlier test",
                        column.getName());
                continue;
            }
            tested.add(column);
            bounds.add(new double[] {stats.getMean(), sigma});
        }
        if (tested.isEmpty()) {
            return input;
        }
        Dataset result = input.filterRows(row -> {
            for (int c = 0; c < tested.size(); c++) {
                Double value = tested.get(c).getNumber(row);
                if (value == null) {
                    return false;
                }
                double mean = bounds.get(c)[0];
                double sigma = bounds.get(c)[1];
                if (!(Math.abs(value - mean) / sigma < threshold)) {
                    return false;
                }
            }
            return true;
        });
        log.debug("Outlier rows dropped: {} (threshold={})",
                input.rowCount() - result.rowCount(), threshold);
        return result;
    }
}
