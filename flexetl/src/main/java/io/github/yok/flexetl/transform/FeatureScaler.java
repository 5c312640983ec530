package io.github.yok.flexetl.transform;

import io.github.yok.flexetl.model.Column;
import io.github.yok.flexetl.model.ColumnType;
import io.github.yok.flexetl.model.Dataset;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Standardizes every numeric column to zero mean and unit variance.
 *
 * <p>
 * Mean and population standard deviation (divisor {@code n}) are fitted on the dataset as it is
 * when this stage runs, so the result depends on which stages ran before. Each non-missing value
 * {@code x} becomes {@code (x - μ) / σ}; missing cells stay missing.
 * </p>
 *
 * <p>
 * A column with zero variance is only centered: all its non-missing values become {@code 0.0}.
 * Non-numeric columns are untouched.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class FeatureScaler implements TransformStage {

    @Override
    public StageId id() {
        return StageId.SCALE_FEATURES;
    }

    @Override
    public Dataset apply(Dataset input) {
        List<Column> columns = new ArrayList<>(input.columnCount());
        for (Column column : input.columns()) {
            columns.add(column.getType() == ColumnType.NUMERIC ? scale(column) : column);
        }
        return input.withColumns(columns);
    }

    private Column scale(Column column) {
        ColumnStatistics stats = ColumnStatistics.of(column);
        if (stats.getCount() == 0) {
            return column;
        }
        double mean = stats.getMean();
        double sigma = stats.populationStandardDeviation();
        boolean spread = stats.isUsableSpread(sigma);
        if (!spread) {
            log.debug("Column '{}' has zero variance; centered only", column.getName());
        }
        List<Object> scaled = new ArrayList<>(column.size());
        for (int row = 0; row < column.size(); row++) {
            Double value = column.getNumber(row);
            if (value == null) {
                scaled.add(null);
            } else {
                scaled.add(spread ? (value - mean) / sigma : 0.0);
            }
        }
        return column.withValues(ColumnType.NUMERIC, scaled);
    }
}
