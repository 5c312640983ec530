package io.github.yok.flexetl.transform;

import io.github.yok.flexetl.model.Column;
import io.github.yok.flexetl.model.ColumnType;
import io.github.yok.flexetl.model.Dataset;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Profiles a dataset into a {@link DataQualityReport}.
 *
 * <p>
 * Outliers are counted per numeric column with the population standard deviation and a fixed
 * threshold of 3; a column without spread has no outliers. The profiler never modifies the
 * dataset.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class DataQualityProfiler {

    static final double OUTLIER_Z = 3.0;

    /**
     * Profiles the given dataset.
     *
     * @param dataset dataset to inspect
     * @return quality report
     */
    public DataQualityReport profile(Dataset dataset) {
        Map<String, Integer> missing = new LinkedHashMap<>();
        Map<String, String> types = new LinkedHashMap<>();
        Map<String, Integer> outliers = new LinkedHashMap<>();
        Map<String, Integer> unique = new LinkedHashMap<>();

        for (Column column : dataset.columns()) {
            missing.put(column.getName(),
                    (int) column.getValues().stream().filter(Objects::isNull).count());
            types.put(column.getName(), column.getType().name());
            unique.put(column.getName(), (int) column.getValues().stream()
                    .filter(Objects::nonNull).distinct().count());
            if (column.getType() == ColumnType.NUMERIC) {
                outliers.put(column.getName(), countOutliers(column));
            }
        }

        return DataQualityReport.builder().rowCount(dataset.rowCount())
                .missingCounts(Collections.unmodifiableMap(missing))
                .duplicateRows(countDuplicateRows(dataset))
                .dataTypes(Collections.unmodifiableMap(types))
                .outlierCounts(Collections.unmodifiableMap(outliers))
                .uniqueCounts(Collections.unmodifiableMap(unique)).build();
    }

    private int countOutliers(Column column) {
        ColumnStatistics stats = ColumnStatistics.of(column);
        double sigma = stats.populationStandardDeviation();
        if (!stats.isUsableSpread(sigma)) {
            return 0;
        }
        int count = 0;
        for (int row = 0; row < column.size(); row++) {
            Double value = column.getNumber(row);
            if (value != null && Math.abs(value - stats.getMean()) / sigma > OUTLIER_Z) {
                count++;
            }
        }
        return count;
    }

    private int countDuplicateRows(Dataset dataset) {
        Set<List<Object>> seen = new HashSet<>();
        int duplicates = 0;
        for (int row = 0; row < dataset.rowCount(); row++) {
            if (!seen.add(dataset.row(row))) {
                duplicates++;
            }
        }
        return duplicates;
    }
}
