package io.github.yok.flexetl.transform;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Summary of a dataset's quality, keyed by column name in column order.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class DataQualityReport {

    // Number of rows profiled
    int rowCount;

    // Missing cells per column
    Map<String, Integer> missingCounts;

    // Rows equal to an earlier row in every column
    int duplicateRows;

    // Semantic type name per column
    Map<String, String> dataTypes;

    // Values with |z| > 3 per numeric column
    Map<String, Integer> outlierCounts;

    // Distinct non-missing values per column
    Map<String, Integer> uniqueCounts;
}
