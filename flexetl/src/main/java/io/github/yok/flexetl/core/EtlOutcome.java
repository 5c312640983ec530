package io.github.yok.flexetl.core;

import io.github.yok.flexetl.transform.DataQualityReport;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of an {@link EtlRequest}: either the table was replaced, or a human-readable reason why
 * not.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EtlOutcome {

    boolean success;

    // Target table; null on failure
    String tableName;

    // Rows written; 0 on failure
    int rowsLoaded;

    // Profile of the loaded dataset; null on failure
    DataQualityReport qualityReport;

    // Reason of the failure; null on success
    String reason;

    public static EtlOutcome success(String tableName, int rowsLoaded,
            DataQualityReport qualityReport) {
        return new EtlOutcome(true, tableName, rowsLoaded, qualityReport, null);
    }

    public static EtlOutcome failure(String reason) {
        return new EtlOutcome(false, null, 0, null, reason);
    }
}
