package io.github.yok.flexetl.transform;

import io.github.yok.flexetl.model.Dataset;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a successful pipeline run.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class PipelineResult {

    // Dataset produced by the last applied stage
    Dataset dataset;

    // Stages that ran, in execution order
    List<StageId> appliedStages;

    // Wall-clock duration of the run in milliseconds
    long elapsedMillis;

    // Profile of the final dataset
    DataQualityReport qualityReport;
}
