package io.github.yok.flexetl.core;

import io.github.yok.flexetl.source.SourceDescriptor;
import io.github.yok.flexetl.transform.StageId;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * One extract-transform-load request.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
@Builder
public class EtlRequest {

    // Where the dataset comes from
    SourceDescriptor source;

    // Stages to apply; null applies pipeline.enabled-stages
    Set<StageId> stages;

    // Logical ID of the target store; null targets the first configured connection
    String connectionId;

    // Target table name
    String tableName;
}
