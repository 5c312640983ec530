package io.github.yok.flexetl.core;

import io.github.yok.flexetl.config.ConnectionConfig;
import io.github.yok.flexetl.config.PipelineConfig;
import io.github.yok.flexetl.model.Dataset;
import io.github.yok.flexetl.source.DatasetSourceFactory;
import io.github.yok.flexetl.source.SourceDescriptor;
import io.github.yok.flexetl.transform.DataQualityReport;
import io.github.yok.flexetl.transform.PipelineException;
import io.github.yok.flexetl.transform.PipelineResult;
import io.github.yok.flexetl.transform.StageId;
import io.github.yok.flexetl.transform.TransformPipeline;
import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Runs one request end to end: extract with a source adapter, transform with the
 * {@link TransformPipeline}, load with a {@link TableLoader}.
 *
 * <p>
 * Every failure is reported as a failed {@link EtlOutcome} carrying a human-readable reason; this
 * class never throws for an unsuccessful run. Nothing is written when extraction or
 * transformation fails.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class EtlService {

    private final DatasetSourceFactory sourceFactory;
    private final TransformPipeline pipeline;
    private final TableLoader tableLoader;
    private final ConnectionConfig connectionConfig;
    private final PipelineConfig pipelineConfig;

    @Autowired
    public EtlService(DatasetSourceFactory sourceFactory, TableLoader tableLoader,
            ConnectionConfig connectionConfig, PipelineConfig pipelineConfig) {
        this(sourceFactory, TransformPipeline.standard(pipelineConfig.getOutlierThreshold()),
                tableLoader, connectionConfig, pipelineConfig);
    }

    EtlService(DatasetSourceFactory sourceFactory, TransformPipeline pipeline,
            TableLoader tableLoader, ConnectionConfig connectionConfig,
            PipelineConfig pipelineConfig) {
        this.sourceFactory = sourceFactory;
        this.pipeline = pipeline;
        this.tableLoader = tableLoader;
        this.connectionConfig = connectionConfig;
        this.pipelineConfig = pipelineConfig;
    }

    /**
     * Executes the request.
     *
     * @param request request
     * @return outcome of the run
     */
    public EtlOutcome execute(EtlRequest request) {
        SourceDescriptor source = request.getSource();
        log.info("ETL started: source={} [{}], table={}", source.getKind(), source.getLocation(),
                request.getTableName());

        Optional<ConnectionConfig.Entry> connection =
                connectionConfig.find(request.getConnectionId());
        if (connection.isEmpty()) {
            return fail("Unknown connection: "
                    + (request.getConnectionId() == null ? "<none configured>"
                            : request.getConnectionId()));
        }

        // 1) Extract
        Optional<Dataset> extracted;
        try {
            extracted = sourceFactory.create(source.getKind()).extract(source);
        } catch (IOException e) {
            return fail("Extraction failed for " + source.getLocation() + ": " + e.getMessage());
        }
        if (extracted.isEmpty()) {
            return fail("No data extracted from " + source.getLocation());
        }
        preview("Extracted", extracted.get());

        // 2) Transform
        Set<StageId> stages = request.getStages() != null ? request.getStages()
                : pipelineConfig.resolveEnabledStages();
        PipelineResult result;
        try {
            result = pipeline.run(extracted.get(), stages);
        } catch (PipelineException e) {
            return fail(e.getMessage());
        }
        Dataset transformed = result.getDataset();
        preview("Transformed", transformed);
        logQuality(result.getQualityReport());

        // 3) Load
        try {
            tableLoader.load(transformed, connection.get(), request.getTableName());
        } catch (LoadException e) {
            return fail(e.getMessage());
        }
        log.info("ETL completed: table={}, rows={}", request.getTableName(),
                transformed.rowCount());
        return EtlOutcome.success(request.getTableName(), transformed.rowCount(),
                result.getQualityReport());
    }

    private EtlOutcome fail(String reason) {
        log.error("ETL failed: {}", reason);
        return EtlOutcome.failure(reason);
    }

    private void preview(String label, Dataset dataset) {
        Dataset head = dataset.head(pipelineConfig.getPreviewRows());
        log.info("{}: {}", label, dataset);
        for (int i = 0; i < head.rowCount(); i++) {
            log.info("  {}", head.row(i));
        }
    }

    private static void logQuality(DataQualityReport report) {
        log.info("Data quality | rows={}, duplicates={}", report.getRowCount(),
                report.getDuplicateRows());
        log.info("Data quality | missing={}", report.getMissingCounts());
        log.info("Data quality | outliers={}", report.getOutlierCounts());
        log.info("Data quality | unique={}", report.getUniqueCounts());
        log.debug("Data quality | types={}", report.getDataTypes());
    }
}
