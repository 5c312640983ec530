package io.github.yok.flexetl.transform;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import io.github.yok.flexetl.model.Dataset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies the enabled transform stages to a dataset in canonical order.
 *
 * <p>
 * The pipeline owns an explicit registry with at most one stage per {@link StageId}, kept sorted by
 * the declaration order of {@link StageId}. A run walks the registry and applies each enabled
 * stage to the output of the previous one; disabled stages are skipped without affecting the
 * order of the others. The order in which the caller enabled stages plays no role.
 * </p>
 *
 * <p>
 * The first failing stage aborts the run with a {@link PipelineException}; the partially
 * transformed dataset is discarded.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class TransformPipeline {

    private final List<TransformStage> stages;

    private final DataQualityProfiler profiler;

    /**
     * Creates a pipeline from the given stages.
     *
     * @param stages stages in any order, at most one per identifier
     * @param profiler profiler applied to the final dataset
     * @throws IllegalArgumentException if two stages share an identifier
     */
    public TransformPipeline(List<? extends TransformStage> stages, DataQualityProfiler profiler) {
        Preconditions.checkNotNull(stages, "stages must not be null");
        Preconditions.checkNotNull(profiler, "profiler must not be null");
        Set<StageId> seen = EnumSet.noneOf(StageId.class);
        for (TransformStage stage : stages) {
            if (!seen.add(stage.id())) {
                throw new IllegalArgumentException("Duplicate stage: " + stage.id());
            }
        }
        List<TransformStage> sorted = new ArrayList<>(stages);
        sorted.sort(Comparator.comparingInt(stage -> stage.id().ordinal()));
        this.stages = ImmutableList.copyOf(sorted);
        this.profiler = profiler;
    }

    /**
     * Creates the pipeline with all eight standard stages.
     *
     * @param outlierThreshold z-score threshold for outlier filtering
     * @return standard pipeline
     */
    public static TransformPipeline standard(double outlierThreshold) {
        return new TransformPipeline(List.of(new ColumnNormalizer(), new DateTimeInference(),
                new TypeCoercion(), new MissingDataEliminator(),
                new OutlierFilter(outlierThreshold), new CategoricalEncoder(),
                new FeatureScaler(), new DerivedFeatureCalculator()), new DataQualityProfiler());
    }

    /**
     * Returns the registered stages in canonical order.
     *
     * @return stages
     */
    public List<TransformStage> getStages() {
        return stages;
    }

    /**
     * Runs the enabled stages.
     *
     * @param input dataset produced by a source adapter
     * @param enabled stages to apply; stages not registered in this pipeline are ignored
     * @return final dataset with run details
     * @throws PipelineException if a stage fails
     */
    public PipelineResult run(Dataset input, Set<StageId> enabled) throws PipelineException {
        Preconditions.checkNotNull(input, "input must not be null");
        Preconditions.checkNotNull(enabled, "enabled must not be null");
        Stopwatch total = Stopwatch.createStarted();
        log.info("Pipeline started. Enabled stages: {}", enabled);

        Dataset current = input;
        List<StageId> applied = new ArrayList<>();
        for (TransformStage stage : stages) {
            if (!enabled.contains(stage.id())) {
                continue;
            }
            Stopwatch watch = Stopwatch.createStarted();
            int rowsBefore = current.rowCount();
            try {
                current = stage.apply(current);
            } catch (TransformException | RuntimeException e) {
                log.error("Stage [{}] failed: {}", stage.id().getKey(), e.getMessage());
                throw new PipelineException(stage.id(), e);
            }
            applied.add(stage.id());
            log.info("Stage [{}] done | rows {} -> {}, columns={}, {} ms", stage.id().getKey(),
                    rowsBefore, current.rowCount(), current.columnCount(),
                    watch.elapsed(TimeUnit.MILLISECONDS));
        }

        long elapsed = total.elapsed(TimeUnit.MILLISECONDS);
        log.info("Pipeline finished. Applied: {}, rows={}, columns={}, {} ms", applied,
                current.rowCount(), current.columnCount(), elapsed);
        return PipelineResult.builder().dataset(current).appliedStages(List.copyOf(applied))
                .elapsedMillis(elapsed).qualityReport(profiler.profile(current)).build();
    }
}
