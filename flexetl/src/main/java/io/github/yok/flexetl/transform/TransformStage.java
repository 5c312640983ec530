package io.github.yok.flexetl.transform;

import io.github.yok.flexetl.model.Dataset;

/**
 * One independent, toggleable unit of the transformation pipeline.
 *
 * <p>
 * Implementations take a dataset and return a new one; they keep no reference to either after
 * returning. Callers must not assume the input is still the "current" dataset once a stage has
 * run.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface TransformStage {

    /**
     * Returns the identifier that fixes this stage's position in the canonical order.
     *
     * @return stage identifier
     */
    StageId id();

    /**
     * Applies this stage.
     *
     * @param input dataset produced by the previous stage or the source adapter
     * @return transformed dataset
     * @throws TransformException if the stage cannot transform the input
     */
    Dataset apply(Dataset input) throws TransformException;
}
