/**
 * Transformation pipeline engine.
 *
 * <p>
 * Each {@link io.github.yok.flexetl.transform.TransformStage} addresses one cleaning concern and
 * maps a dataset to a new dataset. {@link io.github.yok.flexetl.transform.TransformPipeline} holds
 * the stages in the canonical order declared by {@link io.github.yok.flexetl.transform.StageId}
 * and applies the enabled subset.
 * </p>
 */
package io.github.yok.flexetl.transform;
