package io.github.yok.flexetl.transform;

import lombok.Getter;

/**
 * Signals that a pipeline run was aborted because one of its stages failed.
 *
 * <p>
 * The stages after {@link #getStage()} were not applied, and no partially transformed dataset is
 * exposed to the caller.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class PipelineException extends Exception {

    private static final long serialVersionUID = 1L;

    // Stage that failed
    private final StageId stage;

    public PipelineException(StageId stage, Throwable cause) {
        super("Stage '" + stage.getKey() + "' failed: " + cause.getMessage(), cause);
        this.stage = stage;
    }
}
