package io.github.yok.flexetl.config;

import io.github.yok.flexetl.transform.StageId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code pipeline} section in {@code application.yml}.
 *
 * <ul>
 * <li>{@code pipeline.enabled-stages}: stage keys enabled when the command line does not name
 * any (e.g., {@code normalize-columns}, {@code drop-missing})</li>
 * <li>{@code pipeline.outlier-threshold}: z-score threshold used by outlier filtering</li>
 * <li>{@code pipeline.preview-rows}: number of rows logged as a preview after extraction and after
 * transformation</li>
 * </ul>
 *
 * <p>
 * The order of {@code enabled-stages} is irrelevant: stages always run in the canonical order of
 * {@link StageId}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
@NoArgsConstructor
public class PipelineConfig {

    /**
     * Keys of the stages enabled by default.
     */
    private List<String> enabledStages = new ArrayList<>();

    /**
     * Z-score threshold for outlier filtering. Rows are retained only when every numeric value is
     * strictly closer to its column mean than this many standard deviations.
     */
    private double outlierThreshold = 3.0;

    /**
     * Number of rows shown in preview logs.
     */
    private int previewRows = 5;

    /**
     * Resolves {@link #enabledStages} into stage identifiers.
     *
     * @return enabled stages; empty if none are configured
     * @throws IllegalArgumentException if a key does not name a stage
     */
    public Set<StageId> resolveEnabledStages() {
        if (enabledStages == null || enabledStages.isEmpty()) {
            return EnumSet.noneOf(StageId.class);
        }
        return StageId.parseAll(enabledStages);
    }
}
