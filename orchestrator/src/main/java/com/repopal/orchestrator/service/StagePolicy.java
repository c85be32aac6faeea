package com.repopal.orchestrator.service;

import com.repopal.orchestrator.config.RepoPalProperties;
import com.repopal.orchestrator.model.Stage;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Retry budget, backoff and time limits per stage.
 */
@Component
public class StagePolicy {

    private final RepoPalProperties.Pipeline pipeline;
    private final int executionTimeoutSeconds;
    // Image pull, clone and push run inside EXECUTE but outside the command's own limit.
    private final int executePreparationSeconds;

    public StagePolicy(RepoPalProperties properties) {
        this.pipeline                  = properties.getPipeline();
        this.executionTimeoutSeconds   = properties.getExecutor().getExecutionTimeoutSeconds();
        this.executePreparationSeconds = properties.getExecutor().getImagePullTimeoutSeconds()
                + 2 * properties.getGit().getCloneTimeoutSeconds();
    }

    /** True while {@code attempt} (0-based) has retries left. */
    public boolean canRetry(int attempt) {
        return attempt < pipeline.getMaxStageRetries();
    }

    /** base × 2^attempt, capped. */
    public Duration backoff(int attempt) {
        long base = pipeline.getRetryBackoffBaseSeconds();
        long max  = pipeline.getRetryBackoffMaxSeconds();
        long seconds = attempt >= 31 ? max : Math.min(base << attempt, max);
        return Duration.ofSeconds(Math.max(0, seconds));
    }

    /** Past this a warning is logged; the stage keeps running. */
    public Duration softLimit(Stage stage) {
        return Duration.ofSeconds(stage == Stage.EXECUTE ? executionTimeoutSeconds : pipeline.getSoftTimeoutSeconds());
    }

    /**
     * Past this the stage is interrupted. For EXECUTE it covers the command's own
     * limit plus every git and image-pull budget around it, so the sandbox always
     * times the command out first.
     */
    public Duration hardLimit(Stage stage) {
        return Duration.ofSeconds(stage == Stage.EXECUTE
                ? (long) executionTimeoutSeconds + executePreparationSeconds + pipeline.getExecuteGraceSeconds()
                : pipeline.getHardTimeoutSeconds());
    }
}
