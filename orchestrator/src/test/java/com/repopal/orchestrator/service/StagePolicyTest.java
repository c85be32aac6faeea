package com.repopal.orchestrator.service;

import com.repopal.orchestrator.config.RepoPalProperties;
import com.repopal.orchestrator.model.Stage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class StagePolicyTest {

    StagePolicy policy;

    @BeforeEach
    void setUp() {
        RepoPalProperties properties = new RepoPalProperties();
        properties.getPipeline().setRetryBackoffBaseSeconds(5);
        properties.getPipeline().setRetryBackoffMaxSeconds(60);
        properties.getPipeline().setMaxStageRetries(3);
        properties.getPipeline().setSoftTimeoutSeconds(120);
        properties.getPipeline().setHardTimeoutSeconds(300);
        properties.getPipeline().setExecuteGraceSeconds(180);
        properties.getExecutor().setExecutionTimeoutSeconds(600);
        properties.getExecutor().setImagePullTimeoutSeconds(600);
        properties.getGit().setCloneTimeoutSeconds(300);
        policy = new StagePolicy(properties);
    }

    @Test
    void backoff_doublesPerAttemptUpToCap() {
        assertThat(policy.backoff(0)).isEqualTo(Duration.ofSeconds(5));
        assertThat(policy.backoff(1)).isEqualTo(Duration.ofSeconds(10));
        assertThat(policy.backoff(3)).isEqualTo(Duration.ofSeconds(40));
        assertThat(policy.backoff(4)).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.backoff(40)).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void canRetry_allowsMaxStageRetriesRetries() {
        assertThat(policy.canRetry(0)).isTrue();
        assertThat(policy.canRetry(2)).isTrue();
        assertThat(policy.canRetry(3)).isFalse();
    }

    @Test
    void executeLimits_followExecutionTimeoutPlusGrace() {
        assertThat(policy.softLimit(Stage.EXECUTE)).isEqualTo(Duration.ofSeconds(600));
        // 600 command + 600 pull + 2 x 300 clone/push + 180 grace
        assertThat(policy.hardLimit(Stage.EXECUTE)).isEqualTo(Duration.ofSeconds(1980));
        assertThat(policy.softLimit(Stage.PROCESS)).isEqualTo(Duration.ofSeconds(120));
        assertThat(policy.hardLimit(Stage.DISPATCH)).isEqualTo(Duration.ofSeconds(300));
    }

    @Test
    void executeHardLimit_outlastsSlowCloneFollowedByCommandNearItsOwnLimit() {
        // a 290s clone then a 590s command is still within every individual budget
        Duration slowestLegalRun = Duration.ofSeconds(290 + 590);

        assertThat(policy.hardLimit(Stage.EXECUTE)).isGreaterThan(slowestLegalRun);
    }
}
