package com.repopal.orchestrator.queue;

import com.repopal.orchestrator.model.Lane;
import com.repopal.orchestrator.model.Stage;
import com.repopal.orchestrator.model.StageTask;
import com.repopal.orchestrator.model.TaskState;
import com.repopal.orchestrator.repository.StageTaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JpaTaskQueue with the repository mocked.
 * The locking itself is the database's job and is not simulated here.
 */
@ExtendWith(MockitoExtension.class)
class JpaTaskQueueTest {

    @Mock StageTaskRepository taskRepo;

    JpaTaskQueue queue;

    @BeforeEach
    void setUp() {
        queue = new JpaTaskQueue(taskRepo);
    }

    @Test
    void enqueue_newKey_savesPendingTaskDelayedAsRequested() {
        TaskMessage msg = TaskMessage.of(UUID.randomUUID(), UUID.randomUUID(), 3, Stage.EXECUTE, "{}", 1);
        when(taskRepo.existsByIdempotencyKey(msg.idempotencyKey())).thenReturn(false);

        Instant before = Instant.now();
        boolean added = queue.enqueue(msg, Duration.ofSeconds(10));

        assertThat(added).isTrue();
        ArgumentCaptor<StageTask> saved = ArgumentCaptor.forClass(StageTask.class);
        verify(taskRepo).save(saved.capture());
        StageTask task = saved.getValue();
        assertThat(task.getState()).isEqualTo(TaskState.PENDING);
        assertThat(task.getLane()).isEqualTo(Lane.EXECUTION);
        assertThat(task.getIdempotencyKey()).isEqualTo(msg.pipelineId() + ":EXECUTE:3");
        assertThat(task.getAttempt()).isEqualTo(1);
        assertThat(task.getAvailableAt()).isAfterOrEqualTo(before.plusSeconds(10));
    }

    @Test
    void enqueue_existingKey_isNoOp() {
        TaskMessage msg = TaskMessage.of(UUID.randomUUID(), UUID.randomUUID(), 3, Stage.PROCESS, "{}", 0);
        when(taskRepo.existsByIdempotencyKey(msg.idempotencyKey())).thenReturn(true);

        assertThat(queue.enqueue(msg, Duration.ZERO)).isFalse();
        verify(taskRepo, never()).save(any());
    }

    @Test
    void claimNext_marksTaskRunningAndCountsDelivery() {
        StageTask task = pending(Stage.DISPATCH);
        when(taskRepo.claimNextPending(eq(Lane.CONTROL), any())).thenReturn(Optional.of(task));

        Optional<TaskMessage> claimed = queue.claimNext(Lane.CONTROL, "worker-1");

        assertThat(claimed).isPresent();
        assertThat(claimed.get().taskId()).isEqualTo(task.getId());
        assertThat(task.getState()).isEqualTo(TaskState.RUNNING);
        assertThat(task.getWorkerId()).isEqualTo("worker-1");
        assertThat(task.getDeliveries()).isEqualTo(1);
        assertThat(task.getHeartbeatAt()).isNotNull();
        verify(taskRepo).save(task);
    }

    @Test
    void claimNext_nothingDue_returnsEmpty() {
        when(taskRepo.claimNextPending(eq(Lane.EXECUTION), any())).thenReturn(Optional.empty());

        assertThat(queue.claimNext(Lane.EXECUTION, "worker-1")).isEmpty();
        verify(taskRepo, never()).save(any());
    }

    @Test
    void heartbeat_onlyTouchesRunningTasks() {
        StageTask done = pending(Stage.PROCESS);
        done.setState(TaskState.DONE);
        when(taskRepo.findById(done.getId())).thenReturn(Optional.of(done));

        queue.heartbeat(done.getId());

        assertThat(done.getHeartbeatAt()).isNull();
        verify(taskRepo, never()).save(any());
    }

    @Test
    void recoverExpired_redeliversUntilDeliveryBudgetThenGivesUp() {
        StageTask retryable = running(Stage.PROCESS, 1);
        StageTask exhausted = running(Stage.EXECUTE, 3);
        when(taskRepo.findByStateAndHeartbeatAtBefore(eq(TaskState.RUNNING), any()))
                .thenReturn(List.of(retryable, exhausted));

        List<TaskMessage> abandoned = queue.recoverExpired(Duration.ofMinutes(5), 3);

        assertThat(retryable.getState()).isEqualTo(TaskState.PENDING);
        assertThat(retryable.getWorkerId()).isNull();
        assertThat(exhausted.getState()).isEqualTo(TaskState.FAILED);
        assertThat(exhausted.getLastError()).contains("heartbeat");
        assertThat(abandoned).extracting(TaskMessage::taskId).containsExactly(exhausted.getId());
    }

    @Test
    void fail_recordsReason() {
        StageTask task = running(Stage.PROCESS, 1);
        when(taskRepo.findById(task.getId())).thenReturn(Optional.of(task));

        queue.fail(task.getId(), "poison payload");

        assertThat(task.getState()).isEqualTo(TaskState.FAILED);
        assertThat(task.getLastError()).isEqualTo("poison payload");
        assertThat(task.getFinishedAt()).isNotNull();
    }

    private static StageTask pending(Stage stage) {
        UUID pipelineId = UUID.randomUUID();
        return new StageTask(UUID.randomUUID(), pipelineId, stage, 2, "{}",
                TaskMessage.idempotencyKey(pipelineId, stage, 2), 0, Instant.now());
    }

    private static StageTask running(Stage stage, int deliveries) {
        StageTask task = pending(stage);
        task.setState(TaskState.RUNNING);
        task.setWorkerId("worker-x");
        task.setHeartbeatAt(Instant.now().minusSeconds(3600));
        for (int i = 0; i < deliveries; i++) task.incrementDeliveries();
        return task;
    }
}
