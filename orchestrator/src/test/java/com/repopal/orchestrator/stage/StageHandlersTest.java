package com.repopal.orchestrator.stage;

import com.repopal.orchestrator.capability.ArgumentGenerator;
import com.repopal.orchestrator.capability.CapabilityException;
import com.repopal.orchestrator.capability.CommandSelector;
import com.repopal.orchestrator.capability.GeneratedArguments;
import com.repopal.orchestrator.command.CommandRegistry;
import com.repopal.orchestrator.config.RepoPalProperties;
import com.repopal.orchestrator.event.ExecutionEnvironment;
import com.repopal.orchestrator.event.RepositoryContext;
import com.repopal.orchestrator.event.StandardizedEvent;
import com.repopal.orchestrator.executor.CancellationCheck;
import com.repopal.orchestrator.executor.CommandExecutor;
import com.repopal.orchestrator.executor.ExecutorException;
import com.repopal.orchestrator.executor.dto.*;
import com.repopal.orchestrator.model.Pipeline;
import com.repopal.orchestrator.result.ChangeRequestException;
import com.repopal.orchestrator.result.PipelineSummary;
import com.repopal.orchestrator.result.ResultProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

/**
 * Each stage handler in isolation: capabilities, executor and result processor are mocked,
 * the command registry is real.
 */
@ExtendWith(MockitoExtension.class)
class StageHandlersTest {

    static final UUID PIPELINE_ID = UUID.fromString("0c9f6a2e-1111-2222-3333-444455556666");

    @Mock CommandSelector   selector;
    @Mock ArgumentGenerator arguments;
    @Mock CommandExecutor   executor;
    @Mock ResultProcessor   results;

    PipelineContext context;
    Pipeline        pipeline;

    @BeforeEach
    void setUp() {
        RepoPalProperties properties = new RepoPalProperties();
        RepoPalProperties.CommandDefinition license = new RepoPalProperties.CommandDefinition();
        license.setImage("ghcr.io/repopal/license:1");
        license.setArgv(List.of("license-header", "{license}"));
        license.setRequiredArgs(List.of("license"));
        properties.getCommands().put("add-license-header", license);

        context = new PipelineContext(new CommandRegistry(List.of(), properties),
                selector, arguments, executor, results, CancellationCheck.NEVER);
        pipeline = new Pipeline(PIPELINE_ID, "github", "org/repo");
    }

    // ------------------------------------------------------------------
    // PROCESS
    // ------------------------------------------------------------------

    @Test
    void process_selectsRegisteredCommand() {
        when(selector.selectCommand(eq("add an MIT header"), anyList())).thenReturn("add-license-header");

        StageOutcome outcome = new ProcessStageHandler().handle(context, pipeline, StagePayload.of(event(null)));

        assertThat(outcome.failed()).isFalse();
        assertThat(outcome.payload().command()).isEqualTo("add-license-header");
        assertThat(outcome.metadata()).containsEntry("command", "add-license-header");
    }

    @Test
    void process_unregisteredCommand_isFatal() {
        when(selector.selectCommand(anyString(), anyList())).thenReturn("deploy-prod");

        assertThatThrownBy(() -> new ProcessStageHandler().handle(context, pipeline, StagePayload.of(event(null))))
                .isInstanceOf(StageException.class)
                .hasMessage("Unknown command selected: deploy-prod")
                .extracting(e -> ((StageException) e).getKind())
                .isEqualTo(StageException.Kind.FATAL);
    }

    @Test
    void process_transientSelectorFailure_isTransient() {
        when(selector.selectCommand(anyString(), anyList()))
                .thenThrow(new CapabilityException("rate limited", true));

        assertThatThrownBy(() -> new ProcessStageHandler().handle(context, pipeline, StagePayload.of(event(null))))
                .isInstanceOf(StageException.class)
                .extracting(e -> ((StageException) e).getKind())
                .isEqualTo(StageException.Kind.TRANSIENT);
    }

    // ------------------------------------------------------------------
    // DISPATCH
    // ------------------------------------------------------------------

    @Test
    void dispatch_buildsRequestOnGeneratedBranch() {
        when(arguments.generateArguments(any(), anyString(), anyList(), anyList()))
                .thenReturn(new GeneratedArguments(Map.of("license", "MIT"), Map.of()));

        StageOutcome outcome = new DispatchStageHandler().handle(context, pipeline,
                StagePayload.of(event(null)).withCommand("add-license-header"));

        CommandRequest request = outcome.payload().request();
        assertThat(request.pipelineId()).isEqualTo(PIPELINE_ID);
        assertThat(request.requiredArgs()).containsEntry("license", "MIT");
        assertThat(request.context().baseBranch()).isEqualTo("main");
        assertThat(request.context().targetBranch()).isEqualTo("repopal/0c9f6a2e");
        assertThat(request.context().canWrite()).isTrue();
        assertThat(outcome.metadata()).containsEntry("targetBranch", "repopal/0c9f6a2e");
    }

    @Test
    void dispatch_explicitTargetBranch_isUsed() {
        when(arguments.generateArguments(any(), anyString(), anyList(), anyList()))
                .thenReturn(new GeneratedArguments(Map.of("license", "MIT"), Map.of()));

        StageOutcome outcome = new DispatchStageHandler().handle(context, pipeline,
                StagePayload.of(event("feature/headers")).withCommand("add-license-header"));

        assertThat(outcome.payload().request().context().targetBranch()).isEqualTo("feature/headers");
    }

    @Test
    void dispatch_missingRequiredArgument_isValidation() {
        when(arguments.generateArguments(any(), anyString(), anyList(), anyList()))
                .thenReturn(GeneratedArguments.none());

        assertThatThrownBy(() -> new DispatchStageHandler().handle(context, pipeline,
                StagePayload.of(event(null)).withCommand("add-license-header")))
                .isInstanceOf(StageException.class)
                .hasMessageContaining("license")
                .extracting(e -> ((StageException) e).getKind())
                .isEqualTo(StageException.Kind.VALIDATION);
    }

    @Test
    void dispatch_unknownCommand_isFatal() {
        assertThatThrownBy(() -> new DispatchStageHandler().handle(context, pipeline,
                StagePayload.of(event(null)).withCommand("deploy-prod")))
                .isInstanceOf(StageException.class)
                .extracting(e -> ((StageException) e).getKind())
                .isEqualTo(StageException.Kind.FATAL);
    }

    // ------------------------------------------------------------------
    // EXECUTE
    // ------------------------------------------------------------------

    @Test
    void execute_failedCommand_stillAdvancesWithMetadata() {
        ExecutionResult failed = new ExecutionResult(ExecutionStatus.exited(2, "Command exited with code 2"),
                "", "boom", ChangeSet.empty("abc"), new WorkspaceInfo("/ws", 10));
        when(executor.execute(any(), any())).thenReturn(failed);

        StageOutcome outcome = new ExecuteStageHandler().handle(context, pipeline, dispatchedPayload());

        assertThat(outcome.failed()).isFalse();
        assertThat(outcome.payload().result()).isEqualTo(failed);
        assertThat(outcome.metadata())
                .containsEntry("exitCode", 2)
                .containsEntry("timedOut", false)
                .containsEntry("filesChanged", 0)
                .doesNotContainKey("finalCommit");
    }

    @Test
    void execute_executorKinds_mapToStageKinds() {
        assertKind(ExecutorException.Kind.TRANSIENT, StageException.Kind.TRANSIENT);
        assertKind(ExecutorException.Kind.VALIDATION, StageException.Kind.VALIDATION);
        assertKind(ExecutorException.Kind.FATAL, StageException.Kind.FATAL);
        assertKind(ExecutorException.Kind.CANCELLED, StageException.Kind.FATAL);
    }

    // ------------------------------------------------------------------
    // PROCESS_RESULTS
    // ------------------------------------------------------------------

    @Test
    void processResults_failedSummary_endsPipelineFailed() {
        when(results.process(eq(PIPELINE_ID), any(), eq("add-license-header"), eq("repopal/0c9f6a2e"), any()))
                .thenReturn(new PipelineSummary(PIPELINE_ID, "org/repo", "add-license-header", false,
                        List.of(), "no changes", null, "Command exited with code 2"));

        StageOutcome outcome = new ProcessResultsStageHandler().handle(context, pipeline,
                dispatchedPayload().withResult(null));

        assertThat(outcome.failed()).isTrue();
        assertThat(outcome.error()).isEqualTo("Command exited with code 2");
        assertThat(outcome.metadata()).containsEntry("changeSummary", "no changes");
    }

    @Test
    void processResults_changeRequestFailure_isTransient() {
        when(results.process(any(), any(), any(), any(), any()))
                .thenThrow(new ChangeRequestException("Could not open change request: 502", null));

        assertThatThrownBy(() -> new ProcessResultsStageHandler().handle(context, pipeline, dispatchedPayload()))
                .isInstanceOf(StageException.class)
                .extracting(e -> ((StageException) e).getKind())
                .isEqualTo(StageException.Kind.TRANSIENT);
    }

    private void assertKind(ExecutorException.Kind from, StageException.Kind to) {
        doThrow(new ExecutorException(from, "executor said no")).when(executor).execute(any(), any());
        assertThatThrownBy(() -> new ExecuteStageHandler().handle(context, pipeline, dispatchedPayload()))
                .isInstanceOf(StageException.class)
                .extracting(e -> ((StageException) e).getKind())
                .isEqualTo(to);
    }

    private StagePayload dispatchedPayload() {
        CommandRequest request = new CommandRequest(PIPELINE_ID, "add-license-header", Map.of("license", "MIT"),
                Map.of(), new ExecutionContext("org/repo", null, "main", "repopal/0c9f6a2e", true));
        return StagePayload.of(event(null)).withCommand("add-license-header").withRequest(request);
    }

    private static StandardizedEvent event(String targetBranch) {
        return new StandardizedEvent("github", "add an MIT header", List.of("src/app.py"), List.of(),
                new RepositoryContext("org/repo", null, "main", "python", true, true),
                new ExecutionEnvironment(targetBranch, null, false), Map.of());
    }
}
