package com.repopal.orchestrator.executor;

import com.repopal.orchestrator.command.Command;
import com.repopal.orchestrator.command.CommandException;
import com.repopal.orchestrator.command.CommandRegistry;
import com.repopal.orchestrator.command.UnknownCommandException;
import com.repopal.orchestrator.executor.dto.*;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The Command Executor: credential → workspace → clone → sandbox → diff → commit → cleanup.
 *
 * The workspace and the sandbox belong to this call alone and are gone when it
 * returns, whichever way it returns. A cleanup failure is logged and never
 * replaces the result or the exception already on its way out.
 */
public class SandboxCommandExecutor implements CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(SandboxCommandExecutor.class);

    // Characters of stderr quoted in the status error of a failed command.
    private static final int ERROR_TAIL_CHARS = 2000;

    private final CommandRegistry    registry;
    private final CredentialProvider credentials;
    private final WorkspaceManager   workspaces;
    private final GitClient          git;
    private final SandboxRunner      sandbox;
    private final SandboxLimits      limits;
    private final String             cloneUrlTemplate;
    private final MeterRegistry      meterRegistry;

    public SandboxCommandExecutor(CommandRegistry registry,
                                  CredentialProvider credentials,
                                  WorkspaceManager workspaces,
                                  GitClient git,
                                  SandboxRunner sandbox,
                                  SandboxLimits limits,
                                  String cloneUrlTemplate,
                                  MeterRegistry meterRegistry) {
        this.registry         = registry;
        this.credentials      = credentials;
        this.workspaces       = workspaces;
        this.git              = git;
        this.sandbox          = sandbox;
        this.limits           = limits;
        this.cloneUrlTemplate = cloneUrlTemplate;
        this.meterRegistry    = meterRegistry;
    }

    @Override
    public ExecutionResult execute(CommandRequest request, CancellationCheck cancellation) {
        Command command = resolve(request);
        ExecutionContext ctx = request.context();
        SandboxSpec spec = command.invocation(request.requiredArgs(), request.optionalArgs(), environmentFor(command));
        RepositoryCredential credential = issueCredential(ctx.repository());
        String cloneUrl = ctx.cloneUrl() != null ? ctx.cloneUrl() : cloneUrlTemplate.formatted(ctx.repository());

        String status = "error";
        Workspace workspace = null;
        try {
            workspace = workspaces.allocate(request.pipelineId());
            checkCancelled(cancellation, request);

            git.cloneRepository(cloneUrl, credential, ctx.baseBranch(), workspace.dir());
            String originalCommit = git.headCommit(workspace.dir());
            log.info("Cloned {} @ {} at {}", ctx.repository(), ctx.baseBranch(), originalCommit);
            checkCancelled(cancellation, request);

            SandboxOutcome outcome = sandbox.run(spec, workspace.dir(), limits, cancellation);
            if (outcome.cancelled()) {
                status = "cancelled";
                throw new ExecutorException(ExecutorException.Kind.CANCELLED,
                        "Command '" + request.command() + "' was cancelled");
            }
            WorkspaceInfo info = new WorkspaceInfo(workspace.dir().toString(), sizeOf(workspace));

            if (outcome.timedOut()) {
                status = "timeout";
                log.warn("Command '{}' timed out after {}s", request.command(), limits.timeoutSeconds());
                return new ExecutionResult(ExecutionStatus.timeout(limits.timeoutSeconds()),
                        outcome.stdout(), outcome.stderr(), ChangeSet.empty(originalCommit), info);
            }

            List<FileChange> changes = git.changesSince(workspace.dir(), originalCommit);
            if (outcome.exitCode() != 0) {
                status = "exit_failure";
                log.warn("Command '{}' exited with {}", request.command(), outcome.exitCode());
                return new ExecutionResult(
                        ExecutionStatus.exited(outcome.exitCode(), failureSummary(outcome)),
                        outcome.stdout(), outcome.stderr(),
                        new ChangeSet(changes, originalCommit, null), info);
            }

            String finalCommit = null;
            if (!changes.isEmpty() && command.policy().writeAllowed() && ctx.canWrite()) {
                finalCommit = commitAndPush(request, workspace, cloneUrl, credential);
            }
            status = "success";
            log.info("Command '{}' succeeded: {} file(s) changed, final commit {}",
                    request.command(), changes.size(), finalCommit);
            return new ExecutionResult(ExecutionStatus.succeeded(), outcome.stdout(), outcome.stderr(),
                    new ChangeSet(changes, originalCommit, finalCommit), info);
        } catch (GitException e) {
            throw classify(e);
        } finally {
            cleanup(workspace);
            meterRegistry.counter("repopal.command.executions",
                    "command", request.command(), "status", status).increment();
        }
    }

    // ------------------------------------------------------------------
    // Phases
    // ------------------------------------------------------------------

    private Command resolve(CommandRequest request) {
        try {
            Command command = registry.get(request.command());
            command.validateArgs(request.requiredArgs(), request.optionalArgs());
            return command;
        } catch (UnknownCommandException e) {
            throw new ExecutorException(ExecutorException.Kind.FATAL, e.getMessage(), e);
        } catch (CommandException e) {
            throw new ExecutorException(ExecutorException.Kind.VALIDATION, e.getMessage(), e);
        }
    }

    private Map<String, String> environmentFor(Command command) {
        try {
            return registry.resolveEnvironment(command);
        } catch (CommandException e) {
            throw new ExecutorException(ExecutorException.Kind.FATAL, e.getMessage(), e);
        }
    }

    private RepositoryCredential issueCredential(String repository) {
        try {
            RepositoryCredential credential = credentials.issue(repository);
            if (credential.isExpired(Instant.now())) {
                throw new ExecutorException(ExecutorException.Kind.TRANSIENT,
                        "Credential issued for " + repository + " had already expired at " + credential.expiresAt());
            }
            return credential;
        } catch (CredentialException e) {
            throw new ExecutorException(
                    e.isRevoked() ? ExecutorException.Kind.FATAL : ExecutorException.Kind.TRANSIENT,
                    "Could not obtain credential for " + repository + ": " + e.getMessage(), e);
        }
    }

    private String commitAndPush(CommandRequest request, Workspace workspace, String cloneUrl,
                                 RepositoryCredential credential) {
        ExecutionContext ctx = request.context();
        String commit = git.commit(workspace.dir(),
                "RepoPal: " + request.command() + "\n\nPipeline " + request.pipelineId());
        if (credential.isExpired(Instant.now())) {
            log.info("Credential for {} expired during the run, requesting a new one for push", ctx.repository());
            credential = issueCredential(ctx.repository());
        }
        boolean botBranch = !ctx.targetBranch().equals(ctx.baseBranch());
        git.push(workspace.dir(), cloneUrl, credential, ctx.targetBranch(), botBranch);
        return commit;
    }

    private static void checkCancelled(CancellationCheck cancellation, CommandRequest request) {
        if (cancellation.isCancelled()) {
            throw new ExecutorException(ExecutorException.Kind.CANCELLED,
                    "Pipeline " + request.pipelineId() + " was cancelled");
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Network and rate-limit failures are worth another attempt; a rejected credential,
     * missing repository or branch is not.
     */
    static ExecutorException classify(GitException e) {
        ExecutorException.Kind kind = switch (e.getFailure()) {
            case NETWORK -> ExecutorException.Kind.TRANSIENT;
            case AUTH, NOT_FOUND, OTHER -> ExecutorException.Kind.FATAL;
        };
        return new ExecutorException(kind, e.getMessage(), e);
    }

    private long sizeOf(Workspace workspace) {
        try {
            return workspaces.sizeOf(workspace.dir());
        } catch (IOException e) {
            log.warn("Could not measure workspace {}: {}", workspace.dir(), e.getMessage());
            return -1;
        }
    }

    private void cleanup(Workspace workspace) {
        if (workspace == null) return;
        try {
            workspaces.delete(workspace);
        } catch (IOException | RuntimeException e) {
            log.warn("Could not delete workspace {}, manual cleanup may be needed: {}",
                    workspace.dir(), e.getMessage());
        }
    }

    static String failureSummary(SandboxOutcome outcome) {
        String stderr = outcome.stderr() == null ? "" : outcome.stderr().strip();
        if (stderr.isEmpty()) {
            return "Command exited with code " + outcome.exitCode();
        }
        if (stderr.length() > ERROR_TAIL_CHARS) {
            stderr = "..." + stderr.substring(stderr.length() - ERROR_TAIL_CHARS);
        }
        return "Command exited with code " + outcome.exitCode() + ": " + stderr;
    }
}
