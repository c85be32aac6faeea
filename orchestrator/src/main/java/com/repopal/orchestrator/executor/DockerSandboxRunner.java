package com.repopal.orchestrator.executor;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Runs commands in throwaway Docker containers.
 *
 * <p>Each container is configured with:
 * <ul>
 *   <li>a bind mount of the workspace to /workspace, and nothing else</li>
 *   <li>memory (no swap), CPU and PID limits</li>
 *   <li>network mode "none" unless the command requires network</li>
 *   <li>a non-root user, all capabilities dropped, no-new-privileges</li>
 * </ul>
 *
 * The wall-clock limit is enforced here: the container is killed when it is exceeded.
 */
public class DockerSandboxRunner implements SandboxRunner {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxRunner.class);

    // Cancellation and deadline are checked this often while the container runs.
    private static final int POLL_SECONDS = 2;

    private static final int MAX_OUTPUT_CHARS = 256 * 1024;

    private static final long PIDS_LIMIT = 512;

    private final DockerClient dockerClient;
    private final int          pullTimeoutSeconds;

    public DockerSandboxRunner(DockerClient dockerClient, int pullTimeoutSeconds) {
        this.dockerClient       = dockerClient;
        this.pullTimeoutSeconds = pullTimeoutSeconds;
    }

    @Override
    public SandboxOutcome run(SandboxSpec spec, Path workspace, SandboxLimits limits, CancellationCheck cancellation) {
        String containerName = "repopal-" + workspace.getFileName() + "-" + UUID.randomUUID().toString().substring(0, 6);
        String containerId = null;
        try {
            ensureImage(spec.image());
            containerId = create(containerName, spec, workspace, limits);
            dockerClient.startContainerCmd(containerId).exec();
            log.info("Sandbox {} started (container {}, image {})", containerName, containerId, spec.image());
        } catch (ExecutorException e) {
            teardown(containerId);
            throw e;
        } catch (RuntimeException e) {
            teardown(containerId);
            throw new ExecutorException(ExecutorException.Kind.TRANSIENT,
                    "Sandbox launch failed for image " + spec.image() + ": " + e.getMessage(), e);
        }

        try {
            return await(containerId, limits.timeoutSeconds(), cancellation);
        } finally {
            teardown(containerId);
        }
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    private void ensureImage(String image) {
        try {
            dockerClient.inspectImageCmd(image).exec();
        } catch (NotFoundException e) {
            log.info("Image {} not present locally, pulling", image);
            try {
                boolean pulled = dockerClient.pullImageCmd(image).exec(new PullImageResultCallback())
                        .awaitCompletion(pullTimeoutSeconds, TimeUnit.SECONDS);
                if (!pulled) {
                    throw new ExecutorException(ExecutorException.Kind.TRANSIENT,
                            "Pulling " + image + " did not finish within " + pullTimeoutSeconds + "s");
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new ExecutorException(ExecutorException.Kind.TRANSIENT, "Interrupted while pulling " + image, ie);
            }
        }
    }

    private String create(String name, SandboxSpec spec, Path workspace, SandboxLimits limits) {
        List<String> env = new ArrayList<>();
        for (Map.Entry<String, String> e : spec.env().entrySet()) {
            env.add(e.getKey() + "=" + e.getValue());
        }

        HostConfig hostConfig = HostConfig.newHostConfig()
                .withBinds(new Bind(workspace.toAbsolutePath().toString(), new Volume("/workspace"), AccessMode.rw))
                .withMemory(limits.memoryBytes())
                .withMemorySwap(limits.memoryBytes())
                .withNanoCPUs((long) (limits.cpus() * 1_000_000_000L))
                .withPidsLimit(PIDS_LIMIT)
                .withNetworkMode(spec.network() ? "bridge" : "none")
                .withCapDrop(Capability.ALL)
                .withSecurityOpts(List.of("no-new-privileges"))
                .withPrivileged(false);

        var cmd = dockerClient.createContainerCmd(spec.image())
                .withName(name)
                .withHostConfig(hostConfig)
                .withEnv(env)
                .withUser(limits.user())
                .withWorkingDir("/workspace")
                .withNetworkDisabled(!spec.network());
        if (!spec.argv().isEmpty()) {
            cmd = cmd.withCmd(spec.argv());
        }
        return cmd.exec().getId();
    }

    private SandboxOutcome await(String containerId, int timeoutSeconds, CancellationCheck cancellation) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
        try (WaitContainerResultCallback callback =
                     dockerClient.waitContainerCmd(containerId).exec(new WaitContainerResultCallback())) {
            while (!callback.awaitCompletion(POLL_SECONDS, TimeUnit.SECONDS)) {
                if (cancellation.isCancelled()) {
                    log.warn("Cancellation requested, killing sandbox {}", containerId);
                    kill(containerId);
                    return SandboxOutcome.cancelled(logs(containerId, false), logs(containerId, true));
                }
                if (System.nanoTime() > deadline) {
                    log.warn("Sandbox {} exceeded {}s, killing", containerId, timeoutSeconds);
                    kill(containerId);
                    return SandboxOutcome.timedOut(logs(containerId, false), logs(containerId, true));
                }
            }
            Integer exitCode = callback.awaitStatusCode();
            return SandboxOutcome.exited(exitCode != null ? exitCode : -1,
                    logs(containerId, false), logs(containerId, true));
        } catch (InterruptedException e) {
            // Hard stage timeout or shutdown: the worker thread was interrupted.
            Thread.currentThread().interrupt();
            kill(containerId);
            return SandboxOutcome.cancelled("", "");
        } catch (IOException e) {
            log.warn("Could not close wait callback for {}: {}", containerId, e.getMessage());
            return SandboxOutcome.exited(-1, "", "Lost track of sandbox " + containerId);
        }
    }

    private String logs(String containerId, boolean stderr) {
        StringBuilder sb = new StringBuilder();
        try {
            dockerClient.logContainerCmd(containerId)
                    .withStdOut(!stderr)
                    .withStdErr(stderr)
                    .withFollowStream(false)
                    .exec(new ResultCallback.Adapter<Frame>() {
                        @Override
                        public void onNext(Frame frame) {
                            if (sb.length() < MAX_OUTPUT_CHARS) {
                                sb.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                            }
                        }
                    }).awaitCompletion(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while capturing output from sandbox {}", containerId);
        }
        if (sb.length() > MAX_OUTPUT_CHARS) {
            sb.setLength(MAX_OUTPUT_CHARS);
            sb.append("\n[output truncated]");
        }
        return sb.toString();
    }

    private void kill(String containerId) {
        try {
            dockerClient.killContainerCmd(containerId).exec();
        } catch (RuntimeException e) {
            log.debug("Container {} may already have exited: {}", containerId, e.getMessage());
        }
    }

    private void teardown(String containerId) {
        if (containerId == null) return;
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            log.info("Sandbox {} torn down", containerId);
        } catch (RuntimeException e) {
            log.warn("Failed to remove container {}", containerId, e);
        }
    }
}
