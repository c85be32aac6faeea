package com.repopal.orchestrator.config;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import com.repopal.orchestrator.command.CommandRegistry;
import com.repopal.orchestrator.executor.*;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the Command Executor and its collaborators from {@code repopal.executor}
 * and {@code repopal.git}.
 */
@Configuration
public class ExecutorConfig {

    @Bean
    public DockerClient dockerClient(RepoPalProperties properties) {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", properties.getExecutor().getDockerHost());
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // zerodep talks to the Unix socket itself
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public SandboxRunner sandboxRunner(DockerClient dockerClient, RepoPalProperties properties) {
        return new DockerSandboxRunner(dockerClient, properties.getExecutor().getImagePullTimeoutSeconds());
    }

    @Bean
    public WorkspaceManager workspaceManager(RepoPalProperties properties) {
        RepoPalProperties.Executor executor = properties.getExecutor();
        return new WorkspaceManager(executor.getWorkspaceRoot(), executor.getMaxWorkspaceBytes().toBytes());
    }

    @Bean
    public GitClient gitClient(RepoPalProperties properties) {
        RepoPalProperties.Git git = properties.getGit();
        return new GitClient(git.getBinary(), git.getAuthorName(), git.getAuthorEmail(), git.getCloneTimeoutSeconds());
    }

    @Bean
    public CommandExecutor commandExecutor(CommandRegistry registry,
                                           CredentialProvider credentialProvider,
                                           WorkspaceManager workspaceManager,
                                           GitClient gitClient,
                                           SandboxRunner sandboxRunner,
                                           RepoPalProperties properties,
                                           MeterRegistry meterRegistry) {
        RepoPalProperties.Executor executor = properties.getExecutor();
        SandboxLimits limits = new SandboxLimits(
                executor.getContainerMemoryLimit().toBytes(),
                executor.getContainerCpuLimit(),
                executor.getExecutionTimeoutSeconds(),
                executor.getSandboxUser());
        return new SandboxCommandExecutor(registry, credentialProvider, workspaceManager, gitClient,
                sandboxRunner, limits, properties.getGit().getCloneUrlTemplate(), meterRegistry);
    }
}
