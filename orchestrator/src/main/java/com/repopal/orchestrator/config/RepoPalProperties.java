package com.repopal.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed configuration under the {@code repopal} prefix (application.yml).
 */
@ConfigurationProperties(prefix = "repopal")
public class RepoPalProperties {

    private Pipeline pipeline = new Pipeline();
    private Executor executor = new Executor();
    private Git git = new Git();
    private Claude claude = new Claude();
    private Map<String, CommandDefinition> commands = new LinkedHashMap<>();

    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }
    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Claude getClaude() { return claude; }
    public void setClaude(Claude claude) { this.claude = claude; }
    public Map<String, CommandDefinition> getCommands() { return commands; }
    public void setCommands(Map<String, CommandDefinition> commands) { this.commands = commands; }

    /** Stage dispatch, retry and timeout policy. */
    public static class Pipeline {
        private int softTimeoutSeconds = 120;
        // Hard limit for CONTROL-lane stages; EXECUTE uses the execution timeout plus a grace period.
        private int hardTimeoutSeconds = 300;
        private int executeGraceSeconds = 180;
        private int maxStageRetries = 3;
        private int retryBackoffBaseSeconds = 5;
        private int retryBackoffMaxSeconds = 300;
        private int visibilityTimeoutSeconds = 300;
        private int maxDeliveries = 3;
        private int heartbeatIntervalSeconds = 30;
        private int controlWorkers = 4;
        private int executionWorkers = 2;

        public int getSoftTimeoutSeconds() { return softTimeoutSeconds; }
        public void setSoftTimeoutSeconds(int v) { this.softTimeoutSeconds = v; }
        public int getHardTimeoutSeconds() { return hardTimeoutSeconds; }
        public void setHardTimeoutSeconds(int v) { this.hardTimeoutSeconds = v; }
        public int getExecuteGraceSeconds() { return executeGraceSeconds; }
        public void setExecuteGraceSeconds(int v) { this.executeGraceSeconds = v; }
        public int getMaxStageRetries() { return maxStageRetries; }
        public void setMaxStageRetries(int v) { this.maxStageRetries = v; }
        public int getRetryBackoffBaseSeconds() { return retryBackoffBaseSeconds; }
        public void setRetryBackoffBaseSeconds(int v) { this.retryBackoffBaseSeconds = v; }
        public int getRetryBackoffMaxSeconds() { return retryBackoffMaxSeconds; }
        public void setRetryBackoffMaxSeconds(int v) { this.retryBackoffMaxSeconds = v; }
        public int getVisibilityTimeoutSeconds() { return visibilityTimeoutSeconds; }
        public void setVisibilityTimeoutSeconds(int v) { this.visibilityTimeoutSeconds = v; }
        public int getMaxDeliveries() { return maxDeliveries; }
        public void setMaxDeliveries(int v) { this.maxDeliveries = v; }
        public int getHeartbeatIntervalSeconds() { return heartbeatIntervalSeconds; }
        public void setHeartbeatIntervalSeconds(int v) { this.heartbeatIntervalSeconds = v; }
        public int getControlWorkers() { return controlWorkers; }
        public void setControlWorkers(int v) { this.controlWorkers = v; }
        public int getExecutionWorkers() { return executionWorkers; }
        public void setExecutionWorkers(int v) { this.executionWorkers = v; }
    }

    /** Workspace and sandbox limits. */
    public static class Executor {
        private int executionTimeoutSeconds = 600;
        private int imagePullTimeoutSeconds = 600;
        private Path workspaceRoot = Path.of("/var/lib/repopal/workspaces");
        private DataSize maxWorkspaceBytes = DataSize.ofGigabytes(20);
        private DataSize containerMemoryLimit = DataSize.ofGigabytes(2);
        private double containerCpuLimit = 1.0;
        private String sandboxUser = "1000:1000";
        private String dockerHost = "unix:///var/run/docker.sock";

        public int getExecutionTimeoutSeconds() { return executionTimeoutSeconds; }
        public void setExecutionTimeoutSeconds(int v) { this.executionTimeoutSeconds = v; }
        public int getImagePullTimeoutSeconds() { return imagePullTimeoutSeconds; }
        public void setImagePullTimeoutSeconds(int v) { this.imagePullTimeoutSeconds = v; }
        public Path getWorkspaceRoot() { return workspaceRoot; }
        public void setWorkspaceRoot(Path workspaceRoot) { this.workspaceRoot = workspaceRoot; }
        public DataSize getMaxWorkspaceBytes() { return maxWorkspaceBytes; }
        public void setMaxWorkspaceBytes(DataSize v) { this.maxWorkspaceBytes = v; }
        public DataSize getContainerMemoryLimit() { return containerMemoryLimit; }
        public void setContainerMemoryLimit(DataSize v) { this.containerMemoryLimit = v; }
        public double getContainerCpuLimit() { return containerCpuLimit; }
        public void setContainerCpuLimit(double v) { this.containerCpuLimit = v; }
        public String getSandboxUser() { return sandboxUser; }
        public void setSandboxUser(String sandboxUser) { this.sandboxUser = sandboxUser; }
        public String getDockerHost() { return dockerHost; }
        public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
    }

    /** git CLI and repository access. */
    public static class Git {
        private String binary = "git";
        private String cloneUrlTemplate = "https://github.com/%s.git";
        private String authorName = "RepoPal";
        private String authorEmail = "repopal@users.noreply.github.com";
        private int cloneTimeoutSeconds = 300;
        // Static token handed out by the configuration-backed credential provider; blank = anonymous.
        private String token = "";
        private int tokenTtlSeconds = 3600;

        public String getBinary() { return binary; }
        public void setBinary(String binary) { this.binary = binary; }
        public String getCloneUrlTemplate() { return cloneUrlTemplate; }
        public void setCloneUrlTemplate(String v) { this.cloneUrlTemplate = v; }
        public String getAuthorName() { return authorName; }
        public void setAuthorName(String authorName) { this.authorName = authorName; }
        public String getAuthorEmail() { return authorEmail; }
        public void setAuthorEmail(String authorEmail) { this.authorEmail = authorEmail; }
        public int getCloneTimeoutSeconds() { return cloneTimeoutSeconds; }
        public void setCloneTimeoutSeconds(int v) { this.cloneTimeoutSeconds = v; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public int getTokenTtlSeconds() { return tokenTtlSeconds; }
        public void setTokenTtlSeconds(int v) { this.tokenTtlSeconds = v; }
    }

    /** Claude-backed command selection and argument generation. */
    public static class Claude {
        private String apiKey = "";
        private String model = "claude-sonnet-4-5";
        private String apiUrl = "https://api.anthropic.com/v1/messages";

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
    }

    /**
     * One sandboxed command. {@code argv} entries may contain {@code {name}} placeholders
     * that are replaced by argument values; an entry whose placeholder names an absent
     * optional argument is dropped.
     */
    public static class CommandDefinition {
        private String version = "1.0.0";
        private String description = "";
        private String image;
        private List<String> argv = new ArrayList<>();
        private List<String> requiredArgs = new ArrayList<>();
        private List<String> optionalArgs = new ArrayList<>();
        private List<String> requiredEnv = new ArrayList<>();
        private boolean network = false;
        private boolean write = true;

        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }
        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public List<String> getArgv() { return argv; }
        public void setArgv(List<String> argv) { this.argv = argv; }
        public List<String> getRequiredArgs() { return requiredArgs; }
        public void setRequiredArgs(List<String> requiredArgs) { this.requiredArgs = requiredArgs; }
        public List<String> getOptionalArgs() { return optionalArgs; }
        public void setOptionalArgs(List<String> optionalArgs) { this.optionalArgs = optionalArgs; }
        public List<String> getRequiredEnv() { return requiredEnv; }
        public void setRequiredEnv(List<String> requiredEnv) { this.requiredEnv = requiredEnv; }
        public boolean isNetwork() { return network; }
        public void setNetwork(boolean network) { this.network = network; }
        public boolean isWrite() { return write; }
        public void setWrite(boolean write) { this.write = write; }
    }
}
