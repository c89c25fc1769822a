package io.github.drompincen.clawrelay.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings bound from the {@code relay.*} namespace. Environment variables override them through
 * relaxed binding, e.g. {@code RELAY_MAX_CONCURRENT_JOBS=4}.
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    /** Global cap on jobs running at the same time across all conversations. */
    private int maxConcurrentJobs = 2;

    private Duration sessionIdleTimeout = Duration.ofHours(3);
    private Duration jobRetention = Duration.ofHours(24);
    private Duration sweepInterval = Duration.ofMinutes(30);

    /** Minimum spacing between progress notifications for one job. */
    private Duration progressInterval = Duration.ofMillis(1500);

    /** Parent directory of every per-session workspace tree. */
    private Path workspaceBase = Path.of("/tmp/agent");

    /** Data home that holds the shared credential blob ({@code opencode/auth.json}). */
    private Path xdgDataHome = Path.of("/data");

    private String defaultModel = "kimi/kimi-k2.5-free";

    /** Empty means every user may talk to the agent. */
    private List<String> allowedUserIds = new ArrayList<>();

    private Runtime runtime = new Runtime();
    private Auth auth = new Auth();

    public int getMaxConcurrentJobs() { return maxConcurrentJobs; }
    public void setMaxConcurrentJobs(int maxConcurrentJobs) { this.maxConcurrentJobs = maxConcurrentJobs; }

    public Duration getSessionIdleTimeout() { return sessionIdleTimeout; }
    public void setSessionIdleTimeout(Duration sessionIdleTimeout) { this.sessionIdleTimeout = sessionIdleTimeout; }

    public Duration getJobRetention() { return jobRetention; }
    public void setJobRetention(Duration jobRetention) { this.jobRetention = jobRetention; }

    public Duration getSweepInterval() { return sweepInterval; }
    public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }

    public Duration getProgressInterval() { return progressInterval; }
    public void setProgressInterval(Duration progressInterval) { this.progressInterval = progressInterval; }

    public Path getWorkspaceBase() { return workspaceBase; }
    public void setWorkspaceBase(Path workspaceBase) { this.workspaceBase = workspaceBase; }

    public Path getXdgDataHome() { return xdgDataHome; }
    public void setXdgDataHome(Path xdgDataHome) { this.xdgDataHome = xdgDataHome; }

    public String getDefaultModel() { return defaultModel; }
    public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }

    public List<String> getAllowedUserIds() { return allowedUserIds; }
    public void setAllowedUserIds(List<String> allowedUserIds) { this.allowedUserIds = allowedUserIds; }

    public Runtime getRuntime() { return runtime; }
    public void setRuntime(Runtime runtime) { this.runtime = runtime; }

    public Auth getAuth() { return auth; }
    public void setAuth(Auth auth) { this.auth = auth; }

    /** How the per-session agent runtime is launched and talked to. */
    public static class Runtime {

        private List<String> command = new ArrayList<>(List.of("opencode"));
        private String hostname = "127.0.0.1";
        private String logLevel = "INFO";
        private Duration startupTimeout = Duration.ofSeconds(30);
        private Duration healthPollInterval = Duration.ofMillis(100);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration modelListTimeout = Duration.ofSeconds(60);
        private String modelsProvider = "openai";

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }

        public String getHostname() { return hostname; }
        public void setHostname(String hostname) { this.hostname = hostname; }

        public String getLogLevel() { return logLevel; }
        public void setLogLevel(String logLevel) { this.logLevel = logLevel; }

        public Duration getStartupTimeout() { return startupTimeout; }
        public void setStartupTimeout(Duration startupTimeout) { this.startupTimeout = startupTimeout; }

        public Duration getHealthPollInterval() { return healthPollInterval; }
        public void setHealthPollInterval(Duration healthPollInterval) { this.healthPollInterval = healthPollInterval; }

        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }

        public Duration getModelListTimeout() { return modelListTimeout; }
        public void setModelListTimeout(Duration modelListTimeout) { this.modelListTimeout = modelListTimeout; }

        public String getModelsProvider() { return modelsProvider; }
        public void setModelsProvider(String modelsProvider) { this.modelsProvider = modelsProvider; }
    }

    /**
     * Rules for driving the interactive {@code auth login} flow. The phrases track the external
     * tool's prompt wording and are expected to drift, so they live in configuration.
     */
    public static class Auth {

        private List<String> command = new ArrayList<>(
                List.of("opencode", "--print-logs", "--log-level", "INFO", "auth", "login"));
        private List<String> promptPhrases = new ArrayList<>(List.of("select provider", "add credential"));
        private List<String> successPhrases = new ArrayList<>(List.of("Successfully", "Done"));
        private Map<String, String> providerLabels = new LinkedHashMap<>(
                Map.of("openai", "OpenAI", "google", "Google", "codex", "codex"));
        private Duration selectionDelay = Duration.ofMillis(1500);
        private Duration enterPulseInterval = Duration.ofSeconds(3);
        private int enterPulseMax = 6;
        private Duration timeout = Duration.ofMinutes(5);

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }

        public List<String> getPromptPhrases() { return promptPhrases; }
        public void setPromptPhrases(List<String> promptPhrases) { this.promptPhrases = promptPhrases; }

        public List<String> getSuccessPhrases() { return successPhrases; }
        public void setSuccessPhrases(List<String> successPhrases) { this.successPhrases = successPhrases; }

        public Map<String, String> getProviderLabels() { return providerLabels; }
        public void setProviderLabels(Map<String, String> providerLabels) { this.providerLabels = providerLabels; }

        public Duration getSelectionDelay() { return selectionDelay; }
        public void setSelectionDelay(Duration selectionDelay) { this.selectionDelay = selectionDelay; }

        public Duration getEnterPulseInterval() { return enterPulseInterval; }
        public void setEnterPulseInterval(Duration enterPulseInterval) { this.enterPulseInterval = enterPulseInterval; }

        public int getEnterPulseMax() { return enterPulseMax; }
        public void setEnterPulseMax(int enterPulseMax) { this.enterPulseMax = enterPulseMax; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }
}
