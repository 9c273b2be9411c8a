package triagent.orchestrator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import triagent.orchestrator.model.TaskType;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration holder for orchestrator settings.
 * Built once at startup and passed explicitly to every component.
 * All settings have sensible defaults.
 */
public final class OrchestratorConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/triagent;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;
    private Duration databaseLockTimeout = Duration.ofSeconds(10);

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private String agentKey = null; // If set, workers must provide X-Triagent-Key header

    // Pool settings
    private List<String> capabilities = List.of("claude", "codex", "gemini");
    private int maxConcurrentTasksPerWorker = 3;
    private int shardCount = 3;
    private Duration staleHeartbeatThreshold = Duration.ofMinutes(5);
    private Duration heartbeatInterval = Duration.ofSeconds(30);
    private Duration recoveryInterval = Duration.ofSeconds(30);
    private Duration pollInterval = Duration.ofSeconds(2);
    private Duration maxBackoff = Duration.ofSeconds(60);
    private Duration antiStarvationBackoff = Duration.ofSeconds(10);
    private int maxRetriesPerTask = 3;

    // Consensus settings
    private int minApprovals = 2;
    private Set<TaskType> unanimousTaskTypes = EnumSet.of(TaskType.SECURITY);

    // Breaker settings
    private int breakerFailureThreshold = 3;
    private Duration breakerCooldown = Duration.ofSeconds(60);

    // Budget settings ($)
    private BigDecimal budgetRateLimit = new BigDecimal("1.00");
    private Duration budgetRateWindow = Duration.ofMinutes(5);
    private BigDecimal budgetDailyLimit = new BigDecimal("50.00");
    private Duration budgetCheckInterval = Duration.ofSeconds(30);
    private Duration budgetKillGrace = Duration.ofSeconds(30);

    // Executor settings
    private Duration executorTimeout = Duration.ofSeconds(300);
    private Map<String, String> executorCommands = new LinkedHashMap<>();

    // Worker identity (worker mode only)
    private String workerId = null;
    private String workerShard = null;
    private String workerModel = null;
    private Set<TaskType> workerSpecialization = EnumSet.noneOf(TaskType.class);

    private OrchestratorConfig() {
    }

    public static OrchestratorConfig defaults() {
        return new OrchestratorConfig();
    }

    public static OrchestratorConfig fromEnv() {
        return defaults().applyEnv(System.getenv());
    }

    /**
     * Load settings from an ini file, then apply environment overrides.
     *
     * @param path ini file with [database], [server], [pool], [consensus],
     *             [breaker], [budget] and [executor] sections
     */
    public static OrchestratorConfig fromIni(Path path) throws IOException {
        Ini ini = new Ini(path.toFile());
        OrchestratorConfig config = defaults();

        Profile.Section database = ini.get("database");
        if (database != null) {
            config.databaseUrl = string(database, "url", config.databaseUrl);
            config.databasePoolSize = integer(database, "pool_size", config.databasePoolSize);
            config.databaseLockTimeout = seconds(database, "lock_timeout_seconds", config.databaseLockTimeout);
        }

        Profile.Section server = ini.get("server");
        if (server != null) {
            config.serverHost = string(server, "host", config.serverHost);
            config.serverPort = integer(server, "port", config.serverPort);
            config.agentKey = string(server, "agent_key", config.agentKey);
        }

        Profile.Section pool = ini.get("pool");
        if (pool != null) {
            String caps = pool.fetch("capabilities");
            if (caps != null && !caps.isBlank()) {
                config.capabilities = splitList(caps);
            }
            config.maxConcurrentTasksPerWorker = integer(pool, "max_concurrent_tasks_per_worker",
                    config.maxConcurrentTasksPerWorker);
            config.shardCount = integer(pool, "shard_count", config.shardCount);
            config.staleHeartbeatThreshold = seconds(pool, "stale_heartbeat_threshold_seconds",
                    config.staleHeartbeatThreshold);
            config.heartbeatInterval = seconds(pool, "heartbeat_interval_seconds", config.heartbeatInterval);
            config.recoveryInterval = seconds(pool, "recovery_interval_seconds", config.recoveryInterval);
            config.pollInterval = seconds(pool, "poll_interval_seconds", config.pollInterval);
            config.maxBackoff = seconds(pool, "max_backoff_seconds", config.maxBackoff);
            config.antiStarvationBackoff = seconds(pool, "anti_starvation_backoff_seconds",
                    config.antiStarvationBackoff);
            config.maxRetriesPerTask = integer(pool, "max_retries_per_task", config.maxRetriesPerTask);
        }

        Profile.Section consensus = ini.get("consensus");
        if (consensus != null) {
            config.minApprovals = integer(consensus, "min_approvals", config.minApprovals);
            String unanimous = consensus.fetch("unanimous_task_types");
            if (unanimous != null) {
                config.unanimousTaskTypes = parseTypes(unanimous);
            }
        }

        Profile.Section breaker = ini.get("breaker");
        if (breaker != null) {
            config.breakerFailureThreshold = integer(breaker, "failure_threshold", config.breakerFailureThreshold);
            config.breakerCooldown = seconds(breaker, "cooldown_seconds", config.breakerCooldown);
        }

        Profile.Section budget = ini.get("budget");
        if (budget != null) {
            config.budgetRateLimit = decimal(budget, "rate_limit_per_minute", config.budgetRateLimit);
            config.budgetRateWindow = seconds(budget, "rate_window_seconds", config.budgetRateWindow);
            config.budgetDailyLimit = decimal(budget, "daily_limit", config.budgetDailyLimit);
            config.budgetCheckInterval = seconds(budget, "check_interval_seconds", config.budgetCheckInterval);
            config.budgetKillGrace = seconds(budget, "kill_grace_seconds", config.budgetKillGrace);
        }

        Profile.Section executor = ini.get("executor");
        if (executor != null) {
            config.executorTimeout = seconds(executor, "timeout_seconds", config.executorTimeout);
            for (String key : executor.keySet()) {
                if (key.startsWith("command.")) {
                    config.executorCommands.put(key.substring("command.".length()), executor.fetch(key));
                }
            }
        }

        return config.applyEnv(System.getenv());
    }

    /**
     * Apply TRIAGENT_* overrides from the given environment map.
     */
    OrchestratorConfig applyEnv(Map<String, String> env) {
        String dbUrl = env.get("TRIAGENT_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String port = env.get("TRIAGENT_PORT");
        if (port != null && !port.isBlank()) {
            serverPort = Integer.parseInt(port.trim());
        }

        String key = env.get("TRIAGENT_AGENT_KEY");
        if (key != null && !key.isBlank()) {
            agentKey = key;
        }

        String caps = env.get("TRIAGENT_CAPABILITIES");
        if (caps != null && !caps.isBlank()) {
            capabilities = splitList(caps);
        }

        String maxRetries = env.get("TRIAGENT_MAX_RETRIES");
        if (maxRetries != null && !maxRetries.isBlank()) {
            maxRetriesPerTask = Integer.parseInt(maxRetries.trim());
        }

        String shards = env.get("TRIAGENT_SHARD_COUNT");
        if (shards != null && !shards.isBlank()) {
            shardCount = Integer.parseInt(shards.trim());
        }

        String worker = env.get("TRIAGENT_WORKER_ID");
        if (worker != null && !worker.isBlank()) {
            workerId = worker;
        }

        String shard = env.get("TRIAGENT_WORKER_SHARD");
        if (shard != null && !shard.isBlank()) {
            workerShard = shard;
        }

        String model = env.get("TRIAGENT_WORKER_MODEL");
        if (model != null && !model.isBlank()) {
            workerModel = model;
        }

        String specialization = env.get("TRIAGENT_WORKER_SPECIALIZATION");
        if (specialization != null && !specialization.isBlank()) {
            workerSpecialization = parseTypes(specialization);
        }

        return this;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration databaseLockTimeout() {
        return databaseLockTimeout;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String agentKey() {
        return agentKey;
    }

    public boolean hasAgentKey() {
        return agentKey != null && !agentKey.isBlank();
    }

    public List<String> capabilities() {
        return capabilities;
    }

    public int maxConcurrentTasksPerWorker() {
        return maxConcurrentTasksPerWorker;
    }

    public int shardCount() {
        return shardCount;
    }

    public Duration staleHeartbeatThreshold() {
        return staleHeartbeatThreshold;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration recoveryInterval() {
        return recoveryInterval;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration maxBackoff() {
        return maxBackoff;
    }

    public Duration antiStarvationBackoff() {
        return antiStarvationBackoff;
    }

    public int maxRetriesPerTask() {
        return maxRetriesPerTask;
    }

    public int minApprovals() {
        return minApprovals;
    }

    public Set<TaskType> unanimousTaskTypes() {
        return Collections.unmodifiableSet(unanimousTaskTypes);
    }

    public int breakerFailureThreshold() {
        return breakerFailureThreshold;
    }

    public Duration breakerCooldown() {
        return breakerCooldown;
    }

    public BigDecimal budgetRateLimit() {
        return budgetRateLimit;
    }

    public Duration budgetRateWindow() {
        return budgetRateWindow;
    }

    public BigDecimal budgetDailyLimit() {
        return budgetDailyLimit;
    }

    public Duration budgetCheckInterval() {
        return budgetCheckInterval;
    }

    public Duration budgetKillGrace() {
        return budgetKillGrace;
    }

    public Duration executorTimeout() {
        return executorTimeout;
    }

    public Map<String, String> executorCommands() {
        return Collections.unmodifiableMap(executorCommands);
    }

    public String workerId() {
        return workerId;
    }

    public String workerShard() {
        return workerShard;
    }

    public String workerModel() {
        return workerModel;
    }

    public Set<TaskType> workerSpecialization() {
        return Collections.unmodifiableSet(workerSpecialization);
    }

    // Fluent setters for testing/customization
    public OrchestratorConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public OrchestratorConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public OrchestratorConfig withAgentKey(String key) {
        this.agentKey = key;
        return this;
    }

    public OrchestratorConfig withCapabilities(String... capabilities) {
        this.capabilities = List.of(capabilities);
        return this;
    }

    public OrchestratorConfig withMaxConcurrentTasksPerWorker(int max) {
        this.maxConcurrentTasksPerWorker = max;
        return this;
    }

    public OrchestratorConfig withShardCount(int shardCount) {
        this.shardCount = shardCount;
        return this;
    }

    public OrchestratorConfig withStaleHeartbeatThreshold(Duration threshold) {
        this.staleHeartbeatThreshold = threshold;
        return this;
    }

    public OrchestratorConfig withHeartbeatInterval(Duration interval) {
        this.heartbeatInterval = interval;
        return this;
    }

    public OrchestratorConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public OrchestratorConfig withMaxBackoff(Duration backoff) {
        this.maxBackoff = backoff;
        return this;
    }

    public OrchestratorConfig withAntiStarvationBackoff(Duration backoff) {
        this.antiStarvationBackoff = backoff;
        return this;
    }

    public OrchestratorConfig withMaxRetriesPerTask(int maxRetries) {
        this.maxRetriesPerTask = maxRetries;
        return this;
    }

    public OrchestratorConfig withMinApprovals(int minApprovals) {
        this.minApprovals = minApprovals;
        return this;
    }

    public OrchestratorConfig withUnanimousTaskTypes(Set<TaskType> types) {
        this.unanimousTaskTypes = types.isEmpty() ? EnumSet.noneOf(TaskType.class) : EnumSet.copyOf(types);
        return this;
    }

    public OrchestratorConfig withBreakerFailureThreshold(int threshold) {
        this.breakerFailureThreshold = threshold;
        return this;
    }

    public OrchestratorConfig withBreakerCooldown(Duration cooldown) {
        this.breakerCooldown = cooldown;
        return this;
    }

    public OrchestratorConfig withBudgetRateLimit(BigDecimal limit) {
        this.budgetRateLimit = limit;
        return this;
    }

    public OrchestratorConfig withBudgetDailyLimit(BigDecimal limit) {
        this.budgetDailyLimit = limit;
        return this;
    }

    public OrchestratorConfig withBudgetKillGrace(Duration grace) {
        this.budgetKillGrace = grace;
        return this;
    }

    public OrchestratorConfig withExecutorTimeout(Duration timeout) {
        this.executorTimeout = timeout;
        return this;
    }

    public OrchestratorConfig withExecutorCommand(String capability, String command) {
        this.executorCommands.put(capability, command);
        return this;
    }

    public OrchestratorConfig withWorker(String workerId, String shard, String model) {
        this.workerId = workerId;
        this.workerShard = shard;
        this.workerModel = model;
        return this;
    }

    private static String string(Profile.Section section, String key, String fallback) {
        String value = section.fetch(key);
        return value != null && !value.isBlank() ? value.trim() : fallback;
    }

    private static int integer(Profile.Section section, String key, int fallback) {
        String value = section.fetch(key);
        return value != null && !value.isBlank() ? Integer.parseInt(value.trim()) : fallback;
    }

    private static Duration seconds(Profile.Section section, String key, Duration fallback) {
        String value = section.fetch(key);
        return value != null && !value.isBlank() ? Duration.ofSeconds(Long.parseLong(value.trim())) : fallback;
    }

    private static BigDecimal decimal(Profile.Section section, String key, BigDecimal fallback) {
        String value = section.fetch(key);
        return value != null && !value.isBlank() ? new BigDecimal(value.trim()) : fallback;
    }

    private static List<String> splitList(String raw) {
        List<String> out = new ArrayList<>();
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                out.add(part.trim());
            }
        }
        return List.copyOf(out);
    }

    private static Set<TaskType> parseTypes(String raw) {
        Set<TaskType> types = EnumSet.noneOf(TaskType.class);
        Arrays.stream(raw.split(","))
                .filter(s -> !s.isBlank())
                .map(TaskType::parse)
                .forEach(types::add);
        return types;
    }

    @Override
    public String toString() {
        return "OrchestratorConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", capabilities=" + capabilities +
                ", maxConcurrent=" + maxConcurrentTasksPerWorker +
                ", shardCount=" + shardCount +
                ", maxRetries=" + maxRetriesPerTask +
                ", minApprovals=" + minApprovals +
                ", agentKeySet=" + hasAgentKey() +
                '}';
    }
}
