package triagent.orchestrator.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import triagent.orchestrator.model.TaskType;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorConfigTest {

    @Test
    void defaults() {
        OrchestratorConfig config = OrchestratorConfig.defaults();

        assertEquals(List.of("claude", "codex", "gemini"), config.capabilities());
        assertEquals(3, config.maxRetriesPerTask());
        assertEquals(2, config.minApprovals());
        assertEquals(EnumSet.of(TaskType.SECURITY), config.unanimousTaskTypes());
        assertEquals(Duration.ofMinutes(5), config.staleHeartbeatThreshold());
        assertEquals(3, config.breakerFailureThreshold());
        assertEquals(0, new BigDecimal("50.00").compareTo(config.budgetDailyLimit()));
        assertFalse(config.hasAgentKey());
    }

    @Test
    void loadsIniSections(@TempDir Path dir) throws Exception {
        Path ini = dir.resolve("triagent.ini");
        Files.writeString(ini, """
                [database]
                url = jdbc:h2:mem:ini-test
                pool_size = 4

                [server]
                port = 9090
                agent_key = s3cret

                [pool]
                capabilities = claude, codex, gemini, mistral
                max_concurrent_tasks_per_worker = 2
                shard_count = 5
                stale_heartbeat_threshold_seconds = 120

                [consensus]
                min_approvals = 3
                unanimous_task_types = security, review

                [breaker]
                failure_threshold = 5
                cooldown_seconds = 30

                [budget]
                rate_limit_per_minute = 2.5
                daily_limit = 75

                [executor]
                timeout_seconds = 90
                command.claude = claude -p
                command.codex = codex exec
                """);

        OrchestratorConfig config = OrchestratorConfig.fromIni(ini);

        assertEquals(4, config.databasePoolSize());
        assertEquals(9090, config.serverPort());
        assertTrue(config.hasAgentKey());
        assertEquals(List.of("claude", "codex", "gemini", "mistral"), config.capabilities());
        assertEquals(2, config.maxConcurrentTasksPerWorker());
        assertEquals(5, config.shardCount());
        assertEquals(Duration.ofMinutes(2), config.staleHeartbeatThreshold());
        assertEquals(3, config.minApprovals());
        assertEquals(EnumSet.of(TaskType.SECURITY, TaskType.REVIEW), config.unanimousTaskTypes());
        assertEquals(5, config.breakerFailureThreshold());
        assertEquals(Duration.ofSeconds(30), config.breakerCooldown());
        assertEquals(0, new BigDecimal("2.5").compareTo(config.budgetRateLimit()));
        assertEquals(0, new BigDecimal("75").compareTo(config.budgetDailyLimit()));
        assertEquals(Duration.ofSeconds(90), config.executorTimeout());
        assertEquals("claude -p", config.executorCommands().get("claude"));
        assertEquals("codex exec", config.executorCommands().get("codex"));
    }

    @Test
    void missingSectionsKeepDefaults(@TempDir Path dir) throws Exception {
        Path ini = dir.resolve("empty.ini");
        Files.writeString(ini, "[server]\nport = 8181\n");

        OrchestratorConfig config = OrchestratorConfig.fromIni(ini);

        assertEquals(8181, config.serverPort());
        assertEquals(3, config.shardCount());
        assertEquals(Duration.ofSeconds(60), config.breakerCooldown());
    }

    @Test
    void environmentOverrides() {
        OrchestratorConfig config = OrchestratorConfig.defaults().applyEnv(Map.of(
                "TRIAGENT_PORT", "7070",
                "TRIAGENT_CAPABILITIES", "claude,gemini",
                "TRIAGENT_MAX_RETRIES", "1",
                "TRIAGENT_WORKER_ID", "w-env",
                "TRIAGENT_WORKER_SPECIALIZATION", "implementation"));

        assertEquals(7070, config.serverPort());
        assertEquals(List.of("claude", "gemini"), config.capabilities());
        assertEquals(1, config.maxRetriesPerTask());
        assertEquals("w-env", config.workerId());
        assertEquals(EnumSet.of(TaskType.IMPLEMENTATION), config.workerSpecialization());
    }

    @Test
    void unknownTaskTypeInIniFails(@TempDir Path dir) throws Exception {
        Path ini = dir.resolve("bad.ini");
        Files.writeString(ini, "[consensus]\nunanimous_task_types = baking\n");

        assertThrows(IllegalArgumentException.class, () -> OrchestratorConfig.fromIni(ini));
    }
}
