package triagent.orchestrator.service;

import org.junit.jupiter.api.*;
import triagent.orchestrator.config.Dependencies;
import triagent.orchestrator.model.ClaimFilter;
import triagent.orchestrator.model.EventType;
import triagent.orchestrator.model.Priority;
import triagent.orchestrator.model.Task;
import triagent.orchestrator.model.TaskState;
import triagent.orchestrator.model.TaskType;
import triagent.orchestrator.support.FakeExecutor;
import triagent.orchestrator.support.FakeProcessProbe;
import triagent.orchestrator.support.MutableClock;
import triagent.orchestrator.support.TestStores;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class TaskServiceTest {

    private MutableClock clock;
    private Dependencies deps;
    private TaskService taskService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        deps = Dependencies.create(TestStores.config("test-task-service"), clock, new FakeProcessProbe(),
                new FakeExecutor());
        taskService = deps.taskService();
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    @Test
    void ensureTaskExistsRoutesAndShards() {
        assertTrue(taskService.ensureTaskExists("sec-1", "Audit login", TaskType.SECURITY, Priority.HIGH,
                "check auth", null));

        Task task = taskService.findById("sec-1").orElseThrow();
        assertEquals(TaskState.QUEUED, task.state());
        assertEquals("claude", task.assignedModel());
        assertEquals("review", task.lane());
        assertEquals(new ShardRouter(3).shardFor("sec-1"), task.shard());
        assertEquals(3, task.maxRetries());
        assertNotNull(task.traceId());
        assertEquals(1, deps.auditRepository().countByTaskAndType("sec-1", EventType.TASK_CREATED));
    }

    @Test
    void ensureTaskExistsIsIdempotent() {
        assertTrue(taskService.ensureTaskExists("t-1", "first", TaskType.ANALYSIS, Priority.LOW, "a", null));
        assertFalse(taskService.ensureTaskExists("t-1", "second", TaskType.REVIEW, Priority.CRITICAL, "b", null));

        Task task = taskService.findById("t-1").orElseThrow();
        assertEquals("first", task.name());
        assertEquals(TaskType.ANALYSIS, task.type());
        assertEquals(1, deps.auditRepository().countByTaskAndType("t-1", EventType.TASK_CREATED));
    }

    @Test
    void modelHintOverridesRoute() {
        taskService.ensureTaskExists("t-2", null, TaskType.IMPLEMENTATION, null, "x", "gemini");

        Task task = taskService.findById("t-2").orElseThrow();
        assertEquals("gemini", task.assignedModel());
        assertEquals("t-2", task.name());
        assertEquals(Priority.MEDIUM, task.priority());
    }

    @Test
    void rejectsMissingIdOrType() {
        assertThrows(IllegalArgumentException.class,
                () -> taskService.ensureTaskExists(" ", "n", TaskType.REVIEW, Priority.LOW, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> taskService.ensureTaskExists("t-3", "n", null, Priority.LOW, null, null));
    }

    @Test
    void claimsHighestPriorityFirstThenOldest() {
        taskService.ensureTaskExists("low", null, TaskType.IMPLEMENTATION, Priority.LOW, null, null);
        clock.advance(Duration.ofSeconds(1));
        taskService.ensureTaskExists("high-a", null, TaskType.IMPLEMENTATION, Priority.HIGH, null, null);
        clock.advance(Duration.ofSeconds(1));
        taskService.ensureTaskExists("high-b", null, TaskType.IMPLEMENTATION, Priority.HIGH, null, null);

        List<String> order = new ArrayList<>();
        Optional<Task> next;
        while ((next = taskService.claim("w-1", ClaimFilter.any())).isPresent()) {
            order.add(next.get().id());
        }

        assertEquals(List.of("high-a", "high-b", "low"), order);
    }

    @Test
    void claimedTaskIsRunningUnderWorker() {
        taskService.ensureTaskExists("t-4", null, TaskType.REVIEW, Priority.MEDIUM, null, null);

        Task claimed = taskService.claim("w-1", ClaimFilter.any()).orElseThrow();

        assertEquals(TaskState.RUNNING, claimed.state());
        assertEquals("w-1", claimed.workerId());
        assertEquals(List.of("t-4"), taskService.findRunningByWorker("w-1").stream().map(Task::id).toList());
        assertTrue(taskService.claim("w-2", ClaimFilter.any()).isEmpty());
    }

    @Test
    void concurrentClaimsNeverHandOutATaskTwice() throws Exception {
        int tasks = 30;
        for (int i = 0; i < tasks; i++) {
            taskService.ensureTaskExists("c-" + i, null, TaskType.IMPLEMENTATION, Priority.MEDIUM, null, null);
        }

        int workers = 6;
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        List<String> claimed = Collections.synchronizedList(new ArrayList<>());
        List<Future<?>> futures = new ArrayList<>();
        for (int w = 0; w < workers; w++) {
            String workerId = "w-" + w;
            futures.add(pool.submit(() -> {
                start.await();
                int misses = 0;
                while (misses < 3) {
                    Optional<Task> task = taskService.claim(workerId, ClaimFilter.any());
                    if (task.isPresent()) {
                        claimed.add(task.get().id());
                        misses = 0;
                    } else {
                        misses++;
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get();
        }
        pool.shutdown();

        Set<String> unique = new HashSet<>(claimed);
        assertEquals(claimed.size(), unique.size(), "a task was claimed twice");
        assertEquals(tasks, unique.size());
        assertEquals(tasks, taskService.countByState(TaskState.RUNNING));
    }

    @Test
    void releaseRequeuesWithoutPenalty() {
        taskService.ensureTaskExists("t-5", null, TaskType.IMPLEMENTATION, Priority.MEDIUM, null, null);
        taskService.claim("w-1", ClaimFilter.any());

        assertFalse(taskService.release("t-5", "w-2"));
        assertTrue(taskService.release("t-5", "w-1"));

        Task task = taskService.findById("t-5").orElseThrow();
        assertEquals(TaskState.QUEUED, task.state());
        assertEquals(0, task.retryCount());
        assertEquals(1, deps.auditRepository().countByTaskAndType("t-5", EventType.TASK_RELEASED));
    }

    @Test
    void queuedPerShardCoversEveryShardInUse() {
        for (int i = 0; i < 12; i++) {
            taskService.ensureTaskExists("s-" + i, null, TaskType.ANALYSIS, Priority.LOW, null, null);
        }

        int total = taskService.queuedPerShard().values().stream().mapToInt(Integer::intValue).sum();
        assertEquals(12, total);
        assertTrue(taskService.queuedPerShard().keySet().stream().allMatch(s -> s.startsWith("shard-")));
    }
}
