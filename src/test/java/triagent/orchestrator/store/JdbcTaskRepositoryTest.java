package triagent.orchestrator.store;

import org.junit.jupiter.api.*;
import triagent.orchestrator.error.InvalidTransitionException;
import triagent.orchestrator.model.ClaimFilter;
import triagent.orchestrator.model.Priority;
import triagent.orchestrator.model.Task;
import triagent.orchestrator.model.TaskState;
import triagent.orchestrator.model.TaskType;
import triagent.orchestrator.support.TestStores;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTaskRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private static Database db;
    private static JdbcTaskRepository repo;

    @BeforeAll
    static void setup() {
        db = new Database(TestStores.config("test-tasks"));
        repo = new JdbcTaskRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTasks() throws Exception {
        TestStores.clean(db);
    }

    private static Task task(String id, Priority priority, Instant createdAt) {
        return Task.builder()
                .id(id)
                .name(id)
                .type(TaskType.IMPLEMENTATION)
                .priority(priority)
                .shard("shard-0")
                .assignedModel("codex")
                .lane("impl")
                .payload("{\"n\":1}")
                .createdAt(createdAt)
                .build();
    }

    @Test
    void insertAndFindById() {
        assertTrue(repo.insertIfAbsent(task("task-1", Priority.HIGH, T0)));

        Optional<Task> found = repo.findById("task-1");
        assertTrue(found.isPresent());
        assertEquals(TaskState.QUEUED, found.get().state());
        assertEquals(Priority.HIGH, found.get().priority());
        assertEquals("codex", found.get().assignedModel());
        assertEquals("shard-0", found.get().shard());
        assertEquals(0, found.get().retryCount());
    }

    @Test
    void insertIfAbsentIsIdempotent() {
        assertTrue(repo.insertIfAbsent(task("dup", Priority.LOW, T0)));
        assertFalse(repo.insertIfAbsent(task("dup", Priority.CRITICAL, T0)));

        assertEquals(Priority.LOW, repo.findById("dup").orElseThrow().priority());
    }

    @Test
    void candidatesOrderedByPriorityThenAge() {
        repo.insertIfAbsent(task("low-old", Priority.LOW, T0));
        repo.insertIfAbsent(task("high-new", Priority.HIGH, T0.plusSeconds(30)));
        repo.insertIfAbsent(task("high-old", Priority.HIGH, T0.plusSeconds(10)));
        repo.insertIfAbsent(task("critical", Priority.CRITICAL, T0.plusSeconds(60)));

        List<Task> candidates = repo.findClaimCandidates(ClaimFilter.any(), 10);

        assertEquals(List.of("critical", "high-old", "high-new", "low-old"),
                candidates.stream().map(Task::id).toList());
    }

    @Test
    void candidatesRespectShardModelAndType() {
        repo.insertIfAbsent(task("a", Priority.MEDIUM, T0));
        repo.insertIfAbsent(task("b", Priority.MEDIUM, T0).toBuilder().shard("shard-1").build());
        repo.insertIfAbsent(task("c", Priority.MEDIUM, T0).toBuilder().assignedModel("gemini").build());
        repo.insertIfAbsent(task("d", Priority.MEDIUM, T0).toBuilder().type(TaskType.SECURITY).build());

        List<Task> found = repo.findClaimCandidates(
                new ClaimFilter("shard-0", "codex", Set.of(TaskType.IMPLEMENTATION)), 10);

        assertEquals(List.of("a"), found.stream().map(Task::id).toList());
    }

    @Test
    void claimIsConditionalOnQueued() {
        repo.insertIfAbsent(task("claim-me", Priority.MEDIUM, T0));

        assertTrue(repo.tryClaim("claim-me", "worker-1", T0));
        assertFalse(repo.tryClaim("claim-me", "worker-2", T0));

        Task claimed = repo.findById("claim-me").orElseThrow();
        assertEquals(TaskState.RUNNING, claimed.state());
        assertEquals("worker-1", claimed.workerId());
        assertEquals(1, repo.countRunningByWorker("worker-1"));
    }

    @Test
    void releaseOnlyByOwnerAndKeepsRetryCount() {
        repo.insertIfAbsent(task("rel", Priority.MEDIUM, T0));
        repo.tryClaim("rel", "worker-1", T0);

        assertFalse(repo.release("rel", "worker-2"));
        assertTrue(repo.release("rel", "worker-1"));

        Task released = repo.findById("rel").orElseThrow();
        assertEquals(TaskState.QUEUED, released.state());
        assertNull(released.workerId());
        assertEquals(0, released.retryCount());
    }

    @Test
    void submitForReviewStoresResultAndClearsOwner() {
        repo.insertIfAbsent(task("sub", Priority.MEDIUM, T0));
        repo.tryClaim("sub", "worker-1", T0);

        assertFalse(repo.submitForReview("sub", "worker-2", "nope"));
        assertTrue(repo.submitForReview("sub", "worker-1", "diff --git"));

        Task reviewed = repo.findById("sub").orElseThrow();
        assertEquals(TaskState.REVIEW, reviewed.state());
        assertEquals("diff --git", reviewed.result());
        assertNull(reviewed.workerId());
    }

    @Test
    void requeueForRetryIncrementsRetryCount() {
        repo.insertIfAbsent(task("retry", Priority.MEDIUM, T0));
        repo.tryClaim("retry", "worker-1", T0);

        assertTrue(repo.requeueForRetry("retry", TaskState.RUNNING, "worker-1", "{\"why\":\"bug\"}", "boom"));

        Task requeued = repo.findById("retry").orElseThrow();
        assertEquals(TaskState.QUEUED, requeued.state());
        assertEquals(1, requeued.retryCount());
        assertEquals("{\"why\":\"bug\"}", requeued.feedback());
    }

    @Test
    void triggerRejectsSkippingStates() {
        repo.insertIfAbsent(task("skip", Priority.MEDIUM, T0));

        assertThrows(InvalidTransitionException.class,
                () -> repo.transition("skip", TaskState.QUEUED, TaskState.COMPLETED, null, null, T0));
        assertEquals(TaskState.QUEUED, repo.findById("skip").orElseThrow().state());
    }

    @Test
    void terminalTasksNeverChange() {
        repo.insertIfAbsent(task("done", Priority.MEDIUM, T0));
        assertTrue(repo.transition("done", TaskState.QUEUED, TaskState.FAILED, null, "operator", T0));

        assertThrows(InvalidTransitionException.class,
                () -> repo.transition("done", TaskState.FAILED, TaskState.QUEUED, null, null, T0));
        assertFalse(repo.tryClaim("done", "worker-1", T0));
        assertEquals(TaskState.FAILED, repo.findById("done").orElseThrow().state());
    }

    @Test
    void countsQueuedPerShard() {
        repo.insertIfAbsent(task("s0-a", Priority.MEDIUM, T0));
        repo.insertIfAbsent(task("s0-b", Priority.MEDIUM, T0));
        repo.insertIfAbsent(task("s1-a", Priority.MEDIUM, T0).toBuilder().shard("shard-1").build());

        assertEquals(2, repo.countQueuedByShard().get("shard-0"));
        assertEquals(1, repo.countQueuedByShard().get("shard-1"));
        assertEquals(3, repo.countByState(TaskState.QUEUED));
    }
}
