package triagent.orchestrator.service;

import org.junit.jupiter.api.*;
import triagent.orchestrator.config.Dependencies;
import triagent.orchestrator.model.Priority;
import triagent.orchestrator.model.SubmitResult;
import triagent.orchestrator.model.Task;
import triagent.orchestrator.model.TaskState;
import triagent.orchestrator.model.TaskType;
import triagent.orchestrator.model.Worker;
import triagent.orchestrator.model.WorkerStatus;
import triagent.orchestrator.support.FakeExecutor;
import triagent.orchestrator.support.FakeProcessProbe;
import triagent.orchestrator.support.MutableClock;
import triagent.orchestrator.support.TestStores;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolServiceTest {

    private Dependencies deps;
    private WorkerPoolService pool;

    @BeforeEach
    void setUp() {
        deps = Dependencies.create(TestStores.config("test-pool").withMaxConcurrentTasksPerWorker(2),
                MutableClock.at("2026-03-01T10:00:00Z"), new FakeProcessProbe(), new FakeExecutor());
        pool = deps.workerPoolService();

        pool.register(Worker.builder().id("w-1").build());
        pool.markReady("w-1");
        for (int i = 1; i <= 4; i++) {
            deps.taskService().ensureTaskExists("t-" + i, null, TaskType.IMPLEMENTATION, Priority.MEDIUM, null,
                    null);
        }
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    @Test
    void claimStopsAtTheCapAndResumesOnceATaskIsReleased() {
        Task first = pool.claimForWorker("w-1").orElseThrow();
        pool.claimForWorker("w-1").orElseThrow();

        assertTrue(pool.atCapacity("w-1"));
        assertTrue(pool.claimForWorker("w-1").isEmpty());
        assertEquals(2, deps.taskService().countByState(TaskState.QUEUED));

        assertTrue(pool.release(first.id(), "w-1"));

        assertFalse(pool.atCapacity("w-1"));
        assertTrue(pool.claimForWorker("w-1").isPresent());
        assertEquals(WorkerStatus.BUSY, pool.findById("w-1").orElseThrow().status());
    }

    @Test
    void claimResumesOnceATaskMovesToReview() {
        Task first = pool.claimForWorker("w-1").orElseThrow();
        pool.claimForWorker("w-1").orElseThrow();
        assertTrue(pool.claimForWorker("w-1").isEmpty());

        assertEquals(SubmitResult.SUBMITTED,
                deps.lifecycleService().submitForReview(first.id(), "w-1", null, "patch"));

        assertTrue(pool.claimForWorker("w-1").isPresent());
        assertEquals(TaskState.REVIEW, deps.taskService().findById(first.id()).orElseThrow().state());
        assertEquals(1, deps.taskService().countByState(TaskState.QUEUED));
    }

    @Test
    void pausedWorkerDoesNotClaim() {
        pool.requestPause("w-1");

        assertTrue(pool.claimForWorker("w-1").isEmpty());
        assertEquals(4, deps.taskService().countByState(TaskState.QUEUED));
    }

    @Test
    void registrationKeepsProcessIdentity() {
        Instant started = Instant.parse("2026-03-01T09:59:58Z");
        Worker stored = pool.register(Worker.builder().id("w-2").pid(4242L).host("build-3")
                .processStartedAt(started).build());

        assertEquals("build-3", stored.host());
        assertEquals(started, stored.processStartedAt());
        assertEquals(WorkerStatus.STARTING, stored.status());
    }
}
