package triagent.orchestrator.store;

import org.junit.jupiter.api.*;
import triagent.orchestrator.error.InvalidTransitionException;
import triagent.orchestrator.model.HeartbeatRecord;
import triagent.orchestrator.model.TaskType;
import triagent.orchestrator.model.Worker;
import triagent.orchestrator.model.WorkerStatus;
import triagent.orchestrator.support.TestStores;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class JdbcWorkerRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private static Database db;
    private static JdbcWorkerRepository repo;

    @BeforeAll
    static void setup() {
        db = new Database(TestStores.config("test-workers"));
        repo = new JdbcWorkerRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        TestStores.clean(db);
    }

    private static Worker worker(String id) {
        return Worker.builder()
                .id(id)
                .pid(4242L)
                .shard("shard-1")
                .model("codex")
                .specialization(EnumSet.of(TaskType.IMPLEMENTATION, TaskType.ANALYSIS))
                .build();
    }

    @Test
    void registerStoresWorkerAsStarting() {
        Worker stored = repo.register(worker("w-1"), T0);

        assertEquals(WorkerStatus.STARTING, stored.status());
        Worker found = repo.findById("w-1").orElseThrow();
        assertEquals(4242L, found.pid());
        assertEquals("shard-1", found.shard());
        assertEquals("codex", found.model());
        assertEquals(EnumSet.of(TaskType.IMPLEMENTATION, TaskType.ANALYSIS), found.specialization());
        assertEquals(T0, found.registeredAt());
    }

    @Test
    void startingCannotJumpToDead() {
        repo.register(worker("w-2"), T0);

        InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                () -> repo.updateStatus("w-2", WorkerStatus.STARTING, WorkerStatus.DEAD));
        assertNotNull(e.getMessage());
        assertEquals(WorkerStatus.STARTING, repo.findById("w-2").orElseThrow().status());
    }

    @Test
    void conditionalUpdateReturnsFalseOnMismatch() {
        repo.register(worker("w-3"), T0);

        assertFalse(repo.updateStatus("w-3", WorkerStatus.IDLE, WorkerStatus.BUSY));
        assertTrue(repo.updateStatus("w-3", WorkerStatus.STARTING, WorkerStatus.IDLE));
        assertTrue(repo.updateStatus("w-3", WorkerStatus.IDLE, WorkerStatus.BUSY));
    }

    @Test
    void deadWorkerReRegistersAsStarting() {
        repo.register(worker("w-4"), T0);
        repo.updateStatus("w-4", WorkerStatus.STARTING, WorkerStatus.IDLE);
        repo.updateStatus("w-4", WorkerStatus.IDLE, WorkerStatus.DEAD);

        repo.register(worker("w-4"), T0.plusSeconds(60));

        assertEquals(WorkerStatus.STARTING, repo.findById("w-4").orElseThrow().status());
    }

    @Test
    void markRecoveredOnlyFromBusyAndCountsCrashes() {
        repo.register(worker("w-5"), T0);
        repo.updateStatus("w-5", WorkerStatus.STARTING, WorkerStatus.IDLE);
        repo.updateStatus("w-5", WorkerStatus.IDLE, WorkerStatus.BUSY);

        assertTrue(repo.markRecovered("w-5", WorkerStatus.CRASHED));
        assertFalse(repo.markRecovered("w-5", WorkerStatus.CRASHED));

        Worker found = repo.findById("w-5").orElseThrow();
        assertEquals(WorkerStatus.CRASHED, found.status());
        assertEquals(1, found.crashCount());
    }

    @Test
    void heartbeatUpsertsLatestRecord() {
        repo.register(worker("w-6"), T0);

        assertTrue(repo.heartbeat(new HeartbeatRecord("w-6", T0.plusSeconds(5), null, 0.0, null)));
        assertTrue(repo.heartbeat(new HeartbeatRecord("w-6", T0.plusSeconds(10), "task-1", 0.5,
                Duration.ofMinutes(10))));
        assertFalse(repo.heartbeat(new HeartbeatRecord("nobody", T0, null, 0.0, null)));

        HeartbeatRecord latest = repo.findHeartbeat("w-6").orElseThrow();
        assertEquals("task-1", latest.taskId());
        assertEquals(0.5, latest.progress());
        assertEquals(Duration.ofMinutes(10), latest.expectedTimeout());
        assertEquals(T0.plusSeconds(10), repo.findById("w-6").orElseThrow().lastHeartbeat());
    }

    @Test
    void pauseFlags() {
        repo.register(worker("w-7"), T0);
        repo.register(worker("w-8"), T0);

        assertTrue(repo.setPauseRequested("w-7", true));
        assertTrue(repo.findById("w-7").orElseThrow().pauseRequested());

        assertEquals(2, repo.setPauseRequestedAll(false));
        assertFalse(repo.findById("w-7").orElseThrow().pauseRequested());
    }
}
