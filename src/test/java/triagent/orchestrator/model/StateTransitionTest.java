package triagent.orchestrator.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StateTransitionTest {

    @Test
    void taskHappyPath() {
        assertTrue(TaskState.QUEUED.canTransitionTo(TaskState.RUNNING));
        assertTrue(TaskState.RUNNING.canTransitionTo(TaskState.REVIEW));
        assertTrue(TaskState.REVIEW.canTransitionTo(TaskState.APPROVED));
        assertTrue(TaskState.APPROVED.canTransitionTo(TaskState.COMPLETED));
    }

    @Test
    void taskRetryEdges() {
        assertTrue(TaskState.RUNNING.canTransitionTo(TaskState.QUEUED));
        assertTrue(TaskState.REJECTED.canTransitionTo(TaskState.QUEUED));
        assertTrue(TaskState.REJECTED.canTransitionTo(TaskState.ESCALATED));
        assertFalse(TaskState.REVIEW.canTransitionTo(TaskState.QUEUED));
        assertFalse(TaskState.QUEUED.canTransitionTo(TaskState.COMPLETED));
    }

    @Test
    void terminalTaskStatesGoNowhere() {
        for (TaskState terminal : new TaskState[] { TaskState.COMPLETED, TaskState.FAILED, TaskState.ESCALATED }) {
            assertTrue(terminal.isTerminal());
            for (TaskState next : TaskState.values()) {
                assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
            }
        }
    }

    @Test
    void workerEdges() {
        assertTrue(WorkerStatus.STARTING.canTransitionTo(WorkerStatus.IDLE));
        assertTrue(WorkerStatus.STARTING.canTransitionTo(WorkerStatus.CRASHED));
        assertFalse(WorkerStatus.STARTING.canTransitionTo(WorkerStatus.DEAD));
        assertFalse(WorkerStatus.STARTING.canTransitionTo(WorkerStatus.BUSY));
        assertTrue(WorkerStatus.DEAD.canTransitionTo(WorkerStatus.STARTING));
        assertFalse(WorkerStatus.DEAD.canTransitionTo(WorkerStatus.IDLE));
        assertTrue(WorkerStatus.BUSY.canTransitionTo(WorkerStatus.BUSY));
    }

    @Test
    void workerStatusStoredLowercase() {
        assertEquals("crashed", WorkerStatus.CRASHED.dbValue());
        assertEquals(WorkerStatus.PAUSED, WorkerStatus.fromDb("paused"));
    }

    @Test
    void retryBudget() {
        Task fresh = Task.builder().id("t").maxRetries(3).retryCount(2).build();
        Task spent = fresh.toBuilder().retryCount(3).build();

        assertTrue(fresh.canRetry());
        assertFalse(spent.canRetry());
    }
}
