package triagent.orchestrator.repository;

import triagent.orchestrator.model.ClaimFilter;
import triagent.orchestrator.model.Task;
import triagent.orchestrator.model.TaskState;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for Task persistence.
 * Every mutation is a single conditional update on the expected current state,
 * so concurrent callers in different processes can never both win.
 */
public interface TaskRepository {

    /**
     * Insert a QUEUED task unless a task with the same id already exists.
     *
     * @param task the task to insert
     * @return true if inserted, false if it already existed
     */
    boolean insertIfAbsent(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * Find tasks by state in claim order.
     *
     * @param state the state to filter by
     * @param limit maximum number of results
     * @return list of tasks
     */
    List<Task> findByState(TaskState state, int limit);

    /**
     * Find RUNNING tasks owned by a worker.
     *
     * @param workerId the worker ID
     * @return list of tasks
     */
    List<Task> findRunningByWorker(String workerId);

    /**
     * Find RUNNING tasks whose last heartbeat (or start, if none) is older than the cutoff.
     *
     * @param cutoff heartbeat instant before which a task counts as silent
     * @return oldest first
     */
    List<Task> findSilentRunning(Instant cutoff);

    /**
     * Count RUNNING tasks owned by a worker.
     *
     * @param workerId the worker ID
     * @return count
     */
    int countRunningByWorker(String workerId);

    /**
     * Find QUEUED tasks matching the filter, highest priority first, oldest first on ties.
     *
     * @param filter shard/model/type filter
     * @param limit  maximum number of candidates
     * @return candidates in claim order
     */
    List<Task> findClaimCandidates(ClaimFilter filter, int limit);

    /**
     * Atomically claim one task: QUEUED to RUNNING with the given owner.
     *
     * @param taskId   the task to claim
     * @param workerId the claiming worker
     * @param now      claim timestamp
     * @return true if this call won the task, false on a lost race
     */
    boolean tryClaim(String taskId, String workerId, Instant now);

    /**
     * Move a RUNNING task back to QUEUED without touching its retry count.
     * Used for graceful release and crash recovery.
     *
     * @param taskId   the task ID
     * @param workerId the owner that must still hold the task
     * @return true if released, false if it was no longer RUNNING under that worker
     */
    boolean release(String taskId, String workerId);

    /**
     * RUNNING to REVIEW with the executor result; clears ownership.
     *
     * @param taskId   the task ID
     * @param workerId the owner that must still hold the task
     * @param result   executor output
     * @return true if moved
     */
    boolean submitForReview(String taskId, String workerId, String result);

    /**
     * Requeue for another attempt with {@code retry_count + 1}.
     *
     * @param taskId        the task ID
     * @param from          RUNNING or REJECTED
     * @param expectedOwner required owner when {@code from} is RUNNING, else null
     * @param feedback      structured feedback for the next attempt, or null to keep the old one
     * @param error         last error, or null to keep the old one
     * @return true if requeued
     */
    boolean requeueForRetry(String taskId, TaskState from, String expectedOwner, String feedback, String error);

    /**
     * Conditional state change that clears ownership.
     *
     * @param taskId        the task ID
     * @param from          expected current state
     * @param to            target state
     * @param expectedOwner required owner, or null for any
     * @param error         error text to store, or null to keep the old one
     * @param now           timestamp stored as completed_at for terminal targets
     * @return true if moved, false if the task was not in {@code from}
     */
    boolean transition(String taskId, TaskState from, TaskState to, String expectedOwner, String error, Instant now);

    /**
     * Refresh heartbeat_at for a RUNNING task.
     *
     * @return true if updated
     */
    boolean touchHeartbeat(String taskId, String workerId, Instant now);

    /**
     * Count tasks in a state.
     */
    int countByState(TaskState state);

    /**
     * Count QUEUED tasks per shard; unsharded tasks are reported under "none".
     */
    Map<String, Integer> countQueuedByShard();
}
