package triagent.orchestrator.repository;

import triagent.orchestrator.model.HeartbeatRecord;
import triagent.orchestrator.model.Worker;
import triagent.orchestrator.model.WorkerStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for worker rows and heartbeats.
 * Status changes pass through the store trigger; an edge it rejects
 * surfaces as {@link triagent.orchestrator.error.InvalidTransitionException}.
 */
public interface WorkerRepository {

    /**
     * Insert a new worker as starting, or refresh attributes of an existing one.
     * A dead or crashed worker is moved back to starting.
     *
     * @param worker registration data
     * @param now    registration timestamp
     * @return the stored worker
     */
    Worker register(Worker worker, Instant now);

    /**
     * Find a worker by ID.
     */
    Optional<Worker> findById(String workerId);

    /**
     * Find all workers ordered by id.
     */
    List<Worker> findAll();

    /**
     * Find workers in a status.
     */
    List<Worker> findByStatus(WorkerStatus status);

    /**
     * Change status.
     *
     * @param workerId the worker ID
     * @param expected required current status, or null for any
     * @param next     target status
     * @return true if the row changed, false if the current status did not match
     */
    boolean updateStatus(String workerId, WorkerStatus expected, WorkerStatus next);

    /**
     * Mark a busy worker dead or crashed. Only acts while status is still busy,
     * so a second recovery pass is a no-op. Crashes increment crash_count.
     *
     * @return true if this call changed the row
     */
    boolean markRecovered(String workerId, WorkerStatus next);

    /**
     * Upsert the heartbeat row and bump last_heartbeat.
     *
     * @return true if the worker exists
     */
    boolean heartbeat(HeartbeatRecord heartbeat);

    /**
     * Find the latest heartbeat of a worker.
     */
    Optional<HeartbeatRecord> findHeartbeat(String workerId);

    /**
     * Set or clear the pause flag on one worker.
     *
     * @return true if the worker exists
     */
    boolean setPauseRequested(String workerId, boolean paused);

    /**
     * Set or clear the pause flag on every worker that is not dead or crashed.
     *
     * @return number of workers updated
     */
    int setPauseRequestedAll(boolean paused);

    /**
     * Set the pause flag on every live worker that has none, tagging it as set by a pool halt.
     * Flags an operator set beforehand stay untagged.
     *
     * @return number of workers newly paused
     */
    int pauseAllForHalt();

    /**
     * Clear the pause flag only where a pool halt set it.
     *
     * @return number of workers resumed
     */
    int resumeHaltPaused();

    /**
     * Increment tasks_completed or tasks_failed.
     */
    void incrementStats(String workerId, boolean completed);

    /**
     * Count workers in a status.
     */
    int countByStatus(WorkerStatus status);
}
