package triagent.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.config.OrchestratorConfig;
import triagent.orchestrator.error.BudgetExceededException;
import triagent.orchestrator.error.InvalidTransitionException;
import triagent.orchestrator.model.AuditEvent;
import triagent.orchestrator.model.ClaimFilter;
import triagent.orchestrator.model.EventType;
import triagent.orchestrator.model.KillSwitchStatus;
import triagent.orchestrator.model.Task;
import triagent.orchestrator.model.Worker;
import triagent.orchestrator.model.WorkerStatus;
import triagent.orchestrator.repository.AuditRepository;
import triagent.orchestrator.repository.BudgetRepository;
import triagent.orchestrator.repository.TaskRepository;
import triagent.orchestrator.repository.WorkerRepository;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Worker pool manager: registration, status transitions, pause control and
 * claiming on behalf of a worker.
 */
public class WorkerPoolService {

    private static final Logger log = LoggerFactory.getLogger(WorkerPoolService.class);

    private final WorkerRepository workerRepository;
    private final TaskRepository taskRepository;
    private final BudgetRepository budgetRepository;
    private final AuditRepository auditRepository;
    private final TaskService taskService;
    private final OrchestratorConfig config;
    private final Clock clock;

    public WorkerPoolService(WorkerRepository workerRepository, TaskRepository taskRepository,
            BudgetRepository budgetRepository, AuditRepository auditRepository, TaskService taskService,
            OrchestratorConfig config, Clock clock) {
        this.workerRepository = workerRepository;
        this.taskRepository = taskRepository;
        this.budgetRepository = budgetRepository;
        this.auditRepository = auditRepository;
        this.taskService = taskService;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Register a worker, or refresh it when it already exists.
     * New and previously dead or crashed workers come back as starting.
     */
    public Worker register(Worker registration) {
        if (registration.id().isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }

        Worker stored = workerRepository.register(registration, clock.instant());
        auditRepository.record(AuditEvent.of(EventType.WORKER_REGISTERED, null, stored.id(), stored.id(),
                "pid=" + stored.pid() + " shard=" + stored.shard() + " model=" + stored.model()));
        return stored;
    }

    /**
     * starting to idle.
     */
    public void markReady(String workerId) {
        Worker worker = require(workerId);
        if (worker.status() == WorkerStatus.IDLE) {
            return;
        }
        transition(workerId, WorkerStatus.STARTING, WorkerStatus.IDLE);
    }

    /**
     * Claim the next task for a worker using its shard, model and specialization filters.
     *
     * @return the claimed task, or empty when paused, at the concurrency cap or nothing matches
     * @throws BudgetExceededException while the kill switch is active
     */
    public Optional<Task> claimForWorker(String workerId) {
        KillSwitchStatus killSwitch = budgetRepository.killSwitch();
        if (killSwitch.active()) {
            throw new BudgetExceededException(killSwitch.reason());
        }

        Worker worker = require(workerId);
        if (!worker.isLive()) {
            log.warn("Worker {} is {} and cannot claim", workerId, worker.status());
            return Optional.empty();
        }
        if (worker.pauseRequested()) {
            log.debug("Worker {} has a pause request, not claiming", workerId);
            return Optional.empty();
        }

        int running = taskRepository.countRunningByWorker(workerId);
        if (running >= config.maxConcurrentTasksPerWorker()) {
            log.debug("Worker {} at concurrency cap ({}/{})", workerId, running,
                    config.maxConcurrentTasksPerWorker());
            return Optional.empty();
        }

        if (worker.status() == WorkerStatus.STARTING || worker.status() == WorkerStatus.PAUSED) {
            transition(workerId, worker.status(), WorkerStatus.IDLE);
        }

        Optional<Task> claimed = taskService.claim(workerId, ClaimFilter.forWorker(worker));
        if (claimed.isPresent()) {
            try {
                workerRepository.updateStatus(workerId, null, WorkerStatus.BUSY);
            } catch (InvalidTransitionException e) {
                // Worker was recovered meanwhile; it must not keep the task.
                taskService.release(claimed.get().id(), workerId);
                throw e;
            }
        }
        return claimed;
    }

    /**
     * Whether the worker has reached the per-worker cap of RUNNING tasks.
     */
    public boolean atCapacity(String workerId) {
        return taskRepository.countRunningByWorker(workerId) >= config.maxConcurrentTasksPerWorker();
    }

    /**
     * Release a task and settle the worker status.
     */
    public boolean release(String taskId, String workerId) {
        boolean released = taskService.release(taskId, workerId);
        settle(workerId);
        return released;
    }

    /**
     * busy to idle once the worker owns no RUNNING task.
     */
    public void settle(String workerId) {
        if (taskRepository.countRunningByWorker(workerId) == 0) {
            workerRepository.updateStatus(workerId, WorkerStatus.BUSY, WorkerStatus.IDLE);
        }
    }

    /**
     * Worker observed its pause flag with no task in hand.
     */
    public void enterPause(String workerId) {
        Worker worker = require(workerId);
        if (worker.status() == WorkerStatus.PAUSED) {
            return;
        }
        if (worker.status() == WorkerStatus.STARTING) {
            transition(workerId, WorkerStatus.STARTING, WorkerStatus.IDLE);
        }
        transition(workerId, null, WorkerStatus.PAUSED);
        log.info("Worker {} paused", workerId);
    }

    /**
     * paused to idle.
     */
    public void leavePause(String workerId) {
        if (workerRepository.updateStatus(workerId, WorkerStatus.PAUSED, WorkerStatus.IDLE)) {
            log.info("Worker {} resumed", workerId);
        }
    }

    /**
     * Graceful stop: release owned tasks, then stopping to dead.
     *
     * @return number of tasks released
     */
    public int stop(String workerId) {
        Worker worker = require(workerId);
        if (worker.status().isGone()) {
            return 0;
        }

        transition(workerId, null, WorkerStatus.STOPPING);
        int released = 0;
        for (Task task : taskRepository.findRunningByWorker(workerId)) {
            if (taskService.release(task.id(), workerId)) {
                released++;
            }
        }
        transition(workerId, WorkerStatus.STOPPING, WorkerStatus.DEAD);
        log.info("Worker {} stopped, released {} task(s)", workerId, released);
        return released;
    }

    public boolean requestPause(String workerId) {
        return setPause(workerId, true);
    }

    public boolean requestResume(String workerId) {
        return setPause(workerId, false);
    }

    public int requestPauseAll() {
        int count = workerRepository.setPauseRequestedAll(true);
        log.info("Pause requested for {} worker(s)", count);
        return count;
    }

    public int requestResumeAll() {
        int count = workerRepository.setPauseRequestedAll(false);
        log.info("Resume requested for {} worker(s)", count);
        return count;
    }

    /**
     * Pause request from a pool halt; operator pauses already in place are left as they are.
     */
    public int pauseAllForHalt() {
        int count = workerRepository.pauseAllForHalt();
        log.info("Pause requested for {} worker(s) by halt", count);
        return count;
    }

    /**
     * Lift only the pause requests a halt set.
     */
    public int resumeHaltPaused() {
        int count = workerRepository.resumeHaltPaused();
        log.info("Resume requested for {} halted worker(s)", count);
        return count;
    }

    public boolean isPauseRequested(String workerId) {
        return workerRepository.findById(workerId).map(Worker::pauseRequested).orElse(false);
    }

    /**
     * Count a finished execution against the worker.
     */
    public void recordOutcome(String workerId, boolean completed) {
        workerRepository.incrementStats(workerId, completed);
    }

    /**
     * Conditional status change. A rejected edge is logged and rethrown.
     *
     * @param expected required current status, or null for any
     * @return true if the row changed
     */
    public boolean transition(String workerId, WorkerStatus expected, WorkerStatus next) {
        try {
            boolean changed = workerRepository.updateStatus(workerId, expected, next);
            if (changed) {
                auditRepository.record(AuditEvent.of(EventType.WORKER_STATUS, null, workerId, workerId,
                        (expected != null ? expected.dbValue() : "*") + " -> " + next.dbValue()));
            }
            return changed;
        } catch (InvalidTransitionException e) {
            log.warn("Worker {} transition to {} rejected: {}", workerId, next, e.getMessage());
            throw e;
        }
    }

    public Optional<Worker> findById(String workerId) {
        return workerRepository.findById(workerId);
    }

    public List<Worker> findAll() {
        return workerRepository.findAll();
    }

    public int countByStatus(WorkerStatus status) {
        return workerRepository.countByStatus(status);
    }

    private boolean setPause(String workerId, boolean paused) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        boolean found = workerRepository.setPauseRequested(workerId, paused);
        if (found) {
            log.info("{} requested for worker {}", paused ? "Pause" : "Resume", workerId);
        }
        return found;
    }

    private Worker require(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        return workerRepository.findById(workerId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown worker: " + workerId));
    }
}
