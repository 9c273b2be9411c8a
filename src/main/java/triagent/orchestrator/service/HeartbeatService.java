package triagent.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.config.OrchestratorConfig;
import triagent.orchestrator.model.AuditEvent;
import triagent.orchestrator.model.EventType;
import triagent.orchestrator.model.HeartbeatRecord;
import triagent.orchestrator.model.RecoveryReason;
import triagent.orchestrator.model.RecoveryReport;
import triagent.orchestrator.model.Task;
import triagent.orchestrator.model.Worker;
import triagent.orchestrator.model.WorkerStatus;
import triagent.orchestrator.repository.AuditRepository;
import triagent.orchestrator.repository.TaskRepository;
import triagent.orchestrator.repository.WorkerRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Heartbeat monitor and crash recovery.
 *
 * A busy worker is stale once its last heartbeat is older than
 * {@code max(staleHeartbeatThreshold, expectedTimeout * 1.5)}. Recovery requeues
 * its RUNNING tasks without penalty and marks it dead or crashed. A RUNNING task whose
 * own heartbeat went stale is requeued too, even if its owner is still heartbeating.
 * Every step is a conditional update, so running recovery twice changes nothing the
 * second time.
 */
public class HeartbeatService {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatService.class);

    private final WorkerRepository workerRepository;
    private final TaskRepository taskRepository;
    private final AuditRepository auditRepository;
    private final ProcessProbe processProbe;
    private final OrchestratorConfig config;
    private final Clock clock;

    public HeartbeatService(WorkerRepository workerRepository, TaskRepository taskRepository,
            AuditRepository auditRepository, ProcessProbe processProbe, OrchestratorConfig config, Clock clock) {
        this.workerRepository = workerRepository;
        this.taskRepository = taskRepository;
        this.auditRepository = auditRepository;
        this.processProbe = processProbe;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Record a heartbeat.
     *
     * @param taskId          task in progress, or null
     * @param progress        0..1
     * @param expectedTimeout how long the current step may take, or null
     * @return false if the worker is unknown
     */
    public boolean heartbeat(String workerId, String taskId, double progress, Duration expectedTimeout) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (progress < 0 || progress > 1) {
            throw new IllegalArgumentException("progress must be between 0 and 1");
        }

        Instant now = clock.instant();
        boolean known = workerRepository.heartbeat(new HeartbeatRecord(workerId, now, taskId, progress,
                expectedTimeout));
        if (!known) {
            log.warn("Heartbeat from unknown worker {}", workerId);
            return false;
        }
        if (taskId != null) {
            taskRepository.touchHeartbeat(taskId, workerId, now);
        }
        log.debug("Heartbeat from {} (task={}, progress={})", workerId, taskId, progress);
        return true;
    }

    /**
     * Staleness threshold for one worker, stretched by the expected timeout it reported.
     */
    public Duration effectiveThreshold(Optional<HeartbeatRecord> heartbeat) {
        Duration base = config.staleHeartbeatThreshold();
        Duration expected = heartbeat.map(HeartbeatRecord::expectedTimeout).orElse(null);
        if (expected == null) {
            return base;
        }
        Duration stretched = Duration.ofMillis(expected.toMillis() * 3 / 2);
        return stretched.compareTo(base) > 0 ? stretched : base;
    }

    public boolean isStale(Worker worker, Instant now) {
        if (worker.status() != WorkerStatus.BUSY) {
            return false;
        }
        Instant last = worker.lastHeartbeat() != null ? worker.lastHeartbeat() : worker.registeredAt();
        if (last == null) {
            return true;
        }
        Duration threshold = effectiveThreshold(workerRepository.findHeartbeat(worker.id()));
        return Duration.between(last, now).compareTo(threshold) > 0;
    }

    /**
     * One recovery pass over every busy worker, then over silent RUNNING tasks.
     */
    public RecoveryReport recoverStaleWorkers() {
        Instant now = clock.instant();
        RecoveryReport report = RecoveryReport.EMPTY;

        for (Worker worker : workerRepository.findByStatus(WorkerStatus.BUSY)) {
            if (!isStale(worker, now)) {
                continue;
            }
            // Only a process verifiably gone is dead; a hung or unverifiable one counts as a crash.
            RecoveryReason reason = processProbe.liveness(worker) == ProcessProbe.Liveness.GONE
                    ? RecoveryReason.WORKER_DEAD
                    : RecoveryReason.WORKER_CRASHED;
            report = report.plus(recoverWorker(worker.id(), reason));
        }
        report = report.plus(new RecoveryReport(0, recoverSilentTasks(now)));

        if (!report.isEmpty()) {
            log.info("Recovery pass: {} worker(s) recovered, {} task(s) requeued",
                    report.workersRecovered(), report.tasksRequeued());
        } else {
            log.debug("Recovery pass: nothing stale");
        }
        return report;
    }

    /**
     * Take back a busy worker's tasks and mark it dead or crashed.
     */
    public RecoveryReport recoverWorker(String workerId, RecoveryReason reason) {
        int requeued = requeueTasks(workerId, reason);

        WorkerStatus target = reason == RecoveryReason.WORKER_CRASHED ? WorkerStatus.CRASHED : WorkerStatus.DEAD;
        boolean marked = workerRepository.markRecovered(workerId, target);
        if (marked) {
            auditRepository.record(AuditEvent.of(EventType.WORKER_STATUS, null, workerId, "recovery",
                    "busy -> " + target.dbValue() + " (" + reason + ")"));
            log.warn("Worker {} marked {} ({}), {} task(s) requeued", workerId, target.dbValue(), reason, requeued);
        }
        return new RecoveryReport(marked ? 1 : 0, requeued);
    }

    /**
     * Requeue RUNNING tasks whose heartbeat is older than their owner's threshold, retry
     * count unchanged, and settle owners left with nothing running.
     *
     * @return number of tasks requeued
     */
    public int recoverSilentTasks(Instant now) {
        int requeued = 0;
        for (Task task : taskRepository.findSilentRunning(now.minus(config.staleHeartbeatThreshold()))) {
            String owner = task.workerId();
            Instant last = task.heartbeatAt() != null ? task.heartbeatAt() : task.startedAt();
            Duration threshold = effectiveThreshold(workerRepository.findHeartbeat(owner));
            if (last != null && Duration.between(last, now).compareTo(threshold) <= 0) {
                continue;
            }
            if (taskRepository.release(task.id(), owner)) {
                requeued++;
                auditRepository.record(AuditEvent.of(EventType.TASK_RECOVERED, task.id(), owner, "recovery",
                        RecoveryReason.TASK_SILENT.name()).withTraceId(task.traceId()));
                log.warn("Task {} silent since {}, requeued from {}", task.id(), last, owner);
                if (taskRepository.countRunningByWorker(owner) == 0) {
                    workerRepository.updateStatus(owner, WorkerStatus.BUSY, WorkerStatus.IDLE);
                }
            }
        }
        return requeued;
    }

    /**
     * Requeue every RUNNING task of a worker with retry_count unchanged.
     *
     * @return number of tasks this call requeued
     */
    public int requeueTasks(String workerId, RecoveryReason reason) {
        int requeued = 0;
        for (Task task : taskRepository.findRunningByWorker(workerId)) {
            if (taskRepository.release(task.id(), workerId)) {
                requeued++;
                auditRepository.record(AuditEvent.of(EventType.TASK_RECOVERED, task.id(), workerId, "recovery",
                        reason.name()).withTraceId(task.traceId()));
                log.info("Task {} requeued from {} ({})", task.id(), workerId, reason);
            }
        }
        return requeued;
    }
}
