package triagent.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.config.OrchestratorConfig;
import triagent.orchestrator.model.AuditEvent;
import triagent.orchestrator.model.ClaimFilter;
import triagent.orchestrator.model.EventType;
import triagent.orchestrator.model.Priority;
import triagent.orchestrator.model.Task;
import triagent.orchestrator.model.TaskRoute;
import triagent.orchestrator.model.TaskState;
import triagent.orchestrator.model.TaskType;
import triagent.orchestrator.repository.AuditRepository;
import triagent.orchestrator.repository.TaskRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Service layer for the task queue: idempotent creation, atomic claiming and release.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    /** Candidates fetched per scan. */
    private static final int CLAIM_BATCH = 10;
    /** Scans before giving up when every candidate was taken by someone else. */
    private static final int MAX_RESCANS = 3;

    private final TaskRepository taskRepository;
    private final AuditRepository auditRepository;
    private final TaskRouter taskRouter;
    private final ShardRouter shardRouter;
    private final OrchestratorConfig config;
    private final Clock clock;

    public TaskService(TaskRepository taskRepository, AuditRepository auditRepository, TaskRouter taskRouter,
            ShardRouter shardRouter, OrchestratorConfig config, Clock clock) {
        this.taskRepository = taskRepository;
        this.auditRepository = auditRepository;
        this.taskRouter = taskRouter;
        this.shardRouter = shardRouter;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Insert a QUEUED task unless one with the same id exists.
     * Shard, lane and capability hint come from the routing tables unless given.
     *
     * @param modelHint capability that must execute the task, or null for the routed default
     * @return true if created, false if it already existed
     */
    public boolean ensureTaskExists(String id, String name, TaskType type, Priority priority, String payload,
            String modelHint) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("task id is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("task type is required");
        }

        TaskRoute route = taskRouter.route(type);
        Task task = Task.builder()
                .id(id)
                .name(name != null && !name.isBlank() ? name : id)
                .type(type)
                .priority(priority != null ? priority : Priority.MEDIUM)
                .shard(shardRouter.shardFor(id))
                .assignedModel(modelHint != null && !modelHint.isBlank() ? modelHint : route.capability())
                .lane(route.lane())
                .payload(payload)
                .traceId(UUID.randomUUID().toString())
                .createdAt(clock.instant())
                .maxRetries(config.maxRetriesPerTask())
                .build();

        boolean created = taskRepository.insertIfAbsent(task);
        if (created) {
            auditRepository.record(AuditEvent.of(EventType.TASK_CREATED, id, null, "queue",
                    type + " " + task.priority() + " " + task.shard()).withTraceId(task.traceId()));
            log.info("Task {} queued ({}, {}, {}, lane={})", id, type, task.priority(), task.shard(), task.lane());
        } else {
            log.debug("Task {} already exists", id);
        }
        return created;
    }

    /**
     * Claim the best matching QUEUED task for a worker.
     * Lost races move on to the next candidate; they never surface as errors.
     *
     * @return the claimed task, or empty when nothing matches
     */
    public Optional<Task> claim(String workerId, ClaimFilter filter) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }

        for (int scan = 0; scan < MAX_RESCANS; scan++) {
            List<Task> candidates = taskRepository.findClaimCandidates(filter, CLAIM_BATCH);
            if (candidates.isEmpty()) {
                return Optional.empty();
            }

            for (Task candidate : candidates) {
                Instant now = clock.instant();
                if (taskRepository.tryClaim(candidate.id(), workerId, now)) {
                    auditRepository.record(AuditEvent.of(EventType.TASK_CLAIMED, candidate.id(), workerId,
                            workerId, "priority " + candidate.priority()).withTraceId(candidate.traceId()));
                    log.info("Task {} claimed by {}", candidate.id(), workerId);
                    return Optional.of(candidate.toBuilder()
                            .state(TaskState.RUNNING)
                            .workerId(workerId)
                            .startedAt(now)
                            .heartbeatAt(now)
                            .build());
                }
                log.debug("Claim conflict on task {} for worker {}", candidate.id(), workerId);
            }
        }

        log.debug("Worker {} lost every claim race in {} scans", workerId, MAX_RESCANS);
        return Optional.empty();
    }

    /**
     * Give a RUNNING task back to the queue without penalty.
     *
     * @return true if released
     */
    public boolean release(String taskId, String workerId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }

        boolean released = taskRepository.release(taskId, workerId);
        if (released) {
            auditRepository.record(AuditEvent.of(EventType.TASK_RELEASED, taskId, workerId, workerId, null));
            log.info("Task {} released by {}", taskId, workerId);
        } else {
            log.warn("Release of task {} by {} ignored - not RUNNING under that worker", taskId, workerId);
        }
        return released;
    }

    public Optional<Task> findById(String taskId) {
        return taskRepository.findById(taskId);
    }

    public List<Task> findByState(TaskState state, int limit) {
        return taskRepository.findByState(state, limit);
    }

    public List<Task> findRunningByWorker(String workerId) {
        return taskRepository.findRunningByWorker(workerId);
    }

    public int countByState(TaskState state) {
        return taskRepository.countByState(state);
    }

    public Map<String, Integer> queuedPerShard() {
        return taskRepository.countQueuedByShard();
    }

    public List<AuditEvent> events(String taskId) {
        return auditRepository.findByTask(taskId);
    }
}
