package triagent.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.error.InvalidTransitionException;
import triagent.orchestrator.model.AuditEvent;
import triagent.orchestrator.model.ConsensusResult;
import triagent.orchestrator.model.ConsensusSession;
import triagent.orchestrator.model.Escalation;
import triagent.orchestrator.model.EventType;
import triagent.orchestrator.model.FailResult;
import triagent.orchestrator.model.Priority;
import triagent.orchestrator.model.SubmitResult;
import triagent.orchestrator.model.Task;
import triagent.orchestrator.model.TaskState;
import triagent.orchestrator.model.TaskType;
import triagent.orchestrator.model.Vote;
import triagent.orchestrator.repository.AuditRepository;
import triagent.orchestrator.repository.EscalationRepository;
import triagent.orchestrator.repository.TaskRepository;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Task lifecycle state machine.
 *
 * <pre>
 * QUEUED   -> RUNNING | FAILED
 * RUNNING  -> REVIEW | QUEUED | ESCALATED | FAILED
 * REVIEW   -> APPROVED | REJECTED | ESCALATED | FAILED
 * APPROVED -> COMPLETED | FAILED
 * REJECTED -> QUEUED | ESCALATED | FAILED
 * </pre>
 *
 * Every move is a conditional update on the expected current state. A mismatch
 * raises {@link InvalidTransitionException}; nothing is repaired.
 */
public class LifecycleService {

    private static final Logger log = LoggerFactory.getLogger(LifecycleService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final TaskRepository taskRepository;
    private final EscalationRepository escalationRepository;
    private final AuditRepository auditRepository;
    private final ConsensusService consensusService;
    private final WorkerPoolService workerPoolService;
    private final Clock clock;

    public LifecycleService(TaskRepository taskRepository, EscalationRepository escalationRepository,
            AuditRepository auditRepository, ConsensusService consensusService,
            WorkerPoolService workerPoolService, Clock clock) {
        this.taskRepository = taskRepository;
        this.escalationRepository = escalationRepository;
        this.auditRepository = auditRepository;
        this.consensusService = consensusService;
        this.workerPoolService = workerPoolService;
        this.clock = clock;
    }

    // ==================== Execution results ====================

    /**
     * RUNNING to REVIEW. Stores the result, clears the owner and opens a consensus
     * session with the executing capability as implementer. If the session cannot be
     * opened the task is escalated rather than left in REVIEW with nothing to vote on.
     *
     * @param implementer capability that produced the result; defaults to the task's assigned model
     */
    public SubmitResult submitForReview(String taskId, String workerId, String implementer, String result) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }

        Optional<Task> found = taskRepository.findById(taskId);
        if (found.isEmpty()) {
            return SubmitResult.NOT_FOUND;
        }
        Task task = found.get();
        if (task.state() != TaskState.RUNNING) {
            return task.state() == TaskState.QUEUED ? SubmitResult.WRONG_WORKER : SubmitResult.ALREADY_SUBMITTED;
        }
        if (!workerId.equals(task.workerId())) {
            log.warn("Task {} submitted by {} but owned by {}", taskId, workerId, task.workerId());
            return SubmitResult.WRONG_WORKER;
        }

        if (!taskRepository.submitForReview(taskId, workerId, result)) {
            // Recovered or released between the read and the update.
            log.warn("Submit of task {} by {} lost - task is no longer RUNNING under that worker", taskId, workerId);
            return SubmitResult.WRONG_WORKER;
        }
        recordTransition(task, TaskState.RUNNING, TaskState.REVIEW, workerId, null);

        workerPoolService.recordOutcome(workerId, true);
        workerPoolService.settle(workerId);

        String capability = implementer != null && !implementer.isBlank() ? implementer : task.assignedModel();
        ConsensusSession session = null;
        try {
            session = consensusService.createSession(taskId, capability, task.type());

            // With no reviewers configured the session is decided at once.
            ConsensusResult immediate = consensusService.evaluate(session.id());
            if (immediate.isFinal()) {
                applyConsensus(taskId, immediate);
            }
        } catch (RuntimeException e) {
            log.error("Review of task {} could not start", taskId, e);
            escalateUnreviewable(taskId, session != null, e);
        }
        return SubmitResult.SUBMITTED;
    }

    /**
     * REVIEW to ESCALATED after a failed review start. If this fails too, the original
     * error is rethrown with the second one suppressed.
     */
    private void escalateUnreviewable(String taskId, boolean sessionOpened, RuntimeException cause) {
        try {
            if (sessionOpened) {
                consensusService.cancelOpen(taskId, "review could not start");
            }
            Task current = require(taskId);
            if (current.state() != TaskState.REVIEW) {
                return;
            }
            String reason = "Review could not start: " + cause.getMessage();
            move(current, TaskState.REVIEW, TaskState.ESCALATED, reason);
            openEscalation(current, reason);
        } catch (RuntimeException compensation) {
            cause.addSuppressed(compensation);
            throw cause;
        }
    }

    /**
     * Executor failure: RUNNING to QUEUED with retry_count + 1, or ESCALATED once retries are spent.
     */
    public FailResult failExecution(String taskId, String workerId, String error) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }

        Optional<Task> found = taskRepository.findById(taskId);
        if (found.isEmpty()) {
            return FailResult.NOT_FOUND;
        }
        Task task = found.get();
        if (task.state().isTerminal()) {
            return FailResult.ALREADY_TERMINAL;
        }
        if (task.state() != TaskState.RUNNING || !workerId.equals(task.workerId())) {
            log.warn("Failure report for task {} from {} ignored - task is {} under {}", taskId, workerId,
                    task.state(), task.workerId());
            return FailResult.WRONG_WORKER;
        }

        FailResult outcome;
        if (task.canRetry()) {
            if (!taskRepository.requeueForRetry(taskId, TaskState.RUNNING, workerId, null, error)) {
                return FailResult.WRONG_WORKER;
            }
            recordTransition(task, TaskState.RUNNING, TaskState.QUEUED, workerId,
                    "retry " + (task.retryCount() + 1) + "/" + task.maxRetries() + ": " + error);
            log.info("Task {} requeued after executor failure (retry {}/{})", taskId, task.retryCount() + 1,
                    task.maxRetries());
            outcome = FailResult.RETRIED;
        } else {
            if (!taskRepository.transition(taskId, TaskState.RUNNING, TaskState.ESCALATED, workerId, error,
                    clock.instant())) {
                return FailResult.WRONG_WORKER;
            }
            recordTransition(task, TaskState.RUNNING, TaskState.ESCALATED, workerId, error);
            openEscalation(task, "Executor failed after " + task.retryCount() + " retries: " + error);
            outcome = FailResult.ESCALATED;
        }

        workerPoolService.recordOutcome(workerId, false);
        workerPoolService.settle(workerId);
        return outcome;
    }

    // ==================== Consensus outcomes ====================

    /**
     * Apply a consensus result to a task in REVIEW.
     *
     * @return the state the task ended in
     * @throws InvalidTransitionException if the task is not in REVIEW
     */
    public TaskState applyConsensus(String taskId, ConsensusResult result) {
        Task task = require(taskId);
        if (result == ConsensusResult.PENDING || result == ConsensusResult.CANCELLED) {
            return task.state();
        }
        if (task.state() != TaskState.REVIEW) {
            throw new InvalidTransitionException(taskId,
                    "Cannot apply " + result + " to task " + taskId + " in state " + task.state());
        }

        switch (result) {
            case PASS -> {
                move(task, TaskState.REVIEW, TaskState.APPROVED, null);
                move(task, TaskState.APPROVED, TaskState.COMPLETED, null);
                log.info("Task {} completed", taskId);
                return TaskState.COMPLETED;
            }
            case FAIL -> {
                move(task, TaskState.REVIEW, TaskState.REJECTED, null);
                return retryOrEscalate(task);
            }
            case INCONCLUSIVE -> {
                move(task, TaskState.REVIEW, TaskState.ESCALATED, "consensus inconclusive");
                openEscalation(task, "Consensus inconclusive");
                return TaskState.ESCALATED;
            }
            default -> throw new IllegalArgumentException("Unsupported consensus result: " + result);
        }
    }

    private TaskState retryOrEscalate(Task task) {
        if (!task.canRetry()) {
            move(task, TaskState.REJECTED, TaskState.ESCALATED, "rejected with retries exhausted");
            openEscalation(task, "Rejected after " + task.retryCount() + " retries");
            return TaskState.ESCALATED;
        }

        String feedback = rejectionFeedback(task);
        if (!taskRepository.requeueForRetry(task.id(), TaskState.REJECTED, null, feedback, null)) {
            throw new InvalidTransitionException(task.id(), "Task " + task.id() + " left REJECTED before requeue");
        }
        recordTransition(task, TaskState.REJECTED, TaskState.QUEUED, null,
                "retry " + (task.retryCount() + 1) + "/" + task.maxRetries());
        log.info("Task {} rejected, requeued with feedback (retry {}/{})", task.id(), task.retryCount() + 1,
                task.maxRetries());
        return TaskState.QUEUED;
    }

    /**
     * Votes and reasons of the latest failed session, as JSON for the next attempt.
     */
    String rejectionFeedback(Task task) {
        List<ConsensusSession> sessions = consensusService.sessionsForTask(task.id());
        ConsensusSession latest = null;
        for (ConsensusSession session : sessions) {
            if (session.finalResult() == ConsensusResult.FAIL) {
                latest = session;
            }
        }

        ObjectNode root = MAPPER.createObjectNode();
        root.put("attempt", task.retryCount() + 1);
        root.put("result", ConsensusResult.FAIL.name());
        ArrayNode votes = root.putArray("votes");
        if (latest != null) {
            root.put("sessionId", latest.id());
            root.put("implementer", latest.implementer());
            for (Vote vote : consensusService.votes(latest.id())) {
                ObjectNode node = votes.addObject();
                node.put("voter", vote.voter());
                node.put("vote", vote.value().name());
                node.put("reason", vote.reason());
            }
        }

        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize feedback for task " + task.id(), e);
        }
    }

    // ==================== Operator actions ====================

    /**
     * Any non-terminal state to FAILED.
     */
    public void fail(String taskId, String reason) {
        Task task = require(taskId);
        if (task.state().isTerminal()) {
            throw new InvalidTransitionException(taskId,
                    "Task " + taskId + " is already " + task.state());
        }

        move(task, task.state(), TaskState.FAILED, reason);
        consensusService.cancelOpen(taskId, "task failed");
        log.info("Task {} failed: {}", taskId, reason);
        if (task.workerId() != null) {
            workerPoolService.settle(task.workerId());
        }
    }

    public List<Escalation> openEscalations() {
        return escalationRepository.findOpen();
    }

    public List<Escalation> escalationsForTask(String taskId) {
        return escalationRepository.findByTask(taskId);
    }

    /**
     * Close an escalation. The task stays ESCALATED.
     *
     * @return false if unknown or already resolved
     */
    public boolean resolveEscalation(long escalationId, String operator) {
        if (operator == null || operator.isBlank()) {
            throw new IllegalArgumentException("operator is required");
        }
        Optional<Escalation> escalation = escalationRepository.findById(escalationId);
        if (escalation.isEmpty()) {
            return false;
        }

        boolean resolved = escalationRepository.resolve(escalationId, operator, clock.instant());
        if (resolved) {
            auditRepository.record(AuditEvent.of(EventType.ESCALATION_RESOLVED, escalation.get().taskId(), null,
                    operator, "escalation " + escalationId));
            log.info("Escalation {} for task {} resolved by {}", escalationId, escalation.get().taskId(), operator);
        }
        return resolved;
    }

    // ==================== Helpers ====================

    private void move(Task task, TaskState from, TaskState to, String error) {
        if (!taskRepository.transition(task.id(), from, to, null, error, clock.instant())) {
            log.warn("Task {} transition {} -> {} rejected - state changed concurrently", task.id(), from, to);
            throw new InvalidTransitionException(task.id(),
                    "Task " + task.id() + " is no longer " + from + ", cannot move to " + to);
        }
        recordTransition(task, from, to, null, error);
    }

    private void recordTransition(Task task, TaskState from, TaskState to, String workerId, String detail) {
        auditRepository.record(AuditEvent.of(EventType.TASK_TRANSITION, task.id(), workerId, "lifecycle",
                from + " -> " + to + (detail != null ? " (" + detail + ")" : "")).withTraceId(task.traceId()));
    }

    private void openEscalation(Task task, String reason) {
        String severity = task.type() == TaskType.SECURITY || task.priority() == Priority.CRITICAL
                ? "HIGH"
                : "MEDIUM";
        long id = escalationRepository.open(task.id(), reason, severity, clock.instant());
        auditRepository.record(AuditEvent.of(EventType.ESCALATION_OPENED, task.id(), null, "lifecycle",
                "escalation " + id + " [" + severity + "] " + reason).withTraceId(task.traceId()));
    }

    private Task require(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required");
        }
        return taskRepository.findById(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
    }
}
