package triagent.orchestrator.model;

/**
 * Result of reporting an execution failure.
 */
public enum FailResult {
    /** Task requeued with retry_count + 1 */
    RETRIED,

    /** Retries exhausted, task escalated */
    ESCALATED,

    /** Task was already in a terminal state - idempotent success */
    ALREADY_TERMINAL,

    /** Task not found */
    NOT_FOUND,

    /** Task is owned by a different worker */
    WRONG_WORKER
}
