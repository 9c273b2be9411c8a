package triagent.orchestrator.model;

/**
 * Result of submitting an execution result for review.
 */
public enum SubmitResult {
    /** Task moved to REVIEW and a consensus session was opened */
    SUBMITTED,

    /** Task was already past RUNNING - idempotent success */
    ALREADY_SUBMITTED,

    /** Task not found */
    NOT_FOUND,

    /** Task is owned by a different worker */
    WRONG_WORKER
}
