package triagent.orchestrator.model;

/**
 * A reviewer's vote in a consensus session.
 */
public enum VoteValue {
    APPROVE,
    REJECT,
    ABSTAIN,
    /** Reviewer did not answer within the executor timeout */
    TIMEOUT,
    /** Reviewer call failed or its breaker was open */
    ERROR
}
