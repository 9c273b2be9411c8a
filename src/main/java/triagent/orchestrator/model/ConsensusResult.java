package triagent.orchestrator.model;

/**
 * Outcome of a consensus session.
 */
public enum ConsensusResult {
    /** Enough approvals */
    PASS,
    /** Enough rejections */
    FAIL,
    /** Every expected voter responded without reaching either threshold */
    INCONCLUSIVE,
    /** Closed without a decision because the task left review */
    CANCELLED,
    /** Still waiting for votes */
    PENDING;

    public boolean isFinal() {
        return this != PENDING;
    }
}
