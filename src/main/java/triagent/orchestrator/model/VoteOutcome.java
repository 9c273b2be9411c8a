package triagent.orchestrator.model;

/**
 * Result of recording a vote. Anything but ACCEPTED leaves the session untouched.
 */
public enum VoteOutcome {
    ACCEPTED,
    SESSION_NOT_FOUND,
    IMPLEMENTER_VOTE,
    UNKNOWN_VOTER,
    DUPLICATE_VOTE,
    SESSION_CLOSED;

    public boolean accepted() {
        return this == ACCEPTED;
    }
}
