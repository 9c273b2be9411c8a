package triagent.orchestrator.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Task lifecycle state.
 *
 * <pre>
 * QUEUED   -> RUNNING | FAILED
 * RUNNING  -> REVIEW | QUEUED | ESCALATED | FAILED
 * REVIEW   -> APPROVED | REJECTED | ESCALATED | FAILED
 * APPROVED -> COMPLETED | FAILED
 * REJECTED -> QUEUED | ESCALATED | FAILED
 * </pre>
 *
 * COMPLETED, FAILED and ESCALATED are terminal.
 */
public enum TaskState {
    /** Waiting to be claimed */
    QUEUED,
    /** Owned by exactly one worker */
    RUNNING,
    /** Result submitted, consensus session open */
    REVIEW,
    /** Consensus passed */
    APPROVED,
    /** Consensus failed, will be retried or escalated */
    REJECTED,
    /** Done */
    COMPLETED,
    /** Unrecoverable failure */
    FAILED,
    /** Handed to a human; nothing moves it automatically */
    ESCALATED;

    private static final Map<TaskState, Set<TaskState>> TRANSITIONS = new EnumMap<>(TaskState.class);

    static {
        TRANSITIONS.put(QUEUED, EnumSet.of(RUNNING, FAILED));
        TRANSITIONS.put(RUNNING, EnumSet.of(REVIEW, QUEUED, ESCALATED, FAILED));
        TRANSITIONS.put(REVIEW, EnumSet.of(APPROVED, REJECTED, ESCALATED, FAILED));
        TRANSITIONS.put(APPROVED, EnumSet.of(COMPLETED, FAILED));
        TRANSITIONS.put(REJECTED, EnumSet.of(QUEUED, ESCALATED, FAILED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(TaskState.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(TaskState.class));
        TRANSITIONS.put(ESCALATED, EnumSet.noneOf(TaskState.class));
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == ESCALATED;
    }

    public boolean canTransitionTo(TaskState next) {
        return TRANSITIONS.get(this).contains(next);
    }
}
