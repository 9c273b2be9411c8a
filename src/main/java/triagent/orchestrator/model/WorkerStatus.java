package triagent.orchestrator.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Worker process status. Stored lowercase.
 */
public enum WorkerStatus {
    /** Registered, not yet polling */
    STARTING,
    /** Polling for work */
    IDLE,
    /** Owns at least one RUNNING task */
    BUSY,
    /** Pause requested and observed */
    PAUSED,
    /** Shutting down */
    STOPPING,
    /** Process gone */
    DEAD,
    /** Process alive but unresponsive */
    CRASHED;

    private static final Map<WorkerStatus, Set<WorkerStatus>> TRANSITIONS = new EnumMap<>(WorkerStatus.class);

    static {
        TRANSITIONS.put(STARTING, EnumSet.of(IDLE, STOPPING, CRASHED));
        TRANSITIONS.put(IDLE, EnumSet.of(BUSY, PAUSED, STOPPING, DEAD, CRASHED));
        TRANSITIONS.put(BUSY, EnumSet.of(IDLE, PAUSED, STOPPING, DEAD, CRASHED));
        TRANSITIONS.put(PAUSED, EnumSet.of(IDLE, STOPPING, DEAD, CRASHED));
        TRANSITIONS.put(STOPPING, EnumSet.of(DEAD, CRASHED));
        TRANSITIONS.put(DEAD, EnumSet.of(STARTING));
        TRANSITIONS.put(CRASHED, EnumSet.of(STARTING));
    }

    /**
     * Same-status updates are always allowed.
     */
    public boolean canTransitionTo(WorkerStatus next) {
        return this == next || TRANSITIONS.get(this).contains(next);
    }

    /** Dead or crashed */
    public boolean isGone() {
        return this == DEAD || this == CRASHED;
    }

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static WorkerStatus fromDb(String value) {
        return WorkerStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
