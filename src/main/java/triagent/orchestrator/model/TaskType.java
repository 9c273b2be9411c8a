package triagent.orchestrator.model;

import java.util.Locale;

/**
 * Kind of work a task represents. Drives routing and consensus policy.
 */
public enum TaskType {
    /** Write or change code */
    IMPLEMENTATION,
    /** Review an existing change */
    REVIEW,
    /** Research, architecture or design analysis */
    ANALYSIS,
    /** Security-sensitive review, always sent to the highest-trust capability */
    SECURITY;

    /**
     * Parse a task type name, case-insensitive.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static TaskType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("task type is required");
        }
        try {
            return TaskType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown task type: " + raw, e);
        }
    }
}
