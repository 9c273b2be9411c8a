package triagent.orchestrator.model;

/**
 * Circuit breaker state for one capability.
 */
public enum BreakerState {
    /** Calls flow */
    CLOSED,
    /** Calls are refused until the cooldown elapses */
    OPEN,
    /** One trial call allowed */
    HALF_OPEN
}
