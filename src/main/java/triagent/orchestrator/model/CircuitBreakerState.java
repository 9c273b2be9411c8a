package triagent.orchestrator.model;

import java.time.Instant;

/**
 * Persisted breaker row for one capability.
 *
 * @param halfOpenInFlight the single HALF_OPEN trial call has been handed out
 */
public record CircuitBreakerState(
        String capability,
        BreakerState state,
        int failureCount,
        Instant openedAt,
        boolean halfOpenInFlight,
        Instant lastFailure,
        Instant lastSuccess) {

    public static CircuitBreakerState closed(String capability) {
        return new CircuitBreakerState(capability, BreakerState.CLOSED, 0, null, false, null, null);
    }

    public CircuitBreakerState withState(BreakerState newState, Instant newOpenedAt, boolean inFlight) {
        return new CircuitBreakerState(capability, newState, failureCount, newOpenedAt, inFlight,
                lastFailure, lastSuccess);
    }

    public CircuitBreakerState withFailure(int count, Instant at) {
        return new CircuitBreakerState(capability, state, count, openedAt, halfOpenInFlight, at, lastSuccess);
    }

    public CircuitBreakerState withSuccess(Instant at) {
        return new CircuitBreakerState(capability, BreakerState.CLOSED, 0, null, false, lastFailure, at);
    }
}
