package triagent.orchestrator.repository;

import triagent.orchestrator.model.CircuitBreakerState;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Repository interface for per-capability circuit breaker rows.
 */
public interface BreakerRepository {

    /**
     * Read-modify-write one breaker row under a row lock in a single transaction.
     * A missing row starts CLOSED.
     *
     * @param capability breaker key
     * @param update     computes the next state and a result from the current state
     * @return the result produced by {@code update}
     */
    <R> R update(String capability, Function<CircuitBreakerState, Mutation<R>> update);

    /**
     * Find a breaker row.
     */
    Optional<CircuitBreakerState> find(String capability);

    /**
     * Find every breaker row ordered by capability.
     */
    List<CircuitBreakerState> findAll();

    /**
     * Next state plus the value handed back to the caller.
     */
    record Mutation<R>(CircuitBreakerState next, R result) {
    }
}
