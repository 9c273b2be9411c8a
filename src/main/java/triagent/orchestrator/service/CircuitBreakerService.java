package triagent.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.config.OrchestratorConfig;
import triagent.orchestrator.error.CircuitOpenException;
import triagent.orchestrator.executor.ExecutorException;
import triagent.orchestrator.model.BreakerState;
import triagent.orchestrator.model.CircuitBreakerState;
import triagent.orchestrator.repository.BreakerRepository;
import triagent.orchestrator.repository.BreakerRepository.Mutation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Per-capability circuit breaker persisted in the store, so every worker process
 * sees the same state.
 *
 * CLOSED opens after {@code breakerFailureThreshold} consecutive failures. OPEN refuses
 * calls until the cooldown has elapsed, then HALF_OPEN hands out a single trial call.
 * A successful trial closes the breaker; a failed one reopens it with a fresh cooldown.
 */
public class CircuitBreakerService {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerService.class);

    /**
     * A guarded call into the executor.
     */
    @FunctionalInterface
    public interface ExecutorCall<T> {
        T call() throws ExecutorException;
    }

    private final BreakerRepository breakerRepository;
    private final OrchestratorConfig config;
    private final Clock clock;

    public CircuitBreakerService(BreakerRepository breakerRepository, OrchestratorConfig config, Clock clock) {
        this.breakerRepository = breakerRepository;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Whether a call may go out now. Moving OPEN to HALF_OPEN and taking the trial
     * slot happen in the same locked update.
     */
    public boolean allowRequest(String capability) {
        requireCapability(capability);
        Instant now = clock.instant();
        Duration cooldown = config.breakerCooldown();

        return breakerRepository.<Boolean>update(capability, current -> {
            switch (current.state()) {
                case OPEN:
                    if (elapsed(current.openedAt(), now, cooldown)) {
                        log.info("Breaker {} half-open, allowing one trial call", capability);
                        return new Mutation<>(current.withState(BreakerState.HALF_OPEN, now, true), true);
                    }
                    return new Mutation<>(current, false);
                case HALF_OPEN:
                    // A trial that never reported back frees its slot after another cooldown.
                    if (!current.halfOpenInFlight() || elapsed(current.openedAt(), now, cooldown)) {
                        return new Mutation<>(current.withState(BreakerState.HALF_OPEN, now, true), true);
                    }
                    return new Mutation<>(current, false);
                default:
                    return new Mutation<>(current, true);
            }
        });
    }

    public void recordSuccess(String capability) {
        requireCapability(capability);
        Instant now = clock.instant();

        BreakerState previous = breakerRepository.<BreakerState>update(capability,
                current -> new Mutation<>(current.withSuccess(now), current.state()));
        if (previous != BreakerState.CLOSED) {
            log.info("Breaker {} closed after successful call", capability);
        }
    }

    public void recordFailure(String capability) {
        requireCapability(capability);
        Instant now = clock.instant();
        int threshold = config.breakerFailureThreshold();

        CircuitBreakerState next = breakerRepository.<CircuitBreakerState>update(capability, current -> {
            CircuitBreakerState failed = current.withFailure(current.failureCount() + 1, now);
            CircuitBreakerState updated = switch (current.state()) {
                case HALF_OPEN -> failed.withState(BreakerState.OPEN, now, false);
                case CLOSED -> failed.failureCount() >= threshold
                        ? failed.withState(BreakerState.OPEN, now, false)
                        : failed;
                case OPEN -> failed;
            };
            return new Mutation<>(updated, updated);
        });

        if (next.state() == BreakerState.OPEN) {
            log.warn("Breaker {} open ({} consecutive failures)", capability, next.failureCount());
        } else {
            log.debug("Breaker {} failure {}/{}", capability, next.failureCount(), threshold);
        }
    }

    /**
     * Run a call through the breaker. Timeouts and errors count as failures.
     *
     * @throws CircuitOpenException when the breaker refuses; the call is not made
     */
    public <T> T execute(String capability, ExecutorCall<T> call) throws ExecutorException {
        if (!allowRequest(capability)) {
            throw new CircuitOpenException(capability);
        }
        try {
            T result = call.call();
            recordSuccess(capability);
            return result;
        } catch (ExecutorException | RuntimeException e) {
            recordFailure(capability);
            throw e;
        }
    }

    public CircuitBreakerState state(String capability) {
        requireCapability(capability);
        return breakerRepository.find(capability).orElse(CircuitBreakerState.closed(capability));
    }

    public List<CircuitBreakerState> findAll() {
        return breakerRepository.findAll();
    }

    /**
     * Operator action: force CLOSED with the failure count cleared.
     */
    public void reset(String capability) {
        requireCapability(capability);
        breakerRepository.<Void>update(capability, current -> new Mutation<>(
                new CircuitBreakerState(capability, BreakerState.CLOSED, 0, null, false,
                        current.lastFailure(), current.lastSuccess()),
                null));
        log.info("Breaker {} reset by operator", capability);
    }

    private static boolean elapsed(Instant since, Instant now, Duration cooldown) {
        return since == null || !now.isBefore(since.plus(cooldown));
    }

    private static void requireCapability(String capability) {
        if (capability == null || capability.isBlank()) {
            throw new IllegalArgumentException("capability is required");
        }
    }
}
