package triagent.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.config.OrchestratorConfig;
import triagent.orchestrator.error.InvalidTransitionException;
import triagent.orchestrator.model.AuditEvent;
import triagent.orchestrator.model.BudgetStatus;
import triagent.orchestrator.model.EventType;
import triagent.orchestrator.model.KillSwitchStatus;
import triagent.orchestrator.model.RecoveryReason;
import triagent.orchestrator.model.SpendEntry;
import triagent.orchestrator.model.Worker;
import triagent.orchestrator.model.WorkerStatus;
import triagent.orchestrator.repository.AuditRepository;
import triagent.orchestrator.repository.BudgetRepository;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Spend ledger and pool-wide kill switch.
 *
 * {@link #check()} trips the switch when the rolling rate exceeds the rate limit or
 * today's spend reaches the daily limit, then halts the pool. The switch is sticky:
 * only {@link #reset(String)} clears it.
 *
 * A halt never blocks the caller: workers are asked to pause at once, and the ones
 * still running once the grace period has passed are killed by a later check.
 */
public class BudgetGovernor {

    private static final Logger log = LoggerFactory.getLogger(BudgetGovernor.class);

    private final BudgetRepository budgetRepository;
    private final AuditRepository auditRepository;
    private final WorkerPoolService workerPoolService;
    private final HeartbeatService heartbeatService;
    private final ProcessProbe processProbe;
    private final OrchestratorConfig config;
    private final Clock clock;

    // Activation whose kill phase already ran.
    private volatile Instant enforcedActivation;

    public BudgetGovernor(BudgetRepository budgetRepository, AuditRepository auditRepository,
            WorkerPoolService workerPoolService, HeartbeatService heartbeatService, ProcessProbe processProbe,
            OrchestratorConfig config, Clock clock) {
        this.budgetRepository = budgetRepository;
        this.auditRepository = auditRepository;
        this.workerPoolService = workerPoolService;
        this.heartbeatService = heartbeatService;
        this.processProbe = processProbe;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Append a spend entry.
     *
     * @param amount     dollars, not negative
     * @param capability model that incurred it, may be null
     * @param taskId     task it is attributed to, may be null
     */
    public void recordSpend(BigDecimal amount, String capability, String taskId) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be zero or positive");
        }
        budgetRepository.append(new SpendEntry(null, clock.instant(), amount, capability, taskId));
        log.debug("Spend ${} recorded ({} / {})", amount, capability, taskId);
    }

    /**
     * Spend over {@code [now - window, now]} normalised to dollars per minute.
     */
    public BigDecimal spendRatePerMinute(Duration window) {
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        Instant now = clock.instant();
        BigDecimal total = budgetRepository.sumBetween(now.minus(window), now);
        return total.multiply(BigDecimal.valueOf(60))
                .divide(BigDecimal.valueOf(window.toSeconds()), 6, RoundingMode.HALF_UP);
    }

    /**
     * Spend since 00:00 UTC today.
     */
    public BigDecimal dailySpend() {
        Instant now = clock.instant();
        return budgetRepository.sumBetween(startOfDay(now), now);
    }

    /**
     * Compare spend against both limits and trip the kill switch on a breach.
     *
     * @return true if the switch is active after the check
     */
    public boolean check() {
        KillSwitchStatus current = budgetRepository.killSwitch();
        if (current.active()) {
            log.debug("Kill switch already active: {}", current.reason());
            enforceHalt(current);
            return true;
        }

        BigDecimal rate = spendRatePerMinute(config.budgetRateWindow());
        BigDecimal daily = dailySpend();

        String reason = null;
        if (rate.compareTo(config.budgetRateLimit()) > 0) {
            reason = "Spend rate $" + rate.stripTrailingZeros().toPlainString() + "/min exceeds limit $"
                    + config.budgetRateLimit().toPlainString() + "/min";
        } else if (daily.compareTo(config.budgetDailyLimit()) >= 0) {
            reason = "Daily spend $" + daily.stripTrailingZeros().toPlainString() + " reached limit $"
                    + config.budgetDailyLimit().toPlainString();
        }

        if (reason == null) {
            log.debug("Budget ok: rate ${}/min, daily ${}", rate, daily);
            return false;
        }

        if (budgetRepository.activate(reason, clock.instant())) {
            auditRepository.record(AuditEvent.of(EventType.KILL_SWITCH_ACTIVATED, null, null, "budget", reason));
            haltPool(reason);
        }
        return true;
    }

    /**
     * Ask every worker to pause. Workers an operator had already paused keep their flag
     * as the operator's. Kills follow once the grace period is over.
     *
     * @return number of workers killed right away, non-zero only without a grace period
     */
    public int haltPool(String reason) {
        int asked = workerPoolService.pauseAllForHalt();
        log.warn("Halting pool ({}): pause requested for {} worker(s), grace {}", reason, asked,
                config.budgetKillGrace());
        return enforceHalt(budgetRepository.killSwitch());
    }

    /**
     * Kill phase of a halt: once per activation, after the grace period, kill every worker
     * that did not pause or stop on its own. Their tasks go back to the queue without penalty.
     *
     * @return number of workers killed
     */
    int enforceHalt(KillSwitchStatus killSwitch) {
        if (!killSwitch.active() || killSwitch.activatedAt() == null
                || killSwitch.activatedAt().equals(enforcedActivation)) {
            return 0;
        }
        Instant deadline = killSwitch.activatedAt().plus(config.budgetKillGrace());
        if (clock.instant().isBefore(deadline)) {
            log.debug("Kill grace running until {}", deadline);
            return 0;
        }
        enforcedActivation = killSwitch.activatedAt();

        int killed = 0;
        for (Worker worker : workerPoolService.findAll()) {
            WorkerStatus status = worker.status();
            if (status == WorkerStatus.PAUSED || status == WorkerStatus.STOPPING || status.isGone()) {
                continue;
            }
            if (kill(worker, killSwitch.reason())) {
                killed++;
            }
        }

        log.warn("Pool halted ({}): {} worker(s) killed", killSwitch.reason(), killed);
        return killed;
    }

    private boolean kill(Worker worker, String reason) {
        ProcessProbe.Liveness liveness = processProbe.liveness(worker);
        if (liveness == ProcessProbe.Liveness.ALIVE && !processProbe.terminate(worker)) {
            log.warn("Could not terminate worker {} (pid {})", worker.id(), worker.pid());
        } else if (liveness == ProcessProbe.Liveness.UNVERIFIABLE) {
            log.warn("Worker {} (pid {} on {}) cannot be verified, marking crashed without a kill",
                    worker.id(), worker.pid(), worker.host());
        }

        int requeued = heartbeatService.requeueTasks(worker.id(), RecoveryReason.BUDGET_KILL);

        // starting -> dead is not an allowed edge.
        boolean crashed = worker.status() == WorkerStatus.STARTING || liveness == ProcessProbe.Liveness.UNVERIFIABLE;
        WorkerStatus target = crashed ? WorkerStatus.CRASHED : WorkerStatus.DEAD;
        boolean marked;
        try {
            marked = workerPoolService.transition(worker.id(), worker.status(), target);
        } catch (InvalidTransitionException e) {
            marked = false;
        }
        if (!marked) {
            log.warn("Worker {} changed status during kill, left as is", worker.id());
            return false;
        }

        auditRepository.record(AuditEvent.of(EventType.WORKER_KILLED, null, worker.id(), "budget",
                reason + " (" + requeued + " task(s) requeued)"));
        log.warn("Worker {} killed by budget governor, {} task(s) requeued", worker.id(), requeued);
        return true;
    }

    public boolean isHalted() {
        return budgetRepository.killSwitch().active();
    }

    public BudgetStatus status() {
        KillSwitchStatus killSwitch = budgetRepository.killSwitch();
        Instant now = clock.instant();
        return new BudgetStatus(
                killSwitch.active(),
                killSwitch.reason(),
                killSwitch.activatedAt(),
                killSwitch.resetAt(),
                killSwitch.resetBy(),
                spendRatePerMinute(config.budgetRateWindow()),
                config.budgetRateLimit(),
                dailySpend(),
                config.budgetDailyLimit(),
                budgetRepository.sumByCapabilitySince(startOfDay(now)));
    }

    /**
     * Operator reset: clear the switch and lift the pause requests the halt set.
     *
     * @return false if the switch was not active
     */
    public boolean reset(String operator) {
        if (operator == null || operator.isBlank()) {
            throw new IllegalArgumentException("operator is required");
        }
        boolean reset = budgetRepository.reset(operator, clock.instant());
        if (reset) {
            auditRepository.record(AuditEvent.of(EventType.KILL_SWITCH_RESET, null, null, operator, null));
            workerPoolService.resumeHaltPaused();
        }
        return reset;
    }

    private static Instant startOfDay(Instant now) {
        return now.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.DAYS).toInstant();
    }
}
