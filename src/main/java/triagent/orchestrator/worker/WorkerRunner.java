package triagent.orchestrator.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.config.OrchestratorConfig;
import triagent.orchestrator.error.BudgetExceededException;
import triagent.orchestrator.error.CircuitOpenException;
import triagent.orchestrator.error.InvalidTransitionException;
import triagent.orchestrator.error.StoreUnavailableException;
import triagent.orchestrator.executor.ExecutorException;
import triagent.orchestrator.executor.ExecutorTimeoutException;
import triagent.orchestrator.executor.ModelExecutor;
import triagent.orchestrator.model.FailResult;
import triagent.orchestrator.model.SubmitResult;
import triagent.orchestrator.model.Task;
import triagent.orchestrator.model.Worker;
import triagent.orchestrator.service.BudgetGovernor;
import triagent.orchestrator.service.CircuitBreakerService;
import triagent.orchestrator.service.HeartbeatService;
import triagent.orchestrator.service.LifecycleService;
import triagent.orchestrator.service.ReviewService;
import triagent.orchestrator.service.SpendMeter;
import triagent.orchestrator.service.WorkerPoolService;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One worker's loop: heartbeat, pause check, claim, execute, review, report.
 * Registers on start, releases its work and goes dead on stop.
 * Stops cleanly on {@link CancellationToken#requestStop()} or Thread.interrupt().
 *
 * While a task is in hand the worker heartbeats every {@code heartbeatInterval}.
 * Any error after a claim gives the task back, so a claimed task never outlives
 * the attempt that claimed it.
 */
public final class WorkerRunner implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkerRunner.class);

    private final Worker registration;
    private final WorkerPoolService workerPoolService;
    private final HeartbeatService heartbeatService;
    private final LifecycleService lifecycleService;
    private final ReviewService reviewService;
    private final CircuitBreakerService breakerService;
    private final BudgetGovernor budgetGovernor;
    private final ModelExecutor executor;
    private final SpendMeter spendMeter;
    private final OrchestratorConfig config;
    private final CancellationToken token;
    private final ScheduledExecutorService heartbeatTicker;

    private Duration backoff;
    private boolean paused;

    public WorkerRunner(Worker registration, WorkerPoolService workerPoolService, HeartbeatService heartbeatService,
            LifecycleService lifecycleService, ReviewService reviewService, CircuitBreakerService breakerService,
            BudgetGovernor budgetGovernor, ModelExecutor executor, SpendMeter spendMeter, OrchestratorConfig config,
            CancellationToken token) {
        this.registration = registration;
        this.workerPoolService = workerPoolService;
        this.heartbeatService = heartbeatService;
        this.lifecycleService = lifecycleService;
        this.reviewService = reviewService;
        this.breakerService = breakerService;
        this.budgetGovernor = budgetGovernor;
        this.executor = executor;
        this.spendMeter = spendMeter;
        this.config = config;
        this.token = token;
        this.backoff = config.pollInterval();
        this.heartbeatTicker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-" + registration.id());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void run() {
        String workerId = registration.id();
        Thread.currentThread().setName("worker-" + workerId);

        start();
        log.info("Worker {} started (shard={}, model={})", workerId, registration.shard(), registration.model());

        try {
            while (!token.isStopRequested() && !Thread.currentThread().isInterrupted()) {
                try {
                    token.await(step());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        } finally {
            shutdown();
            log.info("Worker {} stopped", workerId);
        }
    }

    /**
     * Register and move to idle.
     */
    public void start() {
        workerPoolService.register(registration);
        workerPoolService.markReady(registration.id());
    }

    /**
     * One loop iteration.
     *
     * @return how long to wait before the next one
     */
    public Duration step() {
        String workerId = registration.id();
        try {
            heartbeatService.heartbeat(workerId, null, 0.0, null);

            if (token.isPauseRequested() || workerPoolService.isPauseRequested(workerId)) {
                if (!paused) {
                    workerPoolService.enterPause(workerId);
                    paused = true;
                }
                return config.pollInterval();
            }
            if (paused) {
                workerPoolService.leavePause(workerId);
                paused = false;
            }

            if (workerPoolService.atCapacity(workerId)) {
                log.debug("Worker {} at capacity, backing off", workerId);
                return config.antiStarvationBackoff();
            }

            Optional<Task> claimed = workerPoolService.claimForWorker(workerId);
            if (claimed.isEmpty()) {
                return resetBackoff();
            }

            return process(claimed.get());

        } catch (BudgetExceededException e) {
            log.warn("Worker {} not claiming: {}", workerId, e.getMessage());
            return config.pollInterval();
        } catch (InvalidTransitionException e) {
            log.warn("Worker {}: {}", workerId, e.getMessage());
            return config.pollInterval();
        } catch (StoreUnavailableException e) {
            Duration wait = increaseBackoff();
            log.warn("Worker {} store error, retrying in {}: {}", workerId, wait, e.getMessage());
            return wait;
        } catch (RuntimeException e) {
            Duration wait = increaseBackoff();
            log.error("Worker {} step failed, retrying in {}", workerId, wait, e);
            return wait;
        }
    }

    /**
     * Work one claimed task. Whatever goes wrong, the task is not left RUNNING under this
     * worker unless the store refuses the release as well.
     */
    private Duration process(Task task) {
        long interval = Math.max(1L, config.heartbeatInterval().toMillis());
        ScheduledFuture<?> tick = null;
        try {
            tick = heartbeatTicker.scheduleAtFixedRate(() -> tick(task.id()), interval, interval,
                    TimeUnit.MILLISECONDS);
            return execute(task);
        } catch (RuntimeException e) {
            log.error("Task {} abandoned by worker {}", task.id(), registration.id(), e);
            giveBack(task, e);
            return increaseBackoff();
        } finally {
            if (tick != null) {
                tick.cancel(false);
            }
        }
    }

    private Duration execute(Task task) {
        String workerId = registration.id();
        String capability = task.assignedModel() != null ? task.assignedModel() : registration.model();
        String prompt = executionPrompt(task);

        heartbeatService.heartbeat(workerId, task.id(), 0.0, config.executorTimeout());

        String output;
        try {
            output = breakerService.execute(capability,
                    () -> executor.execute(capability, prompt, config.executorTimeout()));
        } catch (CircuitOpenException e) {
            workerPoolService.release(task.id(), workerId);
            Duration wait = increaseBackoff();
            log.warn("Breaker open for {}, task {} released, backing off {}", capability, task.id(), wait);
            return wait;
        } catch (ExecutorTimeoutException e) {
            FailResult result = lifecycleService.failExecution(task.id(), workerId, e.getMessage());
            log.warn("Task {} timed out on {} -> {}", task.id(), capability, result);
            return resetBackoff();
        } catch (ExecutorException e) {
            FailResult result = lifecycleService.failExecution(task.id(), workerId, e.getMessage());
            log.warn("Task {} failed on {} -> {}", task.id(), capability, result);
            return resetBackoff();
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            // Executor bug: same accounting as an executor error.
            log.error("Executor {} crashed on task {}", capability, task.id(), e);
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            FailResult result = lifecycleService.failExecution(task.id(), workerId, error);
            log.warn("Task {} failed on {} -> {}", task.id(), capability, result);
            return resetBackoff();
        }

        BigDecimal cost = spendMeter.cost(capability, prompt, output);
        if (cost != null && cost.signum() > 0) {
            budgetGovernor.recordSpend(cost, capability, task.id());
        }

        heartbeatService.heartbeat(workerId, task.id(), 1.0, config.executorTimeout());
        SubmitResult submitted = lifecycleService.submitForReview(task.id(), workerId, capability, output);
        if (submitted == SubmitResult.SUBMITTED) {
            log.info("Task {} -> {} by {}", task.id(), reviewService.review(task.id()), workerId);
        } else {
            log.warn("Task {} result from {} not submitted: {}", task.id(), workerId, submitted);
        }

        backoff = config.pollInterval();
        return Duration.ZERO;
    }

    private void tick(String taskId) {
        try {
            heartbeatService.heartbeat(registration.id(), taskId, 0.0, config.executorTimeout());
        } catch (RuntimeException e) {
            log.warn("Worker {} heartbeat for task {} failed: {}", registration.id(), taskId, e.getMessage());
        }
    }

    /**
     * Release a task without penalty after an error. If the store refuses even that,
     * silent-task recovery takes it back later.
     */
    private void giveBack(Task task, RuntimeException cause) {
        String workerId = registration.id();
        try {
            if (workerPoolService.release(task.id(), workerId)) {
                log.warn("Task {} released by {} after: {}", task.id(), workerId, cause.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("Task {} could not be released by {}, left for recovery", task.id(), workerId, e);
        }
    }

    /**
     * Give back anything still owned and go dead.
     */
    public void shutdown() {
        heartbeatTicker.shutdownNow();
        try {
            workerPoolService.stop(registration.id());
        } catch (RuntimeException e) {
            log.error("Worker {} failed to stop cleanly", registration.id(), e);
        }
    }

    static String executionPrompt(Task task) {
        StringBuilder prompt = new StringBuilder()
                .append("Task ").append(task.name()).append(" (").append(task.type()).append(")\n\n");
        if (task.payload() != null) {
            prompt.append(task.payload()).append('\n');
        }
        if (task.feedback() != null) {
            prompt.append("\nThe previous attempt was rejected. Reviewer feedback:\n")
                    .append(task.feedback()).append('\n');
        }
        return prompt.toString();
    }

    private Duration resetBackoff() {
        backoff = config.pollInterval();
        return backoff;
    }

    private Duration increaseBackoff() {
        Duration current = backoff;
        Duration doubled = backoff.multipliedBy(2);
        backoff = doubled.compareTo(config.maxBackoff()) > 0 ? config.maxBackoff() : doubled;
        return current;
    }
}
