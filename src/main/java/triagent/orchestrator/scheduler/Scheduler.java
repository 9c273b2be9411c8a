package triagent.orchestrator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.config.OrchestratorConfig;
import triagent.orchestrator.service.BudgetGovernor;
import triagent.orchestrator.service.HeartbeatService;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinator background jobs:
 * - StaleWorkerReaper: recovers busy workers with stale heartbeats
 * - BudgetWatchdog: checks spend against the limits
 *
 * Single-threaded, so a budget halt and a recovery pass never run at the same time.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final StaleWorkerReaper workerReaper;
    private final BudgetWatchdog budgetWatchdog;
    private final OrchestratorConfig config;

    private volatile boolean running = false;

    public Scheduler(HeartbeatService heartbeatService, BudgetGovernor budgetGovernor, OrchestratorConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "triagent-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.workerReaper = new StaleWorkerReaper(heartbeatService);
        this.budgetWatchdog = new BudgetWatchdog(budgetGovernor);
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long recoveryMs = config.recoveryInterval().toMillis();
        executor.scheduleAtFixedRate(wrapRunnable("worker-reaper", workerReaper),
                recoveryMs, recoveryMs, TimeUnit.MILLISECONDS);
        log.info("Stale worker reaper scheduled every {}ms", recoveryMs);

        long budgetMs = config.budgetCheckInterval().toMillis();
        executor.scheduleWithFixedDelay(wrapRunnable("budget-watchdog", budgetWatchdog),
                budgetMs, budgetMs, TimeUnit.MILLISECONDS);
        log.info("Budget watchdog scheduled every {}ms", budgetMs);

        log.info("Scheduler started");
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * For a manual recovery pass.
     */
    public StaleWorkerReaper workerReaper() {
        return workerReaper;
    }

    /**
     * Keep one failing job from cancelling its schedule.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }
}
