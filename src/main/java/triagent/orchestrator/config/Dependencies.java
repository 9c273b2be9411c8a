package triagent.orchestrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.api.internal.v1.MessageController;
import triagent.orchestrator.api.internal.v1.TaskController;
import triagent.orchestrator.api.internal.v1.WorkerController;
import triagent.orchestrator.api.v1.BreakerController;
import triagent.orchestrator.api.v1.BudgetController;
import triagent.orchestrator.api.v1.EscalationController;
import triagent.orchestrator.api.v1.HealthController;
import triagent.orchestrator.api.v1.QueueController;
import triagent.orchestrator.api.v1.WorkerPoolController;
import triagent.orchestrator.executor.ModelExecutor;
import triagent.orchestrator.executor.ProcessModelExecutor;
import triagent.orchestrator.model.Worker;
import triagent.orchestrator.repository.AuditRepository;
import triagent.orchestrator.repository.BreakerRepository;
import triagent.orchestrator.repository.BudgetRepository;
import triagent.orchestrator.repository.ConsensusRepository;
import triagent.orchestrator.repository.EscalationRepository;
import triagent.orchestrator.repository.TaskRepository;
import triagent.orchestrator.repository.WorkerRepository;
import triagent.orchestrator.scheduler.Scheduler;
import triagent.orchestrator.server.RouterHandler;
import triagent.orchestrator.service.BudgetGovernor;
import triagent.orchestrator.service.CircuitBreakerService;
import triagent.orchestrator.service.ConsensusService;
import triagent.orchestrator.service.HeartbeatService;
import triagent.orchestrator.service.LifecycleService;
import triagent.orchestrator.service.OsProcessProbe;
import triagent.orchestrator.service.ProcessProbe;
import triagent.orchestrator.service.ReviewService;
import triagent.orchestrator.service.ShardRouter;
import triagent.orchestrator.service.SpendMeter;
import triagent.orchestrator.service.TaskRouter;
import triagent.orchestrator.service.TaskService;
import triagent.orchestrator.service.WorkerPoolService;
import triagent.orchestrator.store.Database;
import triagent.orchestrator.store.JdbcAuditRepository;
import triagent.orchestrator.store.JdbcBreakerRepository;
import triagent.orchestrator.store.JdbcBudgetRepository;
import triagent.orchestrator.store.JdbcConsensusRepository;
import triagent.orchestrator.store.JdbcEscalationRepository;
import triagent.orchestrator.store.JdbcTaskRepository;
import triagent.orchestrator.store.JdbcWorkerRepository;
import triagent.orchestrator.worker.CancellationToken;
import triagent.orchestrator.worker.WorkerRunner;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(OrchestratorConfig.fromEnv());
 * deps.startScheduler(); // recovery pass and budget check
 * TaskService taskService = deps.taskService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final OrchestratorConfig config;
    private final Clock clock;
    private final ModelExecutor executor;
    private final Database database;

    private final TaskRepository taskRepository;
    private final WorkerRepository workerRepository;
    private final ConsensusRepository consensusRepository;
    private final BreakerRepository breakerRepository;
    private final BudgetRepository budgetRepository;
    private final AuditRepository auditRepository;
    private final EscalationRepository escalationRepository;

    private final TaskService taskService;
    private final WorkerPoolService workerPoolService;
    private final HeartbeatService heartbeatService;
    private final ConsensusService consensusService;
    private final LifecycleService lifecycleService;
    private final CircuitBreakerService breakerService;
    private final BudgetGovernor budgetGovernor;
    private final ReviewService reviewService;
    private final SpendMeter spendMeter;

    private RouterHandler routerHandler;
    private Scheduler scheduler;

    private Dependencies(OrchestratorConfig config, Clock clock, ProcessProbe processProbe, ModelExecutor executor,
            SpendMeter spendMeter) {
        this.config = config;
        this.clock = clock;
        this.executor = executor;
        this.spendMeter = spendMeter;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.taskRepository = new JdbcTaskRepository(database);
        this.workerRepository = new JdbcWorkerRepository(database);
        this.consensusRepository = new JdbcConsensusRepository(database);
        this.breakerRepository = new JdbcBreakerRepository(database);
        this.budgetRepository = new JdbcBudgetRepository(database);
        this.auditRepository = new JdbcAuditRepository(database);
        this.escalationRepository = new JdbcEscalationRepository(database);

        // Services
        this.taskService = new TaskService(taskRepository, auditRepository, new TaskRouter(),
                new ShardRouter(config.shardCount()), config, clock);
        this.workerPoolService = new WorkerPoolService(workerRepository, taskRepository, budgetRepository,
                auditRepository, taskService, config, clock);
        this.heartbeatService = new HeartbeatService(workerRepository, taskRepository, auditRepository,
                processProbe, config, clock);
        this.consensusService = new ConsensusService(consensusRepository, auditRepository, config, clock);
        this.lifecycleService = new LifecycleService(taskRepository, escalationRepository, auditRepository,
                consensusService, workerPoolService, clock);
        this.breakerService = new CircuitBreakerService(breakerRepository, config, clock);
        this.budgetGovernor = new BudgetGovernor(budgetRepository, auditRepository, workerPoolService,
                heartbeatService, processProbe, config, clock);
        this.reviewService = new ReviewService(consensusService, lifecycleService, taskService, breakerService,
                budgetGovernor, executor, spendMeter, config, clock);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, the system clock, OS process control
     * and the process-based executor.
     */
    public static Dependencies create(OrchestratorConfig config) {
        return new Dependencies(config, Clock.systemUTC(), new OsProcessProbe(),
                new ProcessModelExecutor(config.executorCommands()), SpendMeter.NONE);
    }

    /**
     * Create dependencies with replaceable time, process control and executor.
     */
    public static Dependencies create(OrchestratorConfig config, Clock clock, ProcessProbe processProbe,
            ModelExecutor executor) {
        return new Dependencies(config, clock, processProbe, executor, SpendMeter.NONE);
    }

    public static Dependencies create(OrchestratorConfig config, Clock clock, ProcessProbe processProbe,
            ModelExecutor executor, SpendMeter spendMeter) {
        return new Dependencies(config, clock, processProbe, executor, spendMeter);
    }

    // Getters
    public OrchestratorConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public WorkerRepository workerRepository() {
        return workerRepository;
    }

    public AuditRepository auditRepository() {
        return auditRepository;
    }

    public ConsensusRepository consensusRepository() {
        return consensusRepository;
    }

    public EscalationRepository escalationRepository() {
        return escalationRepository;
    }

    public TaskService taskService() {
        return taskService;
    }

    public WorkerPoolService workerPoolService() {
        return workerPoolService;
    }

    public HeartbeatService heartbeatService() {
        return heartbeatService;
    }

    public ConsensusService consensusService() {
        return consensusService;
    }

    public LifecycleService lifecycleService() {
        return lifecycleService;
    }

    public CircuitBreakerService breakerService() {
        return breakerService;
    }

    public BudgetGovernor budgetGovernor() {
        return budgetGovernor;
    }

    public ReviewService reviewService() {
        return reviewService;
    }

    /**
     * A worker loop wired to these services.
     */
    public WorkerRunner workerRunner(Worker registration, CancellationToken token) {
        return new WorkerRunner(registration, workerPoolService, heartbeatService, lifecycleService, reviewService,
                breakerService, budgetGovernor, executor, spendMeter, config, token);
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    // public API
                    .registerController(new HealthController(database, taskService, workerPoolService,
                            budgetGovernor))
                    .registerController(new QueueController(taskService, consensusService, lifecycleService))
                    .registerController(new WorkerPoolController(workerPoolService))
                    .registerController(new BudgetController(budgetGovernor))
                    .registerController(new EscalationController(lifecycleService))
                    .registerController(new BreakerController(breakerService))
                    // internal API
                    .registerController(new WorkerController(workerPoolService, heartbeatService))
                    .registerController(new TaskController(workerPoolService, lifecycleService))
                    .registerController(new MessageController(taskService, consensusService, lifecycleService,
                            heartbeatService, workerPoolService));
            log.info("RouterHandler created with {} controllers", 9);
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(heartbeatService, budgetGovernor, config);
        }
        return scheduler;
    }

    /**
     * Start the stale worker reaper and the budget watchdog.
     * Only the coordinator process runs these.
     */
    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
