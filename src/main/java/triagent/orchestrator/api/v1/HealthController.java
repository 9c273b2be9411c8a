package triagent.orchestrator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.api.Controller;
import triagent.orchestrator.api.v1.dto.HealthResponse;
import triagent.orchestrator.model.TaskState;
import triagent.orchestrator.model.WorkerStatus;
import triagent.orchestrator.server.RouterHandler;
import triagent.orchestrator.service.BudgetGovernor;
import triagent.orchestrator.service.TaskService;
import triagent.orchestrator.service.WorkerPoolService;
import triagent.orchestrator.store.Database;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final TaskService taskService;
    private final WorkerPoolService workerPoolService;
    private final BudgetGovernor budgetGovernor;

    public HealthController(Database database, TaskService taskService, WorkerPoolService workerPoolService,
            BudgetGovernor budgetGovernor) {
        this.database = database;
        this.taskService = taskService;
        this.workerPoolService = workerPoolService;
        this.budgetGovernor = budgetGovernor;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy("connection failed")));
            }

            Map<String, Integer> tasks = new LinkedHashMap<>();
            for (TaskState state : TaskState.values()) {
                tasks.put(state.name(), taskService.countByState(state));
            }
            Map<String, Integer> workers = new LinkedHashMap<>();
            for (WorkerStatus status : WorkerStatus.values()) {
                workers.put(status.dbValue(), workerPoolService.countByStatus(status));
            }

            HealthResponse response = HealthResponse.healthy(formatUptime(), VERSION, budgetGovernor.isHalted(),
                    tasks, taskService.queuedPerShard(), workers);
            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.unavailable("health check failed: " + e.getMessage());
        }
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
