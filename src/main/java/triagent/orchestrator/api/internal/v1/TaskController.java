package triagent.orchestrator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import triagent.orchestrator.api.Controller;
import triagent.orchestrator.api.internal.v1.dto.ClaimTaskResponse;
import triagent.orchestrator.api.internal.v1.dto.OperationResponse;
import triagent.orchestrator.api.internal.v1.dto.SubmitTaskRequest;
import triagent.orchestrator.api.internal.v1.dto.TaskFailRequest;
import triagent.orchestrator.api.internal.v1.dto.WorkerRequest;
import triagent.orchestrator.model.FailResult;
import triagent.orchestrator.model.SubmitResult;
import triagent.orchestrator.model.Task;
import triagent.orchestrator.server.RouterHandler;
import triagent.orchestrator.service.LifecycleService;
import triagent.orchestrator.service.WorkerPoolService;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Task operations for workers (internal API).
 * POST /internal/v1/tasks/claim - Claim the next task for a worker
 * POST /internal/v1/tasks/{taskId}/submit - Submit a result for review (idempotent)
 * POST /internal/v1/tasks/{taskId}/fail - Report an executor failure (idempotent)
 * POST /internal/v1/tasks/{taskId}/release - Give a task back without penalty
 */
public class TaskController implements Controller {

    private static final Pattern CLAIM_PATTERN = Pattern.compile("^/internal/v1/tasks/claim$");
    private static final Pattern ACTION_PATTERN = Pattern.compile("^/internal/v1/tasks/([^/]+)/(submit|fail|release)$");

    private final WorkerPoolService workerPoolService;
    private final LifecycleService lifecycleService;

    public TaskController(WorkerPoolService workerPoolService, LifecycleService lifecycleService) {
        this.workerPoolService = workerPoolService;
        this.lifecycleService = lifecycleService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return CLAIM_PATTERN.matcher(path).matches() || ACTION_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        try {
            if (CLAIM_PATTERN.matcher(path).matches()) {
                return handleClaim(body);
            }

            Matcher action = ACTION_PATTERN.matcher(path);
            if (action.matches()) {
                String taskId = action.group(1);
                return switch (action.group(2)) {
                    case "submit" -> handleSubmit(body, taskId);
                    case "fail" -> handleFail(body, taskId);
                    default -> handleRelease(body, taskId);
                };
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }

    /**
     * Kill switch active surfaces as 503 through the router.
     */
    private ControllerResponse handleClaim(String body) throws JsonProcessingException {
        WorkerRequest request = RouterHandler.mapper().readValue(body, WorkerRequest.class);
        request.validate();

        Optional<Task> claimed = workerPoolService.claimForWorker(request.workerId());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(ClaimTaskResponse.from(claimed)));
    }

    private ControllerResponse handleSubmit(String body, String taskId) throws JsonProcessingException {
        SubmitTaskRequest request = RouterHandler.mapper().readValue(body, SubmitTaskRequest.class);
        request.validate();

        SubmitResult result = lifecycleService.submitForReview(taskId, request.workerId(), request.capability(),
                request.result());

        return switch (result) {
            case SUBMITTED, ALREADY_SUBMITTED -> ok(result.name());
            case NOT_FOUND -> failed(HttpResponseStatus.NOT_FOUND, result.name(), "task not found");
            case WRONG_WORKER -> failed(HttpResponseStatus.CONFLICT, result.name(),
                    "task not assigned to this worker");
        };
    }

    private ControllerResponse handleFail(String body, String taskId) throws JsonProcessingException {
        TaskFailRequest request = RouterHandler.mapper().readValue(body, TaskFailRequest.class);
        request.validate();

        FailResult result = lifecycleService.failExecution(taskId, request.workerId(), request.error());

        return switch (result) {
            case RETRIED, ESCALATED, ALREADY_TERMINAL -> ok(result.name());
            case NOT_FOUND -> failed(HttpResponseStatus.NOT_FOUND, result.name(), "task not found");
            case WRONG_WORKER -> failed(HttpResponseStatus.CONFLICT, result.name(),
                    "task not assigned to this worker");
        };
    }

    private ControllerResponse handleRelease(String body, String taskId) throws JsonProcessingException {
        WorkerRequest request = RouterHandler.mapper().readValue(body, WorkerRequest.class);
        request.validate();

        if (workerPoolService.release(taskId, request.workerId())) {
            return ok("RELEASED");
        }
        return failed(HttpResponseStatus.CONFLICT, "NOT_RELEASED", "task not RUNNING under this worker");
    }

    private static ControllerResponse ok(String outcome) throws JsonProcessingException {
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success(outcome)));
    }

    private static ControllerResponse failed(HttpResponseStatus status, String outcome, String error)
            throws JsonProcessingException {
        return ControllerResponse.json(status,
                RouterHandler.mapper().writeValueAsString(OperationResponse.error(outcome, error)));
    }
}
