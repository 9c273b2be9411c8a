package triagent.orchestrator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import triagent.orchestrator.api.Controller;
import triagent.orchestrator.api.v1.dto.CreateTaskRequest;
import triagent.orchestrator.api.v1.dto.TaskDetailResponse;
import triagent.orchestrator.api.v1.dto.TaskResponse;
import triagent.orchestrator.model.ConsensusSession;
import triagent.orchestrator.model.Task;
import triagent.orchestrator.model.TaskState;
import triagent.orchestrator.server.RouterHandler;
import triagent.orchestrator.service.ConsensusService;
import triagent.orchestrator.service.LifecycleService;
import triagent.orchestrator.service.TaskService;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Task queue (public API).
 * POST /api/v1/tasks - Ensure a task exists (idempotent on id)
 * GET /api/v1/tasks?state=QUEUED&limit=50 - List tasks in a state
 * GET /api/v1/tasks/{id} - Task with reviews, escalations and events
 * POST /api/v1/tasks/{id}/fail - Operator: move a task to FAILED
 */
public class QueueController implements Controller {

    private static final Pattern TASK_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)$");
    private static final Pattern FAIL_PATTERN = Pattern.compile("^/api/v1/tasks/([^/]+)/fail$");
    private static final String TASKS_PATH = "/api/v1/tasks";
    private static final int DEFAULT_LIMIT = 50;
    private static final int MAX_LIMIT = 500;

    private final TaskService taskService;
    private final ConsensusService consensusService;
    private final LifecycleService lifecycleService;

    public QueueController(TaskService taskService, ConsensusService consensusService,
            LifecycleService lifecycleService) {
        this.taskService = taskService;
        this.consensusService = consensusService;
        this.lifecycleService = lifecycleService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return TASKS_PATH.equals(path) || FAIL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return TASKS_PATH.equals(path) || TASK_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (TASKS_PATH.equals(path)) {
                return req.method().equals(HttpMethod.POST) ? handleCreate(req) : handleList(req);
            }

            Matcher fail = FAIL_PATTERN.matcher(path);
            if (fail.matches()) {
                return handleFail(req, fail.group(1));
            }

            Matcher task = TASK_PATTERN.matcher(path);
            if (task.matches()) {
                return handleGet(task.group(1));
            }

            return ControllerResponse.notFound("unknown task endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }

    private ControllerResponse handleCreate(FullHttpRequest req) throws JsonProcessingException {
        CreateTaskRequest request = RouterHandler.mapper()
                .readValue(req.content().toString(StandardCharsets.UTF_8), CreateTaskRequest.class);
        request.validate();

        boolean created = taskService.ensureTaskExists(request.id(), request.name(), request.taskType(),
                request.taskPriority(), request.payload(), request.model());
        Task task = taskService.findById(request.id())
                .orElseThrow(() -> new IllegalStateException("Task vanished after insert: " + request.id()));

        return ControllerResponse.json(created ? HttpResponseStatus.CREATED : HttpResponseStatus.OK,
                RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
    }

    private ControllerResponse handleList(FullHttpRequest req) throws JsonProcessingException {
        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();
        String rawState = first(params, "state", "QUEUED");
        TaskState state;
        try {
            state = TaskState.valueOf(rawState.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown state: " + rawState, e);
        }
        int limit = parseLimit(first(params, "limit", String.valueOf(DEFAULT_LIMIT)));

        List<TaskResponse> tasks = taskService.findByState(state, limit).stream()
                .map(TaskResponse::from)
                .collect(Collectors.toList());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(tasks));
    }

    private ControllerResponse handleGet(String taskId) throws JsonProcessingException {
        Optional<Task> task = taskService.findById(taskId);
        if (task.isEmpty()) {
            return ControllerResponse.notFound("task not found: " + taskId);
        }

        List<TaskDetailResponse.Review> reviews = new ArrayList<>();
        for (ConsensusSession session : consensusService.sessionsForTask(taskId)) {
            reviews.add(new TaskDetailResponse.Review(session, consensusService.votes(session.id())));
        }

        TaskDetailResponse response = new TaskDetailResponse(
                TaskResponse.from(task.get()),
                reviews,
                lifecycleService.escalationsForTask(taskId),
                taskService.events(taskId));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    private ControllerResponse handleFail(FullHttpRequest req, String taskId) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        String reason = body.isBlank()
                ? "failed by operator"
                : RouterHandler.mapper().readTree(body).path("reason").asText("failed by operator");

        lifecycleService.fail(taskId, reason);
        Task task = taskService.findById(taskId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TaskResponse.from(task)));
    }

    private static String first(Map<String, List<String>> params, String name, String fallback) {
        List<String> values = params.get(name);
        return values == null || values.isEmpty() ? fallback : values.get(0);
    }

    private static int parseLimit(String raw) {
        try {
            int limit = Integer.parseInt(raw);
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive");
            }
            return Math.min(limit, MAX_LIMIT);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be a number", e);
        }
    }
}
