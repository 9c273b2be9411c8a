package triagent.orchestrator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import triagent.orchestrator.api.Controller;
import triagent.orchestrator.api.v1.dto.WorkerResponse;
import triagent.orchestrator.server.RouterHandler;
import triagent.orchestrator.service.WorkerPoolService;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Worker pool status and pause control (public API).
 * GET /api/v1/workers - All registered workers
 * POST /api/v1/workers/{id}/pause - Request pause of one worker
 * POST /api/v1/workers/{id}/resume - Clear its pause request
 * POST /api/v1/workers/pause, /api/v1/workers/resume - Same for every live worker
 */
public class WorkerPoolController implements Controller {

    private static final String WORKERS_PATH = "/api/v1/workers";
    private static final Pattern ALL_PATTERN = Pattern.compile("^/api/v1/workers/(pause|resume)$");
    private static final Pattern ONE_PATTERN = Pattern.compile("^/api/v1/workers/([^/]+)/(pause|resume)$");

    private final WorkerPoolService workerPoolService;

    public WorkerPoolController(WorkerPoolService workerPoolService) {
        this.workerPoolService = workerPoolService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return WORKERS_PATH.equals(path);
        }
        return method.equals(HttpMethod.POST)
                && (ALL_PATTERN.matcher(path).matches() || ONE_PATTERN.matcher(path).matches());
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (WORKERS_PATH.equals(path)) {
                List<WorkerResponse> workers = workerPoolService.findAll().stream()
                        .map(WorkerResponse::from)
                        .collect(Collectors.toList());
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(workers));
            }

            Matcher all = ALL_PATTERN.matcher(path);
            if (all.matches()) {
                boolean pause = "pause".equals(all.group(1));
                int count = pause ? workerPoolService.requestPauseAll() : workerPoolService.requestResumeAll();
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(Map.of("workers", count)));
            }

            Matcher one = ONE_PATTERN.matcher(path);
            if (one.matches()) {
                String workerId = one.group(1);
                boolean pause = "pause".equals(one.group(2));
                boolean found = pause
                        ? workerPoolService.requestPause(workerId)
                        : workerPoolService.requestResume(workerId);
                if (!found) {
                    return ControllerResponse.notFound("worker not found: " + workerId);
                }
                return ControllerResponse.json(RouterHandler.mapper()
                        .writeValueAsString(Map.of("workerId", workerId, "pauseRequested", pause)));
            }

            return ControllerResponse.notFound("unknown worker endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.error("serialization failed: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }
}
