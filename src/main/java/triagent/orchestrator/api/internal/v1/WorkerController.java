package triagent.orchestrator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import triagent.orchestrator.api.Controller;
import triagent.orchestrator.api.internal.v1.dto.HeartbeatRequest;
import triagent.orchestrator.api.internal.v1.dto.OperationResponse;
import triagent.orchestrator.api.internal.v1.dto.RegisterWorkerRequest;
import triagent.orchestrator.api.v1.dto.WorkerResponse;
import triagent.orchestrator.model.Worker;
import triagent.orchestrator.server.RouterHandler;
import triagent.orchestrator.service.HeartbeatService;
import triagent.orchestrator.service.WorkerPoolService;

import java.nio.charset.StandardCharsets;

/**
 * Worker registration and heartbeats (internal API).
 * POST /internal/v1/workers/register - Register or re-register a worker
 * POST /internal/v1/heartbeat - Worker heartbeat
 */
public class WorkerController implements Controller {

    private static final String REGISTER_PATH = "/internal/v1/workers/register";
    private static final String HEARTBEAT_PATH = "/internal/v1/heartbeat";

    private final WorkerPoolService workerPoolService;
    private final HeartbeatService heartbeatService;

    public WorkerController(WorkerPoolService workerPoolService, HeartbeatService heartbeatService) {
        this.workerPoolService = workerPoolService;
        this.heartbeatService = heartbeatService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && (REGISTER_PATH.equals(path) || HEARTBEAT_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        try {
            return REGISTER_PATH.equals(path) ? handleRegister(body) : handleHeartbeat(body);
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }

    private ControllerResponse handleRegister(String body) throws JsonProcessingException {
        RegisterWorkerRequest request = RouterHandler.mapper().readValue(body, RegisterWorkerRequest.class);
        request.validate();

        Worker stored = workerPoolService.register(request.toWorker());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(WorkerResponse.from(stored)));
    }

    private ControllerResponse handleHeartbeat(String body) throws JsonProcessingException {
        HeartbeatRequest request = RouterHandler.mapper().readValue(body, HeartbeatRequest.class);
        request.validate();

        boolean known = heartbeatService.heartbeat(request.workerId(), request.taskId(), request.progress(),
                request.expectedTimeout());
        if (!known) {
            return ControllerResponse.json(HttpResponseStatus.NOT_FOUND, RouterHandler.mapper()
                    .writeValueAsString(OperationResponse.error(null, "unknown worker, register first")));
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(OperationResponse.success(null)));
    }
}
