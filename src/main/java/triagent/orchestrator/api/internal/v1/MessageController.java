package triagent.orchestrator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.api.Controller;
import triagent.orchestrator.api.internal.v1.dto.MessageEnvelope;
import triagent.orchestrator.model.ConsensusResult;
import triagent.orchestrator.model.ConsensusSession;
import triagent.orchestrator.model.Priority;
import triagent.orchestrator.model.TaskType;
import triagent.orchestrator.model.VoteOutcome;
import triagent.orchestrator.model.VoteValue;
import triagent.orchestrator.server.RouterHandler;
import triagent.orchestrator.service.ConsensusService;
import triagent.orchestrator.service.HeartbeatService;
import triagent.orchestrator.service.LifecycleService;
import triagent.orchestrator.service.TaskService;
import triagent.orchestrator.service.WorkerPoolService;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Inter-agent message intake (internal API).
 * POST /internal/v1/messages
 *
 * TASK_ASSIGN enqueues, TASK_APPROVE / TASK_REJECT vote on the task's open review,
 * HEARTBEAT refreshes the source worker, CONTROL_PAUSE / CONTROL_RESUME set the
 * pause flag of the target worker or of every worker.
 */
public class MessageController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(MessageController.class);
    private static final String PATH = "/internal/v1/messages";

    private final TaskService taskService;
    private final ConsensusService consensusService;
    private final LifecycleService lifecycleService;
    private final HeartbeatService heartbeatService;
    private final WorkerPoolService workerPoolService;

    public MessageController(TaskService taskService, ConsensusService consensusService,
            LifecycleService lifecycleService, HeartbeatService heartbeatService,
            WorkerPoolService workerPoolService) {
        this.taskService = taskService;
        this.consensusService = consensusService;
        this.lifecycleService = lifecycleService;
        this.heartbeatService = heartbeatService;
        this.workerPoolService = workerPoolService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            MessageEnvelope message = RouterHandler.mapper()
                    .readValue(req.content().toString(StandardCharsets.UTF_8), MessageEnvelope.class);
            message.validate();
            log.debug("Message {} {} from {} to {}", message.id(), message.type(), message.source(),
                    message.target());

            Map<String, Object> reply = new LinkedHashMap<>();
            reply.put("id", message.id());
            reply.put("type", message.type());

            HttpResponseStatus status = switch (message.type()) {
                case TASK_ASSIGN -> assign(message, reply);
                case TASK_APPROVE -> vote(message, VoteValue.APPROVE, reply);
                case TASK_REJECT -> vote(message, VoteValue.REJECT, reply);
                case HEARTBEAT -> heartbeat(message, reply);
                case CONTROL_PAUSE -> control(message, true, reply);
                case CONTROL_RESUME -> control(message, false, reply);
            };
            return ControllerResponse.json(status, RouterHandler.mapper().writeValueAsString(reply));

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid message: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }

    private HttpResponseStatus assign(MessageEnvelope message, Map<String, Object> reply) {
        String name = message.payloadText("name");
        TaskType type = TaskType.parse(Optional.ofNullable(message.payloadText("type")).orElse("IMPLEMENTATION"));
        Priority priority = Priority.parse(message.payloadText("priority"));
        String body = message.payloadText("body");

        boolean created = taskService.ensureTaskExists(message.taskId(), name, type, priority, body,
                message.target());
        reply.put("created", created);
        return HttpResponseStatus.OK;
    }

    private HttpResponseStatus vote(MessageEnvelope message, VoteValue value, Map<String, Object> reply) {
        Optional<ConsensusSession> session = consensusService.findOpenByTask(message.taskId());
        if (session.isEmpty()) {
            reply.put("error", "no open review for task " + message.taskId());
            return HttpResponseStatus.NOT_FOUND;
        }

        long durationMs = (long) message.payloadDouble("duration_ms", 0);
        VoteOutcome outcome = consensusService.recordVote(session.get().id(), message.source(), value,
                message.payloadText("reason"), Duration.ofMillis(durationMs));
        reply.put("vote", outcome);
        if (!outcome.accepted()) {
            return HttpResponseStatus.CONFLICT;
        }

        ConsensusResult result = consensusService.evaluate(session.get().id());
        reply.put("consensus", result);
        if (result.isFinal()) {
            reply.put("state", lifecycleService.applyConsensus(message.taskId(), result));
        }
        return HttpResponseStatus.OK;
    }

    private HttpResponseStatus heartbeat(MessageEnvelope message, Map<String, Object> reply) {
        boolean known = heartbeatService.heartbeat(message.source(), message.taskId(),
                message.payloadDouble("progress", 0.0), null);
        reply.put("known", known);
        return known ? HttpResponseStatus.OK : HttpResponseStatus.NOT_FOUND;
    }

    private HttpResponseStatus control(MessageEnvelope message, boolean pause, Map<String, Object> reply) {
        if (MessageEnvelope.ALL_WORKERS.equals(message.target())) {
            int count = pause ? workerPoolService.requestPauseAll() : workerPoolService.requestResumeAll();
            reply.put("workers", count);
            return HttpResponseStatus.OK;
        }
        boolean found = pause
                ? workerPoolService.requestPause(message.target())
                : workerPoolService.requestResume(message.target());
        reply.put("workers", found ? 1 : 0);
        return found ? HttpResponseStatus.OK : HttpResponseStatus.NOT_FOUND;
    }
}
