package triagent.orchestrator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import triagent.orchestrator.api.Controller;
import triagent.orchestrator.api.v1.dto.OperatorRequest;
import triagent.orchestrator.server.RouterHandler;
import triagent.orchestrator.service.LifecycleService;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Escalations awaiting a human (public API).
 * GET /api/v1/escalations - Open escalations
 * POST /api/v1/escalations/{id}/resolve - Close one; the task stays ESCALATED
 */
public class EscalationController implements Controller {

    private static final String ESCALATIONS_PATH = "/api/v1/escalations";
    private static final Pattern RESOLVE_PATTERN = Pattern.compile("^/api/v1/escalations/(\\d+)/resolve$");

    private final LifecycleService lifecycleService;

    public EscalationController(LifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return ESCALATIONS_PATH.equals(path);
        }
        return method.equals(HttpMethod.POST) && RESOLVE_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (ESCALATIONS_PATH.equals(path)) {
                return ControllerResponse.json(
                        RouterHandler.mapper().writeValueAsString(lifecycleService.openEscalations()));
            }

            Matcher resolve = RESOLVE_PATTERN.matcher(path);
            if (resolve.matches()) {
                long id = Long.parseLong(resolve.group(1));
                OperatorRequest request = RouterHandler.mapper()
                        .readValue(req.content().toString(StandardCharsets.UTF_8), OperatorRequest.class);
                request.validate();

                if (!lifecycleService.resolveEscalation(id, request.operator())) {
                    return ControllerResponse.notFound("no open escalation " + id);
                }
                return ControllerResponse.json(
                        RouterHandler.mapper().writeValueAsString(Map.of("id", id, "status", "RESOLVED")));
            }

            return ControllerResponse.notFound("unknown escalation endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }
}
