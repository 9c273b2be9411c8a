package triagent.orchestrator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import triagent.orchestrator.api.Controller;
import triagent.orchestrator.server.RouterHandler;
import triagent.orchestrator.service.CircuitBreakerService;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Circuit breakers (public API).
 * GET /api/v1/breakers - State per capability
 * POST /api/v1/breakers/{capability}/reset - Operator reset to CLOSED
 */
public class BreakerController implements Controller {

    private static final String BREAKERS_PATH = "/api/v1/breakers";
    private static final Pattern RESET_PATTERN = Pattern.compile("^/api/v1/breakers/([^/]+)/reset$");

    private final CircuitBreakerService breakerService;

    public BreakerController(CircuitBreakerService breakerService) {
        this.breakerService = breakerService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return BREAKERS_PATH.equals(path);
        }
        return method.equals(HttpMethod.POST) && RESET_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (BREAKERS_PATH.equals(path)) {
                return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(breakerService.findAll()));
            }

            Matcher reset = RESET_PATTERN.matcher(path);
            if (reset.matches()) {
                String capability = reset.group(1);
                breakerService.reset(capability);
                return ControllerResponse.json(
                        RouterHandler.mapper().writeValueAsString(breakerService.state(capability)));
            }

            return ControllerResponse.notFound("unknown breaker endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.error("serialization failed: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }
}
