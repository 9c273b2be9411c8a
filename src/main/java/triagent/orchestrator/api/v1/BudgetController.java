package triagent.orchestrator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import triagent.orchestrator.api.Controller;
import triagent.orchestrator.api.v1.dto.OperatorRequest;
import triagent.orchestrator.api.v1.dto.SpendRequest;
import triagent.orchestrator.server.RouterHandler;
import triagent.orchestrator.service.BudgetGovernor;

import java.nio.charset.StandardCharsets;

/**
 * Budget and kill switch (public API).
 * GET /api/v1/budget - Spend rate, daily spend, kill switch status
 * POST /api/v1/budget/spend - Append a ledger entry
 * POST /api/v1/budget/reset - Operator reset of the kill switch
 */
public class BudgetController implements Controller {

    private static final String BUDGET_PATH = "/api/v1/budget";
    private static final String SPEND_PATH = "/api/v1/budget/spend";
    private static final String RESET_PATH = "/api/v1/budget/reset";

    private final BudgetGovernor budgetGovernor;

    public BudgetController(BudgetGovernor budgetGovernor) {
        this.budgetGovernor = budgetGovernor;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return BUDGET_PATH.equals(path);
        }
        return method.equals(HttpMethod.POST) && (SPEND_PATH.equals(path) || RESET_PATH.equals(path));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        try {
            if (SPEND_PATH.equals(path)) {
                SpendRequest request = RouterHandler.mapper().readValue(body, SpendRequest.class);
                request.validate();
                budgetGovernor.recordSpend(request.amount(), request.capability(), request.taskId());
                return ControllerResponse.json(HttpResponseStatus.CREATED,
                        RouterHandler.mapper().writeValueAsString(budgetGovernor.status()));
            }

            if (RESET_PATH.equals(path)) {
                OperatorRequest request = RouterHandler.mapper().readValue(body, OperatorRequest.class);
                request.validate();
                if (!budgetGovernor.reset(request.operator())) {
                    return ControllerResponse.conflict("kill switch is not active");
                }
            }

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(budgetGovernor.status()));

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }
}
