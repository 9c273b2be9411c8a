package triagent.orchestrator.service;

import triagent.orchestrator.model.TaskRoute;
import triagent.orchestrator.model.TaskType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Single routing table from task type to implementing capability and lane.
 * SECURITY always goes to the highest-trust capability, regardless of load.
 */
public final class TaskRouter {

    private static final Map<TaskType, TaskRoute> ROUTES = new EnumMap<>(TaskType.class);

    static {
        ROUTES.put(TaskType.IMPLEMENTATION, new TaskRoute("codex", "impl"));
        ROUTES.put(TaskType.REVIEW, new TaskRoute("claude", "review"));
        ROUTES.put(TaskType.ANALYSIS, new TaskRoute("gemini", "analysis"));
        ROUTES.put(TaskType.SECURITY, new TaskRoute("claude", "review"));
    }

    public TaskRoute route(TaskType type) {
        if (type == null) {
            throw new IllegalArgumentException("task type is required");
        }
        return ROUTES.get(type);
    }

    public Map<TaskType, TaskRoute> routes() {
        return Collections.unmodifiableMap(ROUTES);
    }
}
