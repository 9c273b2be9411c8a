package triagent.orchestrator.model;

import java.util.Set;

/**
 * Filters applied when a worker claims. Null or empty means "any".
 */
public record ClaimFilter(String shard, String model, Set<TaskType> types) {

    public static ClaimFilter any() {
        return new ClaimFilter(null, null, Set.of());
    }

    public static ClaimFilter forWorker(Worker worker) {
        return new ClaimFilter(worker.shard(), worker.model(), worker.specialization());
    }
}
