package triagent.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import triagent.orchestrator.model.TaskType;
import triagent.orchestrator.model.Worker;

import java.time.Instant;
import java.util.List;

/**
 * Worker as seen over HTTP.
 * GET /api/v1/workers
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerResponse(
        @JsonProperty("id") String id,
        @JsonProperty("pid") Long pid,
        @JsonProperty("status") String status,
        @JsonProperty("shard") String shard,
        @JsonProperty("model") String model,
        @JsonProperty("specialization") List<String> specialization,
        @JsonProperty("pauseRequested") boolean pauseRequested,
        @JsonProperty("lastHeartbeat") Instant lastHeartbeat,
        @JsonProperty("tasksCompleted") int tasksCompleted,
        @JsonProperty("tasksFailed") int tasksFailed,
        @JsonProperty("crashCount") int crashCount,
        @JsonProperty("registeredAt") Instant registeredAt) {

    public static WorkerResponse from(Worker worker) {
        return new WorkerResponse(
                worker.id(),
                worker.pid(),
                worker.status().dbValue(),
                worker.shard(),
                worker.model(),
                worker.specialization().stream().map(TaskType::name).sorted().toList(),
                worker.pauseRequested(),
                worker.lastHeartbeat(),
                worker.tasksCompleted(),
                worker.tasksFailed(),
                worker.crashCount(),
                worker.registeredAt());
    }
}
