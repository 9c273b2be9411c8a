package triagent.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import triagent.orchestrator.model.Task;

import java.time.Instant;

/**
 * Task as seen over HTTP.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("priority") String priority,
        @JsonProperty("state") String state,
        @JsonProperty("shard") String shard,
        @JsonProperty("assignedModel") String assignedModel,
        @JsonProperty("lane") String lane,
        @JsonProperty("workerId") String workerId,
        @JsonProperty("payload") String payload,
        @JsonProperty("result") String result,
        @JsonProperty("feedback") String feedback,
        @JsonProperty("error") String error,
        @JsonProperty("traceId") String traceId,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("maxRetries") int maxRetries) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.id(),
                task.name(),
                task.type().name(),
                task.priority().name(),
                task.state().name(),
                task.shard(),
                task.assignedModel(),
                task.lane(),
                task.workerId(),
                task.payload(),
                task.result(),
                task.feedback(),
                task.error(),
                task.traceId(),
                task.createdAt(),
                task.startedAt(),
                task.completedAt(),
                task.retryCount(),
                task.maxRetries());
    }
}
