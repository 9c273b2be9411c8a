package triagent.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body carrying only the calling worker.
 * POST /internal/v1/tasks/claim, POST /internal/v1/tasks/{taskId}/release
 */
public record WorkerRequest(
        @JsonProperty("workerId") String workerId) {

    public void validate() {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
    }
}
