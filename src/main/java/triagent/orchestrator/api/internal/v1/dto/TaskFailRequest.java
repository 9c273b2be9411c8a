package triagent.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for reporting an executor failure.
 * POST /internal/v1/tasks/{taskId}/fail
 */
public record TaskFailRequest(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("error") String error) {

    public void validate() {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (error == null || error.isBlank()) {
            throw new IllegalArgumentException("error is required");
        }
    }
}
