package triagent.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for submitting an execution result for review.
 * POST /internal/v1/tasks/{taskId}/submit
 *
 * @param capability model that produced the result; the task's assigned model when absent
 */
public record SubmitTaskRequest(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("capability") String capability,
        @JsonProperty("result") String result) {

    public void validate() {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (result == null) {
            throw new IllegalArgumentException("result is required");
        }
    }
}
