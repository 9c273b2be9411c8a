package triagent.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Request DTO for worker heartbeat.
 * POST /internal/v1/heartbeat
 */
public record HeartbeatRequest(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("taskId") String taskId,
        @JsonProperty("progress") double progress,
        @JsonProperty("expectedTimeoutSeconds") Long expectedTimeoutSeconds) {

    public void validate() {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (progress < 0 || progress > 1) {
            throw new IllegalArgumentException("progress must be between 0 and 1");
        }
        if (expectedTimeoutSeconds != null && expectedTimeoutSeconds < 0) {
            throw new IllegalArgumentException("expectedTimeoutSeconds must be non-negative");
        }
    }

    public Duration expectedTimeout() {
        return expectedTimeoutSeconds != null ? Duration.ofSeconds(expectedTimeoutSeconds) : null;
    }
}
