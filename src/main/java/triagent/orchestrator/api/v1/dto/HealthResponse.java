package triagent.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("killSwitchActive") Boolean killSwitchActive,
        @JsonProperty("tasksByState") Map<String, Integer> tasksByState,
        @JsonProperty("queuedByShard") Map<String, Integer> queuedByShard,
        @JsonProperty("workersByStatus") Map<String, Integer> workersByStatus) {

    public static HealthResponse healthy(String uptime, String version, boolean killSwitchActive,
            Map<String, Integer> tasksByState, Map<String, Integer> queuedByShard,
            Map<String, Integer> workersByStatus) {
        return new HealthResponse("healthy", "ok", uptime, version, killSwitchActive, tasksByState, queuedByShard,
                workersByStatus);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}
