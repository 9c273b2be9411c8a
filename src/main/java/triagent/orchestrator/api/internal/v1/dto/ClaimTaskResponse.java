package triagent.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import triagent.orchestrator.api.v1.dto.TaskResponse;
import triagent.orchestrator.model.Task;

import java.util.Optional;

/**
 * Response DTO for a claim. {@code task} is absent when nothing was claimed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClaimTaskResponse(
        @JsonProperty("claimed") boolean claimed,
        @JsonProperty("task") TaskResponse task) {

    public static ClaimTaskResponse from(Optional<Task> claimed) {
        return claimed.map(task -> new ClaimTaskResponse(true, TaskResponse.from(task)))
                .orElseGet(() -> new ClaimTaskResponse(false, null));
    }
}
