package triagent.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import triagent.orchestrator.model.Priority;
import triagent.orchestrator.model.TaskType;

/**
 * Request DTO for enqueueing a task (idempotent on id).
 * POST /api/v1/tasks
 */
public record CreateTaskRequest(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("priority") String priority,
        @JsonProperty("payload") String payload,
        @JsonProperty("model") String model) {

    public void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id is required");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type is required");
        }
        taskType();
        taskPriority();
    }

    public TaskType taskType() {
        return TaskType.parse(type);
    }

    /** MEDIUM when absent */
    public Priority taskPriority() {
        return Priority.parse(priority);
    }
}
