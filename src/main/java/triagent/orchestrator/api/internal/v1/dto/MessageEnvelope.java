package triagent.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Inter-agent message.
 * POST /internal/v1/messages
 *
 * @param source  sending agent: the voter for approve/reject, the worker for heartbeat
 * @param target  receiving agent: model hint for assign, worker or {@code *} for pause/resume
 * @param payload type-specific fields
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageEnvelope(
        @JsonProperty("id") String id,
        @JsonProperty("type") MessageType type,
        @JsonProperty("source") String source,
        @JsonProperty("target") String target,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("task_id") String taskId,
        @JsonProperty("payload") JsonNode payload,
        @JsonProperty("trace_id") String traceId) {

    public static final String ALL_WORKERS = "*";

    public void validate() {
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        switch (type) {
            case TASK_ASSIGN -> requireTask();
            case TASK_APPROVE, TASK_REJECT -> {
                requireTask();
                requireSource();
            }
            case HEARTBEAT -> requireSource();
            case CONTROL_PAUSE, CONTROL_RESUME -> {
                if (target == null || target.isBlank()) {
                    throw new IllegalArgumentException("target is required for " + type);
                }
            }
        }
    }

    /** Text field of the payload, or null. */
    public String payloadText(String field) {
        if (payload == null || !payload.hasNonNull(field)) {
            return null;
        }
        JsonNode node = payload.get(field);
        return node.isTextual() ? node.asText() : node.toString();
    }

    public double payloadDouble(String field, double fallback) {
        if (payload == null || !payload.hasNonNull(field)) {
            return fallback;
        }
        return payload.get(field).asDouble(fallback);
    }

    private void requireTask() {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("task_id is required for " + type);
        }
    }

    private void requireSource() {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source is required for " + type);
        }
    }
}
