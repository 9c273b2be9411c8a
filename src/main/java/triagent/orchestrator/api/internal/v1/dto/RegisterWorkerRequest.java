package triagent.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import triagent.orchestrator.model.TaskType;
import triagent.orchestrator.model.Worker;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Request DTO for worker registration (idempotent).
 * POST /internal/v1/workers/register
 */
public record RegisterWorkerRequest(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("pid") Long pid,
        @JsonProperty("host") String host,
        @JsonProperty("processStartedAt") Instant processStartedAt,
        @JsonProperty("shard") String shard,
        @JsonProperty("model") String model,
        @JsonProperty("specialization") List<String> specialization) {

    public void validate() {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
        if (pid != null && pid <= 0) {
            throw new IllegalArgumentException("pid must be positive");
        }
        specializationTypes();
    }

    public Set<TaskType> specializationTypes() {
        Set<TaskType> types = EnumSet.noneOf(TaskType.class);
        if (specialization != null) {
            for (String raw : specialization) {
                types.add(TaskType.parse(raw));
            }
        }
        return types;
    }

    public Worker toWorker() {
        return Worker.builder()
                .id(workerId)
                .pid(pid)
                .host(host)
                .processStartedAt(processStartedAt)
                .shard(shard)
                .model(model)
                .specialization(specializationTypes())
                .build();
    }
}
