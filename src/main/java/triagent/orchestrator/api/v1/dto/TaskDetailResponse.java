package triagent.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import triagent.orchestrator.model.AuditEvent;
import triagent.orchestrator.model.ConsensusSession;
import triagent.orchestrator.model.Escalation;
import triagent.orchestrator.model.Vote;

import java.util.List;

/**
 * Task with its review rounds, escalations and event history.
 * GET /api/v1/tasks/{id}
 */
public record TaskDetailResponse(
        @JsonProperty("task") TaskResponse task,
        @JsonProperty("reviews") List<Review> reviews,
        @JsonProperty("escalations") List<Escalation> escalations,
        @JsonProperty("events") List<AuditEvent> events) {

    /**
     * One consensus session and its votes.
     */
    public record Review(
            @JsonProperty("session") ConsensusSession session,
            @JsonProperty("votes") List<Vote> votes) {
    }
}
