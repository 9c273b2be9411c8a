package triagent.orchestrator.model;

import java.time.Instant;

/**
 * Incident opened when a task reaches ESCALATED. Resolving it does not move the task.
 */
public record Escalation(
        long id,
        String taskId,
        String reason,
        String severity,
        EscalationStatus status,
        Instant createdAt,
        Instant resolvedAt,
        String resolvedBy) {
}
