package triagent.orchestrator.model;

import java.time.Instant;

public record AuditEvent(
        Long id,
        String taskId,
        String workerId,
        EventType type,
        String actor,
        String detail,
        String traceId,
        Instant createdAt) {

    public static AuditEvent of(EventType type, String taskId, String workerId, String actor, String detail) {
        return new AuditEvent(null, taskId, workerId, type, actor, detail, null, null);
    }

    public AuditEvent withTraceId(String trace) {
        return new AuditEvent(id, taskId, workerId, type, actor, detail, trace, createdAt);
    }
}
