package triagent.orchestrator.repository;

import triagent.orchestrator.model.AuditEvent;
import triagent.orchestrator.model.EventType;

import java.util.List;

/**
 * Repository interface for the append-only event log.
 */
public interface AuditRepository {

    /**
     * Append an event. Missing timestamp is filled with the current time.
     */
    void record(AuditEvent event);

    /**
     * Events of one task, oldest first.
     */
    List<AuditEvent> findByTask(String taskId);

    /**
     * Most recent events, newest first.
     */
    List<AuditEvent> findRecent(int limit);

    /**
     * Count events of one type for a task.
     */
    int countByTaskAndType(String taskId, EventType type);
}
