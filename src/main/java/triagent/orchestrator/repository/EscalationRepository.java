package triagent.orchestrator.repository;

import triagent.orchestrator.model.Escalation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for escalation incidents.
 */
public interface EscalationRepository {

    /**
     * Open an incident for a task.
     *
     * @return generated id
     */
    long open(String taskId, String reason, String severity, Instant now);

    Optional<Escalation> findById(long id);

    List<Escalation> findOpen();

    List<Escalation> findByTask(String taskId);

    /**
     * Resolve an open incident.
     *
     * @return true if it was open
     */
    boolean resolve(long id, String operator, Instant now);
}
