package triagent.orchestrator.error;

/**
 * A task or worker was asked to move along an edge that its state table does not allow,
 * or its current state no longer matched the expected one.
 */
public class InvalidTransitionException extends OrchestratorException {

    private final String entityId;

    public InvalidTransitionException(String entityId, String message) {
        super(message);
        this.entityId = entityId;
    }

    public InvalidTransitionException(String entityId, String message, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
    }

    public String entityId() {
        return entityId;
    }
}
