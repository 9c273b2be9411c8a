package triagent.orchestrator.error;

/**
 * Base class for orchestration failures surfaced to callers.
 */
public class OrchestratorException extends RuntimeException {

    public OrchestratorException(String message) {
        super(message);
    }

    public OrchestratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
