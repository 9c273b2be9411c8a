package triagent.orchestrator.error;

/**
 * The shared store could not be reached or the statement failed.
 * Callers retry with backoff and never assume ownership.
 */
public class StoreUnavailableException extends OrchestratorException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
