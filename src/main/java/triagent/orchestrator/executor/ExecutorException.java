package triagent.orchestrator.executor;

/**
 * The model executor failed to produce a result.
 */
public class ExecutorException extends Exception {

    public ExecutorException(String message) {
        super(message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
