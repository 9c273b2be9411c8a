package triagent.orchestrator.executor;

import java.time.Duration;

/**
 * The model executor did not answer within its timeout.
 */
public class ExecutorTimeoutException extends ExecutorException {

    public ExecutorTimeoutException(String capability, Duration timeout) {
        super("Executor for " + capability + " timed out after " + timeout.toSeconds() + "s");
    }
}
