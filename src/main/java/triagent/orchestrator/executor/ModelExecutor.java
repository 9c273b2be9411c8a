package triagent.orchestrator.executor;

import java.time.Duration;

/**
 * Runs a prompt against one model capability.
 */
public interface ModelExecutor {

    /**
     * Execute the prompt and return the model output.
     *
     * @param capability which model to run (e.g. "claude")
     * @param prompt     full prompt text
     * @param timeout    upper bound for the call
     * @return model output text
     * @throws ExecutorTimeoutException when the timeout elapsed
     * @throws ExecutorException        on any other failure
     */
    String execute(String capability, String prompt, Duration timeout) throws ExecutorException;
}
