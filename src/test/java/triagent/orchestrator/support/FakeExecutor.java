package triagent.orchestrator.support;

import triagent.orchestrator.executor.ExecutorException;
import triagent.orchestrator.executor.ExecutorTimeoutException;
import triagent.orchestrator.executor.ModelExecutor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scripted executor. Each capability answers with a fixed reply, fails, crashes, or times out.
 */
public final class FakeExecutor implements ModelExecutor {

    private final Map<String, String> replies = new ConcurrentHashMap<>();
    private final Map<String, String> failures = new ConcurrentHashMap<>();
    private final Map<String, Boolean> timeouts = new ConcurrentHashMap<>();
    private final Map<String, RuntimeException> crashes = new ConcurrentHashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    public FakeExecutor reply(String capability, String output) {
        replies.put(capability, output);
        failures.remove(capability);
        timeouts.remove(capability);
        crashes.remove(capability);
        return this;
    }

    public FakeExecutor fail(String capability, String error) {
        failures.put(capability, error);
        return this;
    }

    /** Throw an unchecked exception, as a broken executor would. */
    public FakeExecutor crash(String capability, RuntimeException crash) {
        crashes.put(capability, crash);
        return this;
    }

    public FakeExecutor timeOut(String capability) {
        timeouts.put(capability, Boolean.TRUE);
        return this;
    }

    public List<String> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public int callCount(String capability) {
        return (int) calls().stream().filter(capability::equals).count();
    }

    @Override
    public String execute(String capability, String prompt, Duration timeout) throws ExecutorException {
        calls.add(capability);
        RuntimeException crash = crashes.get(capability);
        if (crash != null) {
            throw crash;
        }
        if (timeouts.containsKey(capability)) {
            throw new ExecutorTimeoutException(capability, timeout);
        }
        String error = failures.get(capability);
        if (error != null) {
            throw new ExecutorException(error);
        }
        return replies.getOrDefault(capability, "APPROVE looks fine");
    }
}
