package triagent.orchestrator.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a configured command per capability with the prompt on stdin and
 * returns whatever the command prints on stdout.
 */
public class ProcessModelExecutor implements ModelExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProcessModelExecutor.class);

    private final Map<String, String> commands;

    public ProcessModelExecutor(Map<String, String> commands) {
        this.commands = Map.copyOf(commands);
    }

    @Override
    public String execute(String capability, String prompt, Duration timeout) throws ExecutorException {
        String command = commands.get(capability);
        if (command == null || command.isBlank()) {
            throw new ExecutorException("No executor command configured for capability: " + capability);
        }

        List<String> argv = Arrays.asList(command.trim().split("\\s+"));
        Process process;
        try {
            process = new ProcessBuilder(argv).start();
        } catch (IOException e) {
            throw new ExecutorException("Failed to start executor for " + capability + ": " + argv.get(0), e);
        }

        log.debug("Started executor pid={} for {}", process.pid(), capability);

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));

        try (OutputStream in = process.getOutputStream()) {
            in.write(prompt.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Executor for {} closed stdin early: {}", capability, e.getMessage());
        }

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ExecutorTimeoutException(capability, timeout);
            }

            String output = stdout.get(5, TimeUnit.SECONDS);
            int exit = process.exitValue();
            if (exit != 0) {
                String err = stderr.get(5, TimeUnit.SECONDS);
                throw new ExecutorException("Executor for " + capability + " exited with " + exit + ": "
                        + truncate(err));
            }
            return output;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ExecutorException("Interrupted while waiting for " + capability, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ExecutorException("Failed to read output of " + capability, e);
        }
    }

    private static String readAll(InputStream stream) {
        try (InputStream in = stream) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read process stream", e);
        }
    }

    private static String truncate(String s) {
        if (s == null) {
            return "";
        }
        String trimmed = s.strip();
        return trimmed.length() > 500 ? trimmed.substring(0, 500) + "..." : trimmed;
    }
}
