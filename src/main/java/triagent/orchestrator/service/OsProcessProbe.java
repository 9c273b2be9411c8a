package triagent.orchestrator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.model.Worker;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * {@link ProcessProbe} backed by {@link ProcessHandle}. Only processes on this host
 * whose start instant matches the registered one are considered the worker's.
 */
public class OsProcessProbe implements ProcessProbe {

    private static final Logger log = LoggerFactory.getLogger(OsProcessProbe.class);

    // Start instants are derived from clock ticks and survive a round trip through the store.
    private static final Duration START_TOLERANCE = Duration.ofSeconds(1);

    private final String localHost;

    public OsProcessProbe() {
        this(localHostName());
    }

    public OsProcessProbe(String localHost) {
        this.localHost = localHost;
    }

    @Override
    public Liveness liveness(Worker worker) {
        if (worker.pid() == null || localHost == null || !localHost.equalsIgnoreCase(worker.host())) {
            return Liveness.UNVERIFIABLE;
        }
        Optional<ProcessHandle> handle = ProcessHandle.of(worker.pid()).filter(ProcessHandle::isAlive);
        if (handle.isEmpty()) {
            return Liveness.GONE;
        }
        Optional<Instant> started = handle.get().info().startInstant();
        if (worker.processStartedAt() == null || started.isEmpty()) {
            return Liveness.UNVERIFIABLE;
        }
        Duration drift = Duration.between(started.get(), worker.processStartedAt()).abs();
        if (drift.compareTo(START_TOLERANCE) > 0) {
            log.debug("Pid {} of worker {} now belongs to another process", worker.pid(), worker.id());
            return Liveness.GONE;
        }
        return Liveness.ALIVE;
    }

    @Override
    public boolean terminate(Worker worker) {
        if (liveness(worker) != Liveness.ALIVE) {
            log.warn("Not terminating worker {}: pid {} on {} cannot be verified as its process",
                    worker.id(), worker.pid(), worker.host());
            return false;
        }
        long pid = worker.pid();
        if (pid == ProcessHandle.current().pid()) {
            log.warn("Refusing to terminate own process {}", pid);
            return false;
        }
        return ProcessHandle.of(pid)
                .map(ProcessHandle::destroyForcibly)
                .orElse(false);
    }

    /**
     * Host name a worker on this machine reports at registration, or null if it cannot be resolved.
     */
    public static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Cannot resolve local host name, worker processes will not be verified: {}", e.getMessage());
            return null;
        }
    }
}
