package triagent.orchestrator.service;

import org.junit.jupiter.api.*;
import triagent.orchestrator.model.Worker;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class OsProcessProbeTest {

    private static final String HOST = "build-host";

    private final OsProcessProbe probe = new OsProcessProbe(HOST);

    private static Worker worker(long pid, String host, Instant startedAt) {
        return Worker.builder().id("w-" + pid).pid(pid).host(host).processStartedAt(startedAt).build();
    }

    private static Instant startOf(ProcessHandle handle) {
        Instant started = handle.info().startInstant().orElse(null);
        assumeTrue(started != null, "process start instant not available on this platform");
        return started;
    }

    @Test
    void ownProcessIsAliveButNeverTerminated() {
        ProcessHandle self = ProcessHandle.current();
        Worker me = worker(self.pid(), HOST, startOf(self));

        assertEquals(ProcessProbe.Liveness.ALIVE, probe.liveness(me));
        assertFalse(probe.terminate(me));
    }

    @Test
    void otherHostCannotBeVerified() {
        ProcessHandle self = ProcessHandle.current();

        Worker remote = worker(self.pid(), "elsewhere", startOf(self));

        assertEquals(ProcessProbe.Liveness.UNVERIFIABLE, probe.liveness(remote));
        assertFalse(probe.terminate(remote));
    }

    @Test
    void missingIdentityCannotBeVerified() {
        assertEquals(ProcessProbe.Liveness.UNVERIFIABLE,
                probe.liveness(Worker.builder().id("w").host(HOST).build()));
        assertEquals(ProcessProbe.Liveness.UNVERIFIABLE,
                probe.liveness(worker(ProcessHandle.current().pid(), HOST, null)));
    }

    @Test
    void pidWithDifferentStartBelongsToSomeoneElse() {
        ProcessHandle self = ProcessHandle.current();
        Worker stale = worker(self.pid(), HOST, startOf(self).minus(Duration.ofHours(3)));

        assertEquals(ProcessProbe.Liveness.GONE, probe.liveness(stale));
        assertFalse(probe.terminate(stale));
    }

    @Test
    void terminatesOnlyTheVerifiedProcess() throws Exception {
        assumeTrue(!System.getProperty("os.name").toLowerCase().contains("win"), "needs a POSIX sleep");
        Process child = new ProcessBuilder("sleep", "30").start();
        try {
            Instant started = startOf(child.toHandle());

            Worker impostor = worker(child.pid(), HOST, started.minus(Duration.ofMinutes(10)));
            assertFalse(probe.terminate(impostor));
            assertTrue(child.isAlive());

            assertTrue(probe.terminate(worker(child.pid(), HOST, started)));
            assertTrue(child.waitFor(5, TimeUnit.SECONDS));
        } finally {
            child.destroyForcibly();
        }
    }
}
