package triagent.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.config.Dependencies;
import triagent.orchestrator.config.OrchestratorConfig;
import triagent.orchestrator.model.Worker;
import triagent.orchestrator.service.OsProcessProbe;
import triagent.orchestrator.server.OrchestratorServer;
import triagent.orchestrator.worker.CancellationToken;
import triagent.orchestrator.worker.WorkerRunner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point.
 *
 * <pre>
 * java -jar triagent-orchestrator.jar coordinator [config.ini]
 * java -jar triagent-orchestrator.jar worker [config.ini]
 * </pre>
 *
 * The coordinator serves the HTTP API and runs the recovery and budget jobs.
 * A worker runs one poll loop against the shared store until it is stopped.
 */
public final class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private Main() {
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        String mode = args.length > 0 ? args[0] : "coordinator";
        OrchestratorConfig config = loadConfig(args.length > 1 ? Path.of(args[1]) : null);

        switch (mode) {
            case "coordinator" -> runCoordinator(config);
            case "worker" -> runWorker(config);
            default -> {
                System.err.println("Usage: triagent-orchestrator [coordinator|worker] [config.ini]");
                System.exit(2);
            }
        }
    }

    private static OrchestratorConfig loadConfig(Path path) throws IOException {
        if (path == null) {
            return OrchestratorConfig.fromEnv();
        }
        if (!Files.isRegularFile(path)) {
            throw new IOException("Config file not found: " + path);
        }
        log.info("Loading config from {}", path);
        return OrchestratorConfig.fromIni(path);
    }

    private static void runCoordinator(OrchestratorConfig config) throws InterruptedException {
        Dependencies deps = Dependencies.create(config);
        OrchestratorServer server = new OrchestratorServer(deps.routerHandler(), config.serverHost(),
                config.serverPort());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down coordinator");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "triagent-shutdown"));

        server.start();
        deps.startScheduler();
        stopped.await();
    }

    private static void runWorker(OrchestratorConfig config) throws InterruptedException {
        Dependencies deps = Dependencies.create(config);
        CancellationToken token = new CancellationToken();

        String workerId = config.workerId() != null
                ? config.workerId()
                : "worker-" + UUID.randomUUID().toString().substring(0, 8);
        Worker registration = Worker.builder()
                .id(workerId)
                .pid(ProcessHandle.current().pid())
                .host(OsProcessProbe.localHostName())
                .processStartedAt(ProcessHandle.current().info().startInstant().orElse(null))
                .shard(config.workerShard())
                .model(config.workerModel())
                .specialization(config.workerSpecialization())
                .build();

        WorkerRunner runner = deps.workerRunner(registration, token);
        Thread loop = new Thread(runner, "worker-" + workerId);

        // The hook only flips the token; the loop releases its work and exits on its own.
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            token.requestStop();
            try {
                loop.join(config.executorTimeout().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            deps.close();
        }, "triagent-shutdown"));

        loop.start();
        loop.join();
    }
}
