package triagent.orchestrator.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Latest heartbeat of a worker. One row per worker, used only for staleness.
 *
 * @param expectedTimeout how long the current step may legitimately take, or null
 */
public record HeartbeatRecord(
        String workerId,
        Instant timestamp,
        String taskId,
        double progress,
        Duration expectedTimeout) {
}
