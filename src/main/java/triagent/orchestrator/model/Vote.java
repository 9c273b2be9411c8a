package triagent.orchestrator.model;

import java.time.Instant;

public record Vote(
        String sessionId,
        String voter,
        VoteValue value,
        String reason,
        long durationMs,
        Instant createdAt) {
}
