package triagent.orchestrator.model;

import java.time.Instant;

/**
 * Pool-wide kill switch. Sticky: only an operator reset clears it.
 */
public record KillSwitchStatus(
        boolean active,
        String reason,
        Instant activatedAt,
        Instant resetAt,
        String resetBy) {

    public static KillSwitchStatus inactive() {
        return new KillSwitchStatus(false, null, null, null, null);
    }
}
