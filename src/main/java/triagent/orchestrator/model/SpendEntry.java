package triagent.orchestrator.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One append-only ledger row. Amount in dollars.
 */
public record SpendEntry(
        Long id,
        Instant timestamp,
        BigDecimal amount,
        String capability,
        String taskId) {
}
