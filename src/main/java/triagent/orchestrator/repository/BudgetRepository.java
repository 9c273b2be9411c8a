package triagent.orchestrator.repository;

import triagent.orchestrator.model.KillSwitchStatus;
import triagent.orchestrator.model.SpendEntry;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Repository interface for the spend ledger and the kill switch.
 */
public interface BudgetRepository {

    /**
     * Append a ledger entry.
     */
    void append(SpendEntry entry);

    /**
     * Sum of ledger amounts with timestamp in {@code [from, to]}.
     */
    BigDecimal sumBetween(Instant from, Instant to);

    /**
     * Ledger sums per capability since {@code from}.
     */
    Map<String, BigDecimal> sumByCapabilitySince(Instant from);

    /**
     * Read the kill switch row.
     */
    KillSwitchStatus killSwitch();

    /**
     * Activate the kill switch if it is not active yet.
     *
     * @return true if this call activated it
     */
    boolean activate(String reason, Instant now);

    /**
     * Clear an active kill switch.
     *
     * @return true if it was active
     */
    boolean reset(String operator, Instant now);
}
