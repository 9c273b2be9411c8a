package triagent.orchestrator.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of spend and the kill switch. Stays readable after the switch trips.
 *
 * @param spendRatePerMinute rolling rate over the configured window, $/min
 * @param dailySpend         since 00:00 UTC
 * @param dailyByCapability  today's spend per capability
 */
public record BudgetStatus(
        boolean killSwitchActive,
        String reason,
        Instant activatedAt,
        Instant resetAt,
        String resetBy,
        BigDecimal spendRatePerMinute,
        BigDecimal rateLimit,
        BigDecimal dailySpend,
        BigDecimal dailyLimit,
        Map<String, BigDecimal> dailyByCapability) {

    public BudgetStatus {
        dailyByCapability = Map.copyOf(dailyByCapability);
    }
}
