package triagent.orchestrator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.service.BudgetGovernor;

/**
 * Periodic budget check. Trips the kill switch on a breach; never clears it.
 */
public class BudgetWatchdog implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(BudgetWatchdog.class);

    private final BudgetGovernor budgetGovernor;

    public BudgetWatchdog(BudgetGovernor budgetGovernor) {
        this.budgetGovernor = budgetGovernor;
    }

    @Override
    public void run() {
        try {
            if (budgetGovernor.check()) {
                log.debug("Kill switch active");
            }
        } catch (Exception e) {
            log.error("Budget watchdog error", e);
        }
    }
}
