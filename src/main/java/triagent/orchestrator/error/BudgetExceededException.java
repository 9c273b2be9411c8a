package triagent.orchestrator.error;

/**
 * Kill switch is active; no work may be claimed until an operator resets it.
 */
public class BudgetExceededException extends OrchestratorException {

    public BudgetExceededException(String reason) {
        super("Budget kill switch active: " + reason);
    }
}
