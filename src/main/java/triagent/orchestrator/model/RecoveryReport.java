package triagent.orchestrator.model;

/**
 * Outcome of one recovery pass.
 */
public record RecoveryReport(int workersRecovered, int tasksRequeued) {

    public static final RecoveryReport EMPTY = new RecoveryReport(0, 0);

    public RecoveryReport plus(RecoveryReport other) {
        return new RecoveryReport(workersRecovered + other.workersRecovered, tasksRequeued + other.tasksRequeued);
    }

    public boolean isEmpty() {
        return workersRecovered == 0 && tasksRequeued == 0;
    }
}
