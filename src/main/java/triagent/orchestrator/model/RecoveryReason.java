package triagent.orchestrator.model;

/**
 * Why a worker's tasks were taken back.
 */
public enum RecoveryReason {
    /** Heartbeat stale and the OS process is gone */
    WORKER_DEAD,
    /** Heartbeat stale but the process still exists */
    WORKER_CRASHED,
    /** Terminated by the budget kill switch */
    BUDGET_KILL,
    /** Task heartbeat stale while its owner kept heartbeating */
    TASK_SILENT
}
