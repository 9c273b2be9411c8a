package triagent.orchestrator.model;

/**
 * Audit event kinds written to the event log.
 */
public enum EventType {
    TASK_CREATED,
    TASK_CLAIMED,
    TASK_RELEASED,
    TASK_RECOVERED,
    TASK_TRANSITION,
    VOTE_RECORDED,
    CONSENSUS_DECIDED,
    WORKER_REGISTERED,
    WORKER_STATUS,
    WORKER_KILLED,
    KILL_SWITCH_ACTIVATED,
    KILL_SWITCH_RESET,
    ESCALATION_OPENED,
    ESCALATION_RESOLVED
}
