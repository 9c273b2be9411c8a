package triagent.orchestrator.api.internal.v1.dto;

/**
 * Inter-agent message kinds.
 */
public enum MessageType {
    TASK_ASSIGN,
    TASK_APPROVE,
    TASK_REJECT,
    HEARTBEAT,
    CONTROL_PAUSE,
    CONTROL_RESUME
}
