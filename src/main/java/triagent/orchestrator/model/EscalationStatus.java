package triagent.orchestrator.model;

public enum EscalationStatus {
    OPEN,
    RESOLVED
}
