package triagent.orchestrator.error;

public class CircuitOpenException extends OrchestratorException {

    private final String capability;

    public CircuitOpenException(String capability) {
        super("Circuit open for capability: " + capability);
        this.capability = capability;
    }

    public String capability() {
        return capability;
    }
}
