package triagent.orchestrator.model;

/**
 * Where a task type is processed.
 *
 * @param capability model capability that implements tasks of this type
 * @param lane       processing lane name
 */
public record TaskRoute(String capability, String lane) {
}
