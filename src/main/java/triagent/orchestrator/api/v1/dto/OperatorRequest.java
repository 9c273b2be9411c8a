package triagent.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Operator action body: kill switch reset, escalation resolve, breaker reset.
 */
public record OperatorRequest(
        @JsonProperty("operator") String operator) {

    public void validate() {
        if (operator == null || operator.isBlank()) {
            throw new IllegalArgumentException("operator is required");
        }
    }
}
