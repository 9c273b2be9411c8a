package triagent.orchestrator.api.internal.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic response for internal API operations.
 *
 * @param outcome service-level result name, e.g. SUBMITTED or RETRIED
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResponse(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("outcome") String outcome,
        @JsonProperty("error") String error) {

    public static OperationResponse success(String outcome) {
        return new OperationResponse(true, outcome, null);
    }

    public static OperationResponse error(String outcome, String error) {
        return new OperationResponse(false, outcome, error);
    }
}
