package triagent.orchestrator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Request DTO for recording spend.
 * POST /api/v1/budget/spend
 */
public record SpendRequest(
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("capability") String capability,
        @JsonProperty("taskId") String taskId) {

    public void validate() {
        if (amount == null) {
            throw new IllegalArgumentException("amount is required");
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must not be negative");
        }
    }
}
