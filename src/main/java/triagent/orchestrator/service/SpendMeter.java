package triagent.orchestrator.service;

import java.math.BigDecimal;

/**
 * Prices one executor call. Estimation heuristics live outside the engine;
 * the default charges nothing.
 */
@FunctionalInterface
public interface SpendMeter {

    SpendMeter NONE = (capability, prompt, output) -> BigDecimal.ZERO;

    BigDecimal cost(String capability, String prompt, String output);
}
