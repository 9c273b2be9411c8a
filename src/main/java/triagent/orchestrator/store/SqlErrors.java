package triagent.orchestrator.store;

import triagent.orchestrator.error.InvalidTransitionException;
import triagent.orchestrator.error.OrchestratorException;
import triagent.orchestrator.error.StoreUnavailableException;

import java.sql.SQLException;

/**
 * Classifies SQL failures raised by constraints and triggers.
 */
final class SqlErrors {

    static final String INVALID_TRANSITION = "INVALID_TRANSITION";

    private static final String CHECK_VIOLATION = "23514";
    private static final String UNIQUE_VIOLATION = "23505";
    private static final int CONCURRENT_UPDATE = 90131;

    private SqlErrors() {
    }

    static SQLException invalidTransition(String detail) {
        return new SQLException(INVALID_TRANSITION + " " + detail, CHECK_VIOLATION);
    }

    /** Raised by one of the transition triggers, possibly wrapped by the driver. */
    static boolean isInvalidTransition(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains(INVALID_TRANSITION)) {
                return true;
            }
        }
        return false;
    }

    /** H2 row-level write conflict between two transactions. */
    static boolean isConcurrentUpdate(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && sql.getErrorCode() == CONCURRENT_UPDATE) {
                return true;
            }
        }
        return false;
    }

    static boolean isDuplicateKey(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    /** Trigger message without the marker, for exception text. */
    static String transitionDetail(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String msg = t.getMessage();
            if (msg != null) {
                int idx = msg.indexOf(INVALID_TRANSITION);
                if (idx >= 0) {
                    String tail = msg.substring(idx + INVALID_TRANSITION.length()).trim();
                    int end = tail.indexOf(';');
                    return end > 0 ? tail.substring(0, end).trim() : tail;
                }
            }
        }
        return e.getMessage();
    }

    /**
     * Wrap a failed statement: trigger rejections become InvalidTransitionException,
     * everything else StoreUnavailableException.
     */
    static OrchestratorException translate(String operation, String id, SQLException e) {
        if (isInvalidTransition(e)) {
            return new InvalidTransitionException(id, "Rejected " + operation + ": " + transitionDetail(e), e);
        }
        return new StoreUnavailableException("Failed to " + operation + ": " + id, e);
    }
}
