package triagent.orchestrator.store;

import org.h2.tools.TriggerAdapter;
import triagent.orchestrator.model.WorkerStatus;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Rejects worker status changes that the worker state table does not allow.
 * New rows must start in {@code starting}.
 */
public class WorkerStatusTrigger extends TriggerAdapter {

    @Override
    public void fire(Connection conn, ResultSet oldRow, ResultSet newRow) throws SQLException {
        WorkerStatus next = WorkerStatus.fromDb(newRow.getString("status"));
        String id = newRow.getString("id");

        if (oldRow == null) {
            if (next != WorkerStatus.STARTING) {
                throw SqlErrors.invalidTransition("worker " + id + " must register as starting, got " + next);
            }
            return;
        }

        WorkerStatus current = WorkerStatus.fromDb(oldRow.getString("status"));
        if (!current.canTransitionTo(next)) {
            throw SqlErrors.invalidTransition("worker " + id + ": " + current + " -> " + next);
        }
    }
}
