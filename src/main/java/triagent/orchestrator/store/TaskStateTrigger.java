package triagent.orchestrator.store;

import org.h2.tools.TriggerAdapter;
import triagent.orchestrator.model.TaskState;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Keeps terminal task rows immutable and enforces the task state table.
 * Also refuses to hand a RUNNING task to a second owner.
 */
public class TaskStateTrigger extends TriggerAdapter {

    @Override
    public void fire(Connection conn, ResultSet oldRow, ResultSet newRow) throws SQLException {
        TaskState next = TaskState.valueOf(newRow.getString("state"));
        String id = newRow.getString("id");

        if (oldRow == null) {
            if (next != TaskState.QUEUED) {
                throw SqlErrors.invalidTransition("task " + id + " must be created QUEUED, got " + next);
            }
            return;
        }

        TaskState current = TaskState.valueOf(oldRow.getString("state"));
        if (current.isTerminal()) {
            throw SqlErrors.invalidTransition("task " + id + " is " + current + " and can no longer change");
        }
        if (current != next && !current.canTransitionTo(next)) {
            throw SqlErrors.invalidTransition("task " + id + ": " + current + " -> " + next);
        }

        // A running task changes owner only by going back through QUEUED.
        if (current == TaskState.RUNNING && next == TaskState.RUNNING) {
            String owner = oldRow.getString("worker_id");
            if (owner != null && !Objects.equals(owner, newRow.getString("worker_id"))) {
                throw SqlErrors.invalidTransition("task " + id + " is owned by " + owner);
            }
        }
    }
}
