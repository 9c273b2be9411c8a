package triagent.orchestrator.store;

import triagent.orchestrator.model.AuditEvent;
import triagent.orchestrator.model.EventType;
import triagent.orchestrator.repository.AuditRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static triagent.orchestrator.store.JdbcTaskRepository.setTimestamp;
import static triagent.orchestrator.store.JdbcTaskRepository.toInstant;

/**
 * JDBC implementation of AuditRepository.
 */
public class JdbcAuditRepository implements AuditRepository {

    private final Database db;

    public JdbcAuditRepository(Database db) {
        this.db = db;
    }

    @Override
    public void record(AuditEvent event) {
        String sql = """
                    INSERT INTO events (task_id, worker_id, event_type, actor, detail, trace_id, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, event.taskId());
            ps.setString(2, event.workerId());
            ps.setString(3, event.type().name());
            ps.setString(4, event.actor());
            ps.setString(5, event.detail());
            ps.setString(6, event.traceId());
            setTimestamp(ps, 7, event.createdAt() != null ? event.createdAt() : Instant.now());
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw SqlErrors.translate("record event " + event.type(), String.valueOf(event.taskId()), e);
        }
    }

    @Override
    public List<AuditEvent> findByTask(String taskId) {
        String sql = "SELECT * FROM events WHERE task_id = ? ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw SqlErrors.translate("find events", taskId, e);
        }
    }

    @Override
    public List<AuditEvent> findRecent(int limit) {
        String sql = "SELECT * FROM events ORDER BY created_at DESC, id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw SqlErrors.translate("find recent events", String.valueOf(limit), e);
        }
    }

    @Override
    public int countByTaskAndType(String taskId, EventType type) {
        String sql = "SELECT COUNT(*) FROM events WHERE task_id = ? AND event_type = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            ps.setString(2, type.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("count events", taskId, e);
        }
    }

    private List<AuditEvent> executeQuery(PreparedStatement ps) throws SQLException {
        List<AuditEvent> events = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                events.add(new AuditEvent(
                        rs.getLong("id"),
                        rs.getString("task_id"),
                        rs.getString("worker_id"),
                        EventType.valueOf(rs.getString("event_type")),
                        rs.getString("actor"),
                        rs.getString("detail"),
                        rs.getString("trace_id"),
                        toInstant(rs.getTimestamp("created_at"))));
            }
        }
        return events;
    }
}
