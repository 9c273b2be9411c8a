package triagent.orchestrator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.model.Escalation;
import triagent.orchestrator.model.EscalationStatus;
import triagent.orchestrator.repository.EscalationRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static triagent.orchestrator.store.JdbcTaskRepository.setTimestamp;
import static triagent.orchestrator.store.JdbcTaskRepository.toInstant;

/**
 * JDBC implementation of EscalationRepository.
 */
public class JdbcEscalationRepository implements EscalationRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEscalationRepository.class);

    private final Database db;

    public JdbcEscalationRepository(Database db) {
        this.db = db;
    }

    @Override
    public long open(String taskId, String reason, String severity, Instant now) {
        String sql = """
                    INSERT INTO escalations (task_id, reason, severity, status, created_at)
                    VALUES (?, ?, ?, 'OPEN', ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, taskId);
            ps.setString(2, reason);
            ps.setString(3, severity);
            setTimestamp(ps, 4, now);
            ps.executeUpdate();

            long id;
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for escalation of task " + taskId);
                }
                id = keys.getLong(1);
            }
            conn.commit();

            log.warn("Escalation {} opened for task {} [{}]: {}", id, taskId, severity, reason);
            return id;
        } catch (SQLException e) {
            throw SqlErrors.translate("open escalation", taskId, e);
        }
    }

    @Override
    public Optional<Escalation> findById(long id) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM escalations WHERE id = ?")) {
            ps.setLong(1, id);
            List<Escalation> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw SqlErrors.translate("find escalation", String.valueOf(id), e);
        }
    }

    @Override
    public List<Escalation> findOpen() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "SELECT * FROM escalations WHERE status = 'OPEN' ORDER BY created_at, id")) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw SqlErrors.translate("list open escalations", "*", e);
        }
    }

    @Override
    public List<Escalation> findByTask(String taskId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(
                        "SELECT * FROM escalations WHERE task_id = ? ORDER BY created_at, id")) {
            ps.setString(1, taskId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw SqlErrors.translate("find escalations", taskId, e);
        }
    }

    @Override
    public boolean resolve(long id, String operator, Instant now) {
        String sql = """
                    UPDATE escalations SET status = 'RESOLVED', resolved_at = ?, resolved_by = ?
                    WHERE id = ? AND status = 'OPEN'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            ps.setString(2, operator);
            ps.setLong(3, id);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate("resolve escalation", String.valueOf(id), e);
        }
    }

    private List<Escalation> executeQuery(PreparedStatement ps) throws SQLException {
        List<Escalation> result = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                result.add(new Escalation(
                        rs.getLong("id"),
                        rs.getString("task_id"),
                        rs.getString("reason"),
                        rs.getString("severity"),
                        EscalationStatus.valueOf(rs.getString("status")),
                        toInstant(rs.getTimestamp("created_at")),
                        toInstant(rs.getTimestamp("resolved_at")),
                        rs.getString("resolved_by")));
            }
        }
        return result;
    }
}
