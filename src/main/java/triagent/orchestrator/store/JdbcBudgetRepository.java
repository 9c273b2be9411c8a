package triagent.orchestrator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.model.KillSwitchStatus;
import triagent.orchestrator.model.SpendEntry;
import triagent.orchestrator.repository.BudgetRepository;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static triagent.orchestrator.store.JdbcTaskRepository.setTimestamp;
import static triagent.orchestrator.store.JdbcTaskRepository.toInstant;

/**
 * JDBC implementation of BudgetRepository.
 * The kill switch is a single row (id = 1) created with the schema.
 */
public class JdbcBudgetRepository implements BudgetRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcBudgetRepository.class);

    private final Database db;

    public JdbcBudgetRepository(Database db) {
        this.db = db;
    }

    @Override
    public void append(SpendEntry entry) {
        String sql = "INSERT INTO budget_ledger (ts, amount, capability, task_id) VALUES (?, ?, ?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, entry.timestamp() != null ? entry.timestamp() : Instant.now());
            ps.setBigDecimal(2, entry.amount());
            ps.setString(3, entry.capability());
            ps.setString(4, entry.taskId());
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw SqlErrors.translate("append spend", String.valueOf(entry.taskId()), e);
        }
    }

    @Override
    public BigDecimal sumBetween(Instant from, Instant to) {
        String sql = "SELECT COALESCE(SUM(amount), 0) FROM budget_ledger WHERE ts >= ? AND ts <= ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, from);
            setTimestamp(ps, 2, to);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                BigDecimal sum = rs.getBigDecimal(1);
                return sum != null ? sum : BigDecimal.ZERO;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("sum spend", from + ".." + to, e);
        }
    }

    @Override
    public Map<String, BigDecimal> sumByCapabilitySince(Instant from) {
        String sql = """
                    SELECT COALESCE(capability, 'unknown') AS cap, SUM(amount) AS total
                    FROM budget_ledger WHERE ts >= ?
                    GROUP BY COALESCE(capability, 'unknown')
                    ORDER BY cap
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, from);
            Map<String, BigDecimal> totals = new LinkedHashMap<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    totals.put(rs.getString("cap"), rs.getBigDecimal("total"));
                }
            }
            return totals;
        } catch (SQLException e) {
            throw SqlErrors.translate("sum spend per capability", String.valueOf(from), e);
        }
    }

    @Override
    public KillSwitchStatus killSwitch() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM kill_switch WHERE id = 1");
                ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                return KillSwitchStatus.inactive();
            }
            return new KillSwitchStatus(
                    rs.getBoolean("active"),
                    rs.getString("reason"),
                    toInstant(rs.getTimestamp("activated_at")),
                    toInstant(rs.getTimestamp("reset_at")),
                    rs.getString("reset_by"));
        } catch (SQLException e) {
            throw SqlErrors.translate("read kill switch", "1", e);
        }
    }

    @Override
    public boolean activate(String reason, Instant now) {
        String sql = "UPDATE kill_switch SET active = TRUE, reason = ?, activated_at = ? WHERE id = 1 AND active = FALSE";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, reason);
            setTimestamp(ps, 2, now);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.warn("Kill switch activated: {}", reason);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate("activate kill switch", "1", e);
        }
    }

    @Override
    public boolean reset(String operator, Instant now) {
        String sql = "UPDATE kill_switch SET active = FALSE, reset_at = ?, reset_by = ? WHERE id = 1 AND active = TRUE";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            ps.setString(2, operator);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.info("Kill switch reset by {}", operator);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate("reset kill switch", "1", e);
        }
    }
}
