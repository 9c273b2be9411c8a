package triagent.orchestrator.store;

import triagent.orchestrator.model.BreakerState;
import triagent.orchestrator.model.CircuitBreakerState;
import triagent.orchestrator.repository.BreakerRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static triagent.orchestrator.store.JdbcTaskRepository.setTimestamp;
import static triagent.orchestrator.store.JdbcTaskRepository.toInstant;

/**
 * JDBC implementation of BreakerRepository.
 * Breaker rows are shared by every worker process, so each decision is taken
 * under {@code SELECT ... FOR UPDATE} and written back in the same transaction.
 */
public class JdbcBreakerRepository implements BreakerRepository {

    private final Database db;

    public JdbcBreakerRepository(Database db) {
        this.db = db;
    }

    @Override
    public <R> R update(String capability, Function<CircuitBreakerState, Mutation<R>> update) {
        String selectSql = "SELECT * FROM breakers WHERE capability = ? FOR UPDATE";
        String insertSql = "INSERT INTO breakers (capability, state, failure_count) VALUES (?, 'CLOSED', 0)";
        String updateSql = """
                    UPDATE breakers
                    SET state = ?, failure_count = ?, opened_at = ?, half_open_in_flight = ?,
                        last_failure = ?, last_success = ?
                    WHERE capability = ?
                """;

        try (Connection conn = db.getConnection()) {
            try {
                CircuitBreakerState current = lockRow(conn, selectSql, capability);
                if (current == null) {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        ps.setString(1, capability);
                        ps.executeUpdate();
                    } catch (SQLException e) {
                        if (!SqlErrors.isDuplicateKey(e)) {
                            throw e;
                        }
                        // Another process created it first.
                        conn.rollback();
                    }
                    current = lockRow(conn, selectSql, capability);
                    if (current == null) {
                        throw new SQLException("Breaker row missing after insert: " + capability);
                    }
                }

                Mutation<R> mutation = update.apply(current);
                CircuitBreakerState next = mutation.next();

                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, next.state().name());
                    ps.setInt(2, next.failureCount());
                    setTimestamp(ps, 3, next.openedAt());
                    ps.setBoolean(4, next.halfOpenInFlight());
                    setTimestamp(ps, 5, next.lastFailure());
                    setTimestamp(ps, 6, next.lastSuccess());
                    ps.setString(7, capability);
                    ps.executeUpdate();
                }

                conn.commit();
                return mutation.result();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("update breaker", capability, e);
        }
    }

    @Override
    public Optional<CircuitBreakerState> find(String capability) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM breakers WHERE capability = ?")) {
            ps.setString(1, capability);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("find breaker", capability, e);
        }
    }

    @Override
    public List<CircuitBreakerState> findAll() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM breakers ORDER BY capability");
                ResultSet rs = ps.executeQuery()) {
            List<CircuitBreakerState> states = new ArrayList<>();
            while (rs.next()) {
                states.add(mapRow(rs));
            }
            return states;
        } catch (SQLException e) {
            throw SqlErrors.translate("list breakers", "*", e);
        }
    }

    private CircuitBreakerState lockRow(Connection conn, String sql, String capability) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, capability);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? mapRow(rs) : null;
            }
        }
    }

    private CircuitBreakerState mapRow(ResultSet rs) throws SQLException {
        return new CircuitBreakerState(
                rs.getString("capability"),
                BreakerState.valueOf(rs.getString("state")),
                rs.getInt("failure_count"),
                toInstant(rs.getTimestamp("opened_at")),
                rs.getBoolean("half_open_in_flight"),
                toInstant(rs.getTimestamp("last_failure")),
                toInstant(rs.getTimestamp("last_success")));
    }
}
