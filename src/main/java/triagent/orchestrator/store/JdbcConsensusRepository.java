package triagent.orchestrator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.model.ConsensusResult;
import triagent.orchestrator.model.ConsensusSession;
import triagent.orchestrator.model.Vote;
import triagent.orchestrator.model.VoteOutcome;
import triagent.orchestrator.model.VoteValue;
import triagent.orchestrator.repository.ConsensusRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static triagent.orchestrator.store.JdbcTaskRepository.setTimestamp;
import static triagent.orchestrator.store.JdbcTaskRepository.toInstant;

/**
 * JDBC implementation of ConsensusRepository.
 * One vote per (session, voter) is enforced by the primary key.
 */
public class JdbcConsensusRepository implements ConsensusRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcConsensusRepository.class);

    private final Database db;

    public JdbcConsensusRepository(Database db) {
        this.db = db;
    }

    @Override
    public void createSession(ConsensusSession session) {
        String sql = """
                    INSERT INTO consensus_sessions (id, task_id, implementer, required_approvals, expected_voters,
                                                    created_at, final_result)
                    VALUES (?, ?, ?, ?, ?, ?, 'PENDING')
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, session.id());
            ps.setString(2, session.taskId());
            ps.setString(3, session.implementer());
            ps.setInt(4, session.requiredApprovals());
            ps.setString(5, String.join(",", session.expectedVoters()));
            setTimestamp(ps, 6, session.createdAt() != null ? session.createdAt() : Instant.now());
            ps.executeUpdate();
            conn.commit();

            log.debug("Created consensus session {} for task {}", session.id(), session.taskId());
        } catch (SQLException e) {
            throw SqlErrors.translate("create consensus session", session.id(), e);
        }
    }

    @Override
    public Optional<ConsensusSession> findById(String sessionId) {
        return queryOne("SELECT * FROM consensus_sessions WHERE id = ?", sessionId);
    }

    @Override
    public Optional<ConsensusSession> findOpenByTask(String taskId) {
        return queryOne("""
                    SELECT * FROM consensus_sessions
                    WHERE task_id = ? AND final_result = 'PENDING'
                    ORDER BY created_at DESC LIMIT 1
                """, taskId);
    }

    @Override
    public List<ConsensusSession> findByTask(String taskId) {
        String sql = "SELECT * FROM consensus_sessions WHERE task_id = ? ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            List<ConsensusSession> sessions = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    sessions.add(mapSession(rs));
                }
            }
            return sessions;
        } catch (SQLException e) {
            throw SqlErrors.translate("find consensus sessions", taskId, e);
        }
    }

    @Override
    public VoteOutcome insertVote(Vote vote) {
        String lockSql = "SELECT final_result FROM consensus_sessions WHERE id = ? FOR UPDATE";
        String insertSql = """
                    INSERT INTO consensus_votes (session_id, voter, vote, reason, duration_ms, created_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                // complete() updates the same row, so it waits for this transaction.
                try (PreparedStatement ps = conn.prepareStatement(lockSql)) {
                    ps.setString(1, vote.sessionId());
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            return VoteOutcome.SESSION_NOT_FOUND;
                        }
                        if (!ConsensusResult.PENDING.name().equals(rs.getString(1))) {
                            conn.rollback();
                            return VoteOutcome.SESSION_CLOSED;
                        }
                    }
                }

                try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                    ps.setString(1, vote.sessionId());
                    ps.setString(2, vote.voter());
                    ps.setString(3, vote.value().name());
                    ps.setString(4, vote.reason());
                    ps.setLong(5, vote.durationMs());
                    setTimestamp(ps, 6, vote.createdAt() != null ? vote.createdAt() : Instant.now());
                    ps.executeUpdate();
                }
                conn.commit();
                return VoteOutcome.ACCEPTED;
            } catch (SQLException e) {
                conn.rollback();
                if (SqlErrors.isDuplicateKey(e)) {
                    return VoteOutcome.DUPLICATE_VOTE;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("record vote", vote.sessionId() + "/" + vote.voter(), e);
        }
    }

    @Override
    public List<Vote> findVotes(String sessionId) {
        String sql = "SELECT * FROM consensus_votes WHERE session_id = ? ORDER BY created_at, voter";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, sessionId);
            List<Vote> votes = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    votes.add(new Vote(
                            rs.getString("session_id"),
                            rs.getString("voter"),
                            VoteValue.valueOf(rs.getString("vote")),
                            rs.getString("reason"),
                            rs.getLong("duration_ms"),
                            toInstant(rs.getTimestamp("created_at"))));
                }
            }
            return votes;
        } catch (SQLException e) {
            throw SqlErrors.translate("find votes", sessionId, e);
        }
    }

    @Override
    public boolean complete(String sessionId, ConsensusResult result, Instant now) {
        String sql = """
                    UPDATE consensus_sessions SET final_result = ?, completed_at = ?
                    WHERE id = ? AND final_result = 'PENDING'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, result.name());
            setTimestamp(ps, 2, now);
            ps.setString(3, sessionId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate("complete consensus session", sessionId, e);
        }
    }

    private Optional<ConsensusSession> queryOne(String sql, String param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapSession(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("find consensus session", param, e);
        }
    }

    private ConsensusSession mapSession(ResultSet rs) throws SQLException {
        String voters = rs.getString("expected_voters");
        List<String> expected = voters == null || voters.isBlank()
                ? List.of()
                : Arrays.asList(voters.split(","));
        return new ConsensusSession(
                rs.getString("id"),
                rs.getString("task_id"),
                rs.getString("implementer"),
                rs.getInt("required_approvals"),
                expected,
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("completed_at")),
                ConsensusResult.valueOf(rs.getString("final_result")));
    }
}
