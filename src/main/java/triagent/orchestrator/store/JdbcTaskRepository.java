package triagent.orchestrator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.model.ClaimFilter;
import triagent.orchestrator.model.Priority;
import triagent.orchestrator.model.Task;
import triagent.orchestrator.model.TaskState;
import triagent.orchestrator.model.TaskType;
import triagent.orchestrator.repository.TaskRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of TaskRepository.
 * Claims use a conditional UPDATE ({@code WHERE state = 'QUEUED'}) as the only
 * serialization point between worker processes.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean insertIfAbsent(Task task) {
        String sql = """
                    INSERT INTO tasks (id, name, type, priority, state, shard, assigned_model, lane, payload,
                                       trace_id, created_at, retry_count, max_retries)
                    VALUES (?, ?, ?, ?, 'QUEUED', ?, ?, ?, ?, ?, ?, 0, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.name());
            ps.setString(3, task.type().name());
            ps.setInt(4, task.priority().level());
            ps.setString(5, task.shard());
            ps.setString(6, task.assignedModel());
            ps.setString(7, task.lane());
            ps.setString(8, task.payload());
            ps.setString(9, task.traceId());
            setTimestamp(ps, 10, task.createdAt() != null ? task.createdAt() : Instant.now());
            ps.setInt(11, task.maxRetries());

            try {
                ps.executeUpdate();
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                if (SqlErrors.isDuplicateKey(e)) {
                    return false;
                }
                throw e;
            }

            log.debug("Inserted task {} ({}, {})", task.id(), task.type(), task.priority());
            return true;
        } catch (SQLException e) {
            throw SqlErrors.translate("insert task", task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw SqlErrors.translate("find task", taskId, e);
        }
    }

    @Override
    public List<Task> findByState(TaskState state, int limit) {
        String sql = "SELECT * FROM tasks WHERE state = ? ORDER BY priority, created_at, id LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, state.name());
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw SqlErrors.translate("find tasks by state", state.name(), e);
        }
    }

    @Override
    public List<Task> findRunningByWorker(String workerId) {
        String sql = "SELECT * FROM tasks WHERE worker_id = ? AND state = 'RUNNING' ORDER BY started_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workerId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw SqlErrors.translate("find running tasks of worker", workerId, e);
        }
    }

    @Override
    public List<Task> findSilentRunning(Instant cutoff) {
        String sql = """
                    SELECT * FROM tasks
                    WHERE state = 'RUNNING' AND COALESCE(heartbeat_at, started_at) < ?
                    ORDER BY COALESCE(heartbeat_at, started_at)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, cutoff);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw SqlErrors.translate("find silent running tasks", "*", e);
        }
    }

    @Override
    public int countRunningByWorker(String workerId) {
        String sql = "SELECT COUNT(*) FROM tasks WHERE worker_id = ? AND state = 'RUNNING'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workerId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("count running tasks of worker", workerId, e);
        }
    }

    @Override
    public List<Task> findClaimCandidates(ClaimFilter filter, int limit) {
        StringBuilder sql = new StringBuilder("SELECT * FROM tasks WHERE state = 'QUEUED'");
        List<Object> params = new ArrayList<>();

        if (filter.shard() != null) {
            sql.append(" AND shard = ?");
            params.add(filter.shard());
        }
        if (filter.model() != null) {
            sql.append(" AND (assigned_model IS NULL OR assigned_model = ?)");
            params.add(filter.model());
        }
        if (filter.types() != null && !filter.types().isEmpty()) {
            sql.append(" AND type IN (");
            int i = 0;
            for (TaskType type : filter.types()) {
                sql.append(i++ == 0 ? "?" : ", ?");
                params.add(type.name());
            }
            sql.append(")");
        }
        sql.append(" ORDER BY priority, created_at, id LIMIT ?");
        params.add(limit);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            List<Task> result = executeQuery(ps);
            conn.commit();
            return result;
        } catch (SQLException e) {
            throw SqlErrors.translate("find claim candidates", String.valueOf(filter), e);
        }
    }

    @Override
    public boolean tryClaim(String taskId, String workerId, Instant now) {
        String sql = """
                    UPDATE tasks
                    SET state = 'RUNNING', worker_id = ?, started_at = ?, heartbeat_at = ?
                    WHERE id = ? AND state = 'QUEUED'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workerId);
            setTimestamp(ps, 2, now);
            setTimestamp(ps, 3, now);
            ps.setString(4, taskId);

            try {
                int updated = ps.executeUpdate();
                conn.commit();
                return updated == 1;
            } catch (SQLException e) {
                conn.rollback();
                if (SqlErrors.isConcurrentUpdate(e) || SqlErrors.isInvalidTransition(e)) {
                    log.debug("Claim of {} by {} lost to a concurrent writer", taskId, workerId);
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("claim task", taskId, e);
        }
    }

    @Override
    public boolean release(String taskId, String workerId) {
        String sql = """
                    UPDATE tasks
                    SET state = 'QUEUED', worker_id = NULL, started_at = NULL, heartbeat_at = NULL
                    WHERE id = ? AND state = 'RUNNING' AND worker_id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            ps.setString(2, workerId);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} released by {}", taskId, workerId);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate("release task", taskId, e);
        }
    }

    @Override
    public boolean submitForReview(String taskId, String workerId, String result) {
        String sql = """
                    UPDATE tasks
                    SET state = 'REVIEW', worker_id = NULL, result = ?
                    WHERE id = ? AND state = 'RUNNING' AND worker_id = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, result);
            ps.setString(2, taskId);
            ps.setString(3, workerId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate("submit task for review", taskId, e);
        }
    }

    @Override
    public boolean requeueForRetry(String taskId, TaskState from, String expectedOwner, String feedback,
            String error) {
        String sql = """
                    UPDATE tasks
                    SET state = 'QUEUED', worker_id = NULL, started_at = NULL, heartbeat_at = NULL,
                        retry_count = retry_count + 1,
                        feedback = COALESCE(?, feedback),
                        error = COALESCE(?, error)
                    WHERE id = ? AND state = ?
                """ + (expectedOwner != null ? " AND worker_id = ?" : "");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, feedback);
            ps.setString(2, truncate(error));
            ps.setString(3, taskId);
            ps.setString(4, from.name());
            if (expectedOwner != null) {
                ps.setString(5, expectedOwner);
            }
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} requeued from {} for retry", taskId, from);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate("requeue task", taskId, e);
        }
    }

    @Override
    public boolean transition(String taskId, TaskState from, TaskState to, String expectedOwner, String error,
            Instant now) {
        String sql = """
                    UPDATE tasks
                    SET state = ?, worker_id = NULL, error = COALESCE(?, error), completed_at = ?
                    WHERE id = ? AND state = ?
                """ + (expectedOwner != null ? " AND worker_id = ?" : "");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, to.name());
            ps.setString(2, truncate(error));
            setTimestamp(ps, 3, to.isTerminal() ? now : null);
            ps.setString(4, taskId);
            ps.setString(5, from.name());
            if (expectedOwner != null) {
                ps.setString(6, expectedOwner);
            }
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} {} -> {}", taskId, from, to);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate("move task " + from + " -> " + to, taskId, e);
        }
    }

    @Override
    public boolean touchHeartbeat(String taskId, String workerId, Instant now) {
        String sql = "UPDATE tasks SET heartbeat_at = ? WHERE id = ? AND worker_id = ? AND state = 'RUNNING'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            ps.setString(2, taskId);
            ps.setString(3, workerId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate("touch task heartbeat", taskId, e);
        }
    }

    @Override
    public int countByState(TaskState state) {
        String sql = "SELECT COUNT(*) FROM tasks WHERE state = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, state.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("count tasks", state.name(), e);
        }
    }

    @Override
    public Map<String, Integer> countQueuedByShard() {
        String sql = """
                    SELECT COALESCE(shard, 'none') AS shard_key, COUNT(*) AS cnt
                    FROM tasks WHERE state = 'QUEUED'
                    GROUP BY COALESCE(shard, 'none')
                    ORDER BY shard_key
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            Map<String, Integer> counts = new LinkedHashMap<>();
            while (rs.next()) {
                counts.put(rs.getString("shard_key"), rs.getInt("cnt"));
            }
            return counts;
        } catch (SQLException e) {
            throw SqlErrors.translate("count queued tasks per shard", "*", e);
        }
    }

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> tasks = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                tasks.add(mapRow(rs));
            }
        }
        return tasks;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .type(TaskType.valueOf(rs.getString("type")))
                .priority(Priority.fromLevel(rs.getInt("priority")))
                .state(TaskState.valueOf(rs.getString("state")))
                .shard(rs.getString("shard"))
                .assignedModel(rs.getString("assigned_model"))
                .lane(rs.getString("lane"))
                .workerId(rs.getString("worker_id"))
                .payload(rs.getString("payload"))
                .result(rs.getString("result"))
                .feedback(rs.getString("feedback"))
                .error(rs.getString("error"))
                .traceId(rs.getString("trace_id"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .heartbeatAt(toInstant(rs.getTimestamp("heartbeat_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .retryCount(rs.getInt("retry_count"))
                .maxRetries(rs.getInt("max_retries"))
                .build();
    }

    private static String truncate(String s) {
        return s != null && s.length() > 4000 ? s.substring(0, 4000) : s;
    }

    static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }
}
