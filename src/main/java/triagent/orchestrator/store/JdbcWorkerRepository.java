package triagent.orchestrator.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.model.HeartbeatRecord;
import triagent.orchestrator.model.TaskType;
import triagent.orchestrator.model.Worker;
import triagent.orchestrator.model.WorkerStatus;
import triagent.orchestrator.repository.WorkerRepository;

import java.sql.*;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static triagent.orchestrator.store.JdbcTaskRepository.setTimestamp;
import static triagent.orchestrator.store.JdbcTaskRepository.toInstant;

/**
 * JDBC implementation of WorkerRepository.
 */
public class JdbcWorkerRepository implements WorkerRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkerRepository.class);

    private final Database db;

    public JdbcWorkerRepository(Database db) {
        this.db = db;
    }

    @Override
    public Worker register(Worker worker, Instant now) {
        String updateSql = """
                    UPDATE workers
                    SET pid = ?, host = ?, process_started_at = ?, shard = ?, specialization = ?, model = ?,
                        last_heartbeat = ?,
                        status = CASE WHEN status IN ('dead', 'crashed') THEN 'starting' ELSE status END
                    WHERE id = ?
                """;

        String insertSql = """
                    INSERT INTO workers (id, pid, host, process_started_at, status, shard, specialization, model,
                                         last_heartbeat, registered_at)
                    VALUES (?, ?, ?, ?, 'starting', ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    setLongOrNull(ps, 1, worker.pid());
                    ps.setString(2, worker.host());
                    setTimestamp(ps, 3, worker.processStartedAt());
                    ps.setString(4, worker.shard());
                    ps.setString(5, joinTypes(worker.specialization()));
                    ps.setString(6, worker.model());
                    setTimestamp(ps, 7, now);
                    ps.setString(8, worker.id());
                    updated = ps.executeUpdate();
                }

                if (updated == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        ps.setString(1, worker.id());
                        setLongOrNull(ps, 2, worker.pid());
                        ps.setString(3, worker.host());
                        setTimestamp(ps, 4, worker.processStartedAt());
                        ps.setString(5, worker.shard());
                        ps.setString(6, joinTypes(worker.specialization()));
                        ps.setString(7, worker.model());
                        setTimestamp(ps, 8, now);
                        setTimestamp(ps, 9, now);
                        ps.executeUpdate();
                    }
                    log.info("Registered new worker {} (pid={}@{}, shard={}, model={})",
                            worker.id(), worker.pid(), worker.host(), worker.shard(), worker.model());
                } else {
                    log.info("Re-registered worker {} (pid={})", worker.id(), worker.pid());
                }

                Worker stored = findById(conn, worker.id())
                        .orElseThrow(() -> new SQLException("Worker vanished during registration: " + worker.id()));
                conn.commit();
                return stored;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("register worker", worker.id(), e);
        }
    }

    @Override
    public Optional<Worker> findById(String workerId) {
        try (Connection conn = db.getConnection()) {
            return findById(conn, workerId);
        } catch (SQLException e) {
            throw SqlErrors.translate("find worker", workerId, e);
        }
    }

    private Optional<Worker> findById(Connection conn, String workerId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT * FROM workers WHERE id = ?")) {
            ps.setString(1, workerId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Worker> findAll() {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM workers ORDER BY id")) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw SqlErrors.translate("list workers", "*", e);
        }
    }

    @Override
    public List<Worker> findByStatus(WorkerStatus status) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT * FROM workers WHERE status = ? ORDER BY id")) {
            ps.setString(1, status.dbValue());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw SqlErrors.translate("find workers by status", status.dbValue(), e);
        }
    }

    @Override
    public boolean updateStatus(String workerId, WorkerStatus expected, WorkerStatus next) {
        String sql = "UPDATE workers SET status = ? WHERE id = ?" + (expected != null ? " AND status = ?" : "");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, next.dbValue());
            ps.setString(2, workerId);
            if (expected != null) {
                ps.setString(3, expected.dbValue());
            }

            try {
                int updated = ps.executeUpdate();
                conn.commit();
                if (updated > 0) {
                    log.debug("Worker {} -> {}", workerId, next);
                }
                return updated > 0;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("set worker status to " + next.dbValue(), workerId, e);
        }
    }

    @Override
    public boolean markRecovered(String workerId, WorkerStatus next) {
        String sql = "UPDATE workers SET status = ?"
                + (next == WorkerStatus.CRASHED ? ", crash_count = crash_count + 1" : "")
                + " WHERE id = ? AND status = 'busy'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, next.dbValue());
            ps.setString(2, workerId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate("mark worker " + next.dbValue(), workerId, e);
        }
    }

    @Override
    public boolean heartbeat(HeartbeatRecord hb) {
        String workerSql = "UPDATE workers SET last_heartbeat = ? WHERE id = ?";
        String updateSql = """
                    UPDATE worker_heartbeats
                    SET ts = ?, task_id = ?, progress = ?, expected_timeout_seconds = ?
                    WHERE worker_id = ?
                """;
        String insertSql = """
                    INSERT INTO worker_heartbeats (worker_id, ts, task_id, progress, expected_timeout_seconds)
                    VALUES (?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                try (PreparedStatement ps = conn.prepareStatement(workerSql)) {
                    setTimestamp(ps, 1, hb.timestamp());
                    ps.setString(2, hb.workerId());
                    if (ps.executeUpdate() == 0) {
                        conn.rollback();
                        return false;
                    }
                }

                Long expected = hb.expectedTimeout() != null ? hb.expectedTimeout().toSeconds() : null;
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    setTimestamp(ps, 1, hb.timestamp());
                    ps.setString(2, hb.taskId());
                    ps.setDouble(3, hb.progress());
                    setLongOrNull(ps, 4, expected);
                    ps.setString(5, hb.workerId());
                    updated = ps.executeUpdate();
                }
                if (updated == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        ps.setString(1, hb.workerId());
                        setTimestamp(ps, 2, hb.timestamp());
                        ps.setString(3, hb.taskId());
                        ps.setDouble(4, hb.progress());
                        setLongOrNull(ps, 5, expected);
                        ps.executeUpdate();
                    }
                }

                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("record heartbeat", hb.workerId(), e);
        }
    }

    @Override
    public Optional<HeartbeatRecord> findHeartbeat(String workerId) {
        String sql = "SELECT * FROM worker_heartbeats WHERE worker_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                long expected = rs.getLong("expected_timeout_seconds");
                Duration timeout = rs.wasNull() ? null : Duration.ofSeconds(expected);
                return Optional.of(new HeartbeatRecord(
                        rs.getString("worker_id"),
                        toInstant(rs.getTimestamp("ts")),
                        rs.getString("task_id"),
                        rs.getDouble("progress"),
                        timeout));
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("find heartbeat", workerId, e);
        }
    }

    @Override
    public boolean setPauseRequested(String workerId, boolean paused) {
        String sql = "UPDATE workers SET pause_requested = ?, halt_paused = FALSE WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setBoolean(1, paused);
            ps.setString(2, workerId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw SqlErrors.translate("set pause flag", workerId, e);
        }
    }

    @Override
    public int setPauseRequestedAll(boolean paused) {
        String sql = "UPDATE workers SET pause_requested = ?, halt_paused = FALSE WHERE status NOT IN ('dead', 'crashed')";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setBoolean(1, paused);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated;
        } catch (SQLException e) {
            throw SqlErrors.translate("set pause flag", "*", e);
        }
    }

    @Override
    public int pauseAllForHalt() {
        String sql = """
                    UPDATE workers SET pause_requested = TRUE, halt_paused = TRUE
                    WHERE status NOT IN ('dead', 'crashed') AND pause_requested = FALSE
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int updated = ps.executeUpdate();
            conn.commit();
            return updated;
        } catch (SQLException e) {
            throw SqlErrors.translate("pause workers for halt", "*", e);
        }
    }

    @Override
    public int resumeHaltPaused() {
        String sql = "UPDATE workers SET pause_requested = FALSE, halt_paused = FALSE WHERE halt_paused = TRUE";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int updated = ps.executeUpdate();
            conn.commit();
            return updated;
        } catch (SQLException e) {
            throw SqlErrors.translate("resume halted workers", "*", e);
        }
    }

    @Override
    public void incrementStats(String workerId, boolean completed) {
        String column = completed ? "tasks_completed" : "tasks_failed";
        String sql = "UPDATE workers SET " + column + " = " + column + " + 1 WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workerId);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw SqlErrors.translate("update worker stats", workerId, e);
        }
    }

    @Override
    public int countByStatus(WorkerStatus status) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM workers WHERE status = ?")) {
            ps.setString(1, status.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw SqlErrors.translate("count workers", status.dbValue(), e);
        }
    }

    private List<Worker> executeQuery(PreparedStatement ps) throws SQLException {
        List<Worker> workers = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                workers.add(mapRow(rs));
            }
        }
        return workers;
    }

    private Worker mapRow(ResultSet rs) throws SQLException {
        long pid = rs.getLong("pid");
        Long pidOrNull = rs.wasNull() ? null : pid;
        return Worker.builder()
                .id(rs.getString("id"))
                .pid(pidOrNull)
                .host(rs.getString("host"))
                .processStartedAt(toInstant(rs.getTimestamp("process_started_at")))
                .status(WorkerStatus.fromDb(rs.getString("status")))
                .shard(rs.getString("shard"))
                .specialization(parseTypes(rs.getString("specialization")))
                .model(rs.getString("model"))
                .lastHeartbeat(toInstant(rs.getTimestamp("last_heartbeat")))
                .pauseRequested(rs.getBoolean("pause_requested"))
                .tasksCompleted(rs.getInt("tasks_completed"))
                .tasksFailed(rs.getInt("tasks_failed"))
                .crashCount(rs.getInt("crash_count"))
                .registeredAt(toInstant(rs.getTimestamp("registered_at")))
                .build();
    }

    private static String joinTypes(Set<TaskType> types) {
        if (types == null || types.isEmpty()) {
            return null;
        }
        return types.stream().map(Enum::name).collect(Collectors.joining(","));
    }

    private static Set<TaskType> parseTypes(String raw) {
        Set<TaskType> types = EnumSet.noneOf(TaskType.class);
        if (raw != null) {
            for (String part : raw.split(",")) {
                if (!part.isBlank()) {
                    types.add(TaskType.valueOf(part.trim()));
                }
            }
        }
        return types;
    }

    private static void setLongOrNull(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value != null) {
            ps.setLong(index, value);
        } else {
            ps.setNull(index, Types.BIGINT);
        }
    }
}
