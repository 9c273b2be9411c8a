package triagent.orchestrator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import triagent.orchestrator.config.OrchestratorConfig;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling; every worker process and the
 * coordinator share the same database.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(OrchestratorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize(), config.databaseLockTimeout());
    }

    public Database(String jdbcUrl, int poolSize, Duration lockTimeout) {
        String url = withLockTimeout(jdbcUrl, lockTimeout);

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(url);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("triagent-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", url);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * H2 waits this long on a row lock before failing the statement.
     */
    static String withLockTimeout(String jdbcUrl, Duration lockTimeout) {
        if (!jdbcUrl.startsWith("jdbc:h2:") || jdbcUrl.toUpperCase().contains("LOCK_TIMEOUT=")) {
            return jdbcUrl;
        }
        return jdbcUrl + ";LOCK_TIMEOUT=" + lockTimeout.toMillis();
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id              VARCHAR(128) PRIMARY KEY,
                            name            VARCHAR(512) NOT NULL,
                            type            VARCHAR(20) NOT NULL,
                            priority        INT NOT NULL DEFAULT 2,
                            state           VARCHAR(20) NOT NULL DEFAULT 'QUEUED',
                            shard           VARCHAR(64),
                            assigned_model  VARCHAR(64),
                            lane            VARCHAR(32),
                            worker_id       VARCHAR(128),
                            payload         CLOB,
                            result          CLOB,
                            feedback        CLOB,
                            error           VARCHAR(4096),
                            trace_id        VARCHAR(64),
                            created_at      TIMESTAMP NOT NULL,
                            started_at      TIMESTAMP,
                            heartbeat_at    TIMESTAMP,
                            completed_at    TIMESTAMP,
                            retry_count     INT NOT NULL DEFAULT 0,
                            max_retries     INT NOT NULL DEFAULT 3,
                            CONSTRAINT chk_tasks_state CHECK (state IN
                                ('QUEUED','RUNNING','REVIEW','APPROVED','REJECTED','COMPLETED','FAILED','ESCALATED')),
                            CONSTRAINT chk_tasks_priority CHECK (priority BETWEEN 0 AND 3)
                        );
                    """);

            // ---------- WORKERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS workers (
                            id              VARCHAR(128) PRIMARY KEY,
                            pid             BIGINT,
                            host            VARCHAR(255),
                            process_started_at TIMESTAMP,
                            status          VARCHAR(16) NOT NULL DEFAULT 'starting',
                            shard           VARCHAR(64),
                            specialization  VARCHAR(256),
                            model           VARCHAR(64),
                            last_heartbeat  TIMESTAMP,
                            pause_requested BOOLEAN NOT NULL DEFAULT FALSE,
                            halt_paused     BOOLEAN NOT NULL DEFAULT FALSE,
                            tasks_completed INT NOT NULL DEFAULT 0,
                            tasks_failed    INT NOT NULL DEFAULT 0,
                            crash_count     INT NOT NULL DEFAULT 0,
                            registered_at   TIMESTAMP NOT NULL,
                            CONSTRAINT chk_workers_status CHECK (status IN
                                ('starting','idle','busy','paused','stopping','dead','crashed'))
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS worker_heartbeats (
                            worker_id                VARCHAR(128) PRIMARY KEY,
                            ts                       TIMESTAMP NOT NULL,
                            task_id                  VARCHAR(128),
                            progress                 DOUBLE NOT NULL DEFAULT 0,
                            expected_timeout_seconds BIGINT
                        );
                    """);

            // ---------- CONSENSUS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS consensus_sessions (
                            id                 VARCHAR(64) PRIMARY KEY,
                            task_id            VARCHAR(128) NOT NULL,
                            implementer        VARCHAR(64) NOT NULL,
                            required_approvals INT NOT NULL,
                            expected_voters    VARCHAR(512) NOT NULL,
                            created_at         TIMESTAMP NOT NULL,
                            completed_at       TIMESTAMP,
                            final_result       VARCHAR(16) NOT NULL DEFAULT 'PENDING'
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS consensus_votes (
                            session_id  VARCHAR(64) NOT NULL,
                            voter       VARCHAR(64) NOT NULL,
                            vote        VARCHAR(16) NOT NULL,
                            reason      VARCHAR(4096),
                            duration_ms BIGINT NOT NULL DEFAULT 0,
                            created_at  TIMESTAMP NOT NULL,
                            PRIMARY KEY (session_id, voter)
                        );
                    """);

            // ---------- BREAKERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS breakers (
                            capability          VARCHAR(64) PRIMARY KEY,
                            state               VARCHAR(16) NOT NULL DEFAULT 'CLOSED',
                            failure_count       INT NOT NULL DEFAULT 0,
                            opened_at           TIMESTAMP,
                            half_open_in_flight BOOLEAN NOT NULL DEFAULT FALSE,
                            last_failure        TIMESTAMP,
                            last_success        TIMESTAMP
                        );
                    """);

            // ---------- BUDGET ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS budget_ledger (
                            id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            ts          TIMESTAMP NOT NULL,
                            amount      DECIMAL(14, 6) NOT NULL,
                            capability  VARCHAR(64),
                            task_id     VARCHAR(128),
                            CONSTRAINT chk_ledger_amount CHECK (amount >= 0)
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS kill_switch (
                            id           INT PRIMARY KEY,
                            active       BOOLEAN NOT NULL DEFAULT FALSE,
                            reason       VARCHAR(1024),
                            activated_at TIMESTAMP,
                            reset_at     TIMESTAMP,
                            reset_by     VARCHAR(128),
                            CONSTRAINT chk_kill_switch_single CHECK (id = 1)
                        );
                    """);

            // ---------- AUDIT ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS events (
                            id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            task_id     VARCHAR(128),
                            worker_id   VARCHAR(128),
                            event_type  VARCHAR(32) NOT NULL,
                            actor       VARCHAR(128),
                            detail      CLOB,
                            trace_id    VARCHAR(64),
                            created_at  TIMESTAMP NOT NULL
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS escalations (
                            id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            task_id     VARCHAR(128) NOT NULL,
                            reason      VARCHAR(2048) NOT NULL,
                            severity    VARCHAR(16) NOT NULL,
                            status      VARCHAR(16) NOT NULL DEFAULT 'OPEN',
                            created_at  TIMESTAMP NOT NULL,
                            resolved_at TIMESTAMP,
                            resolved_by VARCHAR(128)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_claim ON tasks(state, priority, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_worker_state ON tasks(worker_id, state);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_workers_status ON workers(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_sessions_task ON consensus_sessions(task_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_ledger_ts ON budget_ledger(ts);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_events_task ON events(task_id, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_escalations_status ON escalations(status);");

            // Store-level transition guards
            st.addBatch("CREATE TRIGGER IF NOT EXISTS trg_workers_status BEFORE INSERT, UPDATE ON workers "
                    + "FOR EACH ROW CALL '" + WorkerStatusTrigger.class.getName() + "'");
            st.addBatch("CREATE TRIGGER IF NOT EXISTS trg_tasks_state BEFORE INSERT, UPDATE ON tasks "
                    + "FOR EACH ROW CALL '" + TaskStateTrigger.class.getName() + "'");

            st.executeBatch();

            try (ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM kill_switch WHERE id = 1")) {
                rs.next();
                if (rs.getInt(1) == 0) {
                    st.executeUpdate("INSERT INTO kill_switch (id, active) VALUES (1, FALSE)");
                }
            }

            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
