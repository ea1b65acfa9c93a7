package com.ctm.store;

import com.ctm.store.model.AssignmentRecord;
import com.ctm.store.model.HitRecord;
import com.ctm.store.model.PairingRecord;
import com.ctm.store.model.RunRecord;
import com.ctm.store.model.WorkerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link RecordStore} over the task platform's SQLite run-data file.
 *
 * Opens one JDBC connection per query. {@link #init()} creates any missing table so the
 * monitor can start against an empty file before the first run is recorded.
 */
public final class SqliteRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteRecordStore.class);

    private final Path dbFile;
    private final String jdbcUrl;

    public SqliteRecordStore(Path dbFile) {
        this.dbFile = dbFile;
        this.jdbcUrl = "jdbc:sqlite:" + dbFile;
    }

    public void init() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS runs (
                        run_id TEXT PRIMARY KEY,
                        created INTEGER NOT NULL,
                        maximum INTEGER NOT NULL,
                        completed INTEGER NOT NULL,
                        failed INTEGER NOT NULL,
                        taskname TEXT,
                        launch_time INTEGER
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS hits (
                        hit_id TEXT PRIMARY KEY,
                        expiration INTEGER NOT NULL,
                        hit_status TEXT,
                        assignments_pending INTEGER,
                        assignments_available INTEGER,
                        assignments_complete INTEGER,
                        run_id TEXT,
                        FOREIGN KEY (run_id) REFERENCES runs (run_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS assignments (
                        assignment_id TEXT PRIMARY KEY,
                        status TEXT,
                        approve_time INTEGER,
                        worker_id TEXT,
                        hit_id TEXT,
                        FOREIGN KEY (worker_id) REFERENCES workers (worker_id),
                        FOREIGN KEY (hit_id) REFERENCES hits (hit_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS workers (
                        worker_id TEXT PRIMARY KEY,
                        accepted INTEGER NOT NULL,
                        disconnected INTEGER NOT NULL,
                        expired INTEGER NOT NULL,
                        completed INTEGER NOT NULL,
                        approved INTEGER NOT NULL,
                        rejected INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS pairings (
                        status TEXT,
                        onboarding_start INTEGER,
                        onboarding_end INTEGER,
                        task_start INTEGER,
                        task_end INTEGER,
                        conversation_id TEXT,
                        bonus_amount INTEGER,
                        bonus_text TEXT,
                        bonus_paid BOOLEAN,
                        notes TEXT,
                        worker_id TEXT,
                        assignment_id TEXT,
                        run_id TEXT,
                        onboarding_id TEXT,
                        extra_bonus_amount INTEGER,
                        extra_bonus_text TEXT,
                        FOREIGN KEY (worker_id) REFERENCES workers (worker_id),
                        FOREIGN KEY (assignment_id) REFERENCES assignments (assignment_id),
                        FOREIGN KEY (run_id) REFERENCES runs (run_id)
                    )
                    """);
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize schema in " + dbFile, e);
        }
        log.info("Record store ready: {}", dbFile);
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    // ── Runs ──────────────────────────────────────────────────────────────────

    @Override
    public List<RunRecord> getAllRuns() {
        return query("SELECT * FROM runs", null, SqliteRecordStore::run, "runs");
    }

    @Override
    public Optional<RunRecord> getRun(String runId) {
        return first(query("SELECT * FROM runs WHERE run_id = ?", runId, SqliteRecordStore::run, "run"));
    }

    @Override
    public List<HitRecord> getHitsForRun(String runId) {
        return query("SELECT * FROM hits WHERE run_id = ?", runId, SqliteRecordStore::hit, "hits for run");
    }

    @Override
    public List<AssignmentRecord> getAssignmentsForRun(String runId) {
        String sql = """
                SELECT assignments.* FROM assignments
                INNER JOIN hits ON assignments.hit_id = hits.hit_id
                WHERE hits.run_id = ?
                """;
        return query(sql, runId, SqliteRecordStore::assignment, "assignments for run");
    }

    @Override
    public List<PairingRecord> getPairingsForRun(String runId) {
        return query("SELECT * FROM pairings WHERE run_id = ?", runId, SqliteRecordStore::pairing, "pairings for run");
    }

    // ── Workers ───────────────────────────────────────────────────────────────

    @Override
    public List<WorkerRecord> getAllWorkers() {
        return query("SELECT * FROM workers", null, SqliteRecordStore::worker, "workers");
    }

    @Override
    public Optional<WorkerRecord> getWorker(String workerId) {
        return first(query("SELECT * FROM workers WHERE worker_id = ?", workerId, SqliteRecordStore::worker, "worker"));
    }

    @Override
    public List<AssignmentRecord> getAssignmentsForWorker(String workerId) {
        return query("SELECT * FROM assignments WHERE worker_id = ?", workerId,
                SqliteRecordStore::assignment, "assignments for worker");
    }

    @Override
    public List<PairingRecord> getPairingsForWorker(String workerId) {
        return query("SELECT * FROM pairings WHERE worker_id = ?", workerId,
                SqliteRecordStore::pairing, "pairings for worker");
    }

    // ── Row mapping ───────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private <T> List<T> query(String sql, String param, RowMapper<T> mapper, String what) {
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (param != null) ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> out = new ArrayList<>();
                while (rs.next()) out.add(mapper.map(rs));
                return out;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read " + what, e);
        }
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private static RunRecord run(ResultSet rs) throws SQLException {
        return new RunRecord(
                rs.getString("run_id"), rs.getLong("created"), rs.getLong("maximum"),
                rs.getLong("completed"), rs.getLong("failed"), rs.getString("taskname"),
                nullableNumber(rs, "launch_time"));
    }

    private static HitRecord hit(ResultSet rs) throws SQLException {
        return new HitRecord(
                rs.getString("hit_id"), rs.getLong("expiration"), rs.getString("hit_status"),
                nullableInt(rs, "assignments_pending"), nullableInt(rs, "assignments_available"),
                nullableInt(rs, "assignments_complete"), rs.getString("run_id"));
    }

    private static AssignmentRecord assignment(ResultSet rs) throws SQLException {
        return new AssignmentRecord(
                rs.getString("assignment_id"), rs.getString("status"), nullableNumber(rs, "approve_time"),
                rs.getString("worker_id"), rs.getString("hit_id"));
    }

    private static WorkerRecord worker(ResultSet rs) throws SQLException {
        return new WorkerRecord(
                rs.getString("worker_id"), rs.getLong("accepted"), rs.getLong("disconnected"),
                rs.getLong("expired"), rs.getLong("completed"), rs.getLong("approved"),
                rs.getLong("rejected"));
    }

    private static PairingRecord pairing(ResultSet rs) throws SQLException {
        return new PairingRecord(
                rs.getString("status"),
                nullableNumber(rs, "onboarding_start"),
                nullableNumber(rs, "onboarding_end"),
                nullableNumber(rs, "task_start"),
                nullableNumber(rs, "task_end"),
                rs.getString("conversation_id"),
                nullableNumber(rs, "bonus_amount"),
                rs.getString("bonus_text"),
                nullableBoolean(rs, "bonus_paid"),
                rs.getString("notes"),
                rs.getString("worker_id"),
                rs.getString("assignment_id"),
                rs.getString("run_id"),
                rs.getString("onboarding_id"),
                nullableNumber(rs, "extra_bonus_amount"),
                rs.getString("extra_bonus_text"));
    }

    /**
     * SQLite keeps REAL values in INTEGER-affinity columns, so INTEGER values come back as
     * {@link Long} and REAL ones as a {@link BigDecimal} that renders without an exponent.
     */
    private static Number nullableNumber(ResultSet rs, String column) throws SQLException {
        Object v = rs.getObject(column);
        if (v == null) return null;
        if (v instanceof Double || v instanceof Float) return BigDecimal.valueOf(((Number) v).doubleValue());
        if (v instanceof Number n) return n.longValue();
        throw new SQLException("Column " + column + " holds non-numeric value '" + v + "'");
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }

    private static Boolean nullableBoolean(ResultSet rs, String column) throws SQLException {
        boolean v = rs.getBoolean(column);
        return rs.wasNull() ? null : v;
    }
}
