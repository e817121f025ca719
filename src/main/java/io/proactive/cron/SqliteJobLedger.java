package io.proactive.cron;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * SQLite-backed job ledger.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code scheduled_jobs}: one row per job, keyed by id</li>
 *   <li>{@code idx_scheduled_jobs_due}: {@code (status, next_run_at)} for the due-job query</li>
 * </ul>
 *
 * <p>Instants are stored as fixed-width UTC strings with millisecond precision so that
 * string comparison in SQL is chronological. All methods share one connection and are
 * serialized on this instance.</p>
 */
public class SqliteJobLedger implements JobLedger {

    private static final Logger log = LoggerFactory.getLogger(SqliteJobLedger.class);

    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private static final String COLUMNS = """
            id, name, description, job_type, schedule, prompt, next_run_at, last_run_at,
            status, failure_count, created_at, updated_at""";

    private final String dbPath;
    private final Clock clock;
    private Connection connection;

    public SqliteJobLedger(String dbPath, Clock clock) {
        this.dbPath = dbPath;
        this.clock = clock;
    }

    /**
     * Opens the connection and creates the schema if needed.
     */
    public synchronized void init() {
        Path parent = Path.of(dbPath).toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new LedgerException("Failed to create ledger directory: " + parent, e);
        }
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            try (var stmt = connection.createStatement()) {
                stmt.execute("PRAGMA journal_mode=WAL");
                stmt.execute("PRAGMA busy_timeout=5000");
            }
            createSchema();
            log.info("Job ledger initialized at: {}", dbPath);
        } catch (SQLException e) {
            throw new LedgerException("Job ledger initialization failed at " + dbPath, e);
        }
    }

    private void createSchema() throws SQLException {
        try (var stmt = connection.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS scheduled_jobs (
                    id TEXT PRIMARY KEY,
                    name TEXT NOT NULL,
                    description TEXT,
                    job_type TEXT NOT NULL,
                    schedule TEXT NOT NULL,
                    prompt TEXT NOT NULL,
                    next_run_at TEXT NOT NULL,
                    last_run_at TEXT,
                    status TEXT NOT NULL DEFAULT 'active',
                    failure_count INTEGER NOT NULL DEFAULT 0,
                    created_at TEXT NOT NULL,
                    updated_at TEXT NOT NULL
                )
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_scheduled_jobs_due ON scheduled_jobs(status, next_run_at)
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_scheduled_jobs_name ON scheduled_jobs(name)
                """);
        }
    }

    @Override
    public synchronized ScheduledJob create(CreateJobRequest request, Instant initialNextRun) {
        String id = UUID.randomUUID().toString();
        String now = format(clock.instant());

        String sql = """
            INSERT INTO scheduled_jobs (id, name, description, job_type, schedule, prompt, next_run_at,
                                        status, failure_count, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, 'active', 0, ?, ?)
            """;
        try (var stmt = connection().prepareStatement(sql)) {
            stmt.setString(1, id);
            stmt.setString(2, request.name());
            stmt.setString(3, request.description());
            stmt.setString(4, request.jobType().value());
            stmt.setString(5, request.schedule());
            stmt.setString(6, request.prompt());
            stmt.setString(7, format(initialNextRun));
            stmt.setString(8, now);
            stmt.setString(9, now);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new LedgerException("Failed to create job '" + request.name() + "'", e);
        }

        log.debug("Created job {} '{}' ({}, next run {})", id, request.name(), request.jobType().value(), initialNextRun);
        return getById(id).orElseThrow(() -> new LedgerException("Job vanished after insert: " + id, null));
    }

    @Override
    public synchronized Optional<ScheduledJob> getById(String id) {
        return queryOne("SELECT " + COLUMNS + " FROM scheduled_jobs WHERE id = ?", id);
    }

    @Override
    public synchronized Optional<ScheduledJob> findByName(String name) {
        return queryOne("""
                SELECT %s FROM scheduled_jobs
                WHERE name = ? AND status IN ('active', 'paused')
                ORDER BY created_at
                LIMIT 1
                """.formatted(COLUMNS), name);
    }

    @Override
    public synchronized List<ScheduledJob> list(boolean includeTerminal) {
        String sql = includeTerminal
                ? "SELECT " + COLUMNS + " FROM scheduled_jobs ORDER BY next_run_at"
                : "SELECT " + COLUMNS + " FROM scheduled_jobs WHERE status = 'active' ORDER BY next_run_at";
        try (var stmt = connection().prepareStatement(sql)) {
            return queryAll(stmt);
        } catch (SQLException e) {
            throw new LedgerException("Failed to list jobs", e);
        }
    }

    @Override
    public synchronized List<ScheduledJob> getDueJobs(Instant asOf) {
        String sql = """
            SELECT %s FROM scheduled_jobs
            WHERE status = 'active' AND next_run_at <= ?
            ORDER BY next_run_at
            """.formatted(COLUMNS);
        try (var stmt = connection().prepareStatement(sql)) {
            stmt.setString(1, format(asOf));
            return queryAll(stmt);
        } catch (SQLException e) {
            throw new LedgerException("Failed to query due jobs", e);
        }
    }

    @Override
    public synchronized void updateAfterRun(String id, Optional<Instant> nextRun) {
        String now = format(clock.instant());
        try {
            if (nextRun.isPresent()) {
                try (var stmt = connection().prepareStatement("""
                        UPDATE scheduled_jobs
                        SET last_run_at = ?, next_run_at = ?, failure_count = 0, updated_at = ?
                        WHERE id = ?
                        """)) {
                    stmt.setString(1, now);
                    stmt.setString(2, format(nextRun.get()));
                    stmt.setString(3, now);
                    stmt.setString(4, id);
                    stmt.executeUpdate();
                }
            } else {
                try (var stmt = connection().prepareStatement("""
                        UPDATE scheduled_jobs
                        SET last_run_at = ?, status = 'completed', updated_at = ?
                        WHERE id = ?
                        """)) {
                    stmt.setString(1, now);
                    stmt.setString(2, now);
                    stmt.setString(3, id);
                    stmt.executeUpdate();
                }
            }
        } catch (SQLException e) {
            throw new LedgerException("Failed to record run of job " + id, e);
        }
    }

    @Override
    public synchronized int incrementFailureCount(String id) {
        try (var stmt = connection().prepareStatement("""
                UPDATE scheduled_jobs
                SET failure_count = failure_count + 1, updated_at = ?
                WHERE id = ?
                """)) {
            stmt.setString(1, format(clock.instant()));
            stmt.setString(2, id);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new LedgerException("Failed to increment failure count of job " + id, e);
        }
        return getById(id).map(ScheduledJob::failureCount).orElse(0);
    }

    @Override
    public synchronized void updateStatus(String id, JobStatus status) {
        try (var stmt = connection().prepareStatement(
                "UPDATE scheduled_jobs SET status = ?, updated_at = ? WHERE id = ?")) {
            stmt.setString(1, status.value());
            stmt.setString(2, format(clock.instant()));
            stmt.setString(3, id);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new LedgerException("Failed to update status of job " + id, e);
        }
    }

    @Override
    public synchronized boolean delete(String id) {
        try (var stmt = connection().prepareStatement("DELETE FROM scheduled_jobs WHERE id = ?")) {
            stmt.setString(1, id);
            return stmt.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new LedgerException("Failed to delete job " + id, e);
        }
    }

    @Override
    public synchronized void close() {
        if (connection != null) {
            try {
                connection.close();
                log.info("Job ledger closed");
            } catch (SQLException e) {
                log.error("Failed to close job ledger connection", e);
            } finally {
                connection = null;
            }
        }
    }

    private Connection connection() {
        if (connection == null) {
            throw new LedgerException("Job ledger is not open: " + dbPath, null);
        }
        return connection;
    }

    private Optional<ScheduledJob> queryOne(String sql, String param) {
        try (var stmt = connection().prepareStatement(sql)) {
            stmt.setString(1, param);
            try (var rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(toJob(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new LedgerException("Failed to read job", e);
        }
    }

    private List<ScheduledJob> queryAll(PreparedStatement stmt) throws SQLException {
        List<ScheduledJob> results = new ArrayList<>();
        try (var rs = stmt.executeQuery()) {
            while (rs.next()) {
                results.add(toJob(rs));
            }
        }
        return results;
    }

    static String format(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant.truncatedTo(ChronoUnit.MILLIS));
    }

    private static Instant parse(String value) {
        return value == null ? null : Instant.parse(value);
    }

    private ScheduledJob toJob(ResultSet rs) throws SQLException {
        return new ScheduledJob(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("description"),
                JobType.fromValue(rs.getString("job_type")),
                rs.getString("schedule"),
                rs.getString("prompt"),
                parse(rs.getString("next_run_at")),
                parse(rs.getString("last_run_at")),
                JobStatus.fromValue(rs.getString("status")),
                rs.getInt("failure_count"),
                parse(rs.getString("created_at")),
                parse(rs.getString("updated_at"))
        );
    }
}
