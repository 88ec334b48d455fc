package com.topostat.core.persistence;

import com.topostat.core.model.Outcome;
import com.topostat.core.model.PlatformInfo;
import com.topostat.core.model.ResultRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-based {@link ResultStore} persisting dimensions and facts to PostgreSQL.
 * <p>
 * Every dimension table carries a surrogate {@code id} and a unique constraint over
 * its natural key, so a concurrent duplicate insert fails the commit instead of
 * producing a second row. A unit of work is written in one transaction.
 * <p>
 * Read failures surface as Spring's {@link org.springframework.dao.DataAccessException}.
 * <p>
 * Tables are created automatically via {@link #createTables()}.
 */
public class JdbcResultStore implements ResultStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcResultStore.class);

    static final String RESULTS_TABLE = "results";

    private static final String ID_COLUMN = "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY";

    private static final List<String> CREATE_TABLES_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS directories (
                %s,
                name VARCHAR(255) NOT NULL,
                UNIQUE (name)
            )
            """.formatted(ID_COLUMN),
            """
            CREATE TABLE IF NOT EXISTS modules (
                %s,
                name         VARCHAR(255) NOT NULL,
                directory_id BIGINT NOT NULL REFERENCES directories (id),
                UNIQUE (name, directory_id)
            )
            """.formatted(ID_COLUMN),
            """
            CREATE TABLE IF NOT EXISTS tests (
                %s,
                name         VARCHAR(255) NOT NULL,
                module_id    BIGINT NOT NULL REFERENCES modules (id),
                directory_id BIGINT NOT NULL REFERENCES directories (id),
                UNIQUE (name, module_id, directory_id)
            )
            """.formatted(ID_COLUMN),
            """
            CREATE TABLE IF NOT EXISTS agents (
                %s,
                name VARCHAR(255) NOT NULL,
                UNIQUE (name)
            )
            """.formatted(ID_COLUMN),
            """
            CREATE TABLE IF NOT EXISTS plans (
                %s,
                name VARCHAR(255) NOT NULL,
                UNIQUE (name)
            )
            """.formatted(ID_COLUMN),
            """
            CREATE TABLE IF NOT EXISTS builds (
                %s,
                number  INTEGER NOT NULL CHECK (number >= 1),
                plan_id BIGINT NOT NULL REFERENCES plans (id),
                UNIQUE (number, plan_id)
            )
            """.formatted(ID_COLUMN),
            """
            CREATE TABLE IF NOT EXISTS jobs (
                %s,
                name    VARCHAR(255) NOT NULL,
                plan_id BIGINT NOT NULL REFERENCES plans (id),
                UNIQUE (name, plan_id)
            )
            """.formatted(ID_COLUMN),
            """
            CREATE TABLE IF NOT EXISTS %s (
                %s,
                directory_id BIGINT NOT NULL REFERENCES directories (id),
                module_id    BIGINT NOT NULL REFERENCES modules (id),
                test_id      BIGINT NOT NULL REFERENCES tests (id),
                agent_id     BIGINT NOT NULL REFERENCES agents (id),
                plan_id      BIGINT NOT NULL REFERENCES plans (id),
                build_id     BIGINT NOT NULL REFERENCES builds (id),
                job_id       BIGINT NOT NULL REFERENCES jobs (id),
                passed       BOOLEAN NOT NULL,
                skipped      BOOLEAN NOT NULL,
                duration     DOUBLE PRECISION NOT NULL CHECK (duration >= 0),
                recorded_at  TIMESTAMP NOT NULL,
                os_name      VARCHAR(255),
                arch_name    VARCHAR(255),
                kernel_version VARCHAR(255)
            )
            """.formatted(RESULTS_TABLE, ID_COLUMN),
            """
            CREATE INDEX IF NOT EXISTS results_plan_time_idx ON %s (plan_id, recorded_at)
            """.formatted(RESULTS_TABLE));

    private static final String FIND_DIRECTORY_SQL = """
            SELECT id FROM directories WHERE name = ?
            """;

    private static final String FIND_MODULE_SQL = """
            SELECT m.id, d.id AS directory_id
            FROM modules m
            JOIN directories d ON d.id = m.directory_id
            WHERE m.name = ? AND d.name = ?
            """;

    private static final String FIND_TEST_SQL = """
            SELECT t.id, m.id AS module_id, d.id AS directory_id
            FROM tests t
            JOIN modules m ON m.id = t.module_id
            JOIN directories d ON d.id = t.directory_id
            WHERE t.name = ? AND m.name = ? AND d.name = ? AND m.directory_id = d.id
            """;

    private static final String FIND_AGENT_SQL = """
            SELECT id FROM agents WHERE name = ?
            """;

    private static final String FIND_PLAN_SQL = """
            SELECT id FROM plans WHERE name = ?
            """;

    private static final String FIND_BUILD_SQL = """
            SELECT b.id, p.id AS plan_id
            FROM builds b
            JOIN plans p ON p.id = b.plan_id
            WHERE b.number = ? AND p.name = ?
            """;

    private static final String FIND_JOB_SQL = """
            SELECT j.id, p.id AS plan_id
            FROM jobs j
            JOIN plans p ON p.id = j.plan_id
            WHERE j.name = ? AND p.name = ?
            """;

    private static final String INSERT_NAMED_SQL = "INSERT INTO %s (name) VALUES (?)";
    private static final String INSERT_MODULE_SQL = "INSERT INTO modules (name, directory_id) VALUES (?, ?)";
    private static final String INSERT_TEST_SQL =
            "INSERT INTO tests (name, module_id, directory_id) VALUES (?, ?, ?)";
    private static final String INSERT_BUILD_SQL = "INSERT INTO builds (number, plan_id) VALUES (?, ?)";
    private static final String INSERT_JOB_SQL = "INSERT INTO jobs (name, plan_id) VALUES (?, ?)";

    private static final String INSERT_RESULT_SQL = """
            INSERT INTO %s (directory_id, module_id, test_id, agent_id, plan_id, build_id, job_id,
                            passed, skipped, duration, recorded_at, os_name, arch_name, kernel_version)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(RESULTS_TABLE);

    private static final String SELECT_RESULTS_SQL = """
            SELECT d.name AS directory, m.name AS module, t.name AS test, a.name AS agent,
                   p.name AS plan, b.number AS build, j.name AS job,
                   r.passed, r.skipped, r.duration, r.recorded_at,
                   r.os_name, r.arch_name, r.kernel_version
            FROM %s r
            JOIN directories d ON d.id = r.directory_id
            JOIN modules m     ON m.id = r.module_id
            JOIN tests t       ON t.id = r.test_id
            JOIN agents a      ON a.id = r.agent_id
            JOIN plans p       ON p.id = r.plan_id
            JOIN builds b      ON b.id = r.build_id
            JOIN jobs j        ON j.id = r.job_id
            WHERE p.name = ? AND r.recorded_at >= ? AND r.recorded_at <= ?
            ORDER BY r.recorded_at ASC, r.id ASC
            """.formatted(RESULTS_TABLE);

    private static final String COUNT_SQL = "SELECT COUNT(*) FROM %s";

    private final DataSource dataSource;

    public JdbcResultStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the dimension and result tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : CREATE_TABLES_SQL) {
                stmt.execute(sql);
            }
            log.info("Result schema ensured ({} dimension tables + '{}')",
                    DimensionType.values().length, RESULTS_TABLE);
        }
    }

    @Override
    public <T extends Dimension> Optional<T> find(NaturalKey key, Class<T> type) {
        if (key.parts().contains(null)) {
            return Optional.empty();
        }
        try (Connection conn = dataSource.getConnection()) {
            Dimension found = lookup(conn, key);
            if (type.isInstance(found)) {
                return Optional.of(type.cast(found));
            }
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Failed to look up " + key, e);
        }
        return Optional.empty();
    }

    private Dimension lookup(Connection conn, NaturalKey key) throws SQLException {
        List<String> parts = key.parts();
        switch (key.type()) {
            case DIRECTORY: {
                Long id = queryId(conn, FIND_DIRECTORY_SQL, parts.get(0));
                return id == null ? null : persisted(new DirectoryRow(parts.get(0)), id);
            }
            case MODULE:
                try (PreparedStatement stmt = conn.prepareStatement(FIND_MODULE_SQL)) {
                    stmt.setString(1, parts.get(0));
                    stmt.setString(2, parts.get(1));
                    try (ResultSet rs = stmt.executeQuery()) {
                        if (!rs.next()) {
                            return null;
                        }
                        DirectoryRow directory = persisted(new DirectoryRow(parts.get(1)), rs.getLong("directory_id"));
                        return persisted(new ModuleRow(parts.get(0), directory), rs.getLong("id"));
                    }
                }
            case TEST:
                try (PreparedStatement stmt = conn.prepareStatement(FIND_TEST_SQL)) {
                    stmt.setString(1, parts.get(0));
                    stmt.setString(2, parts.get(1));
                    stmt.setString(3, parts.get(2));
                    try (ResultSet rs = stmt.executeQuery()) {
                        if (!rs.next()) {
                            return null;
                        }
                        DirectoryRow directory = persisted(new DirectoryRow(parts.get(2)), rs.getLong("directory_id"));
                        ModuleRow module = persisted(new ModuleRow(parts.get(1), directory), rs.getLong("module_id"));
                        return persisted(new TestRow(parts.get(0), module, directory), rs.getLong("id"));
                    }
                }
            case AGENT: {
                Long id = queryId(conn, FIND_AGENT_SQL, parts.get(0));
                return id == null ? null : persisted(new AgentRow(parts.get(0)), id);
            }
            case PLAN: {
                Long id = queryId(conn, FIND_PLAN_SQL, parts.get(0));
                return id == null ? null : persisted(new PlanRow(parts.get(0)), id);
            }
            case BUILD:
                try (PreparedStatement stmt = conn.prepareStatement(FIND_BUILD_SQL)) {
                    int number = Integer.parseInt(parts.get(0));
                    stmt.setInt(1, number);
                    stmt.setString(2, parts.get(1));
                    try (ResultSet rs = stmt.executeQuery()) {
                        if (!rs.next()) {
                            return null;
                        }
                        PlanRow plan = persisted(new PlanRow(parts.get(1)), rs.getLong("plan_id"));
                        return persisted(new BuildRow(number, plan), rs.getLong("id"));
                    }
                }
            case JOB:
                try (PreparedStatement stmt = conn.prepareStatement(FIND_JOB_SQL)) {
                    stmt.setString(1, parts.get(0));
                    stmt.setString(2, parts.get(1));
                    try (ResultSet rs = stmt.executeQuery()) {
                        if (!rs.next()) {
                            return null;
                        }
                        PlanRow plan = persisted(new PlanRow(parts.get(1)), rs.getLong("plan_id"));
                        return persisted(new JobRow(parts.get(0), plan), rs.getLong("id"));
                    }
                }
            default:
                throw new IllegalArgumentException("Unknown dimension type " + key.type());
        }
    }

    private static Long queryId(Connection conn, String sql, String name) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, name);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : null;
            }
        }
    }

    private static <T extends Dimension> T persisted(T dimension, long id) {
        dimension.assignId(id);
        return dimension;
    }

    @Override
    public void commit(UnitOfWork work) throws PersistenceException {
        ResultFact fact = work.getFact();
        if (fact == null || !fact.isValid()) {
            throw new PersistenceException("Unit of work carries no valid fact");
        }
        for (Dimension dimension : work.getCreated()) {
            if (!dimension.isValid()) {
                throw new PersistenceException("Invalid dimension " + dimension);
            }
        }

        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                for (Dimension dimension : work.getCreated()) {
                    dimension.assignId(insert(conn, dimension));
                }
                for (Dimension dimension : fact.dimensions()) {
                    if (!dimension.isPersisted()) {
                        throw new SQLException("Fact references unresolved dimension " + dimension);
                    }
                }
                fact.assignId(insertFact(conn, fact));
                conn.commit();
                log.debug("Committed {} new dimension(s) and fact {}", work.getCreated().size(), fact.getId());
            } catch (SQLException e) {
                conn.rollback();
                work.rollbackIds();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            work.rollbackIds();
            throw new PersistenceException("Failed to commit unit of work: " + e.getMessage(), e);
        }
    }

    private long insert(Connection conn, Dimension dimension) throws SQLException {
        switch (dimension.type()) {
            case DIRECTORY:
                return insertNamed(conn, "directories", ((DirectoryRow) dimension).getName());
            case MODULE: {
                ModuleRow module = (ModuleRow) dimension;
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_MODULE_SQL, Statement.RETURN_GENERATED_KEYS)) {
                    stmt.setString(1, module.getName());
                    stmt.setLong(2, parentId(module.getDirectory()));
                    return executeInsert(stmt);
                }
            }
            case TEST: {
                TestRow test = (TestRow) dimension;
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_TEST_SQL, Statement.RETURN_GENERATED_KEYS)) {
                    stmt.setString(1, test.getName());
                    stmt.setLong(2, parentId(test.getModule()));
                    stmt.setLong(3, parentId(test.getDirectory()));
                    return executeInsert(stmt);
                }
            }
            case AGENT:
                return insertNamed(conn, "agents", ((AgentRow) dimension).getName());
            case PLAN:
                return insertNamed(conn, "plans", ((PlanRow) dimension).getName());
            case BUILD: {
                BuildRow build = (BuildRow) dimension;
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_BUILD_SQL, Statement.RETURN_GENERATED_KEYS)) {
                    stmt.setInt(1, build.getNumber());
                    stmt.setLong(2, parentId(build.getPlan()));
                    return executeInsert(stmt);
                }
            }
            case JOB: {
                JobRow job = (JobRow) dimension;
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_JOB_SQL, Statement.RETURN_GENERATED_KEYS)) {
                    stmt.setString(1, job.getName());
                    stmt.setLong(2, parentId(job.getPlan()));
                    return executeInsert(stmt);
                }
            }
            default:
                throw new SQLException("Unknown dimension type " + dimension.type());
        }
    }

    private static long insertNamed(Connection conn, String table, String name) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                INSERT_NAMED_SQL.formatted(table), Statement.RETURN_GENERATED_KEYS)) {
            stmt.setString(1, name);
            return executeInsert(stmt);
        }
    }

    private static long parentId(Dimension parent) throws SQLException {
        if (!parent.isPersisted()) {
            throw new SQLException("Parent not persisted: " + parent);
        }
        return parent.getId();
    }

    private static long executeInsert(PreparedStatement stmt) throws SQLException {
        stmt.executeUpdate();
        try (ResultSet keys = stmt.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("No generated key returned");
            }
            return keys.getLong(1);
        }
    }

    private long insertFact(Connection conn, ResultFact fact) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_RESULT_SQL, Statement.RETURN_GENERATED_KEYS)) {
            stmt.setLong(1, fact.getDirectory().getId());
            stmt.setLong(2, fact.getModule().getId());
            stmt.setLong(3, fact.getTest().getId());
            stmt.setLong(4, fact.getAgent().getId());
            stmt.setLong(5, fact.getPlan().getId());
            stmt.setLong(6, fact.getBuild().getId());
            stmt.setLong(7, fact.getJob().getId());
            stmt.setBoolean(8, fact.isPassed());
            stmt.setBoolean(9, fact.isSkipped());
            stmt.setDouble(10, fact.getDurationSeconds());
            stmt.setObject(11, toDatabase(fact.getTimestamp()));
            PlatformInfo platform = fact.getPlatform();
            if (platform != null) {
                stmt.setString(12, platform.osName());
                stmt.setString(13, platform.archName());
                stmt.setString(14, platform.kernelVersion());
            } else {
                stmt.setNull(12, Types.VARCHAR);
                stmt.setNull(13, Types.VARCHAR);
                stmt.setNull(14, Types.VARCHAR);
            }
            return executeInsert(stmt);
        }
    }

    @Override
    public List<ResultRecord> findResults(String plan, Instant from, Instant to) {
        List<ResultRecord> records = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_RESULTS_SQL)) {
            stmt.setString(1, plan);
            stmt.setObject(2, toDatabase(from));
            stmt.setObject(3, toDatabase(to));

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Failed to query results of plan '" + plan + "'", e);
        }

        return records;
    }

    private static ResultRecord fromResultSet(ResultSet rs) throws SQLException {
        Outcome outcome = rs.getBoolean("passed") ? Outcome.PASSED
                : rs.getBoolean("skipped") ? Outcome.SKIPPED : Outcome.FAILED;
        String os = rs.getString("os_name");
        PlatformInfo platform = os == null ? null
                : new PlatformInfo(os, rs.getString("arch_name"), rs.getString("kernel_version"));
        return new ResultRecord(
                platform != null ? ResultRecord.VERSION_2 : ResultRecord.VERSION_1,
                rs.getString("directory") + "." + rs.getString("module") + "." + rs.getString("test"),
                outcome,
                rs.getDouble("duration"),
                rs.getString("agent"),
                rs.getObject("recorded_at", LocalDateTime.class).toInstant(ZoneOffset.UTC),
                rs.getString("plan"),
                rs.getInt("build"),
                rs.getString("job"),
                platform);
    }

    @Override
    public long countResults() {
        return count(RESULTS_TABLE);
    }

    @Override
    public long countDimensions(DimensionType type) {
        return count(type.tableName());
    }

    private long count(String table) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(COUNT_SQL.formatted(table));
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Failed to count rows of '" + table + "'", e);
        }
    }

    private static LocalDateTime toDatabase(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
