package com.topostat.core.persistence;

import com.topostat.core.model.Outcome;
import com.topostat.core.model.ResultRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static com.topostat.SampleRecords.T0;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Exercises {@link JdbcResultStore} against mocked JDBC objects, without a PostgreSQL database.
 */
class JdbcResultStoreTest {

    private DataSource dataSource;
    private Connection connection;
    private PreparedStatement statement;
    private ResultSet resultSet;
    private JdbcResultStore store;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = mock(DataSource.class);
        connection = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        resultSet = mock(ResultSet.class);

        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(connection.prepareStatement(anyString(), eq(Statement.RETURN_GENERATED_KEYS))).thenReturn(statement);
        when(connection.getAutoCommit()).thenReturn(true);
        when(statement.executeQuery()).thenReturn(resultSet);

        store = new JdbcResultStore(dataSource);
    }

    private static UnitOfWork freshUnit() {
        UnitOfWork work = new UnitOfWork();
        DirectoryRow dir = work.create(new DirectoryRow("bgpd"));
        ModuleRow module = work.create(new ModuleRow("test_basic", dir));
        TestRow test = work.create(new TestRow("test_convergence", module, dir));
        AgentRow agent = work.create(new AgentRow("h1"));
        PlanRow plan = work.create(new PlanRow("P"));
        BuildRow build = work.create(new BuildRow(3, plan));
        JobRow job = work.create(new JobRow("J", plan));
        work.setFact(new ResultFact(dir, module, test, agent, plan, build, job, Outcome.FAILED, 1.5, T0, null));
        return work;
    }

    @Test
    @DisplayName("createTables executes every DDL statement")
    void createTables() throws Exception {
        Statement ddl = mock(Statement.class);
        when(connection.createStatement()).thenReturn(ddl);

        store.createTables();

        // seven dimension tables, the results table and its index
        verify(ddl, times(9)).execute(anyString());
        verify(ddl).execute(contains("CREATE TABLE IF NOT EXISTS results"));
    }

    @Nested
    @DisplayName("commit")
    class Commit {

        @Test
        @DisplayName("inserts rows in one transaction and assigns generated ids")
        void commitsTransaction() throws Exception {
            ResultSet keys = mock(ResultSet.class);
            AtomicLong nextId = new AtomicLong();
            when(statement.getGeneratedKeys()).thenReturn(keys);
            when(keys.next()).thenReturn(true);
            when(keys.getLong(1)).thenAnswer(inv -> nextId.incrementAndGet());

            UnitOfWork work = freshUnit();
            store.commit(work);

            verify(connection).setAutoCommit(false);
            verify(connection).commit();
            verify(connection, never()).rollback();
            verify(statement, times(8)).executeUpdate();
            assertEquals(1L, work.getCreated().get(0).getId());
            assertEquals(8L, work.getFact().getId());
            verify(statement).setBoolean(8, false);
            verify(statement).setBoolean(9, false);
        }

        @Test
        @DisplayName("a failing insert rolls back and clears every assigned id")
        void rollsBackOnFailure() throws Exception {
            ResultSet keys = mock(ResultSet.class);
            when(statement.getGeneratedKeys()).thenReturn(keys);
            when(keys.next()).thenReturn(true);
            when(keys.getLong(1)).thenReturn(1L);
            when(statement.executeUpdate())
                    .thenReturn(1, 1, 1)
                    .thenThrow(new SQLException("duplicate key value violates unique constraint"));

            UnitOfWork work = freshUnit();
            PersistenceException e = assertThrows(PersistenceException.class, () -> store.commit(work));

            assertTrue(e.getMessage().contains("duplicate key"));
            verify(connection).rollback();
            verify(connection, never()).commit();
            verify(connection).setAutoCommit(true);
            work.getCreated().forEach(d -> assertFalse(d.isPersisted()));
            assertNull(work.getFact().getId());
        }

        @Test
        @DisplayName("an invalid fact is rejected before a connection is opened")
        void rejectsInvalidFact() throws Exception {
            assertThrows(PersistenceException.class, () -> store.commit(new UnitOfWork()));
            verify(dataSource, never()).getConnection();
        }
    }

    @Nested
    @DisplayName("find")
    class Find {

        @Test
        @DisplayName("returns the persisted row with its id")
        void findsDirectory() throws Exception {
            when(resultSet.next()).thenReturn(true);
            when(resultSet.getLong(1)).thenReturn(42L);

            DirectoryRow row = store.find(NaturalKey.directory("bgpd"), DirectoryRow.class).orElseThrow();

            assertEquals(42L, row.getId());
            assertEquals("bgpd", row.getName());
        }

        @Test
        @DisplayName("resolves build rows together with their plan")
        void findsBuild() throws Exception {
            when(resultSet.next()).thenReturn(true);
            when(resultSet.getLong("plan_id")).thenReturn(7L);
            when(resultSet.getLong("id")).thenReturn(9L);

            BuildRow row = store.find(NaturalKey.build(3, "P"), BuildRow.class).orElseThrow();

            assertEquals(9L, row.getId());
            assertEquals(3, row.getNumber());
            assertEquals(7L, row.getPlan().getId());
            verify(statement).setInt(1, 3);
        }

        @Test
        @DisplayName("returns empty when no row matches")
        void notFound() throws Exception {
            when(resultSet.next()).thenReturn(false);
            assertTrue(store.find(NaturalKey.agent("h1"), AgentRow.class).isEmpty());
        }

        @Test
        @DisplayName("keys with missing parts never reach the database")
        void incompleteKey() throws Exception {
            assertTrue(store.find(NaturalKey.module("m", null), ModuleRow.class).isEmpty());
            verify(dataSource, never()).getConnection();
        }

        @Test
        @DisplayName("database errors propagate instead of reading as not found")
        void databaseError() throws Exception {
            when(statement.executeQuery()).thenThrow(new SQLException("connection reset"));
            var e = assertThrows(DataAccessResourceFailureException.class,
                    () -> store.find(NaturalKey.plan("P"), PlanRow.class));
            assertInstanceOf(SQLException.class, e.getCause());
        }
    }

    @Test
    @DisplayName("findResults rebuilds records including the skipped outcome")
    void findResults() throws Exception {
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getString("directory")).thenReturn("bgpd");
        when(resultSet.getString("module")).thenReturn("test_basic");
        when(resultSet.getString("test")).thenReturn("test_convergence");
        when(resultSet.getString("agent")).thenReturn("h1");
        when(resultSet.getString("plan")).thenReturn("P");
        when(resultSet.getString("job")).thenReturn("J");
        when(resultSet.getInt("build")).thenReturn(3);
        when(resultSet.getBoolean("passed")).thenReturn(false);
        when(resultSet.getBoolean("skipped")).thenReturn(true);
        when(resultSet.getDouble("duration")).thenReturn(1.5);
        when(resultSet.getObject("recorded_at", LocalDateTime.class))
                .thenReturn(LocalDateTime.of(2024, 1, 1, 0, 0));

        List<ResultRecord> records = store.findResults("P", T0, T0.plusSeconds(60));

        assertEquals(1, records.size());
        ResultRecord record = records.get(0);
        assertEquals("bgpd.test_basic.test_convergence", record.name());
        assertEquals(Outcome.SKIPPED, record.outcome());
        assertEquals(T0, record.timestamp());
        assertNull(record.platform());
        verify(statement).setString(1, "P");
    }

    @Test
    @DisplayName("a failing window query propagates instead of returning no results")
    void findResultsError() throws Exception {
        when(statement.executeQuery()).thenThrow(new SQLException("connection reset"));
        assertThrows(DataAccessResourceFailureException.class,
                () -> store.findResults("P", T0, T0.plusSeconds(60)));
        assertThrows(DataAccessResourceFailureException.class, () -> store.countResults());
    }

    @Test
    @DisplayName("counts read the first column")
    void counts() throws Exception {
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getLong(1)).thenReturn(5L);

        assertEquals(5L, store.countResults());
        assertEquals(5L, store.countDimensions(DimensionType.JOB));
        verify(connection).prepareStatement("SELECT COUNT(*) FROM jobs");
    }
}
