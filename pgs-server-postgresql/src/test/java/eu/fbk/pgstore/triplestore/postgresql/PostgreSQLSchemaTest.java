package eu.fbk.pgstore.triplestore.postgresql;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;

public class PostgreSQLSchemaTest {

    private final PostgreSQLSchema schema = new PostgreSQLSchema("kb_test", "urn:store");

    private Connection connection;

    private Statement statement;

    private PreparedStatement query;

    private List<String> executed;

    @Before
    public void setUp() throws SQLException {
        this.connection = Mockito.mock(Connection.class);
        this.statement = Mockito.mock(Statement.class);
        this.query = Mockito.mock(PreparedStatement.class);
        this.executed = Lists.newArrayList();
        Mockito.when(this.connection.createStatement()).thenReturn(this.statement);
        Mockito.when(this.connection.prepareStatement(Mockito.anyString())).thenReturn(
                this.query);
        final Savepoint savepoint = Mockito.mock(Savepoint.class);
        Mockito.when(this.connection.setSavepoint()).thenReturn(savepoint);
        failOn("none");
    }

    private void failOn(final String failingSQL) throws SQLException {
        Mockito.doAnswer(new Answer<Boolean>() {

            @Override
            public Boolean answer(final InvocationOnMock invocation) throws SQLException {
                final String sql = invocation.getArgument(0);
                PostgreSQLSchemaTest.this.executed.add(sql);
                if (sql.equals(failingSQL)) {
                    throw new SQLException("simulated failure");
                }
                return false;
            }

        }).when(this.statement).execute(Mockito.anyString());
    }

    private void existingTables(final String... names) throws SQLException {
        final Object[][] rows = new Object[names.length][];
        for (int i = 0; i < names.length; ++i) {
            rows[i] = new Object[] { names[i] };
        }
        final ResultSet cursor = Cursors.of(rows);
        Mockito.when(this.query.executeQuery()).thenReturn(cursor);
    }

    @Test
    public void testNames() {
        Assert.assertEquals(ImmutableList.of("kb_test_type_statements",
                "kb_test_literal_statements", "kb_test_asserted_statements",
                "kb_test_quoted_statements", "kb_test_namespace_binds"),
                this.schema.getTableNames());
        Assert.assertEquals(19, this.schema.getIndexNames().size());
        Assert.assertTrue(this.schema.getIndexNames().contains("kb_test_A_termComb_index"));
        Assert.assertTrue(this.schema.getIndexNames().contains("kb_test_uri_index"));
    }

    @Test
    public void testExists() throws SQLException {
        existingTables("kb_test_type_statements", "kb_test_literal_statements",
                "kb_test_asserted_statements", "kb_test_quoted_statements",
                "kb_test_namespace_binds");
        Assert.assertTrue(this.schema.exists(this.connection));
        Mockito.verify(this.connection).prepareStatement(
                "SELECT relname FROM pg_class WHERE relname IN (?, ?, ?, ?, ?)");
        Mockito.verify(this.query).setString(1, "kb_test_type_statements");
        Mockito.verify(this.query).setString(5, "kb_test_namespace_binds");
    }

    @Test
    public void testPartiallyExisting() throws SQLException {
        existingTables("kb_test_type_statements", "kb_test_literal_statements");
        Assert.assertFalse(this.schema.exists(this.connection));
    }

    @Test
    public void testInitializeCreates() throws SQLException {
        existingTables();
        Assert.assertEquals(0, this.schema.initialize(this.connection));
        Assert.assertEquals(5 + 5 + 19, this.executed.size());
        Assert.assertTrue(this.executed.contains("CREATE TABLE kb_test_type_statements "
                + "(member text NOT NULL, klass text NOT NULL, context text NOT NULL, "
                + "termComb smallint NOT NULL)"));
        Assert.assertTrue(this.executed.contains("COMMENT ON TABLE kb_test_asserted_statements "
                + "IS 'identifier: urn:store'"));
        Assert.assertTrue(this.executed.contains("CREATE INDEX kb_test_klass_index ON "
                + "kb_test_type_statements (klass)"));
        Mockito.verify(this.connection, Mockito.never()).setSavepoint();
        Mockito.verify(this.connection).commit();
    }

    @Test
    public void testInitializeClears() throws SQLException {
        existingTables("kb_test_type_statements", "kb_test_literal_statements",
                "kb_test_asserted_statements", "kb_test_quoted_statements",
                "kb_test_namespace_binds");
        failOn("DELETE FROM kb_test_quoted_statements");
        Assert.assertEquals(1, this.schema.initialize(this.connection));
        Assert.assertEquals(5, this.executed.size());
        Mockito.verify(this.connection, Mockito.times(5)).setSavepoint();
        Mockito.verify(this.connection, Mockito.times(1)).rollback(Mockito.any(Savepoint.class));
        Mockito.verify(this.connection, Mockito.times(4)).releaseSavepoint(
                Mockito.any(Savepoint.class));
        Mockito.verify(this.connection).commit();
    }

    @Test
    public void testDestroyCountsFailures() throws SQLException {
        failOn("DROP INDEX IF EXISTS kb_test_uri_index CASCADE");
        Assert.assertEquals(1, this.schema.destroy(this.connection));
        Assert.assertEquals(5 + 19, this.executed.size());
        Assert.assertEquals("DROP TABLE IF EXISTS kb_test_type_statements CASCADE",
                this.executed.get(0));
        Mockito.verify(this.connection, Mockito.times(1)).rollback(Mockito.any(Savepoint.class));
        Mockito.verify(this.connection).commit();
    }

    @Test
    public void testDestroyIsIdempotent() throws SQLException {
        Assert.assertEquals(0, this.schema.destroy(this.connection));
        Assert.assertEquals(0, this.schema.destroy(this.connection));
        Mockito.verify(this.connection, Mockito.times(2)).commit();
    }

}
