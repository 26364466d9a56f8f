package eu.fbk.pgstore.triplestore.postgresql;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creation, emptying and removal of the tables and indices of a store.
 * <p>
 * A store with prefix {@code P} consists of the statement tables {@code P_<role>_statements},
 * one per {@link Partition}, and of the namespace table {@code P_namespace_binds}, each one with
 * its indices. All the methods operate on a connection with auto-commit disabled and commit once
 * at the end. Maintenance statements whose failure is tolerated run under a savepoint, so that a
 * failure does not abort the remaining statements of the PostgreSQL transaction.
 * </p>
 */
final class PostgreSQLSchema {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgreSQLSchema.class);

    private static final Map<Partition, String> COLUMNS = ImmutableMap.of(
            Partition.ASSERTED, "subject text NOT NULL, predicate text NOT NULL, "
                    + "object text NOT NULL, context text NOT NULL, termComb smallint NOT NULL",
            Partition.TYPE, "member text NOT NULL, klass text NOT NULL, "
                    + "context text NOT NULL, termComb smallint NOT NULL",
            Partition.LITERAL, "subject text NOT NULL, predicate text NOT NULL, object text, "
                    + "context text NOT NULL, termComb smallint NOT NULL, objLanguage text, "
                    + "objDatatype text",
            Partition.QUOTED, "subject text NOT NULL, predicate text NOT NULL, object text, "
                    + "context text NOT NULL, termComb smallint NOT NULL, objLanguage text, "
                    + "objDatatype text");

    private static final String NAMESPACE_COLUMNS = "prefix varchar(20) UNIQUE NOT NULL, "
            + "uri text, PRIMARY KEY (prefix)";

    // index name suffix, table suffix, indexed column
    private static final List<String[]> INDICES = ImmutableList.of(
            new String[] { "A_termComb_index", "asserted_statements", "termComb" },
            new String[] { "A_s_index", "asserted_statements", "subject" },
            new String[] { "A_p_index", "asserted_statements", "predicate" },
            new String[] { "A_o_index", "asserted_statements", "object" },
            new String[] { "A_c_index", "asserted_statements", "context" },
            new String[] { "T_termComb_index", "type_statements", "termComb" },
            new String[] { "member_index", "type_statements", "member" },
            new String[] { "klass_index", "type_statements", "klass" },
            new String[] { "c_index", "type_statements", "context" },
            new String[] { "L_termComb_index", "literal_statements", "termComb" },
            new String[] { "L_s_index", "literal_statements", "subject" },
            new String[] { "L_p_index", "literal_statements", "predicate" },
            new String[] { "L_c_index", "literal_statements", "context" },
            new String[] { "Q_termComb_index", "quoted_statements", "termComb" },
            new String[] { "Q_s_index", "quoted_statements", "subject" },
            new String[] { "Q_p_index", "quoted_statements", "predicate" },
            new String[] { "Q_o_index", "quoted_statements", "object" },
            new String[] { "Q_c_index", "quoted_statements", "context" },
            new String[] { "uri_index", "namespace_binds", "uri" });

    private final String prefix;

    private final String identifier;

    private final List<String> tableNames;

    PostgreSQLSchema(final String prefix, final String identifier) {
        this.prefix = prefix;
        this.identifier = identifier;
        final ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (final Partition partition : Partition.values()) {
            builder.add(partition.getTableName(prefix));
        }
        builder.add(getNamespaceTable());
        this.tableNames = builder.build();
    }

    String getTableName(final Partition partition) {
        return partition.getTableName(this.prefix);
    }

    String getNamespaceTable() {
        return this.prefix + "_namespace_binds";
    }

    /**
     * Returns the names of all the tables of the store, namespace table included.
     */
    List<String> getTableNames() {
        return this.tableNames;
    }

    /**
     * Returns the names of all the indices of the store.
     */
    List<String> getIndexNames() {
        final ImmutableList.Builder<String> builder = ImmutableList.builder();
        for (final String[] index : INDICES) {
            builder.add(this.prefix + "_" + index[0]);
        }
        return builder.build();
    }

    /**
     * Checks whether all the tables of the store exist.
     *
     * @param connection
     *            the connection to use
     * @return true if every table exists
     * @throws SQLException
     *             if the check fails
     */
    boolean exists(final Connection connection) throws SQLException {
        final String placeholders = Joiner.on(", ").join(
                Collections.nCopies(this.tableNames.size(), "?"));
        try (PreparedStatement statement = connection
                .prepareStatement("SELECT relname FROM pg_class WHERE relname IN ("
                        + placeholders + ")")) {
            QueryExecutor.bind(statement, this.tableNames);
            final Set<String> found = Sets.newHashSet();
            try (ResultSet cursor = statement.executeQuery()) {
                while (cursor.next()) {
                    found.add(cursor.getString(1));
                }
            }
            return found.containsAll(this.tableNames);
        }
    }

    /**
     * Creates the tables and indices of the store if missing, otherwise empties the existing
     * tables. Emptying is best-effort: the tables that cannot be emptied are logged and counted.
     *
     * @param connection
     *            the connection to use
     * @return the number of tables that could not be emptied
     * @throws SQLException
     *             if the creation of tables or indices fails
     */
    int initialize(final Connection connection) throws SQLException {
        int failures = 0;
        if (!exists(connection)) {
            try (Statement statement = connection.createStatement()) {
                for (final Partition partition : Partition.values()) {
                    statement.execute("CREATE TABLE " + partition.getTableName(this.prefix)
                            + " (" + COLUMNS.get(partition) + ")");
                }
                statement.execute("CREATE TABLE " + getNamespaceTable() + " ("
                        + NAMESPACE_COLUMNS + ")");
                final String comment = "'identifier: " + this.identifier.replace("'", "''")
                        + "'";
                for (final String table : this.tableNames) {
                    statement.execute("COMMENT ON TABLE " + table + " IS " + comment);
                }
                for (final String[] index : INDICES) {
                    statement.execute("CREATE INDEX " + this.prefix + "_" + index[0] + " ON "
                            + this.prefix + "_" + index[1] + " (" + index[2] + ")");
                }
            }
            LOGGER.info("Created tables and indices with prefix {} for store {}", this.prefix,
                    this.identifier);
        } else {
            for (final String table : this.tableNames) {
                if (!executeGuarded(connection, "DELETE FROM " + table)) {
                    ++failures;
                }
            }
            LOGGER.info("Cleared tables with prefix {} ({} failures)", this.prefix, failures);
        }
        connection.commit();
        return failures;
    }

    /**
     * Drops the tables and the indices of the store, if existing. Failures are logged and
     * counted, and do not stop the removal of the remaining objects.
     *
     * @param connection
     *            the connection to use
     * @return the number of tables and indices that could not be dropped
     * @throws SQLException
     *             if the final commit fails
     */
    int destroy(final Connection connection) throws SQLException {
        int failures = 0;
        for (final String table : this.tableNames) {
            if (!executeGuarded(connection, "DROP TABLE IF EXISTS " + table + " CASCADE")) {
                ++failures;
            }
        }
        for (final String index : getIndexNames()) {
            if (!executeGuarded(connection, "DROP INDEX IF EXISTS " + index + " CASCADE")) {
                ++failures;
            }
        }
        connection.commit();
        LOGGER.info("Dropped tables and indices with prefix {} ({} failures)", this.prefix,
                failures);
        return failures;
    }

    private boolean executeGuarded(final Connection connection, final String sql)
            throws SQLException {
        final Savepoint savepoint = connection.setSavepoint();
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
            connection.releaseSavepoint(savepoint);
            return true;
        } catch (final SQLException ex) {
            LOGGER.warn("Failed to execute '" + sql + "': " + ex.getMessage());
            connection.rollback(savepoint);
            return false;
        }
    }

}
