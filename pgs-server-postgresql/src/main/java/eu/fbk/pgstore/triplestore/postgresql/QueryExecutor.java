package eu.fbk.pgstore.triplestore.postgresql;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.pgstore.internal.Util;

/**
 * Executes planned queries on a JDBC connection.
 * <p>
 * Every value reaches the database as a bound parameter of a {@link PreparedStatement}: strings
 * via {@code setString}, integers via {@code setInt} and nulls as typed {@code VARCHAR} nulls.
 * Result sets are forward-only, read-only and fetched in chunks of the configured size (note
 * that the PostgreSQL driver honors the fetch size only outside auto-commit mode).
 * </p>
 */
final class QueryExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(QueryExecutor.class);

    private final int fetchSize;

    QueryExecutor(final int fetchSize) {
        Preconditions.checkArgument(fetchSize > 0, "Invalid fetch size %s", fetchSize);
        this.fetchSize = fetchSize;
    }

    int getFetchSize() {
        return this.fetchSize;
    }

    /**
     * Executes a query, returning its cursor. Closing the returned {@code ResultSet} also closes
     * the underlying statement.
     *
     * @param connection
     *            the connection to use
     * @param query
     *            the query, not empty
     * @return the result cursor
     * @throws SQLException
     *             on failure
     */
    ResultSet query(final Connection connection, final SqlQuery query) throws SQLException {
        Preconditions.checkArgument(!query.isEmpty(), "Cannot execute the empty query");
        LOGGER.trace("Executing {}", query);
        final PreparedStatement statement = connection.prepareStatement(query.getSQL(),
                ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
        try {
            statement.setFetchDirection(ResultSet.FETCH_FORWARD);
            statement.setFetchSize(this.fetchSize);
            bind(statement, query.getParameters());
            final ResultSet cursor = statement.executeQuery();
            statement.closeOnCompletion();
            return cursor;
        } catch (final SQLException | RuntimeException ex) {
            Util.closeQuietly(statement);
            throw ex;
        }
    }

    /**
     * Executes a counting query, returning the sum of the first column over all returned rows.
     *
     * @param connection
     *            the connection to use
     * @param query
     *            the counting query; if empty, zero is returned
     * @return the count
     * @throws SQLException
     *             on failure
     */
    long count(final Connection connection, final SqlQuery query) throws SQLException {
        if (query.isEmpty()) {
            return 0L;
        }
        try (ResultSet cursor = query(connection, query)) {
            long count = 0L;
            while (cursor.next()) {
                count += cursor.getLong(1);
            }
            return count;
        }
    }

    /**
     * Binds positional parameters to a prepared statement.
     *
     * @param statement
     *            the statement
     * @param parameters
     *            the parameter values, either strings, integers or nulls
     * @throws SQLException
     *             on failure
     */
    static void bind(final PreparedStatement statement, final List<?> parameters)
            throws SQLException {
        int index = 1;
        for (final Object parameter : parameters) {
            if (parameter == null) {
                statement.setNull(index, Types.VARCHAR);
            } else if (parameter instanceof Integer) {
                statement.setInt(index, (Integer) parameter);
            } else if (parameter instanceof String) {
                statement.setString(index, (String) parameter);
            } else {
                throw new IllegalArgumentException("Unsupported parameter type: "
                        + parameter.getClass().getName());
            }
            ++index;
        }
    }

}
