package eu.fbk.pgstore.triplestore.postgresql;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.SESAME;
import org.openrdf.query.QueryEvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import info.aduna.iteration.CloseableIteration;
import info.aduna.iteration.EmptyIteration;
import info.aduna.iteration.Iteration;
import info.aduna.iteration.LookAheadIteration;

import eu.fbk.pgstore.data.Data;
import eu.fbk.pgstore.internal.Util;
import eu.fbk.pgstore.runtime.DataCorruptedException;
import eu.fbk.pgstore.triplestore.TripleContexts;
import eu.fbk.pgstore.triplestore.TriplePattern;
import eu.fbk.pgstore.triplestore.TripleTransaction;

final class PostgreSQLTripleTransaction implements TripleTransaction {

    private static final Logger LOGGER = LoggerFactory
            .getLogger(PostgreSQLTripleTransaction.class);

    private static final String UNDEFINED_TABLE = "42P01";

    private static final int BATCH_SIZE = 1000;

    private static final int MAX_PREFIX_LENGTH = 20;

    private final String id; // transaction name (for logging purposes)

    private final Connection connection; // the underlying JDBC connection, owned

    private final boolean readOnly;

    private final PostgreSQLSchema schema;

    private final QueryPlanner planner;

    private final QueryExecutor executor;

    private boolean ended;

    PostgreSQLTripleTransaction(final String id, final Connection connection,
            final boolean readOnly, final PostgreSQLSchema schema, final QueryPlanner planner,
            final QueryExecutor executor) throws IOException {

        this.id = id;
        this.connection = connection;
        this.readOnly = readOnly;
        this.schema = schema;
        this.planner = planner;
        this.executor = executor;

        try {
            connection.setReadOnly(readOnly);
            connection.setAutoCommit(false);
        } catch (final SQLException ex) {
            Util.closeQuietly(connection);
            throw new IOException("Could not configure PostgreSQL connection", ex);
        }
        LOGGER.debug("{} - started", this);
    }

    private void checkOpen() {
        Preconditions.checkState(!this.ended, "Transaction %s already ended", this.id);
    }

    private void checkWritable() {
        checkOpen();
        if (this.readOnly) {
            throw new IllegalStateException(
                    "Write operation not allowed on read-only transaction");
        }
    }

    private IOException translate(final SQLException ex, final String message) {
        if (UNDEFINED_TABLE.equals(ex.getSQLState())) {
            return new DataCorruptedException(this + " - " + message
                    + ": store tables are missing", ex);
        }
        return new IOException(this + " - " + message, ex);
    }

    @Override
    public CloseableIteration<TripleContexts, QueryEvaluationException> match(
            final TriplePattern pattern, @Nullable final Resource context) throws IOException,
            IllegalStateException {

        checkOpen();
        final SqlQuery query = this.planner.tripleQuery(pattern, context);
        if (query.isEmpty()) {
            return new EmptyIteration<TripleContexts, QueryEvaluationException>();
        }
        try {
            return new TripleGroupIteration(this.executor.query(this.connection, query));
        } catch (final SQLException ex) {
            throw translate(ex, "could not match " + pattern);
        }
    }

    @Override
    public CloseableIteration<Statement, QueryEvaluationException> get(
            @Nullable final Resource subject, @Nullable final URI predicate,
            @Nullable final Value object, @Nullable final Resource context) throws IOException,
            IllegalStateException {

        final CloseableIteration<TripleContexts, QueryEvaluationException> groups = match(
                TriplePattern.of(subject, predicate, object), context);

        // One statement is returned for each (triple, context) pair
        return new LookAheadIteration<Statement, QueryEvaluationException>() {

            @Nullable
            private TripleContexts group;

            @Override
            @Nullable
            protected Statement getNextElement() throws QueryEvaluationException {
                while (true) {
                    if (this.group != null) {
                        final Iteration<Resource, QueryEvaluationException> contexts;
                        contexts = this.group.getContexts();
                        if (contexts.hasNext()) {
                            return Data.getValueFactory().createStatement(
                                    this.group.getSubject(), this.group.getPredicate(),
                                    this.group.getObject(), contexts.next());
                        }
                    }
                    if (!groups.hasNext()) {
                        return null;
                    }
                    this.group = groups.next();
                }
            }

            @Override
            protected void handleClose() throws QueryEvaluationException {
                try {
                    super.handleClose();
                } finally {
                    groups.close();
                }
            }

        };
    }

    @Override
    public long size(@Nullable final Resource context) throws IOException,
            IllegalStateException {
        checkOpen();
        try {
            return this.executor.count(this.connection, this.planner.countQuery(context));
        } catch (final SQLException ex) {
            throw translate(ex, "could not count statements");
        }
    }

    @Override
    public CloseableIteration<Resource, QueryEvaluationException> contexts(
            @Nullable final TriplePattern pattern) throws IOException, IllegalStateException {

        checkOpen();
        final SqlQuery query = this.planner.contextQuery(pattern);
        if (query.isEmpty()) {
            return new EmptyIteration<Resource, QueryEvaluationException>();
        }
        try {
            return new ContextIteration(this.executor.query(this.connection, query));
        } catch (final SQLException ex) {
            throw translate(ex, "could not list contexts");
        }
    }

    @Override
    public void add(final Iterable<? extends Statement> statements) throws IOException,
            IllegalStateException {
        update(true, statements);
    }

    @Override
    public void remove(final Iterable<? extends Statement> statements) throws IOException,
            IllegalStateException {
        update(false, statements);
    }

    private void update(final boolean insert, final Iterable<? extends Statement> statements)
            throws IOException, IllegalStateException {

        // Check arguments and state
        Preconditions.checkNotNull(statements);
        checkWritable();

        // Statements are batched per SQL command, i.e., per partition and context presence
        final Map<String, PreparedStatement> batches = Maps.newLinkedHashMap();
        try {
            int count = 0;
            for (final Statement statement : statements) {
                Resource context = statement.getContext();
                if (insert && context == null) {
                    context = SESAME.NIL;
                }
                final Partition partition = Partition.forStatement(statement.getPredicate(),
                        statement.getObject(), context);
                final List<String> columns = columns(partition, context != null);
                final List<Object> values = values(partition, statement, context);

                final String sql = insert ? insertSQL(partition, columns) : deleteSQL(
                        partition, columns);
                PreparedStatement batch = batches.get(sql);
                if (batch == null) {
                    batch = this.connection.prepareStatement(sql);
                    batches.put(sql, batch);
                }
                QueryExecutor.bind(batch, insert ? Lists.newArrayList(Iterables.concat(values,
                        values)) : values);
                batch.addBatch();

                if (++count % BATCH_SIZE == 0) {
                    flush(batches);
                }
            }
            flush(batches);
            LOGGER.debug("{} - {} {} statements", this, insert ? "added" : "removed", count);

        } catch (final SQLException ex) {
            throw translate(ex, insert ? "could not add statements"
                    : "could not remove statements");
        } finally {
            for (final PreparedStatement batch : batches.values()) {
                Util.closeQuietly(batch);
            }
        }
    }

    private static void flush(final Map<String, PreparedStatement> batches) throws SQLException {
        for (final PreparedStatement batch : batches.values()) {
            batch.executeBatch();
        }
    }

    private static List<String> columns(final Partition partition, final boolean hasContext) {
        final List<String> columns = Lists.newArrayList();
        columns.add(partition.getSubjectColumn());
        if (partition.getPredicateColumn() != null) {
            columns.add(partition.getPredicateColumn());
        }
        columns.add(partition.getObjectColumn());
        if (hasContext) {
            columns.add(partition.getContextColumn());
        }
        columns.add("termComb");
        if (partition.hasLiteralColumns()) {
            columns.add("objLanguage");
            columns.add("objDatatype");
        }
        return columns;
    }

    private static List<Object> values(final Partition partition, final Statement statement,
            @Nullable final Resource context) {
        final Resource subject = statement.getSubject();
        final URI predicate = statement.getPredicate();
        final Value object = statement.getObject();
        final List<Object> values = Lists.newArrayList();
        values.add(TermCodec.encode(subject));
        if (partition.getPredicateColumn() != null) {
            values.add(TermCodec.encode(predicate));
        }
        values.add(TermCodec.encode(object));
        if (context != null) {
            values.add(TermCodec.encode(context));
            values.add(TermCodec.termComb(subject, predicate, object, context));
        } else {
            // matched against termComb / 4, ignoring the context kind
            values.add(TermCodec.termComb(subject, predicate, object, SESAME.NIL) / 4);
        }
        if (partition.hasLiteralColumns()) {
            values.add(TermCodec.languageOf(object));
            values.add(TermCodec.datatypeOf(object));
        }
        return values;
    }

    private String insertSQL(final Partition partition, final List<String> columns) {
        final String table = this.schema.getTableName(partition);
        final List<String> casts = Lists.newArrayList();
        for (final String column : columns) {
            casts.add("termComb".equals(column) ? "CAST(? AS smallint)" : "CAST(? AS text)");
        }
        return "INSERT INTO " + table + " (" + Joiner.on(", ").join(columns) + ") SELECT "
                + Joiner.on(", ").join(casts) + " WHERE NOT EXISTS (SELECT 1 FROM " + table
                + " WHERE " + conditions(columns) + ")";
    }

    private String deleteSQL(final Partition partition, final List<String> columns) {
        return "DELETE FROM " + this.schema.getTableName(partition) + " WHERE "
                + conditions(columns);
    }

    private static String conditions(final List<String> columns) {
        final boolean hasContext = columns.contains("context");
        final List<String> conditions = Lists.newArrayList();
        for (final String column : columns) {
            if ("objLanguage".equals(column) || "objDatatype".equals(column)) {
                conditions.add(column + " IS NOT DISTINCT FROM CAST(? AS text)");
            } else if ("termComb".equals(column) && !hasContext) {
                conditions.add("termComb / 4 = ?");
            } else {
                conditions.add(column + " = ?");
            }
        }
        return Joiner.on(" AND ").join(conditions);
    }

    @Override
    public void bind(final String prefix, final String namespace) throws IOException,
            IllegalStateException {

        Preconditions.checkArgument(prefix.length() <= MAX_PREFIX_LENGTH,
                "Prefix '%s' longer than %s characters", prefix, MAX_PREFIX_LENGTH);
        checkWritable();

        final String table = this.schema.getNamespaceTable();
        try {
            try (PreparedStatement statement = this.connection.prepareStatement("DELETE FROM "
                    + table + " WHERE prefix = ? OR uri = ?")) {
                QueryExecutor.bind(statement, ImmutableList.of(prefix, namespace));
                statement.executeUpdate();
            }
            try (PreparedStatement statement = this.connection.prepareStatement("INSERT INTO "
                    + table + " (prefix, uri) VALUES (?, ?)")) {
                QueryExecutor.bind(statement, ImmutableList.of(prefix, namespace));
                statement.executeUpdate();
            }
        } catch (final SQLException ex) {
            throw translate(ex, "could not bind prefix " + prefix);
        }
    }

    @Override
    @Nullable
    public String getNamespace(final String prefix) throws IOException, IllegalStateException {
        return lookup("SELECT uri FROM " + this.schema.getNamespaceTable()
                + " WHERE prefix = ?", prefix);
    }

    @Override
    @Nullable
    public String getPrefix(final String namespace) throws IOException, IllegalStateException {
        return lookup("SELECT prefix FROM " + this.schema.getNamespaceTable()
                + " WHERE uri = ?", namespace);
    }

    @Nullable
    private String lookup(final String sql, final String key) throws IOException {
        checkOpen();
        try (PreparedStatement statement = this.connection.prepareStatement(sql)) {
            QueryExecutor.bind(statement, ImmutableList.of(key));
            try (ResultSet cursor = statement.executeQuery()) {
                return cursor.next() ? cursor.getString(1) : null;
            }
        } catch (final SQLException ex) {
            throw translate(ex, "could not look up namespace binding for " + key);
        }
    }

    @Override
    public Map<String, String> getNamespaces() throws IOException, IllegalStateException {
        checkOpen();
        final String sql = "SELECT prefix, uri FROM " + this.schema.getNamespaceTable()
                + " WHERE uri IS NOT NULL ORDER BY prefix";
        try (PreparedStatement statement = this.connection.prepareStatement(sql);
                ResultSet cursor = statement.executeQuery()) {
            final ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
            while (cursor.next()) {
                builder.put(cursor.getString(1), cursor.getString(2));
            }
            return builder.build();
        } catch (final SQLException ex) {
            throw translate(ex, "could not retrieve namespace bindings");
        }
    }

    @Override
    public void end(final boolean commit) throws DataCorruptedException, IOException,
            IllegalStateException {

        checkOpen();
        this.ended = true;
        try {
            if (commit && !this.readOnly) {
                try {
                    this.connection.commit();
                } catch (final SQLException ex) {
                    try {
                        this.connection.rollback();
                    } catch (final SQLException ex2) {
                        throw new DataCorruptedException(this
                                + " - commit failed and rollback not possible", ex);
                    }
                    throw new IOException(this + " - commit failed, changes rolled back", ex);
                }
            } else {
                try {
                    this.connection.rollback();
                } catch (final SQLException ex) {
                    throw new IOException(this + " - rollback failed", ex);
                }
            }
            LOGGER.debug("{} - ended ({})", this, commit ? "commit" : "rollback");
        } finally {
            Util.closeQuietly(this.connection);
        }
    }

    @Override
    public String toString() {
        return this.id;
    }

    private static final class ContextIteration extends
            LookAheadIteration<Resource, QueryEvaluationException> {

        private final ResultSet cursor;

        ContextIteration(final ResultSet cursor) {
            this.cursor = cursor;
        }

        @Override
        @Nullable
        protected Resource getNextElement() throws QueryEvaluationException {
            try {
                if (!this.cursor.next()) {
                    return null;
                }
                return TermCodec.decodeResource(this.cursor.getString(1),
                        this.cursor.getInt(2));
            } catch (final SQLException | IllegalArgumentException ex) {
                throw new QueryEvaluationException("Could not retrieve next context", ex);
            }
        }

        @Override
        protected void handleClose() throws QueryEvaluationException {
            try {
                super.handleClose();
            } finally {
                try {
                    this.cursor.close();
                } catch (final SQLException ex) {
                    throw new QueryEvaluationException("Could not close query cursor", ex);
                }
            }
        }

    }

}
