package eu.fbk.pgstore.triplestore.postgresql;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.hash.Hashing;
import com.zaxxer.hikari.HikariDataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.pgstore.internal.Util;
import eu.fbk.pgstore.runtime.DataCorruptedException;
import eu.fbk.pgstore.triplestore.TripleStore;
import eu.fbk.pgstore.triplestore.TripleTransaction;

/**
 * A {@code TripleStore} keeping statements in partitioned PostgreSQL tables.
 * <p>
 * Statements are split among four tables (see {@link Partition}) whose names start with a prefix
 * specific to the store, so that multiple stores may share the same database. The prefix is
 * either supplied explicitly or derived from the store identifier as {@code kb_} followed by the
 * first 10 hex digits of the SHA-1 of the identifier.
 * </p>
 * <p>
 * Connections are owned by a HikariCP pool created by {@link #init()} and released by
 * {@link #close()}. Each {@link TripleTransaction} holds one pooled connection until it is ended;
 * schema maintenance operations ({@link #reset()}, {@link #destroy()}, {@link #exists()}) borrow
 * a connection for their duration only.
 * </p>
 */
public final class PostgreSQLTripleStore implements TripleStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgreSQLTripleStore.class);

    private static final int DEFAULT_FETCH_SIZE = 200;

    private static final Pattern PREFIX_PATTERN = Pattern.compile("[a-z_][a-z0-9_]{0,39}");

    private final PostgreSQLConfiguration configuration;

    private final String identifier;

    private final String prefix;

    private final PostgreSQLSchema schema;

    private final QueryPlanner planner;

    private final QueryExecutor executor;

    private final AtomicLong transactionCounter;

    @Nullable
    private HikariDataSource dataSource;

    private boolean closed;

    /**
     * Creates a new instance based on the supplied configuration string and store identifier.
     *
     * @param configuration
     *            the connection configuration, as space-separated {@code key=value} tokens
     * @param identifier
     *            the identifier of the store
     * @see PostgreSQLConfiguration#parse(String)
     */
    public PostgreSQLTripleStore(final String configuration, final String identifier) {
        this(PostgreSQLConfiguration.parse(configuration), identifier, null, null);
    }

    /**
     * Creates a new instance based on the supplied configuration properties.
     *
     * @param configuration
     *            the connection configuration
     * @param identifier
     *            the identifier of the store, stored as a comment of its tables
     * @param prefix
     *            the prefix of table and index names, a lowercase SQL identifier; if null it is
     *            derived from the identifier
     * @param fetchSize
     *            the number of rows to fetch from PostgreSQL in a single operation when query
     *            results are iterated; if null defaults to 200
     */
    public PostgreSQLTripleStore(final PostgreSQLConfiguration configuration,
            final String identifier, @Nullable final String prefix,
            @Nullable final Integer fetchSize) {

        // Configure and validate parameters
        this.configuration = Preconditions.checkNotNull(configuration);
        this.identifier = Preconditions.checkNotNull(identifier);
        this.prefix = prefix != null ? prefix : prefixFor(identifier);
        Preconditions.checkArgument(PREFIX_PATTERN.matcher(this.prefix).matches(),
                "Invalid table prefix '%s'", this.prefix);
        this.schema = new PostgreSQLSchema(this.prefix, identifier);
        this.planner = new QueryPlanner(this.prefix);
        this.executor = new QueryExecutor(MoreObjects.firstNonNull(fetchSize,
                DEFAULT_FETCH_SIZE));
        this.transactionCounter = new AtomicLong(0L);

        // Log relevant information
        LOGGER.info("PostgreSQLTripleStore configured, URL={}, identifier={}, prefix={}, "
                + "fetchSize={}", configuration.getJdbcURL(), identifier, this.prefix,
                this.executor.getFetchSize());
    }

    /**
     * Returns the table prefix derived from a store identifier.
     *
     * @param identifier
     *            the store identifier
     * @return {@code kb_} followed by the first 10 hex digits of the SHA-1 of the identifier
     */
    @SuppressWarnings("deprecation")
    public static String prefixFor(final String identifier) {
        // SHA-1 fixed by the naming of existing store tables, not used for security
        return "kb_"
                + Hashing.sha1().hashString(identifier, StandardCharsets.UTF_8).toString()
                        .substring(0, 10);
    }

    public String getIdentifier() {
        return this.identifier;
    }

    public String getPrefix() {
        return this.prefix;
    }

    @Override
    public synchronized void init() throws IOException {
        Preconditions.checkState(this.dataSource == null && !this.closed,
                "Store already initialized or closed");
        try {
            this.dataSource = new HikariDataSource(this.configuration.toHikariConfig("pgstore-"
                    + this.prefix));
        } catch (final RuntimeException ex) {
            throw new IOException("Could not connect to PostgreSQL at "
                    + this.configuration.getJdbcURL(), ex);
        }
    }

    @Override
    public Status open(final boolean create) throws IOException {
        synchronized (this) {
            if (this.dataSource == null) {
                init();
            }
        }
        if (create) {
            reset();
        }
        try {
            return exists() ? Status.VALID_STORE : Status.NO_STORE;
        } catch (final IOException ex) {
            LOGGER.warn("Could not check existence of store " + this.identifier, ex);
            return Status.NO_STORE;
        }
    }

    @Override
    public boolean exists() throws IOException {
        final Connection connection = acquireConnection();
        try {
            return this.schema.exists(connection);
        } catch (final SQLException ex) {
            throw new IOException("Could not check existence of tables with prefix "
                    + this.prefix, ex);
        } finally {
            rollbackQuietly(connection);
            Util.closeQuietly(connection);
        }
    }

    @Override
    public TripleTransaction begin(final boolean readOnly) throws DataCorruptedException,
            IOException {
        final String id = "PostgreSQL TX" + this.transactionCounter.incrementAndGet();
        return new PostgreSQLTripleTransaction(id, acquireConnection(), readOnly, this.schema,
                this.planner, this.executor);
    }

    @Override
    public void reset() throws IOException {
        final Connection connection = acquireConnection();
        try {
            final int failures = this.schema.initialize(connection);
            if (failures > 0) {
                LOGGER.warn("{} tables of store {} could not be emptied", failures,
                        this.identifier);
            }
        } catch (final SQLException ex) {
            rollbackQuietly(connection);
            throw new IOException("Could not initialize tables with prefix " + this.prefix, ex);
        } finally {
            Util.closeQuietly(connection);
        }
    }

    @Override
    public int destroy() throws IOException {
        final Connection connection = acquireConnection();
        try {
            return this.schema.destroy(connection);
        } catch (final SQLException ex) {
            rollbackQuietly(connection);
            throw new IOException("Could not drop tables with prefix " + this.prefix, ex);
        } finally {
            Util.closeQuietly(connection);
        }
    }

    @Override
    public synchronized void close() {
        // no need to terminate pending transactions: this is done externally
        if (!this.closed) {
            this.closed = true;
            if (this.dataSource != null) {
                this.dataSource.close();
                this.dataSource = null;
            }
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + this.prefix + "]";
    }

    private Connection acquireConnection() throws IOException {
        final HikariDataSource source;
        synchronized (this) {
            Preconditions.checkState(this.dataSource != null, "Store not initialized");
            source = this.dataSource;
        }
        Connection connection = null;
        try {
            connection = source.getConnection();
            connection.setAutoCommit(false);
            return connection;
        } catch (final SQLException ex) {
            Util.closeQuietly(connection);
            throw new IOException("Could not connect to PostgreSQL", ex);
        }
    }

    private static void rollbackQuietly(final Connection connection) {
        try {
            connection.rollback();
        } catch (final SQLException ex) {
            LOGGER.error("Rollback failed", ex);
        }
    }

}
