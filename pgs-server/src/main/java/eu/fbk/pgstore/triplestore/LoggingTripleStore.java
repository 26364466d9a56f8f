package eu.fbk.pgstore.triplestore;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.Iterables;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.query.QueryEvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import info.aduna.iteration.CloseableIteration;
import info.aduna.iteration.IterationWrapper;

import eu.fbk.pgstore.data.Data;

/**
 * A {@code TripleStore} wrapper that log calls to the operations of a wrapped {@code TripleStore}
 * and their execution times.
 * <p>
 * This wrapper intercepts calls to an underlying {@code TripleStore} and to the
 * {@code TripleTransaction}s it creates, and logs request information and execution times via
 * SLF4J (level DEBUG, logger named after this class). The overhead introduced by this wrapper
 * when logging is disabled is negligible.
 * </p>
 */
public final class LoggingTripleStore extends ForwardingTripleStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingTripleStore.class);

    private final TripleStore delegate;

    /**
     * Creates a new instance for the wrapped {@code TripleStore} specified.
     *
     * @param delegate
     *            the wrapped {@code TripleStore}
     */
    public LoggingTripleStore(final TripleStore delegate) {
        this.delegate = Preconditions.checkNotNull(delegate);
        LOGGER.debug("{} configured", getClass().getSimpleName());
    }

    @Override
    protected TripleStore delegate() {
        return this.delegate;
    }

    @Override
    public void init() throws IOException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.init();
            LOGGER.debug("{} - initialized in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            super.init();
        }
    }

    @Override
    public Status open(final boolean create) throws IOException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final Status status = super.open(create);
            LOGGER.debug("{} - opened ({}) with status {} in {} ms", this, create ? "create"
                    : "no create", status, System.currentTimeMillis() - ts);
            return status;
        } else {
            return super.open(create);
        }
    }

    @Override
    public TripleTransaction begin(final boolean readOnly) throws IOException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final TripleTransaction transaction = new LoggingTripleTransaction(
                    super.begin(readOnly));
            LOGGER.debug("{} - started in {} mode in {} ms", transaction, readOnly ? "read-only"
                    : "read-write", System.currentTimeMillis() - ts);
            return transaction;
        } else {
            return super.begin(readOnly);
        }
    }

    @Override
    public void reset() throws IOException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.reset();
            LOGGER.debug("{} - reset done in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            super.reset();
        }
    }

    @Override
    public int destroy() throws IOException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            final int failures = super.destroy();
            LOGGER.debug("{} - destroyed with {} failures in {} ms", this, failures,
                    System.currentTimeMillis() - ts);
            return failures;
        } else {
            return super.destroy();
        }
    }

    @Override
    public void close() {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.close();
            LOGGER.debug("{} - closed in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            super.close();
        }
    }

    @Override
    public String toString() {
        return this.delegate.toString();
    }

    private static final class LoggingTripleTransaction extends ForwardingTripleTransaction {

        private final TripleTransaction delegate;

        LoggingTripleTransaction(final TripleTransaction delegate) {
            this.delegate = Preconditions.checkNotNull(delegate);
        }

        @Override
        protected TripleTransaction delegate() {
            return this.delegate;
        }

        private String format(@Nullable final Value value) {
            return value == null ? "*" : Data.toString(value, Data.getNamespaceMap());
        }

        private <T, E extends Exception> CloseableIteration<T, E> logClose(
                final CloseableIteration<T, E> iteration, final String name, final long ts) {
            return new IterationWrapper<T, E>(iteration) {

                @Override
                protected void handleClose() throws E {
                    try {
                        super.handleClose();
                    } finally {
                        LOGGER.debug("{} - {} closed after {} ms", LoggingTripleTransaction.this,
                                name, System.currentTimeMillis() - ts);
                    }
                }

            };
        }

        private Iterable<Statement> track(final Iterable<? extends Statement> statements,
                final AtomicLong count) {
            return Iterables.transform(statements, new Function<Statement, Statement>() {

                @Override
                public Statement apply(final Statement statement) {
                    count.incrementAndGet();
                    return statement;
                }

            });
        }

        @Override
        public CloseableIteration<TripleContexts, QueryEvaluationException> match(
                final TriplePattern pattern, @Nullable final Resource context)
                throws IOException, IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final String name = "match() iteration for " + pattern + " in "
                        + format(context);
                final long ts = System.currentTimeMillis();
                final CloseableIteration<TripleContexts, QueryEvaluationException> result;
                result = logClose(super.match(pattern, context), name, ts);
                LOGGER.debug("{} - {} obtained in {} ms", this, name, System.currentTimeMillis()
                        - ts);
                return result;
            } else {
                return super.match(pattern, context);
            }
        }

        @Override
        public CloseableIteration<Statement, QueryEvaluationException> get(
                @Nullable final Resource subject, @Nullable final URI predicate,
                @Nullable final Value object, @Nullable final Resource context)
                throws IOException, IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final String name = "get() statement iteration for <" + format(subject) + ", "
                        + format(predicate) + ", " + format(object) + ", " + format(context) + ">";
                final long ts = System.currentTimeMillis();
                final CloseableIteration<Statement, QueryEvaluationException> result;
                result = logClose(super.get(subject, predicate, object, context), name, ts);
                LOGGER.debug("{} - {} obtained in {} ms", this, name, System.currentTimeMillis()
                        - ts);
                return result;
            } else {
                return super.get(subject, predicate, object, context);
            }
        }

        @Override
        public long size(@Nullable final Resource context) throws IOException,
                IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final long ts = System.currentTimeMillis();
                final long size = super.size(context);
                LOGGER.debug("{} - size of {} computed in {} ms: {}", this, format(context),
                        System.currentTimeMillis() - ts, size);
                return size;
            } else {
                return super.size(context);
            }
        }

        @Override
        public CloseableIteration<Resource, QueryEvaluationException> contexts(
                @Nullable final TriplePattern pattern) throws IOException, IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final String name = "contexts() iteration for "
                        + (pattern == null ? "*" : pattern.toString());
                final long ts = System.currentTimeMillis();
                final CloseableIteration<Resource, QueryEvaluationException> result;
                result = logClose(super.contexts(pattern), name, ts);
                LOGGER.debug("{} - {} obtained in {} ms", this, name, System.currentTimeMillis()
                        - ts);
                return result;
            } else {
                return super.contexts(pattern);
            }
        }

        @Override
        public void add(final Iterable<? extends Statement> statements) throws IOException,
                IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final AtomicLong count = new AtomicLong();
                final long ts = System.currentTimeMillis();
                super.add(track(statements, count));
                LOGGER.debug("{} - {} statements added in {} ms", this, count,
                        System.currentTimeMillis() - ts);
            } else {
                super.add(statements);
            }
        }

        @Override
        public void remove(final Iterable<? extends Statement> statements) throws IOException,
                IllegalStateException {

            if (LOGGER.isDebugEnabled()) {
                final AtomicLong count = new AtomicLong();
                final long ts = System.currentTimeMillis();
                super.remove(track(statements, count));
                LOGGER.debug("{} - {} statements removed in {} ms", this, count,
                        System.currentTimeMillis() - ts);
            } else {
                super.remove(statements);
            }
        }

        @Override
        public void bind(final String prefix, final String namespace) throws IOException,
                IllegalStateException {
            LOGGER.debug("{} - binding {}: to <{}>", this, prefix, namespace);
            super.bind(prefix, namespace);
        }

        @Override
        public Map<String, String> getNamespaces() throws IOException, IllegalStateException {
            final Map<String, String> namespaces = super.getNamespaces();
            LOGGER.debug("{} - {} namespace bindings retrieved", this, namespaces.size());
            return namespaces;
        }

        @Override
        public void end(final boolean commit) throws IOException {

            if (LOGGER.isDebugEnabled()) {
                final long ts = System.currentTimeMillis();
                super.end(commit);
                LOGGER.debug("{} - {} done in {} ms", this, commit ? "commit" : "rollback",
                        System.currentTimeMillis() - ts);
            } else {
                super.end(commit);
            }
        }

        @Override
        public String toString() {
            return this.delegate.toString();
        }

    }

}
