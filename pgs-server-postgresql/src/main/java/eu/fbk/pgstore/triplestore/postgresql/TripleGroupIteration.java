package eu.fbk.pgstore.triplestore.postgresql;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import javax.annotation.Nullable;

import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.query.QueryEvaluationException;

import info.aduna.iteration.Iteration;
import info.aduna.iteration.LookAheadIteration;

import eu.fbk.pgstore.triplestore.TripleContexts;

/**
 * Folds the sorted rows of a triple query into {@link TripleContexts} groups.
 * <p>
 * Rows are read from the cursor one at a time, keeping a single row of look-ahead. Each returned
 * group exposes the contexts of its triple as a lazy iteration reading from the same cursor;
 * advancing this iteration to the next group skips the contexts of the previous group that were
 * not consumed. Grouping requires rows of the same triple to be adjacent, as guaranteed by
 * {@link QueryPlanner#ORDER_BY}. The cursor (and its statement) is closed when the iteration is
 * exhausted or closed.
 * </p>
 */
final class TripleGroupIteration extends
        LookAheadIteration<TripleContexts, QueryEvaluationException> {

    private final ResultSet cursor;

    @Nullable
    private Row pending;

    private boolean exhausted;

    @Nullable
    private Group current;

    TripleGroupIteration(final ResultSet cursor) {
        this.cursor = cursor;
    }

    @Override
    @Nullable
    protected TripleContexts getNextElement() throws QueryEvaluationException {
        if (this.current != null) {
            this.current.skip();
        }
        final Row row = peek();
        if (row == null) {
            this.current = null;
            return null;
        }
        this.current = new Group(row.subject, row.predicate, row.object);
        return this.current;
    }

    @Override
    protected void handleClose() throws QueryEvaluationException {
        try {
            super.handleClose();
        } finally {
            this.pending = null;
            this.exhausted = true;
            try {
                final Statement statement = this.cursor.getStatement();
                this.cursor.close();
                if (statement != null) {
                    statement.close();
                }
            } catch (final SQLException ex) {
                throw new QueryEvaluationException("Could not close query cursor", ex);
            }
        }
    }

    @Nullable
    private Row peek() throws QueryEvaluationException {
        if (this.pending == null && !this.exhausted) {
            try {
                if (this.cursor.next()) {
                    this.pending = new Row(this.cursor);
                } else {
                    this.exhausted = true;
                }
            } catch (final SQLException ex) {
                throw new QueryEvaluationException("Could not retrieve next row", ex);
            } catch (final IllegalArgumentException ex) {
                throw new QueryEvaluationException("Could not decode row", ex);
            }
        }
        return this.pending;
    }

    private Row take() throws QueryEvaluationException {
        final Row row = peek();
        this.pending = null;
        return row;
    }

    private static final class Row {

        final Resource subject;

        final URI predicate;

        final Value object;

        final Resource context;

        Row(final ResultSet cursor) throws SQLException {
            final int termComb = cursor.getInt(5);
            final String language = cursor.getString(6);
            final String datatype = cursor.getString(7);
            this.subject = TermCodec.decodeResource(cursor.getString(1),
                    TermCodec.subjectKind(termComb));
            this.predicate = TermCodec.decodeURI(cursor.getString(2),
                    TermCodec.predicateKind(termComb));
            this.object = TermCodec.decode(cursor.getString(3), TermCodec.objectKind(termComb),
                    language, datatype);
            this.context = TermCodec.decodeResource(cursor.getString(4),
                    TermCodec.contextKind(termComb));
        }

        boolean sameTriple(final Resource subject, final URI predicate, final Value object) {
            return this.subject.equals(subject) && this.predicate.equals(predicate)
                    && this.object.equals(object);
        }

    }

    private final class Group implements TripleContexts {

        private final Resource subject;

        private final URI predicate;

        private final Value object;

        private final Contexts contexts;

        private boolean finished;

        Group(final Resource subject, final URI predicate, final Value object) {
            this.subject = subject;
            this.predicate = predicate;
            this.object = object;
            this.contexts = new Contexts();
        }

        @Override
        public Resource getSubject() {
            return this.subject;
        }

        @Override
        public URI getPredicate() {
            return this.predicate;
        }

        @Override
        public Value getObject() {
            return this.object;
        }

        @Override
        public Iteration<Resource, QueryEvaluationException> getContexts() {
            return this.contexts;
        }

        @Nullable
        Resource nextContext() throws QueryEvaluationException {
            if (!this.finished) {
                final Row row = peek();
                if (row != null && row.sameTriple(this.subject, this.predicate, this.object)) {
                    return take().context;
                }
                this.finished = true;
            }
            return null;
        }

        void skip() throws QueryEvaluationException {
            while (nextContext() != null) {
                // discard
            }
        }

        @Override
        public String toString() {
            return "<" + this.subject + ", " + this.predicate + ", " + this.object + ">";
        }

        private final class Contexts extends
                LookAheadIteration<Resource, QueryEvaluationException> {

            @Override
            @Nullable
            protected Resource getNextElement() throws QueryEvaluationException {
                return nextContext();
            }

        }

    }

}
