package eu.fbk.pgstore.triplestore;

import java.io.IOException;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.ForwardingObject;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.query.QueryEvaluationException;

import info.aduna.iteration.CloseableIteration;

/**
 * A <tt>TripleTransaction</tt> that forwards all its method calls to another
 * <tt>TripleTransaction</tt>.
 * <p>
 * This class provides a starting point for implementing the decorator pattern on top of the
 * <tt>TripleTransaction</tt> interface. Subclasses must implement method {@link #delegate()} and
 * override the methods of <tt>TripleTransaction</tt> they want to decorate.
 * </p>
 */
public abstract class ForwardingTripleTransaction extends ForwardingObject implements
        TripleTransaction {

    @Override
    protected abstract TripleTransaction delegate();

    @Override
    public CloseableIteration<TripleContexts, QueryEvaluationException> match(
            final TriplePattern pattern, @Nullable final Resource context) throws IOException,
            IllegalStateException {
        return delegate().match(pattern, context);
    }

    @Override
    public CloseableIteration<Statement, QueryEvaluationException> get(
            @Nullable final Resource subject, @Nullable final URI predicate,
            @Nullable final Value object, @Nullable final Resource context) throws IOException,
            IllegalStateException {
        return delegate().get(subject, predicate, object, context);
    }

    @Override
    public long size(@Nullable final Resource context) throws IOException, IllegalStateException {
        return delegate().size(context);
    }

    @Override
    public CloseableIteration<Resource, QueryEvaluationException> contexts(
            @Nullable final TriplePattern pattern) throws IOException, IllegalStateException {
        return delegate().contexts(pattern);
    }

    @Override
    public void add(final Iterable<? extends Statement> statements) throws IOException,
            IllegalStateException {
        delegate().add(statements);
    }

    @Override
    public void remove(final Iterable<? extends Statement> statements) throws IOException,
            IllegalStateException {
        delegate().remove(statements);
    }

    @Override
    public void bind(final String prefix, final String namespace) throws IOException,
            IllegalStateException {
        delegate().bind(prefix, namespace);
    }

    @Override
    @Nullable
    public String getNamespace(final String prefix) throws IOException, IllegalStateException {
        return delegate().getNamespace(prefix);
    }

    @Override
    @Nullable
    public String getPrefix(final String namespace) throws IOException, IllegalStateException {
        return delegate().getPrefix(namespace);
    }

    @Override
    public Map<String, String> getNamespaces() throws IOException, IllegalStateException {
        return delegate().getNamespaces();
    }

    @Override
    public void end(final boolean commit) throws IOException {
        delegate().end(commit);
    }

}
