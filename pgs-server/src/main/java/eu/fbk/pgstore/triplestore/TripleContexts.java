package eu.fbk.pgstore.triplestore;

import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.query.QueryEvaluationException;

import info.aduna.iteration.Iteration;

/**
 * A triple returned by {@link TripleTransaction#match(TriplePattern, Resource)}, together with the
 * contexts it is asserted (or quoted) in.
 * <p>
 * The contexts are returned by a lazy, single-pass iteration that reads from the same cursor the
 * triple comes from. It must be consumed before moving to the next triple of the enclosing
 * iteration: once the enclosing iteration advances, contexts not yet read are skipped and
 * {@link #getContexts()} returns no more elements.
 * </p>
 */
public interface TripleContexts {

    Resource getSubject();

    URI getPredicate();

    Value getObject();

    /**
     * Returns the lazy iteration over the contexts of the triple. The same iteration object is
     * returned at each call.
     *
     * @return the contexts iteration; contexts of quoted statements are
     *         {@link eu.fbk.pgstore.data.Formula}s
     */
    Iteration<Resource, QueryEvaluationException> getContexts();

}
