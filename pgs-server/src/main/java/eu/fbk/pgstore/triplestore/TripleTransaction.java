package eu.fbk.pgstore.triplestore;

import java.io.IOException;
import java.util.Map;

import javax.annotation.Nullable;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.query.QueryEvaluationException;

import info.aduna.iteration.CloseableIteration;

import eu.fbk.pgstore.runtime.DataCorruptedException;

/**
 * A triple store transaction.
 * <p>
 * A {@code TripleTransaction} is a unit of work over the contents of a {@link TripleStore}. It
 * supports the following features:
 * </p>
 * <ul>
 * <li><b>Pattern matching</b>, via {@link #match(TriplePattern, Resource)} returning each matched
 * triple once together with its contexts, and via {@link #get(Resource, URI, Value, Resource)}
 * returning one statement per (triple, context) pair;</li>
 * <li><b>Counting</b>, via {@link #size(Resource)};</li>
 * <li><b>Context enumeration</b>, via {@link #contexts(TriplePattern)};</li>
 * <li><b>Statement modification</b>, via bulk methods {@link #add(Iterable)} and
 * {@link #remove(Iterable)};</li>
 * <li><b>Namespace bindings</b>, via {@link #bind(String, String)} and related getters.</li>
 * </ul>
 * <p>
 * Modification methods are not available for read-only transactions (an
 * {@link IllegalStateException} is thrown in that case). Transactions are terminated via
 * {@link #end(boolean)}, whose parameter specifies whether changes should be committed.
 * </p>
 * <p>
 * {@code TripleTransaction} objects are not thread safe. Access by at most one thread at a time
 * must be guaranteed externally. Iterations returned by the transaction must be closed before the
 * transaction is ended; ending the transaction invalidates them.
 * </p>
 */
public interface TripleTransaction {

    /**
     * Returns an iteration over the triples matching the supplied pattern and optional context,
     * each one returned once together with the contexts it belongs to. Statements quoted inside
     * formulae are considered only if a context is specified.
     *
     * @param pattern
     *            the triple pattern
     * @param context
     *            the context to match, null to match any (non-formula) context
     * @return an iteration over matching triples, ordered by subject, predicate and object
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the {@code TripleTransaction} has been already ended
     */
    CloseableIteration<TripleContexts, QueryEvaluationException> match(TriplePattern pattern,
            @Nullable Resource context) throws IOException, IllegalStateException;

    /**
     * Returns an iteration over all the statements matching the (optional) subject, predicate,
     * object and context supplied. Null values are used as wildcard. A triple asserted in N
     * contexts is returned as N statements.
     *
     * @param subject
     *            the subject to match, null to match any subject
     * @param predicate
     *            the predicate to match, null to match any predicate
     * @param object
     *            the object to match, null to match any object
     * @param context
     *            the context to match, null to match any context
     * @return an iteration over matching statements
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the {@code TripleTransaction} has been already ended
     */
    CloseableIteration<Statement, QueryEvaluationException> get(@Nullable Resource subject,
            @Nullable URI predicate, @Nullable Value object, @Nullable Resource context)
            throws IOException, IllegalStateException;

    /**
     * Returns the number of statements in the store or in the supplied context. Without context,
     * statements quoted inside formulae are not counted.
     *
     * @param context
     *            the context whose statements should be counted, null to count all asserted
     *            statements
     * @return the number of statements
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the {@code TripleTransaction} has been already ended
     */
    long size(@Nullable Resource context) throws IOException, IllegalStateException;

    /**
     * Returns an iteration over the distinct contexts containing triples matching the optional
     * pattern supplied. Formulae are never returned.
     *
     * @param pattern
     *            the pattern triples should match, null to return all the contexts
     * @return an iteration over contexts
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the {@code TripleTransaction} has been already ended
     */
    CloseableIteration<Resource, QueryEvaluationException> contexts(
            @Nullable TriplePattern pattern) throws IOException, IllegalStateException;

    /**
     * Adds all the RDF statements in the {@code Iterable} specified. Statements without context
     * are added to the default context; statements whose context is a
     * {@link eu.fbk.pgstore.data.Formula} are quoted in that formula. Adding a statement already
     * stored has no effect.
     *
     * @param statements
     *            the statements to add
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the {@code TripleTransaction} has been already ended, or if it is read-only
     */
    void add(Iterable<? extends Statement> statements) throws IOException, IllegalStateException;

    /**
     * Removes all the RDF statements in the {@code Iterable} specified. Statements without
     * context are removed from every context, formulae excluded.
     *
     * @param statements
     *            the statements to remove
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the {@code TripleTransaction} has been already ended, or if it is read-only
     */
    void remove(Iterable<? extends Statement> statements) throws IOException,
            IllegalStateException;

    /**
     * Binds a prefix to a namespace, replacing existing bindings of either the prefix or the
     * namespace.
     *
     * @param prefix
     *            the prefix
     * @param namespace
     *            the namespace
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the {@code TripleTransaction} has been already ended, or if it is read-only
     */
    void bind(String prefix, String namespace) throws IOException, IllegalStateException;

    @Nullable
    String getNamespace(String prefix) throws IOException, IllegalStateException;

    @Nullable
    String getPrefix(String namespace) throws IOException, IllegalStateException;

    /**
     * Returns all the prefix-to-namespace bindings.
     *
     * @return an immutable prefix-to-namespace map
     * @throws IOException
     *             in case some IO error occurs
     * @throws IllegalStateException
     *             if the {@code TripleTransaction} has been already ended
     */
    Map<String, String> getNamespaces() throws IOException, IllegalStateException;

    /**
     * Ends the transaction, either committing or rolling back its changes (if any). If commit is
     * requested but fails, a rollback is attempted and an {@code IOException} is thrown. The
     * backend resources held by the transaction are released in any case.
     *
     * @param commit
     *            true in case changes made by the transaction should be committed
     * @throws DataCorruptedException
     *             in case neither commit nor rollback were possible
     * @throws IOException
     *             in case the commit request cannot be satisfied
     * @throws IllegalStateException
     *             if the {@code TripleTransaction} has been already ended
     */
    void end(boolean commit) throws DataCorruptedException, IOException, IllegalStateException;

}
