/**
 * {@code TripleStore} component API ({@code pgs-server}).
 * <p>
 * This package defines the abstract API of a store of RDF statements within named graphs and
 * quoted graphs, offering pattern matching, counting and context enumeration on top of it. More
 * in details, the package provides:
 * </p>
 * <ul>
 * <li>the {@code TripleStore} API ({@link eu.fbk.pgstore.triplestore.TripleStore},
 * {@link eu.fbk.pgstore.triplestore.TripleTransaction},
 * {@link eu.fbk.pgstore.triplestore.TriplePattern},
 * {@link eu.fbk.pgstore.triplestore.Selector},
 * {@link eu.fbk.pgstore.triplestore.TripleContexts});</li>
 * <li>abstract classes ({@link eu.fbk.pgstore.triplestore.ForwardingTripleStore} and
 * {@link eu.fbk.pgstore.triplestore.ForwardingTripleTransaction}) for implementing the decorator
 * pattern;</li>
 * <li>a concrete decorator providing logging support
 * ({@link eu.fbk.pgstore.triplestore.LoggingTripleStore}).</li>
 * </ul>
 * <p>
 * The API builds on the Sesame model and iteration classes, without reusing the Repository or
 * Sail concepts of Sesame. Implementations for specific backends are provided by dedicated
 * modules.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.pgstore.triplestore;
