/**
 * Data model helpers ({@code pgs-core}).
 * <p>
 * This package complements the Sesame RDF model with the {@link eu.fbk.pgstore.data.Formula}
 * term, identifying quoted graphs, and with the {@link eu.fbk.pgstore.data.Data} utility class.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.pgstore.data;
