/**
 * Component lifecycle API ({@code pgs-server}).
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.pgstore.runtime;
