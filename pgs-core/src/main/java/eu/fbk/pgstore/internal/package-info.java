@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.pgstore.internal;
