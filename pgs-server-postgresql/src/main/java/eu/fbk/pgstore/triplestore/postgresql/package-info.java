/**
 * {@code TripleStore} implementation based on PostgreSQL ({@code pgs-server-postgresql}).
 * <p>
 * This package provides {@link eu.fbk.pgstore.triplestore.postgresql.PostgreSQLTripleStore}, a
 * triple store keeping statements in four partition tables (asserted, rdf:type, literal and
 * quoted statements) plus a table of namespace bindings, all accessed through JDBC with pooled
 * connections (HikariCP). Connection parameters are supplied via
 * {@link eu.fbk.pgstore.triplestore.postgresql.PostgreSQLConfiguration}.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.pgstore.triplestore.postgresql;
