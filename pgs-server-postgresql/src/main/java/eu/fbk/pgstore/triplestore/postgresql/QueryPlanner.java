package eu.fbk.pgstore.triplestore.postgresql;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import org.openrdf.model.Resource;
import org.openrdf.model.vocabulary.RDF;

import eu.fbk.pgstore.triplestore.Selector;
import eu.fbk.pgstore.triplestore.TriplePattern;

/**
 * Plans the UNION queries answering pattern matching, counting and context enumeration.
 * <p>
 * For a pattern {@code (s, p, o)} and an optional context {@code c}, the partitions to query are
 * chosen as follows: if {@code p} is exactly {@code rdf:type} only {@link Partition#TYPE} is
 * queried; otherwise {@link Partition#TYPE} is queried if {@code p} could match
 * {@code rdf:type}, {@link Partition#LITERAL} if {@code o} could match a literal and
 * {@link Partition#ASSERTED} if {@code o} could match a resource. {@link Partition#QUOTED} is
 * added whenever a context is given. Each partition contributes one SELECT whose WHERE clause is
 * produced by {@link ClauseBuilder}.
 * </p>
 * <p>
 * Triple queries project every partition to the columns {@code subject, predicate, object,
 * context, termComb, objLanguage, objDatatype} and are sorted so that all the rows of the same
 * RDF triple are adjacent, which {@link TripleGroupIteration} relies on.
 * </p>
 */
final class QueryPlanner {

    static final String ORDER_BY = " ORDER BY subject, predicate, object, objLanguage, "
            + "objDatatype, termComb";

    private static final String NULL_TEXT = "CAST(NULL AS text)";

    private final String prefix;

    QueryPlanner(final String prefix) {
        this.prefix = prefix;
    }

    /**
     * Returns the partitions that may contain triples matching the supplied pattern and context.
     *
     * @param pattern
     *            the pattern
     * @param context
     *            the context, null if any context is matched
     * @return the partitions to query, in query order; possibly empty
     */
    List<Partition> selectPartitions(final TriplePattern pattern,
            @Nullable final Resource context) {

        final Selector p = pattern.getPredicate();
        final Selector o = pattern.getObject();
        final List<Partition> partitions = Lists.newArrayList();

        if (p.getKind() == Selector.Kind.VALUE && RDF.TYPE.equals(p.getValue())) {
            partitions.add(Partition.TYPE);
        } else {
            if (p.matches(RDF.TYPE)) {
                partitions.add(Partition.TYPE);
            }
            if (o.mayMatchLiteral()) {
                partitions.add(Partition.LITERAL);
            }
            if (o.mayMatchResource()) {
                partitions.add(Partition.ASSERTED);
            }
        }

        if (context != null) {
            partitions.add(Partition.QUOTED);
        }
        return partitions;
    }

    /**
     * Plans the query returning the rows of the triples matching a pattern, sorted by triple.
     *
     * @param pattern
     *            the pattern
     * @param context
     *            the context, null if any context is matched (quoted statements excluded)
     * @return the planned query, possibly empty
     */
    SqlQuery tripleQuery(final TriplePattern pattern, @Nullable final Resource context) {
        final List<String> selects = Lists.newArrayList();
        final List<Object> parameters = Lists.newArrayList();
        for (final Partition partition : selectPartitions(pattern, context)) {
            selects.add(projection(partition, parameters)
                    + where(partition, pattern, context, parameters));
        }
        if (selects.isEmpty()) {
            return SqlQuery.empty();
        }
        return new SqlQuery(Joiner.on(" UNION ALL ").join(selects) + ORDER_BY, parameters);
    }

    /**
     * Plans the query counting the statements of the store or of a context. Without context, one
     * {@code COUNT(*)} row is returned for each non-quoted partition and the result is their
     * sum. With a context, a single row counts the distinct matching rows of all partitions.
     *
     * @param context
     *            the context, null to count all non-quoted statements
     * @return the planned query
     */
    SqlQuery countQuery(@Nullable final Resource context) {
        final List<String> selects = Lists.newArrayList();
        final List<Object> parameters = Lists.newArrayList();
        if (context == null) {
            for (final Partition partition : selectPartitions(TriplePattern.any(), null)) {
                selects.add("SELECT COUNT(*) FROM " + from(partition));
            }
            return new SqlQuery(Joiner.on(" UNION ALL ").join(selects), parameters);
        }
        for (final Partition partition : selectPartitions(TriplePattern.any(), context)) {
            selects.add(projection(partition, parameters)
                    + where(partition, TriplePattern.any(), context, parameters));
        }
        return new SqlQuery("SELECT COUNT(*) FROM (" + Joiner.on(" UNION ").join(selects)
                + ") AS matched", parameters);
    }

    /**
     * Plans the query returning the distinct contexts containing triples that match a pattern.
     * Each row has the context text and its kind. The quoted partition never participates.
     *
     * @param pattern
     *            the pattern, null to return all the contexts
     * @return the planned query, possibly empty
     */
    SqlQuery contextQuery(@Nullable final TriplePattern pattern) {
        final TriplePattern actualPattern = pattern != null ? pattern : TriplePattern.any();
        final List<String> selects = Lists.newArrayList();
        final List<Object> parameters = Lists.newArrayList();
        for (final Partition partition : selectPartitions(actualPattern, null)) {
            final String alias = partition.getAlias();
            selects.add("SELECT " + alias + ".context AS context, " + alias
                    + ".termComb % 4 AS contextKind FROM " + from(partition)
                    + where(partition, actualPattern, null, parameters));
        }
        if (selects.isEmpty()) {
            return SqlQuery.empty();
        }
        return new SqlQuery(Joiner.on(" UNION ").join(selects), parameters);
    }

    private String from(final Partition partition) {
        return partition.getTableName(this.prefix) + " AS " + partition.getAlias();
    }

    private String projection(final Partition partition, final List<Object> parameters) {
        final String alias = partition.getAlias();
        final StringBuilder builder = new StringBuilder("SELECT ");
        builder.append(alias).append('.').append(partition.getSubjectColumn())
                .append(" AS subject, ");
        if (partition.getPredicateColumn() == null) {
            builder.append("CAST(? AS text) AS predicate, ");
            parameters.add(RDF.TYPE.stringValue());
        } else {
            builder.append(alias).append('.').append(partition.getPredicateColumn())
                    .append(" AS predicate, ");
        }
        builder.append(alias).append('.').append(partition.getObjectColumn())
                .append(" AS object, ");
        builder.append(alias).append(".context AS context, ");
        builder.append(alias).append(".termComb AS termComb, ");
        if (partition.hasLiteralColumns()) {
            builder.append(alias).append(".objLanguage AS objLanguage, ");
            builder.append(alias).append(".objDatatype AS objDatatype");
        } else {
            builder.append(NULL_TEXT).append(" AS objLanguage, ");
            builder.append(NULL_TEXT).append(" AS objDatatype");
        }
        builder.append(" FROM ").append(from(partition));
        return builder.toString();
    }

    private String where(final Partition partition, final TriplePattern pattern,
            @Nullable final Resource context, final List<Object> parameters) {

        final String alias = partition.getAlias();
        final List<Clause> clauses = Lists.newArrayList();
        clauses.add(ClauseBuilder.buildTerm(alias, partition.getSubjectColumn(),
                TermCodec.SUBJECT_WEIGHT, pattern.getSubject()));
        if (partition.getPredicateColumn() != null) {
            clauses.add(ClauseBuilder.buildTerm(alias, partition.getPredicateColumn(),
                    TermCodec.PREDICATE_WEIGHT, pattern.getPredicate()));
        }
        clauses.add(ClauseBuilder.buildObject(alias, partition.getObjectColumn(),
                pattern.getObject(), partition.hasLiteralColumns()));
        if (context != null) {
            clauses.add(ClauseBuilder.buildTerm(alias, partition.getContextColumn(),
                    TermCodec.CONTEXT_WEIGHT, Selector.of(context)));
        }

        final Clause clause = Clause.and(clauses);
        if (clause == null) {
            return "";
        }
        parameters.addAll(clause.getParameters());
        return " WHERE " + clause.getSQL();
    }

}
