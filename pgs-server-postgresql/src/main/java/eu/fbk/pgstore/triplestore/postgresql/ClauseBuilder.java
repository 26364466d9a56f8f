package eu.fbk.pgstore.triplestore.postgresql;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.openrdf.model.Literal;
import org.openrdf.model.Value;

import eu.fbk.pgstore.triplestore.Selector;

/**
 * Translates {@link Selector}s on table columns into SQL {@link Clause}s.
 * <p>
 * Concrete values are compared by their encoded text ({@code alias.column = ?}) and, when the
 * column holds a statement term, by the kind recorded for that term in {@code termComb}, so
 * that a literal never matches a URI with the same text. Regular expressions use the PostgreSQL
 * match operator ({@code alias.column ~ ?}), alternatives become disjunctions and the null
 * selector becomes {@code alias.column IS NULL}. Wildcards produce no clause. All values are
 * passed as parameters, never inlined.
 * </p>
 */
final class ClauseBuilder {

    private static final Clause FALSE = new Clause("FALSE", ImmutableList.of());

    private static final int NO_KIND = 0;

    /**
     * Builds the clause constraining a column by its text only.
     *
     * @param alias
     *            the table alias
     * @param column
     *            the column name
     * @param selector
     *            the selector
     * @return the clause, or null if the selector is a wildcard
     */
    @Nullable
    static Clause build(final String alias, final String column, final Selector selector) {
        return build(alias, column, NO_KIND, selector, false);
    }

    /**
     * Builds the clause constraining the column of a statement term. Concrete values also
     * constrain the term kind, extracted from {@code termComb} using the supplied weight.
     *
     * @param alias
     *            the table alias
     * @param column
     *            the column name
     * @param weight
     *            the multiplier of the term kind in {@code termComb}, e.g.
     *            {@link TermCodec#SUBJECT_WEIGHT}
     * @param selector
     *            the selector
     * @return the clause, or null if the selector is a wildcard
     */
    @Nullable
    static Clause buildTerm(final String alias, final String column, final int weight,
            final Selector selector) {
        return build(alias, column, weight, selector, false);
    }

    /**
     * Builds the clause constraining the object column of a table. If the table has the
     * {@code objLanguage} and {@code objDatatype} columns, a concrete literal also constrains
     * them, so that literals sharing a label but differing in language or datatype do not match.
     *
     * @param alias
     *            the table alias
     * @param column
     *            the object column name
     * @param selector
     *            the selector
     * @param literalColumns
     *            whether the table has the literal language and datatype columns
     * @return the clause, or null if the selector is a wildcard
     */
    @Nullable
    static Clause buildObject(final String alias, final String column, final Selector selector,
            final boolean literalColumns) {
        return build(alias, column, TermCodec.OBJECT_WEIGHT, selector, literalColumns);
    }

    @Nullable
    private static Clause build(final String alias, final String column, final int weight,
            final Selector selector, final boolean literalColumns) {

        final String qualified = alias + "." + column;

        switch (selector.getKind()) {
        case ANY:
            return null;

        case NULL:
            return new Clause(qualified + " IS NULL", ImmutableList.of());

        case REGEX:
            return new Clause(qualified + " ~ ?", ImmutableList.of(selector.getRegex()));

        case VALUE:
            final Value value = selector.getValue();
            final Clause clause = new Clause(qualified + " = ?",
                    ImmutableList.of(TermCodec.encode(value)));
            final List<Clause> conjuncts = Lists.newArrayList(clause);
            if (weight != NO_KIND) {
                conjuncts.add(new Clause(kindExpression(alias, weight) + " = ?",
                        ImmutableList.of(TermCodec.kindOf(value))));
            }
            if (literalColumns && value instanceof Literal) {
                conjuncts.add(nullableEquals(alias + ".objLanguage",
                        TermCodec.languageOf(value)));
                conjuncts.add(nullableEquals(alias + ".objDatatype",
                        TermCodec.datatypeOf(value)));
            }
            if (conjuncts.size() == 1) {
                return clause;
            }
            final Clause conjunction = Clause.and(conjuncts);
            return new Clause("(" + conjunction.getSQL() + ")", conjunction.getParameters());

        case ALTERNATIVES:
            final List<Selector> alternatives = selector.getAlternatives();
            if (alternatives.isEmpty()) {
                return FALSE;
            }
            final List<String> fragments = Lists.newArrayList();
            final List<Object> parameters = Lists.newArrayList();
            for (final Selector alternative : alternatives) {
                final Clause c = build(alias, column, weight, alternative, literalColumns);
                if (c == null) {
                    return null; // wildcard alternative
                }
                fragments.add(c.getSQL());
                parameters.addAll(c.getParameters());
            }
            return new Clause("(" + Joiner.on(" OR ").join(fragments) + ")", parameters);

        default:
            throw new Error("Unexpected selector kind: " + selector.getKind());
        }
    }

    private static String kindExpression(final String alias, final int weight) {
        return weight == TermCodec.CONTEXT_WEIGHT ? alias + ".termComb % 4" : "(" + alias
                + ".termComb / " + weight + ") % 4";
    }

    private static Clause nullableEquals(final String qualified, @Nullable final String value) {
        return value == null ? new Clause(qualified + " IS NULL", ImmutableList.of())
                : new Clause(qualified + " = ?", ImmutableList.of(value));
    }

    private ClauseBuilder() {
    }

}
