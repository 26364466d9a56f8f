package eu.fbk.pgstore.triplestore.postgresql;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * A SQL boolean fragment together with the values of its {@code ?} placeholders, in order.
 */
final class Clause {

    private final String sql;

    private final List<Object> parameters;

    Clause(final String sql, final List<?> parameters) {
        this.sql = Preconditions.checkNotNull(sql);
        this.parameters = ImmutableList.copyOf(parameters);
    }

    String getSQL() {
        return this.sql;
    }

    List<Object> getParameters() {
        return this.parameters;
    }

    /**
     * Combines the supplied clauses in conjunction.
     *
     * @param clauses
     *            the clauses to combine, null elements being ignored
     * @return the conjunction, or null if no clause was supplied
     */
    @Nullable
    static Clause and(final Iterable<Clause> clauses) {
        final List<String> fragments = Lists.newArrayList();
        final List<Object> parameters = Lists.newArrayList();
        for (final Clause clause : clauses) {
            if (clause != null) {
                fragments.add(clause.sql);
                parameters.addAll(clause.parameters);
            }
        }
        if (fragments.isEmpty()) {
            return null;
        } else if (fragments.size() == 1) {
            return new Clause(fragments.get(0), parameters);
        }
        return new Clause(Joiner.on(" AND ").join(fragments), parameters);
    }

    @Override
    public String toString() {
        return this.sql + " " + this.parameters;
    }

}
