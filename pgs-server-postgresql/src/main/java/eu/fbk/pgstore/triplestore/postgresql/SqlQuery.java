package eu.fbk.pgstore.triplestore.postgresql;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A planned SQL query with its positional parameters. The empty query denotes a request no
 * partition can satisfy and is never sent to the database.
 */
final class SqlQuery {

    private static final SqlQuery EMPTY = new SqlQuery("", ImmutableList.of());

    private final String sql;

    private final List<Object> parameters;

    SqlQuery(final String sql, final List<?> parameters) {
        this.sql = Preconditions.checkNotNull(sql);
        this.parameters = ImmutableList.copyOf(parameters);
    }

    static SqlQuery empty() {
        return EMPTY;
    }

    boolean isEmpty() {
        return this.sql.isEmpty();
    }

    String getSQL() {
        return this.sql;
    }

    List<Object> getParameters() {
        return this.parameters;
    }

    @Override
    public String toString() {
        return isEmpty() ? "<empty>" : this.sql + " " + this.parameters;
    }

}
