package eu.fbk.pgstore.triplestore.postgresql;

import javax.annotation.Nullable;

import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.vocabulary.RDF;

import eu.fbk.pgstore.data.Formula;

/**
 * The statement tables of a store.
 * <p>
 * Every statement is stored in exactly one of {@link #TYPE} (predicate {@code rdf:type}),
 * {@link #LITERAL} (literal object) and {@link #ASSERTED} (any other statement), unless its
 * context is a {@link Formula}, in which case it is stored in {@link #QUOTED}.
 * </p>
 */
enum Partition {

    TYPE("type", "typeTable", "member", null, "klass", false),

    LITERAL("literal", "literal", "subject", "predicate", "object", true),

    ASSERTED("asserted", "asserted", "subject", "predicate", "object", false),

    QUOTED("quoted", "quoted", "subject", "predicate", "object", true);

    private final String role;

    private final String alias;

    private final String subjectColumn;

    @Nullable
    private final String predicateColumn;

    private final String objectColumn;

    private final boolean literalColumns;

    private Partition(final String role, final String alias, final String subjectColumn,
            @Nullable final String predicateColumn, final String objectColumn,
            final boolean literalColumns) {
        this.role = role;
        this.alias = alias;
        this.subjectColumn = subjectColumn;
        this.predicateColumn = predicateColumn;
        this.objectColumn = objectColumn;
        this.literalColumns = literalColumns;
    }

    String getAlias() {
        return this.alias;
    }

    String getTableName(final String prefix) {
        return prefix + "_" + this.role + "_statements";
    }

    String getSubjectColumn() {
        return this.subjectColumn;
    }

    /**
     * Returns the predicate column, or null for {@link #TYPE} whose predicate is implicit.
     */
    @Nullable
    String getPredicateColumn() {
        return this.predicateColumn;
    }

    String getObjectColumn() {
        return this.objectColumn;
    }

    String getContextColumn() {
        return "context";
    }

    /**
     * Returns whether the partition has the {@code objLanguage} and {@code objDatatype} columns.
     */
    boolean hasLiteralColumns() {
        return this.literalColumns;
    }

    /**
     * Returns the partition where a statement with the supplied components is stored.
     *
     * @param predicate
     *            the predicate
     * @param object
     *            the object
     * @param context
     *            the context
     * @return the partition for the statement
     */
    static Partition forStatement(final URI predicate, final Value object,
            final Resource context) {
        if (context instanceof Formula) {
            return QUOTED;
        } else if (RDF.TYPE.equals(predicate)) {
            return TYPE;
        } else if (object instanceof Literal) {
            return LITERAL;
        } else {
            return ASSERTED;
        }
    }

}
