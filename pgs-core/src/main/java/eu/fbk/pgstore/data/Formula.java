package eu.fbk.pgstore.data;

import java.util.UUID;

import com.google.common.base.Preconditions;

import org.openrdf.model.Resource;

/**
 * The identifier of a quoted graph (formula).
 * <p>
 * A {@code Formula} names a graph whose statements are treated as data rather than as asserted
 * facts, as done in Notation 3 for rules and reification-like constructs. It can be used as the
 * context of a statement, meaning the statement is quoted inside the formula, as well as the
 * subject or object of a statement, meaning the statement talks about the formula. Two
 * {@code Formula}s are equal if they have the same identifier; a {@code Formula} is never equal
 * to a {@code URI} or {@code BNode} with the same string value.
 * </p>
 */
public final class Formula implements Resource {

    private static final long serialVersionUID = 1L;

    private final String id;

    private Formula(final String id) {
        this.id = id;
    }

    /**
     * Returns the {@code Formula} with the identifier specified.
     *
     * @param id
     *            the identifier, not empty
     * @return the corresponding {@code Formula}
     */
    public static Formula create(final String id) {
        Preconditions.checkArgument(!id.isEmpty(), "Empty formula identifier");
        return new Formula(id);
    }

    /**
     * Returns a new {@code Formula} with a random identifier.
     *
     * @return the created {@code Formula}
     */
    public static Formula create() {
        return new Formula("f" + UUID.randomUUID().toString().replace("-", ""));
    }

    /**
     * Returns the identifier of this formula.
     *
     * @return the identifier
     */
    public String getID() {
        return this.id;
    }

    @Override
    public String stringValue() {
        return this.id;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Formula)) {
            return false;
        }
        return this.id.equals(((Formula) object).id);
    }

    @Override
    public int hashCode() {
        return this.id.hashCode();
    }

    @Override
    public String toString() {
        return "{" + this.id + "}";
    }

}
