package eu.fbk.pgstore.triplestore;

import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;

/**
 * A triple pattern, made of a {@link Selector} for each of subject, predicate and object.
 */
public final class TriplePattern {

    private static final TriplePattern ANY = new TriplePattern(Selector.any(), Selector.any(),
            Selector.any());

    private final Selector subject;

    private final Selector predicate;

    private final Selector object;

    private TriplePattern(final Selector subject, final Selector predicate,
            final Selector object) {
        this.subject = Preconditions.checkNotNull(subject);
        this.predicate = Preconditions.checkNotNull(predicate);
        this.object = Preconditions.checkNotNull(object);
    }

    /**
     * Returns the pattern matching every triple.
     *
     * @return the wildcard pattern
     */
    public static TriplePattern any() {
        return ANY;
    }

    /**
     * Returns a pattern matching concrete values, with null values used as wildcards.
     *
     * @param subject
     *            the subject, null to match any subject
     * @param predicate
     *            the predicate, null to match any predicate
     * @param object
     *            the object, null to match any object
     * @return the created pattern
     */
    public static TriplePattern of(@Nullable final Resource subject,
            @Nullable final URI predicate, @Nullable final Value object) {
        return of(Selector.of(subject), Selector.of(predicate), Selector.of(object));
    }

    /**
     * Returns a pattern made of the supplied selectors.
     *
     * @param subject
     *            the subject selector
     * @param predicate
     *            the predicate selector
     * @param object
     *            the object selector
     * @return the created pattern
     */
    public static TriplePattern of(final Selector subject, final Selector predicate,
            final Selector object) {
        if (subject.isAny() && predicate.isAny() && object.isAny()) {
            return ANY;
        }
        return new TriplePattern(subject, predicate, object);
    }

    public Selector getSubject() {
        return this.subject;
    }

    public Selector getPredicate() {
        return this.predicate;
    }

    public Selector getObject() {
        return this.object;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof TriplePattern)) {
            return false;
        }
        final TriplePattern other = (TriplePattern) object;
        return this.subject.equals(other.subject) && this.predicate.equals(other.predicate)
                && this.object.equals(other.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.subject, this.predicate, this.object);
    }

    @Override
    public String toString() {
        return "<" + this.subject + ", " + this.predicate + ", " + this.object + ">";
    }

}
