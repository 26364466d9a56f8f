package eu.fbk.pgstore.triplestore;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.Value;

import eu.fbk.pgstore.data.Data;

/**
 * A constraint on one component (subject, predicate or object) of a triple pattern.
 * <p>
 * A {@code Selector} is one of the following:
 * </p>
 * <ul>
 * <li>the wildcard {@link #any()}, matching every term;</li>
 * <li>a concrete value {@link #of(Value)}, matching only that term;</li>
 * <li>a regular expression {@link #regex(String)}, matching terms whose lexical form contains a
 * match of the expression (evaluated natively by the backend);</li>
 * <li>a list of alternatives {@link #anyOf(Selector...)}, matching terms matched by any
 * alternative;</li>
 * <li>the {@link #isNull()} selector, matching missing values (e.g., the language of a literal
 * without language).</li>
 * </ul>
 * <p>
 * Selectors are immutable. Alternatives are flattened on creation: nested lists are inlined and a
 * list containing the wildcard is the wildcard itself.
 * </p>
 */
public final class Selector {

    /** The kinds of {@code Selector}. */
    public enum Kind {

        /** Wildcard. */
        ANY,

        /** Concrete value. */
        VALUE,

        /** Regular expression. */
        REGEX,

        /** List of alternatives. */
        ALTERNATIVES,

        /** Missing value. */
        NULL

    }

    private static final Selector ANY = new Selector(Kind.ANY, null, null,
            ImmutableList.<Selector>of());

    private static final Selector NULL = new Selector(Kind.NULL, null, null,
            ImmutableList.<Selector>of());

    private final Kind kind;

    @Nullable
    private final Value value;

    @Nullable
    private final Pattern regex;

    private final List<Selector> alternatives;

    private Selector(final Kind kind, @Nullable final Value value, @Nullable final Pattern regex,
            final List<Selector> alternatives) {
        this.kind = kind;
        this.value = value;
        this.regex = regex;
        this.alternatives = alternatives;
    }

    /**
     * Returns the wildcard selector.
     *
     * @return the wildcard selector
     */
    public static Selector any() {
        return ANY;
    }

    /**
     * Returns the selector matching missing values.
     *
     * @return the null selector
     */
    public static Selector isNull() {
        return NULL;
    }

    /**
     * Returns a selector matching exactly the value supplied, or the wildcard if null.
     *
     * @param value
     *            the value to match, possibly null
     * @return the corresponding selector
     */
    public static Selector of(@Nullable final Value value) {
        return value == null ? ANY : new Selector(Kind.VALUE, value, null,
                ImmutableList.<Selector>of());
    }

    /**
     * Returns a selector matching the terms whose lexical form contains a match of the supplied
     * regular expression.
     *
     * @param regex
     *            the regular expression
     * @return the corresponding selector
     * @throws java.util.regex.PatternSyntaxException
     *             if the expression is not valid
     */
    public static Selector regex(final String regex) {
        return new Selector(Kind.REGEX, null, Pattern.compile(regex),
                ImmutableList.<Selector>of());
    }

    /**
     * Returns a selector matching any of the supplied values.
     *
     * @param values
     *            the alternative values
     * @return the corresponding selector
     */
    public static Selector anyOf(final Iterable<? extends Value> values) {
        final ImmutableList.Builder<Selector> builder = ImmutableList.builder();
        for (final Value value : values) {
            builder.add(of(Preconditions.checkNotNull(value)));
        }
        final List<Selector> selectors = builder.build();
        return anyOf(selectors.toArray(new Selector[selectors.size()]));
    }

    /**
     * Returns a selector matching the terms matched by any of the supplied selectors.
     *
     * @param selectors
     *            the alternative selectors
     * @return the corresponding selector
     */
    public static Selector anyOf(final Selector... selectors) {
        final ImmutableList.Builder<Selector> builder = ImmutableList.builder();
        for (final Selector selector : selectors) {
            switch (selector.kind) {
            case ANY:
                return ANY;
            case ALTERNATIVES:
                builder.addAll(selector.alternatives);
                break;
            default:
                builder.add(selector);
            }
        }
        final List<Selector> alternatives = builder.build();
        return alternatives.size() == 1 ? alternatives.get(0) : new Selector(Kind.ALTERNATIVES,
                null, null, alternatives);
    }

    public Kind getKind() {
        return this.kind;
    }

    public boolean isAny() {
        return this.kind == Kind.ANY;
    }

    /**
     * Returns the value of a {@link Kind#VALUE} selector.
     *
     * @return the value
     * @throws IllegalStateException
     *             if the selector is of a different kind
     */
    public Value getValue() {
        Preconditions.checkState(this.kind == Kind.VALUE, "Not a value selector: %s", this);
        return this.value;
    }

    /**
     * Returns the regular expression of a {@link Kind#REGEX} selector.
     *
     * @return the regular expression
     * @throws IllegalStateException
     *             if the selector is of a different kind
     */
    public String getRegex() {
        Preconditions.checkState(this.kind == Kind.REGEX, "Not a regex selector: %s", this);
        return this.regex.pattern();
    }

    /**
     * Returns the alternatives of a {@link Kind#ALTERNATIVES} selector, an empty list otherwise.
     *
     * @return an immutable list of alternatives, none of them being a list itself
     */
    public List<Selector> getAlternatives() {
        return this.alternatives;
    }

    /**
     * Checks whether the supplied term could be matched by this selector.
     *
     * @param term
     *            the term
     * @return true if the term is matched
     */
    public boolean matches(final Value term) {
        switch (this.kind) {
        case ANY:
            return true;
        case VALUE:
            return this.value.equals(term);
        case REGEX:
            return this.regex.matcher(term.stringValue()).find();
        case ALTERNATIVES:
            for (final Selector alternative : this.alternatives) {
                if (alternative.matches(term)) {
                    return true;
                }
            }
            return false;
        default:
            return false;
        }
    }

    /**
     * Checks whether this selector, used on the object of a pattern, may match a literal.
     *
     * @return true for wildcards, regexes, null selectors, literal values and lists containing
     *         one of them
     */
    public boolean mayMatchLiteral() {
        switch (this.kind) {
        case VALUE:
            return this.value instanceof Literal;
        case ALTERNATIVES:
            for (final Selector alternative : this.alternatives) {
                if (alternative.mayMatchLiteral()) {
                    return true;
                }
            }
            return false;
        default:
            return true;
        }
    }

    /**
     * Checks whether this selector, used on the object of a pattern, may match a resource (URI,
     * blank node or formula).
     *
     * @return true for wildcards, regexes, resource values and lists containing one of them
     */
    public boolean mayMatchResource() {
        switch (this.kind) {
        case ANY:
        case REGEX:
            return true;
        case VALUE:
            return this.value instanceof Resource;
        case ALTERNATIVES:
            for (final Selector alternative : this.alternatives) {
                if (alternative.mayMatchResource()) {
                    return true;
                }
            }
            return false;
        default:
            return false;
        }
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Selector)) {
            return false;
        }
        final Selector other = (Selector) object;
        return this.kind == other.kind && Objects.equals(this.value, other.value)
                && Objects.equals(this.regex == null ? null : this.regex.pattern(),
                        other.regex == null ? null : other.regex.pattern())
                && this.alternatives.equals(other.alternatives);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.kind, this.value,
                this.regex == null ? null : this.regex.pattern(), this.alternatives);
    }

    @Override
    public String toString() {
        switch (this.kind) {
        case ANY:
            return "*";
        case VALUE:
            return Data.toString(this.value, Data.getNamespaceMap());
        case REGEX:
            return "/" + this.regex.pattern() + "/";
        case ALTERNATIVES:
            return "(" + Joiner.on(" | ").join(this.alternatives) + ")";
        default:
            return "NULL";
        }
    }

}
