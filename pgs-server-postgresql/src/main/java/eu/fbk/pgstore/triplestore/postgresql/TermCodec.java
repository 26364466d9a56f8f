package eu.fbk.pgstore.triplestore.postgresql;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import org.openrdf.model.BNode;
import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;

import eu.fbk.pgstore.data.Data;
import eu.fbk.pgstore.data.Formula;

/**
 * Encoding of RDF terms to column values and term kinds.
 * <p>
 * Each term is stored as text (URI string, blank node ID, literal label or formula ID) and its
 * kind is recorded in the {@code termComb} column of the row, which packs the kinds of subject,
 * predicate, object and context as {@code 64*s + 16*p + 4*o + c}. Decoding a row only needs the
 * column values and {@code termComb}.
 * </p>
 */
final class TermCodec {

    static final int URI_KIND = 0;

    static final int BNODE_KIND = 1;

    static final int LITERAL_KIND = 2;

    static final int FORMULA_KIND = 3;

    // multipliers of the subject, predicate, object and context kinds in termComb

    static final int SUBJECT_WEIGHT = 64;

    static final int PREDICATE_WEIGHT = 16;

    static final int OBJECT_WEIGHT = 4;

    static final int CONTEXT_WEIGHT = 1;

    static int kindOf(final Value value) {
        if (value instanceof Formula) {
            return FORMULA_KIND;
        } else if (value instanceof URI) {
            return URI_KIND;
        } else if (value instanceof BNode) {
            return BNODE_KIND;
        } else if (value instanceof Literal) {
            return LITERAL_KIND;
        }
        throw new IllegalArgumentException("Unsupported RDF term: " + value);
    }

    static String encode(final Value value) {
        return value instanceof Literal ? ((Literal) value).getLabel() : value.stringValue();
    }

    @Nullable
    static String languageOf(final Value value) {
        return value instanceof Literal ? ((Literal) value).getLanguage() : null;
    }

    @Nullable
    static String datatypeOf(final Value value) {
        if (value instanceof Literal) {
            final URI datatype = ((Literal) value).getDatatype();
            return datatype == null ? null : datatype.stringValue();
        }
        return null;
    }

    static int termComb(final Resource subject, final URI predicate, final Value object,
            final Resource context) {
        return SUBJECT_WEIGHT * kindOf(subject) + PREDICATE_WEIGHT * kindOf(predicate)
                + OBJECT_WEIGHT * kindOf(object) + CONTEXT_WEIGHT * kindOf(context);
    }

    static int subjectKind(final int termComb) {
        return termComb >> 6 & 0x03;
    }

    static int predicateKind(final int termComb) {
        return termComb >> 4 & 0x03;
    }

    static int objectKind(final int termComb) {
        return termComb >> 2 & 0x03;
    }

    static int contextKind(final int termComb) {
        return termComb & 0x03;
    }

    static Value decode(@Nullable final String text, final int kind,
            @Nullable final String language, @Nullable final String datatype) {
        final ValueFactory factory = Data.getValueFactory();
        if (kind == LITERAL_KIND) {
            final String label = Strings.nullToEmpty(text);
            if (language != null) {
                return factory.createLiteral(label, language);
            } else if (datatype != null) {
                return factory.createLiteral(label, factory.createURI(datatype));
            } else {
                return factory.createLiteral(label);
            }
        }
        return decodeResource(text, kind);
    }

    static Resource decodeResource(@Nullable final String text, final int kind) {
        Preconditions.checkArgument(text != null, "Missing value for term of kind %s", kind);
        switch (kind) {
        case URI_KIND:
            return Data.getValueFactory().createURI(text);
        case BNODE_KIND:
            return Data.getValueFactory().createBNode(text);
        case FORMULA_KIND:
            return Formula.create(text);
        default:
            throw new IllegalArgumentException("Not a resource kind: " + kind + " (value '"
                    + text + "')");
        }
    }

    static URI decodeURI(@Nullable final String text, final int kind) {
        Preconditions.checkArgument(kind == URI_KIND, "Not a URI kind: %s (value '%s')", kind,
                text);
        return (URI) decodeResource(text, kind);
    }

    private TermCodec() {
    }

}
