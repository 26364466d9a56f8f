package eu.fbk.pgstore.data;

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import org.openrdf.model.BNode;
import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.model.vocabulary.OWL;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.SESAME;
import org.openrdf.model.vocabulary.XMLSchema;

/**
 * Helper services for working with PgStore data.
 * <p>
 * This class provides access to the {@code ValueFactory} used throughout PgStore for creating
 * {@link Value}s and {@link Statement}s, to a small map of common prefix-to-namespace mappings
 * and to methods for producing compact, Turtle-like string representations of values and
 * statements, mainly for logging purposes.
 * </p>
 */
public final class Data {

    private static final ValueFactory VALUE_FACTORY = ValueFactoryImpl.getInstance();

    private static final Map<String, String> COMMON_NAMESPACES = ImmutableMap
            .<String, String>builder().put("rdf", RDF.NAMESPACE).put("rdfs", RDFS.NAMESPACE)
            .put("owl", OWL.NAMESPACE).put("xsd", XMLSchema.NAMESPACE)
            .put("sesame", SESAME.NAMESPACE).build();

    /**
     * Returns the {@code ValueFactory} for creating RDF {@code URI}s, {@code BNode}s,
     * {@code Literal}s and {@code Statement}s.
     *
     * @return a singleton {@code ValueFactory}
     */
    public static ValueFactory getValueFactory() {
        return VALUE_FACTORY;
    }

    /**
     * Returns an immutable map of common prefix-to-namespace mappings (rdf, rdfs, owl, xsd,
     * sesame).
     *
     * @return a singleton prefix-to-namespace map
     */
    public static Map<String, String> getNamespaceMap() {
        return COMMON_NAMESPACES;
    }

    /**
     * Performs a reverse lookup of the prefix bound to a namespace in a prefix-to-namespace map.
     *
     * @param namespace
     *            the namespace to look up
     * @param namespaceMap
     *            the prefix-to-namespace map containing the searched mapping
     * @return the prefix of the namespace, or null if no mapping is defined
     */
    @Nullable
    public static String namespaceToPrefix(final String namespace,
            final Map<String, String> namespaceMap) {
        Preconditions.checkNotNull(namespace);
        for (final Map.Entry<String, String> entry : namespaceMap.entrySet()) {
            if (entry.getValue().equals(namespace)) {
                return entry.getKey();
            }
        }
        return null;
    }

    /**
     * Returns a string representation of the supplied {@code Value} or {@code Statement},
     * optionally abbreviating URIs using the supplied namespaces. Formulae are rendered as
     * {@code {id}}.
     *
     * @param object
     *            the value or statement, possibly null
     * @param namespaces
     *            the optional prefix-to-namespace mappings to use for generating the string
     * @return the produced string, or null if a null object was passed as input
     */
    @Nullable
    public static String toString(@Nullable final Object object,
            @Nullable final Map<String, String> namespaces) {

        if (object instanceof Statement) {
            final Statement statement = (Statement) object;
            final StringBuilder builder = new StringBuilder();
            builder.append('(');
            toString(statement.getSubject(), namespaces, builder);
            builder.append(',').append(' ');
            toString(statement.getPredicate(), namespaces, builder);
            builder.append(',').append(' ');
            toString(statement.getObject(), namespaces, builder);
            builder.append(")");
            final Resource ctx = statement.getContext();
            if (ctx != null) {
                builder.append(' ').append('[');
                toString(ctx, namespaces, builder);
                builder.append(']');
            }
            return builder.toString();

        } else if (object instanceof Value) {
            final StringBuilder builder = new StringBuilder();
            toString((Value) object, namespaces, builder);
            return builder.toString();

        } else if (object != null) {
            return object.toString();
        }

        return null;
    }

    private static void toString(final Value value,
            @Nullable final Map<String, String> namespaces, final StringBuilder builder) {

        if (value instanceof Formula) {
            builder.append('{').append(((Formula) value).getID()).append('}');

        } else if (value instanceof URI) {
            final URI uri = (URI) value;
            String prefix = null;
            if (namespaces != null) {
                prefix = namespaceToPrefix(uri.getNamespace(), namespaces);
            }
            if (prefix != null) {
                builder.append(prefix).append(':').append(uri.getLocalName());
            } else {
                builder.append('<').append(uri.stringValue()).append('>');
            }

        } else if (value instanceof BNode) {
            builder.append('_').append(':').append(((BNode) value).getID());

        } else {
            final Literal literal = (Literal) value;
            builder.append('\"').append(literal.getLabel()).append('\"');
            final URI datatype = literal.getDatatype();
            if (datatype != null) {
                builder.append('^').append('^');
                toString(datatype, namespaces, builder);
            } else {
                final String language = literal.getLanguage();
                if (language != null) {
                    builder.append('@').append(language);
                }
            }
        }
    }

    private Data() {
    }

}
