package eu.fbk.pgstore.triplestore;

import com.google.common.collect.ImmutableList;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;

import eu.fbk.pgstore.data.Data;
import eu.fbk.pgstore.data.Formula;

public class SelectorTest {

    private static final ValueFactory VF = Data.getValueFactory();

    private static final URI S1 = VF.createURI("urn:s1");

    private static final URI S2 = VF.createURI("urn:s2");

    @Test
    public void testNullValueIsWildcard() {
        Assert.assertSame(Selector.any(), Selector.of(null));
        Assert.assertTrue(Selector.of(null).isAny());
        Assert.assertFalse(Selector.of(S1).isAny());
    }

    @Test
    public void testAlternativesFlattening() {
        final Selector nested = Selector.anyOf(Selector.of(S1),
                Selector.anyOf(Selector.of(S2), Selector.regex("^urn:")));
        Assert.assertEquals(Selector.Kind.ALTERNATIVES, nested.getKind());
        Assert.assertEquals(3, nested.getAlternatives().size());
        for (final Selector alternative : nested.getAlternatives()) {
            Assert.assertNotEquals(Selector.Kind.ALTERNATIVES, alternative.getKind());
        }
    }

    @Test
    public void testAlternativesWithWildcard() {
        Assert.assertSame(Selector.any(), Selector.anyOf(Selector.of(S1), Selector.any()));
    }

    @Test
    public void testSingleAlternative() {
        Assert.assertEquals(Selector.of(S1), Selector.anyOf(ImmutableList.of(S1)));
    }

    @Test
    public void testEmptyAlternatives() {
        final Selector empty = Selector.anyOf();
        Assert.assertEquals(Selector.Kind.ALTERNATIVES, empty.getKind());
        Assert.assertTrue(empty.getAlternatives().isEmpty());
        Assert.assertFalse(empty.matches(S1));
    }

    @Test
    public void testMatches() {
        Assert.assertTrue(Selector.any().matches(S1));
        Assert.assertTrue(Selector.of(S1).matches(S1));
        Assert.assertFalse(Selector.of(S1).matches(S2));
        Assert.assertTrue(Selector.regex("s[12]$").matches(S2));
        Assert.assertTrue(Selector.regex("type").matches(RDF.TYPE));
        Assert.assertFalse(Selector.regex("^type").matches(RDF.TYPE));
        Assert.assertTrue(Selector.anyOf(ImmutableList.of(S1, RDF.TYPE)).matches(RDF.TYPE));
        Assert.assertFalse(Selector.isNull().matches(S1));
    }

    @Test
    public void testObjectKinds() {
        Assert.assertTrue(Selector.any().mayMatchLiteral());
        Assert.assertTrue(Selector.any().mayMatchResource());
        Assert.assertTrue(Selector.regex("x").mayMatchLiteral());
        Assert.assertTrue(Selector.regex("x").mayMatchResource());
        Assert.assertTrue(Selector.isNull().mayMatchLiteral());
        Assert.assertFalse(Selector.isNull().mayMatchResource());

        final Selector literal = Selector.of(VF.createLiteral("x"));
        Assert.assertTrue(literal.mayMatchLiteral());
        Assert.assertFalse(literal.mayMatchResource());

        final Selector resource = Selector.of(VF.createBNode("b"));
        Assert.assertFalse(resource.mayMatchLiteral());
        Assert.assertTrue(resource.mayMatchResource());
        Assert.assertTrue(Selector.of(Formula.create("f")).mayMatchResource());

        final Selector mixed = Selector.anyOf(literal, Selector.of(RDFS.CLASS));
        Assert.assertTrue(mixed.mayMatchLiteral());
        Assert.assertTrue(mixed.mayMatchResource());
    }

    @Test(expected = IllegalStateException.class)
    public void testGetValueOnWrongKind() {
        Selector.regex("x").getValue();
    }

    @Test
    public void testEqualsAndToString() {
        Assert.assertEquals(Selector.regex("a.*"), Selector.regex("a.*"));
        Assert.assertEquals(Selector.regex("a.*").hashCode(), Selector.regex("a.*").hashCode());
        Assert.assertNotEquals(Selector.regex("a.*"), Selector.regex("b.*"));
        Assert.assertEquals("*", Selector.any().toString());
        Assert.assertEquals("/a.*/", Selector.regex("a.*").toString());
        Assert.assertEquals("(rdf:type | <urn:s1>)",
                Selector.anyOf(ImmutableList.of(RDF.TYPE, S1)).toString());
    }

}
