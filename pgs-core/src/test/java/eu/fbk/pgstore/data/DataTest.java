package eu.fbk.pgstore.data;

import org.junit.Assert;
import org.junit.Test;
import org.openrdf.model.Statement;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.XMLSchema;

public class DataTest {

    @Test
    public void testToStringValues() {
        final ValueFactory vf = Data.getValueFactory();
        Assert.assertEquals("rdf:type", Data.toString(RDF.TYPE, Data.getNamespaceMap()));
        Assert.assertEquals("<" + RDF.TYPE + ">", Data.toString(RDF.TYPE, null));
        Assert.assertEquals("_:b1", Data.toString(vf.createBNode("b1"), null));
        Assert.assertEquals("\"ciao\"@it", Data.toString(vf.createLiteral("ciao", "it"), null));
        Assert.assertEquals("\"1\"^^xsd:int",
                Data.toString(vf.createLiteral("1", XMLSchema.INT), Data.getNamespaceMap()));
        Assert.assertEquals("{f1}", Data.toString(Formula.create("f1"), null));
        Assert.assertNull(Data.toString(null, null));
    }

    @Test
    public void testToStringStatement() {
        final ValueFactory vf = Data.getValueFactory();
        final Statement statement = vf.createStatement(vf.createURI("urn:s"), RDFS.LABEL,
                vf.createLiteral("label"), Formula.create("f1"));
        Assert.assertEquals("(<urn:s>, rdfs:label, \"label\") [{f1}]",
                Data.toString(statement, Data.getNamespaceMap()));
    }

    @Test
    public void testNamespaceToPrefix() {
        Assert.assertEquals("rdfs", Data.namespaceToPrefix(RDFS.NAMESPACE, Data.getNamespaceMap()));
        Assert.assertNull(Data.namespaceToPrefix("urn:unknown#", Data.getNamespaceMap()));
    }

}
