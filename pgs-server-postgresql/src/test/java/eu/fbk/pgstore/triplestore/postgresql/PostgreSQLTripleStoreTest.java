package eu.fbk.pgstore.triplestore.postgresql;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.junit.After;
import org.junit.Assert;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Test;
import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.model.vocabulary.SESAME;
import org.openrdf.model.vocabulary.XMLSchema;

import info.aduna.iteration.CloseableIteration;
import info.aduna.iteration.Iterations;

import eu.fbk.pgstore.data.Data;
import eu.fbk.pgstore.data.Formula;
import eu.fbk.pgstore.triplestore.Selector;
import eu.fbk.pgstore.triplestore.TripleContexts;
import eu.fbk.pgstore.triplestore.TriplePattern;
import eu.fbk.pgstore.triplestore.TripleStore;
import eu.fbk.pgstore.triplestore.TripleTransaction;

/**
 * Runs against a live database, configured through system property {@code pgstore.test.config}
 * (e.g. {@code -Dpgstore.test.config="user=test password=test dbname=test"}).
 */
public class PostgreSQLTripleStoreTest {

    private static final ValueFactory FACTORY = Data.getValueFactory();

    private static final URI ALICE = FACTORY.createURI("http://example.org/alice");

    private static final URI BOB = FACTORY.createURI("http://example.org/bob");

    private static final URI KNOWS = FACTORY.createURI("http://example.org/knows");

    private static final URI PERSON = FACTORY.createURI("http://example.org/Person");

    private static final URI G1 = FACTORY.createURI("http://example.org/g1");

    private static final URI G2 = FACTORY.createURI("http://example.org/g2");

    private static final Literal NAME = FACTORY.createLiteral("Alice", "en");

    private static final Literal AGE = FACTORY.createLiteral("42", XMLSchema.INTEGER);

    private PostgreSQLTripleStore store;

    @Before
    public void setUp() throws Throwable {
        final String config = System.getProperty("pgstore.test.config");
        Assume.assumeNotNull(config);
        this.store = new PostgreSQLTripleStore(PostgreSQLConfiguration.parse(config),
                "urn:pgstore:test:" + System.nanoTime(), null, 50);
        Assert.assertEquals(TripleStore.Status.VALID_STORE, this.store.open(true));
    }

    @After
    public void tearDown() throws Throwable {
        if (this.store != null) {
            this.store.destroy();
            this.store.close();
        }
    }

    private void add(final Statement... statements) throws Throwable {
        final TripleTransaction tx = this.store.begin(false);
        tx.add(ImmutableList.copyOf(statements));
        tx.end(true);
    }

    private List<Statement> get(final Resource subject, final URI predicate,
            final Resource context) throws Throwable {
        final TripleTransaction tx = this.store.begin(true);
        try {
            return Iterations.asList(tx.get(subject, predicate, null, context));
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testAddAndGet() throws Throwable {
        final Statement s1 = FACTORY.createStatement(ALICE, KNOWS, BOB, G1);
        final Statement s2 = FACTORY.createStatement(ALICE, RDF.TYPE, PERSON, G1);
        final Statement s3 = FACTORY.createStatement(ALICE, RDFS.LABEL, NAME, G1);
        final Statement s4 = FACTORY.createStatement(ALICE, KNOWS, AGE, G2);
        add(s1, s2, s3, s4);

        Assert.assertEquals(ImmutableSet.of(s1, s2, s3, s4),
                ImmutableSet.copyOf(get(ALICE, null, null)));
        Assert.assertEquals(ImmutableList.of(s2), get(null, RDF.TYPE, null));
        Assert.assertEquals(ImmutableList.of(s3), get(null, RDFS.LABEL, null));
        Assert.assertEquals(ImmutableSet.of(s1, s2, s3),
                ImmutableSet.copyOf(get(ALICE, null, G1)));
    }

    @Test
    public void testAddIsIdempotent() throws Throwable {
        final Statement statement = FACTORY.createStatement(ALICE, RDFS.LABEL, NAME, G1);
        add(statement);
        add(statement, statement);
        final TripleTransaction tx = this.store.begin(true);
        Assert.assertEquals(1L, tx.size(null));
        tx.end(false);
    }

    @Test
    public void testNullContextDefaultsToNil() throws Throwable {
        add(FACTORY.createStatement(ALICE, KNOWS, BOB));
        Assert.assertEquals(ImmutableList.of(FACTORY.createStatement(ALICE, KNOWS, BOB,
                SESAME.NIL)), get(ALICE, KNOWS, null));
    }

    @Test
    public void testMatchGroupsContexts() throws Throwable {
        add(FACTORY.createStatement(ALICE, KNOWS, BOB, G1),
                FACTORY.createStatement(ALICE, KNOWS, BOB, G2),
                FACTORY.createStatement(BOB, KNOWS, ALICE, G1));

        final TripleTransaction tx = this.store.begin(true);
        try {
            final CloseableIteration<TripleContexts, ?> iteration = tx.match(
                    TriplePattern.of(Selector.any(), Selector.of(KNOWS), Selector.any()), null);
            try {
                Assert.assertTrue(iteration.hasNext());
                final TripleContexts first = iteration.next();
                Assert.assertEquals(ALICE, first.getSubject());
                Assert.assertEquals(ImmutableSet.of(G1, G2),
                        ImmutableSet.copyOf(Iterations.asList(first.getContexts())));
                final TripleContexts second = iteration.next();
                Assert.assertEquals(BOB, second.getSubject());
                Assert.assertEquals(ImmutableList.of(G1),
                        Iterations.asList(second.getContexts()));
                Assert.assertFalse(iteration.hasNext());
            } finally {
                iteration.close();
            }
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testValuesMatchTermKind() throws Throwable {
        final URI klass = FACTORY.createURI("urn:C");
        final Statement typed = FACTORY.createStatement(ALICE, RDF.TYPE, klass, G1);
        final Statement labelled = FACTORY.createStatement(BOB, RDFS.LABEL,
                FACTORY.createLiteral("urn:C"), G1);
        add(typed, labelled, FACTORY.createStatement(ALICE, KNOWS, BOB, G1));

        final TripleTransaction tx = this.store.begin(true);
        try {
            Assert.assertEquals(ImmutableList.of(labelled), Iterations.asList(tx.get(null, null,
                    FACTORY.createLiteral("urn:C"), null)));
            Assert.assertEquals(ImmutableList.of(typed), Iterations.asList(tx.get(null, null,
                    klass, null)));
            Assert.assertTrue(Iterations.asList(tx.get(FACTORY.createBNode(
                    ALICE.stringValue()), null, null, null)).isEmpty());
            Assert.assertTrue(Iterations.asList(tx.match(TriplePattern.of(Selector.any(),
                    Selector.any(), Selector.anyOf(ImmutableList.of(
                            FACTORY.createLiteral(BOB.stringValue())))), null)).isEmpty());
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testRegexAndAlternatives() throws Throwable {
        add(FACTORY.createStatement(ALICE, KNOWS, BOB, G1),
                FACTORY.createStatement(BOB, KNOWS, ALICE, G1),
                FACTORY.createStatement(ALICE, RDFS.LABEL, NAME, G1));

        final TripleTransaction tx = this.store.begin(true);
        try {
            Assert.assertEquals(2, Iterations.asList(
                    tx.match(TriplePattern.of(Selector.regex("alice$"), Selector.any(),
                            Selector.any()), null)).size());
            Assert.assertEquals(2, Iterations.asList(
                    tx.match(TriplePattern.of(Selector.any(), Selector.any(),
                            Selector.anyOf(ImmutableList.of(BOB, NAME))), null)).size());
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testSizeAndContexts() throws Throwable {
        add(FACTORY.createStatement(ALICE, KNOWS, BOB, G1),
                FACTORY.createStatement(ALICE, RDF.TYPE, PERSON, G2),
                FACTORY.createStatement(ALICE, RDFS.LABEL, NAME, G2));

        final TripleTransaction tx = this.store.begin(true);
        try {
            Assert.assertEquals(3L, tx.size(null));
            Assert.assertEquals(1L, tx.size(G1));
            Assert.assertEquals(2L, tx.size(G2));
            Assert.assertEquals(ImmutableSet.of(G1, G2),
                    ImmutableSet.copyOf(Iterations.asList(tx.contexts(null))));
            Assert.assertEquals(ImmutableSet.of(G2), ImmutableSet.copyOf(Iterations.asList(
                    tx.contexts(TriplePattern.of(null, RDF.TYPE, null)))));
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testQuotedStatements() throws Throwable {
        final Formula formula = Formula.create("f1");
        final Statement quoted = FACTORY.createStatement(ALICE, KNOWS, BOB, formula);
        add(quoted);

        Assert.assertTrue(get(ALICE, KNOWS, null).isEmpty());
        Assert.assertEquals(ImmutableList.of(quoted), get(ALICE, KNOWS, formula));

        final TripleTransaction tx = this.store.begin(true);
        try {
            Assert.assertEquals(1L, tx.size(formula));
            Assert.assertTrue(Iterations.asList(tx.contexts(null)).isEmpty());
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testRemove() throws Throwable {
        add(FACTORY.createStatement(ALICE, KNOWS, BOB, G1),
                FACTORY.createStatement(ALICE, KNOWS, BOB, G2),
                FACTORY.createStatement(ALICE, RDFS.LABEL, NAME, G1));

        TripleTransaction tx = this.store.begin(false);
        tx.remove(ImmutableList.of(FACTORY.createStatement(ALICE, KNOWS, BOB, G1),
                FACTORY.createStatement(ALICE, RDFS.LABEL, NAME, G1)));
        tx.end(true);
        Assert.assertEquals(ImmutableList.of(FACTORY.createStatement(ALICE, KNOWS, BOB, G2)),
                get(ALICE, null, null));

        tx = this.store.begin(false);
        tx.remove(ImmutableList.of(FACTORY.createStatement(ALICE, KNOWS, BOB)));
        tx.end(true);
        Assert.assertTrue(get(ALICE, null, null).isEmpty());
    }

    @Test
    public void testRollback() throws Throwable {
        final TripleTransaction tx = this.store.begin(false);
        tx.add(ImmutableList.of(FACTORY.createStatement(ALICE, KNOWS, BOB, G1)));
        tx.end(false);
        Assert.assertTrue(get(ALICE, null, null).isEmpty());
    }

    @Test
    public void testNamespaces() throws Throwable {
        TripleTransaction tx = this.store.begin(false);
        tx.bind("ex", "http://example.org/");
        tx.bind("foaf", "http://xmlns.com/foaf/0.1/");
        tx.bind("ex", "http://example.com/");
        tx.end(true);

        tx = this.store.begin(true);
        try {
            Assert.assertEquals("http://example.com/", tx.getNamespace("ex"));
            Assert.assertEquals("foaf", tx.getPrefix("http://xmlns.com/foaf/0.1/"));
            Assert.assertNull(tx.getPrefix("http://example.org/"));
            Assert.assertEquals(ImmutableList.of("ex", "foaf"),
                    ImmutableList.copyOf(tx.getNamespaces().keySet()));
        } finally {
            tx.end(false);
        }
    }

    @Test
    public void testResetAndDestroy() throws Throwable {
        add(FACTORY.createStatement(ALICE, KNOWS, BOB, G1));
        this.store.reset();
        this.store.reset();
        Assert.assertTrue(this.store.exists());
        Assert.assertTrue(get(ALICE, null, null).isEmpty());

        Assert.assertEquals(0, this.store.destroy());
        Assert.assertFalse(this.store.exists());
        Assert.assertEquals(TripleStore.Status.NO_STORE, this.store.open(false));
    }

}
