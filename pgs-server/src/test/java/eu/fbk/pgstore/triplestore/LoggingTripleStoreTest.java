package eu.fbk.pgstore.triplestore;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;
import org.openrdf.query.QueryEvaluationException;

import info.aduna.iteration.CloseableIteration;

import eu.fbk.pgstore.data.Data;

public class LoggingTripleStoreTest {

    private static final ValueFactory VF = Data.getValueFactory();

    private TripleStore delegate;

    private TripleTransaction transaction;

    private TripleStore store;

    @Before
    public void setUp() throws Throwable {
        this.delegate = Mockito.mock(TripleStore.class);
        this.transaction = Mockito.mock(TripleTransaction.class);
        Mockito.when(this.delegate.begin(Mockito.anyBoolean())).thenReturn(this.transaction);
        this.store = new LoggingTripleStore(this.delegate);
    }

    @Test
    public void testLifecycleDelegation() throws Throwable {
        Mockito.when(this.delegate.open(true)).thenReturn(TripleStore.Status.VALID_STORE);
        Mockito.when(this.delegate.destroy()).thenReturn(2);
        Mockito.when(this.delegate.exists()).thenReturn(true);

        this.store.init();
        Assert.assertEquals(TripleStore.Status.VALID_STORE, this.store.open(true));
        Assert.assertTrue(this.store.exists());
        this.store.reset();
        Assert.assertEquals(2, this.store.destroy());
        this.store.close();

        Mockito.verify(this.delegate).init();
        Mockito.verify(this.delegate).open(true);
        Mockito.verify(this.delegate).reset();
        Mockito.verify(this.delegate).destroy();
        Mockito.verify(this.delegate).close();
    }

    @Test
    public void testAddAndRemoveForwardStatements() throws Throwable {
        final Statement s1 = VF.createStatement(VF.createURI("urn:a"), RDF.TYPE, RDFS.CLASS);
        final Statement s2 = VF.createStatement(VF.createURI("urn:b"), RDFS.LABEL,
                VF.createLiteral("b"));
        final List<Statement> statements = ImmutableList.of(s1, s2);

        final TripleTransaction tx = this.store.begin(false);
        tx.add(statements);
        tx.remove(ImmutableList.of(s2));
        tx.end(true);

        @SuppressWarnings("unchecked")
        final ArgumentCaptor<Iterable<? extends Statement>> added = (ArgumentCaptor) ArgumentCaptor
                .forClass(Iterable.class);
        Mockito.verify(this.transaction).add(added.capture());
        Assert.assertTrue(Iterables.elementsEqual(statements, added.getValue()));

        @SuppressWarnings("unchecked")
        final ArgumentCaptor<Iterable<? extends Statement>> removed = //
                (ArgumentCaptor) ArgumentCaptor.forClass(Iterable.class);
        Mockito.verify(this.transaction).remove(removed.capture());
        Assert.assertTrue(Iterables.elementsEqual(ImmutableList.of(s2), removed.getValue()));
        Mockito.verify(this.transaction, Mockito.never()).add(ImmutableList.of(s2));
        Mockito.verify(this.transaction).end(true);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testIterationCloseIsForwarded() throws Throwable {
        final CloseableIteration<Resource, QueryEvaluationException> contexts = Mockito
                .mock(CloseableIteration.class);
        Mockito.when(contexts.hasNext()).thenReturn(true, false);
        Mockito.when(contexts.next()).thenReturn(RDFS.RESOURCE);
        Mockito.when(this.transaction.contexts(null)).thenReturn(contexts);

        final TripleTransaction tx = this.store.begin(true);
        final CloseableIteration<Resource, QueryEvaluationException> iteration = tx
                .contexts(null);
        Assert.assertTrue(iteration.hasNext());
        Assert.assertEquals(RDFS.RESOURCE, iteration.next());
        Assert.assertFalse(iteration.hasNext());
        iteration.close();

        Mockito.verify(contexts).close();
    }

    @Test
    public void testQueriesForwardResults() throws Throwable {
        Mockito.when(this.transaction.size(null)).thenReturn(42L);
        Mockito.when(this.transaction.getNamespaces()).thenReturn(
                ImmutableMap.of("rdfs", RDFS.NAMESPACE));
        Mockito.when(this.transaction.getNamespace("rdfs")).thenReturn(RDFS.NAMESPACE);

        final TripleTransaction tx = this.store.begin(true);
        Assert.assertEquals(42L, tx.size(null));
        Assert.assertEquals(ImmutableMap.of("rdfs", RDFS.NAMESPACE), tx.getNamespaces());
        Assert.assertEquals(RDFS.NAMESPACE, tx.getNamespace("rdfs"));
        tx.bind("ex", "urn:ex#");
        tx.end(false);

        Mockito.verify(this.transaction).bind("ex", "urn:ex#");
        Mockito.verify(this.transaction).end(false);
    }

}
