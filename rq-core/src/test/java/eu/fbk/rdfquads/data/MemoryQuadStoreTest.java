package eu.fbk.rdfquads.data;

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.junit.Assert;
import org.junit.Test;

public class MemoryQuadStoreTest {

    private static final TermFactory FACTORY = TermFactory.getDefault();

    private static final IRI S1 = iri("s1");

    private static final IRI S2 = iri("s2");

    private static final IRI P = iri("p");

    private static final IRI G1 = iri("g1");

    private static final IRI G2 = iri("g2");

    @Test
    public void testSetSemantics() {
        final QuadStore store = new MemoryQuadStore();
        Assert.assertTrue(store.isEmpty());
        Assert.assertTrue(store.add(S1, P, S2, null));
        Assert.assertFalse(store.add(new Quad(S1, P, S2, null)));
        Assert.assertTrue(store.add(S1, P, S2, G1));
        Assert.assertFalse(store.add(S1, P, S2, G1));
        Assert.assertEquals(2, store.size());
        Assert.assertEquals(1, store.addAll(ImmutableList.of(new Quad(S1, P, S2, null),
                new Quad(S2, P, S1, null))));
        Assert.assertEquals(3, store.size());
        Assert.assertTrue(store.contains(new Quad(S2, P, S1, null)));
        Assert.assertTrue(store.remove(new Quad(S2, P, S1, null)));
        Assert.assertFalse(store.remove(new Quad(S2, P, S1, null)));
        Assert.assertEquals(2, store.size());
        store.clear();
        Assert.assertTrue(store.isEmpty());
    }

    @Test
    public void testDefaultGraphSentinel() {
        final QuadStore store = new MemoryQuadStore();
        store.add(S1, P, S2, QuadStore.DEFAULT_GRAPH);
        Assert.assertTrue(store.contains(new Quad(S1, P, S2, null)));
        Assert.assertEquals(ImmutableList.of(QuadStore.DEFAULT_GRAPH), ImmutableList
                .copyOf(store.graphs()));
        Assert.assertEquals(1, store.quads(null).size());
        Assert.assertEquals(1, store.quads(QuadStore.DEFAULT_GRAPH).size());
    }

    @Test
    public void testCanonicalOrder() {
        final QuadStore store = new MemoryQuadStore();
        final Quad q1 = new Quad(S2, P, S1, G2);
        final Quad q2 = new Quad(S1, P, S2, G2);
        final Quad q3 = new Quad(S2, P, S1, G1);
        final Quad q4 = new Quad(S2, P, S1, null);
        final Quad q5 = new Quad(S1, P, FACTORY.createLiteral("x"), null);
        for (final Quad quad : ImmutableList.of(q1, q2, q3, q4, q5)) {
            store.add(quad);
        }
        Assert.assertEquals(ImmutableList.of(q5, q4, q3, q2, q1), store.quads());
        Assert.assertEquals(ImmutableList.of(QuadStore.DEFAULT_GRAPH, G1, G2), ImmutableList
                .copyOf(store.graphs()));
        Assert.assertEquals(ImmutableList.of(q2, q1), store.quads(G2));
        Assert.assertEquals(ImmutableList.of(q2.getTriple(), q1.getTriple()), store.triples(G2));
        Assert.assertEquals(ImmutableList.of(q5, q4, q3, q2, q1), ImmutableList.copyOf(store));
    }

    @Test
    public void testFilter() {
        final QuadStore store = new MemoryQuadStore();
        store.add(S1, P, S2, null);
        store.add(S1, P, S2, G1);
        store.add(S2, P, S1, G1);
        Assert.assertEquals(3, store.filter(null, null, null, null).size());
        Assert.assertEquals(2, store.filter(S1, null, null, null).size());
        Assert.assertEquals(2, store.filter(null, P, null, G1).size());
        final List<Quad> defaults = store.filter(null, null, null, QuadStore.DEFAULT_GRAPH);
        Assert.assertEquals(ImmutableList.of(new Quad(S1, P, S2, null)), defaults);
        Assert.assertTrue(store.filter(null, null, S2, G2).isEmpty());
    }

    @Test
    public void testWithGraph() {
        final QuadStore store = new MemoryQuadStore();
        store.add(S1, P, S2, null);
        store.add(S1, P, S2, G1);
        store.add(S2, P, S1, G2);
        final QuadStore retagged = store.withGraph(G2);
        Assert.assertEquals(2, retagged.size());
        Assert.assertEquals(ImmutableList.of(G2), ImmutableList.copyOf(retagged.graphs()));
        Assert.assertEquals(3, store.size());
    }

    @Test
    public void testIsomorphism() {
        final BNode a = FACTORY.createBNode("a");
        final BNode b = FACTORY.createBNode("b");
        final BNode c = FACTORY.createBNode("c");
        final BNode d = FACTORY.createBNode("d");

        final QuadStore s1 = new MemoryQuadStore();
        s1.add(a, P, b, null);
        s1.add(b, P, a, null);
        s1.add(a, P, S1, G1);

        final QuadStore s2 = new MemoryQuadStore();
        s2.add(d, P, c, null);
        s2.add(c, P, d, null);
        s2.add(d, P, S1, G1);

        final QuadStore s3 = new MemoryQuadStore();
        s3.add(d, P, c, null);
        s3.add(c, P, d, null);
        s3.add(c, P, S2, G1);

        Assert.assertTrue(s1.isomorphic(s2));
        Assert.assertFalse(s1.isomorphic(s3));
        Assert.assertFalse(s1.equals(s2));
        Assert.assertEquals(s1, new MemoryQuadStore(s1));
        Assert.assertEquals(s1.hashCode(), new MemoryQuadStore(s1).hashCode());
    }

    @Test
    public void testSynchronizedStore() throws Throwable {
        final QuadStore store = new SynchronizedQuadStore(new MemoryQuadStore());
        final Thread[] threads = new Thread[4];
        for (int i = 0; i < threads.length; ++i) {
            final int index = i;
            threads[i] = new Thread(new Runnable() {

                @Override
                public void run() {
                    for (int j = 0; j < 250; ++j) {
                        store.add(iri("s" + index), P, FACTORY.createLiteral("" + j), null);
                    }
                }

            });
            threads[i].start();
        }
        for (final Thread thread : threads) {
            thread.join();
        }
        Assert.assertEquals(1000, store.size());
    }

    private static IRI iri(final String localName) {
        return FACTORY.createIRI("http://example.org/" + localName);
    }

}
