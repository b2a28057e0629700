package eu.fbk.rdfquads.rio;

import java.io.StringWriter;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.rdfquads.data.BNode;
import eu.fbk.rdfquads.data.IRI;
import eu.fbk.rdfquads.data.MemoryQuadStore;
import eu.fbk.rdfquads.data.Quad;
import eu.fbk.rdfquads.data.QuadStore;
import eu.fbk.rdfquads.data.TermFactory;
import eu.fbk.rdfquads.vocabulary.XSD;

public class NQuadsWriterTest {

    private static final TermFactory FACTORY = TermFactory.getDefault();

    private static final IRI S = FACTORY.createIRI("http://ex.org/s");

    private static final IRI P = FACTORY.createIRI("http://ex.org/p");

    private static final IRI G = FACTORY.createIRI("http://ex.org/g");

    @Test
    public void testCanonicalOutput() throws Throwable {
        final QuadStore store = new MemoryQuadStore();
        store.add(S, P, FACTORY.createLiteral("hi", "en"), G);
        store.add(S, P, FACTORY.createLiteral("1", XSD.INTEGER), G);
        store.add(S, P, FACTORY.createLiteral("caf\u00e9 \"x\"\n"), null);
        store.add(S, P, FACTORY.createIRI("http://ex.org/\u00e8/\ud83d\ude00"), null);

        final StringWriter writer = new StringWriter();
        new NQuadsWriter(writer, Syntax.NQUADS).write(store);
        Assert.assertEquals("<http://ex.org/s> <http://ex.org/p> \"caf\\u00E9 \\\"x\\\"\\n\" .\n"
                + "<http://ex.org/s> <http://ex.org/p> <http://ex.org/\\u00E8/\\U0001F600> .\n"
                + "<http://ex.org/s> <http://ex.org/p> "
                + "\"1\"^^<http://www.w3.org/2001/XMLSchema#integer> <http://ex.org/g> .\n"
                + "<http://ex.org/s> <http://ex.org/p> \"hi\"@en <http://ex.org/g> .\n",
                writer.toString());
    }

    @Test
    public void testBlankNodeRelabelling() throws Throwable {
        final BNode x = FACTORY.createBNode("zzz");
        final BNode y = FACTORY.createBNode("aaa");
        final StringWriter writer = new StringWriter();
        final NQuadsWriter nq = new NQuadsWriter(writer, Syntax.NQUADS);
        nq.handle(new Quad(x, P, y, null));
        nq.handle(new Quad(y, P, x, y));
        nq.handle(null);
        Assert.assertEquals("_:b0 <http://ex.org/p> _:b1 .\n_:b1 <http://ex.org/p> _:b0 _:b1 .\n",
                writer.toString());
    }

    @Test
    public void testNTriples() throws Throwable {
        final QuadStore store = new MemoryQuadStore();
        store.add(S, P, S, G);
        StringWriter writer = new StringWriter();
        new NQuadsWriter(writer, Syntax.NTRIPLES).write(store);
        Assert.assertEquals("<http://ex.org/s> <http://ex.org/p> <http://ex.org/s> .\n", writer
                .toString());

        store.add(S, P, S, null);
        writer = new StringWriter();
        try {
            new NQuadsWriter(writer, Syntax.NTRIPLES).write(store);
            Assert.fail();
        } catch (final UnsupportedConstructException ex) {
            Assert.assertEquals("", writer.toString());
        }
    }

    @Test
    public void testRoundTrip() throws Throwable {
        final QuadStore store = TurtleParser.create(Syntax.TRIG).parse(
                "@prefix ex: <http://ex.org/> .\n"
                        + "ex:s ex:p [ ex:q \"tab\\there\"@it ], ( 1 2.5 ) .\n"
                        + "ex:g { _:a ex:p _:a ; ex:r \"\\u0001\\u007F\" }\n");
        final StringWriter writer = new StringWriter();
        new NQuadsWriter(writer, Syntax.NQUADS).write(store);
        final String text = writer.toString();
        for (int i = 0; i < text.length(); ++i) {
            Assert.assertTrue(text.charAt(i) < 0x7F);
        }
        Assert.assertTrue(store.isomorphic(NQuadsParser.create(Syntax.NQUADS).parse(text)));
    }

    @Test
    public void testOutputIndependentOfBlankNodeIDs() throws Throwable {
        final String document = "_:x <http://ex.org/p> <http://ex.org/o> .\n"
                + "_:y <http://ex.org/q> <http://ex.org/o> .\n";
        final TurtleParser parser = TurtleParser.create(Syntax.TURTLE);
        final String first = write(parser.parse(document));

        final StringBuilder filler = new StringBuilder();
        for (int i = 0; i < 29; ++i) {
            filler.append("[] <http://ex.org/p> <http://ex.org/o> .\n");
        }
        parser.parse(filler.toString());
        Assert.assertEquals(first, write(parser.parse(document)));

        final QuadStore store1 = new MemoryQuadStore();
        store1.add(FACTORY.createBNode("aaa"), P, S, null);
        store1.add(FACTORY.createBNode("zzz"), G, S, null);
        final QuadStore store2 = new MemoryQuadStore();
        store2.add(FACTORY.createBNode("zzz"), P, S, null);
        store2.add(FACTORY.createBNode("aaa"), G, S, null);
        Assert.assertEquals(write(store1), write(store2));
    }

    @Test
    public void testEscapedLiteralRoundTrip() throws Throwable {
        final QuadStore store = TurtleParser.create(Syntax.TURTLE).parse(
                "<http://ex.org/s> <http://ex.org/p> \"caf\\u00e9\"@en .");
        Assert.assertEquals(FACTORY.createLiteral("caf\u00e9", "en"), store.quads().get(0)
                .getObject());
        final String text = write(store);
        Assert.assertEquals("<http://ex.org/s> <http://ex.org/p> \"caf\\u00E9\"@en .\n", text);
        Assert.assertEquals(store, NQuadsParser.create(Syntax.NQUADS).parse(text));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedSyntax() {
        new NQuadsWriter(new StringWriter(), Syntax.TURTLE);
    }

    private static String write(final QuadStore store) throws Throwable {
        final StringWriter writer = new StringWriter();
        new NQuadsWriter(writer, Syntax.NQUADS).write(store);
        return writer.toString();
    }

}
