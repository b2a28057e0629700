package eu.fbk.rdfquads.rio;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.rdfquads.data.BNode;
import eu.fbk.rdfquads.data.Handler;
import eu.fbk.rdfquads.data.IRI;
import eu.fbk.rdfquads.data.MemoryQuadStore;
import eu.fbk.rdfquads.data.Quad;
import eu.fbk.rdfquads.data.QuadStore;
import eu.fbk.rdfquads.data.TermFactory;
import eu.fbk.rdfquads.vocabulary.RDF;
import eu.fbk.rdfquads.vocabulary.XSD;

public class TurtleParserTest {

    private static final String EX = "@prefix ex: <http://ex.org/> .\n";

    @Test
    public void testBasicTriples() {
        final QuadStore store = turtle(EX + "ex:s a ex:C ; ex:p ex:o1, ex:o2 ;; .");
        assertIsomorphic("<http://ex.org/s> <" + RDF.TYPE.stringValue() + "> <http://ex.org/C> .\n"
                + "<http://ex.org/s> <http://ex.org/p> <http://ex.org/o1> .\n"
                + "<http://ex.org/s> <http://ex.org/p> <http://ex.org/o2> .\n", store);
        Assert.assertEquals(ImmutableList.of(QuadStore.DEFAULT_GRAPH), ImmutableList.copyOf(store
                .graphs()));
    }

    @Test
    public void testDirectives() {
        final TurtleParser parser = TurtleParser.builder(Syntax.TURTLE)
                .baseIRI("http://base.org/dir/doc").build();
        final QuadStore store = parser.parse("<s> <p> <../o> .\n"
                + "PREFIX ex: <http://ex.org/>\n"
                + "@base <http://other.org/x/> .\n"
                + "ex:s ex:p <o> .\n"
                + "@prefix ex: <http://ex2.org/> .\n"
                + "ex:s ex:p <#frag> .\n"
                + "BASE <sub/>\n"
                + "@prefix rel: <ns#> .\n"
                + "rel:s rel:p rel: .");
        assertIsomorphic("<http://base.org/dir/s> <http://base.org/dir/p> <http://base.org/o> .\n"
                + "<http://ex.org/s> <http://ex.org/p> <http://other.org/x/o> .\n"
                + "<http://ex2.org/s> <http://ex2.org/p> <http://other.org/x/#frag> .\n"
                + "<http://other.org/x/sub/ns#s> <http://other.org/x/sub/ns#p> "
                + "<http://other.org/x/sub/ns#> .\n", store);

        final ParseContext context = parser.getContext();
        Assert.assertEquals("http://other.org/x/sub/", context.getBaseIRI());
        Assert.assertEquals("http://ex2.org/", context.getNamespace("ex"));
        Assert.assertEquals("http://other.org/x/sub/ns#", context.getPrefixes().get("rel"));
    }

    @Test
    public void testDirectivesDoNotLeakAcrossParses() {
        final TurtleParser parser = TurtleParser.create(Syntax.TURTLE);
        parser.parse(EX + "ex:s ex:p ex:o .");
        try {
            parser.parse("ex:s ex:p ex:o .");
            Assert.fail();
        } catch (final ResolutionException ex) {
            Assert.assertEquals(1, ex.getLine());
            Assert.assertEquals(1, ex.getColumn());
            Assert.assertNull(parser.getContext());
        }
    }

    @Test(expected = ResolutionException.class)
    public void testRelativeIRIWithoutBase() {
        TurtleParser.create(Syntax.TURTLE).parse("<s> <http://ex.org/p> <o> .");
    }

    @Test
    public void testLiterals() {
        final QuadStore store = turtle(EX + "ex:s ex:p 'plain', \"tag\"@EN, '''long\n'''"
                + ", 'typed'^^ex:dt, 42, -1.5, 1e3, true, \"x\"^^<"
                + XSD.STRING.stringValue() + "> .");
        final TermFactory f = TermFactory.getDefault();
        final List<Object> objects = Lists.newArrayList();
        for (final Quad quad : store) {
            objects.add(quad.getObject());
        }
        Assert.assertEquals(9, objects.size());
        Assert.assertTrue(objects.contains(f.createLiteral("plain")));
        Assert.assertTrue(objects.contains(f.createLiteral("tag", "en")));
        Assert.assertTrue(objects.contains(f.createLiteral("long\n")));
        Assert.assertTrue(objects.contains(f.createLiteral("typed", f
                .createIRI("http://ex.org/dt"))));
        Assert.assertTrue(objects.contains(f.createLiteral("42", XSD.INTEGER)));
        Assert.assertTrue(objects.contains(f.createLiteral("-1.5", XSD.DECIMAL)));
        Assert.assertTrue(objects.contains(f.createLiteral("1e3", XSD.DOUBLE)));
        Assert.assertTrue(objects.contains(f.createLiteral("true", XSD.BOOLEAN)));
        Assert.assertTrue(objects.contains(f.createLiteral("x")));
    }

    @Test
    public void testBlankNodes() {
        final QuadStore store = turtle(EX + "_:a ex:p _:b . _:b ex:p _:a .\n"
                + "[ ex:p [ ex:q 1 ] ] ex:r [] .\n" + "[ ex:only 2 ] .");
        assertIsomorphic("_:a <http://ex.org/p> _:b .\n_:b <http://ex.org/p> _:a .\n"
                + "_:x <http://ex.org/p> _:y .\n"
                + "_:y <http://ex.org/q> \"1\"^^<http://www.w3.org/2001/XMLSchema#integer> .\n"
                + "_:x <http://ex.org/r> _:z .\n"
                + "_:w <http://ex.org/only> \"2\"^^<http://www.w3.org/2001/XMLSchema#integer> .\n",
                store);
    }

    @Test
    public void testBlankNodeScopedToDocument() {
        final TurtleParser parser = TurtleParser.create(Syntax.TURTLE);
        final QuadStore first = parser.parse(EX + "_:b ex:p ex:o .");
        final QuadStore second = parser.parse(EX + "_:b ex:p ex:o .");
        final BNode b1 = (BNode) first.quads().get(0).getSubject();
        final BNode b2 = (BNode) second.quads().get(0).getSubject();
        Assert.assertFalse(b1.equals(b2));
        Assert.assertFalse("b".equals(b1.getID()));
    }

    @Test
    public void testCollections() {
        final QuadStore store = turtle(EX + "ex:s ex:p ( 1 ex:o ( ) ), () .");
        assertIsomorphic("<http://ex.org/s> <http://ex.org/p> _:l1 .\n"
                + "_:l1 <" + RDF.FIRST.stringValue()
                + "> \"1\"^^<http://www.w3.org/2001/XMLSchema#integer> .\n"
                + "_:l1 <" + RDF.REST.stringValue() + "> _:l2 .\n"
                + "_:l2 <" + RDF.FIRST.stringValue() + "> <http://ex.org/o> .\n"
                + "_:l2 <" + RDF.REST.stringValue() + "> _:l3 .\n"
                + "_:l3 <" + RDF.FIRST.stringValue() + "> <" + RDF.NIL.stringValue() + "> .\n"
                + "_:l3 <" + RDF.REST.stringValue() + "> <" + RDF.NIL.stringValue() + "> .\n"
                + "<http://ex.org/s> <http://ex.org/p> <" + RDF.NIL.stringValue() + "> .\n",
                store);
    }

    @Test
    public void testSyntaxErrorPosition() {
        try {
            turtle(EX + "ex:s ex:p ex:o .\nex:s ex:p .");
            Assert.fail();
        } catch (final SyntaxException ex) {
            Assert.assertEquals(3, ex.getLine());
            Assert.assertEquals(11, ex.getColumn());
            Assert.assertEquals("object", ex.getExpected());
            Assert.assertEquals("'.'", ex.getFound());
        }
    }

    @Test
    public void testMissingDot() {
        try {
            turtle(EX + "ex:s ex:p ex:o");
            Assert.fail();
        } catch (final SyntaxException ex) {
            Assert.assertEquals("'.'", ex.getExpected());
            Assert.assertEquals(2, ex.getLine());
        }
    }

    @Test
    public void testFailedParseLeavesStoreUntouched() throws Throwable {
        final QuadStore store = new MemoryQuadStore();
        store.add(TermFactory.getDefault().createIRI("http://ex.org/x"), RDF.TYPE,
                TermFactory.getDefault().createIRI("http://ex.org/C"), null);
        final byte[] bytes = (EX + "ex:s ex:p ex:o .\nex:s ex:p undeclared:o .")
                .getBytes(Charsets.UTF_8);
        try {
            TurtleParser.create(Syntax.TURTLE).parse(new ByteArrayInputStream(bytes), store);
            Assert.fail();
        } catch (final ResolutionException ex) {
            Assert.assertEquals(3, ex.getLine());
            Assert.assertEquals(11, ex.getColumn());
        }
        Assert.assertEquals(1, store.size());
    }

    @Test
    public void testHandlerReceivesEndOfDocument() throws Throwable {
        final List<Quad> quads = Lists.newArrayList();
        final boolean[] ended = new boolean[1];
        final ParseContext context = TurtleParser.create(Syntax.TURTLE).parse(
                EX + "ex:s ex:p ex:o1 . ex:s ex:p ex:o2 .", new Handler<Quad>() {

                    @Override
                    public void handle(@Nullable final Quad quad) {
                        Assert.assertFalse(ended[0]);
                        if (quad == null) {
                            ended[0] = true;
                        } else {
                            quads.add(quad);
                        }
                    }

                });
        Assert.assertTrue(ended[0]);
        Assert.assertEquals(2, quads.size());
        Assert.assertEquals("http://ex.org/", context.getNamespace("ex"));
    }

    @Test
    public void testHandlerExceptionStopsParse() {
        final List<Quad> quads = Lists.newArrayList();
        try {
            TurtleParser.create(Syntax.TURTLE).parse(EX + "ex:s ex:p ex:o1 . ex:s ex:p ex:o2 .",
                    new Handler<Quad>() {

                        @Override
                        public void handle(@Nullable final Quad quad) throws IOException {
                            quads.add(quad);
                            throw new IOException("stop");
                        }

                    });
            Assert.fail();
        } catch (final IOException ex) {
            Assert.assertEquals("stop", ex.getMessage());
        }
        Assert.assertEquals(1, quads.size());
    }

    @Test
    public void testDefaultGraphOption() {
        final IRI graph = TermFactory.getDefault().createIRI("http://ex.org/g");
        final QuadStore store = TurtleParser.builder(Syntax.TURTLE).defaultGraph(graph).build()
                .parse(EX + "ex:s ex:p ex:o .");
        Assert.assertEquals(graph, store.quads().get(0).getGraph());
    }

    @Test
    public void testTrig() {
        final QuadStore store = TurtleParser.create(Syntax.TRIG).parse(
                EX + "ex:s ex:p ex:o .\n" + "ex:g1 { ex:s ex:p ex:o . ex:s ex:q 1 }\n"
                        + "GRAPH ex:g2 { ex:a ex:b ex:c }\n" + "{ ex:d ex:e ex:f . }\n"
                        + "_:g { ex:s ex:p ex:o }\n" + "ex:t ex:p ex:o .");
        assertIsomorphic("<http://ex.org/s> <http://ex.org/p> <http://ex.org/o> .\n"
                + "<http://ex.org/s> <http://ex.org/p> <http://ex.org/o> <http://ex.org/g1> .\n"
                + "<http://ex.org/s> <http://ex.org/q> "
                + "\"1\"^^<http://www.w3.org/2001/XMLSchema#integer> <http://ex.org/g1> .\n"
                + "<http://ex.org/a> <http://ex.org/b> <http://ex.org/c> <http://ex.org/g2> .\n"
                + "<http://ex.org/d> <http://ex.org/e> <http://ex.org/f> .\n"
                + "<http://ex.org/s> <http://ex.org/p> <http://ex.org/o> _:g .\n"
                + "<http://ex.org/t> <http://ex.org/p> <http://ex.org/o> .\n", store);
    }

    @Test
    public void testTrigBlocksNotAllowedInTurtle() {
        try {
            turtle(EX + "ex:g { ex:s ex:p ex:o }");
            Assert.fail();
        } catch (final SyntaxException ex) {
            Assert.assertEquals(2, ex.getLine());
            Assert.assertEquals(6, ex.getColumn());
        }
    }

    @Test
    public void testN3Sugar() {
        final QuadStore store = TurtleParser.create(Syntax.N3).parse(
                EX + "ex:a = ex:b .\n" + "ex:a => ex:c .\n" + "ex:a <= ex:d .\n"
                        + "ex:a is ex:p of ex:e .\n" + "ex:a has ex:q ex:f .\n"
                        + "ex:a @a ex:C .");
        assertIsomorphic("<http://ex.org/a> <http://www.w3.org/2002/07/owl#sameAs> "
                + "<http://ex.org/b> .\n"
                + "<http://ex.org/a> <http://www.w3.org/2000/10/swap/log#implies> "
                + "<http://ex.org/c> .\n"
                + "<http://ex.org/d> <http://www.w3.org/2000/10/swap/log#implies> "
                + "<http://ex.org/a> .\n"
                + "<http://ex.org/e> <http://ex.org/p> <http://ex.org/a> .\n"
                + "<http://ex.org/a> <http://ex.org/q> <http://ex.org/f> .\n"
                + "<http://ex.org/a> <" + RDF.TYPE.stringValue() + "> <http://ex.org/C> .\n",
                store);
    }

    @Test
    public void testN3UnsupportedFails() {
        for (final String doc : new String[] { "{ ex:a ex:b ex:c } => { ex:a ex:b ex:d } .",
                "?x ex:p ex:o .", "@forAll ex:x .", "ex:a!ex:b ex:c ex:d .",
                "ex:a ex:p { ex:b ex:c ex:d } ." }) {
            try {
                TurtleParser.create(Syntax.N3).parse(EX + doc);
                Assert.fail("Expected failure for " + doc);
            } catch (final UnsupportedConstructException ex) {
                Assert.assertTrue(ex.getReason().endsWith("cannot be represented as quads"));
                Assert.assertEquals(2, ex.getLine());
            }
        }
    }

    @Test
    public void testN3UnsupportedSkipped() {
        final TurtleParser parser = TurtleParser.builder(Syntax.N3)
                .unsupportedPolicy(TurtleParser.Policy.SKIP).build();
        final QuadStore store = parser.parse(EX + "ex:a ex:p ex:b .\n"
                + "{ ex:a ex:b [ ex:c ex:d ] } => { ex:a ex:b ex:e } .\n"
                + "ex:a ex:p ?x .\n" + "ex:c ex:p ( ex:d ?y ) .\n" + "ex:c ex:p ex:d .");
        assertIsomorphic("<http://ex.org/a> <http://ex.org/p> <http://ex.org/b> .\n"
                + "<http://ex.org/c> <http://ex.org/p> <http://ex.org/d> .\n", store);
    }

    @Test
    public void testReaderAndStreamInputs() throws Throwable {
        final String text = EX + "ex:s ex:p \"è\" .";
        final QuadStore store = new MemoryQuadStore();
        final int added = TurtleParser.create(Syntax.TURTLE).parse(
                new ByteArrayInputStream(text.getBytes(Charsets.UTF_8)), store);
        Assert.assertEquals(1, added);
        Assert.assertEquals(TermFactory.getDefault().createLiteral("è"), store.quads()
                .get(0).getObject());
        Assert.assertEquals(0, TurtleParser.create(Syntax.TURTLE).parse(
                new StringReader(text), store));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedSyntax() {
        TurtleParser.builder(Syntax.NQUADS);
    }

    private static QuadStore turtle(final String text) {
        return TurtleParser.create(Syntax.TURTLE).parse(text);
    }

    private static void assertIsomorphic(final String expectedNQuads, final QuadStore actual) {
        final QuadStore expected = NQuadsParser.create(Syntax.NQUADS).parse(expectedNQuads);
        if (!expected.isomorphic(actual)) {
            Assert.fail("Expected:\n" + expected.quads() + "\nActual:\n" + actual.quads());
        }
    }

}
