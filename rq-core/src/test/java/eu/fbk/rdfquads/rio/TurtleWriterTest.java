package eu.fbk.rdfquads.rio;

import java.io.StringWriter;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.rdfquads.data.Data;
import eu.fbk.rdfquads.data.IRI;
import eu.fbk.rdfquads.data.MemoryQuadStore;
import eu.fbk.rdfquads.data.QuadStore;
import eu.fbk.rdfquads.data.TermFactory;
import eu.fbk.rdfquads.vocabulary.RDF;
import eu.fbk.rdfquads.vocabulary.XSD;

public class TurtleWriterTest {

    private static final TermFactory FACTORY = TermFactory.getDefault();

    private static final Map<String, String> NAMESPACES = Data.newNamespaceMap(
            ImmutableMap.of("ex", "http://ex.org/"), Data.getNamespaceMap());

    private static final IRI S = ex("s");

    private static final IRI P = ex("p");

    @Test
    public void testGroupingAndAbbreviations() throws Throwable {
        final QuadStore store = new MemoryQuadStore();
        store.add(S, RDF.TYPE, ex("C"), null);
        store.add(S, P, FACTORY.createLiteral("hello", "en"), null);
        store.add(S, P, FACTORY.createLiteral("42", XSD.INTEGER), null);
        store.add(S, ex("q"), FACTORY.createLiteral("x", ex("dt")), null);
        store.add(ex("t"), P, FACTORY.createIRI("http://other.org/o"), null);

        Assert.assertEquals("@prefix ex: <http://ex.org/> .\n\n"
                + "ex:s ex:p 42, \"hello\"@en ;\n"
                + "    ex:q \"x\"^^ex:dt ;\n"
                + "    a ex:C .\n"
                + "ex:t ex:p <http://other.org/o> .\n", write(store, Syntax.TURTLE));
    }

    @Test
    public void testLiteralForms() throws Throwable {
        final QuadStore store = new MemoryQuadStore();
        store.add(S, P, FACTORY.createLiteral("1.5", XSD.DECIMAL), null);
        store.add(S, P, FACTORY.createLiteral("true", XSD.BOOLEAN), null);
        store.add(S, P, FACTORY.createLiteral("1.0E3", XSD.DOUBLE), null);
        store.add(S, P, FACTORY.createLiteral("abc", XSD.INTEGER), null);
        store.add(S, P, FACTORY.createLiteral("line\n\"quoted\""), null);
        final String text = write(store, Syntax.TURTLE);
        Assert.assertTrue(text.contains("1.5"));
        Assert.assertTrue(text.contains("true"));
        Assert.assertTrue(text.contains("1.0E3"));
        Assert.assertTrue(text.contains("\"abc\"^^xsd:integer"));
        Assert.assertTrue(text.contains("\"line\\n\\\"quoted\\\"\""));
        Assert.assertTrue(text.contains("@prefix xsd: <http://www.w3.org/2001/XMLSchema#> ."));
        Assert.assertTrue(store.isomorphic(TurtleParser.create(Syntax.TURTLE).parse(text)));
    }

    @Test
    public void testTrigGraphBlocks() throws Throwable {
        final QuadStore store = new MemoryQuadStore();
        store.add(S, P, ex("o"), null);
        store.add(S, P, ex("o"), ex("g"));
        Assert.assertEquals("@prefix ex: <http://ex.org/> .\n\n"
                + "ex:s ex:p ex:o .\n\n"
                + "ex:g {\n"
                + "    ex:s ex:p ex:o .\n"
                + "}\n", write(store, Syntax.TRIG));
    }

    @Test
    public void testGraphsMergedInTurtle() throws Throwable {
        final QuadStore store = new MemoryQuadStore();
        store.add(S, P, ex("o"), null);
        store.add(S, P, ex("o"), ex("g"));
        store.add(S, P, ex("o2"), ex("g"));
        // objects follow the canonical order, where <http://ex.org/o2> precedes <http://ex.org/o>
        Assert.assertEquals("@prefix ex: <http://ex.org/> .\n\n"
                + "ex:s ex:p ex:o2, ex:o .\n", write(store, Syntax.TURTLE));
    }

    @Test
    public void testNonPrefixableNames() throws Throwable {
        final QuadStore store = new MemoryQuadStore();
        store.add(S, P, FACTORY.createIRI("http://ex.org/a,b"), null);
        Assert.assertEquals("@prefix ex: <http://ex.org/> .\n\n"
                + "ex:s ex:p <http://ex.org/a,b> .\n", write(store, Syntax.TURTLE));
        Assert.assertEquals("<http://ex.org/s> <http://ex.org/p> <http://ex.org/a,b> .\n",
                write(store, Syntax.TURTLE, null));
    }

    @Test
    public void testRoundTrip() throws Throwable {
        final String document = "@prefix ex: <http://ex.org/> .\n"
                + "ex:s ex:p [ ex:q \"tab\\there\"@it ; ex:r ( 1 2.5 -3e2 ) ] .\n"
                + "ex:g1 { _:a ex:p _:a ; ex:r \"caf\u00e9\" . }\n"
                + "_:g { ex:s a ex:C }\n";
        final QuadStore store = TurtleParser.create(Syntax.TRIG).parse(document);
        final String text = write(store, Syntax.TRIG);
        Assert.assertTrue(store.isomorphic(TurtleParser.create(Syntax.TRIG).parse(text)));
    }

    private static String write(final QuadStore store, final Syntax syntax) throws Throwable {
        return write(store, syntax, NAMESPACES);
    }

    private static String write(final QuadStore store, final Syntax syntax,
            final Map<String, String> namespaces) throws Throwable {
        final StringWriter writer = new StringWriter();
        new TurtleWriter(writer, syntax, namespaces).write(store);
        return writer.toString();
    }

    private static IRI ex(final String localName) {
        return FACTORY.createIRI("http://ex.org/" + localName);
    }

}
