package eu.fbk.rdfquads.data;

import java.math.BigDecimal;
import java.math.BigInteger;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.rdfquads.vocabulary.RDF;
import eu.fbk.rdfquads.vocabulary.XSD;

public class TermTest {

    private static final TermFactory FACTORY = TermFactory.getDefault();

    @Test
    public void testIRI() {
        final IRI iri = FACTORY.createIRI("http://example.org/ns#name");
        Assert.assertEquals("http://example.org/ns#", iri.getNamespace());
        Assert.assertEquals("name", iri.getLocalName());
        Assert.assertEquals("<http://example.org/ns#name>", iri.toString());
        Assert.assertEquals(iri, FACTORY.createIRI("http://example.org/ns#", "name"));

        final IRI slash = FACTORY.createIRI("http://example.org/a/b");
        Assert.assertEquals("http://example.org/a/", slash.getNamespace());
        Assert.assertEquals("b", slash.getLocalName());

        final IRI urn = FACTORY.createIRI("urn:isbn:123");
        Assert.assertEquals("urn:isbn:", urn.getNamespace());
        Assert.assertEquals("123", urn.getLocalName());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRelativeIRIRejected() {
        FACTORY.createIRI("relative/path");
    }

    @Test
    public void testLiteralDefaults() {
        final Literal plain = FACTORY.createLiteral("hello");
        Assert.assertEquals(XSD.STRING, plain.getDatatype());
        Assert.assertNull(plain.getLanguage());
        Assert.assertTrue(plain.isSimple());
        Assert.assertEquals("\"hello\"", plain.toString());

        final Literal tagged = FACTORY.createLiteral("hello", "EN-gb");
        Assert.assertEquals("en-gb", tagged.getLanguage());
        Assert.assertEquals(RDF.LANG_STRING, tagged.getDatatype());
        Assert.assertFalse(tagged.isSimple());
        Assert.assertEquals(tagged, FACTORY.createLiteral("hello", "en-GB"));
        Assert.assertEquals("\"hello\"@en-gb", tagged.toString());

        final Literal typed = FACTORY.createLiteral("5", XSD.INTEGER);
        Assert.assertEquals("\"5\"^^<http://www.w3.org/2001/XMLSchema#integer>",
                typed.toString());
        Assert.assertFalse(typed.equals(FACTORY.createLiteral("5")));
        Assert.assertEquals(plain, FACTORY.createLiteral("hello", XSD.STRING));
    }

    @Test
    public void testLiteralLanguageAndDatatypeExclusive() {
        try {
            FACTORY.createLiteral("x", "en", XSD.STRING);
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            // expected
        }
        try {
            FACTORY.createLiteral("x", RDF.LANG_STRING);
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            // expected
        }
        try {
            FACTORY.createLiteral("x", "not a tag");
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            // expected
        }
        Assert.assertEquals("en", FACTORY.createLiteral("x", "en", RDF.LANG_STRING)
                .getLanguage());
    }

    @Test
    public void testLiteralEscaping() {
        final Literal literal = FACTORY.createLiteral("a \"quoted\"\nline\\");
        Assert.assertEquals("\"a \\\"quoted\\\"\\nline\\\\\"", literal.toString());
    }

    @Test
    public void testTypedAccessors() {
        Assert.assertTrue(FACTORY.createLiteral("true", XSD.BOOLEAN).booleanValue());
        Assert.assertFalse(FACTORY.createLiteral("0", XSD.BOOLEAN).booleanValue());
        Assert.assertEquals(42L, FACTORY.createLiteral("+42", XSD.INTEGER).longValue());
        Assert.assertEquals(new BigInteger("-12345678901234567890"),
                FACTORY.createLiteral("-12345678901234567890", XSD.INTEGER).integerValue());
        Assert.assertEquals(new BigDecimal("1.50"), FACTORY.createLiteral("1.50", XSD.DECIMAL)
                .decimalValue());
        Assert.assertEquals(1.5e3, FACTORY.createLiteral("1.5E3", XSD.DOUBLE).doubleValue(), 0.0);
        Assert.assertEquals(Double.NEGATIVE_INFINITY, FACTORY.createLiteral("-INF", XSD.DOUBLE)
                .doubleValue(), 0.0);
        try {
            FACTORY.createLiteral("maybe", XSD.BOOLEAN).booleanValue();
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            // expected
        }
    }

    @Test
    public void testBNodes() {
        final TermFactory f1 = TermFactory.create();
        final TermFactory f2 = TermFactory.create();
        Assert.assertFalse(f1.getBNodePrefix().equals(f2.getBNodePrefix()));
        final BNode b1 = f1.createBNode();
        final BNode b2 = f1.createBNode();
        final BNode b3 = f2.createBNode();
        Assert.assertFalse(b1.equals(b2));
        Assert.assertFalse(b1.equals(b3));
        Assert.assertEquals(FACTORY.createBNode("x1"), FACTORY.createBNode("x1"));
        Assert.assertEquals("_:x1", FACTORY.createBNode("x1").toString());
    }

    @Test
    public void testQuad() {
        final IRI s = FACTORY.createIRI("http://example.org/s");
        final IRI p = FACTORY.createIRI("http://example.org/p");
        final Literal o = FACTORY.createLiteral("o");
        final IRI g = FACTORY.createIRI("http://example.org/g");
        final Quad quad = new Quad(s, p, o, g);
        Assert.assertEquals(new Triple(s, p, o), quad.getTriple());
        Assert.assertEquals(quad, new Triple(s, p, o).inGraph(g));
        Assert.assertNull(quad.withGraph(null).getGraph());
        Assert.assertFalse(quad.equals(quad.withGraph(null)));
        Assert.assertTrue(quad.withGraph(null).compareTo(quad) < 0);
    }

    @Test
    public void testCanonicalOrderOnNTriplesForm() {
        final IRI o = FACTORY.createIRI("http://example.org/o");
        final IRI o2 = FACTORY.createIRI("http://example.org/o2");
        final Literal literal = FACTORY.createLiteral("z");
        final BNode bnode = FACTORY.createBNode("a");
        // '>' follows '2', so an IRI sorts after the longer IRIs it is a prefix of
        Assert.assertTrue(o2.compareTo(o) < 0);
        Assert.assertTrue(literal.compareTo(o) < 0);
        Assert.assertTrue(o.compareTo(bnode) < 0);
    }

}
