package eu.fbk.rdfquads.rio;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.util.zip.GZIPInputStream;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.ByteStreams;
import com.google.common.io.Files;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import eu.fbk.rdfquads.data.IRI;
import eu.fbk.rdfquads.data.QuadStore;
import eu.fbk.rdfquads.data.TermFactory;

public class RDFIOTest {

    private static final String DOCUMENT = "@prefix ex: <http://ex.org/> .\n"
            + "ex:s ex:p <o>, [ ex:q \"caf\u00e9\"@fr ] .\n";

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testReadDetectsSyntaxAndBase() throws Throwable {
        final File file = this.folder.newFile("data.ttl");
        Files.write(DOCUMENT, file, Charsets.UTF_8);
        final QuadStore store = RDFIO.read(file, null, null);
        Assert.assertEquals(3, store.size());
        final IRI resolved = TermFactory.getDefault().createIRI(
                file.toURI().resolve("o").toString());
        Assert.assertEquals(1, store.filter(null, null, resolved, null).size());

        final QuadStore rebased = RDFIO.read(file, Syntax.TURTLE, "http://base.org/");
        Assert.assertEquals(1, rebased.filter(null, null,
                TermFactory.getDefault().createIRI("http://base.org/o"), null).size());
    }

    @Test
    public void testGzipRoundTrip() throws Throwable {
        final QuadStore store = RDFIO.read(new ByteArrayInputStream(DOCUMENT
                .getBytes(Charsets.UTF_8)), Syntax.TURTLE, "http://base.org/");
        final File file = new File(this.folder.getRoot(), "data.nq.gz");
        RDFIO.write(store, file, null, null);

        final InputStream raw = new GZIPInputStream(new FileInputStream(file));
        final String text;
        try {
            text = new String(ByteStreams.toByteArray(raw), Charsets.UTF_8);
        } finally {
            raw.close();
        }
        Assert.assertTrue(text.contains("\\u00E9\"@fr"));
        Assert.assertTrue(store.isomorphic(RDFIO.read(file, null, null)));
    }

    @Test
    public void testWriteTurtleWithNamespaces() throws Throwable {
        final QuadStore store = RDFIO.read(new ByteArrayInputStream(DOCUMENT
                .getBytes(Charsets.UTF_8)), Syntax.TURTLE, "http://ex.org/");
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        RDFIO.write(store, Syntax.TURTLE, out, ImmutableMap.of("ex", "http://ex.org/"));
        final String text = new String(out.toByteArray(), Charsets.UTF_8);
        Assert.assertTrue(text.startsWith("@prefix ex: <http://ex.org/> .\n\n"));
        Assert.assertTrue(text.contains("\"caf\u00e9\"@fr"));
        Assert.assertTrue(store.isomorphic(TurtleParser.create(Syntax.TURTLE).parse(text)));
    }

    @Test
    public void testByteOrderMarkAndInvalidUTF8() throws Throwable {
        final byte[] bom = ("\ufeff" + DOCUMENT).getBytes(Charsets.UTF_8);
        Assert.assertEquals(3, RDFIO.read(new ByteArrayInputStream(bom), Syntax.TURTLE,
                "http://base.org/").size());

        final byte[] invalid = "<http://ex.org/s> <http://ex.org/p> \"x\u00ff\" .\n"
                .getBytes(Charsets.ISO_8859_1);
        try {
            RDFIO.read(new ByteArrayInputStream(invalid), Syntax.NTRIPLES, null);
            Assert.fail();
        } catch (final LexException ex) {
            Assert.assertEquals(1, ex.getLine());
            Assert.assertEquals(39, ex.getColumn());
        }
    }

    @Test
    public void testUndetectableSyntax() throws Throwable {
        final File file = this.folder.newFile("data.unknown");
        try {
            RDFIO.read(file, null, null);
            Assert.fail();
        } catch (final IllegalArgumentException ex) {
            Assert.assertTrue(ex.getMessage().contains("data.unknown"));
        }
    }

    @Test
    public void testSyntaxDetection() {
        Assert.assertEquals(Syntax.TRIG, Syntax.forFileName("dump.TriG.gz"));
        Assert.assertEquals(Syntax.NQUADS, Syntax.forFileName("/tmp/x.nq"));
        Assert.assertEquals(Syntax.N3, Syntax.forFileName("rules.n3"));
        Assert.assertNull(Syntax.forFileName("README"));
        Assert.assertEquals(Syntax.NTRIPLES, Syntax.valueOfAny("application/n-triples"));
        Assert.assertEquals(Syntax.TURTLE, Syntax.valueOfAny(" ttl "));
        Assert.assertEquals(Syntax.TRIG, Syntax.valueOfAny("TriG"));
    }

}
