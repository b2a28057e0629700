package eu.fbk.rdfquads.rio;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.util.Map;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import javax.annotation.Nullable;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.rdfquads.data.MemoryQuadStore;
import eu.fbk.rdfquads.data.QuadStore;
import eu.fbk.rdfquads.data.Resource;
import eu.fbk.rdfquads.internal.Util;

/**
 * Static entry points for reading and writing RDF files and streams in any supported
 * {@link Syntax}.
 * <p>
 * Files whose name ends in {@code .gz} are transparently decompressed when read and compressed
 * when written; the syntax is detected from the remaining extension if not given explicitly.
 * </p>
 */
public final class RDFIO {

    private static final Logger LOGGER = LoggerFactory.getLogger(RDFIO.class);

    private RDFIO() {
    }

    /**
     * Returns a new parser for the syntax specified.
     *
     * @param syntax
     *            the syntax
     * @param baseIRI
     *            the initial base IRI, ignored by line-based syntaxes; null for none
     * @param defaultGraph
     *            the graph to assign to statements not in a named graph, null for the default
     *            graph
     * @return the created parser
     */
    public static QuadParser newParser(final Syntax syntax, @Nullable final String baseIRI,
            @Nullable final Resource defaultGraph) {
        if (syntax.isTurtleFamily()) {
            return TurtleParser.builder(syntax).baseIRI(baseIRI).defaultGraph(defaultGraph)
                    .build();
        } else {
            return new NQuadsParser(syntax, null, defaultGraph);
        }
    }

    /**
     * Reads a file into a new store.
     *
     * @param file
     *            the file to read, possibly gzipped
     * @param syntax
     *            the syntax, null to detect it from the file name
     * @param baseIRI
     *            the base IRI, null to use the file URI
     * @return a store with the content of the file
     * @throws IOException
     *             on I/O failure
     * @throws IllegalArgumentException
     *             if the syntax is not specified and cannot be detected
     */
    public static QuadStore read(final File file, @Nullable final Syntax syntax,
            @Nullable final String baseIRI) throws IOException {
        final Syntax actualSyntax = syntax != null ? syntax : detect(file.getName());
        final String actualBase = baseIRI != null ? baseIRI : file.toURI().toString();
        final InputStream stream = open(file);
        try {
            final QuadStore store = read(stream, actualSyntax, actualBase);
            LOGGER.debug("Read {} quads from {}", store.size(), file);
            return store;
        } finally {
            stream.close();
        }
    }

    public static QuadStore read(final InputStream stream, final Syntax syntax,
            @Nullable final String baseIRI) throws IOException {
        final QuadStore store = new MemoryQuadStore();
        newParser(syntax, baseIRI, null).parse(stream, store);
        return store;
    }

    public static QuadStore read(final Reader reader, final Syntax syntax,
            @Nullable final String baseIRI) throws IOException {
        final QuadStore store = new MemoryQuadStore();
        newParser(syntax, baseIRI, null).parse(reader, store);
        return store;
    }

    /**
     * Writes a store to a file, in the syntax specified or detected from the file name.
     *
     * @param store
     *            the store to write
     * @param file
     *            the target file, gzipped if its name ends in {@code .gz}
     * @param syntax
     *            the syntax, null to detect it from the file name
     * @param namespaces
     *            the prefix-to-namespace mappings used by Turtle-family writers, null for none
     * @throws IOException
     *             on I/O failure
     */
    public static void write(final QuadStore store, final File file,
            @Nullable final Syntax syntax, @Nullable final Map<String, String> namespaces)
            throws IOException {
        final Syntax actualSyntax = syntax != null ? syntax : detect(file.getName());
        final OutputStream stream = openOutput(file);
        try {
            write(store, actualSyntax, stream, namespaces);
        } finally {
            stream.close();
        }
        LOGGER.debug("Wrote {} quads to {}", store.size(), file);
    }

    public static void write(final QuadStore store, final Syntax syntax,
            final OutputStream stream, @Nullable final Map<String, String> namespaces)
            throws IOException {
        write(store, syntax, new OutputStreamWriter(stream, Charsets.UTF_8), namespaces);
    }

    public static void write(final QuadStore store, final Syntax syntax, final Writer writer,
            @Nullable final Map<String, String> namespaces) throws IOException {
        Preconditions.checkNotNull(store);
        if (syntax.isTurtleFamily()) {
            new TurtleWriter(writer, syntax, namespaces).write(store);
        } else {
            new NQuadsWriter(writer, syntax).write(store);
        }
    }

    private static Syntax detect(final String fileName) {
        final Syntax syntax = Syntax.forFileName(fileName);
        Preconditions.checkArgument(syntax != null, "Cannot detect RDF syntax of %s", fileName);
        return syntax;
    }

    /**
     * Opens a file for reading, decompressing it if its name ends in {@code .gz}.
     *
     * @param file
     *            the file to open
     * @return a buffered stream, to be closed by the caller
     * @throws IOException
     *             if the file cannot be opened
     */
    public static InputStream open(final File file) throws IOException {
        final InputStream stream = new BufferedInputStream(new FileInputStream(file));
        if (!file.getName().endsWith(".gz")) {
            return stream;
        }
        try {
            return new GZIPInputStream(stream);
        } catch (final IOException ex) {
            Util.closeQuietly(stream);
            throw ex;
        }
    }

    private static OutputStream openOutput(final File file) throws IOException {
        final OutputStream stream = new BufferedOutputStream(new FileOutputStream(file));
        return file.getName().endsWith(".gz") ? new GZIPOutputStream(stream) : stream;
    }

}
