package eu.fbk.rdfquads.tool;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.rdfquads.data.IRI;
import eu.fbk.rdfquads.data.MemoryQuadStore;
import eu.fbk.rdfquads.data.ParseException;
import eu.fbk.rdfquads.data.QuadStore;
import eu.fbk.rdfquads.internal.CommandLine;
import eu.fbk.rdfquads.internal.Logging;
import eu.fbk.rdfquads.rio.QuadParser;
import eu.fbk.rdfquads.rio.RDFIO;
import eu.fbk.rdfquads.rio.Syntax;

/**
 * Command line tool converting Turtle, TriG, N3, N-Triples and N-Quads documents to a single
 * canonical N-Quads document, optionally assigning the statements outside named graphs to a
 * target graph.
 */
public final class NamedGraphToNQuads {

    private static final Logger LOGGER = LoggerFactory.getLogger(NamedGraphToNQuads.class);

    private static final String STDIN = "-";

    private NamedGraphToNQuads() {
    }

    public static void main(final String... args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * Runs the tool.
     *
     * @param args
     *            the command line arguments
     * @param in
     *            the stream read for input {@code -}
     * @param out
     *            the stream where to write the result, unless option {@code -o} is given, and
     *            help and version information
     * @param err
     *            the stream where to report errors
     * @return the exit status: 0 on success, 1 if an input cannot be read or parsed, 2 on
     *         invalid arguments
     */
    public static int run(final String[] args, final InputStream in, final PrintStream out,
            final PrintStream err) {

        final CommandLine cmd;
        try {
            cmd = CommandLine
                    .parser()
                    .withName("rq-nquads")
                    .withHeader(
                            "Converts RDF documents to a single canonical N-Quads document, "
                                    + "placing statements outside named graphs in the "
                                    + "graph specified.")
                    .withOption("g", "graph", "the graph for statements outside named graphs",
                            "IRI", CommandLine.Type.IRI, false, false)
                    .withOption("b", "base", "the base IRI (default: the URI of each file)",
                            "IRI", CommandLine.Type.IRI, false, false)
                    .withOption("f", "format", "the input syntax (default: detected from the "
                            + "file extension, Turtle for standard input)", "SYNTAX",
                            CommandLine.Type.SYNTAX, false, false)
                    .withOption("o", "output", "the output file (default: standard output)",
                            "FILE", CommandLine.Type.FILE, false, false)
                    .withFooter("Input files ending in '.gz' are decompressed; '-' or no file "
                            + "denotes standard input.")
                    .withLogger(LoggerFactory.getLogger("eu.fbk.rdfquads")).withOutput(out)
                    .parse(args);
        } catch (final CommandLine.Exception ex) {
            return CommandLine.fail(ex, err);
        }

        final IRI graph = cmd.getOptionValue("g", IRI.class);
        final String base = cmd.getOptionValue("b", String.class);
        final Syntax syntax = cmd.getOptionValue("f", Syntax.class);
        final File output = cmd.getOptionValue("o", File.class);
        final List<String> inputs = cmd.getArgCount() == 0 ? ImmutableList.of(STDIN) : cmd
                .getArgs(String.class);

        final QuadStore store = new MemoryQuadStore();
        for (final String input : inputs) {
            final String previous = Logging.setContext(input);
            try {
                final int added = read(input, in, syntax, base, graph, store);
                LOGGER.info("{} quads read from {}", added, input);
            } catch (final ParseException ex) {
                LOGGER.debug("Parse failed", ex);
                err.println(input + ":" + ex.getLine() + ":" + ex.getColumn() + ": "
                        + ex.getReason());
                return CommandLine.EXIT_FAILURE;
            } catch (final IOException ex) {
                LOGGER.debug("Read failed", ex);
                err.println(input + ": " + ex.getMessage());
                return CommandLine.EXIT_FAILURE;
            } catch (final IllegalArgumentException ex) {
                err.println(input + ": " + ex.getMessage());
                return CommandLine.EXIT_USAGE;
            } finally {
                Logging.setContext(previous);
            }
        }

        try {
            if (output != null) {
                RDFIO.write(store, output, Syntax.NQUADS, null);
            } else {
                RDFIO.write(store, Syntax.NQUADS, out, null);
            }
            LOGGER.info("{} quads written to {}", store.size(),
                    output != null ? output : "standard output");
        } catch (final IOException ex) {
            err.println((output != null ? output : "standard output") + ": " + ex.getMessage());
            return CommandLine.EXIT_FAILURE;
        }
        return CommandLine.EXIT_OK;
    }

    private static int read(final String input, final InputStream in,
            @Nullable final Syntax syntax, @Nullable final String base,
            @Nullable final IRI graph, final QuadStore store) throws IOException {

        if (STDIN.equals(input)) {
            final Syntax actualSyntax = syntax != null ? syntax : Syntax.TURTLE;
            return RDFIO.newParser(actualSyntax, base, graph).parse(in, store);
        }

        final File file = new File(input);
        Syntax actualSyntax = syntax;
        if (actualSyntax == null) {
            actualSyntax = Syntax.forFileName(input);
            if (actualSyntax == null) {
                throw new IllegalArgumentException("cannot detect syntax, use option -f");
            }
        }
        final String actualBase = base != null ? base : file.getAbsoluteFile().toURI()
                .toString();
        final QuadParser parser = RDFIO.newParser(actualSyntax, actualBase, graph);
        final InputStream stream = RDFIO.open(file);
        try {
            return parser.parse(stream, store);
        } finally {
            stream.close();
        }
    }

}
