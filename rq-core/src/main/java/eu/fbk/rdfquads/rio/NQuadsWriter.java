package eu.fbk.rdfquads.rio;

import java.io.IOException;
import java.io.Writer;
import java.util.HashMap;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import eu.fbk.rdfquads.data.BNode;
import eu.fbk.rdfquads.data.Data;
import eu.fbk.rdfquads.data.Handler;
import eu.fbk.rdfquads.data.IRI;
import eu.fbk.rdfquads.data.Literal;
import eu.fbk.rdfquads.data.Quad;
import eu.fbk.rdfquads.data.QuadStore;
import eu.fbk.rdfquads.data.Resource;
import eu.fbk.rdfquads.data.Term;
import eu.fbk.rdfquads.internal.Util;

/**
 * Writer for the N-Quads and N-Triples syntaxes.
 * <p>
 * Output is ASCII-safe: IRIs and literals encode non-ASCII characters with {@code \}{@code uXXXX}
 * and {@code \}{@code UXXXXXXXX} escapes, and literals additionally escape quotes, backslashes
 * and line breaks. Literals of type {@code xsd:string} are written without datatype. Blank nodes
 * are relabelled {@code _:b0}, {@code _:b1}, ... in order of first appearance.
 * </p>
 * <p>
 * Method {@link #write(QuadStore)} writes a whole store in the canonical order of
 * {@link Data#canonicalOrder(java.util.Collection)}, which does not depend on blank node IDs.
 * Alternatively, the writer can be used as a {@link Handler} to write
 * quads one at a time in the order they are supplied, with null signalling the end of the
 * sequence. In N-Triples mode graph names are dropped, and writing quads of different graphs
 * fails with an {@link UnsupportedConstructException}.
 * </p>
 */
public final class NQuadsWriter implements Handler<Quad> {

    private final Writer writer;

    private final Syntax syntax;

    private final Map<BNode, String> labels;

    private final StringBuilder builder;

    private boolean started;

    @Nullable
    private Resource graph;

    public NQuadsWriter(final Writer writer, final Syntax syntax) {
        Preconditions.checkArgument(syntax == Syntax.NQUADS || syntax == Syntax.NTRIPLES,
                "Unsupported syntax %s", syntax);
        this.writer = Preconditions.checkNotNull(writer);
        this.syntax = syntax;
        this.labels = new HashMap<BNode, String>();
        this.builder = new StringBuilder(256);
        this.started = false;
        this.graph = null;
    }

    public Syntax getSyntax() {
        return this.syntax;
    }

    /**
     * Writes all the quads of a store in canonical order, then flushes the underlying writer.
     *
     * @param store
     *            the store to write, which must not be modified concurrently
     * @throws IOException
     *             on I/O failure
     * @throws UnsupportedConstructException
     *             in N-Triples mode, if the store contains quads of different graphs
     */
    public void write(final QuadStore store) throws IOException {
        if (this.syntax == Syntax.NTRIPLES && store.graphs().size() > 1) {
            throw new UnsupportedConstructException("Cannot write quads of "
                    + store.graphs().size() + " graphs as N-Triples");
        }
        for (final Quad quad : Data.canonicalOrder(store.quads())) {
            write(quad);
        }
        this.writer.flush();
    }

    @Override
    public void handle(@Nullable final Quad quad) throws IOException {
        if (quad != null) {
            write(quad);
        } else {
            this.writer.flush();
        }
    }

    private void write(final Quad quad) throws IOException {

        if (this.syntax == Syntax.NTRIPLES) {
            final Resource graph = quad.getGraph();
            if (!this.started) {
                this.graph = graph;
            } else if (graph == null ? this.graph != null : !graph.equals(this.graph)) {
                throw new UnsupportedConstructException("Cannot write quads of different "
                        + "graphs as N-Triples");
            }
        }
        this.started = true;

        this.builder.setLength(0);
        emit(quad.getSubject());
        this.builder.append(' ');
        emit(quad.getPredicate());
        this.builder.append(' ');
        emit(quad.getObject());
        if (this.syntax == Syntax.NQUADS && quad.getGraph() != null) {
            this.builder.append(' ');
            emit(quad.getGraph());
        }
        this.builder.append(' ').append('.').append('\n');
        this.writer.write(this.builder.toString());
    }

    private void emit(final Term term) {
        if (term instanceof IRI) {
            Util.appendIRI(this.builder, term.stringValue(), true);
        } else if (term instanceof BNode) {
            String label = this.labels.get(term);
            if (label == null) {
                label = "b" + this.labels.size();
                this.labels.put((BNode) term, label);
            }
            this.builder.append('_').append(':').append(label);
        } else {
            Util.appendLiteral(this.builder, (Literal) term, true);
        }
    }

}
