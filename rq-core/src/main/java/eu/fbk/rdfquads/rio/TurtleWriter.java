package eu.fbk.rdfquads.rio;

import java.io.IOException;
import java.io.Writer;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import eu.fbk.rdfquads.data.BNode;
import eu.fbk.rdfquads.data.Data;
import eu.fbk.rdfquads.data.IRI;
import eu.fbk.rdfquads.data.Literal;
import eu.fbk.rdfquads.data.Quad;
import eu.fbk.rdfquads.data.QuadStore;
import eu.fbk.rdfquads.data.Resource;
import eu.fbk.rdfquads.data.Term;
import eu.fbk.rdfquads.data.Triple;
import eu.fbk.rdfquads.internal.Util;
import eu.fbk.rdfquads.vocabulary.RDF;
import eu.fbk.rdfquads.vocabulary.XSD;

/**
 * Writer for the Turtle, TriG and N3 syntaxes.
 * <p>
 * The writer emits {@code @prefix} declarations for the namespaces of the supplied
 * prefix-to-namespace map that are actually used, followed by the statements grouped by subject
 * (with {@code ;}) and predicate (with {@code ,}), in canonical order. Abbreviations are used
 * where possible: {@code a} for {@code rdf:type}, prefixed names and the shorthand forms of
 * integer, decimal, double and boolean literals. Blank nodes are relabelled {@code _:b0},
 * {@code _:b1}, ... in order of first appearance. With syntax TriG, named graphs are written as
 * graph blocks; otherwise graph names are dropped and the triples of all graphs are merged.
 * </p>
 */
public final class TurtleWriter {

    private static final Pattern INTEGER = Pattern.compile("[+-]?[0-9]+");

    private static final Pattern DECIMAL = Pattern.compile("[+-]?[0-9]*\\.[0-9]+");

    private static final Pattern DOUBLE = Pattern
            .compile("[+-]?([0-9]+\\.[0-9]*|\\.[0-9]+|[0-9]+)[eE][+-]?[0-9]+");

    private static final String INDENT = "    ";

    private final Writer writer;

    private final Syntax syntax;

    private final Map<String, String> namespaces;

    private final Map<BNode, String> labels;

    private final SortedMap<String, String> usedPrefixes;

    private final StringBuilder builder;

    /**
     * Creates a new writer.
     *
     * @param writer
     *            the target writer
     * @param syntax
     *            one of {@code TURTLE}, {@code TRIG}, {@code N3}
     * @param namespaces
     *            the prefix-to-namespace mappings that can be used to abbreviate IRIs, null for
     *            none
     */
    public TurtleWriter(final Writer writer, final Syntax syntax,
            @Nullable final Map<String, String> namespaces) {
        Preconditions.checkArgument(syntax.isTurtleFamily(), "Unsupported syntax %s", syntax);
        this.writer = Preconditions.checkNotNull(writer);
        this.syntax = syntax;
        this.namespaces = namespaces != null ? namespaces : Collections.<String, String>emptyMap();
        this.labels = new HashMap<BNode, String>();
        this.usedPrefixes = new TreeMap<String, String>();
        this.builder = new StringBuilder(1024);
    }

    public Syntax getSyntax() {
        return this.syntax;
    }

    /**
     * Writes the content of a store, then flushes the underlying writer.
     *
     * @param store
     *            the store to write, which must not be modified concurrently
     * @throws IOException
     *             on I/O failure
     */
    public void write(final QuadStore store) throws IOException {

        final Map<Resource, List<Triple>> graphs = new TreeMap<Resource, List<Triple>>();
        List<Triple> defaultTriples = ImmutableList.of();
        if (this.syntax == Syntax.TRIG) {
            for (final Resource graph : store.graphs()) {
                if (graph.equals(QuadStore.DEFAULT_GRAPH)) {
                    defaultTriples = store.triples(null);
                } else {
                    graphs.put(graph, store.triples(graph));
                }
            }
        } else {
            final Set<Triple> triples = new TreeSet<Triple>();
            for (final Quad quad : store.quads()) {
                triples.add(quad.getTriple());
            }
            defaultTriples = ImmutableList.copyOf(triples);
        }

        collectPrefixes(defaultTriples);
        for (final Map.Entry<Resource, List<Triple>> entry : graphs.entrySet()) {
            collectPrefix(entry.getKey());
            collectPrefixes(entry.getValue());
        }

        this.builder.setLength(0);
        for (final Map.Entry<String, String> entry : this.usedPrefixes.entrySet()) {
            this.builder.append("@prefix ").append(entry.getKey()).append(": ");
            Util.appendIRI(this.builder, entry.getValue(), false);
            this.builder.append(" .\n");
        }
        if (!this.usedPrefixes.isEmpty()) {
            this.builder.append('\n');
        }

        emitTriples(defaultTriples, "");
        for (final Map.Entry<Resource, List<Triple>> entry : graphs.entrySet()) {
            if (this.builder.length() > 0) {
                this.builder.append('\n');
            }
            emitTerm(entry.getKey(), false);
            this.builder.append(" {\n");
            emitTriples(entry.getValue(), INDENT);
            this.builder.append("}\n");
        }

        this.writer.write(this.builder.toString());
        this.writer.flush();
    }

    private void collectPrefixes(final List<Triple> triples) {
        for (final Triple triple : triples) {
            collectPrefix(triple.getSubject());
            if (!triple.getPredicate().equals(RDF.TYPE)) {
                collectPrefix(triple.getPredicate());
            }
            collectPrefix(triple.getObject());
        }
    }

    private void collectPrefix(final Term term) {
        if (term instanceof IRI) {
            final String prefix = prefixFor((IRI) term);
            if (prefix != null) {
                this.usedPrefixes.put(prefix, ((IRI) term).getNamespace());
            }
        } else if (term instanceof Literal) {
            final Literal literal = (Literal) term;
            if (literal.getLanguage() == null && !literal.isSimple()
                    && abbreviate(literal) == null) {
                collectPrefix(literal.getDatatype());
            }
        }
    }

    @Nullable
    private String prefixFor(final IRI iri) {
        final String prefix = Data.namespaceToPrefix(iri.getNamespace(), this.namespaces);
        return prefix != null && TurtleUtil.isPrefix(prefix)
                && TurtleUtil.isLocalName(iri.getLocalName()) ? prefix : null;
    }

    private void emitTriples(final List<Triple> triples, final String indent) {
        Resource subject = null;
        IRI predicate = null;
        for (final Triple triple : triples) {
            if (!triple.getSubject().equals(subject)) {
                if (subject != null) {
                    this.builder.append(" .\n");
                }
                subject = triple.getSubject();
                predicate = triple.getPredicate();
                this.builder.append(indent);
                emitTerm(subject, false);
                this.builder.append(' ');
                emitTerm(predicate, true);
                this.builder.append(' ');
            } else if (!triple.getPredicate().equals(predicate)) {
                predicate = triple.getPredicate();
                this.builder.append(" ;\n").append(indent).append(INDENT);
                emitTerm(predicate, true);
                this.builder.append(' ');
            } else {
                this.builder.append(", ");
            }
            emitTerm(triple.getObject(), false);
        }
        if (subject != null) {
            this.builder.append(" .\n");
        }
    }

    private void emitTerm(final Term term, final boolean predicate) {
        if (term instanceof IRI) {
            final IRI iri = (IRI) term;
            final String prefix = prefixFor(iri);
            if (predicate && iri.equals(RDF.TYPE)) {
                this.builder.append('a');
            } else if (prefix != null) {
                this.builder.append(prefix).append(':').append(iri.getLocalName());
            } else {
                Util.appendIRI(this.builder, iri.stringValue(), false);
            }

        } else if (term instanceof BNode) {
            String label = this.labels.get(term);
            if (label == null) {
                label = "b" + this.labels.size();
                this.labels.put((BNode) term, label);
            }
            this.builder.append('_').append(':').append(label);

        } else {
            final Literal literal = (Literal) term;
            final String shorthand = abbreviate(literal);
            if (shorthand != null) {
                this.builder.append(shorthand);
                return;
            }
            this.builder.append('"');
            Util.appendEscaped(this.builder, literal.getLabel(), false);
            this.builder.append('"');
            if (literal.getLanguage() != null) {
                this.builder.append('@').append(literal.getLanguage());
            } else if (!literal.isSimple()) {
                this.builder.append("^^");
                emitTerm(literal.getDatatype(), false);
            }
        }
    }

    @Nullable
    private static String abbreviate(final Literal literal) {
        final IRI datatype = literal.getDatatype();
        final String label = literal.getLabel();
        if (datatype.equals(XSD.INTEGER) && INTEGER.matcher(label).matches()
                || datatype.equals(XSD.DECIMAL) && DECIMAL.matcher(label).matches()
                || datatype.equals(XSD.DOUBLE) && DOUBLE.matcher(label).matches()
                || datatype.equals(XSD.BOOLEAN)
                && (label.equals("true") || label.equals("false"))) {
            return label;
        }
        return null;
    }

}
