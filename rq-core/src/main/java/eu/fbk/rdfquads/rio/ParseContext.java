package eu.fbk.rdfquads.rio;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import eu.fbk.rdfquads.data.BNode;
import eu.fbk.rdfquads.data.IRI;
import eu.fbk.rdfquads.data.Resource;
import eu.fbk.rdfquads.data.TermFactory;
import eu.fbk.rdfquads.internal.IRIs;

/**
 * The mutable state of a single parse: base IRI, prefix table, blank node labels and current
 * graph.
 * <p>
 * A context is created at the beginning of each parse and is never shared between parses, so
 * that directives in one document never affect another document and blank node labels are
 * scoped to the document where they appear. The terms produced via a context do not depend on
 * it once created. The context at the end of a parse is exposed by the parsers to let callers
 * inspect the prefixes and base IRI declared by a document.
 * </p>
 */
public final class ParseContext {

    private final TermFactory termFactory;

    private final Map<String, String> prefixes;

    private final Map<String, BNode> bnodes;

    @Nullable
    private String baseIRI;

    @Nullable
    private Resource graph;

    ParseContext(final TermFactory termFactory, @Nullable final String baseIRI,
            @Nullable final Resource graph) {
        this.termFactory = Preconditions.checkNotNull(termFactory);
        this.prefixes = new TreeMap<String, String>();
        this.bnodes = new HashMap<String, BNode>();
        this.baseIRI = baseIRI;
        this.graph = graph;
    }

    public TermFactory getTermFactory() {
        return this.termFactory;
    }

    /**
     * Returns the base IRI currently in scope.
     *
     * @return the base IRI, or null if none
     */
    @Nullable
    public String getBaseIRI() {
        return this.baseIRI;
    }

    void setBaseIRI(final String baseIRI) {
        this.baseIRI = Preconditions.checkNotNull(baseIRI);
    }

    /**
     * Returns the prefix table, mapping prefixes (without colon) to namespace IRIs.
     *
     * @return an unmodifiable view of the prefix table
     */
    public Map<String, String> getPrefixes() {
        return Collections.unmodifiableMap(this.prefixes);
    }

    /**
     * Returns the namespace bound to a prefix.
     *
     * @param prefix
     *            the prefix, without colon
     * @return the namespace, or null if the prefix was not declared
     */
    @Nullable
    public String getNamespace(final String prefix) {
        return this.prefixes.get(prefix);
    }

    void setPrefix(final String prefix, final String namespace) {
        this.prefixes.put(Preconditions.checkNotNull(prefix),
                Preconditions.checkNotNull(namespace));
    }

    @Nullable
    public Resource getGraph() {
        return this.graph;
    }

    void setGraph(@Nullable final Resource graph) {
        this.graph = graph;
    }

    IRI resolveIRI(final String reference, final int line, final int column) {
        if (IRIs.isAbsolute(reference)) {
            return this.termFactory.createIRI(reference);
        } else if (this.baseIRI == null) {
            throw new ResolutionException("Cannot resolve relative IRI <" + reference
                    + ">: no base IRI in scope", line, column);
        }
        return this.termFactory.createIRI(IRIs.resolve(this.baseIRI, reference));
    }

    IRI resolvePrefixedName(final String prefix, final String localName, final int line,
            final int column) {
        final String namespace = this.prefixes.get(prefix);
        if (namespace == null) {
            throw new ResolutionException("Undeclared prefix '" + prefix + ":'", line, column);
        }
        final String iri = namespace + localName;
        if (!IRIs.isAbsolute(iri)) {
            throw new ResolutionException("Prefixed name " + prefix + ":" + localName
                    + " does not expand to an absolute IRI", line, column);
        }
        return this.termFactory.createIRI(iri);
    }

    BNode resolveBNode(final String label) {
        BNode bnode = this.bnodes.get(label);
        if (bnode == null) {
            bnode = this.termFactory.createBNode();
            this.bnodes.put(label, bnode);
        }
        return bnode;
    }

    BNode newBNode() {
        return this.termFactory.createBNode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("base", this.baseIRI)
                .add("prefixes", this.prefixes).add("graph", this.graph).toString();
    }

}
