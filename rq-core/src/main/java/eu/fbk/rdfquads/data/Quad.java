package eu.fbk.rdfquads.data;

import java.io.Serializable;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * An RDF quad: a triple plus an optional graph name.
 * <p>
 * A null graph denotes the default graph. Quads compare according to the canonical order used by
 * {@link QuadStore} and by the N-Quads writer: graph first (default graph before any named
 * graph), then subject, predicate and object, each compared by its N-Triples representation.
 * </p>
 */
public final class Quad implements Comparable<Quad>, Serializable {

    private static final long serialVersionUID = 1L;

    private final Resource subject;

    private final IRI predicate;

    private final Term object;

    @Nullable
    private final Resource graph;

    public Quad(final Resource subject, final IRI predicate, final Term object,
            @Nullable final Resource graph) {
        this.subject = Preconditions.checkNotNull(subject);
        this.predicate = Preconditions.checkNotNull(predicate);
        this.object = Preconditions.checkNotNull(object);
        this.graph = graph;
    }

    public Resource getSubject() {
        return this.subject;
    }

    public IRI getPredicate() {
        return this.predicate;
    }

    public Term getObject() {
        return this.object;
    }

    /**
     * Returns the graph of the quad.
     *
     * @return the graph, or null if the quad belongs to the default graph
     */
    @Nullable
    public Resource getGraph() {
        return this.graph;
    }

    public Triple getTriple() {
        return new Triple(this.subject, this.predicate, this.object);
    }

    /**
     * Returns a quad with the same triple and the graph specified.
     *
     * @param graph
     *            the new graph, null for the default graph
     * @return a quad in the graph specified (possibly this quad)
     */
    public Quad withGraph(@Nullable final Resource graph) {
        return Objects.equals(graph, this.graph) ? this : new Quad(this.subject, this.predicate,
                this.object, graph);
    }

    @Override
    public int compareTo(final Quad other) {
        int result;
        if (this.graph == null) {
            result = other.graph == null ? 0 : -1;
        } else {
            result = other.graph == null ? 1 : this.graph.compareTo(other.graph);
        }
        if (result == 0) {
            result = this.subject.compareTo(other.subject);
            if (result == 0) {
                result = this.predicate.compareTo(other.predicate);
                if (result == 0) {
                    result = this.object.compareTo(other.object);
                }
            }
        }
        return result;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Quad)) {
            return false;
        }
        final Quad other = (Quad) object;
        return this.subject.equals(other.subject) && this.predicate.equals(other.predicate)
                && this.object.equals(other.object) && Objects.equals(this.graph, other.graph);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.subject, this.predicate, this.object, this.graph);
    }

    @Override
    public String toString() {
        return this.subject + " " + this.predicate + " " + this.object
                + (this.graph == null ? "" : " " + this.graph) + " .";
    }

}
