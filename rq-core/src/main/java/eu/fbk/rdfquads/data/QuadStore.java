package eu.fbk.rdfquads.data;

import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

/**
 * An in-memory set of {@link Quad}s, groupable by graph.
 * <p>
 * A {@code QuadStore} has set semantics: adding a quad already contained is a no-op that returns
 * false and never fails. Quads are returned in the canonical order defined by
 * {@link Quad#compareTo(Quad)} (graph, subject, predicate, object, comparing N-Triples
 * representations, default graph first), which is the order used for serialization.
 * </p>
 * <p>
 * The default graph is represented in quads by a null graph. Methods accepting a graph accept
 * either null or {@link #DEFAULT_GRAPH} to denote it, while {@link #graphs()} reports it as
 * {@link #DEFAULT_GRAPH}.
 * </p>
 * <p>
 * Implementations are not required to be thread safe: concurrent mutation must be prevented by
 * the caller, e.g., by wrapping the store with {@link SynchronizedQuadStore}. Iterating a store
 * while it is modified has undefined results.
 * </p>
 */
public interface QuadStore extends Iterable<Quad> {

    /** Sentinel graph name denoting the default graph in {@link #graphs()}. */
    IRI DEFAULT_GRAPH = TermFactory.getDefault().createIRI(
            "http://dkm.fbk.eu/ontologies/rdfquads#defaultGraph");

    /**
     * Adds a quad, unless already contained.
     *
     * @param quad
     *            the quad to add
     * @return true if the quad was added, false if it was already contained
     */
    boolean add(Quad quad);

    /**
     * Adds the quad with the components specified.
     *
     * @param subject
     *            the subject
     * @param predicate
     *            the predicate
     * @param object
     *            the object
     * @param graph
     *            the graph, null or {@link #DEFAULT_GRAPH} for the default graph
     * @return true if the quad was added, false if it was already contained
     */
    boolean add(Resource subject, IRI predicate, Term object, @Nullable Resource graph);

    /**
     * Adds all the quads supplied.
     *
     * @param quads
     *            the quads to add
     * @return the number of quads actually added
     */
    int addAll(Iterable<Quad> quads);

    /**
     * Removes a quad, if contained.
     *
     * @param quad
     *            the quad to remove
     * @return true if the quad was contained and has been removed
     */
    boolean remove(Quad quad);

    boolean contains(Quad quad);

    int size();

    boolean isEmpty();

    void clear();

    /**
     * Returns the graphs having at least a quad, in canonical order, using {@link #DEFAULT_GRAPH}
     * for the default graph.
     *
     * @return an immutable set of graph names
     */
    Set<Resource> graphs();

    /**
     * Returns all the quads in canonical order.
     *
     * @return an immutable list of quads
     */
    List<Quad> quads();

    /**
     * Returns the quads of a graph in canonical order.
     *
     * @param graph
     *            the graph, null or {@link #DEFAULT_GRAPH} for the default graph
     * @return an immutable list of quads
     */
    List<Quad> quads(@Nullable Resource graph);

    /**
     * Returns the triples of a graph in canonical order.
     *
     * @param graph
     *            the graph, null or {@link #DEFAULT_GRAPH} for the default graph
     * @return an immutable list of triples
     */
    List<Triple> triples(@Nullable Resource graph);

    /**
     * Returns the quads matching a pattern in canonical order. Null subject, predicate or object
     * components match anything; the graph component matches anything if null and the default
     * graph if {@link #DEFAULT_GRAPH}.
     *
     * @param subject
     *            the optional subject
     * @param predicate
     *            the optional predicate
     * @param object
     *            the optional object
     * @param graph
     *            the optional graph
     * @return an immutable list of matching quads
     */
    List<Quad> filter(@Nullable Resource subject, @Nullable IRI predicate, @Nullable Term object,
            @Nullable Resource graph);

    /**
     * Returns a new store with the quads of this store, all assigned to the graph specified.
     *
     * @param graph
     *            the target graph, null or {@link #DEFAULT_GRAPH} for the default graph
     * @return the created store
     */
    QuadStore withGraph(@Nullable Resource graph);

    /**
     * Checks whether this store and the store supplied contain the same quads up to a renaming
     * of blank nodes.
     *
     * @param other
     *            the other store
     * @return true if the two stores are isomorphic
     */
    boolean isomorphic(QuadStore other);

}
