package eu.fbk.rdfquads.data;

import java.util.Iterator;
import java.util.List;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterators;

/**
 * A {@code QuadStore} keeping quads in a sorted set ordered by the canonical quad order.
 * <p>
 * Lookups, insertions and removals take logarithmic time; graph and pattern queries scan the
 * quads of the store. Instances are not thread safe.
 * </p>
 */
public final class MemoryQuadStore implements QuadStore {

    private final NavigableSet<Quad> quads;

    public MemoryQuadStore() {
        this.quads = new TreeSet<Quad>();
    }

    public MemoryQuadStore(final Iterable<Quad> quads) {
        this();
        addAll(quads);
    }

    @Nullable
    static Resource normalizeGraph(@Nullable final Resource graph) {
        return DEFAULT_GRAPH.equals(graph) ? null : graph;
    }

    private static Quad normalize(final Quad quad) {
        return DEFAULT_GRAPH.equals(quad.getGraph()) ? quad.withGraph(null) : quad;
    }

    @Override
    public boolean add(final Quad quad) {
        return this.quads.add(normalize(Preconditions.checkNotNull(quad)));
    }

    @Override
    public boolean add(final Resource subject, final IRI predicate, final Term object,
            @Nullable final Resource graph) {
        return this.quads.add(new Quad(subject, predicate, object, normalizeGraph(graph)));
    }

    @Override
    public int addAll(final Iterable<Quad> quads) {
        int count = 0;
        for (final Quad quad : quads) {
            if (add(quad)) {
                ++count;
            }
        }
        return count;
    }

    @Override
    public boolean remove(final Quad quad) {
        return this.quads.remove(normalize(Preconditions.checkNotNull(quad)));
    }

    @Override
    public boolean contains(final Quad quad) {
        return this.quads.contains(normalize(Preconditions.checkNotNull(quad)));
    }

    @Override
    public int size() {
        return this.quads.size();
    }

    @Override
    public boolean isEmpty() {
        return this.quads.isEmpty();
    }

    @Override
    public void clear() {
        this.quads.clear();
    }

    @Override
    public Set<Resource> graphs() {
        final ImmutableSet.Builder<Resource> builder = ImmutableSet.builder();
        Resource last = null;
        boolean first = true;
        for (final Quad quad : this.quads) {
            final Resource graph = quad.getGraph();
            if (first || !Objects.equals(graph, last)) {
                builder.add(graph == null ? DEFAULT_GRAPH : graph);
                last = graph;
                first = false;
            }
        }
        return builder.build();
    }

    @Override
    public List<Quad> quads() {
        return ImmutableList.copyOf(this.quads);
    }

    @Override
    public List<Quad> quads(@Nullable final Resource graph) {
        final Resource g = normalizeGraph(graph);
        final ImmutableList.Builder<Quad> builder = ImmutableList.builder();
        for (final Quad quad : this.quads) {
            if (Objects.equals(quad.getGraph(), g)) {
                builder.add(quad);
            }
        }
        return builder.build();
    }

    @Override
    public List<Triple> triples(@Nullable final Resource graph) {
        final ImmutableList.Builder<Triple> builder = ImmutableList.builder();
        for (final Quad quad : quads(graph)) {
            builder.add(quad.getTriple());
        }
        return builder.build();
    }

    @Override
    public List<Quad> filter(@Nullable final Resource subject, @Nullable final IRI predicate,
            @Nullable final Term object, @Nullable final Resource graph) {
        final ImmutableList.Builder<Quad> builder = ImmutableList.builder();
        for (final Quad quad : this.quads) {
            if ((subject == null || subject.equals(quad.getSubject()))
                    && (predicate == null || predicate.equals(quad.getPredicate()))
                    && (object == null || object.equals(quad.getObject()))
                    && (graph == null || Objects.equals(normalizeGraph(graph), quad.getGraph()))) {
                builder.add(quad);
            }
        }
        return builder.build();
    }

    @Override
    public QuadStore withGraph(@Nullable final Resource graph) {
        final Resource g = normalizeGraph(graph);
        final MemoryQuadStore store = new MemoryQuadStore();
        for (final Quad quad : this.quads) {
            store.quads.add(quad.withGraph(g));
        }
        return store;
    }

    @Override
    public boolean isomorphic(final QuadStore other) {
        return Isomorphism.isomorphic(quads(), other.quads());
    }

    @Override
    public Iterator<Quad> iterator() {
        return Iterators.unmodifiableIterator(this.quads.iterator());
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof QuadStore)) {
            return false;
        }
        final QuadStore other = (QuadStore) object;
        return size() == other.size() && quads().equals(other.quads());
    }

    @Override
    public int hashCode() {
        int hash = 0;
        for (final Quad quad : this.quads) {
            hash += quad.hashCode();
        }
        return hash;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + this.quads.size() + " quads]";
    }

}
