package eu.fbk.rdfquads.data;

import java.util.Iterator;
import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * A {@code QuadStore} wrapper that serializes access to another {@code QuadStore} using a mutex.
 * <p>
 * Each method call is atomic with respect to the other calls. Query methods return immutable
 * snapshots, so their results can be used while other threads modify the store. Iteration via
 * {@link #iterator()} is over a snapshot as well.
 * </p>
 */
public final class SynchronizedQuadStore implements QuadStore {

    private final QuadStore delegate;

    private final Object mutex;

    /**
     * Creates a new instance wrapping the store specified, using the wrapper itself as mutex.
     *
     * @param delegate
     *            the wrapped store
     */
    public SynchronizedQuadStore(final QuadStore delegate) {
        this(delegate, null);
    }

    /**
     * Creates a new instance wrapping the store specified and synchronizing on the mutex
     * supplied.
     *
     * @param delegate
     *            the wrapped store
     * @param mutex
     *            the object to synchronize on, null to use the wrapper itself
     */
    public SynchronizedQuadStore(final QuadStore delegate, @Nullable final Object mutex) {
        this.delegate = Preconditions.checkNotNull(delegate);
        this.mutex = mutex != null ? mutex : this;
    }

    @Override
    public boolean add(final Quad quad) {
        synchronized (this.mutex) {
            return this.delegate.add(quad);
        }
    }

    @Override
    public boolean add(final Resource subject, final IRI predicate, final Term object,
            @Nullable final Resource graph) {
        synchronized (this.mutex) {
            return this.delegate.add(subject, predicate, object, graph);
        }
    }

    @Override
    public int addAll(final Iterable<Quad> quads) {
        synchronized (this.mutex) {
            return this.delegate.addAll(quads);
        }
    }

    @Override
    public boolean remove(final Quad quad) {
        synchronized (this.mutex) {
            return this.delegate.remove(quad);
        }
    }

    @Override
    public boolean contains(final Quad quad) {
        synchronized (this.mutex) {
            return this.delegate.contains(quad);
        }
    }

    @Override
    public int size() {
        synchronized (this.mutex) {
            return this.delegate.size();
        }
    }

    @Override
    public boolean isEmpty() {
        synchronized (this.mutex) {
            return this.delegate.isEmpty();
        }
    }

    @Override
    public void clear() {
        synchronized (this.mutex) {
            this.delegate.clear();
        }
    }

    @Override
    public Set<Resource> graphs() {
        synchronized (this.mutex) {
            return this.delegate.graphs();
        }
    }

    @Override
    public List<Quad> quads() {
        synchronized (this.mutex) {
            return this.delegate.quads();
        }
    }

    @Override
    public List<Quad> quads(@Nullable final Resource graph) {
        synchronized (this.mutex) {
            return this.delegate.quads(graph);
        }
    }

    @Override
    public List<Triple> triples(@Nullable final Resource graph) {
        synchronized (this.mutex) {
            return this.delegate.triples(graph);
        }
    }

    @Override
    public List<Quad> filter(@Nullable final Resource subject, @Nullable final IRI predicate,
            @Nullable final Term object, @Nullable final Resource graph) {
        synchronized (this.mutex) {
            return this.delegate.filter(subject, predicate, object, graph);
        }
    }

    @Override
    public QuadStore withGraph(@Nullable final Resource graph) {
        synchronized (this.mutex) {
            return this.delegate.withGraph(graph);
        }
    }

    @Override
    public boolean isomorphic(final QuadStore other) {
        final List<Quad> quads = quads();
        return Isomorphism.isomorphic(quads, other.quads());
    }

    @Override
    public Iterator<Quad> iterator() {
        return quads().iterator();
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof QuadStore)) {
            return false;
        }
        return quads().equals(((QuadStore) object).quads());
    }

    @Override
    public int hashCode() {
        synchronized (this.mutex) {
            return this.delegate.hashCode();
        }
    }

    @Override
    public String toString() {
        synchronized (this.mutex) {
            return getClass().getSimpleName() + "[" + this.delegate + "]";
        }
    }

}
