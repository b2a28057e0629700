package eu.fbk.rdfquads.data;

import java.io.Serializable;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * An RDF triple: subject, predicate and object.
 * <p>
 * Term positions are statically typed: the subject is a {@link Resource} (IRI or blank node), the
 * predicate an {@link IRI} and the object any {@link Term}.
 * </p>
 */
public final class Triple implements Comparable<Triple>, Serializable {

    private static final long serialVersionUID = 1L;

    private final Resource subject;

    private final IRI predicate;

    private final Term object;

    public Triple(final Resource subject, final IRI predicate, final Term object) {
        this.subject = Preconditions.checkNotNull(subject);
        this.predicate = Preconditions.checkNotNull(predicate);
        this.object = Preconditions.checkNotNull(object);
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
     * Returns a quad with the components of this triple and the graph specified.
     *
     * @param graph
     *            the graph, null for the default graph
     * @return the created quad
     */
    public Quad inGraph(@Nullable final Resource graph) {
        return new Quad(this.subject, this.predicate, this.object, graph);
    }

    @Override
    public int compareTo(final Triple other) {
        int result = this.subject.compareTo(other.subject);
        if (result == 0) {
            result = this.predicate.compareTo(other.predicate);
            if (result == 0) {
                result = this.object.compareTo(other.object);
            }
        }
        return result;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Triple)) {
            return false;
        }
        final Triple other = (Triple) object;
        return this.subject.equals(other.subject) && this.predicate.equals(other.predicate)
                && this.object.equals(other.object);
    }

    @Override
    public int hashCode() {
        return 961 * this.subject.hashCode() + 31 * this.predicate.hashCode()
                + this.object.hashCode();
    }

    @Override
    public String toString() {
        return this.subject + " " + this.predicate + " " + this.object + " .";
    }

}
