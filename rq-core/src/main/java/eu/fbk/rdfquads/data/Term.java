package eu.fbk.rdfquads.data;

import java.io.Serializable;

/**
 * An RDF term: an {@link IRI}, a blank node ({@link BNode}) or a {@link Literal}.
 * <p>
 * The hierarchy is closed: the only subclasses are the ones of this package. Terms are immutable
 * and can be freely shared among threads. Two terms are equal if they have the same type and the
 * same components; the natural ordering compares the N-Triples representation returned by
 * {@link #toString()}, which is the canonical order used for serialization.
 * </p>
 */
public abstract class Term implements Comparable<Term>, Serializable {

    private static final long serialVersionUID = 1L;

    Term() {
    }

    /**
     * Returns the lexical value of the term: the IRI string, the blank node identifier or the
     * literal label.
     *
     * @return the string value
     */
    public abstract String stringValue();

    @Override
    public int compareTo(final Term other) {
        return toString().compareTo(other.toString());
    }

    /**
     * {@inheritDoc} Returns the N-Triples representation of the term.
     */
    @Override
    public abstract String toString();

}
