package eu.fbk.rdfquads.data;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Factory for {@link Term}s, {@link Triple}s and {@link Quad}s.
 * <p>
 * Every factory owns a random blank node prefix, derived from a {@link UUID}, and a counter. Blank
 * nodes returned by {@link #createBNode()} get IDs of the form {@code <prefix><counter>}, so that
 * fresh blank nodes created by different factories never collide. Parsers use one factory per
 * document unless configured otherwise, which keeps blank nodes of unrelated documents distinct.
 * The counter is atomic, so a factory can be shared by concurrent parsers.
 * </p>
 */
public final class TermFactory {

    private static final TermFactory DEFAULT = new TermFactory();

    private final String bnodePrefix;

    private final AtomicLong bnodeCounter;

    private TermFactory() {
        final UUID uuid = UUID.randomUUID();
        final StringBuilder builder = new StringBuilder(12);
        long num = Math.abs(uuid.getLeastSignificantBits());
        builder.append(charFor(num % 52));
        num = num / 52;
        for (int i = 0; i < 5; ++i) {
            builder.append(charFor(num % 62));
            num = num / 62;
        }
        num = Math.abs(uuid.getMostSignificantBits());
        for (int i = 0; i < 6; ++i) {
            builder.append(charFor(num % 62));
            num = num / 62;
        }
        this.bnodePrefix = builder.toString();
        this.bnodeCounter = new AtomicLong(0L);
    }

    private static char charFor(final long num) {
        if (num < 26) {
            return (char) (65 + num);
        } else if (num < 52) {
            return (char) (71 + num);
        } else if (num < 62) {
            return (char) (num - 4);
        } else {
            return 'x';
        }
    }

    /**
     * Returns the shared factory, used for vocabulary constants and programmatic term creation.
     *
     * @return the shared factory
     */
    public static TermFactory getDefault() {
        return DEFAULT;
    }

    /**
     * Creates a new factory with its own blank node prefix.
     *
     * @return the created factory
     */
    public static TermFactory create() {
        return new TermFactory();
    }

    /**
     * Returns the prefix of the blank node IDs generated by this factory.
     *
     * @return the blank node prefix
     */
    public String getBNodePrefix() {
        return this.bnodePrefix;
    }

    public IRI createIRI(final String iri) {
        return new IRI(iri);
    }

    public IRI createIRI(final String namespace, final String localName) {
        return new IRI(namespace + localName);
    }

    /**
     * Creates a fresh blank node, distinct from any other blank node created so far by any
     * factory.
     *
     * @return the created blank node
     */
    public BNode createBNode() {
        return new BNode(this.bnodePrefix
                + Long.toString(this.bnodeCounter.getAndIncrement(), 32));
    }

    public BNode createBNode(final String id) {
        return new BNode(id);
    }

    public Literal createLiteral(final String label) {
        return new Literal(label, null, null);
    }

    public Literal createLiteral(final String label, @Nullable final String language) {
        return new Literal(label, language, null);
    }

    public Literal createLiteral(final String label, @Nullable final IRI datatype) {
        return new Literal(label, null, datatype);
    }

    /**
     * Creates a literal with optional language and datatype, failing if both are specified.
     *
     * @param label
     *            the label
     * @param language
     *            the optional language tag
     * @param datatype
     *            the optional datatype
     * @return the created literal
     * @throws IllegalArgumentException
     *             if both language and a datatype other than {@code rdf:langString} are given, or
     *             if the language tag is malformed
     */
    public Literal createLiteral(final String label, @Nullable final String language,
            @Nullable final IRI datatype) {
        return new Literal(label, language, datatype);
    }

    public Triple createTriple(final Resource subject, final IRI predicate, final Term object) {
        return new Triple(subject, predicate, object);
    }

    public Quad createQuad(final Resource subject, final IRI predicate, final Term object,
            @Nullable final Resource graph) {
        Preconditions.checkNotNull(subject);
        return new Quad(subject, predicate, object, graph);
    }

}
