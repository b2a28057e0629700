package eu.fbk.rdfquads.data;

import com.google.common.base.Preconditions;

import eu.fbk.rdfquads.internal.IRIs;
import eu.fbk.rdfquads.internal.Util;

/**
 * An absolute IRI.
 * <p>
 * Instances are created via {@link TermFactory#createIRI(String)} or via the constants of the
 * {@code vocabulary} package. The IRI string must be absolute (i.e., it must start with a
 * scheme): relative references are resolved by parsers before terms are created, so that no
 * relative IRI can ever reach a {@link QuadStore}.
 * </p>
 */
public final class IRI extends Resource {

    private static final long serialVersionUID = 1L;

    private final String string;

    private transient String ntriples;

    IRI(final String string) {
        Preconditions.checkArgument(IRIs.isAbsolute(string), "Not an absolute IRI: %s", string);
        this.string = string;
    }

    @Override
    public String stringValue() {
        return this.string;
    }

    /**
     * Returns the namespace part of the IRI, i.e., the prefix up to and including the last
     * {@code #}, {@code /} or {@code :} character.
     *
     * @return the namespace
     */
    public String getNamespace() {
        return this.string.substring(0, localNameIndex());
    }

    /**
     * Returns the local name part of the IRI, i.e., the suffix after the namespace.
     *
     * @return the local name, possibly empty
     */
    public String getLocalName() {
        return this.string.substring(localNameIndex());
    }

    private int localNameIndex() {
        int index = this.string.lastIndexOf('#');
        if (index < 0) {
            index = this.string.lastIndexOf('/');
        }
        if (index < 0) {
            index = this.string.lastIndexOf(':');
        }
        return index + 1;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof IRI)) {
            return false;
        }
        return this.string.equals(((IRI) object).string);
    }

    @Override
    public int hashCode() {
        return this.string.hashCode();
    }

    @Override
    public String toString() {
        if (this.ntriples == null) {
            final StringBuilder builder = new StringBuilder(this.string.length() + 2);
            Util.appendIRI(builder, this.string, false);
            this.ntriples = builder.toString();
        }
        return this.ntriples;
    }

}
