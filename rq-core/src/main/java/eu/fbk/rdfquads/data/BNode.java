package eu.fbk.rdfquads.data;

import com.google.common.base.Preconditions;

/**
 * A blank node, identified by a string ID.
 * <p>
 * Blank node identity is the ID: two {@code BNode}s with the same ID denote the same node. IDs
 * generated by a {@link TermFactory} are unique to that factory, which is what parsers rely on to
 * keep blank nodes of different documents apart.
 * </p>
 */
public final class BNode extends Resource {

    private static final long serialVersionUID = 1L;

    private final String id;

    BNode(final String id) {
        Preconditions.checkArgument(!id.isEmpty(), "Empty blank node ID");
        for (int i = 0; i < id.length(); ++i) {
            final char c = id.charAt(i);
            Preconditions.checkArgument(c > ' ' && c != '.' || c == '.' && i > 0
                    && i < id.length() - 1, "Illegal blank node ID: %s", id);
        }
        this.id = id;
    }

    /**
     * Returns the blank node ID.
     *
     * @return the ID, not empty
     */
    public String getID() {
        return this.id;
    }

    @Override
    public String stringValue() {
        return this.id;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof BNode)) {
            return false;
        }
        return this.id.equals(((BNode) object).id);
    }

    @Override
    public int hashCode() {
        return this.id.hashCode();
    }

    @Override
    public String toString() {
        return "_:" + this.id;
    }

}
