package eu.fbk.rdfquads.data;

/**
 * A term that can appear in subject and graph position: an {@link IRI} or a {@link BNode}.
 */
public abstract class Resource extends Term {

    private static final long serialVersionUID = 1L;

    Resource() {
    }

}
