package eu.fbk.rdfquads.vocabulary;

import eu.fbk.rdfquads.data.IRI;
import eu.fbk.rdfquads.data.TermFactory;

/**
 * Constants for the OWL vocabulary.
 */
public final class OWL {

    /** Recommended prefix for the vocabulary namespace: "owl". */
    public static final String PREFIX = "owl";

    /** Vocabulary namespace: "http://www.w3.org/2002/07/owl#". */
    public static final String NAMESPACE = "http://www.w3.org/2002/07/owl#";

    /** Property owl:sameAs. */
    public static final IRI SAME_AS = createIRI("sameAs");

    /** Class owl:Thing. */
    public static final IRI THING = createIRI("Thing");

    /** Class owl:Class. */
    public static final IRI CLASS = createIRI("Class");

    private static IRI createIRI(final String localName) {
        return TermFactory.getDefault().createIRI(NAMESPACE, localName);
    }

    private OWL() {
    }

}
