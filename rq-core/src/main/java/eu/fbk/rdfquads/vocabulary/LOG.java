package eu.fbk.rdfquads.vocabulary;

import eu.fbk.rdfquads.data.IRI;
import eu.fbk.rdfquads.data.TermFactory;

/**
 * Constants for the Notation3 log vocabulary.
 */
public final class LOG {

    /** Recommended prefix for the vocabulary namespace: "log". */
    public static final String PREFIX = "log";

    /** Vocabulary namespace: "http://www.w3.org/2000/10/swap/log#". */
    public static final String NAMESPACE = "http://www.w3.org/2000/10/swap/log#";

    /** Property log:implies. */
    public static final IRI IMPLIES = createIRI("implies");

    private static IRI createIRI(final String localName) {
        return TermFactory.getDefault().createIRI(NAMESPACE, localName);
    }

    private LOG() {
    }

}
