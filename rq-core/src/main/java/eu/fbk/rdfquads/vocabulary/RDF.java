package eu.fbk.rdfquads.vocabulary;

import eu.fbk.rdfquads.data.IRI;
import eu.fbk.rdfquads.data.TermFactory;

/**
 * Constants for the RDF vocabulary.
 */
public final class RDF {

    /** Recommended prefix for the vocabulary namespace: "rdf". */
    public static final String PREFIX = "rdf";

    /** Vocabulary namespace: "http://www.w3.org/1999/02/22-rdf-syntax-ns#". */
    public static final String NAMESPACE = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";

    /** Property rdf:type. */
    public static final IRI TYPE = createIRI("type");

    /** Property rdf:first. */
    public static final IRI FIRST = createIRI("first");

    /** Property rdf:rest. */
    public static final IRI REST = createIRI("rest");

    /** Resource rdf:nil. */
    public static final IRI NIL = createIRI("nil");

    /** Class rdf:List. */
    public static final IRI LIST = createIRI("List");

    /** Datatype rdf:langString. */
    public static final IRI LANG_STRING = createIRI("langString");

    /** Class rdf:Statement. */
    public static final IRI STATEMENT = createIRI("Statement");

    /** Property rdf:subject. */
    public static final IRI SUBJECT = createIRI("subject");

    /** Property rdf:predicate. */
    public static final IRI PREDICATE = createIRI("predicate");

    /** Property rdf:object. */
    public static final IRI OBJECT = createIRI("object");

    private static IRI createIRI(final String localName) {
        return TermFactory.getDefault().createIRI(NAMESPACE, localName);
    }

    private RDF() {
    }

}
