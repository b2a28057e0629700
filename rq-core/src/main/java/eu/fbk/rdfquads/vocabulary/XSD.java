package eu.fbk.rdfquads.vocabulary;

import eu.fbk.rdfquads.data.IRI;
import eu.fbk.rdfquads.data.TermFactory;

/**
 * Constants for the XML Schema datatypes vocabulary.
 */
public final class XSD {

    /** Recommended prefix for the vocabulary namespace: "xsd". */
    public static final String PREFIX = "xsd";

    /** Vocabulary namespace: "http://www.w3.org/2001/XMLSchema#". */
    public static final String NAMESPACE = "http://www.w3.org/2001/XMLSchema#";

    /** Datatype xsd:string. */
    public static final IRI STRING = createIRI("string");

    /** Datatype xsd:boolean. */
    public static final IRI BOOLEAN = createIRI("boolean");

    /** Datatype xsd:integer. */
    public static final IRI INTEGER = createIRI("integer");

    /** Datatype xsd:decimal. */
    public static final IRI DECIMAL = createIRI("decimal");

    /** Datatype xsd:double. */
    public static final IRI DOUBLE = createIRI("double");

    /** Datatype xsd:float. */
    public static final IRI FLOAT = createIRI("float");

    /** Datatype xsd:long. */
    public static final IRI LONG = createIRI("long");

    /** Datatype xsd:int. */
    public static final IRI INT = createIRI("int");

    /** Datatype xsd:date. */
    public static final IRI DATE = createIRI("date");

    /** Datatype xsd:dateTime. */
    public static final IRI DATE_TIME = createIRI("dateTime");

    private static IRI createIRI(final String localName) {
        return TermFactory.getDefault().createIRI(NAMESPACE, localName);
    }

    private XSD() {
    }

}
