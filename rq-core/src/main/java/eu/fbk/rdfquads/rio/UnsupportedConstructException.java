package eu.fbk.rdfquads.rio;

import eu.fbk.rdfquads.data.ParseException;

/**
 * Signals a construct that is grammatical but cannot be represented as a quad, such as N3
 * formulas, variables and quantifiers, or a term that a writer cannot represent in its output
 * syntax. Writers report position -1.
 */
public class UnsupportedConstructException extends ParseException {

    private static final long serialVersionUID = 1L;

    public UnsupportedConstructException(final String reason, final int line, final int column) {
        super(reason, line, column);
    }

    public UnsupportedConstructException(final String reason) {
        super(reason, -1, -1);
    }

}
