package eu.fbk.rdfquads.rio;

import eu.fbk.rdfquads.data.ParseException;

/**
 * Signals a reference that cannot be resolved to an absolute IRI: a prefixed name using an
 * undeclared prefix, or a relative IRI with no base IRI in scope.
 */
public class ResolutionException extends ParseException {

    private static final long serialVersionUID = 1L;

    public ResolutionException(final String reason, final int line, final int column) {
        super(reason, line, column);
    }

}
