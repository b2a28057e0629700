package eu.fbk.rdfquads.rio;

import javax.annotation.Nullable;

import eu.fbk.rdfquads.data.ParseException;

/**
 * Signals a malformed token: unterminated string or IRI, invalid escape sequence, invalid
 * percent-encoding, character not allowed at the current position or undecodable input.
 */
public class LexException extends ParseException {

    private static final long serialVersionUID = 1L;

    public LexException(final String reason, final int line, final int column) {
        super(reason, line, column);
    }

    public LexException(final String reason, final int line, final int column,
            @Nullable final Throwable cause) {
        super(reason, line, column, cause);
    }

}
