package eu.fbk.rdfquads.rio;

import eu.fbk.rdfquads.data.ParseException;

/**
 * Signals a token that does not match any production allowed at the current position. The
 * expected production and the token actually found are available via {@link #getExpected()} and
 * {@link #getFound()}.
 */
public class SyntaxException extends ParseException {

    private static final long serialVersionUID = 1L;

    private final String expected;

    private final String found;

    public SyntaxException(final String expected, final String found, final int line,
            final int column) {
        super("Expected " + expected + ", found " + found, line, column);
        this.expected = expected;
        this.found = found;
    }

    public String getExpected() {
        return this.expected;
    }

    public String getFound() {
        return this.found;
    }

}
