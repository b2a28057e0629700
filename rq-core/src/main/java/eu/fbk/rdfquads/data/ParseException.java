package eu.fbk.rdfquads.data;

import javax.annotation.Nullable;

/**
 * Signals a failure in parsing RDF text according to some formal grammar.
 * <p>
 * This exception is thrown when a document, or any other string obeying some formal grammar,
 * cannot be parsed for any reason (e.g., malformed token, unexpected token, unresolvable prefix).
 * Parsing is all-or-nothing: when this exception is thrown no statement of the document has been
 * added to the target store. The position of the error is reported via {@link #getLine()} and
 * {@link #getColumn()}, and is included in the message in the form {@code [line:column]}.
 * </p>
 */
public class ParseException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String reason;

    private final int line;

    private final int column;

    /**
     * Creates a new instance with the error message and position specified.
     *
     * @param reason
     *            the error message, without position information
     * @param line
     *            the 1-based line of the error, or -1 if unknown
     * @param column
     *            the 1-based column of the error, or -1 if unknown
     */
    public ParseException(final String reason, final int line, final int column) {
        this(reason, line, column, null);
    }

    /**
     * Creates a new instance with the error message, position and cause specified.
     *
     * @param reason
     *            the error message, without position information
     * @param line
     *            the 1-based line of the error, or -1 if unknown
     * @param column
     *            the 1-based column of the error, or -1 if unknown
     * @param cause
     *            the optional cause of this exception
     */
    public ParseException(final String reason, final int line, final int column,
            @Nullable final Throwable cause) {
        super((line < 0 ? "" : "[" + line + ":" + column + "] ") + reason, cause);
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    /**
     * Returns the error message without position information.
     *
     * @return the reason of the failure
     */
    public final String getReason() {
        return this.reason;
    }

    /**
     * Returns the line where the error occurred.
     *
     * @return the 1-based line, or -1 if unknown
     */
    public final int getLine() {
        return this.line;
    }

    /**
     * Returns the column where the error occurred.
     *
     * @return the 1-based column, or -1 if unknown
     */
    public final int getColumn() {
        return this.column;
    }

}
