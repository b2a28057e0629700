package eu.fbk.rdfquads.rio;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * A lexical token, with its kind, decoded text and start position.
 * <p>
 * The meaning of {@link #getText()} depends on the kind: the unresolved IRI for
 * {@code IRIREF}, the prefix for {@code PNAME_NS} and {@code PNAME_LN} (whose local name is
 * returned by {@link #getLocalName()}), the label for {@code BLANK_NODE_LABEL}, the unescaped
 * value for {@code STRING_LITERAL}, the tag for {@code LANGTAG}, the lexical form for numbers and
 * booleans, the keyword as written for {@code PREFIX}, {@code BASE} and {@code GRAPH}, the name
 * for {@code VARIABLE} and {@code KEYWORD}, and the source text for punctuation.
 * </p>
 */
public final class Token {

    private final TokenType type;

    private final String text;

    @Nullable
    private final String localName;

    private final int line;

    private final int column;

    public Token(final TokenType type, final String text, @Nullable final String localName,
            final int line, final int column) {
        this.type = Preconditions.checkNotNull(type);
        this.text = Preconditions.checkNotNull(text);
        this.localName = localName;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return this.type;
    }

    public String getText() {
        return this.text;
    }

    @Nullable
    public String getLocalName() {
        return this.localName;
    }

    public int getLine() {
        return this.line;
    }

    public int getColumn() {
        return this.column;
    }

    public boolean is(final TokenType type) {
        return this.type == type;
    }

    @Override
    public String toString() {
        switch (this.type) {
        case IRIREF:
            return "IRI <" + this.text + ">";
        case PNAME_NS:
            return "'" + this.text + ":'";
        case PNAME_LN:
            return "'" + this.text + ":" + this.localName + "'";
        case BLANK_NODE_LABEL:
            return "'_:" + this.text + "'";
        case STRING_LITERAL:
            return "string \"" + abbreviate(this.text) + "\"";
        case LANGTAG:
            return "'@" + this.text + "'";
        case VARIABLE:
            return "'?" + this.text + "'";
        case KEYWORD:
            return "'@" + this.text + "'";
        case EOF:
            return this.type.getDescription();
        default:
            return "'" + this.text + "'";
        }
    }

    private static String abbreviate(final String string) {
        return string.length() <= 20 ? string : string.substring(0, 17) + "...";
    }

}
