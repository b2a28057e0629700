package eu.fbk.rdfquads.rio;

import java.util.Locale;

import com.google.common.base.Preconditions;

import eu.fbk.rdfquads.internal.IRIs;

/**
 * Tokenizer for the Turtle family of syntaxes.
 * <p>
 * The lexer works over the whole document text, returning one {@link Token} per call to
 * {@link #next()} until a token of type {@link TokenType#EOF} is returned. Whitespace and
 * comments are skipped. Escape sequences are resolved in the token text, except for
 * percent-encodings in IRIs and local names, which are validated and kept verbatim. N3 specific
 * tokens (variables, {@code =}, {@code =>}, {@code <=}, path operators, {@code @keywords} and
 * the bare words {@code has}, {@code is}, {@code of}) are recognized only if N3 mode is enabled;
 * otherwise they cause a {@link LexException}.
 * </p>
 */
public final class TurtleLexer {

    private final String input;

    private final boolean n3;

    private int pos;

    private int line;

    private int lineStart;

    private TokenType lastType;

    public TurtleLexer(final String input, final boolean n3) {
        this.input = Preconditions.checkNotNull(input);
        this.n3 = n3;
        this.pos = 0;
        this.line = 1;
        this.lineStart = 0;
        this.lastType = null;
    }

    public int getLine() {
        return this.line;
    }

    public int getColumn() {
        return this.pos - this.lineStart + 1;
    }

    /**
     * Returns the next token. After the end of input is reached, any further call returns an
     * {@code EOF} token.
     *
     * @return the next token, never null
     * @throws LexException
     *             if the input at the current position is not a valid token
     */
    public Token next() {
        skipWhitespaceAndComments();
        final Token token = lex();
        this.lastType = token.getType();
        return token;
    }

    private Token lex() {

        final int line = this.line;
        final int column = getColumn();
        final int c = peek(0);

        switch (c) {
        case -1:
            return new Token(TokenType.EOF, "", null, line, column);
        case '<':
            if (this.n3 && peek(1) == '=' && isDelimiter(peek(2))) {
                this.pos += 2;
                return new Token(TokenType.IMPLIED_BY, "<=", null, line, column);
            }
            return new Token(TokenType.IRIREF, lexIRI(), null, line, column);
        case '"':
        case '\'':
            return new Token(TokenType.STRING_LITERAL, lexString(), null, line, column);
        case '@':
            return lexAt(line, column);
        case '_':
            if (peek(1) == ':') {
                this.pos += 2;
                return new Token(TokenType.BLANK_NODE_LABEL, lexBNodeLabel(), null, line,
                        column);
            }
            throw error("Unexpected character '_'", line, column);
        case '.':
            if (isDigit(peek(1))) {
                return lexNumber(line, column);
            }
            return punctuation(TokenType.DOT, ".", line, column);
        case ',':
            return punctuation(TokenType.COMMA, ",", line, column);
        case ';':
            return punctuation(TokenType.SEMICOLON, ";", line, column);
        case '[':
            return punctuation(TokenType.LBRACKET, "[", line, column);
        case ']':
            return punctuation(TokenType.RBRACKET, "]", line, column);
        case '(':
            return punctuation(TokenType.LPAREN, "(", line, column);
        case ')':
            return punctuation(TokenType.RPAREN, ")", line, column);
        case '{':
            return punctuation(TokenType.LBRACE, "{", line, column);
        case '}':
            return punctuation(TokenType.RBRACE, "}", line, column);
        case '^':
            if (peek(1) == '^') {
                this.pos += 2;
                return new Token(TokenType.DATATYPE, "^^", null, line, column);
            } else if (this.n3) {
                return punctuation(TokenType.PATH, "^", line, column);
            }
            throw error("Unexpected character '^'", line, column);
        case '!':
            if (this.n3) {
                return punctuation(TokenType.PATH, "!", line, column);
            }
            throw error("Unexpected character '!'", line, column);
        case '=':
            if (this.n3) {
                if (peek(1) == '>') {
                    this.pos += 2;
                    return new Token(TokenType.IMPLIES, "=>", null, line, column);
                }
                return punctuation(TokenType.EQUALS, "=", line, column);
            }
            throw error("Unexpected character '='", line, column);
        case '?':
            if (this.n3) {
                ++this.pos;
                return new Token(TokenType.VARIABLE, lexName(line, column), null, line, column);
            }
            throw error("Unexpected character '?'", line, column);
        case '+':
        case '-':
            return lexNumber(line, column);
        case ':':
            ++this.pos;
            return lexPrefixedName("", line, column);
        default:
            if (isDigit(c)) {
                return lexNumber(line, column);
            } else if (TurtleUtil.isPNCharsBase(c)) {
                return lexWord(line, column);
            }
            throw error("Unexpected character " + describe(c), line, column);
        }
    }

    private Token punctuation(final TokenType type, final String text, final int line,
            final int column) {
        this.pos += text.length();
        return new Token(type, text, null, line, column);
    }

    private String lexIRI() {
        final int line = this.line;
        final int column = getColumn();
        ++this.pos; // skip '<'
        final StringBuilder builder = new StringBuilder();
        while (true) {
            final int c = peek(0);
            if (c == '>') {
                ++this.pos;
                return builder.toString();
            } else if (c == -1) {
                throw error("Unterminated IRI", line, column);
            } else if (c == '\\') {
                final int escapeColumn = getColumn();
                ++this.pos;
                final int e = peek(0);
                if (e != 'u' && e != 'U') {
                    throw error("Invalid escape sequence in IRI", this.line, escapeColumn);
                }
                final int cp = lexNumericEscape(escapeColumn);
                if (!IRIs.isAllowedChar(cp)) {
                    throw error("Escape sequence denotes a character not allowed in IRIs: "
                            + describe(cp), this.line, escapeColumn);
                }
                builder.appendCodePoint(cp);
            } else if (c == '%' && (!TurtleUtil.isHex(peek(1)) || !TurtleUtil.isHex(peek(2)))) {
                throw error("Invalid percent-encoding in IRI", this.line, getColumn());
            } else if (!IRIs.isAllowedChar(c)) {
                if (c == '\n' || c == '\r') {
                    throw error("Unterminated IRI", line, column);
                }
                throw error("Character not allowed in IRI: " + describe(c), this.line,
                        getColumn());
            } else {
                builder.appendCodePoint(c);
                this.pos += Character.charCount(c);
            }
        }
    }

    private String lexString() {

        final int line = this.line;
        final int column = getColumn();
        final char quote = this.input.charAt(this.pos);
        final boolean isLong = peek(1) == quote && peek(2) == quote;
        this.pos += isLong ? 3 : 1;

        final StringBuilder builder = new StringBuilder();
        while (true) {
            final int c = peek(0);
            if (c == -1) {
                throw error("Unterminated string", line, column);
            } else if (c == quote) {
                if (!isLong) {
                    ++this.pos;
                    return builder.toString();
                } else if (peek(1) == quote && peek(2) == quote) {
                    // a long string may end with up to two quotes before the delimiter
                    int end = this.pos + 3;
                    while (end < this.input.length() && this.input.charAt(end) == quote
                            && end - this.pos < 5) {
                        ++end;
                    }
                    for (int i = this.pos; i < end - 3; ++i) {
                        builder.append(quote);
                    }
                    this.pos = end;
                    return builder.toString();
                }
                builder.append(quote);
                ++this.pos;
            } else if (c == '\\') {
                builder.appendCodePoint(lexStringEscape());
            } else if (c == '\n' || c == '\r') {
                if (!isLong) {
                    throw error("Line break in short string", this.line, getColumn());
                }
                builder.append((char) c);
                consumeNewline(c);
            } else {
                builder.appendCodePoint(c);
                this.pos += Character.charCount(c);
            }
        }
    }

    private int lexStringEscape() {
        final int column = getColumn();
        ++this.pos; // skip '\'
        final int c = peek(0);
        switch (c) {
        case 't':
            ++this.pos;
            return '\t';
        case 'b':
            ++this.pos;
            return '\b';
        case 'n':
            ++this.pos;
            return '\n';
        case 'r':
            ++this.pos;
            return '\r';
        case 'f':
            ++this.pos;
            return '\f';
        case '"':
        case '\'':
        case '\\':
            ++this.pos;
            return c;
        case 'u':
        case 'U':
            return lexNumericEscape(column);
        default:
            throw error("Invalid escape sequence \\" + (c < 0 ? "" : new String(
                    Character.toChars(c))), this.line, column);
        }
    }

    private int lexNumericEscape(final int column) {
        final int digits = peek(0) == 'u' ? 4 : 8;
        ++this.pos;
        if (this.pos + digits > this.input.length()) {
            throw error("Truncated numeric escape sequence", this.line, column);
        }
        int cp = 0;
        for (int i = 0; i < digits; ++i) {
            final char h = this.input.charAt(this.pos + i);
            if (!TurtleUtil.isHex(h)) {
                throw error("Invalid hex digit in numeric escape sequence", this.line, column);
            }
            cp = cp * 16 + Character.digit(h, 16);
            if (cp > Character.MAX_CODE_POINT) {
                throw error("Numeric escape sequence out of Unicode range", this.line, column);
            }
        }
        if (cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE) {
            throw error("Numeric escape sequence denotes a surrogate code point", this.line,
                    column);
        }
        this.pos += digits;
        return cp;
    }

    private Token lexAt(final int line, final int column) {
        ++this.pos; // skip '@'
        final int start = this.pos;
        if (this.lastType == TokenType.STRING_LITERAL) {
            while (isLetter(peek(0)) || isDigit(peek(0)) || peek(0) == '-') {
                ++this.pos;
            }
            final String tag = this.input.substring(start, this.pos);
            if (!tag.matches("[a-zA-Z]+(-[a-zA-Z0-9]+)*")) {
                throw error("Invalid language tag '" + tag + "'", line, column);
            }
            return new Token(TokenType.LANGTAG, tag, null, line, column);
        }
        while (isLetter(peek(0))) {
            ++this.pos;
        }
        final String keyword = this.input.substring(start, this.pos);
        if (keyword.equals("prefix")) {
            return new Token(TokenType.PREFIX, "@prefix", null, line, column);
        } else if (keyword.equals("base")) {
            return new Token(TokenType.BASE, "@base", null, line, column);
        } else if (this.n3
                && (keyword.equals("forAll") || keyword.equals("forSome")
                        || keyword.equals("keywords") || keyword.equals("a")
                        || keyword.equals("has") || keyword.equals("is") || keyword
                            .equals("of"))) {
            return new Token(TokenType.KEYWORD, keyword, null, line, column);
        }
        throw error("Unknown keyword '@" + keyword + "'", line, column);
    }

    private String lexBNodeLabel() {
        final int line = this.line;
        final int column = getColumn() - 2;
        final int first = peek(0);
        if (!TurtleUtil.isPNCharsU(first) && !isDigit(first)) {
            throw error("Invalid blank node label", line, column);
        }
        final int start = this.pos;
        int end = this.pos + Character.charCount(first);
        this.pos = end;
        while (true) {
            final int c = peek(0);
            if (TurtleUtil.isPNChars(c)) {
                this.pos += Character.charCount(c);
                end = this.pos;
            } else if (c == '.') {
                ++this.pos;
            } else {
                break;
            }
        }
        this.pos = end; // trailing dots are not part of the label
        return this.input.substring(start, end);
    }

    private String lexName(final int line, final int column) {
        final int start = this.pos;
        final int first = peek(0);
        if (!TurtleUtil.isPNCharsU(first) && !isDigit(first)) {
            throw error("Invalid variable name", line, column);
        }
        this.pos += Character.charCount(first);
        while (TurtleUtil.isPNChars(peek(0))) {
            this.pos += Character.charCount(peek(0));
        }
        return this.input.substring(start, this.pos);
    }

    private Token lexWord(final int line, final int column) {

        final int start = this.pos;
        int end = start;
        while (true) {
            final int c = peek(0);
            if (TurtleUtil.isPNChars(c)) {
                this.pos += Character.charCount(c);
                end = this.pos;
            } else if (c == '.') {
                ++this.pos;
            } else {
                break;
            }
        }

        if (peek(0) == ':') {
            final String prefix = this.input.substring(start, this.pos);
            if (!TurtleUtil.isPrefix(prefix)) {
                throw error("Invalid prefix '" + prefix + "'", line, column);
            }
            ++this.pos;
            return lexPrefixedName(prefix, line, column);
        }

        this.pos = end;
        final String word = this.input.substring(start, end);
        if (word.equals("a")) {
            return new Token(TokenType.A, word, null, line, column);
        } else if (word.equals("true") || word.equals("false")) {
            return new Token(TokenType.BOOLEAN, word, null, line, column);
        }
        final String upper = word.toUpperCase(Locale.ROOT);
        if (upper.equals("PREFIX")) {
            return new Token(TokenType.PREFIX, word, null, line, column);
        } else if (upper.equals("BASE")) {
            return new Token(TokenType.BASE, word, null, line, column);
        } else if (upper.equals("GRAPH")) {
            return new Token(TokenType.GRAPH, word, null, line, column);
        } else if (this.n3 && (word.equals("has") || word.equals("is") || word.equals("of"))) {
            return new Token(TokenType.KEYWORD, word, null, line, column);
        }
        throw error("Unexpected word '" + word + "'", line, column);
    }

    private Token lexPrefixedName(final String prefix, final int line, final int column) {

        final int first = peek(0);
        if (first == -1 || !(TurtleUtil.isPNCharsU(first) || first == ':' || isDigit(first)
                || first == '%' || first == '\\')) {
            return new Token(TokenType.PNAME_NS, prefix, null, line, column);
        }

        final StringBuilder builder = new StringBuilder();
        int end = this.pos;
        int endLength = 0;
        boolean firstChar = true;
        while (true) {
            final int c = peek(0);
            if (c == '%') {
                final int h1 = peek(1);
                final int h2 = peek(2);
                if (!TurtleUtil.isHex(h1) || !TurtleUtil.isHex(h2)) {
                    throw error("Invalid percent-encoding in local name", this.line,
                            getColumn());
                }
                builder.append('%').append((char) h1).append((char) h2);
                this.pos += 3;
            } else if (c == '\\') {
                final int e = peek(1);
                if (e == -1 || !TurtleUtil.isLocalEscapable(e)) {
                    throw error("Invalid escape sequence in local name", this.line,
                            getColumn());
                }
                builder.append((char) e);
                this.pos += 2;
            } else if (c == '.' && !firstChar) {
                builder.append('.');
                ++this.pos;
                firstChar = false;
                continue;
            } else if (c != -1 && (firstChar ? TurtleUtil.isPNCharsU(c) || isDigit(c)
                    : TurtleUtil.isPNChars(c)) || c == ':') {
                builder.appendCodePoint(c);
                this.pos += Character.charCount(c);
            } else {
                break;
            }
            firstChar = false;
            end = this.pos;
            endLength = builder.length();
        }

        this.pos = end; // trailing dots are not part of the local name
        builder.setLength(endLength);
        return new Token(TokenType.PNAME_LN, prefix, builder.toString(), line, column);
    }

    private Token lexNumber(final int line, final int column) {

        final int start = this.pos;
        if (peek(0) == '+' || peek(0) == '-') {
            ++this.pos;
        }

        final int intStart = this.pos;
        while (isDigit(peek(0))) {
            ++this.pos;
        }
        final boolean hasInteger = this.pos > intStart;

        TokenType type = TokenType.INTEGER;
        if (peek(0) == '.' && isDigit(peek(1))) {
            ++this.pos;
            while (isDigit(peek(0))) {
                ++this.pos;
            }
            type = TokenType.DECIMAL;
        } else if (peek(0) == '.' && hasInteger && isExponent(1)) {
            ++this.pos;
            type = TokenType.DECIMAL;
        }

        if (!hasInteger && type == TokenType.INTEGER) {
            throw error("Invalid number", line, column);
        }

        if (isExponent(0)) {
            ++this.pos;
            if (peek(0) == '+' || peek(0) == '-') {
                ++this.pos;
            }
            while (isDigit(peek(0))) {
                ++this.pos;
            }
            type = TokenType.DOUBLE;
        }

        return new Token(type, this.input.substring(start, this.pos), null, line, column);
    }

    private boolean isExponent(final int offset) {
        final int c = peek(offset);
        if (c != 'e' && c != 'E') {
            return false;
        }
        final int next = peek(offset + 1);
        return isDigit(next) || (next == '+' || next == '-') && isDigit(peek(offset + 2));
    }

    private void skipWhitespaceAndComments() {
        while (true) {
            final int c = peek(0);
            if (c == '\n' || c == '\r') {
                consumeNewline(c);
            } else if (c == ' ' || c == '\t') {
                ++this.pos;
            } else if (c == '#') {
                while (peek(0) != -1 && peek(0) != '\n' && peek(0) != '\r') {
                    ++this.pos;
                }
            } else {
                return;
            }
        }
    }

    private void consumeNewline(final int c) {
        ++this.pos;
        if (c == '\r' && peek(0) == '\n') {
            ++this.pos;
        }
        ++this.line;
        this.lineStart = this.pos;
    }

    private int peek(final int offset) {
        final int index = this.pos + offset;
        return index < this.input.length() ? this.input.codePointAt(index) : -1;
    }

    private boolean isDelimiter(final int c) {
        return c == -1 || TurtleUtil.isWhitespace(c);
    }

    private static boolean isDigit(final int c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(final int c) {
        return c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z';
    }

    private static String describe(final int c) {
        if (c >= 0x20 && c < 0x7F) {
            return "'" + (char) c + "'";
        }
        return String.format("U+%04X", c);
    }

    private static LexException error(final String reason, final int line, final int column) {
        return new LexException(reason, line, column);
    }

}
