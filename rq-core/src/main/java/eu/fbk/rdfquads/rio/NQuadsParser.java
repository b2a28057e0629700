package eu.fbk.rdfquads.rio;

import java.io.IOException;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.rdfquads.data.Handler;
import eu.fbk.rdfquads.data.IRI;
import eu.fbk.rdfquads.data.Literal;
import eu.fbk.rdfquads.data.Quad;
import eu.fbk.rdfquads.data.Resource;
import eu.fbk.rdfquads.data.Term;
import eu.fbk.rdfquads.data.TermFactory;
import eu.fbk.rdfquads.internal.IRIs;
import eu.fbk.rdfquads.vocabulary.RDF;

/**
 * Parser for the line-based N-Triples and N-Quads syntaxes.
 * <p>
 * The parser scans the document in a single pass, one statement per line. Blank lines and
 * {@code #} comments are ignored. IRIs must be absolute; blank node labels are scoped to the
 * document and replaced by fresh blank nodes created with the configured {@link TermFactory}, or
 * with a new factory for each document if none is configured. A graph term is accepted only in
 * N-Quads mode; statements without it belong to the default graph (or to the default graph
 * specified at construction time, if any).
 * </p>
 */
public final class NQuadsParser extends QuadParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(NQuadsParser.class);

    private final Syntax syntax;

    @Nullable
    private final TermFactory termFactory;

    @Nullable
    private final Resource defaultGraph;

    private String text;

    private int pos;

    private int line;

    private int lineStart;

    private ParseContext context;

    private StringBuilder builder;

    public NQuadsParser(final Syntax syntax, @Nullable final TermFactory termFactory,
            @Nullable final Resource defaultGraph) {
        Preconditions.checkArgument(syntax == Syntax.NTRIPLES || syntax == Syntax.NQUADS,
                "Unsupported syntax %s", syntax);
        this.syntax = syntax;
        this.termFactory = termFactory;
        this.defaultGraph = defaultGraph;
    }

    public static NQuadsParser create(final Syntax syntax) {
        return new NQuadsParser(syntax, null, null);
    }

    @Override
    public Syntax getSyntax() {
        return this.syntax;
    }

    @Override
    ParseContext newContext() {
        // blank nodes of each document are minted by a fresh factory unless one is configured
        final TermFactory factory = this.termFactory != null ? this.termFactory : TermFactory
                .create();
        return new ParseContext(factory, null, this.defaultGraph);
    }

    @Override
    void doParse(final String text, final ParseContext context,
            final Handler<? super Quad> handler) throws IOException {

        this.text = text;
        this.pos = 0;
        this.line = 1;
        this.lineStart = 0;
        this.context = context;
        this.builder = new StringBuilder(256);

        try {
            int count = 0;
            while (true) {
                skipWhitespace();
                final int c = peek();
                if (c == -1) {
                    break;
                } else if (c == '#') {
                    skipComment();
                } else if (c == '\r' || c == '\n') {
                    skipNewline();
                } else {
                    emit(handler, parseQuad());
                    ++count;
                }
            }
            LOGGER.debug("Parsed {} document: {} statements", this.syntax, count);
        } finally {
            this.text = null;
            this.context = null;
            this.builder = null;
        }
    }

    private Quad parseQuad() {

        final Resource subject = parseResource();
        skipWhitespace();

        final IRI predicate = parseIRI();
        skipWhitespace();

        final Term object = parseValue();
        skipWhitespace();

        Resource graph = this.context.getGraph();
        if (peek() != '.') {
            if (this.syntax != Syntax.NQUADS) {
                throw unexpected("'.'");
            }
            graph = parseResource();
            skipWhitespace();
        }

        if (peek() != '.') {
            throw unexpected("'.'");
        }
        ++this.pos;
        skipWhitespace();
        if (peek() == '#') {
            skipComment();
        }
        final int c = peek();
        if (c != -1 && c != '\r' && c != '\n') {
            throw unexpected("end of line");
        }

        return new Quad(subject, predicate, object, graph);
    }

    private Term parseValue() {
        final int c = peek();
        if (c == '<') {
            return parseIRI();
        } else if (c == '_') {
            return parseBNode();
        } else if (c == '"') {
            return parseLiteral();
        }
        throw unexpected("IRI, blank node or literal");
    }

    private Resource parseResource() {
        final int c = peek();
        if (c == '<') {
            return parseIRI();
        } else if (c == '_') {
            return parseBNode();
        }
        throw unexpected("IRI or blank node");
    }

    private IRI parseIRI() {
        if (peek() != '<') {
            throw unexpected("IRI");
        }
        final int line = this.line;
        final int column = column();
        ++this.pos;
        this.builder.setLength(0);
        while (true) {
            final int c = peek();
            if (c == '>') {
                ++this.pos;
                break;
            } else if (c == -1 || c == '\r' || c == '\n') {
                throw new LexException("Unterminated IRI", line, column);
            } else if (c == '\\') {
                final int escapeColumn = column();
                ++this.pos;
                if (peek() != 'u' && peek() != 'U') {
                    throw new LexException("Invalid escape sequence in IRI", this.line,
                            escapeColumn);
                }
                final int cp = parseNumericEscape(escapeColumn);
                if (!IRIs.isAllowedChar(cp)) {
                    throw new LexException("Escape sequence denotes a character not allowed "
                            + "in IRIs", this.line, escapeColumn);
                }
                this.builder.appendCodePoint(cp);
            } else if (c == '%' && (!TurtleUtil.isHex(charAt(this.pos + 1))
                    || !TurtleUtil.isHex(charAt(this.pos + 2)))) {
                throw new LexException("Invalid percent-encoding in IRI", this.line, column());
            } else if (!IRIs.isAllowedChar(c)) {
                throw new LexException("Character not allowed in IRI: " + describe(c),
                        this.line, column());
            } else {
                this.builder.appendCodePoint(c);
                this.pos += Character.charCount(c);
            }
        }
        final String iri = this.builder.toString();
        if (!IRIs.isAbsolute(iri)) {
            throw new ResolutionException("Relative IRI <" + iri + "> not allowed in "
                    + this.syntax, line, column);
        }
        return this.context.getTermFactory().createIRI(iri);
    }

    private Resource parseBNode() {
        final int line = this.line;
        final int column = column();
        if (!this.text.startsWith("_:", this.pos)) {
            throw unexpected("blank node");
        }
        this.pos += 2;
        final int first = peek();
        if (first == -1 || !TurtleUtil.isPNCharsU(first) && !(first >= '0' && first <= '9')) {
            throw new LexException("Invalid blank node label", line, column);
        }
        final int start = this.pos;
        this.pos += Character.charCount(first);
        int end = this.pos;
        while (true) {
            final int c = peek();
            if (c != -1 && TurtleUtil.isPNChars(c)) {
                this.pos += Character.charCount(c);
                end = this.pos;
            } else if (c == '.') {
                ++this.pos;
            } else {
                break;
            }
        }
        this.pos = end;
        return this.context.resolveBNode(this.text.substring(start, end));
    }

    private Literal parseLiteral() {
        final int line = this.line;
        final int column = column();
        ++this.pos; // skip '"'
        this.builder.setLength(0);
        while (true) {
            final int c = peek();
            if (c == '"') {
                ++this.pos;
                break;
            } else if (c == -1 || c == '\r' || c == '\n') {
                throw new LexException("Unterminated string", line, column);
            } else if (c == '\\') {
                this.builder.appendCodePoint(parseStringEscape());
            } else {
                this.builder.appendCodePoint(c);
                this.pos += Character.charCount(c);
            }
        }
        final String label = this.builder.toString();

        if (peek() == '@') {
            final int tagColumn = column();
            ++this.pos;
            final int start = this.pos;
            while (true) {
                final int c = peek();
                if (c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || c >= '0' && c <= '9'
                        || c == '-') {
                    ++this.pos;
                } else {
                    break;
                }
            }
            final String language = this.text.substring(start, this.pos);
            if (!language.matches("[a-zA-Z]+(-[a-zA-Z0-9]+)*")) {
                throw new LexException("Invalid language tag '" + language + "'", this.line,
                        tagColumn);
            }
            return this.context.getTermFactory().createLiteral(label, language);

        } else if (peek() == '^') {
            if (!this.text.startsWith("^^", this.pos)) {
                throw unexpected("'^^'");
            }
            this.pos += 2;
            final int dtLine = this.line;
            final int dtColumn = column();
            final IRI datatype = parseIRI();
            if (datatype.equals(RDF.LANG_STRING)) {
                throw new LexException("Datatype rdf:langString requires a language tag",
                        dtLine, dtColumn);
            }
            return this.context.getTermFactory().createLiteral(label, datatype);
        }

        return this.context.getTermFactory().createLiteral(label);
    }

    private int parseStringEscape() {
        final int column = column();
        ++this.pos; // skip '\'
        final int c = peek();
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
            return parseNumericEscape(column);
        default:
            throw new LexException("Invalid escape sequence", this.line, column);
        }
    }

    private int parseNumericEscape(final int column) {
        final int digits = peek() == 'u' ? 4 : 8;
        ++this.pos;
        if (this.pos + digits > this.text.length()) {
            throw new LexException("Truncated numeric escape sequence", this.line, column);
        }
        long cp = 0;
        for (int i = 0; i < digits; ++i) {
            final char h = this.text.charAt(this.pos + i);
            if (!TurtleUtil.isHex(h)) {
                throw new LexException("Invalid hex digit in numeric escape sequence",
                        this.line, column);
            }
            cp = cp * 16 + Character.digit(h, 16);
        }
        if (cp > Character.MAX_CODE_POINT) {
            throw new LexException("Numeric escape sequence out of Unicode range", this.line,
                    column);
        } else if (cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE) {
            throw new LexException("Numeric escape sequence denotes a surrogate code point",
                    this.line, column);
        }
        this.pos += digits;
        return (int) cp;
    }

    private void skipWhitespace() {
        int c = peek();
        while (c == ' ' || c == '\t') {
            ++this.pos;
            c = peek();
        }
    }

    private void skipComment() {
        int c = peek();
        while (c != -1 && c != '\r' && c != '\n') {
            this.pos += Character.charCount(c);
            c = peek();
        }
    }

    private void skipNewline() {
        final int c = peek();
        ++this.pos;
        if (c == '\r' && peek() == '\n') {
            ++this.pos;
        }
        ++this.line;
        this.lineStart = this.pos;
    }

    private int peek() {
        return this.pos < this.text.length() ? this.text.codePointAt(this.pos) : -1;
    }

    private int charAt(final int index) {
        return index < this.text.length() ? this.text.charAt(index) : -1;
    }

    private int column() {
        return this.pos - this.lineStart + 1;
    }

    private SyntaxException unexpected(final String expected) {
        final int c = peek();
        final String found = c == -1 ? "end of input" : c == '\r' || c == '\n' ? "end of line"
                : describe(c);
        return new SyntaxException(expected, found, this.line, column());
    }

    private static String describe(final int c) {
        if (c >= 0x20 && c < 0x7F) {
            return "'" + (char) c + "'";
        }
        return String.format("U+%04X", c);
    }

}
