package eu.fbk.rdfquads.rio;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.rdfquads.data.BNode;
import eu.fbk.rdfquads.data.Handler;
import eu.fbk.rdfquads.data.IRI;
import eu.fbk.rdfquads.data.Literal;
import eu.fbk.rdfquads.data.ParseException;
import eu.fbk.rdfquads.data.Quad;
import eu.fbk.rdfquads.data.Resource;
import eu.fbk.rdfquads.data.Term;
import eu.fbk.rdfquads.data.TermFactory;
import eu.fbk.rdfquads.internal.IRIs;
import eu.fbk.rdfquads.vocabulary.LOG;
import eu.fbk.rdfquads.vocabulary.OWL;
import eu.fbk.rdfquads.vocabulary.RDF;
import eu.fbk.rdfquads.vocabulary.XSD;

/**
 * Recursive descent parser for Turtle, TriG and the subset of N3 that can be represented as
 * quads.
 * <p>
 * Instances are created via {@link #builder(Syntax)}. The parser reads tokens from a
 * {@link TurtleLexer} with at most two tokens of lookahead and emits the statements of each
 * top-level statement of the document once it is complete, so a statement is never partially
 * emitted. Statements outside TriG graph blocks are assigned to the default graph configured in
 * the builder (null, i.e., the default graph, if not set).
 * </p>
 * <p>
 * N3 formulas, variables, quantifiers, paths and {@code @keywords} cannot be represented as quads
 * and cause an {@link UnsupportedConstructException}. With {@link Policy#SKIP} the statement
 * containing the construct is skipped entirely (and logged), and parsing continues with the next
 * statement; with {@link Policy#FAIL} (the default) the whole parse fails.
 * </p>
 */
public final class TurtleParser extends QuadParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(TurtleParser.class);

    /** How to deal with constructs that cannot be represented as quads. */
    public enum Policy {

        /** Abort the parse throwing an {@link UnsupportedConstructException}. */
        FAIL,

        /** Skip the enclosing statement, logging a warning. */
        SKIP

    }

    private final Syntax syntax;

    @Nullable
    private final String baseIRI;

    @Nullable
    private final Resource defaultGraph;

    @Nullable
    private final TermFactory termFactory;

    private final Policy policy;

    // per-parse state, reset by doParse()

    private TurtleLexer lexer;

    private Token token;

    @Nullable
    private Token lookahead;

    private int depth;

    private ParseContext context;

    private List<Quad> pending;

    private int statements;

    private int skipped;

    private TurtleParser(final Builder builder) {
        this.syntax = builder.syntax;
        this.baseIRI = builder.baseIRI;
        this.defaultGraph = builder.defaultGraph;
        this.termFactory = builder.termFactory;
        this.policy = MoreObjects.firstNonNull(builder.policy, Policy.FAIL);
    }

    /**
     * Returns a parser for the syntax specified, with default settings.
     *
     * @param syntax
     *            one of {@code TURTLE}, {@code TRIG}, {@code N3}
     * @return the created parser
     */
    public static TurtleParser create(final Syntax syntax) {
        return builder(syntax).build();
    }

    public static Builder builder(final Syntax syntax) {
        return new Builder(syntax);
    }

    @Override
    public Syntax getSyntax() {
        return this.syntax;
    }

    @Nullable
    public String getBaseIRI() {
        return this.baseIRI;
    }

    @Nullable
    public Resource getDefaultGraph() {
        return this.defaultGraph;
    }

    public Policy getUnsupportedPolicy() {
        return this.policy;
    }

    @Override
    ParseContext newContext() {
        // blank nodes of each document are minted by a fresh factory unless one is configured
        final TermFactory factory = this.termFactory != null ? this.termFactory : TermFactory
                .create();
        return new ParseContext(factory, this.baseIRI, this.defaultGraph);
    }

    @Override
    void doParse(final String text, final ParseContext context,
            final Handler<? super Quad> handler) throws IOException {

        this.lexer = new TurtleLexer(text, this.syntax == Syntax.N3);
        this.token = this.lexer.next();
        this.lookahead = null;
        this.depth = 0;
        this.context = context;
        this.pending = new ArrayList<Quad>();
        this.statements = 0;
        this.skipped = 0;

        try {
            int quads = 0;
            while (!this.token.is(TokenType.EOF)) {
                if (parseStatement(0)) {
                    for (final Quad quad : this.pending) {
                        emit(handler, quad);
                    }
                    quads += this.pending.size();
                }
                this.pending.clear();
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Parsed {} document: {} statements, {} quads, {} prefixes, "
                        + "{} statements skipped", this.syntax, this.statements, quads, context
                        .getPrefixes().size(), this.skipped);
            }
        } finally {
            this.lexer = null;
            this.token = null;
            this.lookahead = null;
            this.context = null;
            this.pending = null;
        }
    }

    // STATEMENTS

    /**
     * Parses a statement, possibly skipping it if it contains unsupported constructs and the
     * policy is SKIP.
     *
     * @param baseDepth
     *            the bracket nesting depth at the beginning of the statement
     * @return true if the statement was parsed, false if it was skipped
     */
    private boolean parseStatement(final int baseDepth) {
        final Token start = this.token;
        final int mark = this.pending.size();
        try {
            if (baseDepth == 0) {
                parseTopLevelStatement();
            } else {
                parseTriples();
            }
            ++this.statements;
            return true;
        } catch (final UnsupportedConstructException ex) {
            if (this.policy == Policy.FAIL) {
                throw ex;
            }
            LOGGER.warn("Skipping statement at line {}, column {}: {}", start.getLine(),
                    start.getColumn(), ex.getMessage());
            ++this.skipped;
            this.pending.subList(mark, this.pending.size()).clear();
            skipStatement(baseDepth);
            return false;
        }
    }

    private void skipStatement(final int baseDepth) {
        while (true) {
            if (this.token.is(TokenType.EOF)) {
                return;
            } else if (this.depth == baseDepth && this.token.is(TokenType.DOT)) {
                consume();
                return;
            } else if (this.depth == baseDepth && this.token.is(TokenType.RBRACE)) {
                return;
            } else if (this.depth < baseDepth) {
                return;
            }
            consume();
        }
    }

    private void parseTopLevelStatement() {
        final TokenType type = this.token.getType();
        if (type == TokenType.PREFIX) {
            parsePrefix();
        } else if (type == TokenType.BASE) {
            parseBase();
        } else if (type == TokenType.KEYWORD) {
            final String keyword = this.token.getText();
            if (keyword.equals("forAll") || keyword.equals("forSome")) {
                throw unsupported("N3 quantifier @" + keyword);
            } else if (keyword.equals("keywords")) {
                throw unsupported("N3 @keywords directive");
            }
            parseTriples();
            expect(TokenType.DOT, "'.'");
        } else if (this.syntax == Syntax.TRIG) {
            parseTrigBlock();
        } else {
            parseTriples();
            expect(TokenType.DOT, "'.'");
        }
    }

    private void parsePrefix() {
        final Token keyword = consume();
        final Token prefix = expect(TokenType.PNAME_NS, "prefix name");
        final Token namespace = expect(TokenType.IRIREF, "namespace IRI");
        final IRI iri = this.context.resolveIRI(namespace.getText(), namespace.getLine(),
                namespace.getColumn());
        if (keyword.getText().startsWith("@")) {
            expect(TokenType.DOT, "'.'");
        }
        this.context.setPrefix(prefix.getText(), iri.stringValue());
    }

    private void parseBase() {
        final Token keyword = consume();
        final Token base = expect(TokenType.IRIREF, "base IRI");
        final IRI iri = this.context.resolveIRI(base.getText(), base.getLine(),
                base.getColumn());
        if (keyword.getText().startsWith("@")) {
            expect(TokenType.DOT, "'.'");
        }
        this.context.setBaseIRI(iri.stringValue());
    }

    private void parseTrigBlock() {
        final TokenType type = this.token.getType();
        if (type == TokenType.GRAPH) {
            consume();
            final Resource graph = parseGraphLabel();
            parseWrappedGraph(graph);
        } else if (type == TokenType.LBRACE) {
            parseWrappedGraph(this.defaultGraph);
        } else if (type == TokenType.IRIREF || type == TokenType.PNAME_LN
                || type == TokenType.PNAME_NS || type == TokenType.BLANK_NODE_LABEL
                || type == TokenType.LBRACKET && peek2().is(TokenType.RBRACKET)) {
            final Resource label = parseGraphLabel();
            if (this.token.is(TokenType.LBRACE)) {
                parseWrappedGraph(label);
            } else {
                parsePredicateObjectList(label);
                expect(TokenType.DOT, "'.' or '{'");
            }
        } else {
            parseTriples();
            expect(TokenType.DOT, "'.'");
        }
    }

    private Resource parseGraphLabel() {
        final TokenType type = this.token.getType();
        if (type == TokenType.LBRACKET && peek2().is(TokenType.RBRACKET)) {
            consume();
            consume();
            return this.context.newBNode();
        } else if (type == TokenType.BLANK_NODE_LABEL) {
            return this.context.resolveBNode(consume().getText());
        } else if (type == TokenType.IRIREF || type == TokenType.PNAME_LN
                || type == TokenType.PNAME_NS) {
            return parseIRI();
        }
        throw unexpected("graph name");
    }

    private void parseWrappedGraph(@Nullable final Resource graph) {
        expect(TokenType.LBRACE, "'{'");
        final Resource oldGraph = this.context.getGraph();
        this.context.setGraph(graph);
        try {
            while (!this.token.is(TokenType.RBRACE)) {
                if (!parseStatement(this.depth)) {
                    continue;
                } else if (this.token.is(TokenType.DOT)) {
                    consume();
                } else if (!this.token.is(TokenType.RBRACE)) {
                    throw unexpected("'.' or '}'");
                }
            }
            expect(TokenType.RBRACE, "'}'");
        } finally {
            this.context.setGraph(oldGraph);
        }
    }

    // TRIPLES

    private void parseTriples() {
        if (this.token.is(TokenType.LBRACKET) && !peek2().is(TokenType.RBRACKET)) {
            final Resource subject = parseBlankNodePropertyList();
            if (!this.token.is(TokenType.DOT) && !this.token.is(TokenType.RBRACE)
                    && !this.token.is(TokenType.EOF)) {
                parsePredicateObjectList(subject);
            }
        } else {
            final Resource subject = parseSubject();
            parsePredicateObjectList(subject);
        }
    }

    private void parsePredicateObjectList(final Resource subject) {
        parseVerbObjectList(subject);
        while (this.token.is(TokenType.SEMICOLON)) {
            while (this.token.is(TokenType.SEMICOLON)) {
                consume();
            }
            if (isVerbStart()) {
                parseVerbObjectList(subject);
            }
        }
    }

    private void parseVerbObjectList(final Resource subject) {
        final Token start = this.token;
        final Verb verb = parseVerb();
        while (true) {
            final Term object = parseObject();
            if (!verb.inverse) {
                emit(subject, verb.predicate, object);
            } else if (object instanceof Resource) {
                emit((Resource) object, verb.predicate, subject);
            } else {
                throw new UnsupportedConstructException("Literal " + object
                        + " cannot be the subject of inverse property " + verb.predicate,
                        start.getLine(), start.getColumn());
            }
            if (!this.token.is(TokenType.COMMA)) {
                break;
            }
            consume();
        }
    }

    private boolean isVerbStart() {
        switch (this.token.getType()) {
        case IRIREF:
        case PNAME_LN:
        case PNAME_NS:
        case A:
            return true;
        case EQUALS:
        case IMPLIES:
        case IMPLIED_BY:
        case KEYWORD:
        case VARIABLE:
        case BLANK_NODE_LABEL:
        case LBRACKET:
            return this.syntax == Syntax.N3;
        default:
            return false;
        }
    }

    private Verb parseVerb() {
        switch (this.token.getType()) {
        case A:
            consume();
            return new Verb(RDF.TYPE, false);
        case IRIREF:
        case PNAME_LN:
        case PNAME_NS:
            return new Verb(checkNoPath(parseIRI()), false);
        default:
            if (this.syntax == Syntax.N3) {
                return parseN3Verb();
            }
            throw unexpected("predicate");
        }
    }

    private Verb parseN3Verb() {
        final Token t = this.token;
        switch (t.getType()) {
        case EQUALS:
            consume();
            return new Verb(OWL.SAME_AS, false);
        case IMPLIES:
            consume();
            return new Verb(LOG.IMPLIES, false);
        case IMPLIED_BY:
            consume();
            return new Verb(LOG.IMPLIES, true);
        case KEYWORD:
            if (t.getText().equals("a")) {
                consume();
                return new Verb(RDF.TYPE, false);
            } else if (t.getText().equals("has")) {
                consume();
                return new Verb(parseN3Predicate(), false);
            } else if (t.getText().equals("is")) {
                consume();
                final IRI predicate = parseN3Predicate();
                if (!this.token.is(TokenType.KEYWORD) || !this.token.getText().equals("of")) {
                    throw unexpected("'of'");
                }
                consume();
                return new Verb(predicate, true);
            }
            throw unexpected("predicate");
        case VARIABLE:
            throw unsupported("N3 variable ?" + t.getText());
        case BLANK_NODE_LABEL:
        case LBRACKET:
            throw unsupported("Blank node in predicate position");
        default:
            throw unexpected("predicate");
        }
    }

    private IRI parseN3Predicate() {
        final TokenType type = this.token.getType();
        if (type == TokenType.IRIREF || type == TokenType.PNAME_LN
                || type == TokenType.PNAME_NS) {
            return checkNoPath(parseIRI());
        } else if (type == TokenType.A) {
            consume();
            return RDF.TYPE;
        } else if (type == TokenType.VARIABLE) {
            throw unsupported("N3 variable ?" + this.token.getText());
        } else if (type == TokenType.BLANK_NODE_LABEL || type == TokenType.LBRACKET) {
            throw unsupported("Blank node in predicate position");
        }
        throw unexpected("predicate");
    }

    // TERMS

    private Resource parseSubject() {
        final Token t = this.token;
        switch (t.getType()) {
        case IRIREF:
        case PNAME_LN:
        case PNAME_NS:
            return checkNoPath(parseIRI());
        case BLANK_NODE_LABEL:
            consume();
            return checkNoPath(this.context.resolveBNode(t.getText()));
        case LBRACKET:
            return checkNoPath(parseBlankNodePropertyList());
        case LPAREN:
            return checkNoPath(parseCollection());
        default:
            if (this.syntax == Syntax.N3) {
                checkN3Term();
                if (isLiteralStart()) {
                    throw unsupported("Literal in subject position");
                }
            }
            throw unexpected("subject");
        }
    }

    private Term parseObject() {
        final Token t = this.token;
        switch (t.getType()) {
        case IRIREF:
        case PNAME_LN:
        case PNAME_NS:
            return checkNoPath(parseIRI());
        case BLANK_NODE_LABEL:
            consume();
            return checkNoPath(this.context.resolveBNode(t.getText()));
        case LBRACKET:
            return checkNoPath(parseBlankNodePropertyList());
        case LPAREN:
            return checkNoPath(parseCollection());
        case STRING_LITERAL:
        case INTEGER:
        case DECIMAL:
        case DOUBLE:
        case BOOLEAN:
            return checkNoPath(parseLiteral());
        default:
            if (this.syntax == Syntax.N3) {
                checkN3Term();
            }
            throw unexpected("object");
        }
    }

    private boolean isLiteralStart() {
        switch (this.token.getType()) {
        case STRING_LITERAL:
        case INTEGER:
        case DECIMAL:
        case DOUBLE:
        case BOOLEAN:
            return true;
        default:
            return false;
        }
    }

    private void checkN3Term() {
        if (this.token.is(TokenType.LBRACE)) {
            throw unsupported("N3 formula");
        } else if (this.token.is(TokenType.VARIABLE)) {
            throw unsupported("N3 variable ?" + this.token.getText());
        }
    }

    private <T extends Term> T checkNoPath(final T term) {
        if (this.token.is(TokenType.PATH)) {
            throw unsupported("N3 path expression '" + this.token.getText() + "'");
        }
        return term;
    }

    private IRI parseIRI() {
        final Token t = consume();
        switch (t.getType()) {
        case IRIREF:
            return this.context.resolveIRI(t.getText(), t.getLine(), t.getColumn());
        case PNAME_LN:
            return this.context.resolvePrefixedName(t.getText(), t.getLocalName(), t.getLine(),
                    t.getColumn());
        case PNAME_NS:
            return this.context.resolvePrefixedName(t.getText(), "", t.getLine(),
                    t.getColumn());
        default:
            throw new SyntaxException("IRI", t.toString(), t.getLine(), t.getColumn());
        }
    }

    private BNode parseBlankNodePropertyList() {
        expect(TokenType.LBRACKET, "'['");
        final BNode bnode = this.context.newBNode();
        if (!this.token.is(TokenType.RBRACKET)) {
            parsePredicateObjectList(bnode);
        }
        expect(TokenType.RBRACKET, "']'");
        return bnode;
    }

    private Resource parseCollection() {
        expect(TokenType.LPAREN, "'('");
        final List<Term> items = new ArrayList<Term>();
        while (!this.token.is(TokenType.RPAREN)) {
            if (this.token.is(TokenType.EOF)) {
                throw unexpected("')'");
            }
            items.add(parseObject());
        }
        consume();
        if (items.isEmpty()) {
            return RDF.NIL;
        }
        final BNode head = this.context.newBNode();
        BNode node = head;
        for (int i = 0; i < items.size(); ++i) {
            emit(node, RDF.FIRST, items.get(i));
            if (i < items.size() - 1) {
                final BNode next = this.context.newBNode();
                emit(node, RDF.REST, next);
                node = next;
            } else {
                emit(node, RDF.REST, RDF.NIL);
            }
        }
        return head;
    }

    private Literal parseLiteral() {
        final Token t = consume();
        final TermFactory factory = this.context.getTermFactory();
        switch (t.getType()) {
        case INTEGER:
            return factory.createLiteral(t.getText(), XSD.INTEGER);
        case DECIMAL:
            return factory.createLiteral(t.getText(), XSD.DECIMAL);
        case DOUBLE:
            return factory.createLiteral(t.getText(), XSD.DOUBLE);
        case BOOLEAN:
            return factory.createLiteral(t.getText(), XSD.BOOLEAN);
        default:
            break;
        }
        if (this.token.is(TokenType.LANGTAG)) {
            return factory.createLiteral(t.getText(), consume().getText());
        } else if (this.token.is(TokenType.DATATYPE)) {
            consume();
            final Token dt = this.token;
            final IRI datatype = parseIRI();
            try {
                return factory.createLiteral(t.getText(), datatype);
            } catch (final IllegalArgumentException ex) {
                throw new ParseException(ex.getMessage(), dt.getLine(), dt.getColumn(), ex);
            }
        }
        return factory.createLiteral(t.getText());
    }

    // TOKENS

    private void emit(final Resource subject, final IRI predicate, final Term object) {
        this.pending.add(new Quad(subject, predicate, object, this.context.getGraph()));
    }

    private Token consume() {
        final Token t = this.token;
        if (this.lookahead != null) {
            this.token = this.lookahead;
            this.lookahead = null;
        } else if (!t.is(TokenType.EOF)) {
            this.token = this.lexer.next();
        }
        switch (t.getType()) {
        case LBRACKET:
        case LPAREN:
        case LBRACE:
            ++this.depth;
            break;
        case RBRACKET:
        case RPAREN:
        case RBRACE:
            --this.depth;
            break;
        default:
            break;
        }
        return t;
    }

    private Token peek2() {
        if (this.lookahead == null) {
            this.lookahead = this.token.is(TokenType.EOF) ? this.token : this.lexer.next();
        }
        return this.lookahead;
    }

    private Token expect(final TokenType type, final String expected) {
        if (!this.token.is(type)) {
            throw unexpected(expected);
        }
        return consume();
    }

    private SyntaxException unexpected(final String expected) {
        return new SyntaxException(expected, this.token.toString(), this.token.getLine(),
                this.token.getColumn());
    }

    private UnsupportedConstructException unsupported(final String construct) {
        return new UnsupportedConstructException(construct + " cannot be represented as quads",
                this.token.getLine(), this.token.getColumn());
    }

    private static final class Verb {

        final IRI predicate;

        final boolean inverse;

        Verb(final IRI predicate, final boolean inverse) {
            this.predicate = predicate;
            this.inverse = inverse;
        }

    }

    public static final class Builder {

        final Syntax syntax;

        @Nullable
        String baseIRI;

        @Nullable
        Resource defaultGraph;

        @Nullable
        TermFactory termFactory;

        @Nullable
        Policy policy;

        Builder(final Syntax syntax) {
            Preconditions.checkArgument(syntax.isTurtleFamily(), "Unsupported syntax %s",
                    syntax);
            this.syntax = syntax;
        }

        /**
         * Sets the initial base IRI, used to resolve relative IRIs until a base directive is
         * found. It must be absolute.
         *
         * @param baseIRI
         *            the base IRI, null for none
         * @return this builder, for call chaining
         */
        public Builder baseIRI(@Nullable final String baseIRI) {
            Preconditions.checkArgument(baseIRI == null
                    || IRIs.isAbsolute(baseIRI),
                    "Base IRI must be absolute: %s", baseIRI);
            this.baseIRI = baseIRI;
            return this;
        }

        public Builder defaultGraph(@Nullable final Resource defaultGraph) {
            this.defaultGraph = defaultGraph;
            return this;
        }

        public Builder termFactory(@Nullable final TermFactory termFactory) {
            this.termFactory = termFactory;
            return this;
        }

        public Builder unsupportedPolicy(@Nullable final Policy policy) {
            this.policy = policy;
            return this;
        }

        public TurtleParser build() {
            return new TurtleParser(this);
        }

    }

}
