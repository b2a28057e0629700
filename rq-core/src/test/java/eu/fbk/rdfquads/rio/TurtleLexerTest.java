package eu.fbk.rdfquads.rio;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import org.junit.Assert;
import org.junit.Test;

public class TurtleLexerTest {

    @Test
    public void testPunctuationAndPositions() {
        final TurtleLexer lexer = new TurtleLexer("<http://ex.org/s>\n  ex:p [ ] ;\n", false);
        Token token = lexer.next();
        Assert.assertEquals(TokenType.IRIREF, token.getType());
        Assert.assertEquals("http://ex.org/s", token.getText());
        Assert.assertEquals(1, token.getLine());
        Assert.assertEquals(1, token.getColumn());
        token = lexer.next();
        Assert.assertEquals(TokenType.PNAME_LN, token.getType());
        Assert.assertEquals("ex", token.getText());
        Assert.assertEquals("p", token.getLocalName());
        Assert.assertEquals(2, token.getLine());
        Assert.assertEquals(3, token.getColumn());
        Assert.assertEquals(ImmutableList.of(TokenType.LBRACKET, TokenType.RBRACKET,
                TokenType.SEMICOLON, TokenType.EOF), types(lexer));
        Assert.assertTrue(lexer.next().is(TokenType.EOF));
    }

    @Test
    public void testNumbers() {
        Assert.assertEquals(ImmutableList.of(TokenType.INTEGER, TokenType.INTEGER,
                TokenType.DECIMAL, TokenType.DECIMAL, TokenType.DOUBLE, TokenType.DOUBLE,
                TokenType.INTEGER, TokenType.DOT, TokenType.EOF), types(new TurtleLexer(
                "42 -7 +3.14 .5 1e10 1.E-3 9.", false)));
        final TurtleLexer lexer = new TurtleLexer("-7", false);
        Assert.assertEquals("-7", lexer.next().getText());
    }

    @Test
    public void testStrings() {
        final TurtleLexer lexer = new TurtleLexer("'a\\tb' \"\\u00E8\" \"\"\"multi\n"
                + "line\"\"\"\"\" '''x'''@en-GB", false);
        Assert.assertEquals("a\tb", lexer.next().getText());
        Assert.assertEquals("\u00e8", lexer.next().getText());
        Assert.assertEquals("multi\nline\"\"", lexer.next().getText());
        Assert.assertEquals("x", lexer.next().getText());
        final Token tag = lexer.next();
        Assert.assertEquals(TokenType.LANGTAG, tag.getType());
        Assert.assertEquals("en-GB", tag.getText());
        Assert.assertEquals(2, tag.getLine());
    }

    @Test
    public void testPrefixedNames() {
        final TurtleLexer lexer = new TurtleLexer("ex: :local ex:a.b. ex:a\\-b ex:%41", false);
        Token token = lexer.next();
        Assert.assertEquals(TokenType.PNAME_NS, token.getType());
        Assert.assertEquals("ex", token.getText());
        token = lexer.next();
        Assert.assertEquals("", token.getText());
        Assert.assertEquals("local", token.getLocalName());
        token = lexer.next();
        Assert.assertEquals("a.b", token.getLocalName());
        Assert.assertTrue(lexer.next().is(TokenType.DOT));
        Assert.assertEquals("a-b", lexer.next().getLocalName());
        Assert.assertEquals("%41", lexer.next().getLocalName());
    }

    @Test
    public void testKeywords() {
        Assert.assertEquals(ImmutableList.of(TokenType.PREFIX, TokenType.PNAME_NS,
                TokenType.IRIREF, TokenType.DOT, TokenType.PREFIX, TokenType.BASE,
                TokenType.GRAPH, TokenType.A, TokenType.BOOLEAN, TokenType.BLANK_NODE_LABEL,
                TokenType.DATATYPE, TokenType.EOF), types(new TurtleLexer(
                "@prefix ex: <http://ex.org/> . PREFIX BASE graph a true _:b1 ^^", false)));
    }

    @Test
    public void testN3Tokens() {
        Assert.assertEquals(ImmutableList.of(TokenType.EQUALS, TokenType.IMPLIES,
                TokenType.IMPLIED_BY, TokenType.VARIABLE, TokenType.PATH, TokenType.PATH,
                TokenType.KEYWORD, TokenType.KEYWORD, TokenType.KEYWORD, TokenType.EOF),
                types(new TurtleLexer("= => <= ?x ! ^ is of @forAll", true)));
        try {
            new TurtleLexer("=", false).next();
            Assert.fail();
        } catch (final LexException ex) {
            Assert.assertEquals(1, ex.getLine());
            Assert.assertEquals(1, ex.getColumn());
        }
    }

    @Test
    public void testComments() {
        Assert.assertEquals(ImmutableList.of(TokenType.A, TokenType.EOF), types(new TurtleLexer(
                "# comment\r\n  a # trailing", false)));
    }

    @Test
    public void testErrors() {
        assertLexError("<http://ex.org/a b>", 1, 17);
        assertLexError("\"unterminated", 1, 1);
        assertLexError("\n  'bad \\q escape'", 2, 8);
        assertLexError("\"x\"@123", 1, 4);
        assertLexError("<\\u0020>", 1, 2);
        assertLexError("hello", 1, 1);
        assertLexError("\"\\uD800\"", 1, 2);
    }

    @Test
    public void testPercentEncodingInIRI() {
        final TurtleLexer lexer = new TurtleLexer("<http://ex.org/%C3%A8?x=%2f>", false);
        final Token token = lexer.next();
        Assert.assertEquals(TokenType.IRIREF, token.getType());
        Assert.assertEquals("http://ex.org/%C3%A8?x=%2f", token.getText());
        assertLexError("<http://ex.org/%zz>", 1, 16);
        assertLexError("<http://ex.org/a%4>", 1, 17);
        assertLexError("<http://ex.org/%", 1, 16);
    }

    private static void assertLexError(final String input, final int line, final int column) {
        final TurtleLexer lexer = new TurtleLexer(input, false);
        try {
            while (!lexer.next().is(TokenType.EOF)) {
                continue;
            }
            Assert.fail("Expected lexical error for " + input);
        } catch (final LexException ex) {
            Assert.assertEquals("line of error in " + input, line, ex.getLine());
            Assert.assertEquals("column of error in " + input, column, ex.getColumn());
        }
    }

    private static List<TokenType> types(final TurtleLexer lexer) {
        final List<TokenType> types = Lists.newArrayList();
        while (true) {
            final Token token = lexer.next();
            types.add(token.getType());
            if (token.is(TokenType.EOF)) {
                return types;
            }
        }
    }

}
