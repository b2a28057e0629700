package eu.fbk.rdfquads.tool;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.google.common.escape.Escaper;
import com.google.common.html.HtmlEscapers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.rdfquads.data.ParseException;
import eu.fbk.rdfquads.internal.CommandLine;
import eu.fbk.rdfquads.rio.RDFIO;
import eu.fbk.rdfquads.rio.TurtleUtil;

/**
 * Renders a grammar in the EBNF notation of W3C recommendations as an HTML table.
 * <p>
 * The grammar is a sequence of productions {@code [n] name ::= expression}, where the number is
 * optional and the expression may continue on subsequent indented lines. {@code /* ... *}{@code /}
 * comments are ignored, a {@code @terminals} line starts the section of terminal productions and
 * {@code @pass} lines are skipped. Each production becomes a table row with anchor
 * {@code prod-name}; references to productions in expressions link to those anchors, while
 * quoted strings, character classes and {@code #xN} code points are rendered as {@code code}.
 * </p>
 */
public final class Bnf2Html {

    private static final Logger LOGGER = LoggerFactory.getLogger(Bnf2Html.class);

    private static final Pattern PRODUCTION = Pattern
            .compile("^\\s*(?:\\[([0-9A-Za-z]+)\\]\\s*)?([A-Za-z_][A-Za-z0-9_]*)\\s*::=(.*)$");

    private static final Escaper ESCAPER = HtmlEscapers.htmlEscaper();

    private Bnf2Html() {
    }

    public static void main(final String... args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    public static int run(final String[] args, final InputStream in, final PrintStream out,
            final PrintStream err) {

        final CommandLine cmd;
        try {
            cmd = CommandLine
                    .parser()
                    .withName("rq-bnf2html")
                    .withHeader("Renders a W3C EBNF grammar as an HTML table with linked "
                            + "production names.")
                    .withOption("t", "title", "the title of the HTML document", "TEXT",
                            CommandLine.Type.STRING, false, false)
                    .withOption("o", "output", "the output file (default: standard output)",
                            "FILE", CommandLine.Type.FILE, false, false)
                    .withFooter("The grammar is read from the file given, or from standard "
                            + "input if no file or '-' is given.")
                    .withLogger(LoggerFactory.getLogger("eu.fbk.rdfquads")).withOutput(out)
                    .parse(args);
            if (cmd.getArgCount() > 1) {
                throw new CommandLine.Exception("at most one input file can be specified");
            }
        } catch (final CommandLine.Exception ex) {
            return CommandLine.fail(ex, err);
        }

        final String input = cmd.getArgCount() == 0 ? "-" : cmd.getArg(0, String.class);
        final String title = cmd.getOptionValue("t", String.class, "Grammar");
        final File output = cmd.getOptionValue("o", File.class);

        final String html;
        try {
            final String text;
            if ("-".equals(input)) {
                text = TurtleUtil.read(in);
            } else {
                final InputStream stream = RDFIO.open(new File(input));
                try {
                    text = TurtleUtil.read(stream);
                } finally {
                    stream.close();
                }
            }
            final List<Production> productions = parse(text);
            LOGGER.info("{} productions read from {}", productions.size(), input);
            html = render(productions, title);
        } catch (final ParseException ex) {
            err.println(input + ":" + ex.getLine() + ":" + ex.getColumn() + ": "
                    + ex.getReason());
            return CommandLine.EXIT_FAILURE;
        } catch (final IOException ex) {
            err.println(input + ": " + ex.getMessage());
            return CommandLine.EXIT_FAILURE;
        }

        try {
            final OutputStream stream = output == null ? out : new FileOutputStream(
                    output);
            try {
                final Writer writer = new OutputStreamWriter(stream, Charsets.UTF_8);
                writer.write(html);
                writer.flush();
            } finally {
                if (output != null) {
                    stream.close();
                }
            }
        } catch (final IOException ex) {
            err.println((output != null ? output.toString() : "standard output") + ": "
                    + ex.getMessage());
            return CommandLine.EXIT_FAILURE;
        }
        return CommandLine.EXIT_OK;
    }

    /**
     * Parses a grammar.
     *
     * @param text
     *            the grammar text
     * @return the productions, in document order
     * @throws ParseException
     *             on lines that are neither productions, continuations, comments nor
     *             directives, and on unterminated comments
     */
    public static List<Production> parse(final String text) {

        final String[] lines = stripComments(text).split("\r\n|\r|\n", -1);
        final List<Production> productions = Lists.newArrayList();
        boolean terminal = false;
        boolean skipping = false;
        String number = null;
        String name = null;
        StringBuilder expression = null;
        int start = 0;

        for (int i = 0; i < lines.length; ++i) {
            final String line = lines[i];
            final String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            final Matcher matcher = PRODUCTION.matcher(line);
            final boolean directive = trimmed.startsWith("@");
            if (matcher.matches() || directive) {
                if (name != null) {
                    productions.add(new Production(number, name, expression.toString().trim(),
                            terminal, start));
                    name = null;
                }
                skipping = false;
                if (directive) {
                    final String keyword = trimmed.split("\\s+")[0];
                    if (keyword.equals("@terminals")) {
                        terminal = true;
                    } else if (keyword.equals("@pass")) {
                        skipping = true;
                    } else {
                        throw new ParseException("Unknown directive " + keyword, i + 1,
                                line.indexOf('@') + 1);
                    }
                    continue;
                }
                number = matcher.group(1);
                name = matcher.group(2);
                expression = new StringBuilder(matcher.group(3).trim());
                start = i + 1;
            } else if (Character.isWhitespace(line.charAt(0)) && (name != null || skipping)) {
                if (name != null) {
                    expression.append(' ').append(trimmed);
                }
            } else {
                throw new ParseException("Expected production '[n] name ::= expression', found '"
                        + trimmed + "'", i + 1, line.indexOf(trimmed.charAt(0)) + 1);
            }
        }
        if (name != null) {
            productions.add(new Production(number, name, expression.toString().trim(),
                    terminal, start));
        }
        return ImmutableList.copyOf(productions);
    }

    /**
     * Renders productions as an HTML document.
     *
     * @param productions
     *            the productions to render
     * @param title
     *            the document title
     * @return the HTML document
     */
    public static String render(final Iterable<Production> productions, final String title) {

        final Set<String> names = Sets.newHashSet();
        for (final Production production : productions) {
            names.add(production.getName());
        }

        final StringBuilder out = new StringBuilder();
        out.append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"UTF-8\">\n<title>");
        out.append(ESCAPER.escape(title));
        out.append("</title>\n</head>\n<body>\n<table class=\"grammar\">\n<tbody>\n");
        boolean terminals = false;
        for (final Production production : productions) {
            if (production.isTerminal() && !terminals) {
                out.append("</tbody>\n<tbody class=\"terminals\">\n");
                terminals = true;
            }
            out.append("<tr id=\"prod-").append(ESCAPER.escape(production.getName()))
                    .append("\">\n");
            out.append("<td>");
            if (production.getNumber() != null) {
                out.append('[').append(ESCAPER.escape(production.getNumber())).append(']');
            }
            out.append("</td>\n<td><code>").append(ESCAPER.escape(production.getName()));
            out.append("</code></td>\n<td>::=</td>\n<td>");
            renderExpression(production.getExpression(), names, out);
            out.append("</td>\n</tr>\n");
        }
        out.append("</tbody>\n</table>\n</body>\n</html>\n");
        return out.toString();
    }

    private static void renderExpression(final String expr, final Set<String> names,
            final StringBuilder out) {
        int i = 0;
        final int length = expr.length();
        while (i < length) {
            final char c = expr.charAt(i);
            if (c == '\'' || c == '"') {
                int end = expr.indexOf(c, i + 1);
                end = end < 0 ? length : end + 1;
                out.append("<code>").append(ESCAPER.escape(expr.substring(i, end)))
                        .append("</code>");
                i = end;
            } else if (c == '[') {
                // a backslash in a character class is a literal character, not an escape
                final int close = expr.indexOf(']', i + 1);
                final int end = close < 0 ? length : close + 1;
                out.append("<code>").append(ESCAPER.escape(expr.substring(i, end)))
                        .append("</code>");
                i = end;
            } else if (c == '#' && i + 1 < length && expr.charAt(i + 1) == 'x') {
                int end = i + 2;
                while (end < length && TurtleUtil.isHex(expr.charAt(end))) {
                    ++end;
                }
                out.append("<code>").append(expr, i, end).append("</code>");
                i = end;
            } else if (Character.isLetter(c) || c == '_') {
                int end = i + 1;
                while (end < length
                        && (Character.isLetterOrDigit(expr.charAt(end)) || expr.charAt(end) == '_')) {
                    ++end;
                }
                final String name = expr.substring(i, end);
                if (names.contains(name)) {
                    out.append("<a href=\"#prod-").append(name).append("\">").append(name)
                            .append("</a>");
                } else {
                    out.append(ESCAPER.escape(name));
                }
                i = end;
            } else {
                out.append(ESCAPER.escape(String.valueOf(c)));
                ++i;
            }
        }
    }

    private static String stripComments(final String text) {
        final StringBuilder builder = new StringBuilder(text.length());
        int line = 1;
        int column = 1;
        int i = 0;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if (c == '/' && text.startsWith("/*", i)) {
                final int end = text.indexOf("*/", i + 2);
                if (end < 0) {
                    throw new ParseException("Unterminated comment", line, column);
                }
                for (int j = i; j < end + 2; ++j) {
                    final char d = text.charAt(j);
                    builder.append(d == '\n' || d == '\r' ? d : ' ');
                    if (d == '\n') {
                        ++line;
                        column = 1;
                    } else {
                        ++column;
                    }
                }
                i = end + 2;
            } else if (c == '\'' || c == '"') {
                // quoted "/*" is a terminal, not a comment
                final int end = text.indexOf(c, i + 1);
                final int stop = end < 0 || text.substring(i, end).indexOf('\n') >= 0 ? i + 1
                        : end + 1;
                builder.append(text, i, stop);
                column += stop - i;
                i = stop;
            } else {
                builder.append(c);
                if (c == '\n') {
                    ++line;
                    column = 1;
                } else {
                    ++column;
                }
                ++i;
            }
        }
        return builder.toString();
    }

    /**
     * A grammar production.
     */
    public static final class Production {

        @Nullable
        private final String number;

        private final String name;

        private final String expression;

        private final boolean terminal;

        private final int line;

        Production(@Nullable final String number, final String name, final String expression,
                final boolean terminal, final int line) {
            this.number = number;
            this.name = Preconditions.checkNotNull(name);
            this.expression = Preconditions.checkNotNull(expression);
            this.terminal = terminal;
            this.line = line;
        }

        @Nullable
        public String getNumber() {
            return this.number;
        }

        public String getName() {
            return this.name;
        }

        public String getExpression() {
            return this.expression;
        }

        public boolean isTerminal() {
            return this.terminal;
        }

        public int getLine() {
            return this.line;
        }

        @Override
        public String toString() {
            return (this.number == null ? "" : "[" + this.number + "] ") + this.name + " ::= "
                    + this.expression;
        }

    }

}
