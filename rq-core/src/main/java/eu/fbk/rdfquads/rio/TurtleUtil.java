package eu.fbk.rdfquads.rio;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import com.google.common.io.ByteStreams;
import com.google.common.io.CharStreams;

/**
 * Character classes of the Turtle grammar and input decoding helpers shared by lexer, parsers and
 * writers.
 */
public final class TurtleUtil {

    private static final char BOM = '\uFEFF';

    private TurtleUtil() {
    }

    public static boolean isWhitespace(final int c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    public static boolean isPNCharsBase(final int c) {
        return c >= 'A' && c <= 'Z' || c >= 'a' && c <= 'z' || c >= 0x00C0 && c <= 0x00D6
                || c >= 0x00D8 && c <= 0x00F6 || c >= 0x00F8 && c <= 0x02FF || c >= 0x0370
                && c <= 0x037D || c >= 0x037F && c <= 0x1FFF || c >= 0x200C && c <= 0x200D
                || c >= 0x2070 && c <= 0x218F || c >= 0x2C00 && c <= 0x2FEF || c >= 0x3001
                && c <= 0xD7FF || c >= 0xF900 && c <= 0xFDCF || c >= 0xFDF0 && c <= 0xFFFD
                || c >= 0x10000 && c <= 0xEFFFF;
    }

    public static boolean isPNCharsU(final int c) {
        return isPNCharsBase(c) || c == '_';
    }

    public static boolean isPNChars(final int c) {
        return isPNCharsU(c) || c == '-' || c >= '0' && c <= '9' || c == 0x00B7 || c >= 0x0300
                && c <= 0x036F || c >= 0x203F && c <= 0x2040;
    }

    public static boolean isHex(final int c) {
        return c >= '0' && c <= '9' || c >= 'a' && c <= 'f' || c >= 'A' && c <= 'F';
    }

    /**
     * Checks whether a character can be escaped with a backslash in a local name.
     *
     * @param c
     *            the character following the backslash
     * @return true if the escape is allowed
     */
    public static boolean isLocalEscapable(final int c) {
        return "_~.-!$&'()*+,;=/?#@%".indexOf(c) >= 0;
    }

    /**
     * Checks whether a string is a valid prefix ({@code PN_PREFIX} or the empty prefix).
     *
     * @param prefix
     *            the prefix, without colon
     * @return true if valid
     */
    public static boolean isPrefix(final String prefix) {
        final int length = prefix.length();
        if (length == 0) {
            return true;
        }
        if (!isPNCharsBase(prefix.codePointAt(0)) || prefix.charAt(length - 1) == '.') {
            return false;
        }
        for (int i = Character.charCount(prefix.codePointAt(0)); i < length;) {
            final int c = prefix.codePointAt(i);
            if (!isPNChars(c) && c != '.') {
                return false;
            }
            i += Character.charCount(c);
        }
        return true;
    }

    /**
     * Checks whether a string can be written as an unescaped local name ({@code PN_LOCAL} without
     * escapes and percent encodings).
     *
     * @param name
     *            the candidate local name
     * @return true if the name can be written as is after a prefix
     */
    public static boolean isLocalName(final String name) {
        final int length = name.length();
        if (length == 0) {
            return true;
        }
        final int first = name.codePointAt(0);
        if (!isPNCharsU(first) && first != ':' && !(first >= '0' && first <= '9')
                || name.charAt(length - 1) == '.') {
            return false;
        }
        for (int i = Character.charCount(first); i < length;) {
            final int c = name.codePointAt(i);
            if (!isPNChars(c) && c != '.' && c != ':') {
                return false;
            }
            i += Character.charCount(c);
        }
        return true;
    }

    /**
     * Reads a UTF-8 stream into a string, reporting malformed byte sequences as a
     * {@code LexException} at the position where they occur. A leading byte order mark is
     * dropped.
     *
     * @param stream
     *            the stream to read, not closed by this method
     * @return the decoded text
     * @throws IOException
     *             on I/O failure
     * @throws LexException
     *             if the stream does not contain valid UTF-8
     */
    public static String read(final InputStream stream) throws IOException {
        final byte[] bytes = ByteStreams.toByteArray(stream);
        final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        final ByteBuffer in = ByteBuffer.wrap(bytes);
        final CharBuffer out = CharBuffer.allocate(bytes.length + 1);
        CoderResult result = decoder.decode(in, out, true);
        if (!result.isError()) {
            result = decoder.flush(out);
        }
        out.flip();
        if (result.isError()) {
            final String text = out.toString();
            int line = 1;
            int column = 1;
            for (int i = 0; i < text.length(); ++i) {
                if (text.charAt(i) == '\n') {
                    ++line;
                    column = 1;
                } else {
                    ++column;
                }
            }
            throw new LexException("Invalid UTF-8 sequence at byte offset " + in.position(),
                    line, column);
        }
        return stripBOM(out.toString());
    }

    /**
     * Reads a character stream into a string, dropping a leading byte order mark.
     *
     * @param reader
     *            the reader, not closed by this method
     * @return the text read
     * @throws IOException
     *             on I/O failure
     */
    public static String read(final Reader reader) throws IOException {
        return stripBOM(CharStreams.toString(reader));
    }

    private static String stripBOM(final String text) {
        return !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
    }

}
