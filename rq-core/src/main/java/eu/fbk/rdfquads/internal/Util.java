package eu.fbk.rdfquads.internal;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Properties;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.rdfquads.data.Literal;

public final class Util {

    private static final Logger LOGGER = LoggerFactory.getLogger(Util.class);

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private Util() {
    }

    public static String getVersion(final String groupId, final String artifactId,
            final String defaultValue) {
        final URL url = Util.class.getClassLoader().getResource(
                "META-INF/maven/" + groupId + "/" + artifactId + "/pom.properties");
        String version = defaultValue;
        if (url != null) {
            try {
                final InputStream stream = url.openStream();
                try {
                    final Properties properties = new Properties();
                    properties.load(stream);
                    version = properties.getProperty("version").trim();
                } finally {
                    stream.close();
                }
            } catch (final IOException ex) {
                version = "unknown";
            }
        }
        return version;
    }

    @Nullable
    public static <T> T closeQuietly(@Nullable final T object) {
        if (object instanceof Closeable) {
            try {
                ((Closeable) object).close();
            } catch (final Throwable ex) {
                LOGGER.error("Error closing " + object.getClass().getSimpleName(), ex);
            }
        }
        return object;
    }

    /**
     * Appends an IRI in N-Triples syntax, i.e., {@code <iri>}. Characters not allowed in an
     * {@code IRIREF} are written as {@code \}{@code uXXXX} escapes; if {@code ascii} is set, the
     * same happens for all non-ASCII characters.
     *
     * @param builder
     *            the builder to append to
     * @param iri
     *            the IRI string
     * @param ascii
     *            true to produce ASCII-only output
     */
    public static void appendIRI(final StringBuilder builder, final String iri,
            final boolean ascii) {
        builder.append('<');
        final int length = iri.length();
        for (int i = 0; i < length;) {
            final int c = iri.codePointAt(i);
            if (!IRIs.isAllowedChar(c) || ascii && c > 0x7E) {
                appendCodePointEscape(builder, c);
            } else {
                builder.appendCodePoint(c);
            }
            i += Character.charCount(c);
        }
        builder.append('>');
    }

    /**
     * Appends a literal in N-Triples syntax. The {@code xsd:string} datatype is left implicit.
     *
     * @param builder
     *            the builder to append to
     * @param literal
     *            the literal
     * @param ascii
     *            true to produce ASCII-only output
     */
    public static void appendLiteral(final StringBuilder builder, final Literal literal,
            final boolean ascii) {
        builder.append('"');
        appendEscaped(builder, literal.getLabel(), ascii);
        builder.append('"');
        final String language = literal.getLanguage();
        if (language != null) {
            builder.append('@').append(language);
        } else if (!literal.isSimple()) {
            builder.append('^').append('^');
            appendIRI(builder, literal.getDatatype().stringValue(), ascii);
        }
    }

    /**
     * Appends a string escaping {@code "}, {@code \}, newline, carriage return, tab and other
     * control characters; if {@code ascii} is set, non-ASCII characters are escaped too.
     *
     * @param builder
     *            the builder to append to
     * @param string
     *            the string to escape
     * @param ascii
     *            true to produce ASCII-only output
     */
    public static void appendEscaped(final StringBuilder builder, final String string,
            final boolean ascii) {
        final int length = string.length();
        for (int i = 0; i < length;) {
            final int c = string.codePointAt(i);
            switch (c) {
            case '\\':
                builder.append('\\').append('\\');
                break;
            case '"':
                builder.append('\\').append('"');
                break;
            case '\n':
                builder.append('\\').append('n');
                break;
            case '\r':
                builder.append('\\').append('r');
                break;
            case '\t':
                builder.append('\\').append('t');
                break;
            default:
                if (c < 0x20 || c == 0x7F || ascii && c > 0x7F) {
                    appendCodePointEscape(builder, c);
                } else {
                    builder.appendCodePoint(c);
                }
            }
            i += Character.charCount(c);
        }
    }

    private static void appendCodePointEscape(final StringBuilder builder, final int c) {
        if (c <= 0xFFFF) {
            builder.append('\\').append('u');
            appendHex(builder, c, 4);
        } else {
            builder.append('\\').append('U');
            appendHex(builder, c, 8);
        }
    }

    private static void appendHex(final StringBuilder builder, final int value, final int digits) {
        for (int shift = (digits - 1) * 4; shift >= 0; shift -= 4) {
            builder.append(HEX[value >> shift & 0xF]);
        }
    }

}
