package eu.fbk.rdfquads.internal;

import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import info.aduna.net.ParsedURI;

/**
 * IRI helpers: absolute IRI detection, RFC 3986 reference resolution and character checks.
 */
public final class IRIs {

    private static final Pattern SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.\\-]*:");

    private IRIs() {
    }

    /**
     * Checks whether the supplied string starts with a scheme, i.e., it is an absolute IRI.
     *
     * @param string
     *            the string to check
     * @return true if absolute
     */
    public static boolean isAbsolute(@Nullable final String string) {
        return string != null && SCHEME.matcher(string).find();
    }

    /**
     * Checks whether a code point can appear unescaped inside an IRI reference, according to
     * the {@code IRIREF} production shared by Turtle, TriG, N-Triples and N-Quads.
     *
     * @param c
     *            the code point
     * @return true if allowed
     */
    public static boolean isAllowedChar(final int c) {
        return c > 0x20 && c != '<' && c != '>' && c != '"' && c != '{' && c != '}'
                && c != '|' && c != '^' && c != '`' && c != '\\';
    }

    /**
     * Resolves a reference against a base IRI following RFC 3986, section 5.2. An absolute
     * reference is returned unchanged apart from dot-segment removal on its path.
     * <p>
     * Parsing and merging of the components is delegated to Sesame's {@link ParsedURI}, whose
     * normalization follows RFC 2396; dot segments are then removed as RFC 3986 prescribes, so
     * that {@code ..} segments never climb above the root.
     * </p>
     *
     * @param base
     *            the base IRI, which must be absolute if the reference is relative
     * @param reference
     *            the reference to resolve
     * @return the resolved IRI
     * @throws IllegalArgumentException
     *             if the reference is relative and the base is null or relative
     */
    public static String resolve(@Nullable final String base, final String reference) {

        Preconditions.checkNotNull(reference);

        ParsedURI uri = new ParsedURI(reference);
        if (!isAbsolute(reference)) {
            Preconditions.checkArgument(isAbsolute(base), "Cannot resolve relative IRI <%s> "
                    + "against base <%s>", reference, base);
            uri = new ParsedURI(base).resolve(uri);
        }
        if (uri.isOpaque()) {
            return uri.toString();
        }

        final String path = uri.getPath();
        return recompose(uri.getScheme(), uri.getAuthority(), path == null ? ""
                : removeDotSegments(path), uri.getQuery(), uri.getFragment());
    }

    static String removeDotSegments(final String path) {
        if (path.indexOf('.') < 0) {
            return path;
        }
        final StringBuilder output = new StringBuilder(path.length());
        String input = path;
        while (!input.isEmpty()) {
            if (input.startsWith("../")) {
                input = input.substring(3);
            } else if (input.startsWith("./")) {
                input = input.substring(2);
            } else if (input.startsWith("/./")) {
                input = input.substring(2);
            } else if (input.equals("/.")) {
                input = "/";
            } else if (input.startsWith("/../")) {
                input = input.substring(3);
                removeLastSegment(output);
            } else if (input.equals("/..")) {
                input = "/";
                removeLastSegment(output);
            } else if (input.equals(".") || input.equals("..")) {
                input = "";
            } else {
                final int start = input.startsWith("/") ? 1 : 0;
                int end = input.indexOf('/', start);
                if (end < 0) {
                    end = input.length();
                }
                output.append(input, 0, end);
                input = input.substring(end);
            }
        }
        return output.toString();
    }

    private static void removeLastSegment(final StringBuilder output) {
        final int index = output.lastIndexOf("/");
        output.setLength(index < 0 ? 0 : index);
    }

    private static String recompose(final String scheme, @Nullable final String authority,
            final String path, @Nullable final String query, @Nullable final String fragment) {
        final StringBuilder builder = new StringBuilder();
        builder.append(scheme).append(':');
        if (authority != null) {
            builder.append("//").append(authority);
        }
        builder.append(path);
        if (query != null) {
            builder.append('?').append(query);
        }
        if (fragment != null) {
            builder.append('#').append(fragment);
        }
        return builder.toString();
    }

}
