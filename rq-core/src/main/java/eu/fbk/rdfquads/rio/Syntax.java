package eu.fbk.rdfquads.rio;

import java.util.List;
import java.util.Locale;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * The RDF text syntaxes supported by this library.
 */
public enum Syntax {

    /** Line-based N-Triples syntax, default graph only. */
    NTRIPLES("N-Triples", "application/n-triples", false, "nt"),

    /** Line-based N-Quads syntax. */
    NQUADS("N-Quads", "application/n-quads", true, "nq", "nquads"),

    /** Turtle syntax. */
    TURTLE("Turtle", "text/turtle", false, "ttl", "turtle"),

    /** TriG syntax, i.e., Turtle plus named graph blocks. */
    TRIG("TriG", "application/trig", true, "trig"),

    /** Notation3 syntax, restricted to the constructs expressible as quads. */
    N3("N3", "text/n3", false, "n3");

    private final String label;

    private final String mimeType;

    private final boolean supportsGraphs;

    private final List<String> extensions;

    private Syntax(final String label, final String mimeType, final boolean supportsGraphs,
            final String... extensions) {
        this.label = label;
        this.mimeType = mimeType;
        this.supportsGraphs = supportsGraphs;
        this.extensions = ImmutableList.copyOf(extensions);
    }

    public String getLabel() {
        return this.label;
    }

    public String getMimeType() {
        return this.mimeType;
    }

    /**
     * Returns whether the syntax can express named graphs.
     *
     * @return true for N-Quads and TriG
     */
    public boolean supportsGraphs() {
        return this.supportsGraphs;
    }

    /**
     * Returns the file extensions associated to the syntax, the preferred one first.
     *
     * @return an immutable list of extensions, without leading dot
     */
    public List<String> getExtensions() {
        return this.extensions;
    }

    /**
     * Returns whether the syntax is one of the Turtle family (Turtle, TriG, N3), handled by
     * {@link TurtleParser}, rather than a line-based syntax handled by {@link NQuadsParser}.
     *
     * @return true for Turtle, TriG and N3
     */
    public boolean isTurtleFamily() {
        return this == TURTLE || this == TRIG || this == N3;
    }

    /**
     * Detects the syntax of a file based on its extension. A trailing {@code .gz} extension is
     * ignored.
     *
     * @param fileName
     *            the file name or path
     * @return the detected syntax, or null if the extension is not recognized
     */
    @Nullable
    public static Syntax forFileName(final String fileName) {
        Preconditions.checkNotNull(fileName);
        String name = fileName.toLowerCase(Locale.ROOT);
        if (name.endsWith(".gz")) {
            name = name.substring(0, name.length() - 3);
        }
        final int index = name.lastIndexOf('.');
        if (index < 0) {
            return null;
        }
        final String extension = name.substring(index + 1);
        for (final Syntax syntax : values()) {
            if (syntax.extensions.contains(extension)) {
                return syntax;
            }
        }
        return null;
    }

    /**
     * Returns the syntax matching a label, name, MIME type or extension, case insensitively.
     *
     * @param string
     *            the string identifying the syntax
     * @return the matching syntax
     * @throws IllegalArgumentException
     *             if no syntax matches
     */
    public static Syntax valueOfAny(final String string) {
        final String s = string.trim();
        for (final Syntax syntax : values()) {
            if (syntax.name().equalsIgnoreCase(s) || syntax.label.equalsIgnoreCase(s)
                    || syntax.mimeType.equalsIgnoreCase(s)
                    || syntax.extensions.contains(s.toLowerCase(Locale.ROOT))) {
                return syntax;
            }
        }
        throw new IllegalArgumentException("Unknown syntax: " + string);
    }

    @Override
    public String toString() {
        return this.label;
    }

}
