package eu.fbk.rdfquads.data;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import eu.fbk.rdfquads.internal.Util;
import eu.fbk.rdfquads.vocabulary.RDF;
import eu.fbk.rdfquads.vocabulary.XSD;

/**
 * A literal: a label plus either a language tag or a datatype.
 * <p>
 * The datatype of a literal is never null: plain literals get datatype {@code xsd:string} and
 * language-tagged literals get datatype {@code rdf:langString}. Language tags are normalized to
 * lower case, so that {@code "x"@EN} and {@code "x"@en} denote the same literal. An explicit
 * datatype different from {@code rdf:langString} cannot be combined with a language tag.
 * </p>
 * <p>
 * Typed accessors ({@link #booleanValue()}, {@link #longValue()}, ...) convert the label using
 * the XML Schema lexical rules, independently of the datatype.
 * </p>
 */
public final class Literal extends Term {

    private static final long serialVersionUID = 1L;

    private final String label;

    @Nullable
    private final String language;

    private final IRI datatype;

    private transient String ntriples;

    Literal(final String label, @Nullable final String language, @Nullable final IRI datatype) {
        Preconditions.checkNotNull(label);
        if (language != null) {
            Preconditions.checkArgument(datatype == null || datatype.equals(RDF.LANG_STRING),
                    "Cannot combine language '%s' and datatype %s", language, datatype);
            Preconditions.checkArgument(isLanguageTag(language), "Invalid language tag: %s",
                    language);
            this.label = label;
            this.language = language.toLowerCase(Locale.ROOT);
            this.datatype = RDF.LANG_STRING;
        } else {
            Preconditions.checkArgument(datatype == null || !datatype.equals(RDF.LANG_STRING),
                    "Datatype %s requires a language", datatype);
            this.label = label;
            this.language = null;
            this.datatype = datatype != null ? datatype : XSD.STRING;
        }
    }

    static boolean isLanguageTag(final String string) {
        final int length = string.length();
        boolean start = true;
        boolean primary = true;
        for (int i = 0; i < length; ++i) {
            final char c = string.charAt(i);
            if (c == '-') {
                if (start || i == length - 1) {
                    return false;
                }
                start = true;
                primary = false;
            } else if (c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || !primary && c >= '0'
                    && c <= '9') {
                start = false;
            } else {
                return false;
            }
        }
        return length > 0;
    }

    /**
     * Returns the literal label.
     *
     * @return the label, possibly empty
     */
    public String getLabel() {
        return this.label;
    }

    /**
     * Returns the lower-case language tag, if any.
     *
     * @return the language, or null for a non language-tagged literal
     */
    @Nullable
    public String getLanguage() {
        return this.language;
    }

    /**
     * Returns the datatype.
     *
     * @return the datatype, never null
     */
    public IRI getDatatype() {
        return this.datatype;
    }

    /**
     * Returns true if this is a plain {@code xsd:string} literal.
     *
     * @return true for simple literals
     */
    public boolean isSimple() {
        return this.datatype.equals(XSD.STRING);
    }

    @Override
    public String stringValue() {
        return this.label;
    }

    public boolean booleanValue() {
        final String s = this.label.trim();
        if ("true".equals(s) || "1".equals(s)) {
            return true;
        } else if ("false".equals(s) || "0".equals(s)) {
            return false;
        }
        throw new IllegalArgumentException("Not a boolean: " + this.label);
    }

    public long longValue() {
        final String s = this.label.trim();
        return Long.parseLong(s.startsWith("+") ? s.substring(1) : s);
    }

    public BigInteger integerValue() {
        final String s = this.label.trim();
        return new BigInteger(s.startsWith("+") ? s.substring(1) : s);
    }

    public BigDecimal decimalValue() {
        return new BigDecimal(this.label.trim());
    }

    public double doubleValue() {
        final String s = this.label.trim();
        if ("INF".equals(s) || "+INF".equals(s)) {
            return Double.POSITIVE_INFINITY;
        } else if ("-INF".equals(s)) {
            return Double.NEGATIVE_INFINITY;
        } else if ("NaN".equals(s)) {
            return Double.NaN;
        }
        return Double.parseDouble(s);
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Literal)) {
            return false;
        }
        final Literal other = (Literal) object;
        return this.label.equals(other.label) && this.datatype.equals(other.datatype)
                && Objects.equals(this.language, other.language);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.label, this.language, this.datatype);
    }

    @Override
    public String toString() {
        if (this.ntriples == null) {
            final StringBuilder builder = new StringBuilder(this.label.length() + 16);
            Util.appendLiteral(builder, this, false);
            this.ntriples = builder.toString();
        }
        return this.ntriples;
    }

}
