package eu.fbk.rdfquads.data;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Charsets;
import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.BiMap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterators;
import com.google.common.collect.Ordering;
import com.google.common.collect.Sets;
import com.google.common.io.Resources;

import eu.fbk.rdfquads.internal.IRIs;
import eu.fbk.rdfquads.internal.Util;
import eu.fbk.rdfquads.rio.Token;
import eu.fbk.rdfquads.rio.TokenType;
import eu.fbk.rdfquads.rio.TurtleLexer;
import eu.fbk.rdfquads.rio.TurtleUtil;
import eu.fbk.rdfquads.vocabulary.RDF;
import eu.fbk.rdfquads.vocabulary.XSD;

/**
 * Helper services for working with the data model.
 * <p>
 * This class provides:
 * </p>
 * <ul>
 * <li>a total ordering over terms, triples and quads ({@link #getTotalComparator()}), matching
 * the canonical order used by quad stores and writers;</li>
 * <li>a map of common prefix-to-namespace mappings ({@link #getNamespaceMap()}), loaded from the
 * {@code prefixes} resource of this package, the possibility to combine it with other maps (
 * {@link #newNamespaceMap(Map, Map)}) and an efficient reverse lookup (
 * {@link #namespaceToPrefix(String, Map)});</li>
 * <li>conversion of terms from and to their Turtle representation (
 * {@link #parseTerm(String, Map)}, {@link #toString(Object, Map)}).</li>
 * </ul>
 */
public final class Data {

    private static final Ordering<Object> TOTAL_ORDERING = new TotalOrdering();

    private static final Map<String, String> COMMON_NAMESPACES;

    private static final Map<String, String> COMMON_PREFIXES;

    static {
        try {
            final ImmutableMap.Builder<String, String> nsToPrefixBuilder;
            final ImmutableMap.Builder<String, String> prefixToNsBuilder;

            nsToPrefixBuilder = ImmutableMap.builder();
            prefixToNsBuilder = ImmutableMap.builder();

            for (final String line : Resources.readLines(Data.class.getResource("prefixes"),
                    Charsets.UTF_8)) {
                if (line.trim().isEmpty() || line.startsWith("#")) {
                    continue;
                }
                final Iterator<String> i = Splitter.on(' ').omitEmptyStrings().split(line)
                        .iterator();
                final String namespace = i.next();
                final String prefix = i.next();
                nsToPrefixBuilder.put(namespace, prefix);
                prefixToNsBuilder.put(prefix, namespace);
                while (i.hasNext()) {
                    prefixToNsBuilder.put(i.next(), namespace);
                }
            }

            COMMON_NAMESPACES = prefixToNsBuilder.build();
            COMMON_PREFIXES = nsToPrefixBuilder.build();

        } catch (final Throwable ex) {
            throw new Error("Unexpected exception (!): " + ex.getMessage(), ex);
        }
    }

    /**
     * Returns a comparator imposing a total order over terms, triples and quads. Objects of the
     * same kind are compared based on their natural ordering, i.e., lexicographically on the
     * N-Quads representation of graph (default graph first), subject, predicate and object;
     * objects of different kinds are sorted with quads first, followed by triples and terms.
     *
     * @return a singleton comparator imposing a total order over objects of the data model
     */
    public static Comparator<Object> getTotalComparator() {
        return TOTAL_ORDERING;
    }

    /**
     * Returns the quads supplied sorted in the canonical serialization order. This is the order of
     * {@link Quad#compareTo(Quad)} except for blank nodes, which are compared first based on the
     * quads they occur in and then on their IDs, so that the order of a document does not depend
     * on the blank node IDs produced when parsing it.
     *
     * @param quads
     *            the quads to sort
     * @return a new list with the sorted quads
     */
    public static List<Quad> canonicalOrder(final Collection<Quad> quads) {
        return Isomorphism.sort(Preconditions.checkNotNull(quads));
    }

    /**
     * Returns a map of common prefix-to-namespace mappings. The returned map provides multiple
     * prefixes for some namespace; it also support fast reverse prefix lookup via
     * {@link #namespaceToPrefix(String, Map)}.
     *
     * @return a singleton map of common prefix-to-namespace mappings
     */
    public static Map<String, String> getNamespaceMap() {
        return COMMON_NAMESPACES;
    }

    /**
     * Creates a new prefix-to-namespace map combining the mappings in the supplied maps. Mappings
     * in the {@code primaryNamespaceMap} take precedence, while the {@code secondaryNamespaceMap}
     * is accessed only if a mapping is not found in the primary map. Modification operations
     * target exclusively the {@code primaryNamespaceMap}.
     *
     * @param primaryNamespaceMap
     *            the primary prefix-to-namespace map, not null
     * @param secondaryNamespaceMap
     *            the secondary prefix-to-namespace map, not null
     * @return the created, combined prefix-to-namespace map
     */
    public static Map<String, String> newNamespaceMap(
            final Map<String, String> primaryNamespaceMap,
            final Map<String, String> secondaryNamespaceMap) {

        Preconditions.checkNotNull(primaryNamespaceMap);
        Preconditions.checkNotNull(secondaryNamespaceMap);

        if (primaryNamespaceMap == secondaryNamespaceMap) {
            return primaryNamespaceMap;
        } else {
            return new NamespaceCombinedMap(primaryNamespaceMap, secondaryNamespaceMap);
        }
    }

    /**
     * Performs a reverse lookup of the prefix corresponding to a namespace in a
     * prefix-to-namespace map, exploiting the features of the map supplied (combined map, Guava
     * {@code BiMap} or the map of common prefixes) where possible.
     *
     * @param namespace
     *            the namespace the corresponding prefix should be looked up
     * @param namespaceMap
     *            the prefix-to-namespace map containing the searched mapping
     * @return the prefix corresponding to the namespace, or null if no mapping is defined
     */
    @Nullable
    public static String namespaceToPrefix(final String namespace,
            final Map<String, String> namespaceMap) {

        Preconditions.checkNotNull(namespace);

        if (namespaceMap == COMMON_NAMESPACES) {
            return COMMON_PREFIXES.get(namespace);

        } else if (namespaceMap instanceof NamespaceCombinedMap) {
            final NamespaceCombinedMap map = (NamespaceCombinedMap) namespaceMap;
            String prefix = namespaceToPrefix(namespace, map.primaryNamespaces);
            if (prefix == null) {
                prefix = namespaceToPrefix(namespace, map.secondaryNamespaces);
                if (prefix != null && map.primaryNamespaces.containsKey(prefix)) {
                    prefix = null; // shadowed by a primary mapping
                }
            }
            return prefix;

        } else if (namespaceMap instanceof BiMap) {
            return ((BiMap<String, String>) namespaceMap).inverse().get(namespace);

        } else {
            Preconditions.checkNotNull(namespaceMap);
            String result = null;
            for (final Map.Entry<String, String> entry : namespaceMap.entrySet()) {
                if (entry.getValue().equals(namespace)
                        && (result == null || entry.getKey().compareTo(result) < 0)) {
                    result = entry.getKey();
                }
            }
            return result;
        }
    }

    /**
     * Parses a term from its Turtle representation: an absolute IRI between angle brackets, a
     * prefixed name (resolved using the namespaces supplied), {@code a}, a blank node (whose
     * label is kept), a quoted literal with optional language or datatype, or a numeric or
     * boolean literal.
     *
     * @param string
     *            the string to parse, possibly null
     * @param namespaces
     *            the optional prefix-to-namespace mappings to use for parsing the string,
     *            possibly null
     * @return the parsed term, or null if a null string was passed as input
     * @throws ParseException
     *             in case parsing fails
     */
    @Nullable
    public static Term parseTerm(@Nullable final String string,
            @Nullable final Map<String, String> namespaces) throws ParseException {

        if (string == null) {
            return null;
        }

        final TermFactory factory = TermFactory.getDefault();
        final TurtleLexer lexer = new TurtleLexer(string, false);
        final Token token = lexer.next();
        Token next = lexer.next();
        final Term term;

        switch (token.getType()) {
        case IRIREF:
        case PNAME_LN:
        case PNAME_NS:
            term = parseIRI(token, namespaces);
            break;
        case A:
            term = RDF.TYPE;
            break;
        case BLANK_NODE_LABEL:
            term = factory.createBNode(token.getText());
            break;
        case INTEGER:
            term = factory.createLiteral(token.getText(), XSD.INTEGER);
            break;
        case DECIMAL:
            term = factory.createLiteral(token.getText(), XSD.DECIMAL);
            break;
        case DOUBLE:
            term = factory.createLiteral(token.getText(), XSD.DOUBLE);
            break;
        case BOOLEAN:
            term = factory.createLiteral(token.getText(), XSD.BOOLEAN);
            break;
        case STRING_LITERAL:
            if (next.is(TokenType.LANGTAG)) {
                term = factory.createLiteral(token.getText(), next.getText());
                next = lexer.next();
            } else if (next.is(TokenType.DATATYPE)) {
                final IRI datatype = parseIRI(lexer.next(), namespaces);
                try {
                    term = factory.createLiteral(token.getText(), datatype);
                } catch (final IllegalArgumentException ex) {
                    throw new ParseException(ex.getMessage(), token.getLine(), token.getColumn(),
                            ex);
                }
                next = lexer.next();
            } else {
                term = factory.createLiteral(token.getText());
            }
            break;
        default:
            throw new ParseException("Not a term: " + string, token.getLine(),
                    token.getColumn());
        }

        if (!next.is(TokenType.EOF)) {
            throw new ParseException("Unexpected " + next + " after term", next.getLine(),
                    next.getColumn());
        }
        return term;
    }

    private static IRI parseIRI(final Token token,
            @Nullable final Map<String, String> namespaces) {
        if (token.is(TokenType.IRIREF)) {
            if (!IRIs.isAbsolute(token.getText())) {
                throw new ParseException("Not an absolute IRI: <" + token.getText() + ">",
                        token.getLine(), token.getColumn());
            }
            return TermFactory.getDefault().createIRI(token.getText());
        } else if (token.is(TokenType.PNAME_LN) || token.is(TokenType.PNAME_NS)) {
            final String namespace = namespaces == null ? null : namespaces.get(token.getText());
            if (namespace == null) {
                throw new ParseException("Undeclared prefix '" + token.getText() + ":'",
                        token.getLine(), token.getColumn());
            }
            final String localName = token.getLocalName();
            return TermFactory.getDefault().createIRI(namespace,
                    localName == null ? "" : localName);
        }
        throw new ParseException("Expected IRI, found " + token, token.getLine(),
                token.getColumn());
    }

    /**
     * Returns the Turtle representation of the supplied term, triple or quad, optionally
     * abbreviating IRIs using the supplied namespaces. Triples and quads are rendered as
     * space-separated terms terminated by a dot.
     *
     * @param object
     *            the term, triple or quad, possibly null
     * @param namespaces
     *            the optional prefix-to-namespace mappings to use for generating the string,
     *            possibly null
     * @return the produced string, or null if a null object was passed as input
     */
    @Nullable
    public static String toString(@Nullable final Object object,
            @Nullable final Map<String, String> namespaces) {

        if (object instanceof Term) {
            final StringBuilder builder = new StringBuilder();
            toString((Term) object, namespaces, builder);
            return builder.toString();

        } else if (object instanceof Triple || object instanceof Quad) {
            final Quad quad = object instanceof Quad ? (Quad) object : ((Triple) object)
                    .inGraph(null);
            final StringBuilder builder = new StringBuilder();
            toString(quad.getSubject(), namespaces, builder);
            builder.append(' ');
            toString(quad.getPredicate(), namespaces, builder);
            builder.append(' ');
            toString(quad.getObject(), namespaces, builder);
            if (quad.getGraph() != null) {
                builder.append(' ');
                toString(quad.getGraph(), namespaces, builder);
            }
            builder.append(" .");
            return builder.toString();

        } else if (object != null) {
            throw new IllegalArgumentException("Unsupported object " + object.getClass());
        }

        return null;
    }

    static void toString(final Term term, @Nullable final Map<String, String> namespaces,
            final StringBuilder builder) {

        if (term instanceof IRI) {
            final IRI iri = (IRI) term;
            String prefix = null;
            if (namespaces != null) {
                prefix = namespaceToPrefix(iri.getNamespace(), namespaces);
            }
            if (prefix != null && TurtleUtil.isLocalName(iri.getLocalName())) {
                builder.append(prefix).append(':').append(iri.getLocalName());
            } else {
                Util.appendIRI(builder, iri.stringValue(), false);
            }

        } else if (term instanceof BNode) {
            builder.append('_').append(':').append(((BNode) term).getID());

        } else {
            final Literal literal = (Literal) term;
            builder.append('\"');
            Util.appendEscaped(builder, literal.getLabel(), false);
            builder.append('\"');
            final String language = literal.getLanguage();
            if (language != null) {
                builder.append('@').append(language);
            } else if (!literal.isSimple()) {
                builder.append('^').append('^');
                toString(literal.getDatatype(), namespaces, builder);
            }
        }
    }

    private Data() {
    }

    private static final class TotalOrdering extends Ordering<Object> {

        @Override
        public int compare(final Object first, final Object second) {
            final int firstRank = rank(first);
            final int secondRank = rank(second);
            if (firstRank != secondRank) {
                return firstRank - secondRank;
            } else if (first instanceof Quad) {
                return ((Quad) first).compareTo((Quad) second);
            } else if (first instanceof Triple) {
                return ((Triple) first).compareTo((Triple) second);
            } else {
                return ((Term) first).compareTo((Term) second);
            }
        }

        private static int rank(final Object object) {
            if (object instanceof Quad) {
                return 0;
            } else if (object instanceof Triple) {
                return 1;
            } else if (object instanceof Term) {
                return 2;
            }
            Preconditions.checkNotNull(object);
            throw new IllegalArgumentException("Unsupported object " + object.getClass());
        }

    }

    private static final class NamespaceCombinedMap extends AbstractMap<String, String> {

        final Map<String, String> primaryNamespaces;

        final Map<String, String> secondaryNamespaces;

        NamespaceCombinedMap(final Map<String, String> primaryNamespaces,
                final Map<String, String> secondaryNamespaces) {

            this.primaryNamespaces = primaryNamespaces;
            this.secondaryNamespaces = secondaryNamespaces;
        }

        @Override
        public String get(final Object prefix) {
            String namespace = this.primaryNamespaces.get(prefix);
            if (namespace == null) {
                namespace = this.secondaryNamespaces.get(prefix);
            }
            return namespace;
        }

        @Override
        public boolean containsKey(final Object prefix) {
            return this.primaryNamespaces.containsKey(prefix)
                    || this.secondaryNamespaces.containsKey(prefix);
        }

        @Override
        public String put(final String prefix, final String namespace) {
            return this.primaryNamespaces.put(prefix, namespace);
        }

        @Override
        public Set<Map.Entry<String, String>> entrySet() {
            return new EntrySet();
        }

        @Override
        public void clear() {
            this.primaryNamespaces.clear();
        }

        final class EntrySet extends AbstractSet<Map.Entry<String, String>> {

            @Override
            public int size() {
                return Sets.union(NamespaceCombinedMap.this.primaryNamespaces.keySet(),
                        NamespaceCombinedMap.this.secondaryNamespaces.keySet()).size();
            }

            @Override
            public Iterator<Map.Entry<String, String>> iterator() {

                final Set<String> additionalKeys = Sets.difference(
                        NamespaceCombinedMap.this.secondaryNamespaces.keySet(),
                        NamespaceCombinedMap.this.primaryNamespaces.keySet());

                Function<String, Map.Entry<String, String>> transformer;
                transformer = new Function<String, Map.Entry<String, String>>() {

                    @Override
                    public Map.Entry<String, String> apply(final String prefix) {
                        return new AbstractMap.SimpleImmutableEntry<String, String>(prefix,
                                NamespaceCombinedMap.this.secondaryNamespaces.get(prefix));
                    }

                };

                return Iterators.unmodifiableIterator(Iterators.concat(
                        NamespaceCombinedMap.this.primaryNamespaces.entrySet().iterator(),
                        Iterators.transform(additionalKeys.iterator(), transformer)));
            }

        }

    }

}
