package eu.fbk.rdfquads.data;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Multimap;
import com.google.common.collect.Sets;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

/**
 * Checks whether two sets of quads are equal up to a bijective renaming of blank nodes, and sorts
 * quads in an order that does not depend on blank node IDs.
 * <p>
 * Blank nodes are first coloured by hashing their neighbourhood, iteratively refining colours
 * with the colours of adjacent blank nodes; then a backtracking search tries to map each blank
 * node of the first set to a blank node of the second set with the same colour, checking at each
 * step that all the quads whose blank nodes are mapped have an image in the second set.
 * </p>
 */
final class Isomorphism {

    private static final int REFINEMENT_ROUNDS = 4;

    private final List<Quad> quads1;

    private final Set<Quad> quads2;

    private final Multimap<BNode, Quad> incident1;

    private final Map<BNode, HashCode> colors1;

    private final Map<BNode, HashCode> colors2;

    private final Map<BNode, BNode> mapping;

    private final Set<BNode> used;

    private Isomorphism(final List<Quad> quads1, final List<Quad> quads2) {
        this.quads1 = quads1;
        this.quads2 = new HashSet<Quad>(quads2);
        this.incident1 = index(quads1);
        this.colors1 = color(quads1, this.incident1);
        this.colors2 = color(quads2, index(quads2));
        this.mapping = Maps.newHashMap();
        this.used = Sets.newHashSet();
    }

    static boolean isomorphic(final List<Quad> quads1, final List<Quad> quads2) {

        if (quads1.size() != quads2.size()) {
            return false;
        }

        final List<Quad> blank1 = Lists.newArrayList();
        final List<Quad> blank2 = Lists.newArrayList();
        final Set<Quad> ground2 = Sets.newHashSet();
        for (final Quad quad : quads2) {
            if (hasBNode(quad)) {
                blank2.add(quad);
            } else {
                ground2.add(quad);
            }
        }
        for (final Quad quad : quads1) {
            if (hasBNode(quad)) {
                blank1.add(quad);
            } else if (!ground2.remove(quad)) {
                return false;
            }
        }
        if (!ground2.isEmpty() || blank1.size() != blank2.size()) {
            return false;
        }
        if (blank1.isEmpty()) {
            return true;
        }

        final Isomorphism iso = new Isomorphism(blank1, blank2);
        if (!iso.sameColorHistogram()) {
            return false;
        }
        return iso.search(iso.orderedBNodes(), 0);
    }

    /**
     * Sorts quads in canonical order, comparing blank nodes by their neighbourhood colour first
     * and by ID only when colours are equal.
     */
    static List<Quad> sort(final Collection<Quad> quads) {
        final Map<BNode, HashCode> colors = color(quads, index(quads));
        final Comparator<Term> termComparator = new Comparator<Term>() {

            @Override
            public int compare(final Term a, final Term b) {
                if (a instanceof BNode && b instanceof BNode) {
                    final int result = colors.get(a).toString().compareTo(
                            colors.get(b).toString());
                    return result != 0 ? result : a.compareTo(b);
                }
                return a.compareTo(b);
            }

        };
        final List<Quad> sorted = new ArrayList<Quad>(quads);
        Collections.sort(sorted, new Comparator<Quad>() {

            @Override
            public int compare(final Quad a, final Quad b) {
                final Resource ga = a.getGraph();
                final Resource gb = b.getGraph();
                int result = ga == null ? gb == null ? 0 : -1 : gb == null ? 1 : termComparator
                        .compare(ga, gb);
                if (result == 0) {
                    result = termComparator.compare(a.getSubject(), b.getSubject());
                    if (result == 0) {
                        result = a.getPredicate().compareTo(b.getPredicate());
                        if (result == 0) {
                            result = termComparator.compare(a.getObject(), b.getObject());
                        }
                    }
                }
                return result;
            }

        });
        return sorted;
    }

    private static boolean hasBNode(final Quad quad) {
        return quad.getSubject() instanceof BNode || quad.getObject() instanceof BNode
                || quad.getGraph() instanceof BNode;
    }

    private static Multimap<BNode, Quad> index(final Collection<Quad> quads) {
        final Multimap<BNode, Quad> index = HashMultimap.create();
        for (final Quad quad : quads) {
            for (final Term term : terms(quad)) {
                if (term instanceof BNode) {
                    index.put((BNode) term, quad);
                }
            }
        }
        return index;
    }

    private static Term[] terms(final Quad quad) {
        final Resource graph = quad.getGraph();
        return graph == null ? new Term[] { quad.getSubject(), quad.getObject() } : new Term[] {
                quad.getSubject(), quad.getObject(), graph };
    }

    private static Map<BNode, HashCode> color(final Collection<Quad> quads,
            final Multimap<BNode, Quad> incident) {

        Map<BNode, HashCode> colors = new HashMap<BNode, HashCode>();
        for (final BNode bnode : incident.keySet()) {
            colors.put(bnode, HashCode.fromInt(0));
        }

        for (int round = 0; round < REFINEMENT_ROUNDS; ++round) {
            final Map<BNode, HashCode> newColors = new HashMap<BNode, HashCode>();
            for (final BNode bnode : incident.keySet()) {
                final List<HashCode> codes = new ArrayList<HashCode>();
                for (final Quad quad : incident.get(bnode)) {
                    codes.add(hash(quad, bnode, colors));
                }
                newColors.put(bnode, Hashing.combineUnordered(codes));
            }
            colors = newColors;
        }
        return colors;
    }

    private static HashCode hash(final Quad quad, final BNode focus,
            final Map<BNode, HashCode> colors) {
        final Hasher hasher = Hashing.murmur3_128().newHasher();
        hashTerm(hasher, quad.getSubject(), focus, colors);
        hasher.putUnencodedChars(quad.getPredicate().stringValue()).putChar('\u0000');
        hashTerm(hasher, quad.getObject(), focus, colors);
        if (quad.getGraph() != null) {
            hashTerm(hasher, quad.getGraph(), focus, colors);
        }
        return hasher.hash();
    }

    private static void hashTerm(final Hasher hasher, final Term term, final BNode focus,
            final Map<BNode, HashCode> colors) {
        if (term.equals(focus)) {
            hasher.putChar('*');
        } else if (term instanceof BNode) {
            hasher.putChar('_').putBytes(colors.get(term).asBytes());
        } else {
            hasher.putUnencodedChars(term.toString());
        }
        hasher.putChar('\u0000');
    }

    private boolean sameColorHistogram() {
        final List<HashCode> histogram1 = new ArrayList<HashCode>(this.colors1.values());
        final List<HashCode> histogram2 = new ArrayList<HashCode>(this.colors2.values());
        if (histogram1.size() != histogram2.size()) {
            return false;
        }
        final Map<HashCode, Integer> counts = Maps.newHashMap();
        for (final HashCode code : histogram1) {
            final Integer count = counts.get(code);
            counts.put(code, count == null ? 1 : count + 1);
        }
        for (final HashCode code : histogram2) {
            final Integer count = counts.get(code);
            if (count == null) {
                return false;
            }
            if (count == 1) {
                counts.remove(code);
            } else {
                counts.put(code, count - 1);
            }
        }
        return counts.isEmpty();
    }

    private List<BNode> orderedBNodes() {
        final Map<HashCode, Integer> classSizes = Maps.newHashMap();
        for (final HashCode code : this.colors2.values()) {
            final Integer size = classSizes.get(code);
            classSizes.put(code, size == null ? 1 : size + 1);
        }
        final List<BNode> bnodes = new ArrayList<BNode>(this.colors1.keySet());
        final Map<BNode, HashCode> colors = this.colors1;
        Collections.sort(bnodes, new Comparator<BNode>() {

            @Override
            public int compare(final BNode a, final BNode b) {
                final int result = classSizes.get(colors.get(a)).compareTo(
                        classSizes.get(colors.get(b)));
                return result != 0 ? result : a.compareTo(b);
            }

        });
        return bnodes;
    }

    private boolean search(final List<BNode> bnodes, final int index) {
        if (index == bnodes.size()) {
            return true;
        }
        final BNode source = bnodes.get(index);
        final HashCode color = this.colors1.get(source);
        for (final Map.Entry<BNode, HashCode> entry : this.colors2.entrySet()) {
            final BNode target = entry.getKey();
            if (!entry.getValue().equals(color) || this.used.contains(target)) {
                continue;
            }
            this.mapping.put(source, target);
            this.used.add(target);
            if (consistent(source) && search(bnodes, index + 1)) {
                return true;
            }
            this.mapping.remove(source);
            this.used.remove(target);
        }
        return false;
    }

    private boolean consistent(final BNode assigned) {
        for (final Quad quad : this.incident1.get(assigned)) {
            final Quad image = map(quad);
            if (image != null && !this.quads2.contains(image)) {
                return false;
            }
        }
        return true;
    }

    private Quad map(final Quad quad) {
        final Resource subject = (Resource) mapTerm(quad.getSubject());
        final Term object = mapTerm(quad.getObject());
        final Resource graph = quad.getGraph() == null ? null : (Resource) mapTerm(quad
                .getGraph());
        if (subject == null || object == null || quad.getGraph() != null && graph == null) {
            return null;
        }
        return new Quad(subject, quad.getPredicate(), object, graph);
    }

    private Term mapTerm(final Term term) {
        return term instanceof BNode ? this.mapping.get(term) : term;
    }

    @Override
    public String toString() {
        return "Isomorphism[" + this.quads1.size() + " quads, mapping " + this.mapping + "]";
    }

}
