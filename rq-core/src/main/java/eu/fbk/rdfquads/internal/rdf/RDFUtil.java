package eu.fbk.rdfquads.internal.rdf;

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

import org.openrdf.model.Model;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.LinkedHashModel;
import org.openrdf.model.impl.ValueFactoryImpl;
import org.openrdf.rio.RDFHandler;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.helpers.RDFHandlerBase;

import eu.fbk.rdfquads.data.BNode;
import eu.fbk.rdfquads.data.IRI;
import eu.fbk.rdfquads.data.Literal;
import eu.fbk.rdfquads.data.Quad;
import eu.fbk.rdfquads.data.QuadStore;
import eu.fbk.rdfquads.data.Resource;
import eu.fbk.rdfquads.data.Term;
import eu.fbk.rdfquads.data.TermFactory;
import eu.fbk.rdfquads.vocabulary.RDF;
import eu.fbk.rdfquads.vocabulary.XSD;

/**
 * Conversion between terms and quads of this library and the OpenRDF Sesame model.
 * <p>
 * Sesame follows RDF 1.0: literals of type {@code xsd:string} are mapped to plain literals and
 * language-tagged literals carry no datatype; the reverse mapping restores the RDF 1.1 datatypes.
 * Blank nodes keep their identifiers in both directions.
 * </p>
 */
public final class RDFUtil {

    private RDFUtil() {
    }

    public static Value toSesame(final Term term, @Nullable final ValueFactory factory) {
        final ValueFactory vf = MoreObjects.firstNonNull(factory, ValueFactoryImpl.getInstance());
        if (term instanceof IRI) {
            return vf.createURI(term.stringValue());
        } else if (term instanceof BNode) {
            return vf.createBNode(((BNode) term).getID());
        }
        final Literal literal = (Literal) term;
        if (literal.getLanguage() != null) {
            return vf.createLiteral(literal.getLabel(), literal.getLanguage());
        } else if (literal.isSimple()) {
            return vf.createLiteral(literal.getLabel());
        } else {
            return vf.createLiteral(literal.getLabel(), vf.createURI(literal.getDatatype()
                    .stringValue()));
        }
    }

    public static Statement toSesame(final Quad quad, @Nullable final ValueFactory factory) {
        final ValueFactory vf = MoreObjects.firstNonNull(factory, ValueFactoryImpl.getInstance());
        final org.openrdf.model.Resource subject = (org.openrdf.model.Resource) toSesame(
                quad.getSubject(), vf);
        final URI predicate = (URI) toSesame(quad.getPredicate(), vf);
        final Value object = toSesame(quad.getObject(), vf);
        final Resource graph = quad.getGraph();
        return graph == null ? vf.createStatement(subject, predicate, object) : vf
                .createStatement(subject, predicate, object,
                        (org.openrdf.model.Resource) toSesame(graph, vf));
    }

    /**
     * Returns a Sesame model with the quads of the store, in canonical order.
     *
     * @param store
     *            the store to convert
     * @return a new, modifiable model
     */
    public static Model toSesame(final QuadStore store) {
        final ValueFactory vf = ValueFactoryImpl.getInstance();
        final Model model = new LinkedHashModel();
        for (final Quad quad : store.quads()) {
            model.add(toSesame(quad, vf));
        }
        return model;
    }

    public static Term fromSesame(final Value value, @Nullable final TermFactory factory) {
        final TermFactory tf = MoreObjects.firstNonNull(factory, TermFactory.getDefault());
        if (value instanceof URI) {
            return tf.createIRI(value.stringValue());
        } else if (value instanceof org.openrdf.model.BNode) {
            return tf.createBNode(((org.openrdf.model.BNode) value).getID());
        }
        final org.openrdf.model.Literal literal = (org.openrdf.model.Literal) value;
        final String language = literal.getLanguage();
        final URI datatype = literal.getDatatype();
        if (language != null) {
            return tf.createLiteral(literal.getLabel(), language);
        } else if (datatype == null || datatype.stringValue().equals(XSD.STRING.stringValue())) {
            return tf.createLiteral(literal.getLabel());
        } else {
            Preconditions.checkArgument(!datatype.stringValue().equals(
                    RDF.LANG_STRING.stringValue()), "Missing language for literal %s", literal);
            return tf.createLiteral(literal.getLabel(), tf.createIRI(datatype.stringValue()));
        }
    }

    public static Quad fromSesame(final Statement statement, @Nullable final TermFactory factory) {
        final TermFactory tf = MoreObjects.firstNonNull(factory, TermFactory.getDefault());
        final org.openrdf.model.Resource context = statement.getContext();
        return new Quad((Resource) fromSesame(statement.getSubject(), tf),
                (IRI) fromSesame(statement.getPredicate(), tf), fromSesame(
                        statement.getObject(), tf), context == null ? null
                        : (Resource) fromSesame(context, tf));
    }

    /**
     * Returns a Sesame {@code RDFHandler} that adds the statements it receives to a store. The
     * namespaces reported by the source are collected in the map supplied, if any.
     *
     * @param store
     *            the target store
     * @param namespaces
     *            the map where to store prefix-to-namespace declarations, null to ignore them
     * @return the created handler
     */
    public static RDFHandler newStoreHandler(final QuadStore store,
            @Nullable final Map<String, String> namespaces) {
        Preconditions.checkNotNull(store);
        final Map<String, String> map = namespaces != null ? namespaces : Maps
                .<String, String>newHashMap();
        final TermFactory factory = TermFactory.create();
        return new RDFHandlerBase() {

            @Override
            public void handleNamespace(final String prefix, final String uri)
                    throws RDFHandlerException {
                map.put(prefix, uri);
            }

            @Override
            public void handleStatement(final Statement statement) throws RDFHandlerException {
                try {
                    store.add(fromSesame(statement, factory));
                } catch (final IllegalArgumentException ex) {
                    throw new RDFHandlerException("Cannot convert " + statement, ex);
                }
            }

        };
    }

}
