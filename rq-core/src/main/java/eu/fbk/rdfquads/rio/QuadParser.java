package eu.fbk.rdfquads.rio;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;

import eu.fbk.rdfquads.data.Handler;
import eu.fbk.rdfquads.data.MemoryQuadStore;
import eu.fbk.rdfquads.data.Quad;
import eu.fbk.rdfquads.data.QuadStore;

/**
 * Base class of the parsers of this package.
 * <p>
 * A parser reads a whole document and either pushes the statements it contains to a
 * {@link Handler}, one statement at a time as soon as it is complete, or adds them to a
 * {@link QuadStore}. Adding to a store is all-or-nothing: statements are buffered and added only
 * after the whole document has been parsed successfully, so that a failed parse leaves the store
 * untouched. When pushing to a handler, the handler is notified of the end of the document
 * (passing null) only if the parse succeeded; exceptions thrown by the handler stop the parse
 * and are propagated to the caller, wrapped in a {@code RuntimeException} if checked and not an
 * {@code IOException}.
 * </p>
 * <p>
 * Parser instances are not thread safe: parse methods are synchronized so that a parser performs
 * at most one parse at a time. Independent documents can be parsed concurrently using separate
 * parser instances.
 * </p>
 */
public abstract class QuadParser {

    @Nullable
    private ParseContext context;

    QuadParser() {
    }

    /**
     * Returns the syntax accepted by this parser.
     *
     * @return the syntax
     */
    public abstract Syntax getSyntax();

    /**
     * Returns the context at the end of the last successful parse, containing the prefixes and
     * base IRI in scope at the end of the document.
     *
     * @return the terminal context of the last parse, or null if no parse completed successfully
     */
    @Nullable
    public final synchronized ParseContext getContext() {
        return this.context;
    }

    /**
     * Parses a document, pushing its statements to the handler supplied.
     *
     * @param text
     *            the document text
     * @param handler
     *            the handler receiving the parsed quads followed by null
     * @return the context at the end of the parse
     * @throws IOException
     *             if thrown by the handler
     * @throws eu.fbk.rdfquads.data.ParseException
     *             if the document is malformed
     */
    public final synchronized ParseContext parse(final String text,
            final Handler<? super Quad> handler) throws IOException {
        Preconditions.checkNotNull(text);
        Preconditions.checkNotNull(handler);
        this.context = null;
        final ParseContext context = newContext();
        doParse(text, context, handler);
        emit(handler, null);
        this.context = context;
        return context;
    }

    public final ParseContext parse(final Reader reader, final Handler<? super Quad> handler)
            throws IOException {
        return parse(TurtleUtil.read(reader), handler);
    }

    /**
     * Parses a document read from an UTF-8 byte stream, pushing its statements to the handler
     * supplied. Malformed UTF-8 input is reported as a {@link LexException}.
     *
     * @param stream
     *            the stream to read, not closed by this method
     * @param handler
     *            the handler receiving the parsed quads followed by null
     * @return the context at the end of the parse
     * @throws IOException
     *             on I/O failure or if thrown by the handler
     */
    public final ParseContext parse(final InputStream stream,
            final Handler<? super Quad> handler) throws IOException {
        return parse(TurtleUtil.read(stream), handler);
    }

    /**
     * Parses a document adding its statements to the store supplied. The store is modified only
     * if the whole document is parsed successfully.
     *
     * @param reader
     *            the reader to read from, not closed by this method
     * @param store
     *            the target store
     * @return the number of quads newly added to the store
     * @throws IOException
     *             on I/O failure
     */
    public final int parse(final Reader reader, final QuadStore store) throws IOException {
        Preconditions.checkNotNull(store);
        final List<Quad> buffer = new ArrayList<Quad>();
        parse(reader, collector(buffer));
        return store.addAll(buffer);
    }

    public final int parse(final InputStream stream, final QuadStore store) throws IOException {
        Preconditions.checkNotNull(store);
        final List<Quad> buffer = new ArrayList<Quad>();
        parse(stream, collector(buffer));
        return store.addAll(buffer);
    }

    /**
     * Parses a document into a new in-memory store.
     *
     * @param text
     *            the document text
     * @return a new store with the statements of the document
     */
    public final QuadStore parse(final String text) {
        final List<Quad> buffer = new ArrayList<Quad>();
        try {
            parse(text, collector(buffer));
        } catch (final IOException ex) {
            throw new UncheckedIOException(ex);
        }
        return new MemoryQuadStore(buffer);
    }

    abstract ParseContext newContext();

    abstract void doParse(String text, ParseContext context, Handler<? super Quad> handler)
            throws IOException;

    static void emit(final Handler<? super Quad> handler, @Nullable final Quad quad)
            throws IOException {
        try {
            handler.handle(quad);
        } catch (final Throwable ex) {
            Throwables.propagateIfPossible(ex, IOException.class);
            throw new RuntimeException(ex);
        }
    }

    private static Handler<Quad> collector(final List<Quad> buffer) {
        return new Handler<Quad>() {

            @Override
            public void handle(@Nullable final Quad quad) {
                if (quad != null) {
                    buffer.add(quad);
                }
            }

        };
    }

}
