package eu.fbk.rdfquads.data;

import java.util.Iterator;

import javax.annotation.Nullable;

/**
 * A handler accepting a sequence of elements, one at a time.
 * <p>
 * Parsers push the statements they produce to a Handler, one at a time, as soon as each statement
 * is complete; writers accept statements the same way. To this respect, this interface
 * complements the {@link Iterator} returned by a {@link QuadStore}, which supports an external,
 * pull-style iteration.
 * </p>
 * <p>
 * A Handler implements a single method {@link #handle(Object)} that is called for each object of
 * the sequence, which MUST not be null; at the end of the sequence, the method is called a last
 * time passing null as sentinel value. This interface does not specify how to interrupt the
 * iteration and how to deal with exceptions, which depend on (and are documented as part of) the
 * specific method accepting a Handler. In particular:
 * </p>
 * <ul>
 * <li>parsers do not check for thread interruption: a caller wanting to stop a parse has to throw
 * an exception from within {@code handle()};</li>
 * <li>exceptions thrown by the Handler cause the iteration to stop immediately, without the end
 * of sequence being propagated.</li>
 * </ul>
 * <p>
 * Implementations of this interface are not expected to be thread safe. It is a responsibility of
 * the caller of {@link #handle(Object)} to never invoke this method multiple times concurrently.
 * </p>
 * 
 * @param <T>
 *            the type of element
 */
public interface Handler<T> {

    /**
     * Callback method called for each non-null element of the sequence, and with a null value at
     * the end of the sequence.
     * 
     * @param element
     *            the element
     * @throws Throwable
     *             on failure
     */
    void handle(@Nullable T element) throws Throwable;

}
