package io.github.manjago.esdl.ops;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Iterator whose elements are computed one at a time, on demand.
 */
abstract class LazyIterator<T> implements Iterator<T> {

    private T next;
    private boolean done;

    /**
     * @return the next element, or {@code null} when the stream has ended
     */
    protected abstract T computeNext();

    @Override
    public boolean hasNext() {
        if (next == null && !done) {
            next = computeNext();
            done = next == null;
        }
        return next != null;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        T result = next;
        next = null;
        return result;
    }
}
