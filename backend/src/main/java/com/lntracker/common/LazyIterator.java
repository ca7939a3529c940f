package com.lntracker.common;

import java.util.NoSuchElementException;

/**
 * Base for pull-based iterators: subclasses implement {@link #computeNext()} and call
 * {@link #endOfData()} once exhausted. {@link #close()} ends the sequence and runs
 * {@link #onClose()} exactly once.
 */
public abstract class LazyIterator<E> implements CloseableIterator<E> {

    private enum State { READY, NOT_READY, DONE, FAILED }

    private State state = State.NOT_READY;
    private E next;
    private volatile boolean closed;

    protected abstract E computeNext();

    protected final E endOfData() {
        state = State.DONE;
        return null;
    }

    protected void onClose() {
    }

    @Override
    public final boolean hasNext() {
        if (state == State.FAILED) {
            throw new IllegalStateException("Iterator failed on a previous call");
        }
        if (closed) {
            return false;
        }
        switch (state) {
            case READY:
                return true;
            case DONE:
                return false;
            default:
                break;
        }
        state = State.FAILED;
        next = computeNext();
        if (state != State.DONE) {
            state = State.READY;
            return true;
        }
        close();
        return false;
    }

    @Override
    public final E next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        state = State.NOT_READY;
        E result = next;
        next = null;
        return result;
    }

    @Override
    public final void close() {
        if (closed) {
            return;
        }
        closed = true;
        state = State.DONE;
        onClose();
    }
}
