package com.obseq.util;

import com.obseq.api.Cut;
import com.obseq.api.SolveListener;
import com.obseq.api.WindowSide;

import java.util.Arrays;

import lombok.extern.log4j.Log4j2;

/**
 * Fans solve callbacks out to several {@link SolveListener}s, in registration
 * order, without allocating per callback.
 *
 * <p>
 * Registration copies the backing array, so listeners may be added or removed
 * between solves but not from inside a callback.
 *
 * <p>
 * {@link #onSolveError} is the one callback that isolates its listeners: the
 * engine calls it while unwinding a failed solve, and a listener throwing there
 * would replace the original failure and starve the listeners after it. Such a
 * secondary failure is logged and the fan-out continues.
 */
@Log4j2
public class CompositeSolveListener implements SolveListener {
    private SolveListener[] listeners;

    public CompositeSolveListener(SolveListener... initial) {
        for (SolveListener l : initial)
            requireListener(l);
        this.listeners = initial.clone();
    }

    public CompositeSolveListener add(SolveListener listener) {
        requireListener(listener);
        SolveListener[] grown = Arrays.copyOf(listeners, listeners.length + 1);
        grown[listeners.length] = listener;
        listeners = grown;
        return this;
    }

    /**
     * Removes the first registration of {@code listener}.
     *
     * @return true if it was registered.
     */
    public boolean remove(SolveListener listener) {
        for (int i = 0; i < listeners.length; i++) {
            if (listeners[i] == listener) {
                SolveListener[] shrunk = new SolveListener[listeners.length - 1];
                System.arraycopy(listeners, 0, shrunk, 0, i);
                System.arraycopy(listeners, i + 1, shrunk, i, listeners.length - i - 1);
                listeners = shrunk;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onSolveStart(long epoch) {
        for (SolveListener l : listeners)
            l.onSolveStart(epoch);
    }

    @Override
    public void onWindowExpanded(long epoch, WindowSide side, int element, int index) {
        for (SolveListener l : listeners)
            l.onWindowExpanded(epoch, side, element, index);
    }

    @Override
    public void onWindowContracted(long epoch, WindowSide side, int element) {
        for (SolveListener l : listeners)
            l.onWindowContracted(epoch, side, element);
    }

    @Override
    public void onCutCertified(long epoch, Cut cut, int candidates) {
        for (SolveListener l : listeners)
            l.onCutCertified(epoch, cut, candidates);
    }

    @Override
    public void onSolveError(long epoch, Throwable error) {
        for (SolveListener l : listeners) {
            try {
                l.onSolveError(epoch, error);
            } catch (RuntimeException secondary) {
                log.warn("Listener {} failed while reporting the solve error of epoch {}: {}",
                        l.getClass().getName(), epoch, secondary.toString());
            }
        }
    }

    @Override
    public void onSolveEnd(long epoch, int expansions) {
        for (SolveListener l : listeners)
            l.onSolveEnd(epoch, expansions);
    }

    private static void requireListener(SolveListener l) {
        if (l == null)
            throw new IllegalArgumentException("Listener must not be null");
    }
}
