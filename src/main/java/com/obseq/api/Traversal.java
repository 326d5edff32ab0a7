package com.obseq.api;

/**
 * Raw forward/backward traversal over a client-owned sequence.
 *
 * Elements are addressed by stable, non-negative integer handles chosen by
 * the client (typically slots of the client's own arena). The engine never
 * stores the sequence itself; it only walks it through this interface.
 *
 * Both directions must describe the same order: {@code prev(next(e)) == e}
 * for every element that is not the last one.
 */
public interface Traversal {

    /** Absent element: before the first or after the last. */
    int NONE = -1;

    /**
     * @param element An element handle, or {@link #NONE} to ask for the first
     *                element.
     * @return The following element, or {@link #NONE} if {@code element} is the
     *         last one (or the sequence is empty).
     */
    int next(int element);

    /**
     * @param element An element handle, or {@link #NONE} to ask for the last
     *                element.
     * @return The preceding element, or {@link #NONE} if {@code element} is the
     *         first one (or the sequence is empty).
     */
    int prev(int element);
}
