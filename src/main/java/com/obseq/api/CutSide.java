package com.obseq.api;

/**
 * Which side of an element a cut lies on.
 */
public enum CutSide {
    /** The cut is immediately before the element: a group starts there. */
    LEFT,
    /** The cut is immediately after the element: a group ends there. */
    RIGHT
}
