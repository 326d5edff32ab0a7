package com.obseq.api;

/**
 * Identifies one of the two DP windows.
 */
public enum WindowSide {
    /** Prefix window, grown rightwards from the sequence start. */
    HEAD,
    /** Suffix window, grown leftwards from the sequence end. */
    TAIL
}
