package com.obseq.api;

/**
 * A certified group boundary: the optimal partition has a cut on
 * {@code side} of {@code element}.
 */
public record Cut(int element, CutSide side) {
}
