package com.obseq.api;

/**
 * The bounds of one group, both inclusive.
 */
public record Interval(int first, int last) {
}
