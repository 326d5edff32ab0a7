package com.obseq.util;

import com.obseq.api.Cut;
import com.obseq.api.Interval;
import com.obseq.engine.LinkedView;
import com.obseq.engine.PartitionEngine;

import java.util.List;

/**
 * Diagnostic utility for inspecting engine state.
 *
 * <p>
 * Generates human-readable descriptions of the two DP windows, of a single
 * element's cached entries, and of the solved partition.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and error reports. Do
 * <b>not</b> use on the hot path (allocates strings, walks the windows).
 */
public final class PartitionExplain {
    private final PartitionEngine<?, ?> engine;

    public PartitionExplain(PartitionEngine<?, ?> engine) {
        this.engine = engine;
    }

    /**
     * Dumps the cached entries of a single element.
     */
    public String explainElement(int element) {
        StringBuilder sb = new StringBuilder(256);
        sb.append("Element: ").append(element).append('\n');

        int li = engine.leftIndex(element);
        if (li == PartitionEngine.UNSET) {
            sb.append("  Head window: -\n");
        } else {
            sb.append("  Head window: leftIndex=").append(li)
                    .append(" cost=").append(engine.prefixCost(element))
                    .append(" cut=").append(name(engine.prefixCut(element))).append('\n');
        }

        int ri = engine.rightIndex(element);
        if (ri == PartitionEngine.UNSET) {
            sb.append("  Tail window: -\n");
        } else {
            sb.append("  Tail window: rightIndex=").append(ri)
                    .append(" cost=").append(engine.suffixCost(element))
                    .append(" cut=").append(name(engine.suffixCut(element))).append('\n');
        }
        return sb.toString();
    }

    /**
     * One-line summary of the windows and the certified cut.
     */
    public String explainWindows() {
        Cut cut = engine.bestCut();
        return "head=" + name(engine.head()) + " (" + engine.headSize() + " entries)"
                + ", tail=" + name(engine.tail()) + " (" + engine.tailSize() + " entries)"
                + ", solved=" + engine.isSolved()
                + ", epoch=" + engine.epoch()
                + ", bestCut=" + (cut == null ? "-" : cut.side() + " of " + cut.element());
    }

    /**
     * Renders the solved partition as bracketed groups, e.g. {@code [0 2] [3 3]}.
     * Solves first if needed.
     */
    public String explainPartition() {
        List<Interval> groups = engine.groups();
        StringBuilder sb = new StringBuilder(groups.size() * 8);
        for (Interval g : groups) {
            if (sb.length() > 0)
                sb.append(' ');
            sb.append('[').append(g.first()).append(' ').append(g.last()).append(']');
        }
        return sb.toString();
    }

    private static String name(int e) {
        if (e == LinkedView.LEFT)
            return "LEFT";
        if (e == LinkedView.RIGHT)
            return "RIGHT";
        return Integer.toString(e);
    }
}
