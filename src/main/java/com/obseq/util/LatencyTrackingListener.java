package com.obseq.util;

import com.obseq.api.Cut;
import com.obseq.api.SolveListener;
import com.obseq.api.WindowSide;

import lombok.extern.log4j.Log4j2;

/**
 * A listener that tracks performance metrics for solves.
 *
 * <p>
 * Captures:
 * <ul>
 * <li><b>Latency:</b> Min, Max, Average time per solve (in nanoseconds).</li>
 * <li><b>Throughput:</b> Total number of solves.</li>
 * <li><b>Workload:</b> Elements expanded, elements contracted and cut
 * candidates evaluated.</li>
 * </ul>
 *
 * <p>
 * The expansion count is the useful measure of incremental efficiency: after
 * a local edit it should stay close to the size of the damaged region rather
 * than the sequence length.
 */
@Log4j2
public final class LatencyTrackingListener implements SolveListener {
    private final ErrorRateLimiter errLimiter = new ErrorRateLimiter(log, 1000); // 1-second throttle
    private long solveStartNanos, lastLatencyNanos;
    private long totalSolves, totalLatencyNanos, totalExpansions, totalContractions, totalErrors;
    private long minLatencyNanos = Long.MAX_VALUE, maxLatencyNanos = Long.MIN_VALUE;
    private int lastExpansions, lastCandidates;

    @Override
    public void onSolveStart(long epoch) {
        solveStartNanos = System.nanoTime();
    }

    @Override
    public void onWindowExpanded(long epoch, WindowSide side, int element, int index) {
        // Counted in bulk by onSolveEnd
    }

    @Override
    public void onWindowContracted(long epoch, WindowSide side, int element) {
        totalContractions++;
    }

    @Override
    public void onCutCertified(long epoch, Cut cut, int candidates) {
        lastCandidates = candidates;
    }

    @Override
    public void onSolveError(long epoch, Throwable error) {
        totalErrors++;
        errLimiter.log("Solve failed at epoch " + epoch + ": " + error.getMessage(), error);
    }

    @Override
    public void onSolveEnd(long epoch, int expansions) {
        lastLatencyNanos = System.nanoTime() - solveStartNanos;
        lastExpansions = expansions;
        totalSolves++;
        totalExpansions += expansions;
        totalLatencyNanos += lastLatencyNanos;
        if (lastLatencyNanos < minLatencyNanos)
            minLatencyNanos = lastLatencyNanos;
        if (lastLatencyNanos > maxLatencyNanos)
            maxLatencyNanos = lastLatencyNanos;
    }

    public long lastLatencyNanos() {
        return lastLatencyNanos;
    }

    public double lastLatencyMicros() {
        return lastLatencyNanos / 1000.0;
    }

    public int lastExpansions() {
        return lastExpansions;
    }

    public int lastCandidates() {
        return lastCandidates;
    }

    public long totalSolves() {
        return totalSolves;
    }

    public long totalExpansions() {
        return totalExpansions;
    }

    public long totalContractions() {
        return totalContractions;
    }

    public long totalErrors() {
        return totalErrors;
    }

    public double avgLatencyNanos() {
        return totalSolves > 0 ? (double) totalLatencyNanos / totalSolves : 0;
    }

    public double avgLatencyMicros() {
        return avgLatencyNanos() / 1000.0;
    }

    public long minLatencyNanos() {
        return minLatencyNanos == Long.MAX_VALUE ? 0 : minLatencyNanos;
    }

    public long maxLatencyNanos() {
        return maxLatencyNanos == Long.MIN_VALUE ? 0 : maxLatencyNanos;
    }

    public void reset() {
        totalSolves = 0;
        totalLatencyNanos = 0;
        totalExpansions = 0;
        totalContractions = 0;
        totalErrors = 0;
        minLatencyNanos = Long.MAX_VALUE;
        maxLatencyNanos = Long.MIN_VALUE;
    }

    public String dump() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%-14s | %10s | %10s | %10s | %10s | %12s\n", "Metric", "Value", "Avg (us)",
                "Min (us)", "Max (us)", "Expansions"));
        sb.append("-----------------------------------------------------------------------------------\n");
        sb.append(String.format("%-14s | %10d | %10.2f | %10.2f | %10.2f | %12d\n",
                "Total Solves",
                totalSolves,
                avgLatencyMicros(),
                minLatencyNanos() / 1000.0,
                maxLatencyNanos() / 1000.0,
                totalExpansions));
        return sb.toString();
    }
}
