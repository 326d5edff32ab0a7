package com.obseq.engine;

import com.obseq.ArraySequence;
import com.obseq.LineAlgebra;
import com.obseq.Partitions;
import com.obseq.api.CostAlgebra;
import com.obseq.api.Cut;
import com.obseq.api.CutSide;
import com.obseq.api.Interval;
import com.obseq.api.SolveListener;
import com.obseq.api.WindowSide;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class PartitionEngineTest {

    private static PartitionEngine<LineAlgebra.Line, Long> engine(ArraySequence seq, LineAlgebra alg) {
        return PartitionEngine.builder(seq, alg).build();
    }

    @Test
    public void testEqualCostsWithBreakPenaltyKeepOneGroup() {
        ArraySequence seq = ArraySequence.of(1, 1, 1, 1, 1);
        LineAlgebra alg = LineAlgebra.sumWithPenalty(seq);
        var engine = engine(seq, alg);

        engine.solve();

        Interval all = new Interval(seq.at(0), seq.at(4));
        for (int e : seq.handles())
            assertEquals(all, engine.interval(e));
        assertEquals(List.of(all), engine.groups());
        // Group cost 5 plus one break penalty
        assertEquals(7L, Partitions.costOf(seq, alg, engine.groups()));
    }

    @Test
    public void testFragmentingCostYieldsSingletons() {
        ArraySequence seq = ArraySequence.of(1, 1, 1, 1, 1);
        var engine = engine(seq, LineAlgebra.fragmenting(seq));

        engine.solve();

        for (int e : seq.handles())
            assertEquals(new Interval(e, e), engine.interval(e));
        assertEquals(5, engine.groups().size());
    }

    @Test
    public void testSingleElement() {
        ArraySequence seq = ArraySequence.of(4);
        var engine = engine(seq, LineAlgebra.justified(seq, 10));

        engine.solve();

        assertEquals(new Interval(0, 0), engine.interval(0));
        assertEquals(new Cut(0, CutSide.LEFT), engine.bestCut());
    }

    @Test
    public void testEmptySequenceSolvesWithoutCut() {
        ArraySequence seq = new ArraySequence();
        var engine = engine(seq, LineAlgebra.justified(seq, 10));

        engine.solve();

        assertTrue(engine.isSolved());
        assertNull(engine.bestCut());
        assertTrue(engine.groups().isEmpty());
        try {
            engine.interval(0);
            fail("Expected IllegalArgumentException for an empty sequence");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("not part of the solved sequence"));
        }
    }

    @Test
    public void testRepeatedSolveIsNoOp() {
        ArraySequence seq = ArraySequence.of(3, 1, 4, 1, 5, 9, 2, 6);
        var engine = engine(seq, LineAlgebra.justified(seq, 8));

        engine.solve();
        Cut cut = engine.bestCut();
        long epoch = engine.epoch();
        List<Interval> groups = engine.groups();

        engine.solve();
        engine.solve();

        assertEquals(epoch, engine.epoch());
        assertEquals(cut, engine.bestCut());
        assertEquals(groups, engine.groups());
        for (int e : seq.handles())
            assertEquals(engine.interval(e), engine.interval(e));
    }

    @Test
    public void testWindowsOverlapAfterSolve() {
        ArraySequence seq = ArraySequence.of(2, 2, 2, 2, 2, 2, 2);
        var engine = engine(seq, LineAlgebra.justified(seq, 6));

        engine.solve();

        for (int e : seq.handles())
            assertTrue("element " + e + " has no index",
                    engine.leftIndex(e) != PartitionEngine.UNSET || engine.rightIndex(e) != PartitionEngine.UNSET);
        assertNotEquals(PartitionEngine.UNSET, engine.leftIndex(engine.tail()));
        // Positional indices are contiguous runs from either end
        for (int i = 0; i < engine.headSize(); i++)
            assertEquals(i, engine.leftIndex(seq.at(i)));
        for (int i = 0; i < engine.tailSize(); i++)
            assertEquals(i, engine.rightIndex(seq.at(seq.size() - 1 - i)));
    }

    @Test
    public void testCompareFollowsSequenceOrder() {
        ArraySequence seq = ArraySequence.of(1, 5, 2, 7, 3, 3, 8, 1, 1);
        var engine = engine(seq, LineAlgebra.justified(seq, 9));
        engine.solve();

        List<Integer> h = seq.handles();
        for (int i = 0; i < h.size(); i++)
            for (int j = 0; j < h.size(); j++)
                assertEquals("compare(" + i + "," + j + ")",
                        Integer.signum(Integer.compare(i, j)), Integer.signum(engine.compare(h.get(i), h.get(j))));
    }

    @Test
    public void testIntervalBeforeSolveFailsFast() {
        ArraySequence seq = ArraySequence.of(1, 2, 3);
        var engine = engine(seq, LineAlgebra.justified(seq, 4));
        try {
            engine.interval(0);
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("requires a successful solve"));
        }
    }

    @Test
    public void testForeignElementIsRejected() {
        ArraySequence seq = ArraySequence.of(1, 2, 3);
        var engine = engine(seq, LineAlgebra.justified(seq, 4));
        engine.solve();

        try {
            engine.interval(42);
            fail("Expected IllegalArgumentException for a foreign handle");
        } catch (IllegalArgumentException expected) {
        }
        try {
            engine.interval(-7);
            fail("Expected IllegalArgumentException for a negative handle");
        } catch (IllegalArgumentException expected) {
        }
    }

    @Test
    public void testExpandingPastTheEndsFailsFast() {
        ArraySequence seq = ArraySequence.of(1, 2);
        var engine = engine(seq, LineAlgebra.justified(seq, 4));

        engine.expandHead();
        engine.expandHead();
        assertEquals(seq.last(), engine.head());
        try {
            engine.expandHead();
            fail("Expected IllegalStateException past the last element");
        } catch (IllegalStateException expected) {
        }

        engine.expandTail();
        engine.expandTail();
        assertEquals(seq.first(), engine.tail());
        try {
            engine.expandTail();
            fail("Expected IllegalStateException past the first element");
        } catch (IllegalStateException expected) {
        }
    }

    @Test
    public void testContractingAnEmptyWindowFailsFast() {
        ArraySequence seq = ArraySequence.of(1, 2);
        var engine = engine(seq, LineAlgebra.justified(seq, 4));
        try {
            engine.contractHead();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException expected) {
        }
        try {
            engine.contractTail();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException expected) {
        }
    }

    @Test
    public void testContractUndoesExpand() {
        ArraySequence seq = ArraySequence.of(1, 2, 3);
        var engine = engine(seq, LineAlgebra.justified(seq, 4));

        engine.expandHead();
        engine.expandHead();
        engine.contractHead();

        assertEquals(seq.first(), engine.head());
        assertEquals(PartitionEngine.UNSET, engine.leftIndex(seq.at(1)));
        try {
            engine.prefixCost(seq.at(1));
            fail("Expected IllegalStateException for a vacated element");
        } catch (IllegalStateException expected) {
        }
        engine.contractHead();
        assertEquals(LinkedView.LEFT, engine.head());
    }

    @Test
    public void testSolveWithoutAlgebraFailsFast() {
        ArraySequence seq = ArraySequence.of(1, 2);
        PartitionEngine<LineAlgebra.Line, Long> engine = PartitionEngine
                .<LineAlgebra.Line, Long>builder(seq, null).build();
        try {
            engine.solve();
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertEquals("No cost algebra set", e.getMessage());
        }
    }

    @Test
    public void testReplacingAlgebraInvalidatesEverything() {
        ArraySequence seq = ArraySequence.of(1, 1, 1, 1, 1);
        var engine = engine(seq, LineAlgebra.sumWithPenalty(seq));
        engine.solve();
        assertEquals(1, engine.groups().size());

        engine.setCostAlgebra(LineAlgebra.fragmenting(seq));

        assertFalse(engine.isSolved());
        assertEquals(0, engine.headSize());
        assertEquals(0, engine.tailSize());
        assertNull(engine.bestCut());
        try {
            engine.interval(0);
            fail("Expected IllegalStateException after replacing the algebra");
        } catch (IllegalStateException expected) {
        }

        engine.solve();
        assertEquals(5, engine.groups().size());
    }

    @Test
    public void testCollaboratorFailureIsReportedAndRecoverable() {
        ArraySequence seq = ArraySequence.of(2, 3, 1, 4, 2, 2, 5);
        LineAlgebra base = LineAlgebra.justified(seq, 7);
        FailingAlgebra failing = new FailingAlgebra(base, seq.at(3));
        List<Throwable> reported = new ArrayList<>();
        var engine = PartitionEngine.builder(seq, failing).listener(new NoOpListener() {
            @Override
            public void onSolveError(long epoch, Throwable error) {
                reported.add(error);
            }
        }).build();

        try {
            engine.solve();
            fail("Expected the algebra failure to propagate");
        } catch (RuntimeException e) {
            assertTrue(e.getMessage().startsWith("Solve failed"));
            assertEquals("boom", e.getCause().getMessage());
        }
        assertEquals(1, reported.size());
        assertFalse(engine.isSolved());

        failing.armed = false;
        engine.solve();
        assertEquals(Partitions.bruteForce(seq, base), Partitions.costOf(seq, base, engine.groups()));
        Partitions.assertConsistent(seq, engine);
    }

    @Test
    public void testListenerSeesExpansionsAndCut() {
        ArraySequence seq = ArraySequence.of(1, 2, 3, 4);
        List<String> events = new ArrayList<>();
        var engine = PartitionEngine.builder(seq, LineAlgebra.justified(seq, 5)).listener(new NoOpListener() {
            @Override
            public void onSolveStart(long epoch) {
                events.add("start " + epoch);
            }

            @Override
            public void onWindowExpanded(long epoch, WindowSide side, int element, int index) {
                events.add(side + " " + element + "@" + index);
            }

            @Override
            public void onCutCertified(long epoch, Cut cut, int candidates) {
                events.add("cut");
            }

            @Override
            public void onSolveEnd(long epoch, int expansions) {
                events.add("end " + expansions);
            }
        }).build();

        engine.solve();

        assertEquals("start 1", events.get(0));
        assertEquals("HEAD 0@0", events.get(1));
        assertEquals("TAIL 3@0", events.get(2));
        assertEquals("cut", events.get(events.size() - 2));
        int expanded = engine.headSize() + engine.tailSize();
        assertEquals("end " + expanded, events.get(events.size() - 1));
    }

    /** Delegates to a real algebra but throws when asked about one element. */
    private static final class FailingAlgebra implements CostAlgebra<LineAlgebra.Line, Long> {
        private final LineAlgebra delegate;
        private final int poison;
        boolean armed = true;

        FailingAlgebra(LineAlgebra delegate, int poison) {
            this.delegate = delegate;
            this.poison = poison;
        }

        private void check(int element) {
            if (armed && element == poison)
                throw new IllegalStateException("boom");
        }

        @Override
        public LineAlgebra.Line singleton(int element) {
            check(element);
            return delegate.singleton(element);
        }

        @Override
        public LineAlgebra.Line extendRight(LineAlgebra.Line group, int element) {
            check(element);
            return delegate.extendRight(group, element);
        }

        @Override
        public Long close(LineAlgebra.Line group) {
            return delegate.close(group);
        }

        @Override
        public Long append(Long total, LineAlgebra.Line group) {
            return delegate.append(total, group);
        }

        @Override
        public Long join(Long prefix, Long suffix) {
            return delegate.join(prefix, suffix);
        }

        @Override
        public boolean less(Long a, Long b) {
            return delegate.less(a, b);
        }

        @Override
        public boolean cannotDecrease(LineAlgebra.Line group) {
            return delegate.cannotDecrease(group);
        }
    }

    static class NoOpListener implements SolveListener {
        @Override
        public void onSolveStart(long epoch) {
        }

        @Override
        public void onWindowExpanded(long epoch, WindowSide side, int element, int index) {
        }

        @Override
        public void onWindowContracted(long epoch, WindowSide side, int element) {
        }

        @Override
        public void onCutCertified(long epoch, Cut cut, int candidates) {
        }

        @Override
        public void onSolveError(long epoch, Throwable error) {
        }

        @Override
        public void onSolveEnd(long epoch, int expansions) {
        }
    }
}
