package com.vulnwitness.graph;

import com.vulnwitness.GraphFixture;
import com.vulnwitness.model.CallSite;
import com.vulnwitness.model.CallStack;
import com.vulnwitness.model.FuncNode;
import com.vulnwitness.model.PackageInfo;
import com.vulnwitness.model.StackEntry;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.vulnwitness.GraphFixture.pkg;
import static org.junit.jupiter.api.Assertions.*;

class StackFinderTest {
    private final PackageInfo app = pkg("example.com/app", GraphFixture.MAIN_MODULE);
    private final PackageInfo lib = pkg("example.com/lib/pkg", GraphFixture.LIB_MODULE);

    private static List<String> functions(CallStack stack) {
        return stack.entries().stream().map(e -> e.getFunction().getName()).collect(Collectors.toList());
    }

    @Test
    void findsBothPathsThroughDifferentCallers() {
        GraphFixture g = new GraphFixture();
        FuncNode main = g.entry(g.func(app, "main", 1));
        FuncNode a = g.func(lib, "A", 10);
        FuncNode c = g.func(lib, "C", 20);
        FuncNode b = g.func(lib, "B", 30);
        g.call(main, a, 3);
        g.call(main, c, 4);
        g.call(a, b, 11);
        g.call(c, b, 21);

        List<CallStack> stacks = new StackFinder(g.result()).find(b);

        assertEquals(2, stacks.size());
        assertEquals(Arrays.asList("main", "A", "B"), functions(stacks.get(0)));
        assertEquals(Arrays.asList("main", "C", "B"), functions(stacks.get(1)));
        for (CallStack stack : stacks) {
            assertSame(main, stack.first().getFunction());
            assertSame(b, stack.last().getFunction());
            assertNull(stack.last().getCall());
        }
    }

    @Test
    void callOfEachFrameLeadsToTheNextFrame() {
        GraphFixture g = new GraphFixture();
        FuncNode main = g.entry(g.func(app, "main", 1));
        FuncNode a = g.func(lib, "A", 10);
        FuncNode sink = g.func(lib, "Sink", 30);
        CallSite mainToA = g.call(main, a, 3);
        CallSite aToSink = g.call(a, sink, 11);

        CallStack stack = new StackFinder(g.result()).find(sink).get(0);

        assertSame(mainToA, stack.get(0).getCall());
        assertSame(aToSink, stack.get(1).getCall());
        assertSame(mainToA.getParent(), stack.get(0).getFunction());
    }

    @Test
    void nullSinkHasNoStacks() {
        GraphFixture g = new GraphFixture();
        g.entry(g.func(app, "main", 1));

        assertTrue(new StackFinder(g.result()).find(null).isEmpty());
    }

    @Test
    void unreachableSinkHasNoStacks() {
        GraphFixture g = new GraphFixture();
        g.entry(g.func(app, "main", 1));
        FuncNode orphan = g.func(lib, "Orphan", 10);
        FuncNode sink = g.func(lib, "Sink", 20);
        g.call(orphan, sink, 11);

        assertTrue(new StackFinder(g.result()).find(sink).isEmpty());
    }

    @Test
    void entryThatIsTheSinkYieldsSingleFrameStack() {
        GraphFixture g = new GraphFixture();
        FuncNode main = g.entry(g.func(app, "main", 1));
        FuncNode sink = g.entry(g.func(lib, "Exported", 20));
        g.call(main, sink, 2);

        List<CallStack> stacks = new StackFinder(g.result()).find(sink);

        assertEquals(2, stacks.size());
        assertEquals(1, stacks.get(0).size());
        assertSame(sink, stacks.get(0).first().getFunction());
        assertEquals(Arrays.asList("main", "Exported"), functions(stacks.get(1)));
    }

    @Test
    void searchThroughCycleTerminatesWithBoundedStacks() {
        GraphFixture g = new GraphFixture();
        FuncNode main = g.entry(g.func(app, "main", 1));
        FuncNode a = g.func(lib, "A", 10);
        FuncNode b = g.func(lib, "B", 30);
        FuncNode sink = g.func(lib, "Sink", 40);
        g.call(main, a, 2);
        g.call(a, b, 11);
        g.call(b, a, 31);
        g.call(a, a, 12);
        g.call(b, sink, 32);

        List<CallStack> stacks = new StackFinder(g.result()).find(sink);

        assertEquals(1, stacks.size());
        assertEquals(Arrays.asList("main", "A", "B", "Sink"), functions(stacks.get(0)));
        for (CallStack stack : stacks) {
            Set<FuncNode> distinct = new HashSet<>();
            for (StackEntry e : stack) {
                assertTrue(distinct.add(e.getFunction()), "function repeated in " + stack);
            }
        }
    }

    @Test
    void eachFunctionIsReachedThroughOneRepresentativeStack() {
        GraphFixture g = new GraphFixture();
        FuncNode main = g.entry(g.func(app, "main", 1));
        FuncNode x = g.func(lib, "X", 10);
        FuncNode z = g.func(lib, "Z", 20);
        FuncNode y = g.func(lib, "Y", 30);
        FuncNode sink = g.func(lib, "Sink", 40);
        g.call(main, x, 2);
        g.call(main, z, 3);
        g.call(x, y, 11);
        g.call(z, y, 21);
        g.call(y, sink, 31);

        List<CallStack> stacks = new StackFinder(g.result()).find(sink);

        // main is reached once through X and once through Z, both via Y
        assertEquals(2, stacks.size());
        assertEquals(Arrays.asList("main", "X", "Y", "Sink"), functions(stacks.get(0)));
        assertEquals(Arrays.asList("main", "Z", "Y", "Sink"), functions(stacks.get(1)));
    }

    @Test
    void picksSmallestCallSitePerCaller() {
        GraphFixture g = new GraphFixture();
        FuncNode main = g.entry(g.func(app, "main", 1));
        FuncNode sink = g.func(lib, "Sink", 40);
        g.call(main, sink, 9);
        CallSite first = g.call(main, sink, 5);
        g.call(main, sink, 7);

        List<CallStack> stacks = new StackFinder(g.result()).find(sink);

        assertEquals(1, stacks.size());
        assertSame(first, stacks.get(0).first().getCall());
    }

    @Test
    void representativesAreOrderedByCallerAndSkipVisited() {
        GraphFixture g = new GraphFixture();
        FuncNode late = g.func(lib, "Late", 50);
        FuncNode early = g.func(lib, "Early", 5);
        FuncNode done = g.func(lib, "Done", 1);
        FuncNode sink = g.func(lib, "Sink", 60);
        CallSite fromLate = g.call(late, sink, 51);
        CallSite fromEarly = g.call(early, sink, 6);
        g.call(done, sink, 2);

        List<CallSite> reps = StackFinder.representatives(sink.getCallSites(), new HashSet<>(List.of(done)));

        assertEquals(Arrays.asList(fromEarly, fromLate), reps);
    }

    @Test
    void resultDoesNotDependOnGraphConstructionOrder() {
        List<String> forward = describe(buildDiamond(false));
        List<String> reversed = describe(buildDiamond(true));

        assertEquals(forward, reversed);
    }

    private static List<String> describe(List<CallStack> stacks) {
        return stacks.stream()
                .map(s -> s.entries().stream()
                        .map(e -> e.getFunction().getName() + (e.getCall() != null ? "@" + e.getCall().getPos().getLine() : ""))
                        .collect(Collectors.joining(",")))
                .collect(Collectors.toList());
    }

    private List<CallStack> buildDiamond(boolean reversed) {
        GraphFixture g = new GraphFixture();
        FuncNode main = g.entry(g.func(app, "main", 1));
        FuncNode a = g.func(lib, "A", 10);
        FuncNode c = g.func(lib, "C", 20);
        FuncNode sink = g.func(lib, "Sink", 30);
        if (reversed) {
            g.call(c, sink, 22);
            g.call(c, sink, 21);
            g.call(a, sink, 11);
            g.call(main, c, 4);
            g.call(main, a, 3);
        } else {
            g.call(main, a, 3);
            g.call(main, c, 4);
            g.call(a, sink, 11);
            g.call(c, sink, 21);
            g.call(c, sink, 22);
        }
        return new StackFinder(g.result()).find(sink);
    }
}
