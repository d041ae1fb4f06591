package com.vulnwitness.graph;

import com.vulnwitness.model.CallSite;
import com.vulnwitness.model.CallStack;
import com.vulnwitness.model.FuncNode;
import com.vulnwitness.model.Result;
import com.vulnwitness.model.StackEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Finds representative call stacks for a vulnerable function.
 * <p>
 * Performs a breadth-first search of the call graph starting at the sink and
 * going up until reaching an entry function. Each function is visited at most
 * once, so not every call stack is discovered, but the search always ends in
 * time linear in the number of call sites.
 */
public class StackFinder {
    private static final Logger logger = LoggerFactory.getLogger(StackFinder.class);
    private final Set<FuncNode> entries;

    public StackFinder(Result result) {
        this(result.getEntryFunctions());
    }

    public StackFinder(Collection<FuncNode> entryFunctions) {
        this.entries = new HashSet<>(entryFunctions);
    }

    /**
     * A chain of calls ending at the sink. Each chain only points at the
     * already built suffix, so rejected chains cost one object.
     */
    private static final class Chain {
        final FuncNode f;
        final CallSite call; // call from f into child.f, null for the sink
        final Chain child;

        Chain(FuncNode f, CallSite call, Chain child) {
            this.f = f;
            this.call = call;
            this.child = child;
        }

        CallStack toCallStack() {
            List<StackEntry> frames = new ArrayList<>();
            for (Chain c = this; c != null; c = c.child) {
                frames.add(new StackEntry(c.f, c.call));
            }
            return new CallStack(frames);
        }
    }

    /**
     * Returns every call stack discovered for {@code sink}, in discovery order.
     * Empty if the sink is null, i.e. the vulnerable symbol is never called.
     */
    public List<CallStack> find(FuncNode sink) {
        List<CallStack> stacks = new ArrayList<>();
        if (sink == null) {
            return stacks;
        }

        Set<FuncNode> visited = new HashSet<>();
        Deque<Chain> queue = new ArrayDeque<>();
        Chain start = new Chain(sink, null, null);
        queue.add(start);
        if (entries.contains(sink)) {
            stacks.add(start.toCallStack());
        }

        while (!queue.isEmpty()) {
            Chain c = queue.poll();
            if (!visited.add(c.f)) {
                continue;
            }

            // One call site per caller is enough since each caller is visited once.
            for (CallSite cs : representatives(c.f.getCallSites(), visited)) {
                Chain next = new Chain(cs.getParent(), cs, c);
                if (entries.contains(cs.getParent())) {
                    stacks.add(next.toCallStack());
                }
                queue.add(next);
            }
        }

        logger.debug("Found {} call stacks to {} ({} functions visited)", stacks.size(), sink, visited.size());
        return stacks;
    }

    /**
     * Picks the smallest call site for each caller not yet visited and
     * returns them ordered by caller. All sites are assumed to share a callee.
     */
    static List<CallSite> representatives(List<CallSite> sites, Set<FuncNode> visited) {
        Map<FuncNode, CallSite> minCs = new LinkedHashMap<>();
        for (CallSite cs : sites) {
            FuncNode caller = cs.getParent();
            if (visited.contains(caller)) {
                continue;
            }
            CallSite current = minCs.get(caller);
            if (CallOrder.CALL_SITE.compare(cs, current) < 0) {
                minCs.put(caller, cs);
            }
        }

        List<FuncNode> callers = new ArrayList<>(minCs.keySet());
        callers.sort(CallOrder.FUNCTION);

        List<CallSite> result = new ArrayList<>(callers.size());
        for (FuncNode f : callers) {
            result.add(minCs.get(f));
        }
        return result;
    }
}
