package com.vulnwitness.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A call stack starting with an entry function and ending with a call to
 * a vulnerable symbol. Immutable; the frames themselves may later receive
 * reconciled positions.
 */
public final class CallStack implements Iterable<StackEntry> {
    private final List<StackEntry> entries;

    public CallStack(List<StackEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalStateException("call stack must have at least one frame");
        }
        for (int i = 0; i < entries.size() - 1; i++) {
            StackEntry e = entries.get(i);
            if (e.getCall() == null) {
                throw new IllegalStateException("frame " + i + " (" + e + ") has no call to the next frame");
            }
        }
        if (entries.get(entries.size() - 1).getCall() != null) {
            throw new IllegalStateException("last frame of a call stack must not have an outgoing call");
        }
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public int size() {
        return entries.size();
    }

    public StackEntry get(int index) {
        return entries.get(index);
    }

    public StackEntry first() {
        return entries.get(0);
    }

    public StackEntry last() {
        return entries.get(entries.size() - 1);
    }

    public List<StackEntry> entries() {
        return entries;
    }

    /**
     * Checks that the stack starts at one of {@code entryFunctions} and ends at {@code sink}.
     *
     * @throws IllegalStateException if it does not
     */
    public void checkEndpoints(Set<FuncNode> entryFunctions, FuncNode sink) {
        if (!entryFunctions.contains(first().getFunction())) {
            throw new IllegalStateException("call stack starts at non-entry function " + first().getFunction());
        }
        if (last().getFunction() != sink) {
            throw new IllegalStateException("call stack ends at " + last().getFunction() + ", expected " + sink);
        }
    }

    @Override
    public Iterator<StackEntry> iterator() {
        return entries.iterator();
    }

    @Override
    public String toString() {
        return entries.stream().map(StackEntry::toString).collect(Collectors.joining(" -> "));
    }
}
