package com.vulnwitness.score;

import com.vulnwitness.model.CallStack;
import com.vulnwitness.model.PackageInfo;
import com.vulnwitness.model.StackEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks call stacks of one vulnerability by their estimated value as a witness.
 */
public final class StackScorer {

    /**
     * Orders stacks by (1) confidence, (2) length and (3) weight, all ascending.
     * Stacks equal on all three compare as equal; the order among them comes from
     * the deterministic search and is kept by a stable sort.
     */
    public static final Comparator<CallStack> STACK_ORDER = Comparator
            .comparingInt(StackScorer::confidence)
            .thenComparingInt(CallStack::size)
            .thenComparingInt(StackScorer::weight);

    private StackScorer() {
    }

    /**
     * Returns a copy of {@code stacks} sorted by {@link #STACK_ORDER}.
     */
    public static List<CallStack> rank(List<CallStack> stacks) {
        List<CallStack> ranked = new ArrayList<>(stacks);
        ranked.sort(STACK_ORDER); // List.sort is stable
        return ranked;
    }

    /**
     * Number of unresolved call sites in the stack. Statically resolved
     * chains are easier to follow and more likely real.
     */
    public static int weight(CallStack stack) {
        int w = 0;
        for (StackEntry e : stack) {
            if (e.getCall() != null && !e.getCall().isResolved()) {
                w++;
            }
        }
        return w;
    }

    /**
     * Number of frames in standard library packages. Stacks through the
     * standard library have been seen to often be false positives.
     */
    public static int confidence(CallStack stack) {
        int c = 0;
        for (StackEntry e : stack) {
            PackageInfo pkg = e.getFunction().getPkg();
            if (pkg != null && isStdPackage(pkg.getPkgPath())) {
                c++;
            }
        }
        return c;
    }

    /**
     * Heuristic: standard library package paths have no "." in their first
     * path element, unlike domain-qualified ones such as "github.com/x/y".
     */
    public static boolean isStdPackage(String pkgPath) {
        if (pkgPath == null || pkgPath.isEmpty()) {
            return false;
        }
        int slash = pkgPath.indexOf('/');
        String first = slash != -1 ? pkgPath.substring(0, slash) : pkgPath;
        return !first.contains(".");
    }
}
