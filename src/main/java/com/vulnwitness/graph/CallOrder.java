package com.vulnwitness.graph;

import com.vulnwitness.model.CallSite;
import com.vulnwitness.model.FuncNode;
import com.vulnwitness.model.Position;

import java.util.Comparator;

/**
 * Deterministic orderings used to make call stack search reproducible
 * regardless of how the call graph was assembled.
 */
public final class CallOrder {

    /**
     * Line, then column, then file name.
     */
    public static final Comparator<Position> POSITION = (p1, p2) -> {
        int c = Integer.compare(p1.getLine(), p2.getLine());
        if (c != 0) return c;
        c = Integer.compare(p1.getColumn(), p2.getColumn());
        if (c != 0) return c;
        return nullToEmpty(p1.getFilename()).compareTo(nullToEmpty(p2.getFilename()));
    };

    /**
     * Smaller position first. A site without position comes after one with a
     * position; remaining ties are broken by the receiver.name key. Null sorts last.
     */
    public static final Comparator<CallSite> CALL_SITE = (cs1, cs2) -> {
        if (cs1 == cs2) return 0;
        if (cs1 == null) return 1;
        if (cs2 == null) return -1;

        Position p1 = cs1.getPos();
        Position p2 = cs2.getPos();
        if (p1 != null && p2 != null) {
            int c = POSITION.compare(p1, p2);
            if (c != 0) return c;
            // should not occur in practice
            return cs1.key().compareTo(cs2.key());
        }
        if (p1 != null) return -1;
        if (p2 != null) return 1;
        return cs1.key().compareTo(cs2.key());
    };

    /**
     * Same scheme as {@link #CALL_SITE} on the functions' own positions,
     * falling back to their qualified names.
     */
    public static final Comparator<FuncNode> FUNCTION = (f1, f2) -> {
        if (f1 == f2) return 0;
        Position p1 = f1.getPos();
        Position p2 = f2.getPos();
        if (p1 != null && p2 != null) {
            int c = POSITION.compare(p1, p2);
            if (c != 0) return c;
            return f1.toString().compareTo(f2.toString());
        }
        if (p1 != null) return -1;
        if (p2 != null) return 1;
        // inits mostly
        return f1.toString().compareTo(f2.toString());
    };

    private CallOrder() {
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
