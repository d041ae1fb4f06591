package com.vulnwitness.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Call graph handed over by the graph construction stage. Edges are stored
 * on their callee, see {@link FuncNode#getCallSites()}.
 */
public class CallGraph {
    private final List<FuncNode> functions = new ArrayList<>();

    public FuncNode addFunction(FuncNode f) {
        functions.add(f);
        return f;
    }

    /**
     * Records a call from {@code caller} to {@code callee} and returns the new call site.
     */
    public CallSite addCall(FuncNode caller, FuncNode callee, Position pos, boolean resolved) {
        CallSite cs = new CallSite(caller, callee.getName(), callee.getRecvType(), pos, resolved);
        callee.addCallSite(cs);
        return cs;
    }

    public List<FuncNode> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    public int edgeCount() {
        int n = 0;
        for (FuncNode f : functions) {
            n += f.getCallSites().size();
        }
        return n;
    }
}
