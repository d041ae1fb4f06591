package com.vulnwitness.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function or method vertex of the call graph. Equality is identity:
 * two nodes with the same name from different builds are different vertices.
 */
@Getter
public class FuncNode {
    private final String name;
    private final String recvType; // empty for plain functions
    private final PackageInfo pkg;

    // Only written by InitPositionUpdater, and only while absent.
    @Setter
    private Position pos;

    private final List<CallSite> callSites = new ArrayList<>();

    public FuncNode(String name, String recvType, PackageInfo pkg, Position pos) {
        this.name = name;
        this.recvType = recvType != null ? recvType : "";
        this.pkg = pkg;
        this.pos = pos;
    }

    /**
     * Call sites whose target is this function, in the order they were added.
     */
    public List<CallSite> getCallSites() {
        return Collections.unmodifiableList(callSites);
    }

    public void addCallSite(CallSite callSite) {
        callSites.add(callSite);
    }

    public boolean hasPos() {
        return pos != null && pos.isValid();
    }

    public String getPkgPath() {
        return pkg != null ? pkg.getPkgPath() : "";
    }

    @Override
    public String toString() {
        if (recvType.isEmpty()) {
            return getPkgPath() + "." + name;
        }
        return recvType + "." + name;
    }
}
