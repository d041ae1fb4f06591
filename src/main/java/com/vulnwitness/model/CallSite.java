package com.vulnwitness.model;

import lombok.Getter;
import lombok.Setter;

/**
 * A call edge, owned by its callee. {@code resolved} is false for dynamic
 * dispatch whose target could not be determined statically.
 */
@Getter
public class CallSite {
    private final FuncNode parent;
    private final String name;     // callee name
    private final String recvType; // callee receiver type, empty for functions
    private final boolean resolved;

    @Setter
    private Position pos;

    public CallSite(FuncNode parent, String name, String recvType, Position pos, boolean resolved) {
        this.parent = parent;
        this.name = name;
        this.recvType = recvType != null ? recvType : "";
        this.pos = pos;
        this.resolved = resolved;
    }

    public boolean hasPos() {
        return pos != null && pos.isValid();
    }

    /**
     * Textual key used when positions are missing or tie.
     */
    public String key() {
        return recvType + "." + name;
    }

    @Override
    public String toString() {
        return parent + " -> " + key() + " @ " + (pos != null ? pos : "-");
    }
}
