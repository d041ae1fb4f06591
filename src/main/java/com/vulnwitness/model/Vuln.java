package com.vulnwitness.model;

import lombok.Getter;

/**
 * One reachable vulnerability instance. {@code callSink} is null when the
 * vulnerable symbol is imported but never called.
 */
@Getter
public class Vuln {
    private final String id;
    private final FuncNode callSink;
    private final PackageInfo importSink;
    private final String fixedVersion;

    public Vuln(String id, FuncNode callSink, PackageInfo importSink) {
        this(id, callSink, importSink, null);
    }

    public Vuln(String id, FuncNode callSink, PackageInfo importSink, String fixedVersion) {
        this.id = id;
        this.callSink = callSink;
        this.importSink = importSink;
        this.fixedVersion = fixedVersion;
    }

    public boolean isCalled() {
        return callSink != null;
    }

    @Override
    public String toString() {
        return id + " (" + (callSink != null ? callSink : importSink.getPkgPath()) + ")";
    }
}
