package com.vulnwitness.model;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Output of the reachability stage: the vulnerabilities found, the entry
 * functions of the analyzed program and its call graph.
 */
@Getter
public class Result {
    private final List<Vuln> vulns;
    private final List<FuncNode> entryFunctions;
    private final CallGraph callGraph;

    public Result(List<Vuln> vulns, List<FuncNode> entryFunctions, CallGraph callGraph) {
        this.vulns = Collections.unmodifiableList(vulns);
        this.entryFunctions = Collections.unmodifiableList(entryFunctions);
        this.callGraph = callGraph;
    }
}
