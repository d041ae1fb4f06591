package com.vulnwitness.engine;

import com.vulnwitness.model.CallStack;
import com.vulnwitness.model.FuncNode;
import com.vulnwitness.model.StackEntry;
import com.vulnwitness.model.Vuln;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Keeps a single call stack per vulnerability, avoiding stacks that go through
 * vulnerable symbols of other vulnerabilities reported together with it.
 * <p>
 * Vulnerabilities are reported together when they share the vulnerability id and
 * the imported package and module. Must run once all stacks are ranked.
 */
public class UniqueStackFilter {
    private static final Logger logger = LoggerFactory.getLogger(UniqueStackFilter.class);

    private static final class GroupKey {
        final String id;
        final String pkg;
        final String mod;

        GroupKey(Vuln v) {
            this.id = v.getId();
            this.pkg = v.getImportSink() != null ? v.getImportSink().getPkgPath() : null;
            this.mod = v.getImportSink() != null ? v.getImportSink().getModulePath() : null;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            GroupKey that = (GroupKey) o;
            return Objects.equals(id, that.id) && Objects.equals(pkg, that.pkg) && Objects.equals(mod, that.mod);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, pkg, mod);
        }
    }

    /**
     * Returns a new map with at most one stack per vulnerability. The input is left untouched.
     */
    public Map<Vuln, List<CallStack>> filter(Map<Vuln, List<CallStack>> stacksPerVuln) {
        Map<GroupKey, Set<FuncNode>> sinksPerGroup = new HashMap<>();
        for (Vuln v : stacksPerVuln.keySet()) {
            if (v.isCalled()) {
                sinksPerGroup.computeIfAbsent(new GroupKey(v), k -> new HashSet<>()).add(v.getCallSink());
            }
        }

        Map<Vuln, List<CallStack>> filtered = new LinkedHashMap<>();
        for (Map.Entry<Vuln, List<CallStack>> entry : stacksPerVuln.entrySet()) {
            Vuln v = entry.getKey();
            List<CallStack> kept = new ArrayList<>(1);
            if (v.isCalled()) {
                CallStack unique = uniqueCallStack(v, entry.getValue(), sinksPerGroup.get(new GroupKey(v)));
                if (unique != null) {
                    kept.add(unique);
                } else if (!entry.getValue().isEmpty()) {
                    logger.warn("No call stack of {} avoids other vulnerable symbols of {}. Reporting it as imported only.",
                            v.getCallSink(), v.getId());
                }
            }
            filtered.put(v, kept);
        }
        return filtered;
    }

    /**
     * Returns the first stack of {@code stacks} that does not go through any
     * symbol of {@code groupSinks} other than the vulnerability's own sink.
     */
    static CallStack uniqueCallStack(Vuln v, List<CallStack> stacks, Set<FuncNode> groupSinks) {
        if (stacks == null) {
            return null;
        }
        nextStack:
        for (CallStack cs : stacks) {
            if (cs.last().getFunction() != v.getCallSink()) {
                throw new IllegalStateException("call stack " + cs + " does not end at the sink of " + v);
            }
            for (StackEntry e : cs) {
                if (e.getFunction() != v.getCallSink() && groupSinks.contains(e.getFunction())) {
                    continue nextStack;
                }
            }
            return cs;
        }
        return null;
    }
}
