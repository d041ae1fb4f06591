package com.vulnwitness.report;

import com.vulnwitness.GraphFixture;
import com.vulnwitness.graph.StackFinder;
import com.vulnwitness.model.CallStack;
import com.vulnwitness.model.Finding;
import com.vulnwitness.model.Frame;
import com.vulnwitness.model.FuncNode;
import com.vulnwitness.model.ModuleInfo;
import com.vulnwitness.model.PackageInfo;
import com.vulnwitness.model.Vuln;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.vulnwitness.GraphFixture.pkg;
import static com.vulnwitness.GraphFixture.pos;
import static org.junit.jupiter.api.Assertions.*;

class FindingEmitterTest {
    private final PackageInfo app = pkg("example.com/app", GraphFixture.MAIN_MODULE);
    private final PackageInfo lib = pkg("example.com/lib/pkg", GraphFixture.LIB_MODULE);

    static class RecordingHandler implements FindingHandler {
        final List<String> events = new ArrayList<>();
        final List<Finding> findings = new ArrayList<>();

        @Override
        public void osv(String id) {
            events.add("osv " + id);
        }

        @Override
        public void finding(Finding finding) {
            events.add("finding " + finding.getOsv());
            findings.add(finding);
        }
    }

    @Test
    void traceStartsAtTheVulnerableSymbol() {
        GraphFixture g = new GraphFixture();
        FuncNode main = g.entry(g.func(app, "main", 1));
        FuncNode method = g.graph.addFunction(new FuncNode("Parse", "*pkg.Parser", lib, pos("pkg.go", 10, 1)));
        g.call(main, method, 3);

        CallStack stack = new StackFinder(g.result()).find(method).get(0);
        List<Frame> trace = FindingEmitter.traceFromEntries(stack);

        assertEquals(2, trace.size());
        Frame sinkFrame = trace.get(0);
        assertEquals("Parse", sinkFrame.getFunction());
        assertEquals("*pkg.Parser", sinkFrame.getReceiver());
        assertEquals("example.com/lib/pkg", sinkFrame.getPkg());
        assertEquals("example.com/lib", sinkFrame.getModule());
        assertEquals("v1.0.0", sinkFrame.getVersion());
        assertNull(sinkFrame.getPosition());

        Frame entryFrame = trace.get(1);
        assertEquals("main", entryFrame.getFunction());
        assertNull(entryFrame.getReceiver());
        assertEquals(pos("app.go", 3, 2), entryFrame.getPosition());
    }

    @Test
    void replacedModuleIsReported() {
        ModuleInfo replaced = new ModuleInfo("example.com/lib", "v1.0.0",
                new ModuleInfo("example.com/fork", "v1.0.1"));
        Frame fr = FindingEmitter.frameFromPackage(new PackageInfo("example.com/lib/pkg", replaced));

        assertEquals("example.com/fork", fr.getModule());
        assertEquals("v1.0.1", fr.getVersion());
        assertEquals("example.com/lib/pkg", fr.getPkg());
    }

    @Test
    void calledFindingsComeFirstAndImportedOnesOncePerId() {
        GraphFixture g = new GraphFixture();
        FuncNode main = g.entry(g.func(app, "main", 1));
        FuncNode sink = g.func(lib, "Sink", 10);
        g.call(main, sink, 2);
        Vuln imported1 = g.vuln("GO-2", null, lib);
        Vuln imported2 = g.vuln("GO-2", null, lib);
        Vuln called = g.vuln("GO-1", sink, lib);
        Vuln calledWithoutWitness = g.vuln("GO-1", null, lib);

        Map<Vuln, List<CallStack>> stacks = new LinkedHashMap<>();
        stacks.put(imported1, List.of());
        stacks.put(imported2, List.of());
        stacks.put(called, new StackFinder(g.result()).find(sink));
        stacks.put(calledWithoutWitness, List.of());

        RecordingHandler handler = new RecordingHandler();
        new FindingEmitter().emit(g.result(), stacks, handler);

        assertEquals(List.of("osv GO-1", "finding GO-1", "osv GO-2", "finding GO-2"), handler.events);
        assertTrue(handler.findings.get(0).isCalled());
        Finding importOnly = handler.findings.get(1);
        assertFalse(importOnly.isCalled());
        assertEquals(1, importOnly.getTrace().size());
        assertEquals("example.com/lib/pkg", importOnly.getTrace().get(0).getPkg());
        assertNull(importOnly.getTrace().get(0).getFunction());
    }
}
