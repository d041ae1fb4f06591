package com.vulnwitness.report;

import com.vulnwitness.model.CallSite;
import com.vulnwitness.model.CallStack;
import com.vulnwitness.model.Finding;
import com.vulnwitness.model.Frame;
import com.vulnwitness.model.FuncNode;
import com.vulnwitness.model.ModuleInfo;
import com.vulnwitness.model.PackageInfo;
import com.vulnwitness.model.Position;
import com.vulnwitness.model.Result;
import com.vulnwitness.model.StackEntry;
import com.vulnwitness.model.Vuln;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns call stacks into findings. Called vulnerabilities are emitted first,
 * one finding per stack; a vulnerability id with no stack at all is then
 * emitted once at the level of its imported package.
 */
public class FindingEmitter {
    private static final Logger logger = LoggerFactory.getLogger(FindingEmitter.class);

    public void emit(Result result, Map<Vuln, List<CallStack>> stacksPerVuln, FindingHandler handler) {
        Set<String> emitted = new HashSet<>();
        Set<String> announced = new HashSet<>();
        int called = 0;
        int imported = 0;

        for (Vuln v : result.getVulns()) {
            for (CallStack stack : stacksPerVuln.getOrDefault(v, Collections.emptyList())) {
                emitted.add(v.getId());
                emitFinding(handler, announced, new Finding(v.getId(), v.getFixedVersion(), traceFromEntries(stack)));
                called++;
            }
        }

        for (Vuln v : result.getVulns()) {
            if (emitted.contains(v.getId())) {
                continue;
            }
            if (!stacksPerVuln.getOrDefault(v, Collections.emptyList()).isEmpty()) {
                continue;
            }
            emitted.add(v.getId());
            List<Frame> trace = new ArrayList<>();
            trace.add(frameFromPackage(v.getImportSink()));
            emitFinding(handler, announced, new Finding(v.getId(), v.getFixedVersion(), trace));
            imported++;
        }

        logger.info("Emitted {} findings ({} with call stacks, {} import only) for {} vulnerabilities.",
                called + imported, called, imported, announced.size());
    }

    private static void emitFinding(FindingHandler handler, Set<String> announced, Finding finding) {
        if (announced.add(finding.getOsv())) {
            handler.osv(finding.getOsv());
        }
        handler.finding(finding);
    }

    /**
     * Frames of {@code stack} from the vulnerable symbol up to the entry function.
     * The position of a frame is the position of the call made in it.
     */
    public static List<Frame> traceFromEntries(CallStack stack) {
        List<Frame> frames = new ArrayList<>(stack.size());
        for (int i = stack.size() - 1; i >= 0; i--) {
            StackEntry e = stack.get(i);
            FuncNode f = e.getFunction();
            Frame fr = frameFromPackage(f.getPkg());
            fr.setFunction(f.getName());
            fr.setReceiver(f.getRecvType().isEmpty() ? null : f.getRecvType());
            CallSite call = e.getCall();
            if (call != null && call.getPos() != null) {
                Position p = call.getPos();
                fr.setPosition(new Position(p.getFilename(), p.getOffset(), p.getLine(), p.getColumn()));
            }
            frames.add(fr);
        }
        return frames;
    }

    public static Frame frameFromPackage(PackageInfo pkg) {
        Frame fr = new Frame();
        if (pkg == null) {
            return fr;
        }
        fr.setPkg(pkg.getPkgPath());
        ModuleInfo mod = pkg.getModule();
        if (mod != null) {
            ModuleInfo effective = mod.getReplace() != null ? mod.getReplace() : mod;
            fr.setModule(effective.getPath());
            fr.setVersion(effective.getVersion());
        }
        return fr;
    }
}
