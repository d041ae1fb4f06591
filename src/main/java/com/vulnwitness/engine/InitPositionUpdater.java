package com.vulnwitness.engine;

import com.vulnwitness.model.CallSite;
import com.vulnwitness.model.CallStack;
import com.vulnwitness.model.FuncNode;
import com.vulnwitness.model.ImportDecl;
import com.vulnwitness.model.PackageInfo;
import com.vulnwitness.model.Position;
import com.vulnwitness.model.SourceFile;
import com.vulnwitness.model.StackEntry;
import com.vulnwitness.model.Vuln;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Populates missing positions of package initializers, and of calls to them,
 * in finished call stacks. Positions already present are never replaced.
 * <p>
 * Implicit initializers are synthesized by the graph builder and have no
 * source of their own:
 * <ul>
 *   <li>P.init gets the position of the "package P" statement;</li>
 *   <li>P1.init calling P2.init is placed at the "import P2" statement of P1;</li>
 *   <li>implicit P.init calling an explicit P.init#n is placed at "package P".</li>
 * </ul>
 */
public class InitPositionUpdater {
    private static final Logger logger = LoggerFactory.getLogger(InitPositionUpdater.class);

    // "init" for implicit initializers, "init#<n>" for source ones and their helpers
    private static final Pattern INIT_NAME = Pattern.compile("init(#\\d+)?");

    public void update(Map<Vuln, List<CallStack>> stacksPerVuln) {
        int updated = 0;
        for (List<CallStack> stacks : stacksPerVuln.values()) {
            for (CallStack cs : stacks) {
                updated += update(cs);
            }
        }
        if (updated > 0) {
            logger.info("Filled in {} missing initializer positions.", updated);
        }
    }

    /**
     * Updates one stack, outermost frame first. Returns the number of positions written.
     */
    public int update(CallStack stack) {
        int updated = 0;
        for (int i = 0; i < stack.size(); i++) {
            StackEntry curr = stack.get(i);
            if (updateInitPosition(curr)) {
                updated++;
            }
            if (i != stack.size() - 1 && updateInitCallPosition(curr, stack.get(i + 1))) {
                updated++;
            }
        }
        return updated;
    }

    public static boolean isInit(FuncNode f) {
        return INIT_NAME.matcher(f.getName()).matches();
    }

    private boolean updateInitPosition(StackEntry entry) {
        FuncNode f = entry.getFunction();
        if (!isInit(f) || f.hasPos()) {
            return false;
        }
        f.setPos(packageStatementPos(f.getPkg()));
        return true;
    }

    private boolean updateInitCallPosition(StackEntry curr, StackEntry next) {
        CallSite call = curr.getCall();
        if (call == null || !isInit(next.getFunction()) || call.hasPos()) {
            return false;
        }

        FuncNode caller = curr.getFunction();
        FuncNode callee = next.getFunction();
        Position pos;
        if ("init".equals(caller.getName()) && caller.getPkg() != null && caller.getPkg().sameAs(callee.getPkg())) {
            pos = packageStatementPos(caller.getPkg());
        } else {
            pos = importStatementPos(caller.getPkg(), callee.getPkgPath());
        }
        call.setPos(pos);
        return true;
    }

    /**
     * Position of the first import of {@code importPath} in {@code pkg}, or the empty
     * position when there is none (call graph imprecision).
     */
    static Position importStatementPos(PackageInfo pkg, String importPath) {
        if (pkg != null) {
            for (SourceFile file : pkg.getFiles()) {
                for (ImportDecl imp : file.getImports()) {
                    if (imp.getPath().equals(importPath) && imp.getPos() != null) {
                        return copy(imp.getPos());
                    }
                }
            }
        }
        logger.warn("No import of {} found in package {}", importPath, pkg != null ? pkg.getPkgPath() : "<none>");
        return Position.empty();
    }

    /**
     * Position of the package statement of the first file, as good as any.
     */
    static Position packageStatementPos(PackageInfo pkg) {
        if (pkg == null || pkg.getFiles().isEmpty() || pkg.getFiles().get(0).getPackagePos() == null) {
            return Position.empty();
        }
        return copy(pkg.getFiles().get(0).getPackagePos());
    }

    private static Position copy(Position p) {
        return new Position(p.getFilename(), p.getOffset(), p.getLine(), p.getColumn());
    }
}
