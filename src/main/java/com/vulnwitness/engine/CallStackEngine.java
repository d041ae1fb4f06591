package com.vulnwitness.engine;

import com.vulnwitness.graph.StackFinder;
import com.vulnwitness.model.CallStack;
import com.vulnwitness.model.FuncNode;
import com.vulnwitness.model.Result;
import com.vulnwitness.model.Vuln;
import com.vulnwitness.score.StackScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Computes ranked call stacks for every vulnerability of a result, one
 * independent search per vulnerability.
 */
public class CallStackEngine {
    private static final Logger logger = LoggerFactory.getLogger(CallStackEngine.class);
    private final int parallelism;

    public CallStackEngine(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /**
     * Returns call stacks for each vulnerability of {@code result}, ordered by
     * {@link StackScorer#STACK_ORDER}. The map iterates in the order of
     * {@link Result#getVulns()}; vulnerabilities that are never called map to an
     * empty list.
     */
    public Map<Vuln, List<CallStack>> run(Result result) {
        List<Vuln> vulns = result.getVulns();
        logger.info("Searching call stacks for {} vulnerabilities (threads: {}, call sites: {})...",
                vulns.size(), parallelism, result.getCallGraph() != null ? result.getCallGraph().edgeCount() : 0);

        StackFinder finder = new StackFinder(result);
        Set<FuncNode> entries = new HashSet<>(result.getEntryFunctions());
        Map<Vuln, List<CallStack>> collected = new IdentityHashMap<>();
        Lock lock = new ReentrantLock();

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, Math.max(1, vulns.size())));
        List<Future<?>> tasks = new ArrayList<>(vulns.size());
        try {
            for (Vuln vuln : vulns) {
                tasks.add(executor.submit(() -> {
                    List<CallStack> stacks = StackScorer.rank(finder.find(vuln.getCallSink()));
                    for (CallStack cs : stacks) {
                        cs.checkEndpoints(entries, vuln.getCallSink());
                    }
                    logger.debug("{}: {} call stacks", vuln, stacks.size());
                    lock.lock();
                    try {
                        collected.put(vuln, stacks);
                    } finally {
                        lock.unlock();
                    }
                }));
            }
            await(tasks);
        } finally {
            executor.shutdownNow();
        }

        Map<Vuln, List<CallStack>> stacksPerVuln = new LinkedHashMap<>();
        for (Vuln vuln : vulns) {
            stacksPerVuln.put(vuln, collected.get(vuln));
        }

        int withStacks = (int) stacksPerVuln.values().stream().filter(s -> !s.isEmpty()).count();
        logger.info("Call stack search finished. {} of {} vulnerabilities have call stacks.", withStacks, vulns.size());
        return stacksPerVuln;
    }

    private static void await(List<Future<?>> tasks) {
        for (Future<?> task : tasks) {
            try {
                task.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while searching call stacks", e);
            } catch (ExecutionException e) {
                logger.error("Call stack search failed", e.getCause());
                throw new IllegalStateException("Call stack search failed", e.getCause());
            }
        }
    }
}
