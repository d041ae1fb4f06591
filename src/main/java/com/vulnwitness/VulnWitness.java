package com.vulnwitness;

import com.vulnwitness.config.ConfigManager;
import com.vulnwitness.config.EngineConfig;
import com.vulnwitness.engine.CallStackEngine;
import com.vulnwitness.engine.InitPositionUpdater;
import com.vulnwitness.engine.UniqueStackFilter;
import com.vulnwitness.model.CallStack;
import com.vulnwitness.model.Result;
import com.vulnwitness.model.Vuln;
import com.vulnwitness.report.FindingEmitter;
import com.vulnwitness.report.FindingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Entry point of the witness pipeline: search and rank call stacks, keep a
 * unique stack per vulnerability, repair initializer positions, emit findings.
 */
public class VulnWitness {
    private static final Logger logger = LoggerFactory.getLogger(VulnWitness.class);
    private final EngineConfig config;

    public VulnWitness() {
        this(new ConfigManager().loadDefault().getEngineConfig());
    }

    public VulnWitness(EngineConfig config) {
        this.config = config;
    }

    /**
     * Returns the call stacks that would be reported for each vulnerability of {@code result}.
     */
    public Map<Vuln, List<CallStack>> callStacks(Result result) {
        Map<Vuln, List<CallStack>> stacks = new CallStackEngine(config.getEffectiveParallelism()).run(result);

        if (config.isUniqueCallStacks()) {
            stacks = new UniqueStackFilter().filter(stacks);
        } else {
            logger.debug("Unique call stack filtering disabled, keeping all ranked stacks");
        }

        if (config.isUpdateInitPositions()) {
            new InitPositionUpdater().update(stacks);
        }
        return stacks;
    }

    public void run(Result result, FindingHandler handler) {
        Map<Vuln, List<CallStack>> stacks = callStacks(result);
        new FindingEmitter().emit(result, stacks, handler);
    }
}
