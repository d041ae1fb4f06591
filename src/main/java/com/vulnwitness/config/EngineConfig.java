package com.vulnwitness.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class EngineConfig {
    @JsonProperty("parallelism")
    private int parallelism = 0; // 0 = one thread per available processor

    @JsonProperty("unique_call_stacks")
    private boolean uniqueCallStacks = true;

    @JsonProperty("update_init_positions")
    private boolean updateInitPositions = true;

    @JsonIgnore
    public int getEffectiveParallelism() {
        if (parallelism > 0) return parallelism;
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }
}
