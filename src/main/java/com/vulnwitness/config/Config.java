package com.vulnwitness.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class Config {
    @JsonProperty("engine")
    private EngineConfig engineConfig;
}
