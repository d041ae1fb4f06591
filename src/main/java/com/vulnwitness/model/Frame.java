package com.vulnwitness.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One frame of a reported trace.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Frame {
    @JsonProperty("module")
    private String module;

    @JsonProperty("version")
    private String version;

    @JsonProperty("package")
    private String pkg;

    @JsonProperty("function")
    private String function;

    @JsonProperty("receiver")
    private String receiver;

    @JsonProperty("position")
    private Position position; // call position, null when unknown
}
