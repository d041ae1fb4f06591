package com.vulnwitness.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A reported vulnerability occurrence. The trace starts at the vulnerable
 * symbol (or its package, for import-level findings) and ends at the entry.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Finding {
    @JsonProperty("osv")
    private String osv;

    @JsonProperty("fixed_version")
    private String fixedVersion;

    @JsonProperty("trace")
    private List<Frame> trace = new ArrayList<>();

    @JsonIgnore
    public boolean isCalled() {
        return trace != null && !trace.isEmpty() && trace.get(0).getFunction() != null;
    }
}
