package com.vulnwitness.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ModuleInfo {
    private String path;
    private String version;
    private ModuleInfo replace; // null unless the module is replaced

    public ModuleInfo(String path, String version) {
        this.path = path;
        this.version = version;
    }
}
