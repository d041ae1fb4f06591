package com.vulnwitness.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A loaded package: its import path, owning module and parsed files
 * in load order.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class PackageInfo {
    private String pkgPath;
    private String name;
    private ModuleInfo module;
    private List<SourceFile> files = new ArrayList<>();

    public PackageInfo(String pkgPath, ModuleInfo module) {
        this.pkgPath = pkgPath;
        this.name = pkgPath.substring(pkgPath.lastIndexOf('/') + 1);
        this.module = module;
    }

    public List<SourceFile> getFiles() {
        if (files == null) {
            files = new ArrayList<>();
        }
        return files;
    }

    public boolean sameAs(PackageInfo other) {
        return other != null && pkgPath != null && pkgPath.equals(other.pkgPath);
    }

    public String getModulePath() {
        return module != null ? module.getPath() : null;
    }
}
