package com.vulnwitness.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class SourceFile {
    private String filename;
    private Position packagePos; // position of the package declaration
    private List<ImportDecl> imports = new ArrayList<>();

    public SourceFile(String filename, Position packagePos) {
        this.filename = filename;
        this.packagePos = packagePos;
    }

    public List<ImportDecl> getImports() {
        if (imports == null) {
            imports = new ArrayList<>();
        }
        return imports;
    }
}
