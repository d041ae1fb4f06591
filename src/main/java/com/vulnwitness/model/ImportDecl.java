package com.vulnwitness.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One import statement of a source file: the imported package path
 * and where the statement begins.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ImportDecl {
    private String path;
    private Position pos;
}
