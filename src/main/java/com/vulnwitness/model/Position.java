package com.vulnwitness.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A source location. Line and column are 1-based; a position whose line is 0
 * is the empty position and carries no usable location.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Position {
    private String filename = "";
    private int offset;
    private int line;
    private int column;

    public static Position empty() {
        return new Position();
    }

    @JsonIgnore
    public boolean isValid() {
        return line > 0;
    }

    @Override
    public String toString() {
        String file = filename != null ? filename : "";
        if (isValid()) {
            return file.isEmpty()
                    ? line + ":" + column
                    : file + ":" + line + ":" + column;
        }
        return file.isEmpty() ? "-" : file;
    }
}
